/*
 * Copyright 2026 Dash Core Group
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.coinsetj.network;

import com.google.common.collect.ImmutableList;
import org.coinsetj.core.Coin;
import org.coinsetj.core.CoinRecord;
import org.coinsetj.core.NetworkParameters;
import org.coinsetj.core.SpendBundle;
import org.coinsetj.core.Utils;
import org.coinsetj.crypto.DeterministicKeyChain;
import org.coinsetj.crypto.KeyService;
import org.coinsetj.ledger.BlockResult;
import org.coinsetj.ledger.LedgerService;
import org.coinsetj.ledger.SpendSimulator;
import org.coinsetj.ledger.SubmitResult;
import org.coinsetj.wallet.SpendResult;
import org.coinsetj.wallet.Wallet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>A session over one ledger. The network owns the ledger and every {@link Wallet} made through it, pushes
 * spend bundles, farms blocks and moves the clock. After every block it replaces each wallet's coin set with
 * the unspent coins the ledger holds for that wallet's puzzle hash.</p>
 *
 * <p>Block rewards go to {@link #getNobody()} unless a farmer is named. Pushes are serialized: a push either
 * is rejected without farming or is committed by the block it triggers before the call returns.</p>
 *
 * <p>A network must be closed when no longer needed, which also closes its ledger.</p>
 */
public class Network implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Network.class);

    private final NetworkParameters params;
    private final LedgerService ledger;
    private final KeyService keys;

    private final ReentrantLock lock = new ReentrantLock();
    @GuardedBy("lock") private final LinkedHashMap<String, Wallet> wallets = new LinkedHashMap<>();
    @GuardedBy("lock") private boolean closed;
    private final Wallet nobody;

    public Network(NetworkParameters params, LedgerService ledger, KeyService keys) {
        this.params = checkNotNull(params);
        this.ledger = checkNotNull(ledger);
        this.keys = checkNotNull(keys);
        this.nobody = makeWallet("nobody");
    }

    /** Creates a session on a fresh in-memory ledger with keys from the default seed. */
    public static Network create(NetworkParameters params) {
        return new Network(params, new SpendSimulator(params), DeterministicKeyChain.withDefaultSeed());
    }

    public NetworkParameters getParams() {
        return params;
    }

    public LedgerService getLedger() {
        return ledger;
    }

    /** The wallet that receives block rewards nobody else claims. */
    public Wallet getNobody() {
        return nobody;
    }

    /** Creates a wallet with the next unused key. */
    public Wallet makeWallet(String name) {
        lock.lock();
        try {
            checkOpen();
            Wallet wallet = new Wallet(this, name, keys.derive(wallets.size()));
            wallets.put(Utils.HEX.encode(wallet.getPubKey()), wallet);
            log.info("Made wallet {} with puzzle hash {}", name, wallet.getPuzzleHash());
            return wallet;
        } finally {
            lock.unlock();
        }
    }

    public List<Wallet> getWallets() {
        lock.lock();
        try {
            return ImmutableList.copyOf(wallets.values());
        } finally {
            lock.unlock();
        }
    }

    public BlockResult farmBlock() {
        return farmBlock(nobody);
    }

    /** Farms one block whose rewards go to {@code farmer}, then refreshes every wallet. */
    public BlockResult farmBlock(Wallet farmer) {
        checkNotNull(farmer);
        lock.lock();
        try {
            checkOpen();
            BlockResult block = ledger.farmBlock(farmer.getPuzzleHash());
            for (Wallet wallet : wallets.values()) {
                List<Coin> unspent = new ArrayList<>();
                for (CoinRecord record : ledger.getCoinRecordsByPuzzleHash(wallet.getPuzzleHash(), false)) {
                    unspent.add(record.getCoin());
                }
                wallet.replaceCoins(unspent);
            }
            log.debug("Refreshed {} wallets at height {}", wallets.size(), block.getHeight());
            return block;
        } finally {
            lock.unlock();
        }
    }

    public void skipTime(Duration duration) {
        skipTime(duration, nobody);
    }

    /**
     * Farms blocks, advancing the clock by one block time after each, until {@code duration} has passed.
     * Every block's rewards go to {@code farmer}.
     */
    public void skipTime(Duration duration, Wallet farmer) {
        checkArgument(!duration.isNegative(), "negative duration: %s", duration);
        lock.lock();
        try {
            checkOpen();
            long target = ledger.getTimestamp() + duration.getSeconds();
            int blocks = 0;
            while (target > ledger.getTimestamp()) {
                farmBlock(farmer);
                ledger.passTime(params.getBlockTimeSeconds());
                blocks++;
            }
            log.info("Skipped {} in {} blocks", duration, blocks);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Submits {@code bundle}. A rejected bundle is returned as a failed result without farming; an accepted one is
     * committed by farming a block, whose effects are returned.
     */
    public SpendResult pushTx(SpendBundle bundle) {
        checkNotNull(bundle);
        lock.lock();
        try {
            checkOpen();
            SubmitResult submitted = ledger.submit(bundle);
            if (!submitted.isAccepted()) {
                return SpendResult.failed(submitted);
            }
            return SpendResult.success(farmBlock());
        } finally {
            lock.unlock();
        }
    }

    /** Current ledger time as a duration since the epoch. */
    public Duration getTimestamp() {
        lock.lock();
        try {
            checkOpen();
            return Duration.ofSeconds(ledger.getTimestamp());
        } finally {
            lock.unlock();
        }
    }

    public long getHeight() {
        lock.lock();
        try {
            checkOpen();
            return ledger.getHeight();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            ledger.close();
            log.info("Closed network with {} wallets", wallets.size());
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private void checkOpen() {
        checkState(!closed, "network is closed");
    }
}
