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

package org.coinsetj.ledger;

import com.google.common.collect.ImmutableList;
import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.core.CoinRecord;
import org.coinsetj.core.NetworkParameters;
import org.coinsetj.core.SpendBundle;
import org.coinsetj.core.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>An in-memory {@link LedgerService}. Accepted bundles wait in a pending pool until the next call to
 * {@link #farmBlock(Bytes32)}, which commits them together with the block rewards. The clock only moves
 * through {@link #passTime(long)}.</p>
 *
 * <p>Every block issues a pool reward coin and a farmer reward coin; the farmer coin also collects the fees
 * of the bundles committed in that block. Reward coin parents are built from the genesis challenge and the
 * block height so no two blocks issue the same reward coin.</p>
 */
public class SpendSimulator implements LedgerService {
    private static final Logger log = LoggerFactory.getLogger(SpendSimulator.class);

    private final NetworkParameters params;
    private final BundleValidator validator;
    private final ReentrantLock lock = new ReentrantLock();

    @GuardedBy("lock") private final LinkedHashMap<Bytes32, CoinRecord> coins = new LinkedHashMap<>();
    @GuardedBy("lock") private final List<PendingBundle> mempool = new ArrayList<>();
    @GuardedBy("lock") private final Set<Bytes32> pendingRemovals = new HashSet<>();
    @GuardedBy("lock") private final Set<Bytes32> pendingAdditions = new HashSet<>();
    @GuardedBy("lock") private long height;
    @GuardedBy("lock") private long timestamp;
    @GuardedBy("lock") private boolean closed;

    private static class PendingBundle {
        final SpendBundle bundle;
        final List<Coin> additions;
        final long fee;

        PendingBundle(SpendBundle bundle, List<Coin> additions, long fee) {
            this.bundle = bundle;
            this.additions = additions;
            this.fee = fee;
        }
    }

    public SpendSimulator(NetworkParameters params) {
        this.params = checkNotNull(params);
        this.validator = new BundleValidator(params);
        this.timestamp = params.getInitialTimestamp();
    }

    public NetworkParameters getParams() {
        return params;
    }

    @Override
    public SubmitResult submit(SpendBundle bundle) {
        checkNotNull(bundle);
        lock.lock();
        try {
            checkOpen();
            BundleValidator.Result result = validator.validate(bundle, coins, pendingRemovals, pendingAdditions,
                    height, timestamp);
            if (!result.isValid()) {
                log.info("Rejected bundle {}: {} {}", bundle.name(), result.error, result.detail);
                return SubmitResult.failed(result.error, result.detail);
            }
            mempool.add(new PendingBundle(bundle, result.additions, result.fee));
            for (Coin removal : bundle.removals()) {
                pendingRemovals.add(removal.getName());
            }
            for (Coin addition : result.additions) {
                pendingAdditions.add(addition.getName());
            }
            log.info("Accepted bundle {} spending {} coins, fee {}", bundle.name(), bundle.getCoinSpends().size(),
                    result.fee);
            return SubmitResult.success();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BlockResult farmBlock(Bytes32 rewardPuzzleHash) {
        checkNotNull(rewardPuzzleHash);
        lock.lock();
        try {
            checkOpen();
            height++;
            List<Coin> additions = new ArrayList<>();
            List<Coin> removals = new ArrayList<>();
            long fees = 0;
            for (PendingBundle pending : mempool) {
                for (Coin removal : pending.bundle.removals()) {
                    Bytes32 name = removal.getName();
                    coins.put(name, coins.get(name).spentAt(height));
                    removals.add(removal);
                }
                for (Coin addition : pending.additions) {
                    coins.put(addition.getName(), new CoinRecord(addition, height, 0, false, timestamp));
                    additions.add(addition);
                }
                fees += pending.fee;
            }
            mempool.clear();
            pendingRemovals.clear();
            pendingAdditions.clear();

            Coin poolCoin = new Coin(rewardParent(0), rewardPuzzleHash, params.getPoolReward());
            Coin farmerCoin = new Coin(rewardParent(Bytes32.LENGTH / 2), rewardPuzzleHash,
                    params.getFarmerReward() + fees);
            for (Coin reward : ImmutableList.of(poolCoin, farmerCoin)) {
                coins.put(reward.getName(), new CoinRecord(reward, height, 0, true, timestamp));
                additions.add(reward);
            }
            log.info("Farmed block {} with {} additions, {} removals, fees {}", height, additions.size(),
                    removals.size(), fees);
            return new BlockResult(height, additions, removals);
        } finally {
            lock.unlock();
        }
    }

    // Half of the genesis challenge followed by the height as a 16 byte big endian integer.
    @GuardedBy("lock")
    private Bytes32 rewardParent(int genesisOffset) {
        byte[] parent = new byte[Bytes32.LENGTH];
        System.arraycopy(params.getGenesisChallenge().getBytes(), genesisOffset, parent, 0, Bytes32.LENGTH / 2);
        Utils.uint64ToByteArrayBE(height, parent, Bytes32.LENGTH - 8);
        return Bytes32.wrap(parent);
    }

    @Override
    public List<CoinRecord> getCoinRecordsByPuzzleHash(Bytes32 puzzleHash, boolean includeSpent) {
        checkNotNull(puzzleHash);
        lock.lock();
        try {
            checkOpen();
            List<CoinRecord> records = new ArrayList<>();
            for (CoinRecord record : coins.values()) {
                if (record.getCoin().getPuzzleHash().equals(puzzleHash) && (includeSpent || !record.isSpent())) {
                    records.add(record);
                }
            }
            return records;
        } finally {
            lock.unlock();
        }
    }

    @Override
    @Nullable
    public CoinRecord getCoinRecordByName(Bytes32 name) {
        lock.lock();
        try {
            checkOpen();
            return coins.get(name);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getHeight() {
        lock.lock();
        try {
            checkOpen();
            return height;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long getTimestamp() {
        lock.lock();
        try {
            checkOpen();
            return timestamp;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void passTime(long seconds) {
        checkArgument(seconds >= 0, "cannot move the clock backwards: %s", seconds);
        lock.lock();
        try {
            checkOpen();
            timestamp += seconds;
        } finally {
            lock.unlock();
        }
    }

    /** Number of bundles waiting for the next block. */
    public int getPendingCount() {
        lock.lock();
        try {
            return mempool.size();
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
            coins.clear();
            mempool.clear();
            pendingRemovals.clear();
            pendingAdditions.clear();
            log.info("Closed ledger at height {}", height);
        } finally {
            lock.unlock();
        }
    }

    @GuardedBy("lock")
    private void checkOpen() {
        checkState(!closed, "ledger is closed");
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "SpendSimulator{" + params.getId() + ", height=" + height + ", coins=" + coins.size()
                    + ", pending=" + mempool.size() + '}';
        } finally {
            lock.unlock();
        }
    }
}
