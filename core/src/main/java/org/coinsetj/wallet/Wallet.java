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

package org.coinsetj.wallet;

import com.google.common.collect.ImmutableList;
import org.coinsetj.contract.Contract;
import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.core.CoinSpend;
import org.coinsetj.crypto.BLSKey;
import org.coinsetj.network.Network;
import org.coinsetj.script.Condition;
import org.coinsetj.script.Program;
import org.coinsetj.script.Puzzles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>An actor in a {@link Network} session. A wallet owns one key, locks its standard coins with the puzzle for
 * that key, and tracks which of those coins are currently unspent. Its balance is the sum of those coins.</p>
 *
 * <p>The coin set is never patched by the wallet's own operations: the network replaces it wholesale from the
 * ledger after every block, so a wallet cannot drift from what the ledger holds. Operations that push a bundle
 * return after that refresh.</p>
 *
 * <p>Wallets are created with {@link Network#makeWallet(String)}.</p>
 */
public class Wallet {
    private static final Logger log = LoggerFactory.getLogger(Wallet.class);

    private final Network network;
    private final String name;
    private final BLSKey key;
    private final Program puzzle;
    private final Bytes32 puzzleHash;
    private final BundleSigner signer;
    private final CoinCombiner combiner;

    private final ReentrantLock lock = new ReentrantLock();
    @GuardedBy("lock")
    private final LinkedHashMap<Bytes32, Coin> coins = new LinkedHashMap<>();
    private volatile CoinSelector coinSelector = GreedyCoinSelector.get();

    public Wallet(Network network, String name, BLSKey key) {
        this.network = checkNotNull(network);
        this.name = checkNotNull(name);
        this.key = checkNotNull(key);
        this.puzzle = Puzzles.puzzleForPk(key.getPubKey());
        this.puzzleHash = puzzle.getTreeHash();
        this.signer = new BundleSigner(network.getParams(), key);
        this.combiner = new CoinCombiner(this);
    }

    public Network getNetwork() {
        return network;
    }

    public String getName() {
        return name;
    }

    public byte[] getPubKey() {
        return key.getPubKey();
    }

    public Program getPuzzle() {
        return puzzle;
    }

    public Bytes32 getPuzzleHash() {
        return puzzleHash;
    }

    BundleSigner getSigner() {
        return signer;
    }

    public CoinSelector getCoinSelector() {
        return coinSelector;
    }

    public void setCoinSelector(CoinSelector coinSelector) {
        this.coinSelector = checkNotNull(coinSelector);
    }

    /** Sum of the amounts of the wallet's unspent coins. */
    public long getBalance() {
        lock.lock();
        try {
            long balance = 0;
            for (Coin coin : coins.values()) {
                balance += coin.getAmount();
            }
            return balance;
        } finally {
            lock.unlock();
        }
    }

    public List<Coin> getCoins() {
        lock.lock();
        try {
            return ImmutableList.copyOf(coins.values());
        } finally {
            lock.unlock();
        }
    }

    public int getCoinCount() {
        lock.lock();
        try {
            return coins.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the whole coin set. Called by the network after every block with the unspent coins the ledger
     * holds for {@link #getPuzzleHash()}.
     */
    public void replaceCoins(Collection<Coin> unspent) {
        lock.lock();
        try {
            coins.clear();
            for (Coin coin : unspent) {
                checkArgument(coin.getPuzzleHash().equals(puzzleHash), "%s is not locked to %s", coin, name);
                coins.put(coin.getName(), coin);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Wraps one of this wallet's standard coins so it can be spent. */
    public SpendableCoin toSpendable(Coin coin) {
        return new SpendableCoin(coin, puzzle);
    }

    /**
     * Returns one coin worth at least {@code amount}, combining coins first when no single coin is large enough.
     * Each combine leaves the wallet with fewer coins, so the loop ends after at most as many rounds as the wallet
     * had coins.
     *
     * @return the coin, or null if a combine needed on the way was rejected by the ledger
     * @throws InsufficientFundsException if all of the wallet's coins together are worth less than {@code amount}
     */
    @Nullable
    public SpendableCoin chooseCoin(long amount) throws InsufficientFundsException {
        checkArgument(amount > 0, "amount must be positive: %s", amount);
        int rounds = getCoinCount();
        while (true) {
            CoinSelection selection = coinSelector.select(amount, getCoins());
            if (!selection.isSatisfied()) {
                throw new InsufficientFundsException(selection.getMissing());
            }
            if (selection.gathered.size() == 1) {
                return toSpendable(selection.gathered.get(0));
            }
            checkState(rounds-- > 0, "%s: combining coins for %s did not converge", name, amount);
            log.info("{}: no single coin holds {}, combining {} coins", name, amount, selection.gathered.size());
            SpendResult result = combineCoins(selection.gathered);
            if (!result.isSuccess()) {
                return null;
            }
        }
    }

    /** Merges {@code toCombine} into one coin with a single atomic bundle. See {@link CoinCombiner}. */
    public SpendResult combineCoins(List<Coin> toCombine) {
        return combiner.combine(toCombine);
    }

    /**
     * Funds a coin locked to {@code contract} with {@code amount} mojos, sending any excess of the funding coin back
     * to this wallet.
     *
     * @return the contract coin as it exists after the push, or null if the ledger rejected the spend
     * @throws InsufficientFundsException if the wallet does not hold {@code amount} at all
     */
    @Nullable
    public SpendableCoin launchContract(Contract contract, long amount) throws InsufficientFundsException {
        checkNotNull(contract);
        checkArgument(amount > 0, "amount must be positive: %s", amount);
        SpendableCoin found = chooseCoin(amount);
        if (found == null) {
            return null;
        }
        List<Condition> conditions = new ArrayList<>(2);
        conditions.add(Condition.createCoin(contract.getPuzzleHash(), amount));
        if (amount < found.getAmount()) {
            conditions.add(Condition.createCoin(puzzleHash, found.getAmount() - amount));
        }
        CoinSpend spend = found.spend(Puzzles.solutionForConditions(conditions));
        SpendResult result = network.pushTx(signer.signBundle(ImmutableList.of(spend)));
        if (!result.isSuccess()) {
            log.warn("{}: launching {} with {} mojos was rejected: {}", name, contract, amount, result.getReason());
            return null;
        }
        log.info("{}: launched {} with {} mojos", name, contract, amount);
        return contract.customCoin(found.getCoin(), amount);
    }

    /**
     * Gives {@code amount} mojos to another wallet or to a contract.
     *
     * @return the coin now locked to the target, or null if the ledger rejected the spend
     * @throws InvalidRecipientException if {@code target} is null, is a wallet of another network or a contract
     *         for another genesis challenge
     */
    @Nullable
    public SpendableCoin giveChia(SpendTarget target, long amount) throws InsufficientFundsException {
        if (target == null) {
            throw new InvalidRecipientException("Recipient is null");
        }
        Bytes32 genesisChallenge = network.getParams().getGenesisChallenge();
        if (target.getKind() == SpendTarget.Kind.WALLET && target.getWallet().getNetwork() != network) {
            throw new InvalidRecipientException(
                    "Recipient " + target.getWallet().getName() + " belongs to another network");
        }
        if (target.getKind() == SpendTarget.Kind.CONTRACT
                && !target.getContract().getGenesisChallenge().equals(genesisChallenge)) {
            throw new InvalidRecipientException("Recipient " + target.getContract() + " is for another network");
        }
        return launchContract(target.asContract(genesisChallenge), amount);
    }

    @Nullable
    public SpendableCoin giveChia(Wallet target, long amount) throws InsufficientFundsException {
        return giveChia(SpendTarget.of(target), amount);
    }

    @Nullable
    public SpendableCoin giveChia(Contract target, long amount) throws InsufficientFundsException {
        return giveChia(SpendTarget.of(target), amount);
    }

    public SpendResult spendCoin(SpendableCoin coin) {
        return spendCoin(coin, SpendRequest.standard());
    }

    /**
     * Spends {@code coin}, which may be one of this wallet's coins or a contract coin, solving it as
     * {@code request} describes, signing every signature the puzzle asks of this wallet's key and pushing it.
     */
    public SpendResult spendCoin(SpendableCoin coin, SpendRequest request) {
        checkNotNull(coin);
        Program solution;
        if (request.hasArgs()) {
            solution = request.getArgs();
        } else {
            Bytes32 target = request.getTo() != null ? request.getTo().getPuzzleHash() : puzzleHash;
            List<Condition> conditions = new ArrayList<>(2);
            conditions.add(Condition.createCoin(target, request.getAmount()));
            if (request.getRemainder() != null) {
                conditions.add(Condition.createCoin(request.getRemainder().getPuzzleHash(),
                        coin.getAmount() - request.getAmount()));
            }
            solution = Puzzles.solutionForConditions(conditions);
        }
        SpendResult result = network.pushTx(signer.signBundle(ImmutableList.of(coin.spend(solution))));
        if (!result.isSuccess()) {
            log.warn("{}: spending {} was rejected: {}", name, coin.getName(), result.getReason());
        }
        return result;
    }

    @Override
    public String toString() {
        return "Wallet{name=" + name + ", puzzleHash=" + puzzleHash + ", balance=" + getBalance() + '}';
    }
}
