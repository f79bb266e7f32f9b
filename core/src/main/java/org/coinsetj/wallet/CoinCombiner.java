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
import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.core.CoinSpend;
import org.coinsetj.core.SpendBundle;
import org.coinsetj.script.Condition;
import org.coinsetj.script.Puzzles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>Merges several coins of one wallet into a single coin in one spend bundle. The ledger spends every coin
 * independently, so the bundle ties them together with an announcement: the last coin announces the merged
 * coin's name and creates it, and every other coin asserts that announcement. If any spend is dropped, the
 * assertion fails and the ledger rejects the whole bundle.</p>
 *
 * <p>The merged coin is {@code Coin(last.name, walletPuzzleHash, sum)} and the asserted announcement id is
 * {@code sha256(last.name || merged.name)}.</p>
 */
public class CoinCombiner {
    private static final Logger log = LoggerFactory.getLogger(CoinCombiner.class);

    private final Wallet wallet;

    public CoinCombiner(Wallet wallet) {
        this.wallet = checkNotNull(wallet);
    }

    /** The coin a combine of {@code coins} creates. */
    public Coin mergedCoin(List<Coin> coins) {
        checkArgument(!coins.isEmpty(), "nothing to combine");
        long total = 0;
        for (Coin coin : coins) {
            total += coin.getAmount();
        }
        Coin last = coins.get(coins.size() - 1);
        return new Coin(last.getName(), wallet.getPuzzleHash(), total);
    }

    /** Builds and signs the combine bundle without pushing it. */
    public SpendBundle createBundle(List<Coin> coins) {
        Coin merged = mergedCoin(coins);
        Coin last = coins.get(coins.size() - 1);
        Bytes32 announcement = Condition.coinAnnouncementId(last.getName(), merged.getName().getBytes());

        List<CoinSpend> spends = new ArrayList<>(coins.size());
        for (Coin coin : coins.subList(0, coins.size() - 1)) {
            checkArgument(coin.getPuzzleHash().equals(wallet.getPuzzleHash()), "%s is not a coin of %s", coin,
                    wallet.getName());
            spends.add(new CoinSpend(coin, wallet.getPuzzle(),
                    Puzzles.solutionForConditions(ImmutableList.of(Condition.assertCoinAnnouncement(announcement)))));
        }
        checkArgument(last.getPuzzleHash().equals(wallet.getPuzzleHash()), "%s is not a coin of %s", last,
                wallet.getName());
        spends.add(new CoinSpend(last, wallet.getPuzzle(), Puzzles.solutionForConditions(ImmutableList.of(
                Condition.createCoinAnnouncement(merged.getName().getBytes()),
                Condition.createCoin(wallet.getPuzzleHash(), merged.getAmount())))));
        return wallet.getSigner().signBundle(spends);
    }

    /**
     * Pushes a combine of {@code coins}. On success the wallet holds the same balance in
     * {@code coins.size() - 1} fewer coins, not counting any other coin the committing block gave it; on rejection
     * none of the coins is spent.
     */
    public SpendResult combine(List<Coin> coins) {
        long startBalance = wallet.getBalance();
        int startCount = wallet.getCoinCount();
        Coin merged = mergedCoin(coins);
        SpendResult result = wallet.getNetwork().pushTx(createBundle(coins));
        if (!result.isSuccess()) {
            log.warn("{}: combining {} coins was rejected: {}", wallet.getName(), coins.size(), result.getReason());
            return result;
        }
        // block rewards may land on this wallet too
        long received = 0;
        int receivedCount = 0;
        for (Coin coin : result.findStandardCoins(wallet.getPuzzleHash())) {
            if (!coin.equals(merged)) {
                received += coin.getAmount();
                receivedCount++;
            }
        }
        checkState(wallet.getBalance() == startBalance + received, "balance changed from %s to %s while combining",
                startBalance, wallet.getBalance());
        int expectedCount = startCount - (coins.size() - 1) + receivedCount;
        checkState(wallet.getCoinCount() == expectedCount, "expected %s coins after combining, have %s",
                expectedCount, wallet.getCoinCount());
        log.info("{}: combined {} coins into {}", wallet.getName(), coins.size(), merged.getName());
        return result;
    }
}
