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
import org.coinsetj.core.CoinRecord;
import org.coinsetj.core.SpendBundle;
import org.coinsetj.crypto.DeterministicKeyChain;
import org.coinsetj.ledger.Err;
import org.coinsetj.ledger.SpendSimulator;
import org.coinsetj.ledger.SubmitResult;
import org.coinsetj.network.Network;
import org.coinsetj.script.Condition;
import org.coinsetj.script.Program;
import org.coinsetj.script.Puzzles;
import org.coinsetj.testing.TestWithNetwork;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class WalletTest extends TestWithNetwork {

    private Contract openContract(String memo) {
        return new Contract(UNITTEST, Puzzles.openPuzzle(memo.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void farmingCreditsTheFarmer() {
        assertEquals(0, alice.getBalance());
        network.farmBlock(alice);
        assertEquals(UNITTEST.getPoolReward() + UNITTEST.getFarmerReward(), alice.getBalance());
        assertEquals(2, alice.getCoinCount());
        for (Coin coin : alice.getCoins()) {
            assertEquals(alice.getPuzzleHash(), coin.getPuzzleHash());
        }
    }

    @Test
    public void chooseCoinReturnsSingleCoveringCoin() throws Exception {
        fund(alice, 5, 40);
        SpendableCoin coin = alice.chooseCoin(10);
        assertNotNull(coin);
        assertEquals(40, coin.getAmount());
        assertEquals(2, alice.getCoinCount());
    }

    @Test
    public void chooseCoinCombinesWhenNoCoinIsLargeEnough() throws Exception {
        fund(alice, 10, 10, 10);
        long height = network.getHeight();
        SpendableCoin coin = alice.chooseCoin(25);
        assertNotNull(coin);
        assertEquals(30, coin.getAmount());
        assertEquals(30, alice.getBalance());
        assertEquals(1, alice.getCoinCount());
        // one combine bundle, one block
        assertEquals(height + 1, network.getHeight());
        assertEquals(ImmutableList.of(coin.getCoin()), alice.getCoins());
    }

    @Test
    public void chooseCoinWithoutEnoughValue() throws Exception {
        fund(alice, 10);
        try {
            alice.chooseCoin(11);
            fail();
        } catch (InsufficientFundsException x) {
            assertEquals(1, x.missing);
        }
        assertEquals(10, alice.getBalance());
    }

    @Test(expected = IllegalArgumentException.class)
    public void chooseCoinNeedsPositiveAmount() throws Exception {
        alice.chooseCoin(0);
    }

    @Test
    public void launchContractLeavesChange() throws Exception {
        fund(alice, 5);
        Contract contract = openContract("launch");
        SpendableCoin launched = alice.launchContract(contract, 1);
        assertNotNull(launched);
        assertEquals(1, launched.getAmount());
        assertEquals(contract.getPuzzleHash(), launched.getPuzzleHash());
        assertEquals(contract.getPuzzle(), launched.getPuzzle());
        assertEquals(4, alice.getBalance());
        assertEquals(1, alice.getCoinCount());

        CoinRecord record = network.getLedger().getCoinRecordByName(launched.getName());
        assertNotNull(record);
        assertFalse(record.isSpent());
    }

    @Test
    public void launchContractWithExactAmountHasNoChange() throws Exception {
        fund(alice, 7);
        assertNotNull(alice.launchContract(openContract("exact"), 7));
        assertEquals(0, alice.getBalance());
        assertEquals(0, alice.getCoinCount());
    }

    @Test(expected = InsufficientFundsException.class)
    public void launchContractWithoutFunds() throws Exception {
        alice.launchContract(openContract("poor"), 1);
    }

    @Test
    public void giveChiaToAnotherWallet() throws Exception {
        fund(alice, 100);
        SpendableCoin given = alice.giveChia(bob, 40);
        assertNotNull(given);
        assertEquals(bob.getPuzzleHash(), given.getPuzzleHash());
        assertEquals(40, bob.getBalance());
        assertEquals(60, alice.getBalance());
        assertEquals(ImmutableList.of(given.getCoin()), bob.getCoins());
    }

    @Test
    public void giveChiaToContract() throws Exception {
        fund(alice, 100);
        Contract contract = openContract("give");
        SpendableCoin given = alice.giveChia(SpendTarget.of(contract), 30);
        assertNotNull(given);
        assertEquals(contract.getPuzzleHash(), given.getPuzzleHash());
        assertEquals(70, alice.getBalance());
    }

    @Test
    public void giveChiaToNullRecipient() throws Exception {
        fund(alice, 100);
        try {
            alice.giveChia((Wallet) null, 1);
            fail();
        } catch (InvalidRecipientException e) {
            assertEquals("Recipient wallet is null", e.getMessage());
        }
        try {
            alice.giveChia((SpendTarget) null, 1);
            fail();
        } catch (InvalidRecipientException e) {
            assertEquals("Recipient is null", e.getMessage());
        }
        assertEquals(100, alice.getBalance());
    }

    @Test
    public void giveChiaToWalletOfAnotherNetwork() throws Exception {
        fund(alice, 100);
        Network other = Network.create(UNITTEST);
        try {
            Wallet carol = other.makeWallet("carol");
            alice.giveChia(carol, 1);
            fail();
        } catch (InvalidRecipientException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("carol"));
        } finally {
            other.close();
        }
        assertEquals(100, alice.getBalance());
    }

    @Test(expected = InvalidRecipientException.class)
    public void giveChiaToContractOfAnotherNetwork() throws Exception {
        fund(alice, 100);
        Contract foreign = new Contract(Bytes32.of("elsewhere".getBytes(StandardCharsets.UTF_8)),
                Puzzles.openPuzzle(new byte[]{1}));
        alice.giveChia(foreign, 1);
    }

    @Test
    public void chooseCoinUsesConfiguredSelector() throws Exception {
        fund(alice, 40, 50);
        assertSame(GreedyCoinSelector.get(), alice.getCoinSelector());
        CoinSelector largestFirst = (target, candidates) -> {
            Coin largest = candidates.get(0);
            for (Coin coin : candidates) {
                if (coin.getAmount() > largest.getAmount()) {
                    largest = coin;
                }
            }
            return new CoinSelection(target, largest.getAmount(), ImmutableList.of(largest));
        };
        alice.setCoinSelector(largestFirst);
        assertSame(largestFirst, alice.getCoinSelector());
        SpendableCoin coin = alice.chooseCoin(10);
        assertNotNull(coin);
        assertEquals(50, coin.getAmount());
    }

    @Test
    public void spendCoinWithRecipientAndRemainder() throws Exception {
        fund(alice, 50);
        SpendableCoin coin = alice.toSpendable(alice.getCoins().get(0));
        SpendResult result = alice.spendCoin(coin, SpendRequest.forAmount(20).to(bob).remainder(alice));
        assertTrue(result.getReason(), result.isSuccess());
        List<Coin> bobs = result.findStandardCoins(bob.getPuzzleHash());
        assertEquals(1, bobs.size());
        assertEquals(20, bobs.get(0).getAmount());
        assertEquals(ImmutableList.of(coin.getCoin()), result.getRemovals());
        assertEquals(20, bob.getBalance());
        assertEquals(30, alice.getBalance());
    }

    @Test
    public void spendCoinDefaultsToOneMojoBackToSelf() throws Exception {
        fund(alice, 1);
        SpendResult result = alice.spendCoin(alice.toSpendable(alice.getCoins().get(0)));
        assertTrue(result.isSuccess());
        List<Coin> mine = result.findStandardCoins(alice.getPuzzleHash());
        assertEquals(1, mine.size());
        assertEquals(SpendRequest.DEFAULT_AMOUNT, mine.get(0).getAmount());
        assertEquals(1, alice.getBalance());
    }

    @Test
    public void spendContractCoinWithArgs() throws Exception {
        fund(alice, 10);
        SpendableCoin contractCoin = alice.launchContract(openContract("args"), 10);
        assertNotNull(contractCoin);
        SpendResult result = alice.spendCoin(contractCoin,
                SpendRequest.withConditions(ImmutableList.of(Condition.createCoin(bob.getPuzzleHash(), 10))));
        assertTrue(result.getReason(), result.isSuccess());
        assertEquals(10, bob.getBalance());
    }

    @Test
    public void remainderLargerThanCoinIsRejectedByLedger() throws Exception {
        fund(alice, 10);
        long balance = alice.getBalance();
        SpendResult result = alice.spendCoin(alice.toSpendable(alice.getCoins().get(0)),
                SpendRequest.forAmount(11).to(bob).remainder(alice));
        assertFalse(result.isSuccess());
        assertEquals(Err.COIN_AMOUNT_NEGATIVE, result.getError());
        assertTrue(result.getAdditions().isEmpty());
        assertEquals(balance, alice.getBalance());
    }

    @Test(expected = IllegalArgumentException.class)
    public void foreignSignatureIsNotForged() throws Exception {
        fund(bob, 10);
        alice.spendCoin(bob.toSpendable(bob.getCoins().get(0)));
    }

    @Test
    public void rejectedCombineMakesChooseCoinReturnNull() throws Exception {
        Network picky = new Network(UNITTEST, new SingleSpendSimulator(), DeterministicKeyChain.withDefaultSeed());
        try {
            Wallet carol = picky.makeWallet("carol");
            picky.farmBlock(carol);
            picky.farmBlock(carol);
            long balance = carol.getBalance();
            int coins = carol.getCoinCount();
            long justOverOneBlock = UNITTEST.getPoolReward() + UNITTEST.getFarmerReward() + 1;
            assertNull(carol.chooseCoin(justOverOneBlock));
            assertNull(carol.launchContract(openContract("picky"), justOverOneBlock));
            assertEquals(balance, carol.getBalance());
            assertEquals(coins, carol.getCoinCount());
        } finally {
            picky.close();
        }
    }

    @Test
    public void walletCoinsAreReplacedNotPatched() throws Exception {
        fund(alice, 10);
        Coin stale = new Coin(alice.getCoins().get(0).getName(), alice.getPuzzleHash(), 999);
        alice.replaceCoins(ImmutableList.of(stale));
        assertEquals(999, alice.getBalance());
        network.farmBlock();
        assertEquals(10, alice.getBalance());
    }

    @Test(expected = IllegalArgumentException.class)
    public void foreignCoinsAreRefused() throws Exception {
        fund(bob, 10);
        alice.replaceCoins(bob.getCoins());
    }

    @Test(expected = IllegalStateException.class)
    public void argsExcludeRecipient() {
        SpendRequest.withArgs(Program.NIL).to(bob);
    }

    /** Refuses every bundle with more than one spend, so combines always fail. */
    private static class SingleSpendSimulator extends SpendSimulator {
        SingleSpendSimulator() {
            super(UNITTEST);
        }

        @Override
        public SubmitResult submit(SpendBundle bundle) {
            if (bundle.getCoinSpends().size() > 1) {
                return SubmitResult.failed(Err.MEMPOOL_CONFLICT, "single spends only");
            }
            return super.submit(bundle);
        }
    }
}
