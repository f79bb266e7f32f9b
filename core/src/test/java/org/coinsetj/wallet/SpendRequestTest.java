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
import org.coinsetj.script.Condition;
import org.coinsetj.script.Puzzles;
import org.coinsetj.testing.TestWithNetwork;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SpendRequestTest extends TestWithNetwork {

    @Test
    public void standardDefaults() {
        SpendRequest request = SpendRequest.standard();
        assertEquals(SpendRequest.DEFAULT_AMOUNT, request.getAmount());
        assertNull(request.getTo());
        assertNull(request.getRemainder());
        assertFalse(request.hasArgs());
    }

    @Test
    public void targetsResolve() {
        Contract contract = new Contract(UNITTEST, Puzzles.openPuzzle(new byte[]{7}));
        SpendRequest request = SpendRequest.forAmount(5).to(bob).remainder(contract);
        assertEquals(SpendTarget.Kind.WALLET, request.getTo().getKind());
        assertSame(bob, request.getTo().getWallet());
        assertEquals(bob.getPuzzleHash(), request.getTo().getPuzzleHash());
        assertEquals(SpendTarget.Kind.CONTRACT, request.getRemainder().getKind());
        assertEquals(contract.getPuzzleHash(), request.getRemainder().getPuzzleHash());
    }

    @Test
    public void walletTargetPaysToStandardPuzzle() {
        Contract asContract = SpendTarget.of(alice).asContract(UNITTEST.getGenesisChallenge());
        assertEquals(alice.getPuzzleHash(), asContract.getPuzzleHash());
        SpendTarget target = SpendTarget.of(alice);
        assertSame(target, SpendRequest.standard().to(target).getTo());
    }

    @Test
    public void conditionsBecomeArgs() {
        SpendRequest request = SpendRequest.withConditions(ImmutableList.of(Condition.reserveFee(1)));
        assertTrue(request.hasArgs());
        assertEquals(Puzzles.solutionForConditions(ImmutableList.of(Condition.reserveFee(1))), request.getArgs());
    }

    @Test(expected = InvalidRecipientException.class)
    public void nullRecipient() {
        SpendRequest.standard().to((Wallet) null);
    }

    @Test
    public void nullTargetsCarryAMessage() {
        try {
            SpendTarget.of((Wallet) null);
            fail();
        } catch (InvalidRecipientException e) {
            assertEquals("Recipient wallet is null", e.getMessage());
        }
        try {
            SpendTarget.of((Contract) null);
            fail();
        } catch (InvalidRecipientException e) {
            assertEquals("Recipient contract is null", e.getMessage());
        }
        try {
            SpendRequest.standard().remainder((SpendTarget) null);
            fail();
        } catch (InvalidRecipientException e) {
            assertEquals("Recipient is null", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeAmount() {
        SpendRequest.forAmount(-1);
    }

    @Test(expected = IllegalStateException.class)
    public void argsExcludeAmount() {
        SpendRequest.withArgs(Puzzles.solutionForConditions(ImmutableList.<Condition>of())).amount(3);
    }
}
