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

package org.coinsetj.testing;

import org.coinsetj.core.NetworkParameters;
import org.coinsetj.network.Network;
import org.coinsetj.params.UnitTestParams;
import org.coinsetj.wallet.InsufficientFundsException;
import org.coinsetj.wallet.SpendableCoin;
import org.coinsetj.wallet.Wallet;
import org.junit.After;
import org.junit.Before;

import static org.junit.Assert.assertNotNull;

/**
 * A fresh session on an in-memory ledger with two actors, alice and bob, who start out empty. The
 * {@code nobody} wallet collects two blocks of rewards up front and funds the actors through {@link #fund}.
 */
public class TestWithNetwork {
    protected static final NetworkParameters UNITTEST = UnitTestParams.get();

    protected Network network;
    protected Wallet alice;
    protected Wallet bob;

    @Before
    public void setUp() throws Exception {
        network = Network.create(UNITTEST);
        alice = network.makeWallet("alice");
        bob = network.makeWallet("bob");
        network.farmBlock();
        network.farmBlock();
    }

    @After
    public void tearDown() throws Exception {
        network.close();
    }

    /** Gives {@code wallet} one new coin per amount, each from a separate spend by nobody. */
    protected void fund(Wallet wallet, long... amounts) throws InsufficientFundsException {
        for (long amount : amounts) {
            SpendableCoin coin = network.getNobody().giveChia(wallet, amount);
            assertNotNull("funding " + wallet.getName() + " with " + amount + " was rejected", coin);
        }
    }
}
