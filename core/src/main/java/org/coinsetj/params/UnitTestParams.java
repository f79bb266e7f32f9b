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

package org.coinsetj.params;

import org.coinsetj.core.Bytes32;
import org.coinsetj.core.NetworkParameters;

import java.nio.charset.StandardCharsets;

/**
 * Network parameters used by unit tests. Rewards are small round numbers so balances stay readable.
 */
public class UnitTestParams extends NetworkParameters {
    public static final long POOL_REWARD = 1750;
    public static final long FARMER_REWARD = 250;

    public UnitTestParams() {
        super();
        id = ID_UNITTESTNET;
        genesisChallenge = Bytes32.of("unittest genesis".getBytes(StandardCharsets.UTF_8));
        aggSigMeAdditionalData = genesisChallenge;
        poolReward = POOL_REWARD;
        farmerReward = FARMER_REWARD;
        initialTimestamp = 1620061201L;
        blockTimeSeconds = 20;
        maxSpendsPerBundle = 100;
        addressPrefix = "txch";
    }

    private static UnitTestParams instance;
    public static synchronized UnitTestParams get() {
        if (instance == null) {
            instance = new UnitTestParams();
        }
        return instance;
    }
}
