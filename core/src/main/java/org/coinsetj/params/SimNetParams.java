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

/**
 * Parameters matching the public simulator: full size block rewards and the main genesis challenge.
 */
public class SimNetParams extends NetworkParameters {
    public static final String GENESIS_CHALLENGE = "ccd5bb71183532bff220ba46c268991a3ff07eb358e8255a65c30a2dce0e5fbb";

    public SimNetParams() {
        super();
        id = ID_SIMNET;
        genesisChallenge = Bytes32.wrap(GENESIS_CHALLENGE);
        aggSigMeAdditionalData = genesisChallenge;
        poolReward = 7 * MOJO_PER_COIN / 4;
        farmerReward = MOJO_PER_COIN / 4;
        // past the initial transaction freeze
        initialTimestamp = 1620061201L;
        blockTimeSeconds = 20;
        maxSpendsPerBundle = 1000;
        addressPrefix = "xch";
    }

    private static SimNetParams instance;
    public static synchronized SimNetParams get() {
        if (instance == null) {
            instance = new SimNetParams();
        }
        return instance;
    }
}
