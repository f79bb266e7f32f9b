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

package org.coinsetj.core;

import com.google.common.base.Objects;

/**
 * <p>NetworkParameters contains the constants a ledger and the wallets using it must agree on.</p>
 *
 * <p>This is an abstract class, concrete instantiations can be found in the params package: one mirroring the
 * public simulator constants ({@link org.coinsetj.params.SimNetParams}) and one intended for unit testing
 * ({@link org.coinsetj.params.UnitTestParams}). Call the static get() methods on each class directly.</p>
 */
public abstract class NetworkParameters {
    /** The string returned by getId() for the simulator network. */
    public static final String ID_SIMNET = "org.coinsetj.simnet";
    /** Unit test network. */
    public static final String ID_UNITTESTNET = "org.coinsetj.unittest";

    /** One coin is this many of the smallest unit. */
    public static final long MOJO_PER_COIN = 1_000_000_000_000L;

    protected String id;
    protected Bytes32 genesisChallenge;
    protected Bytes32 aggSigMeAdditionalData;
    protected long poolReward;
    protected long farmerReward;
    protected long initialTimestamp;
    protected int blockTimeSeconds;
    protected int maxSpendsPerBundle;
    protected String addressPrefix;

    protected NetworkParameters() {
    }

    /** A Java package style string acting as unique ID for these parameters. */
    public String getId() {
        return id;
    }

    /** Hash the chain was started from; reward coin parents are derived from it. */
    public Bytes32 getGenesisChallenge() {
        return genesisChallenge;
    }

    /** Appended to every AGG_SIG_ME message so signatures cannot be replayed on another network. */
    public Bytes32 getAggSigMeAdditionalData() {
        return aggSigMeAdditionalData;
    }

    /** Amount of the pool reward coin created with every block. */
    public long getPoolReward() {
        return poolReward;
    }

    /** Amount of the farmer reward coin created with every block, before fees are added. */
    public long getFarmerReward() {
        return farmerReward;
    }

    /** Ledger clock, in seconds since the epoch, when a new ledger starts. */
    public long getInitialTimestamp() {
        return initialTimestamp;
    }

    /** Seconds the clock advances for every block farmed while skipping time. */
    public int getBlockTimeSeconds() {
        return blockTimeSeconds;
    }

    public int getMaxSpendsPerBundle() {
        return maxSpendsPerBundle;
    }

    /** Human readable part of bech32m encoded addresses. */
    public String getAddressPrefix() {
        return addressPrefix;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return getId().equals(((NetworkParameters) o).getId());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(getId());
    }

    @Override
    public String toString() {
        return getId();
    }
}
