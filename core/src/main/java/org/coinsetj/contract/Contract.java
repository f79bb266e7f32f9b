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

package org.coinsetj.contract;

import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.core.NetworkParameters;
import org.coinsetj.script.Program;
import org.coinsetj.wallet.SpendableCoin;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * <p>A locking puzzle that is not owned by any wallet, identified by its puzzle hash. A contract is not spendable
 * by itself; coins locked to its puzzle hash are.</p>
 *
 * <p>{@link #customCoin(Coin, long)} predicts the coin a spend of {@code parent} creates when it pays
 * {@code amount} to this contract. The prediction only becomes a ledger fact once that spend is committed.</p>
 */
public class Contract {
    private final Bytes32 genesisChallenge;
    private final Program puzzle;

    public Contract(Bytes32 genesisChallenge, Program puzzle) {
        this.genesisChallenge = checkNotNull(genesisChallenge);
        this.puzzle = checkNotNull(puzzle);
        checkArgument(!puzzle.isNil(), "contract puzzle is empty");
    }

    public Contract(NetworkParameters params, Program puzzle) {
        this(params.getGenesisChallenge(), puzzle);
    }

    public Bytes32 getGenesisChallenge() {
        return genesisChallenge;
    }

    public Program getPuzzle() {
        return puzzle;
    }

    public Bytes32 getPuzzleHash() {
        return puzzle.getTreeHash();
    }

    public SpendableCoin customCoin(Coin parent, long amount) {
        return new SpendableCoin(new Coin(parent.getName(), getPuzzleHash(), amount), puzzle);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Contract other = (Contract) o;
        return genesisChallenge.equals(other.genesisChallenge) && puzzle.equals(other.puzzle);
    }

    @Override
    public int hashCode() {
        return puzzle.hashCode();
    }

    @Override
    public String toString() {
        return "Contract{puzzleHash=" + getPuzzleHash() + '}';
    }
}
