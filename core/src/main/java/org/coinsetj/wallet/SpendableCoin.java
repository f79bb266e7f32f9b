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

import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.core.CoinSpend;
import org.coinsetj.script.Program;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A coin together with the puzzle that locks it, which is everything needed to build a spend of it apart from
 * the solution.
 */
public class SpendableCoin {
    private final Coin coin;
    private final Program puzzle;

    public SpendableCoin(Coin coin, Program puzzle) {
        this.coin = checkNotNull(coin);
        this.puzzle = checkNotNull(puzzle);
        checkArgument(puzzle.getTreeHash().equals(coin.getPuzzleHash()), "puzzle does not hash to %s",
                coin.getPuzzleHash());
    }

    public Coin getCoin() {
        return coin;
    }

    public Program getPuzzle() {
        return puzzle;
    }

    public Bytes32 getName() {
        return coin.getName();
    }

    public Bytes32 getPuzzleHash() {
        return coin.getPuzzleHash();
    }

    public long getAmount() {
        return coin.getAmount();
    }

    public CoinSpend spend(Program solution) {
        return new CoinSpend(coin, puzzle, solution);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpendableCoin other = (SpendableCoin) o;
        return coin.equals(other.coin) && puzzle.equals(other.puzzle);
    }

    @Override
    public int hashCode() {
        return coin.hashCode();
    }

    @Override
    public String toString() {
        return "SpendableCoin{" + coin + '}';
    }
}
