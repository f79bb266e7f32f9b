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

import org.coinsetj.script.Program;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A spend record: the coin being consumed, the puzzle it is locked with and the solution to that puzzle.
 */
public class CoinSpend {
    private final Coin coin;
    private final Program puzzleReveal;
    private final Program solution;

    public CoinSpend(Coin coin, Program puzzleReveal, Program solution) {
        this.coin = checkNotNull(coin);
        this.puzzleReveal = checkNotNull(puzzleReveal);
        this.solution = checkNotNull(solution);
    }

    public Coin getCoin() {
        return coin;
    }

    public Program getPuzzleReveal() {
        return puzzleReveal;
    }

    public Program getSolution() {
        return solution;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CoinSpend other = (CoinSpend) o;
        return coin.equals(other.coin) && puzzleReveal.equals(other.puzzleReveal) && solution.equals(other.solution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coin, puzzleReveal, solution);
    }

    @Override
    public String toString() {
        return "CoinSpend{coin=" + coin.getName() + ", amount=" + coin.getAmount() + '}';
    }
}
