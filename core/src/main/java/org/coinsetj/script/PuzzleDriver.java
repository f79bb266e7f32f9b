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

package org.coinsetj.script;

import org.coinsetj.core.Coin;

import java.util.List;

/**
 * Evaluates one family of puzzles. Drivers are looked up by the first byte of a puzzle, see {@link Puzzles}.
 */
public interface PuzzleDriver {

    /** The first byte of every puzzle this driver runs. */
    byte getType();

    /**
     * Runs {@code puzzle} against {@code solution} for {@code coin} and returns the conditions it outputs.
     * @throws ScriptException if the solution does not satisfy the puzzle
     */
    List<Condition> run(Program puzzle, Program solution, Coin coin) throws ScriptException;
}
