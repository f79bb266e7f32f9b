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
 * {@code 0x02 || memo}: anyone may spend the coin and the solution's conditions are output unchanged.
 * The memo only makes the puzzle hash distinct.
 */
public class OpenPuzzleDriver implements PuzzleDriver {
    public static final byte TYPE = 0x02;

    @Override
    public byte getType() {
        return TYPE;
    }

    @Override
    public List<Condition> run(Program puzzle, Program solution, Coin coin) throws ScriptException {
        return ConditionCodec.decode(solution);
    }
}
