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

import com.google.common.collect.ImmutableList;
import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.core.Utils;

import java.util.Arrays;
import java.util.List;

/**
 * {@code 0x03 || unlock timestamp (8 bytes, big endian) || destination puzzle hash}: once the ledger clock has
 * reached the unlock time anyone may spend the coin, and its whole amount goes to the destination.
 */
public class TimeLockPuzzleDriver implements PuzzleDriver {
    public static final byte TYPE = 0x03;
    static final int LENGTH = 1 + 8 + Bytes32.LENGTH;

    @Override
    public byte getType() {
        return TYPE;
    }

    @Override
    public List<Condition> run(Program puzzle, Program solution, Coin coin) throws ScriptException {
        byte[] bytes = puzzle.getBytes();
        if (bytes.length != LENGTH) {
            throw new ScriptException("time lock puzzle must be " + LENGTH + " bytes");
        }
        long unlockTime = Utils.readInt64BE(bytes, 1);
        Bytes32 destination = Bytes32.wrap(Arrays.copyOfRange(bytes, 9, LENGTH));
        return ImmutableList.of(
                Condition.assertSecondsAbsolute(unlockTime),
                Condition.createCoin(destination, coin.getAmount()));
    }
}
