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

import com.google.common.collect.Lists;
import org.coinsetj.core.Coin;
import org.coinsetj.crypto.BLSKey;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The puzzle every wallet locks its own coins with: {@code 0x01 || public key}. The solution is an encoded
 * condition list chosen by the owner; the puzzle passes it through and adds an AGG_SIG_ME requirement on the
 * hash of the solution, so only the key holder can choose what the coin does.
 */
public class StandardPuzzleDriver implements PuzzleDriver {
    public static final byte TYPE = 0x01;
    public static final int PUBLIC_KEY_LENGTH = BLSKey.PUBLIC_KEY_LENGTH;

    @Override
    public byte getType() {
        return TYPE;
    }

    @Override
    public List<Condition> run(Program puzzle, Program solution, Coin coin) throws ScriptException {
        byte[] bytes = puzzle.getBytes();
        if (bytes.length != 1 + PUBLIC_KEY_LENGTH) {
            throw new ScriptException("standard puzzle must carry a " + PUBLIC_KEY_LENGTH + " byte public key");
        }
        byte[] publicKey = Arrays.copyOfRange(bytes, 1, bytes.length);
        List<Condition> delegated = ConditionCodec.decode(solution);
        ArrayList<Condition> conditions = Lists.newArrayListWithCapacity(delegated.size() + 1);
        conditions.addAll(delegated);
        conditions.add(Condition.aggSigMe(publicKey, solution.getTreeHash().getBytes()));
        return conditions;
    }
}
