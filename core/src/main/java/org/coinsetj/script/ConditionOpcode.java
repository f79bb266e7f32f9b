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

import java.util.HashMap;
import java.util.Map;

/**
 * Conditions a puzzle can output. The numeric values are part of the ledger's rules.
 */
public enum ConditionOpcode {
    AGG_SIG_UNSAFE(49, 2),
    AGG_SIG_ME(50, 2),
    CREATE_COIN(51, 2),
    RESERVE_FEE(52, 1),
    CREATE_COIN_ANNOUNCEMENT(60, 1),
    ASSERT_COIN_ANNOUNCEMENT(61, 1),
    CREATE_PUZZLE_ANNOUNCEMENT(62, 1),
    ASSERT_PUZZLE_ANNOUNCEMENT(63, 1),
    ASSERT_MY_COIN_ID(70, 1),
    ASSERT_MY_PARENT_ID(71, 1),
    ASSERT_MY_PUZZLEHASH(72, 1),
    ASSERT_MY_AMOUNT(73, 1),
    ASSERT_SECONDS_ABSOLUTE(81, 1),
    ASSERT_HEIGHT_ABSOLUTE(83, 1);

    private static final Map<Integer, ConditionOpcode> BY_VALUE = new HashMap<>();

    static {
        for (ConditionOpcode opcode : values()) {
            BY_VALUE.put(opcode.value, opcode);
        }
    }

    private final int value;
    private final int argumentCount;

    ConditionOpcode(int value, int argumentCount) {
        this.value = value;
        this.argumentCount = argumentCount;
    }

    public int getValue() {
        return value;
    }

    /** Number of arguments the ledger reads for this condition. */
    public int getArgumentCount() {
        return argumentCount;
    }

    public static ConditionOpcode fromValue(int value) {
        ConditionOpcode opcode = BY_VALUE.get(value);
        if (opcode == null) {
            throw new ScriptException("unknown condition opcode " + value);
        }
        return opcode;
    }
}
