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
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ConditionCodecTest {
    private static final Bytes32 PUZZLE_HASH = Bytes32.of(new byte[]{7});

    @Test
    public void wireFormat() {
        Program program = ConditionCodec.encode(ImmutableList.of(Condition.reserveFee(5)));
        // count, opcode 52, one argument of one byte
        String hex = "00000001" + "34" + "01" + "00000001" + "05";
        assertEquals(hex, program.toHex());
        assertEquals(program, Program.fromHex(hex));
    }

    @Test
    public void emptyList() {
        Program program = ConditionCodec.encode(ImmutableList.<Condition>of());
        assertEquals(4, program.size());
        assertTrue(ConditionCodec.decode(program).isEmpty());
    }

    @Test
    public void decodesWhatItEncodes() {
        List<Condition> conditions = ImmutableList.of(
                Condition.createCoin(PUZZLE_HASH, 1750),
                Condition.createCoinAnnouncement(new byte[0]),
                Condition.assertSecondsAbsolute(1620061201L));
        List<Condition> decoded = ConditionCodec.decode(ConditionCodec.encode(conditions));
        assertEquals(conditions, decoded);
        assertEquals(PUZZLE_HASH, decoded.get(0).getBytes32(0));
        assertEquals(1750, decoded.get(0).getInt(1));
        assertArrayEquals(new byte[0], decoded.get(1).getArg(0));
    }

    @Test(expected = ScriptException.class)
    public void truncated() {
        byte[] bytes = ConditionCodec.encode(ImmutableList.of(Condition.createCoin(PUZZLE_HASH, 1))).getBytes();
        ConditionCodec.decode(Program.of(Arrays.copyOf(bytes, bytes.length - 1)));
    }

    @Test(expected = ScriptException.class)
    public void trailingBytes() {
        byte[] bytes = ConditionCodec.encode(ImmutableList.of(Condition.reserveFee(1))).getBytes();
        ConditionCodec.decode(Program.of(Arrays.copyOf(bytes, bytes.length + 1)));
    }

    @Test(expected = ScriptException.class)
    public void unknownOpcode() {
        ConditionCodec.decode(Program.fromHex("00000001" + "ff" + "00"));
    }

    @Test(expected = ScriptException.class)
    public void missingArguments() {
        ConditionCodec.decode(Program.fromHex("00000001" + "33" + "00"));
    }

    @Test(expected = ScriptException.class)
    public void emptyProgram() {
        ConditionCodec.decode(Program.NIL);
    }
}
