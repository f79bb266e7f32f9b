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
import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes a list of conditions into the solution format understood by the standard and open puzzles:
 * a 4 byte count, then per condition one opcode byte, one argument count byte and each argument as a
 * 4 byte length followed by its bytes.
 */
public final class ConditionCodec {
    private static final int MAX_ARGUMENT_LENGTH = 1024;

    private ConditionCodec() { }

    public static Program encode(List<Condition> conditions) {
        ByteArrayDataOutput out = ByteStreams.newDataOutput();
        out.writeInt(conditions.size());
        for (Condition condition : conditions) {
            out.writeByte(condition.getOpcode().getValue());
            out.writeByte(condition.getArgumentCount());
            for (int i = 0; i < condition.getArgumentCount(); i++) {
                byte[] arg = condition.getArg(i);
                out.writeInt(arg.length);
                out.write(arg);
            }
        }
        return Program.of(out.toByteArray());
    }

    public static List<Condition> decode(Program program) throws ScriptException {
        byte[] bytes = program.getBytes();
        ByteArrayDataInput in = ByteStreams.newDataInput(bytes);
        try {
            int count = in.readInt();
            // every condition takes at least two bytes
            if (count < 0 || count > bytes.length / 2) {
                throw new ScriptException("invalid condition count " + count);
            }
            ArrayList<Condition> conditions = Lists.newArrayListWithCapacity(count);
            int consumed = 4;
            for (int i = 0; i < count; i++) {
                ConditionOpcode opcode = ConditionOpcode.fromValue(in.readUnsignedByte());
                int argc = in.readUnsignedByte();
                consumed += 2;
                ArrayList<byte[]> args = Lists.newArrayListWithCapacity(argc);
                for (int j = 0; j < argc; j++) {
                    int length = in.readInt();
                    consumed += 4;
                    if (length < 0 || length > MAX_ARGUMENT_LENGTH || consumed + length > bytes.length) {
                        throw new ScriptException("invalid argument length " + length);
                    }
                    byte[] arg = new byte[length];
                    in.readFully(arg);
                    consumed += length;
                    args.add(arg);
                }
                conditions.add(new Condition(opcode, args));
            }
            if (consumed != bytes.length) {
                throw new ScriptException("trailing bytes after condition list");
            }
            return conditions;
        } catch (IllegalStateException x) {
            throw new ScriptException("truncated condition list", x);
        }
    }
}
