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
import org.coinsetj.core.Utils;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One instruction emitted by a puzzle: an opcode and its raw arguments.
 */
public class Condition {
    private final ConditionOpcode opcode;
    private final ImmutableList<byte[]> args;

    public Condition(ConditionOpcode opcode, List<byte[]> args) {
        if (args.size() < opcode.getArgumentCount()) {
            throw new ScriptException(opcode + " needs " + opcode.getArgumentCount() + " arguments, got " + args.size());
        }
        this.opcode = opcode;
        ImmutableList.Builder<byte[]> copy = ImmutableList.builder();
        for (byte[] arg : args) {
            copy.add(arg.clone());
        }
        this.args = copy.build();
    }

    public static Condition createCoin(Bytes32 puzzleHash, long amount) {
        return new Condition(ConditionOpcode.CREATE_COIN, Arrays.asList(puzzleHash.getBytes(), Utils.encodeInt(amount)));
    }

    public static Condition createCoinAnnouncement(byte[] message) {
        return new Condition(ConditionOpcode.CREATE_COIN_ANNOUNCEMENT, ImmutableList.of(message));
    }

    public static Condition assertCoinAnnouncement(Bytes32 announcementId) {
        return new Condition(ConditionOpcode.ASSERT_COIN_ANNOUNCEMENT, ImmutableList.of(announcementId.getBytes()));
    }

    public static Condition createPuzzleAnnouncement(byte[] message) {
        return new Condition(ConditionOpcode.CREATE_PUZZLE_ANNOUNCEMENT, ImmutableList.of(message));
    }

    public static Condition assertPuzzleAnnouncement(Bytes32 announcementId) {
        return new Condition(ConditionOpcode.ASSERT_PUZZLE_ANNOUNCEMENT, ImmutableList.of(announcementId.getBytes()));
    }

    public static Condition aggSigMe(byte[] publicKey, byte[] message) {
        return new Condition(ConditionOpcode.AGG_SIG_ME, Arrays.asList(publicKey, message));
    }

    public static Condition aggSigUnsafe(byte[] publicKey, byte[] message) {
        return new Condition(ConditionOpcode.AGG_SIG_UNSAFE, Arrays.asList(publicKey, message));
    }

    public static Condition reserveFee(long amount) {
        return new Condition(ConditionOpcode.RESERVE_FEE, ImmutableList.of(Utils.encodeInt(amount)));
    }

    public static Condition assertSecondsAbsolute(long timestamp) {
        return new Condition(ConditionOpcode.ASSERT_SECONDS_ABSOLUTE, ImmutableList.of(Utils.encodeInt(timestamp)));
    }

    public static Condition assertHeightAbsolute(long height) {
        return new Condition(ConditionOpcode.ASSERT_HEIGHT_ABSOLUTE, ImmutableList.of(Utils.encodeInt(height)));
    }

    public static Condition assertMyCoinId(Bytes32 coinId) {
        return new Condition(ConditionOpcode.ASSERT_MY_COIN_ID, ImmutableList.of(coinId.getBytes()));
    }

    public static Condition assertMyAmount(long amount) {
        return new Condition(ConditionOpcode.ASSERT_MY_AMOUNT, ImmutableList.of(Utils.encodeInt(amount)));
    }

    /** The id a coin announcement made by {@code coinId} with {@code message} is asserted under. */
    public static Bytes32 coinAnnouncementId(Bytes32 coinId, byte[] message) {
        return Bytes32.of(coinId.getBytes(), message);
    }

    /** The id a puzzle announcement made by a coin locked by {@code puzzleHash} is asserted under. */
    public static Bytes32 puzzleAnnouncementId(Bytes32 puzzleHash, byte[] message) {
        return Bytes32.of(puzzleHash.getBytes(), message);
    }

    public ConditionOpcode getOpcode() {
        return opcode;
    }

    public int getArgumentCount() {
        return args.size();
    }

    public byte[] getArg(int index) {
        return args.get(index).clone();
    }

    public Bytes32 getBytes32(int index) {
        byte[] arg = args.get(index);
        if (arg.length != Bytes32.LENGTH) {
            throw new ScriptException(opcode + " argument " + index + " must be 32 bytes, got " + arg.length);
        }
        return Bytes32.wrap(arg);
    }

    public long getInt(int index) {
        try {
            return Utils.decodeInt(args.get(index));
        } catch (ArithmeticException x) {
            throw new ScriptException(opcode + " argument " + index + " is out of range", x);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Condition other = (Condition) o;
        if (opcode != other.opcode || args.size() != other.args.size()) return false;
        for (int i = 0; i < args.size(); i++) {
            if (!Arrays.equals(args.get(i), other.args.get(i))) return false;
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(opcode);
        for (byte[] arg : args) {
            result = 31 * result + Arrays.hashCode(arg);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(opcode.name()).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) builder.append(", ");
            builder.append(Utils.HEX.encode(args.get(i)));
        }
        return builder.append(')').toString();
    }
}
