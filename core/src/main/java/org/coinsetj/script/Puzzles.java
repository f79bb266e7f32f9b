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

import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.core.Utils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Builds the puzzles and solutions the library knows about, and runs any puzzle through the driver
 * registered for its type byte.
 */
public final class Puzzles {
    private static final Map<Byte, PuzzleDriver> drivers = new ConcurrentHashMap<>();

    static {
        register(new StandardPuzzleDriver());
        register(new OpenPuzzleDriver());
        register(new TimeLockPuzzleDriver());
    }

    private Puzzles() { }

    /** Makes puzzles whose first byte is {@code driver.getType()} runnable, replacing any previous driver. */
    public static void register(PuzzleDriver driver) {
        drivers.put(driver.getType(), driver);
    }

    /**
     * Runs the puzzle for {@code coin} and returns its conditions.
     * @throws ScriptException if no driver knows the puzzle or the solution does not satisfy it
     */
    public static List<Condition> run(Program puzzle, Program solution, Coin coin) throws ScriptException {
        if (puzzle.isNil()) {
            throw new ScriptException("empty puzzle");
        }
        PuzzleDriver driver = drivers.get(puzzle.getType());
        if (driver == null) {
            throw new ScriptException("no driver for puzzle type " + puzzle.getType());
        }
        return driver.run(puzzle, solution, coin);
    }

    /** The standard puzzle locking coins to the holder of {@code publicKey}. */
    public static Program puzzleForPk(byte[] publicKey) {
        checkArgument(publicKey.length == StandardPuzzleDriver.PUBLIC_KEY_LENGTH, "bad public key length");
        return Program.of(Utils.concat(new byte[]{StandardPuzzleDriver.TYPE}, publicKey));
    }

    /** The solution that makes a standard or open puzzle output {@code conditions}. */
    public static Program solutionForConditions(List<Condition> conditions) {
        return ConditionCodec.encode(conditions);
    }

    /** A puzzle anyone can spend; different memos give different puzzle hashes. */
    public static Program openPuzzle(byte[] memo) {
        return Program.of(Utils.concat(new byte[]{OpenPuzzleDriver.TYPE}, memo));
    }

    /** A puzzle releasing its whole amount to {@code destination} once the clock reaches {@code unlockTime}. */
    public static Program timeLockPuzzle(long unlockTime, Bytes32 destination) {
        byte[] bytes = new byte[TimeLockPuzzleDriver.LENGTH];
        bytes[0] = TimeLockPuzzleDriver.TYPE;
        Utils.uint64ToByteArrayBE(unlockTime, bytes, 1);
        System.arraycopy(destination.getBytes(), 0, bytes, 9, Bytes32.LENGTH);
        return Program.of(bytes);
    }
}
