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
import org.coinsetj.core.Utils;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An opaque puzzle or solution. The library never interprets the bytes of a program itself: a program is
 * identified by its tree hash and evaluated by the {@link PuzzleDriver} selected by its first byte.
 */
public class Program {
    public static final Program NIL = new Program(new byte[0]);

    private final byte[] bytes;
    private Bytes32 treeHash;

    private Program(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Program of(byte[] bytes) {
        return bytes.length == 0 ? NIL : new Program(bytes.clone());
    }

    public static Program fromHex(String hex) {
        return of(Utils.HEX.decode(hex));
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return Utils.HEX.encode(bytes);
    }

    public int size() {
        return bytes.length;
    }

    public boolean isNil() {
        return bytes.length == 0;
    }

    /** The first byte, which selects the driver able to run this program as a puzzle. */
    public byte getType() {
        checkArgument(bytes.length > 0, "empty program has no type");
        return bytes[0];
    }

    public Bytes32 getTreeHash() {
        if (treeHash == null) {
            treeHash = Bytes32.of(bytes);
        }
        return treeHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Program) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Program{" + toHex() + '}';
    }
}
