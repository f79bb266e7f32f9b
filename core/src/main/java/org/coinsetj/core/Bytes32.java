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

package org.coinsetj.core;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.primitives.UnsignedBytes;

import java.io.Serializable;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A 32 byte value, usually the SHA-256 digest of something: a coin id, a puzzle hash, an announcement id or
 * a genesis challenge. Instances are immutable.
 */
public class Bytes32 implements Serializable, Comparable<Bytes32> {
    public static final int LENGTH = 32;
    public static final Bytes32 ZERO_HASH = wrap(new byte[LENGTH]);

    private final byte[] bytes;

    private Bytes32(byte[] rawHashBytes) {
        checkArgument(rawHashBytes.length == LENGTH, "expected %s bytes, got %s", LENGTH, rawHashBytes.length);
        this.bytes = rawHashBytes;
    }

    /** Creates a new instance that wraps a copy of the given bytes. */
    public static Bytes32 wrap(byte[] rawHashBytes) {
        return new Bytes32(rawHashBytes.clone());
    }

    /** Creates a new instance from the 64 character hex string, with or without a {@code 0x} prefix. */
    public static Bytes32 wrap(String hexString) {
        String hex = hexString.startsWith("0x") ? hexString.substring(2) : hexString;
        return new Bytes32(Utils.HEX.decode(hex.toLowerCase()));
    }

    /** Hashes the concatenation of the given byte arrays with SHA-256. */
    public static Bytes32 of(byte[]... contents) {
        Hasher hasher = Hashing.sha256().newHasher();
        for (byte[] content : contents) {
            hasher.putBytes(content);
        }
        return new Bytes32(hasher.hash().asBytes());
    }

    /** Returns a copy of the underlying bytes. */
    public byte[] getBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Bytes32) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public int compareTo(Bytes32 other) {
        return UnsignedBytes.lexicographicalComparator().compare(bytes, other.bytes);
    }

    @Override
    public String toString() {
        return Utils.HEX.encode(bytes);
    }
}
