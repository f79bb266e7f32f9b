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

import com.google.common.io.BaseEncoding;
import com.google.common.primitives.Bytes;

import java.math.BigInteger;

/**
 * A collection of various utility methods that are helpful for working with coin set data.
 */
public class Utils {

    /** Hex encoding used throughout the library. */
    public static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private static final byte[] EMPTY = new byte[0];

    private Utils() { }

    /**
     * Encodes an integer as the shortest big-endian two's complement byte string that represents it. Zero is
     * encoded as the empty string. This is the form amounts take inside coin ids and conditions.
     */
    public static byte[] encodeInt(long value) {
        if (value == 0) {
            return EMPTY;
        }
        return BigInteger.valueOf(value).toByteArray();
    }

    /**
     * Decodes a value written by {@link #encodeInt(long)}.
     * @throws ArithmeticException if the value does not fit in a long
     */
    public static long decodeInt(byte[] bytes) {
        if (bytes.length == 0) {
            return 0;
        }
        return new BigInteger(bytes).longValueExact();
    }

    /** Concatenates the given arrays. */
    public static byte[] concat(byte[]... arrays) {
        return Bytes.concat(arrays);
    }

    /** Reads a big-endian unsigned 64 bit value. */
    public static long readInt64BE(byte[] bytes, int offset) {
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value = (value << 8) | (bytes[offset + i] & 0xFFL);
        }
        return value;
    }

    /** Writes a big-endian 64 bit value. */
    public static void uint64ToByteArrayBE(long val, byte[] out, int offset) {
        for (int i = 7; i >= 0; i--) {
            out[offset + i] = (byte) (val & 0xFF);
            val >>>= 8;
        }
    }
}
