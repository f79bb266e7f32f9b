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

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class UtilsTest {

    @Test
    public void encodeInt() {
        assertArrayEquals(new byte[0], Utils.encodeInt(0));
        assertEquals("01", Utils.HEX.encode(Utils.encodeInt(1)));
        assertEquals("7f", Utils.HEX.encode(Utils.encodeInt(127)));
        assertEquals("0080", Utils.HEX.encode(Utils.encodeInt(128)));
        assertEquals("00ff", Utils.HEX.encode(Utils.encodeInt(255)));
        assertEquals("0100", Utils.HEX.encode(Utils.encodeInt(256)));
        assertEquals("ff", Utils.HEX.encode(Utils.encodeInt(-1)));
        assertEquals("ff7f", Utils.HEX.encode(Utils.encodeInt(-129)));
        assertEquals("00e8d4a51000", Utils.HEX.encode(Utils.encodeInt(NetworkParameters.MOJO_PER_COIN)));
    }

    @Test
    public void decodeInt() {
        assertEquals(0, Utils.decodeInt(new byte[0]));
        assertEquals(128, Utils.decodeInt(Utils.HEX.decode("0080")));
        assertEquals(-1, Utils.decodeInt(Utils.HEX.decode("ff")));
        assertEquals(Long.MAX_VALUE, Utils.decodeInt(Utils.encodeInt(Long.MAX_VALUE)));
    }

    @Test(expected = ArithmeticException.class)
    public void decodeIntOverflow() {
        Utils.decodeInt(Utils.HEX.decode("010000000000000000"));
    }

    @Test
    public void uint64BigEndian() {
        byte[] out = new byte[10];
        Utils.uint64ToByteArrayBE(0x0102030405060708L, out, 1);
        assertEquals("00010203040506070800", Utils.HEX.encode(out));
        assertEquals(0x0102030405060708L, Utils.readInt64BE(out, 1));
    }
}
