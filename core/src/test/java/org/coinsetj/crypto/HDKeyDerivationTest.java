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

package org.coinsetj.crypto;

import org.coinsetj.core.Utils;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

/**
 * SLIP-0010 test vector 1 for ed25519, private keys and chain codes.
 */
public class HDKeyDerivationTest {
    private static final byte[] SEED = Utils.HEX.decode("000102030405060708090a0b0c0d0e0f");

    @Test
    public void masterKey() {
        HDKeyDerivation.RawKeyBytes master = HDKeyDerivation.createMasterPrivateKey(SEED);
        assertEquals("90046a93de5380a72b5e45010748567d5ea02bbf6522f979e05c0d8d8ca9fffb",
                Utils.HEX.encode(master.chainCode));
        assertEquals("2b4be7f19ee27bbf30c667b642d5f4aa69fd169872f8fc3059c08ebae2eb19e7",
                Utils.HEX.encode(master.keyBytes));
    }

    @Test
    public void firstHardenedChild() {
        HDKeyDerivation.RawKeyBytes child = HDKeyDerivation.derivePath(HDKeyDerivation.createMasterPrivateKey(SEED), 0);
        assertEquals("8b59aa11380b624e81507a27fedda59fea6d0b779a778918a2fd3590e16e9c69",
                Utils.HEX.encode(child.chainCode));
        assertEquals("68e0fe46dfb67e368c75379acec591dad19df3cde26e63b93a8e704f1dade7a3",
                Utils.HEX.encode(child.keyBytes));
    }

    @Test
    public void hardenedBitIsImplied() {
        HDKeyDerivation.RawKeyBytes master = HDKeyDerivation.createMasterPrivateKey(SEED);
        assertEquals(Utils.HEX.encode(HDKeyDerivation.deriveChildKey(master, 5).keyBytes),
                Utils.HEX.encode(HDKeyDerivation.deriveChildKey(master, 5 | HDKeyDerivation.HARDENED_BIT).keyBytes));
        assertNotEquals(Utils.HEX.encode(HDKeyDerivation.deriveChildKey(master, 5).keyBytes),
                Utils.HEX.encode(HDKeyDerivation.deriveChildKey(master, 6).keyBytes));
    }

    @Test(expected = IllegalArgumentException.class)
    public void shortSeed() {
        HDKeyDerivation.createMasterPrivateKey(new byte[15]);
    }
}
