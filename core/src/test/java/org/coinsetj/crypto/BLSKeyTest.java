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

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class BLSKeyTest {
    private static final byte[] PRIVATE_KEY =
            Utils.HEX.decode("68e0fe46dfb67e368c75379acec591dad19df3cde26e63b93a8e704f1dade7a3");
    private static final byte[] MESSAGE = "coin".getBytes(StandardCharsets.UTF_8);

    @Test
    public void derivedFromPrivateBytes() {
        BLSKey key = BLSKey.fromPrivate(PRIVATE_KEY);
        assertTrue(key.hasPrivKey());
        assertEquals(BLSKey.PUBLIC_KEY_LENGTH, key.getPubKey().length);
        assertEquals(key, BLSKey.fromPrivate(PRIVATE_KEY));
        assertArrayEquals(key.getPubKey(), BLSKey.fromPrivate(PRIVATE_KEY).getPubKey());
    }

    @Test
    public void signaturesAreDeterministic() {
        BLSKey key = BLSKey.fromPrivate(PRIVATE_KEY);
        Signature signature = key.sign(MESSAGE);
        assertEquals(Signature.SIGNATURE_LENGTH, signature.getBytes().length);
        assertEquals(signature, BLSKey.fromPrivate(PRIVATE_KEY).sign(MESSAGE));
        assertNotEquals(signature, key.sign("coins".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void signAndVerify() {
        BLSKey key = new BLSKey();
        Signature signature = key.sign(MESSAGE);
        assertTrue(key.verify(MESSAGE, signature));
        assertFalse(key.verify("coins".getBytes(StandardCharsets.UTF_8), signature));
        assertFalse(new BLSKey().verify(MESSAGE, signature));
        assertFalse(key.verify(MESSAGE, Signature.EMPTY));
    }

    @Test
    public void publicOnlyKey() {
        BLSKey key = BLSKey.fromPrivate(PRIVATE_KEY);
        BLSKey pubOnly = BLSKey.fromPublicOnly(key.getPubKey());
        assertFalse(pubOnly.hasPrivKey());
        assertTrue(pubOnly.verify(MESSAGE, key.sign(MESSAGE)));
        assertEquals(key, pubOnly);
        assertEquals(key.hashCode(), pubOnly.hashCode());
    }

    @Test(expected = IllegalStateException.class)
    public void publicOnlyKeyCannotSign() {
        BLSKey.fromPublicOnly(BLSKey.fromPrivate(PRIVATE_KEY).getPubKey()).sign(MESSAGE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void publicKeyOfWrongLength() {
        BLSKey.fromPublicOnly(new byte[32]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroPrivateKey() {
        BLSKey.fromPrivate(new byte[BLSKey.PRIVATE_KEY_LENGTH]);
    }

    @Test
    public void distinctKeys() {
        assertNotEquals(new BLSKey(), new BLSKey());
    }
}
