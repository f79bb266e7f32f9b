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

import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Implementation of the <a href="https://github.com/satoshilabs/slips/blob/master/slip-0010.md">SLIP-0010</a>
 * child key derivation, ed25519 variant, which only has hardened children. The derived 32 bytes are used as
 * secret key material for {@link BLSKey}.
 */
public final class HDKeyDerivation {
    public static final int HARDENED_BIT = 0x80000000;
    private static final byte[] ED25519_SEED_KEY = "ed25519 seed".getBytes(StandardCharsets.US_ASCII);

    private HDKeyDerivation() { }

    /**
     * Generates the master key from the given seed.
     * @throws IllegalArgumentException if the seed is less than 16 bytes and could be brute forced
     */
    public static RawKeyBytes createMasterPrivateKey(byte[] seed) {
        checkArgument(seed.length >= 16, "Seed is too short and could be brute forced");
        return split(hmacSha512(ED25519_SEED_KEY, seed));
    }

    /** Derives the hardened child {@code index} of {@code parent}; the hardened bit is set if missing. */
    public static RawKeyBytes deriveChildKey(RawKeyBytes parent, int index) {
        ByteBuffer data = ByteBuffer.allocate(1 + 32 + 4);
        data.put((byte) 0);
        data.put(parent.keyBytes);
        data.putInt(index | HARDENED_BIT);
        return split(hmacSha512(parent.chainCode, data.array()));
    }

    /** Derives along a path of indexes, each hardened. */
    public static RawKeyBytes derivePath(RawKeyBytes master, int... path) {
        RawKeyBytes key = master;
        for (int index : path) {
            key = deriveChildKey(key, index);
        }
        return key;
    }

    private static RawKeyBytes split(byte[] i) {
        checkState(i.length == 64, i.length);
        RawKeyBytes raw = new RawKeyBytes(Arrays.copyOfRange(i, 0, 32), Arrays.copyOfRange(i, 32, 64));
        Arrays.fill(i, (byte) 0);
        return raw;
    }

    static byte[] hmacSha512(byte[] key, byte[] data) {
        HMac hmac = new HMac(new SHA512Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(data, 0, data.length);
        byte[] out = new byte[64];
        hmac.doFinal(out, 0);
        return out;
    }

    public static class RawKeyBytes {
        public final byte[] keyBytes, chainCode;

        public RawKeyBytes(byte[] keyBytes, byte[] chainCode) {
            this.keyBytes = keyBytes;
            this.chainCode = chainCode;
        }
    }
}
