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

import com.google.common.base.MoreObjects;
import com.google.common.hash.Hashing;
import org.apache.milagro.amcl.BLS381.BIG;
import org.apache.milagro.amcl.BLS381.ECP;
import org.apache.milagro.amcl.BLS381.ECP2;
import org.apache.milagro.amcl.BLS381.ROM;
import org.coinsetj.core.Utils;

import javax.annotation.Nullable;
import java.security.SecureRandom;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>A BLS12-381 public key in G1 and, optionally, its secret scalar. Signatures live in G2, so any number of
 * them can be added into one {@link Signature}.</p>
 *
 * <p>Public keys are serialized as compressed G1 points. Keys are equal when their public keys are equal.</p>
 */
public class BLSKey {
    public static final int PUBLIC_KEY_LENGTH = BIG.MODBYTES + 1;
    public static final int PRIVATE_KEY_LENGTH = 32;

    private static final BIG CURVE_ORDER = new BIG(ROM.CURVE_Order);

    @Nullable private final BIG secret;
    private final ECP pub;
    private final byte[] pubKeyBytes;

    /** Generates an entirely new keypair. */
    public BLSKey() {
        this(new SecureRandom());
    }

    /** Generates an entirely new keypair with the given {@link SecureRandom} object. */
    public BLSKey(SecureRandom secureRandom) {
        this(randomScalar(secureRandom));
    }

    private BLSKey(BIG secret) {
        this.secret = secret;
        this.pub = ECP.generator().mul(secret);
        this.pubKeyBytes = encode(pub);
    }

    private BLSKey(ECP pub, byte[] pubKeyBytes) {
        this.secret = null;
        this.pub = pub;
        this.pubKeyBytes = pubKeyBytes;
    }

    /**
     * Creates a key from 32 bytes of secret key material, read as a big-endian integer and reduced modulo the
     * group order.
     */
    public static BLSKey fromPrivate(byte[] privKeyBytes) {
        checkArgument(privKeyBytes.length == PRIVATE_KEY_LENGTH, "private key must be %s bytes", PRIVATE_KEY_LENGTH);
        byte[] padded = new byte[BIG.MODBYTES];
        System.arraycopy(privKeyBytes, 0, padded, BIG.MODBYTES - PRIVATE_KEY_LENGTH, PRIVATE_KEY_LENGTH);
        BIG secret = BIG.fromBytes(padded);
        secret.mod(CURVE_ORDER);
        checkArgument(!secret.iszilch(), "private key is zero modulo the group order");
        return new BLSKey(secret);
    }

    /**
     * Creates a key that can only verify signatures.
     * @throws IllegalArgumentException if the bytes are not a compressed point of G1
     */
    public static BLSKey fromPublicOnly(byte[] pubKeyBytes) {
        ECP pub = decodePublicKey(pubKeyBytes);
        checkArgument(pub != null, "not a public key: %s", Utils.HEX.encode(pubKeyBytes));
        return new BLSKey(pub, pubKeyBytes.clone());
    }

    /** Parses a public key, or returns null when the bytes do not encode a usable point. */
    @Nullable
    static ECP decodePublicKey(byte[] pubKeyBytes) {
        if (pubKeyBytes.length != PUBLIC_KEY_LENGTH) {
            return null;
        }
        ECP point = ECP.fromBytes(pubKeyBytes);
        return point.is_infinity() ? null : point;
    }

    private static BIG randomScalar(SecureRandom random) {
        byte[] material = new byte[PRIVATE_KEY_LENGTH];
        BIG secret;
        do {
            random.nextBytes(material);
            byte[] padded = new byte[BIG.MODBYTES];
            System.arraycopy(material, 0, padded, BIG.MODBYTES - PRIVATE_KEY_LENGTH, PRIVATE_KEY_LENGTH);
            secret = BIG.fromBytes(padded);
            secret.mod(CURVE_ORDER);
        } while (secret.iszilch());
        return secret;
    }

    private static byte[] encode(ECP point) {
        byte[] bytes = new byte[PUBLIC_KEY_LENGTH];
        point.toBytes(bytes, true);
        return bytes;
    }

    /** Maps a message to G2. Both signing and verification go through here. */
    static ECP2 hashToG2(byte[] message) {
        return ECP2.mapit(Hashing.sha384().hashBytes(message).asBytes());
    }

    public boolean hasPrivKey() {
        return secret != null;
    }

    public byte[] getPubKey() {
        return pubKeyBytes.clone();
    }

    ECP getPubKeyPoint() {
        return pub;
    }

    /** Signs {@code message}: the message hashed to G2, multiplied by the secret. */
    public Signature sign(byte[] message) {
        checkState(secret != null, "cannot sign with a public-only key");
        return new Signature(hashToG2(message).mul(secret));
    }

    /** Verifies a signature by this key alone over {@code message}. */
    public boolean verify(byte[] message, Signature signature) {
        return signature.verify(pub, message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(pubKeyBytes, ((BLSKey) o).pubKeyBytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(pubKeyBytes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("pub", Utils.HEX.encode(pubKeyBytes))
                .add("isPubKeyOnly", !hasPrivKey())
                .toString();
    }
}
