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

import org.apache.milagro.amcl.BLS381.BIG;
import org.apache.milagro.amcl.BLS381.ECP;
import org.apache.milagro.amcl.BLS381.ECP2;
import org.apache.milagro.amcl.BLS381.FP12;
import org.apache.milagro.amcl.BLS381.PAIR;
import org.coinsetj.core.Utils;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>A BLS signature: one point of G2. Aggregating adds points, so the aggregate of any number of signatures is
 * the same size as one and its value does not depend on the order they were added in.</p>
 *
 * <p>An aggregate is valid for a list of (public key, message) pairs when
 * {@code e(g1, signature) == e(pk_1, H(m_1)) * ... * e(pk_n, H(m_n))}. The point at infinity is the aggregate of
 * nothing and is only valid for an empty list.</p>
 */
public class Signature {
    public static final int SIGNATURE_LENGTH = 4 * BIG.MODBYTES;
    /** The aggregate of nothing. */
    public static final Signature EMPTY = new Signature(new ECP2());

    private static final byte[] EMPTY_BYTES = new byte[SIGNATURE_LENGTH];

    private final ECP2 point;
    private final byte[] bytes;

    Signature(ECP2 point) {
        this.point = point;
        this.bytes = encode(point);
    }

    private static byte[] encode(ECP2 point) {
        if (point.is_infinity()) {
            return EMPTY_BYTES.clone();
        }
        byte[] bytes = new byte[SIGNATURE_LENGTH];
        point.toBytes(bytes);
        return bytes;
    }

    /**
     * Parses an uncompressed G2 point as produced by {@link #getBytes()}; all zeros is the empty aggregate.
     * @throws IllegalArgumentException if the bytes are not a point of G2
     */
    public static Signature fromBytes(byte[] bytes) {
        checkArgument(bytes.length == SIGNATURE_LENGTH, "signature must be %s bytes, got %s", SIGNATURE_LENGTH,
                bytes.length);
        if (Arrays.equals(bytes, EMPTY_BYTES)) {
            return EMPTY;
        }
        ECP2 point = ECP2.fromBytes(bytes);
        checkArgument(!point.is_infinity(), "not a point on the curve");
        return new Signature(point);
    }

    public static Signature aggregate(List<Signature> signatures) {
        ECP2 sum = new ECP2();
        for (Signature signature : signatures) {
            sum.add(signature.point);
        }
        return new Signature(sum);
    }

    public boolean isEmpty() {
        return point.is_infinity();
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    boolean verify(ECP publicKey, byte[] message) {
        if (isEmpty()) {
            return false;
        }
        FP12 expected = PAIR.fexp(PAIR.ate(BLSKey.hashToG2(message), publicKey));
        return pairWithGenerator().equals(expected);
    }

    /**
     * Checks this aggregate against the given pairs; {@code publicKeys.get(i)} must have signed
     * {@code messages.get(i)}. A public key that does not parse makes the whole check fail.
     */
    public boolean verify(List<byte[]> publicKeys, List<byte[]> messages) {
        checkArgument(publicKeys.size() == messages.size(), "public keys and messages differ in size");
        if (publicKeys.isEmpty()) {
            return isEmpty();
        }
        if (isEmpty()) {
            return false;
        }
        FP12 product = null;
        for (int i = 0; i < publicKeys.size(); i++) {
            ECP publicKey = BLSKey.decodePublicKey(publicKeys.get(i));
            if (publicKey == null) {
                return false;
            }
            FP12 term = PAIR.ate(BLSKey.hashToG2(messages.get(i)), publicKey);
            if (product == null) {
                product = term;
            } else {
                product.mul(term);
            }
        }
        return pairWithGenerator().equals(PAIR.fexp(product));
    }

    private FP12 pairWithGenerator() {
        return PAIR.fexp(PAIR.ate(point, ECP.generator()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Signature) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return isEmpty() ? "Signature{empty}" : "Signature{" + Utils.HEX.encode(bytes, 0, 8) + "...}";
    }
}
