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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A puzzle hash rendered as a Bech32m string behind a human-readable prefix, for example {@code xch1...}.
 */
public class Address {
    private final String prefix;
    private final Bytes32 puzzleHash;

    public Address(String prefix, Bytes32 puzzleHash) {
        this.prefix = checkNotNull(prefix);
        this.puzzleHash = checkNotNull(puzzleHash);
    }

    public static Address fromPuzzleHash(NetworkParameters params, Bytes32 puzzleHash) {
        return new Address(params.getAddressPrefix(), puzzleHash);
    }

    /**
     * Parses an address of any prefix.
     *
     * @throws AddressFormatException if the string is not Bech32m or does not carry a 32 byte puzzle hash
     */
    public static Address fromString(String address) throws AddressFormatException {
        Bech32.Bech32Data decoded = Bech32.decode(address);
        byte[] puzzleHash = Bech32.convertBits(decoded.data, 5, 8, false);
        if (puzzleHash.length != Bytes32.LENGTH) {
            throw new AddressFormatException("Address carries " + puzzleHash.length + " bytes, expected " + Bytes32.LENGTH);
        }
        return new Address(decoded.hrp, Bytes32.wrap(puzzleHash));
    }

    public static String encodePuzzleHash(Bytes32 puzzleHash, String prefix) {
        return new Address(prefix, puzzleHash).toString();
    }

    public static Bytes32 decodePuzzleHash(String address) throws AddressFormatException {
        return fromString(address).getPuzzleHash();
    }

    public String getPrefix() {
        return prefix;
    }

    public Bytes32 getPuzzleHash() {
        return puzzleHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Address other = (Address) o;
        return prefix.equals(other.prefix) && puzzleHash.equals(other.puzzleHash);
    }

    @Override
    public int hashCode() {
        return 31 * prefix.hashCode() + puzzleHash.hashCode();
    }

    @Override
    public String toString() {
        return Bech32.encode(prefix, Bech32.convertBits(puzzleHash.getBytes(), 8, 5, true));
    }
}
