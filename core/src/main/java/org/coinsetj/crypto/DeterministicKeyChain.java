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

import javax.annotation.concurrent.GuardedBy;
import java.util.HashMap;

/**
 * A {@link KeyService} deriving every key from one seed along {@code m/12381'/8444'/2'/index'}.
 */
public class DeterministicKeyChain implements KeyService {
    /** Seed used when none is given, so that simulated sessions are reproducible. */
    public static final byte[] DEFAULT_SEED =
            Utils.HEX.decode("0a0b0c0d0e0f101112131415161718191a1b1c1d1e1f202122232425262728292a");

    private static final int PURPOSE = 12381;
    private static final int COIN_TYPE = 8444;
    private static final int ACCOUNT = 2;

    private final HDKeyDerivation.RawKeyBytes account;
    @GuardedBy("this")
    private final HashMap<Integer, BLSKey> keys = new HashMap<>();

    public DeterministicKeyChain(byte[] seed) {
        HDKeyDerivation.RawKeyBytes master = HDKeyDerivation.createMasterPrivateKey(seed);
        this.account = HDKeyDerivation.derivePath(master, PURPOSE, COIN_TYPE, ACCOUNT);
    }

    public static DeterministicKeyChain withDefaultSeed() {
        return new DeterministicKeyChain(DEFAULT_SEED);
    }

    @Override
    public synchronized BLSKey derive(int index) {
        BLSKey key = keys.get(index);
        if (key == null) {
            key = BLSKey.fromPrivate(HDKeyDerivation.deriveChildKey(account, index).keyBytes);
            keys.put(index, key);
        }
        return key;
    }
}
