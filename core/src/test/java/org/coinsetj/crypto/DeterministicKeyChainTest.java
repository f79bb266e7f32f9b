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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class DeterministicKeyChainTest {

    @Test
    public void sameSeedSameKeys() {
        KeyService a = DeterministicKeyChain.withDefaultSeed();
        KeyService b = new DeterministicKeyChain(DeterministicKeyChain.DEFAULT_SEED);
        for (int i = 0; i < 4; i++) {
            assertEquals(a.derive(i), b.derive(i));
        }
    }

    @Test
    public void indexesGiveDistinctKeys() {
        KeyService keys = DeterministicKeyChain.withDefaultSeed();
        assertNotEquals(keys.derive(0), keys.derive(1));
        assertTrue(keys.derive(0).hasPrivKey());
    }

    @Test
    public void keysAreCached() {
        KeyService keys = DeterministicKeyChain.withDefaultSeed();
        assertSame(keys.derive(3), keys.derive(3));
    }

    @Test
    public void otherSeedOtherKeys() {
        byte[] seed = DeterministicKeyChain.DEFAULT_SEED.clone();
        seed[0] ^= 1;
        assertNotEquals(DeterministicKeyChain.withDefaultSeed().derive(0), new DeterministicKeyChain(seed).derive(0));
    }
}
