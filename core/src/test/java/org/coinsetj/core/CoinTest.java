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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class CoinTest {
    private static final Bytes32 PARENT = Bytes32.of(new byte[]{1});
    private static final Bytes32 PUZZLE_HASH = Bytes32.of(new byte[]{2});

    @Test
    public void nameHashesParentPuzzleHashAndMinimalAmount() {
        Coin coin = new Coin(PARENT, PUZZLE_HASH, 128);
        assertEquals(Bytes32.of(PARENT.getBytes(), PUZZLE_HASH.getBytes(), new byte[]{0x00, (byte) 0x80}),
                coin.getName());
    }

    @Test
    public void zeroAmountIsEncodedAsNothing() {
        Coin coin = new Coin(PARENT, PUZZLE_HASH, 0);
        assertEquals(Bytes32.of(PARENT.getBytes(), PUZZLE_HASH.getBytes()), coin.getName());
    }

    @Test
    public void nameDependsOnEveryField() {
        Coin coin = new Coin(PARENT, PUZZLE_HASH, 5);
        assertEquals(coin.getName(), new Coin(PARENT, PUZZLE_HASH, 5).getName());
        assertNotEquals(coin.getName(), new Coin(PUZZLE_HASH, PUZZLE_HASH, 5).getName());
        assertNotEquals(coin.getName(), new Coin(PARENT, PARENT, 5).getName());
        assertNotEquals(coin.getName(), new Coin(PARENT, PUZZLE_HASH, 6).getName());
    }

    @Test
    public void equality() {
        assertEquals(new Coin(PARENT, PUZZLE_HASH, 5), new Coin(PARENT, PUZZLE_HASH, 5));
        assertEquals(new Coin(PARENT, PUZZLE_HASH, 5).hashCode(), new Coin(PARENT, PUZZLE_HASH, 5).hashCode());
        assertNotEquals(new Coin(PARENT, PUZZLE_HASH, 5), new Coin(PARENT, PUZZLE_HASH, 4));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeAmount() {
        new Coin(PARENT, PUZZLE_HASH, -1);
    }
}
