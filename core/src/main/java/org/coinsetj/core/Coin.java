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

import java.io.Serializable;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A discrete unit of value locked by a puzzle. A coin is identified by the id of the coin that created it,
 * the hash of its puzzle and its amount; its name (coin id) is the hash of those three fields, so it is
 * never assigned, only computed.
 */
public class Coin implements Serializable {
    private final Bytes32 parentCoinInfo;
    private final Bytes32 puzzleHash;
    private final long amount;

    private transient Bytes32 name;

    public Coin(Bytes32 parentCoinInfo, Bytes32 puzzleHash, long amount) {
        this.parentCoinInfo = checkNotNull(parentCoinInfo);
        this.puzzleHash = checkNotNull(puzzleHash);
        checkArgument(amount >= 0, "coin amount cannot be negative: %s", amount);
        this.amount = amount;
    }

    public Bytes32 getParentCoinInfo() {
        return parentCoinInfo;
    }

    public Bytes32 getPuzzleHash() {
        return puzzleHash;
    }

    public long getAmount() {
        return amount;
    }

    /** The coin id: sha256(parent coin info + puzzle hash + amount). */
    public Bytes32 getName() {
        if (name == null) {
            name = Bytes32.of(parentCoinInfo.getBytes(), puzzleHash.getBytes(), Utils.encodeInt(amount));
        }
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Coin other = (Coin) o;
        return amount == other.amount && parentCoinInfo.equals(other.parentCoinInfo)
                && puzzleHash.equals(other.puzzleHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentCoinInfo, puzzleHash, amount);
    }

    @Override
    public String toString() {
        return "Coin{" +
                "name=" + getName() +
                ", parent=" + parentCoinInfo +
                ", puzzleHash=" + puzzleHash +
                ", amount=" + amount +
                '}';
    }
}
