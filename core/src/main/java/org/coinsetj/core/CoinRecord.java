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
 * What the ledger knows about a coin: when it was created and whether, and when, it was spent.
 */
public class CoinRecord {
    private final Coin coin;
    private final long confirmedBlockIndex;
    private final long spentBlockIndex;
    private final boolean coinbase;
    private final long timestamp;

    public CoinRecord(Coin coin, long confirmedBlockIndex, long spentBlockIndex, boolean coinbase, long timestamp) {
        this.coin = checkNotNull(coin);
        this.confirmedBlockIndex = confirmedBlockIndex;
        this.spentBlockIndex = spentBlockIndex;
        this.coinbase = coinbase;
        this.timestamp = timestamp;
    }

    /** Returns a copy of this record marked as spent at {@code height}. */
    public CoinRecord spentAt(long height) {
        return new CoinRecord(coin, confirmedBlockIndex, height, coinbase, timestamp);
    }

    public Coin getCoin() {
        return coin;
    }

    public Bytes32 getName() {
        return coin.getName();
    }

    public long getConfirmedBlockIndex() {
        return confirmedBlockIndex;
    }

    /** Height the coin was spent at, or 0 while it is unspent. */
    public long getSpentBlockIndex() {
        return spentBlockIndex;
    }

    public boolean isSpent() {
        return spentBlockIndex > 0;
    }

    /** True for pool and farmer rewards, which have no spend as parent. */
    public boolean isCoinbase() {
        return coinbase;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "CoinRecord{" +
                "coin=" + coin +
                ", confirmed=" + confirmedBlockIndex +
                ", spent=" + spentBlockIndex +
                ", coinbase=" + coinbase +
                ", timestamp=" + timestamp +
                '}';
    }
}
