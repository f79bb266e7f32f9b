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

import com.google.common.collect.ImmutableList;
import org.coinsetj.crypto.Signature;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A transaction: spend records the ledger commits all together or not at all, plus one aggregate signature
 * covering every signature the spends require.
 */
public class SpendBundle {
    private final ImmutableList<CoinSpend> coinSpends;
    private final Signature aggregatedSignature;

    public SpendBundle(List<CoinSpend> coinSpends, Signature aggregatedSignature) {
        this.coinSpends = ImmutableList.copyOf(coinSpends);
        this.aggregatedSignature = checkNotNull(aggregatedSignature);
    }

    public List<CoinSpend> getCoinSpends() {
        return coinSpends;
    }

    public Signature getAggregatedSignature() {
        return aggregatedSignature;
    }

    /** The coins this bundle consumes, in spend order. */
    public List<Coin> removals() {
        ImmutableList.Builder<Coin> removals = ImmutableList.builder();
        for (CoinSpend spend : coinSpends) {
            removals.add(spend.getCoin());
        }
        return removals.build();
    }

    /** Hash over the ids of the spent coins and the signature, used to identify a bundle in logs. */
    public Bytes32 name() {
        byte[][] parts = new byte[coinSpends.size() + 1][];
        for (int i = 0; i < coinSpends.size(); i++) {
            parts[i] = coinSpends.get(i).getCoin().getName().getBytes();
        }
        parts[coinSpends.size()] = aggregatedSignature.getBytes();
        return Bytes32.of(parts);
    }

    @Override
    public String toString() {
        return "SpendBundle{spends=" + coinSpends + ", signature=" + aggregatedSignature + '}';
    }
}
