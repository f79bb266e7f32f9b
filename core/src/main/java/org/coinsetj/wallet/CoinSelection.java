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

package org.coinsetj.wallet;

import com.google.common.collect.ImmutableList;
import org.coinsetj.core.Coin;

import java.util.List;

/**
 * Represents the results of a {@link CoinSelector#select(long, List)} operation: the coins picked, ordered by
 * descending amount, and the value they sum to.
 */
public class CoinSelection {
    public final long target;
    public final long valueGathered;
    public final ImmutableList<Coin> gathered;

    public CoinSelection(long target, long valueGathered, List<Coin> gathered) {
        this.target = target;
        this.valueGathered = valueGathered;
        this.gathered = ImmutableList.copyOf(gathered);
    }

    /** True when the gathered coins cover the target. */
    public boolean isSatisfied() {
        return valueGathered >= target;
    }

    /** How much is still needed to reach the target, zero when satisfied. */
    public long getMissing() {
        return Math.max(0, target - valueGathered);
    }

    @Override
    public String toString() {
        return "CoinSelection{target=" + target + ", gathered=" + valueGathered + " in " + gathered.size() + " coins}";
    }
}
