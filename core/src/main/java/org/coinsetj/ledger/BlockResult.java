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

package org.coinsetj.ledger;

import com.google.common.collect.ImmutableList;
import org.coinsetj.core.Coin;

import java.util.List;

/**
 * The coins one farmed block created and destroyed.
 */
public class BlockResult {
    private final long height;
    private final ImmutableList<Coin> additions;
    private final ImmutableList<Coin> removals;

    public BlockResult(long height, List<Coin> additions, List<Coin> removals) {
        this.height = height;
        this.additions = ImmutableList.copyOf(additions);
        this.removals = ImmutableList.copyOf(removals);
    }

    public long getHeight() {
        return height;
    }

    public List<Coin> getAdditions() {
        return additions;
    }

    public List<Coin> getRemovals() {
        return removals;
    }

    @Override
    public String toString() {
        return "BlockResult{height=" + height + ", additions=" + additions.size() + ", removals=" + removals.size() + '}';
    }
}
