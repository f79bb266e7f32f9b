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

import org.coinsetj.core.Coin;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * <p>Single pass selector that keeps the gathered coins sorted by descending amount. Each candidate is inserted
 * in front of the first strictly smaller coin, so it lands after coins of equal amount. After every insertion the
 * smallest kept coins are dropped for as long as the rest still covers the target.</p>
 *
 * <p>The result is minimal in the sense that dropping its smallest coin would fall short of the target, but it is
 * not the globally smallest covering subset. Which coins get combined downstream depends on this exact
 * policy.</p>
 */
public class GreedyCoinSelector implements CoinSelector {
    private static final GreedyCoinSelector instance = new GreedyCoinSelector();

    public static GreedyCoinSelector get() {
        return instance;
    }

    protected GreedyCoinSelector() {
    }

    @Override
    public CoinSelection select(long target, List<Coin> candidates) {
        checkArgument(target >= 0, "negative target: %s", target);
        ArrayList<Coin> kept = new ArrayList<>();
        long total = 0;
        for (Coin coin : candidates) {
            insert(kept, coin);
            total += coin.getAmount();
            while (!kept.isEmpty() && total - kept.get(kept.size() - 1).getAmount() >= target) {
                total -= kept.remove(kept.size() - 1).getAmount();
            }
        }
        return new CoinSelection(target, total, kept);
    }

    private static void insert(List<Coin> kept, Coin coin) {
        for (int i = 0; i < kept.size(); i++) {
            if (kept.get(i).getAmount() < coin.getAmount()) {
                kept.add(i, coin);
                return;
            }
        }
        kept.add(coin);
    }
}
