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

import java.util.List;

/**
 * A CoinSelector is responsible for picking some coins to spend, from the list of all spendable coins. The select
 * operation may return a {@link CoinSelection} whose value is lower than the requested target if there is not
 * enough value available; callers check {@link CoinSelection#isSatisfied()}.
 */
public interface CoinSelector {
    CoinSelection select(long target, List<Coin> candidates);
}
