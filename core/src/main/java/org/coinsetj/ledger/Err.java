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

/**
 * Reasons a ledger refuses a spend bundle.
 */
public enum Err {
    EMPTY_BUNDLE,
    TOO_MANY_SPENDS,
    UNKNOWN_UNSPENT,
    DOUBLE_SPEND,
    MEMPOOL_CONFLICT,
    WRONG_PUZZLE_HASH,
    INVALID_SOLUTION,
    INVALID_CONDITION,
    COIN_AMOUNT_NEGATIVE,
    DUPLICATE_OUTPUT,
    MINTING_COIN,
    RESERVE_FEE_CONDITION_FAILED,
    ASSERT_ANNOUNCE_CONSUMED_FAILED,
    ASSERT_MY_COIN_ID_FAILED,
    ASSERT_MY_PARENT_ID_FAILED,
    ASSERT_MY_PUZZLEHASH_FAILED,
    ASSERT_MY_AMOUNT_FAILED,
    ASSERT_SECONDS_ABSOLUTE_FAILED,
    ASSERT_HEIGHT_ABSOLUTE_FAILED,
    BAD_AGGREGATE_SIGNATURE
}
