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

import org.coinsetj.core.Bytes32;
import org.coinsetj.core.CoinRecord;
import org.coinsetj.core.SpendBundle;

import javax.annotation.Nullable;
import java.util.List;

/**
 * The ledger a session drives: it validates and commits spend bundles, farms blocks and answers coin queries.
 * Implementations decide how puzzles are evaluated; wallets never talk to a ledger directly.
 */
public interface LedgerService extends AutoCloseable {

    /** Validates {@code bundle} and queues it for the next block, or explains why it was refused. */
    SubmitResult submit(SpendBundle bundle);

    /**
     * Farms one block containing every queued bundle; the block rewards and fees are locked to
     * {@code rewardPuzzleHash}.
     */
    BlockResult farmBlock(Bytes32 rewardPuzzleHash);

    List<CoinRecord> getCoinRecordsByPuzzleHash(Bytes32 puzzleHash, boolean includeSpent);

    @Nullable
    CoinRecord getCoinRecordByName(Bytes32 name);

    /** Height of the last farmed block, 0 before the first. */
    long getHeight();

    /** Ledger clock in seconds since the epoch. */
    long getTimestamp();

    void passTime(long seconds);

    /** Releases the ledger; any later call fails. Closing twice is harmless. */
    @Override
    void close();
}
