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
import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.ledger.BlockResult;
import org.coinsetj.ledger.Err;
import org.coinsetj.ledger.SubmitResult;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The outcome of pushing a spend bundle: either the ledger's rejection or the coins created and destroyed by the
 * block that committed it. A rejected push never carries coins.
 */
public class SpendResult {
    @Nullable private final Err error;
    @Nullable private final String reason;
    private final ImmutableList<Coin> additions;
    private final ImmutableList<Coin> removals;

    private SpendResult(@Nullable Err error, @Nullable String reason, List<Coin> additions, List<Coin> removals) {
        this.error = error;
        this.reason = reason;
        this.additions = ImmutableList.copyOf(additions);
        this.removals = ImmutableList.copyOf(removals);
    }

    public static SpendResult success(BlockResult block) {
        return new SpendResult(null, null, block.getAdditions(), block.getRemovals());
    }

    public static SpendResult failed(SubmitResult rejection) {
        checkArgument(!rejection.isAccepted(), "submission was accepted");
        return new SpendResult(rejection.getError(), rejection.getReason(), ImmutableList.<Coin>of(),
                ImmutableList.<Coin>of());
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Nullable
    public Err getError() {
        return error;
    }

    @Nullable
    public String getReason() {
        return reason;
    }

    public List<Coin> getAdditions() {
        return additions;
    }

    public List<Coin> getRemovals() {
        return removals;
    }

    /** The created coins locked to {@code puzzleHash}, which for a wallet's puzzle hash are its new spendable coins. */
    public List<Coin> findStandardCoins(Bytes32 puzzleHash) {
        ImmutableList.Builder<Coin> found = ImmutableList.builder();
        for (Coin coin : additions) {
            if (coin.getPuzzleHash().equals(puzzleHash)) {
                found.add(coin);
            }
        }
        return found.build();
    }

    @Override
    public String toString() {
        if (!isSuccess()) {
            return "SpendResult{error=" + reason + '}';
        }
        return "SpendResult{additions=" + additions.size() + ", removals=" + removals.size() + '}';
    }
}
