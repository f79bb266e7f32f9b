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

import org.coinsetj.contract.Contract;
import org.coinsetj.script.Condition;
import org.coinsetj.script.Program;
import org.coinsetj.script.Puzzles;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * <p>Describes how {@link Wallet#spendCoin(SpendableCoin, SpendRequest)} solves a coin. By default the coin
 * creates one output of {@link #getAmount()} mojos, locked to the wallet itself or to {@link #to(SpendTarget)}, and
 * optionally a second output returning the rest of the coin's value to {@link #remainder(SpendTarget)}.</p>
 *
 * <p>A request built with {@link #withArgs(Program)} instead passes the given solution to the coin's puzzle
 * verbatim. Such a request cannot also carry a recipient, an amount or a remainder.</p>
 */
public class SpendRequest {
    public static final long DEFAULT_AMOUNT = 1;

    private long amount = DEFAULT_AMOUNT;
    @Nullable private SpendTarget to;
    @Nullable private SpendTarget remainder;
    @Nullable private Program args;

    private SpendRequest() {
    }

    /** Sends one mojo back to the spending wallet. */
    public static SpendRequest standard() {
        return new SpendRequest();
    }

    public static SpendRequest forAmount(long amount) {
        return new SpendRequest().amount(amount);
    }

    public static SpendRequest withArgs(Program solution) {
        SpendRequest request = new SpendRequest();
        request.args = checkNotNull(solution);
        return request;
    }

    /** Shorthand for {@link #withArgs(Program)} with a solution that outputs {@code conditions}. */
    public static SpendRequest withConditions(List<Condition> conditions) {
        return withArgs(Puzzles.solutionForConditions(conditions));
    }

    public SpendRequest amount(long amount) {
        checkState(args == null, "amount cannot be combined with explicit arguments");
        checkArgument(amount >= 0, "negative amount: %s", amount);
        this.amount = amount;
        return this;
    }

    /**
     * Sends the output to {@code recipient} instead of back to the spending wallet.
     *
     * @throws InvalidRecipientException if {@code recipient} is null
     */
    public SpendRequest to(SpendTarget recipient) {
        checkState(args == null, "recipient cannot be combined with explicit arguments");
        this.to = checkRecipient(recipient);
        return this;
    }

    public SpendRequest to(Wallet recipient) {
        return to(SpendTarget.of(recipient));
    }

    public SpendRequest to(Contract recipient) {
        return to(SpendTarget.of(recipient));
    }

    /**
     * Returns what is left of the spent coin to {@code recipient}.
     *
     * @throws InvalidRecipientException if {@code recipient} is null
     */
    public SpendRequest remainder(SpendTarget recipient) {
        checkState(args == null, "remainder cannot be combined with explicit arguments");
        this.remainder = checkRecipient(recipient);
        return this;
    }

    public SpendRequest remainder(Wallet recipient) {
        return remainder(SpendTarget.of(recipient));
    }

    public SpendRequest remainder(Contract recipient) {
        return remainder(SpendTarget.of(recipient));
    }

    private static SpendTarget checkRecipient(@Nullable SpendTarget recipient) {
        if (recipient == null) {
            throw new InvalidRecipientException("Recipient is null");
        }
        return recipient;
    }

    public long getAmount() {
        return amount;
    }

    @Nullable
    public SpendTarget getTo() {
        return to;
    }

    @Nullable
    public SpendTarget getRemainder() {
        return remainder;
    }

    @Nullable
    public Program getArgs() {
        return args;
    }

    public boolean hasArgs() {
        return args != null;
    }

    @Override
    public String toString() {
        if (args != null) {
            return "SpendRequest{args=" + args + '}';
        }
        return "SpendRequest{amount=" + amount + ", to=" + to + ", remainder=" + remainder + '}';
    }
}
