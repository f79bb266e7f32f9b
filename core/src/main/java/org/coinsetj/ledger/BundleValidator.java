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
import com.google.common.math.LongMath;
import org.coinsetj.core.Bytes32;
import org.coinsetj.core.Coin;
import org.coinsetj.core.CoinRecord;
import org.coinsetj.core.CoinSpend;
import org.coinsetj.core.NetworkParameters;
import org.coinsetj.core.SpendBundle;
import org.coinsetj.core.Utils;
import org.coinsetj.crypto.BLSKey;
import org.coinsetj.script.Condition;
import org.coinsetj.script.Puzzles;
import org.coinsetj.script.ScriptException;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Checks a spend bundle against a coin set: every input must exist unspent and unclaimed by a pending bundle,
 * every puzzle must run, every assertion must hold, value must not be minted and the aggregate signature must
 * cover every AGG_SIG condition. The first failing check decides the rejection reason.
 */
class BundleValidator {
    private final NetworkParameters params;

    BundleValidator(NetworkParameters params) {
        this.params = checkNotNull(params);
    }

    static class Result {
        @Nullable final Err error;
        @Nullable final String detail;
        final ImmutableList<Coin> additions;
        final long fee;

        private Result(@Nullable Err error, @Nullable String detail, List<Coin> additions, long fee) {
            this.error = error;
            this.detail = detail;
            this.additions = ImmutableList.copyOf(additions);
            this.fee = fee;
        }

        static Result failed(Err error, String detail) {
            return new Result(error, detail, ImmutableList.<Coin>of(), 0);
        }

        boolean isValid() {
            return error == null;
        }
    }

    /**
     * @param coins           every coin the ledger knows, by name
     * @param pendingRemovals names of coins already spent by queued bundles
     * @param pendingAdditions names of coins queued bundles will create
     * @param height          height of the last farmed block
     * @param timestamp       current ledger time
     */
    Result validate(SpendBundle bundle, Map<Bytes32, CoinRecord> coins, Set<Bytes32> pendingRemovals,
                    Set<Bytes32> pendingAdditions, long height, long timestamp) {
        List<CoinSpend> spends = bundle.getCoinSpends();
        if (spends.isEmpty()) {
            return Result.failed(Err.EMPTY_BUNDLE, "bundle has no spends");
        }
        if (spends.size() > params.getMaxSpendsPerBundle()) {
            return Result.failed(Err.TOO_MANY_SPENDS, spends.size() + " spends");
        }

        Set<Bytes32> removals = new HashSet<>();
        for (CoinSpend spend : spends) {
            Coin coin = spend.getCoin();
            Bytes32 name = coin.getName();
            if (!removals.add(name)) {
                return Result.failed(Err.DOUBLE_SPEND, name + " spent twice in one bundle");
            }
            CoinRecord record = coins.get(name);
            if (record == null) {
                return Result.failed(Err.UNKNOWN_UNSPENT, name.toString());
            }
            if (record.isSpent()) {
                return Result.failed(Err.DOUBLE_SPEND, name + " was spent at height " + record.getSpentBlockIndex());
            }
            if (pendingRemovals.contains(name)) {
                return Result.failed(Err.MEMPOOL_CONFLICT, name.toString());
            }
            if (!spend.getPuzzleReveal().getTreeHash().equals(coin.getPuzzleHash())) {
                return Result.failed(Err.WRONG_PUZZLE_HASH, name.toString());
            }
        }

        List<Coin> additions = new ArrayList<>();
        Set<Bytes32> additionNames = new HashSet<>();
        Set<Bytes32> announcements = new HashSet<>();
        List<Bytes32> assertedAnnouncements = new ArrayList<>();
        List<byte[]> publicKeys = new ArrayList<>();
        List<byte[]> messages = new ArrayList<>();
        long inputs = 0;
        long outputs = 0;
        long reservedFee = 0;

        for (CoinSpend spend : spends) {
            Coin coin = spend.getCoin();
            Bytes32 name = coin.getName();
            List<Condition> conditions;
            try {
                conditions = Puzzles.run(spend.getPuzzleReveal(), spend.getSolution(), coin);
            } catch (ScriptException x) {
                return Result.failed(Err.INVALID_SOLUTION, name + ": " + x.getMessage());
            }
            inputs = LongMath.checkedAdd(inputs, coin.getAmount());
            try {
                for (Condition condition : conditions) {
                    switch (condition.getOpcode()) {
                        case CREATE_COIN: {
                            long amount = condition.getInt(1);
                            if (amount < 0) {
                                return Result.failed(Err.COIN_AMOUNT_NEGATIVE, name + " creates " + amount);
                            }
                            Coin addition = new Coin(name, condition.getBytes32(0), amount);
                            Bytes32 additionName = addition.getName();
                            if (!additionNames.add(additionName) || coins.containsKey(additionName)
                                    || pendingAdditions.contains(additionName)) {
                                return Result.failed(Err.DUPLICATE_OUTPUT, additionName.toString());
                            }
                            additions.add(addition);
                            try {
                                outputs = LongMath.checkedAdd(outputs, amount);
                            } catch (ArithmeticException x) {
                                return Result.failed(Err.MINTING_COIN, "output value overflows");
                            }
                            break;
                        }
                        case RESERVE_FEE:
                            reservedFee = LongMath.saturatedAdd(reservedFee, condition.getInt(0));
                            break;
                        case CREATE_COIN_ANNOUNCEMENT:
                            announcements.add(Condition.coinAnnouncementId(name, condition.getArg(0)));
                            break;
                        case CREATE_PUZZLE_ANNOUNCEMENT:
                            announcements.add(Condition.puzzleAnnouncementId(coin.getPuzzleHash(), condition.getArg(0)));
                            break;
                        case ASSERT_COIN_ANNOUNCEMENT:
                        case ASSERT_PUZZLE_ANNOUNCEMENT:
                            assertedAnnouncements.add(condition.getBytes32(0));
                            break;
                        case ASSERT_MY_COIN_ID:
                            if (!condition.getBytes32(0).equals(name)) {
                                return Result.failed(Err.ASSERT_MY_COIN_ID_FAILED, name.toString());
                            }
                            break;
                        case ASSERT_MY_PARENT_ID:
                            if (!condition.getBytes32(0).equals(coin.getParentCoinInfo())) {
                                return Result.failed(Err.ASSERT_MY_PARENT_ID_FAILED, name.toString());
                            }
                            break;
                        case ASSERT_MY_PUZZLEHASH:
                            if (!condition.getBytes32(0).equals(coin.getPuzzleHash())) {
                                return Result.failed(Err.ASSERT_MY_PUZZLEHASH_FAILED, name.toString());
                            }
                            break;
                        case ASSERT_MY_AMOUNT:
                            if (condition.getInt(0) != coin.getAmount()) {
                                return Result.failed(Err.ASSERT_MY_AMOUNT_FAILED, name.toString());
                            }
                            break;
                        case ASSERT_SECONDS_ABSOLUTE: {
                            long required = condition.getInt(0);
                            if (timestamp < required) {
                                return Result.failed(Err.ASSERT_SECONDS_ABSOLUTE_FAILED,
                                        "time " + timestamp + " is before " + required);
                            }
                            break;
                        }
                        case ASSERT_HEIGHT_ABSOLUTE: {
                            long required = condition.getInt(0);
                            if (height < required) {
                                return Result.failed(Err.ASSERT_HEIGHT_ABSOLUTE_FAILED,
                                        "height " + height + " is below " + required);
                            }
                            break;
                        }
                        case AGG_SIG_ME:
                            publicKeys.add(publicKeyArg(condition));
                            messages.add(Utils.concat(condition.getArg(1), name.getBytes(),
                                    params.getAggSigMeAdditionalData().getBytes()));
                            break;
                        case AGG_SIG_UNSAFE:
                            publicKeys.add(publicKeyArg(condition));
                            messages.add(condition.getArg(1));
                            break;
                        default:
                            throw new ScriptException("unhandled condition " + condition.getOpcode());
                    }
                }
            } catch (ScriptException x) {
                return Result.failed(Err.INVALID_CONDITION, name + ": " + x.getMessage());
            }
        }

        for (Bytes32 announcement : assertedAnnouncements) {
            if (!announcements.contains(announcement)) {
                return Result.failed(Err.ASSERT_ANNOUNCE_CONSUMED_FAILED, announcement.toString());
            }
        }
        if (outputs > inputs) {
            return Result.failed(Err.MINTING_COIN, "outputs " + outputs + " exceed inputs " + inputs);
        }
        long fee = inputs - outputs;
        if (fee < reservedFee) {
            return Result.failed(Err.RESERVE_FEE_CONDITION_FAILED, "fee " + fee + " is below " + reservedFee);
        }
        if (!bundle.getAggregatedSignature().verify(publicKeys, messages)) {
            return Result.failed(Err.BAD_AGGREGATE_SIGNATURE, publicKeys.size() + " signatures expected");
        }
        return new Result(null, null, additions, fee);
    }

    private static byte[] publicKeyArg(Condition condition) {
        byte[] publicKey = condition.getArg(0);
        if (publicKey.length != BLSKey.PUBLIC_KEY_LENGTH) {
            throw new ScriptException("bad public key length " + publicKey.length);
        }
        return publicKey;
    }
}
