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
import org.coinsetj.core.CoinSpend;
import org.coinsetj.core.NetworkParameters;
import org.coinsetj.core.SpendBundle;
import org.coinsetj.core.Utils;
import org.coinsetj.crypto.BLSKey;
import org.coinsetj.crypto.Signature;
import org.coinsetj.script.Condition;
import org.coinsetj.script.Puzzles;
import org.coinsetj.script.ScriptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Signs coin spends with one key. Each puzzle is run locally to find the AGG_SIG conditions it will output, and
 * every one of them is signed; a condition asking for a different key is a programming error.
 */
public class BundleSigner {
    private static final Logger log = LoggerFactory.getLogger(BundleSigner.class);

    private final NetworkParameters params;
    private final BLSKey key;

    public BundleSigner(NetworkParameters params, BLSKey key) {
        this.params = checkNotNull(params);
        this.key = checkNotNull(key);
        checkArgument(key.hasPrivKey(), "signing key has no private key");
    }

    public Signature sign(CoinSpend spend) {
        List<Condition> conditions;
        try {
            conditions = Puzzles.run(spend.getPuzzleReveal(), spend.getSolution(), spend.getCoin());
        } catch (ScriptException x) {
            // the ledger will reject it with the same error
            log.warn("Cannot run puzzle of {}, leaving it unsigned: {}", spend.getCoin().getName(), x.getMessage());
            return Signature.EMPTY;
        }
        List<Signature> signatures = new ArrayList<>();
        for (Condition condition : conditions) {
            switch (condition.getOpcode()) {
                case AGG_SIG_ME:
                    checkOwnKey(condition.getArg(0));
                    signatures.add(key.sign(Utils.concat(condition.getArg(1), spend.getCoin().getName().getBytes(),
                            params.getAggSigMeAdditionalData().getBytes())));
                    break;
                case AGG_SIG_UNSAFE:
                    checkOwnKey(condition.getArg(0));
                    signatures.add(key.sign(condition.getArg(1)));
                    break;
                default:
                    break;
            }
        }
        return Signature.aggregate(signatures);
    }

    /** Signs every spend and aggregates the signatures into one bundle. */
    public SpendBundle signBundle(List<CoinSpend> spends) {
        List<Signature> signatures = new ArrayList<>(spends.size());
        for (CoinSpend spend : spends) {
            signatures.add(sign(spend));
        }
        return new SpendBundle(ImmutableList.copyOf(spends), Signature.aggregate(signatures));
    }

    private void checkOwnKey(byte[] publicKey) {
        if (!Arrays.equals(publicKey, key.getPubKey())) {
            throw new IllegalArgumentException("Spend needs a signature from " + Utils.HEX.encode(publicKey)
                    + " but this signer holds " + Utils.HEX.encode(key.getPubKey()));
        }
    }
}
