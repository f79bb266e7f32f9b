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
import org.coinsetj.core.Bytes32;

import javax.annotation.Nullable;

/**
 * Where a spend sends value: either another wallet's standard puzzle or a contract's puzzle.
 */
public class SpendTarget {
    public enum Kind {
        WALLET,
        CONTRACT
    }

    private final Kind kind;
    private final Bytes32 puzzleHash;
    @Nullable private final Wallet wallet;
    @Nullable private final Contract contract;

    private SpendTarget(Kind kind, Bytes32 puzzleHash, @Nullable Wallet wallet, @Nullable Contract contract) {
        this.kind = kind;
        this.puzzleHash = puzzleHash;
        this.wallet = wallet;
        this.contract = contract;
    }

    /**
     * @throws InvalidRecipientException if {@code wallet} is null
     */
    public static SpendTarget of(Wallet wallet) {
        if (wallet == null) {
            throw new InvalidRecipientException("Recipient wallet is null");
        }
        return new SpendTarget(Kind.WALLET, wallet.getPuzzleHash(), wallet, null);
    }

    /**
     * @throws InvalidRecipientException if {@code contract} is null
     */
    public static SpendTarget of(Contract contract) {
        if (contract == null) {
            throw new InvalidRecipientException("Recipient contract is null");
        }
        return new SpendTarget(Kind.CONTRACT, contract.getPuzzleHash(), null, contract);
    }

    public Kind getKind() {
        return kind;
    }

    public Bytes32 getPuzzleHash() {
        return puzzleHash;
    }

    @Nullable
    public Wallet getWallet() {
        return wallet;
    }

    @Nullable
    public Contract getContract() {
        return contract;
    }

    /** The contract whose coins a payment to this target creates; a wallet target uses its standard puzzle. */
    Contract asContract(Bytes32 genesisChallenge) {
        if (contract != null) {
            return contract;
        }
        return new Contract(genesisChallenge, wallet.getPuzzle());
    }

    @Override
    public String toString() {
        return kind == Kind.WALLET ? "SpendTarget{wallet=" + wallet.getName() + '}'
                : "SpendTarget{contract=" + puzzleHash + '}';
    }
}
