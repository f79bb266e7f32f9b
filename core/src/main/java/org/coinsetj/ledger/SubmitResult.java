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

import javax.annotation.Nullable;

/**
 * Whether the ledger accepted a spend bundle for inclusion in the next block, and if not, why.
 */
public class SubmitResult {
    private static final SubmitResult SUCCESS = new SubmitResult(null, null);

    @Nullable private final Err error;
    @Nullable private final String detail;

    private SubmitResult(@Nullable Err error, @Nullable String detail) {
        this.error = error;
        this.detail = detail;
    }

    public static SubmitResult success() {
        return SUCCESS;
    }

    public static SubmitResult failed(Err error, @Nullable String detail) {
        return new SubmitResult(error, detail);
    }

    public boolean isAccepted() {
        return error == null;
    }

    @Nullable
    public Err getError() {
        return error;
    }

    /** Human readable reason for a rejection, or null when accepted. */
    @Nullable
    public String getReason() {
        if (error == null) {
            return null;
        }
        return detail == null ? error.name() : error.name() + ": " + detail;
    }

    @Override
    public String toString() {
        return isAccepted() ? "SubmitResult{SUCCESS}" : "SubmitResult{FAILED, " + getReason() + '}';
    }
}
