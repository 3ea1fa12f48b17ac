/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.agilecrypt;

import static java.util.Objects.requireNonNull;

/**
 * The outcome of one decryption attempt: either the plaintext or a coarse failure reason. Reasons never include
 * details that would help distinguish a wrong key from tampered data.
 */
public final class DecryptionResult {
    public enum Reason {
        /** The data was not produced by this handler's format or suite. */
        FORMAT_MISMATCH,
        /** Authentication failed: the key is wrong or the data has been modified. */
        AUTHENTICATION_FAILED,
        /** No usable key was available for this suite. */
        INVALID_KEY,
        /** The handler for the suite could not be created. */
        ALGORITHM_UNAVAILABLE
    }

    private final byte[] plaintext;
    private final Reason reason;

    private DecryptionResult(byte[] plaintext, Reason reason) {
        this.plaintext = plaintext;
        this.reason = reason;
    }

    static DecryptionResult success(byte[] plaintext) {
        return new DecryptionResult(requireNonNull(plaintext), null);
    }

    static DecryptionResult failure(Reason reason) {
        return new DecryptionResult(null, requireNonNull(reason));
    }

    public boolean isSuccess() {
        return plaintext != null;
    }

    /**
     * The decrypted data.
     *
     * @throws IllegalStateException if decryption failed.
     */
    public byte[] getPlaintext() {
        if (plaintext == null) {
            throw new IllegalStateException("Decryption failed: " + reason);
        }
        return plaintext;
    }

    /**
     * Why decryption failed.
     *
     * @throws IllegalStateException if decryption succeeded.
     */
    public Reason getReason() {
        if (reason == null) {
            throw new IllegalStateException("Decryption succeeded");
        }
        return reason;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success" : "Failure(" + reason + ")";
    }
}
