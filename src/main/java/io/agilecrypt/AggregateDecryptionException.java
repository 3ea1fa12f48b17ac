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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thrown by {@link AgileOrchestrator#decryptWithAgility(byte[], io.agilecrypt.config.CryptoConfig, KeySource)} once
 * every candidate suite has failed. The exception only records which suites were attempted and the coarse reason
 * each one gave. It never carries key material or partial plaintext, and the message is the same whatever the
 * underlying failures were.
 */
public class AggregateDecryptionException extends AgileCryptoException {
    private final Map<String, DecryptionResult.Reason> failures;

    public AggregateDecryptionException(Map<String, DecryptionResult.Reason> failures) {
        super("Unable to decrypt data");
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /**
     * The suite ids that were attempted, in the order they were tried.
     *
     * @return the attempted suite ids.
     */
    public List<String> getAttemptedSuiteIds() {
        return List.copyOf(failures.keySet());
    }

    public Map<String, DecryptionResult.Reason> getFailures() {
        return failures;
    }
}
