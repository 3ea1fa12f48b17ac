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

package io.agilecrypt.config;

import static java.util.Objects.requireNonNull;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The data-at-rest crypto configuration: the suite catalog, the suite used for new encryptions, and the order in
 * which suites are tried when decrypting. Instances are immutable and validated on construction.
 */
public final class CryptoConfig {
    private final String activeSuiteId;
    private final List<String> decryptionAttemptOrder;
    private final Map<String, SuiteDefinition> suites;

    /**
     * Creates and validates a configuration.
     *
     * @param activeSuiteId          the hybrid suite used for all new encryptions.
     * @param decryptionAttemptOrder the suites to try, in order, when decrypting.
     * @param suites                 the suite catalog.
     * @throws ConfigurationException if the active suite or any suite in the attempt order is not in the catalog, or
     * the active suite cannot encrypt.
     */
    public CryptoConfig(String activeSuiteId, List<String> decryptionAttemptOrder,
            Collection<SuiteDefinition> suites) {
        this.activeSuiteId = requireNonNull(activeSuiteId, "activeSuiteId");
        this.decryptionAttemptOrder = List.copyOf(decryptionAttemptOrder);
        var catalog = new LinkedHashMap<String, SuiteDefinition>();
        for (var suite : suites) {
            if (catalog.put(suite.getId(), suite) != null) {
                throw new ConfigurationException("Duplicate suite id: " + suite.getId());
            }
        }
        this.suites = Collections.unmodifiableMap(catalog);

        var active = this.suites.get(activeSuiteId);
        if (active == null) {
            throw new ConfigurationException("Active encryption suite is not defined: " + activeSuiteId);
        }
        if (active.getType() != SuiteType.HYBRID) {
            throw new ConfigurationException("Active encryption suite must be a hybrid suite: " + activeSuiteId);
        }
        for (var suiteId : this.decryptionAttemptOrder) {
            if (!this.suites.containsKey(suiteId)) {
                throw new ConfigurationException("Decryption attempt order names undefined suite: " + suiteId);
            }
        }
    }

    public String getActiveSuiteId() {
        return activeSuiteId;
    }

    public SuiteDefinition getActiveSuite() {
        return suites.get(activeSuiteId);
    }

    public List<String> getDecryptionAttemptOrder() {
        return decryptionAttemptOrder;
    }

    public Map<String, SuiteDefinition> getSuites() {
        return suites;
    }

    public Optional<SuiteDefinition> getSuite(String suiteId) {
        return Optional.ofNullable(suites.get(suiteId));
    }

    /**
     * Returns a copy of this configuration with a different active suite, for rotating to a new suite while keeping
     * older data readable.
     */
    public CryptoConfig withActiveSuite(String suiteId) {
        return new CryptoConfig(suiteId, decryptionAttemptOrder, suites.values());
    }

    /**
     * Returns a copy of this configuration with a different decryption attempt order.
     */
    public CryptoConfig withDecryptionAttemptOrder(List<String> attemptOrder) {
        return new CryptoConfig(activeSuiteId, attemptOrder, suites.values());
    }

    @Override
    public String toString() {
        return "CryptoConfig{" +
                "activeSuiteId='" + activeSuiteId + '\'' +
                ", decryptionAttemptOrder=" + decryptionAttemptOrder +
                ", suites=" + suites.keySet() +
                '}';
    }
}
