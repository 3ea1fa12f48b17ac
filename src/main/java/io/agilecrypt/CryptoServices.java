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

import io.agilecrypt.config.CryptoConfig;
import io.agilecrypt.config.SuiteDefinition;

/**
 * Wires the crypto subsystem together from a configuration: registers a handler for every configured suite and
 * checks that the active suite can be used before any data is encrypted.
 */
public final class CryptoServices {
    private static final RedactedLogger logger = RedactedLogger.getLogger(CryptoServices.class);

    private final CryptoConfig config;
    private final AlgorithmProvider provider;
    private final HandlerRegistry registry;
    private final KeyManager keyManager;
    private final AgileOrchestrator orchestrator;

    private CryptoServices(CryptoConfig config, AlgorithmProvider provider) {
        this.config = requireNonNull(config, "config");
        this.provider = requireNonNull(provider, "provider");
        this.registry = new HandlerRegistry();
        this.keyManager = new KeyManager(provider);
        this.orchestrator = new AgileOrchestrator(registry);
    }

    public static CryptoServices create(CryptoConfig config) {
        return create(config, AlgorithmProvider.defaults());
    }

    /**
     * Registers handlers for every suite in the configuration.
     *
     * @param config   the configuration.
     * @param provider the algorithms available to hybrid suites.
     * @return the wired services.
     * @throws AlgorithmUnavailableException if the active suite names an algorithm the provider does not offer.
     */
    public static CryptoServices create(CryptoConfig config, AlgorithmProvider provider) {
        var services = new CryptoServices(config, provider);
        for (var suite : config.getSuites().values()) {
            services.register(suite);
        }
        // Fail fast: nothing can be encrypted without the active handler
        services.registry.getHandler(config.getActiveSuiteId());
        logger.info("Crypto services ready: active suite {}, registered suites {}", config.getActiveSuiteId(),
                services.registry.registeredSuiteIds());
        return services;
    }

    private void register(SuiteDefinition suite) {
        switch (suite.getType()) {
            case HYBRID:
                try {
                    registry.register(suite.getId(), HybridCryptoHandler.factory(suite, provider));
                } catch (AlgorithmUnavailableException e) {
                    if (suite.getId().equals(config.getActiveSuiteId())) {
                        throw e;
                    }
                    logger.warn("Suite {} is unavailable and will be skipped: {}", suite.getId(), e.getMessage());
                }
                break;
            case LEGACY_OPENPGP:
                registry.register(suite.getId(), () -> new LegacyOpenPgpHandler(suite.getId()));
                break;
            default:
                throw new IllegalStateException("Unsupported suite type: " + suite.getType());
        }
    }

    public CryptoConfig config() {
        return config;
    }

    public HandlerRegistry registry() {
        return registry;
    }

    public KeyManager keyManager() {
        return keyManager;
    }

    public AgileOrchestrator orchestrator() {
        return orchestrator;
    }

    /**
     * Encrypts data with the active suite.
     */
    public byte[] encrypt(byte[] plaintext, KeySource keys) {
        return orchestrator.encryptActive(plaintext, config, keys);
    }

    /**
     * Decrypts data produced by any configured suite.
     */
    public byte[] decrypt(byte[] data, KeySource keys) {
        return orchestrator.decryptWithAgility(data, config, keys);
    }
}
