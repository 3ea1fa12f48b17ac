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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.agilecrypt.DecryptionResult.Reason;
import io.agilecrypt.config.CryptoConfig;

/**
 * The entry point for encrypting and decrypting data at rest. New data is always encrypted with the configured active
 * suite. Data of unknown origin is decrypted by trying handlers in turn until one succeeds.
 * <p>
 * Decryption runs a small state machine. It starts in {@code PARSING}, where the bundle header (if any) is read once.
 * It then moves through {@code TRYING(0)}, {@code TRYING(1)}, ... over the candidate suites: the suite named in the
 * header first, followed by the configured attempt order with duplicates removed. If the header cannot be read the
 * raw bytes are offered to every handler in the attempt order, which is how legacy data is recognised. The first
 * successful attempt ends in {@code SUCCESS}; if every attempt fails the result is {@code EXHAUSTED} and an
 * {@link AggregateDecryptionException} is thrown.
 */
public final class AgileOrchestrator {
    private static final RedactedLogger logger = RedactedLogger.getLogger(AgileOrchestrator.class);

    enum State {
        PARSING, TRYING, SUCCESS, EXHAUSTED
    }

    private final HandlerRegistry registry;

    public AgileOrchestrator(HandlerRegistry registry) {
        this.registry = requireNonNull(registry, "registry");
    }

    /**
     * Encrypts data with the active suite.
     *
     * @param plaintext the data to encrypt.
     * @param config    the configuration naming the active suite.
     * @param keys      the source of the recipient keys.
     * @return the serialized bundle.
     * @throws HandlerNotFoundException if no handler is registered for the active suite.
     */
    public byte[] encryptActive(byte[] plaintext, CryptoConfig config, KeySource keys) {
        var suiteId = config.getActiveSuiteId();
        var bundle = registry.getHandler(suiteId).encrypt(plaintext, keys);
        logger.debug("Encrypted data with active suite {}", suiteId);
        return BundleCodec.serialize(bundle);
    }

    /**
     * Decrypts data produced by any registered suite.
     *
     * @param data   the encrypted data.
     * @param config the configuration giving the decryption attempt order.
     * @param keys   the source of decryption keys.
     * @return the plaintext.
     * @throws AggregateDecryptionException if no handler could decrypt the data.
     */
    public byte[] decryptWithAgility(byte[] data, CryptoConfig config, KeySource keys) {
        var state = State.PARSING;
        var candidates = candidateSuites(data, config);

        Map<String, Reason> failures = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            state = transition(state, State.TRYING, i);
            var suiteId = candidates.get(i);
            var result = attempt(suiteId, data, keys);
            if (result == null) {
                continue;
            }
            if (result.isSuccess()) {
                transition(state, State.SUCCESS, i);
                logger.debug("Decrypted data with suite {} after {} failed attempts", suiteId, failures.size());
                return result.getPlaintext();
            }
            failures.put(suiteId, result.getReason());
        }

        transition(state, State.EXHAUSTED, candidates.size());
        logger.info("Decryption failed with all attempted suites {}", failures.keySet());
        throw new AggregateDecryptionException(failures);
    }

    /**
     * Tries one suite. Returns null if the suite is not registered, in which case it is skipped.
     */
    private DecryptionResult attempt(String suiteId, byte[] data, KeySource keys) {
        CryptoHandler handler;
        try {
            handler = registry.getHandler(suiteId);
        } catch (HandlerNotFoundException e) {
            logger.warn("Skipping suite {} in decryption attempt order: no handler registered", suiteId);
            return null;
        } catch (AlgorithmUnavailableException e) {
            logger.warn("Skipping suite {} in decryption attempt order: {}", suiteId, e.getMessage());
            return DecryptionResult.failure(Reason.ALGORITHM_UNAVAILABLE);
        }
        return handler.decrypt(data, keys);
    }

    private static State transition(State from, State to, int attempt) {
        if (logger.isTraceEnabled()) {
            logger.trace("Decryption state {} -> {}", from, to == State.TRYING ? "TRYING(" + attempt + ")" : to);
        }
        return to;
    }

    /**
     * Lists the suites to try, in order: the registered suite named in the bundle header, if there is one, followed
     * by the configured attempt order.
     */
    List<String> candidateSuites(byte[] data, CryptoConfig config) {
        var candidates = new ArrayList<String>();
        var header = BundleCodec.peekHeader(data);
        if (header.isPresent() && registry.isRegistered(header.get().suiteId())) {
            candidates.add(header.get().suiteId());
        } else {
            logger.debug("No registered suite named in header, offering raw data to each handler");
        }
        for (var suiteId : config.getDecryptionAttemptOrder()) {
            if (!candidates.contains(suiteId)) {
                candidates.add(suiteId);
            }
        }
        return candidates;
    }
}
