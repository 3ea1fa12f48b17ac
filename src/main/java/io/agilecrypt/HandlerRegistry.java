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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps suite ids to crypto handlers. Handlers can be registered directly or as a {@link HandlerFactory}; a factory is
 * invoked the first time its handler is requested and the resulting instance replaces it, so there is at most one
 * live handler per suite id even under concurrent access.
 * <p>
 * Registration is expected to happen once at startup, before any encryption or decryption. {@link #reset()} exists
 * to isolate tests from each other.
 */
public final class HandlerRegistry {
    private static final RedactedLogger logger = RedactedLogger.getLogger(HandlerRegistry.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    public void register(String suiteId, CryptoHandler handler) {
        requireNonNull(handler, "handler");
        put(suiteId, new Entry(suiteId, handler, null));
    }

    public void register(String suiteId, HandlerFactory factory) {
        requireNonNull(factory, "factory");
        put(suiteId, new Entry(suiteId, null, factory));
    }

    private void put(String suiteId, Entry entry) {
        requireNonNull(suiteId, "suiteId");
        if (entries.put(suiteId, entry) != null) {
            logger.warn("Replacing existing crypto handler registration for suite {}", suiteId);
        } else {
            logger.debug("Registered crypto handler for suite {}", suiteId);
        }
    }

    /**
     * Returns the handler for a suite, creating it from its factory on first use.
     *
     * @param suiteId the suite id.
     * @return the handler.
     * @throws HandlerNotFoundException      if nothing is registered for the suite.
     * @throws AlgorithmUnavailableException if the handler's factory fails.
     */
    public CryptoHandler getHandler(String suiteId) {
        var entry = entries.get(suiteId);
        if (entry == null) {
            throw new HandlerNotFoundException(suiteId);
        }
        return entry.get();
    }

    public boolean isRegistered(String suiteId) {
        return entries.containsKey(suiteId);
    }

    public Set<String> registeredSuiteIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(entries.keySet()));
    }

    /**
     * Finds the handler for some encrypted data by peeking at its header, without parsing the rest of it.
     *
     * @param data the encrypted data.
     * @return the handler for the suite named in the header, or an empty result if the header cannot be read or
     * names an unregistered suite. Callers then fall back to trying handlers in turn, which is how legacy formats
     * without a bundle header are decrypted.
     */
    public Optional<CryptoHandler> selectHandlerForBytes(byte[] data) {
        return BundleCodec.peekHeader(data)
                .map(BundleHeader::suiteId)
                .filter(entries::containsKey)
                .map(this::getHandler);
    }

    /**
     * Removes all registrations. Only for use between tests.
     */
    public void reset() {
        entries.clear();
    }

    private static final class Entry {
        private final String suiteId;
        private volatile CryptoHandler handler;
        private HandlerFactory factory;

        Entry(String suiteId, CryptoHandler handler, HandlerFactory factory) {
            this.suiteId = suiteId;
            this.handler = handler;
            this.factory = factory;
        }

        CryptoHandler get() {
            var result = handler;
            if (result == null) {
                synchronized (this) {
                    result = handler;
                    if (result == null) {
                        result = create();
                        handler = result;
                        factory = null;
                    }
                }
            }
            return result;
        }

        private CryptoHandler create() {
            CryptoHandler created;
            try {
                created = factory.create();
            } catch (AlgorithmUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new AlgorithmUnavailableException("Unable to create crypto handler for suite " + suiteId, e);
            }
            if (created == null) {
                throw new AlgorithmUnavailableException("Handler factory for suite " + suiteId + " returned null");
            }
            logger.debug("Created crypto handler for suite {}: {}", suiteId, created);
            return created;
        }
    }
}
