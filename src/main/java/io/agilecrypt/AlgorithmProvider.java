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
import java.util.LinkedHashMap;
import java.util.Map;

import io.agilecrypt.config.SuiteDefinition;
import io.agilecrypt.config.SuiteType;

/**
 * Gives uniform, name-based access to the cryptographic primitives that suites are assembled from:
 * <ul>
 *     <li>classical KEMs (X25519),</li>
 *     <li>post-quantum KEMs (ML-KEM at each security level),</li>
 *     <li>AEAD ciphers (AES-GCM and ChaCha20-Poly1305),</li>
 *     <li>KDFs (HKDF over SHA-2 and SHA-3),</li>
 *     <li>password-based KDFs (Argon2id and PBKDF2).</li>
 * </ul>
 * A provider is built once at startup and is immutable afterwards, so it can be shared freely between threads.
 * Looking up a name that has not been registered fails with {@link AlgorithmUnavailableException}; a provider never
 * substitutes one algorithm for another.
 */
public final class AlgorithmProvider {
    private static final RedactedLogger logger = RedactedLogger.getLogger(AlgorithmProvider.class);

    private final Map<String, Kem> classicalKems;
    private final Map<String, Kem> pqcKems;
    private final Map<String, Aead> aeads;
    private final Map<String, Kdf> kdfs;
    private final Map<String, Pbkdf> pbkdfs;

    private AlgorithmProvider(Builder builder) {
        this.classicalKems = Collections.unmodifiableMap(new LinkedHashMap<>(builder.classicalKems));
        this.pqcKems = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pqcKems));
        this.aeads = Collections.unmodifiableMap(new LinkedHashMap<>(builder.aeads));
        this.kdfs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.kdfs));
        this.pbkdfs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pbkdfs));
    }

    /**
     * Returns a provider with every algorithm supported by this library registered. The names "Kyber768" and
     * "Kyber1024" are accepted as aliases for the standardised ML-KEM parameter sets.
     *
     * @return the default provider.
     */
    public static AlgorithmProvider defaults() {
        return builder()
                .classicalKem(new X25519Kem())
                .pqcKem(MlKem.ML_KEM_512)
                .pqcKem(MlKem.ML_KEM_768, "Kyber768")
                .pqcKem(MlKem.ML_KEM_1024, "Kyber1024")
                .aead(JcaAead.AES_256_GCM)
                .aead(JcaAead.AES_128_GCM)
                .aead(JcaAead.CHACHA20_POLY1305)
                .kdf(Hkdf.HKDF_SHA256)
                .kdf(Hkdf.HKDF_SHA512)
                .kdf(Hkdf.HKDF_SHA3_512)
                .pbkdf(new Argon2idPbkdf())
                .pbkdf(new Pbkdf2())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Kem classicalKem(String name) {
        return lookup(classicalKems, "classical KEM", name);
    }

    public Kem pqcKem(String name) {
        return lookup(pqcKems, "post-quantum KEM", name);
    }

    public Aead aead(String name) {
        return lookup(aeads, "AEAD cipher", name);
    }

    public Kdf kdf(String name) {
        return lookup(kdfs, "KDF", name);
    }

    public Pbkdf pbkdf(String name) {
        return lookup(pbkdfs, "PBKDF", name);
    }

    /**
     * Checks that every algorithm named by a hybrid suite is available.
     *
     * @param suite the suite to check.
     * @throws AlgorithmUnavailableException if any algorithm is missing.
     */
    public void checkAvailable(SuiteDefinition suite) {
        if (suite.getType() != SuiteType.HYBRID) {
            return;
        }
        classicalKem(suite.getClassicalKemAlgorithm());
        pqcKem(suite.getPqcKemAlgorithm());
        aead(suite.getSymmetricAlgorithm());
        kdf(suite.getHybridKdfAlgorithm());
        pbkdf(suite.getPbkdfAlgorithm());
        kdf(suite.getPassphraseKdfAlgorithm());
    }


    private static <T> T lookup(Map<String, T> algorithms, String kind, String name) {
        var algorithm = algorithms.get(requireNonNull(name, kind + " name"));
        if (algorithm == null) {
            logger.debug("Requested unavailable {} {}", kind, name);
            throw new AlgorithmUnavailableException(kind + " not available: " + name);
        }
        return algorithm;
    }

    public static final class Builder {
        private final Map<String, Kem> classicalKems = new LinkedHashMap<>();
        private final Map<String, Kem> pqcKems = new LinkedHashMap<>();
        private final Map<String, Aead> aeads = new LinkedHashMap<>();
        private final Map<String, Kdf> kdfs = new LinkedHashMap<>();
        private final Map<String, Pbkdf> pbkdfs = new LinkedHashMap<>();

        private Builder() {}

        public Builder classicalKem(Kem kem, String... aliases) {
            register(classicalKems, kem.name(), kem, aliases);
            return this;
        }

        public Builder pqcKem(Kem kem, String... aliases) {
            register(pqcKems, kem.name(), kem, aliases);
            return this;
        }

        public Builder aead(Aead aead, String... aliases) {
            register(aeads, aead.name(), aead, aliases);
            return this;
        }

        public Builder kdf(Kdf kdf, String... aliases) {
            register(kdfs, kdf.name(), kdf, aliases);
            return this;
        }

        public Builder pbkdf(Pbkdf pbkdf, String... aliases) {
            register(pbkdfs, pbkdf.name(), pbkdf, aliases);
            return this;
        }

        public AlgorithmProvider build() {
            return new AlgorithmProvider(this);
        }

        private static <T> void register(Map<String, T> algorithms, String name, T algorithm, String... aliases) {
            requireNonNull(algorithm);
            algorithms.put(name, algorithm);
            for (var alias : aliases) {
                algorithms.put(alias, algorithm);
            }
        }
    }
}
