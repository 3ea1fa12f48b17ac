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

import java.util.Objects;

/**
 * A named, fixed combination of algorithms. Suite definitions are immutable and are loaded once at startup, either
 * by {@link CryptoConfigLoader} or programmatically via {@link #builder(String, SuiteType)}. Hybrid suites must name
 * every algorithm; legacy suites need only an id.
 */
public final class SuiteDefinition {
    private final String id;
    private final String description;
    private final SuiteType type;
    private final String classicalKemAlgorithm;
    private final String pqcKemAlgorithm;
    private final String symmetricAlgorithm;
    private final String hybridKdfAlgorithm;
    private final String pbkdfAlgorithm;
    private final PbkdfParameters pbkdfParameters;
    private final String passphraseKdfAlgorithm;

    private SuiteDefinition(Builder builder) {
        this.id = builder.id;
        this.description = builder.description;
        this.type = builder.type;
        this.classicalKemAlgorithm = builder.classicalKemAlgorithm;
        this.pqcKemAlgorithm = builder.pqcKemAlgorithm;
        this.symmetricAlgorithm = builder.symmetricAlgorithm;
        this.hybridKdfAlgorithm = builder.hybridKdfAlgorithm;
        this.pbkdfAlgorithm = builder.pbkdfAlgorithm;
        this.pbkdfParameters = builder.pbkdfParameters;
        this.passphraseKdfAlgorithm = builder.passphraseKdfAlgorithm;
    }

    public static Builder builder(String id, SuiteType type) {
        return new Builder(id, type);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public SuiteType getType() {
        return type;
    }

    public String getClassicalKemAlgorithm() {
        return classicalKemAlgorithm;
    }

    public String getPqcKemAlgorithm() {
        return pqcKemAlgorithm;
    }

    public String getSymmetricAlgorithm() {
        return symmetricAlgorithm;
    }

    public String getHybridKdfAlgorithm() {
        return hybridKdfAlgorithm;
    }

    public String getPbkdfAlgorithm() {
        return pbkdfAlgorithm;
    }

    public PbkdfParameters getPbkdfParameters() {
        return pbkdfParameters;
    }

    public String getPassphraseKdfAlgorithm() {
        return passphraseKdfAlgorithm;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) { return true; }
        if (!(o instanceof SuiteDefinition)) { return false; }
        SuiteDefinition that = (SuiteDefinition) o;
        return id.equals(that.id) && type == that.type
                && Objects.equals(classicalKemAlgorithm, that.classicalKemAlgorithm)
                && Objects.equals(pqcKemAlgorithm, that.pqcKemAlgorithm)
                && Objects.equals(symmetricAlgorithm, that.symmetricAlgorithm)
                && Objects.equals(hybridKdfAlgorithm, that.hybridKdfAlgorithm)
                && Objects.equals(pbkdfAlgorithm, that.pbkdfAlgorithm)
                && Objects.equals(pbkdfParameters, that.pbkdfParameters)
                && Objects.equals(passphraseKdfAlgorithm, that.passphraseKdfAlgorithm);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, classicalKemAlgorithm, pqcKemAlgorithm, symmetricAlgorithm);
    }

    @Override
    public String toString() {
        if (type == SuiteType.LEGACY_OPENPGP) {
            return id + "[" + type + "]";
        }
        return id + "[" + classicalKemAlgorithm + "+" + pqcKemAlgorithm + ", " + symmetricAlgorithm + ", "
                + hybridKdfAlgorithm + "]";
    }

    public static final class Builder {
        private final String id;
        private final SuiteType type;
        private String description = "";
        private String classicalKemAlgorithm;
        private String pqcKemAlgorithm;
        private String symmetricAlgorithm;
        private String hybridKdfAlgorithm;
        private String pbkdfAlgorithm = "Argon2id";
        private PbkdfParameters pbkdfParameters = PbkdfParameters.ARGON2ID_DEFAULTS;
        private String passphraseKdfAlgorithm = "HKDF-SHA3-512";

        private Builder(String id, SuiteType type) {
            this.id = requireNonNull(id, "id");
            this.type = requireNonNull(type, "type");
        }

        public Builder description(String description) {
            this.description = requireNonNull(description);
            return this;
        }

        public Builder classicalKem(String algorithm) {
            this.classicalKemAlgorithm = algorithm;
            return this;
        }

        public Builder pqcKem(String algorithm) {
            this.pqcKemAlgorithm = algorithm;
            return this;
        }

        public Builder symmetricCipher(String algorithm) {
            this.symmetricAlgorithm = algorithm;
            return this;
        }

        public Builder hybridKdf(String algorithm) {
            this.hybridKdfAlgorithm = algorithm;
            return this;
        }

        public Builder pbkdf(String algorithm, PbkdfParameters parameters) {
            this.pbkdfAlgorithm = algorithm;
            this.pbkdfParameters = requireNonNull(parameters, "parameters");
            return this;
        }

        public Builder passphraseKdf(String algorithm) {
            this.passphraseKdfAlgorithm = algorithm;
            return this;
        }

        public SuiteDefinition build() {
            if (id.isBlank()) {
                throw new ConfigurationException("Suite id must not be blank");
            }
            if (type == SuiteType.HYBRID) {
                requireSetting(classicalKemAlgorithm, "classical_kem_algorithm");
                requireSetting(pqcKemAlgorithm, "pqc_kem_algorithm");
                requireSetting(symmetricAlgorithm, "symmetric_algorithm");
                requireSetting(hybridKdfAlgorithm, "kdf_algorithm_for_hybrid_sk");
                requireSetting(pbkdfAlgorithm, "pbkdf_algorithm");
                requireSetting(passphraseKdfAlgorithm, "kdf_algorithm_for_passphrase");
            }
            return new SuiteDefinition(this);
        }

        private void requireSetting(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new ConfigurationException("Hybrid suite '" + id + "' is missing required setting: " + name);
            }
        }
    }
}
