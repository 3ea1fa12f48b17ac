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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.testng.annotations.Test;

public class CryptoConfigTest {
    private static final SuiteDefinition HYBRID = SuiteDefinition.builder("HYBRID-A", SuiteType.HYBRID)
            .classicalKem("X25519")
            .pqcKem("ML-KEM-768")
            .symmetricCipher("AES256GCM")
            .hybridKdf("HKDF-SHA256")
            .build();
    private static final SuiteDefinition LEGACY = SuiteDefinition.builder("LEGACY-OPENPGP",
            SuiteType.LEGACY_OPENPGP).build();

    @Test
    public void shouldRejectUndefinedActiveSuite() {
        assertThatThrownBy(() -> new CryptoConfig("HYBRID-Z", List.of(), List.of(HYBRID)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("HYBRID-Z");
    }

    @Test
    public void shouldRejectUndefinedSuiteInAttemptOrder() {
        assertThatThrownBy(() -> new CryptoConfig("HYBRID-A", List.of("HYBRID-A", "HYBRID-Q"), List.of(HYBRID)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("HYBRID-Q");
    }

    @Test
    public void shouldRejectDuplicateSuiteIds() {
        assertThatThrownBy(() -> new CryptoConfig("HYBRID-A", List.of(), List.of(HYBRID, HYBRID)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    public void shouldRotateActiveSuiteKeepingCatalog() {
        var second = SuiteDefinition.builder("HYBRID-B", SuiteType.HYBRID)
                .classicalKem("X25519")
                .pqcKem("ML-KEM-1024")
                .symmetricCipher("ChaCha20Poly1305")
                .hybridKdf("HKDF-SHA512")
                .build();
        var config = new CryptoConfig("HYBRID-A", List.of("HYBRID-A", "LEGACY-OPENPGP"),
                List.of(HYBRID, second, LEGACY));

        var rotated = config.withActiveSuite("HYBRID-B");

        assertThat(rotated.getActiveSuite()).isEqualTo(second);
        assertThat(rotated.getDecryptionAttemptOrder()).containsExactly("HYBRID-A", "LEGACY-OPENPGP");
        assertThat(rotated.getSuites()).containsOnlyKeys("HYBRID-A", "HYBRID-B", "LEGACY-OPENPGP");
    }

    @Test
    public void shouldDefaultToArgon2idForPassphrases() {
        assertThat(HYBRID.getPbkdfAlgorithm()).isEqualTo("Argon2id");
        assertThat(HYBRID.getPbkdfParameters()).isEqualTo(PbkdfParameters.ARGON2ID_DEFAULTS);
        assertThat(HYBRID.getPassphraseKdfAlgorithm()).isEqualTo("HKDF-SHA3-512");
    }

    @Test
    public void shouldRejectInvalidPbkdfParameters() {
        assertThatThrownBy(() -> new PbkdfParameters(1024, 0, 1)).isInstanceOf(ConfigurationException.class);
    }
}
