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

import static io.agilecrypt.SuiteFixtures.FAST_ARGON2;
import static io.agilecrypt.SuiteFixtures.HYBRID_A;
import static io.agilecrypt.SuiteFixtures.HYBRID_B;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.agilecrypt.DecryptionResult.Reason;

public class HybridCryptoHandlerTest {
    private static final byte[] LEDGER_LINE = "assets:cash 10 USD\n".getBytes(UTF_8);

    private AlgorithmProvider provider;
    private KeyManager keyManager;
    private HybridCryptoHandler handler;

    @BeforeMethod
    public void setup() {
        provider = AlgorithmProvider.defaults();
        keyManager = new KeyManager(provider, FAST_ARGON2);
        handler = new HybridCryptoHandler(HYBRID_A, provider);
    }

    @Test
    public void shouldDecryptLedgerLineWithSamePassphrase() {
        // Given
        var keys = KeySource.passphrase(keyManager, "hunter2".toCharArray())
                .withFixedEncryptionSalt(SuiteFixtures.salt());

        // When
        var bundle = handler.encrypt(LEDGER_LINE, keys);
        var result = handler.decrypt(BundleCodec.serialize(bundle),
                KeySource.passphrase(keyManager, "hunter2".toCharArray()));

        // Then
        assertThat(bundle.getSuiteId()).isEqualTo("HYBRID-A");
        assertThat(bundle.getPassphraseSalt()).hasValueSatisfying(salt -> assertThat(salt)
                .isEqualTo(SuiteFixtures.salt()));
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPlaintext()).asString(UTF_8).isEqualTo("assets:cash 10 USD\n");
    }

    @Test
    public void shouldFailAuthenticationWithDifferentPassphrase() {
        var bundle = handler.encrypt(LEDGER_LINE, KeySource.passphrase(keyManager, "hunter2".toCharArray())
                .withFixedEncryptionSalt(SuiteFixtures.salt()));
        var wrongKeys = keyManager.deriveKeysFromPassphrase("hunter3".toCharArray(), SuiteFixtures.salt(),
                HYBRID_A);

        assertThatThrownBy(() -> handler.decrypt(bundle, wrongKeys))
                .isInstanceOf(AuthenticationException.class);
        assertThat(handler.decrypt(BundleCodec.serialize(bundle),
                KeySource.passphrase(keyManager, "hunter3".toCharArray())).getReason())
                .isEqualTo(Reason.AUTHENTICATION_FAILED);
    }

    @Test
    public void shouldUseFreshSaltAndRandomnessForEveryBundle() {
        var keys = KeySource.passphrase(keyManager, "hunter2".toCharArray());

        var first = handler.encrypt(LEDGER_LINE, keys);
        var second = handler.encrypt(LEDGER_LINE, keys);

        assertThat(first.getPassphraseSalt().orElseThrow()).isNotEqualTo(second.getPassphraseSalt().orElseThrow());
        assertThat(first.getNonce()).isNotEqualTo(second.getNonce());
        assertThat(first.getCiphertext()).isNotEqualTo(second.getCiphertext());
    }

    @Test
    public void shouldEncryptToGeneratedKeys() {
        var keys = keyManager.generateKeys(HYBRID_A);

        var bundle = handler.encrypt(LEDGER_LINE, keys.publicKeysOnly());

        assertThat(bundle.getPassphraseSalt()).isEmpty();
        assertThat(bundle.getClassicalCiphertext()).hasValueSatisfying(ct -> assertThat(ct).hasSize(32));
        assertThat(bundle.getPqcCiphertext()).hasSize(1088);
        assertThat(bundle.getNonce()).hasSize(12);
        assertThat(bundle.getTag()).hasSize(16);
        assertThat(handler.decrypt(bundle, keys)).isEqualTo(LEDGER_LINE);
    }

    @Test
    public void shouldSupportChaCha20Suite() {
        var suiteB = new HybridCryptoHandler(HYBRID_B, provider);
        var keys = keyManager.generateKeys(HYBRID_B);

        var data = BundleCodec.serialize(suiteB.encrypt(LEDGER_LINE, KeySource.keys(keys)));

        assertThat(suiteB.decrypt(data, KeySource.keys(keys)).getPlaintext()).isEqualTo(LEDGER_LINE);
    }

    @Test
    public void shouldDetectTamperedCiphertext() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var bundle = handler.encrypt(LEDGER_LINE, keys);
        var ciphertext = bundle.getCiphertext();
        ciphertext[0] ^= 1;

        var tampered = bundle.toBuilder().ciphertext(ciphertext).build();

        assertThatThrownBy(() -> handler.decrypt(tampered, keys)).isInstanceOf(AuthenticationException.class);
    }

    @Test
    public void shouldDetectTamperedPostQuantumCiphertext() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var bundle = handler.encrypt(LEDGER_LINE, keys);
        var pqcCiphertext = bundle.getPqcCiphertext();
        pqcCiphertext[100] ^= 1;

        var tampered = bundle.toBuilder().pqcCiphertext(pqcCiphertext).build();

        assertThatThrownBy(() -> handler.decrypt(tampered, keys)).isInstanceOf(AuthenticationException.class);
    }

    @Test
    public void shouldDetectTamperedClassicalCiphertext() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var bundle = handler.encrypt(LEDGER_LINE, keys);
        var classicalCiphertext = bundle.getClassicalCiphertext().orElseThrow();
        classicalCiphertext[0] ^= 1;

        var tampered = bundle.toBuilder().classicalCiphertext(classicalCiphertext).build();

        assertThatThrownBy(() -> handler.decrypt(tampered, keys)).isInstanceOf(AuthenticationException.class);
    }

    @Test
    public void shouldDetectTamperedHybridSalt() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var bundle = handler.encrypt(LEDGER_LINE, keys);
        var salt = bundle.getHybridSalt().orElseThrow();
        salt[31] ^= 1;

        var tampered = bundle.toBuilder().hybridSalt(salt).build();

        assertThatThrownBy(() -> handler.decrypt(tampered, keys)).isInstanceOf(AuthenticationException.class);
    }

    @Test
    public void shouldDetectTamperedTag() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var bundle = handler.encrypt(LEDGER_LINE, keys);
        var tag = bundle.getTag();
        tag[15] ^= 1;

        var tampered = BundleCodec.serialize(bundle.toBuilder().tag(tag).build());

        assertThat(handler.decrypt(tampered, KeySource.keys(keys)).getReason())
                .isEqualTo(Reason.AUTHENTICATION_FAILED);
    }

    @Test
    public void shouldDetectTamperedNonce() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var bundle = handler.encrypt(LEDGER_LINE, keys);
        var nonce = bundle.getNonce();
        nonce[0] ^= 1;

        var tampered = BundleCodec.serialize(bundle.toBuilder().nonce(nonce).build());

        assertThat(handler.decrypt(tampered, KeySource.keys(keys)).getReason())
                .isEqualTo(Reason.AUTHENTICATION_FAILED);
    }

    @Test
    public void shouldReportFormatMismatchForShortPassphraseSalt() {
        var bundle = handler.encrypt(LEDGER_LINE, KeySource.passphrase(keyManager, "hunter2".toCharArray()));
        var data = BundleCodec.serialize(bundle.toBuilder().passphraseSalt(new byte[] { 1, 2, 3 }).build());

        var result = handler.decrypt(data, KeySource.passphrase(keyManager, "hunter2".toCharArray()));

        assertThat(result.getReason()).isEqualTo(Reason.FORMAT_MISMATCH);
    }

    @Test
    public void shouldRejectBundleRelabelledWithOtherSuite() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var bundle = handler.encrypt(LEDGER_LINE, keys);
        var relabelled = EncryptedBundle.builder(BundleCodec.HYBRID_FORMAT_ID, "HYBRID-B")
                .classicalCiphertext(bundle.getClassicalCiphertext().orElseThrow())
                .pqcCiphertext(bundle.getPqcCiphertext())
                .nonce(bundle.getNonce())
                .ciphertext(bundle.getCiphertext())
                .tag(bundle.getTag())
                .hybridSalt(bundle.getHybridSalt().orElseThrow())
                .build();

        assertThatThrownBy(() -> handler.decrypt(relabelled, keys)).isInstanceOf(FormatMismatchException.class);
        assertThat(handler.canHandle(BundleCodec.serialize(relabelled))).isFalse();
    }

    @Test
    public void shouldReportFormatMismatchForTruncatedField() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var bundle = handler.encrypt(LEDGER_LINE, keys).toBuilder().nonce(new byte[8]).build();

        var result = handler.decrypt(BundleCodec.serialize(bundle), KeySource.keys(keys));

        assertThat(result.getReason()).isEqualTo(Reason.FORMAT_MISMATCH);
    }

    @Test
    public void shouldReportFormatMismatchForForeignData() {
        var result = handler.decrypt("not a bundle".getBytes(UTF_8), KeySource.keys());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo(Reason.FORMAT_MISMATCH);
    }

    @Test
    public void shouldReportInvalidKeyWhenOnlyPublicKeysAreAvailable() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var data = BundleCodec.serialize(handler.encrypt(LEDGER_LINE, keys));

        var result = handler.decrypt(data, KeySource.keys(keys.publicKeysOnly()));

        assertThat(result.getReason()).isEqualTo(Reason.INVALID_KEY);
    }

    @Test
    public void shouldRejectKeysForOtherAlgorithms() {
        var keysB = keyManager.generateKeys(HYBRID_B);

        assertThatThrownBy(() -> handler.encrypt(LEDGER_LINE, keysB))
                .isInstanceOf(InvalidKeyMaterialException.class);
    }

    @Test
    public void shouldRecogniseOwnBundles() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var data = BundleCodec.serialize(handler.encrypt(LEDGER_LINE, keys));

        assertThat(handler.canHandle(data)).isTrue();
        assertThat(new HybridCryptoHandler(HYBRID_B, provider).canHandle(data)).isFalse();
        assertThat(handler.canHandle("-----BEGIN PGP MESSAGE-----".getBytes(UTF_8))).isFalse();
    }

    @Test
    public void shouldFailFactoryEagerlyForUnknownAlgorithm() {
        var restricted = AlgorithmProvider.builder().classicalKem(new X25519Kem()).build();

        assertThatThrownBy(() -> HybridCryptoHandler.factory(HYBRID_A, restricted))
                .isInstanceOf(AlgorithmUnavailableException.class);
    }
}
