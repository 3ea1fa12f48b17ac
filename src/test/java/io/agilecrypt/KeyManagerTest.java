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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class KeyManagerTest {
    private static final char[] PASSPHRASE = "correct horse battery staple".toCharArray();

    private KeyManager keyManager;
    private Path tempDir;

    @BeforeMethod
    public void setup() throws IOException {
        keyManager = new KeyManager(AlgorithmProvider.defaults(), FAST_ARGON2);
        tempDir = Files.createTempDirectory("agilecrypt-keys");
    }

    @AfterMethod
    public void cleanup() throws IOException {
        try (var files = Files.list(tempDir)) {
            for (var file : (Iterable<Path>) files::iterator) {
                Files.delete(file);
            }
        }
        Files.delete(tempDir);
    }

    @Test
    public void shouldDeriveSameKeysFromSamePassphraseAndSalt() {
        var first = keyManager.deriveKeysFromPassphrase(PASSPHRASE, SuiteFixtures.salt(), HYBRID_A);
        var second = keyManager.deriveKeysFromPassphrase(PASSPHRASE, SuiteFixtures.salt(), HYBRID_A);

        assertThat(first.fingerprint()).isEqualTo(second.fingerprint());
        assertThat(first.getPqc().getPrivateKey().orElseThrow().getEncoded())
                .isEqualTo(second.getPqc().getPrivateKey().orElseThrow().getEncoded());
        assertThat(first.getPassphraseSalt()).hasValueSatisfying(salt -> assertThat(salt)
                .isEqualTo(SuiteFixtures.salt()));
    }

    @Test
    public void shouldDeriveDifferentKeysForDifferentSalt() {
        var salt = SuiteFixtures.salt();
        var first = keyManager.deriveKeysFromPassphrase(PASSPHRASE, salt, HYBRID_A);
        salt[0] ^= 1;
        var second = keyManager.deriveKeysFromPassphrase(PASSPHRASE, salt, HYBRID_A);

        assertThat(first.getClassical().getPublicKey()).isNotEqualTo(second.getClassical().getPublicKey());
        assertThat(first.getPqc().getPublicKey()).isNotEqualTo(second.getPqc().getPublicKey());
    }

    @Test
    public void shouldDeriveDifferentKeysForDifferentPassphrase() {
        var first = keyManager.deriveKeysFromPassphrase(PASSPHRASE, SuiteFixtures.salt(), HYBRID_A);
        var second = keyManager.deriveKeysFromPassphrase("Tr0ub4dor&3".toCharArray(), SuiteFixtures.salt(),
                HYBRID_A);

        assertThat(first.fingerprint()).isNotEqualTo(second.fingerprint());
    }

    @Test
    public void shouldDeriveKeysMatchingSuiteAlgorithms() {
        var keys = keyManager.deriveKeysFromPassphrase(PASSPHRASE, SuiteFixtures.salt(), HYBRID_B);

        assertThat(keys.getSuiteId()).isEqualTo("HYBRID-B");
        assertThat(keys.getClassical().getAlgorithm()).isEqualTo("X25519");
        assertThat(keys.getPqc().getAlgorithm()).isEqualTo("ML-KEM-1024");
        assertThat(keys.getPqc().getPublicKey()).hasSize(1568);
    }

    @Test
    public void shouldRejectShortSalt() {
        assertThatThrownBy(() -> keyManager.deriveKeysFromPassphrase(PASSPHRASE, new byte[8], HYBRID_A))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldGenerateFreshSalts() {
        assertThat(keyManager.newSalt()).hasSize(16).isNotEqualTo(keyManager.newSalt());
    }

    @Test
    public void shouldLoadKeysFromFiles() throws IOException {
        var generated = keyManager.generateKeys(HYBRID_A);
        var files = new KeyFiles(tempDir.resolve("x25519.key"), tempDir.resolve("mlkem.key"));
        Files.write(files.classicalPrivateKey(), generated.getClassical().getPrivateKey().orElseThrow().getEncoded());
        Files.write(files.pqcPrivateKey(), generated.getPqc().getPrivateKey().orElseThrow().getEncoded());

        var loaded = keyManager.loadKeysFromExternalFiles(files, HYBRID_A);

        assertThat(loaded.fingerprint()).isEqualTo(generated.fingerprint());
        assertThat(loaded.hasPrivateKeys()).isTrue();
        assertThat(loaded.getPassphraseSalt()).isEmpty();
    }

    @Test
    public void shouldRejectKeyFileOfWrongLength() throws IOException {
        var files = new KeyFiles(tempDir.resolve("x25519.key"), tempDir.resolve("mlkem.key"));
        Files.write(files.classicalPrivateKey(), new byte[32]);
        Files.write(files.pqcPrivateKey(), new byte[3168]);

        assertThatThrownBy(() -> keyManager.loadKeysFromExternalFiles(files, HYBRID_A))
                .isInstanceOf(InvalidKeyMaterialException.class)
                .hasMessageContaining("ML-KEM-768");
    }

    @Test
    public void shouldFailToLoadMissingKeyFile() {
        var files = new KeyFiles(tempDir.resolve("missing.key"), tempDir.resolve("mlkem.key"));

        assertThatThrownBy(() -> keyManager.loadKeysFromExternalFiles(files, HYBRID_A))
                .isInstanceOf(IOException.class);
    }

    @Test
    public void shouldRecoverExactKeysFromExport() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var classicalPrivate = keys.getClassical().getPrivateKey().orElseThrow().getEncoded();
        var pqcPrivate = keys.getPqc().getPrivateKey().orElseThrow().getEncoded();

        var exported = keyManager.exportPrivateKeys(keys, "backup".toCharArray(), "backup".toCharArray(), true);
        var imported = keyManager.importPrivateKeys(exported, "backup".toCharArray());

        assertThat(imported.getSuiteId()).isEqualTo("HYBRID-A");
        assertThat(imported.getClassical().getPrivateKey().orElseThrow().getEncoded()).isEqualTo(classicalPrivate);
        assertThat(imported.getPqc().getPrivateKey().orElseThrow().getEncoded()).isEqualTo(pqcPrivate);
        assertThat(imported.fingerprint()).isEqualTo(keys.fingerprint());
    }

    @Test
    public void shouldNotExposePlaintextKeysInExport() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var classicalPrivate = keys.getClassical().getPrivateKey().orElseThrow().getEncoded();

        var exported = keyManager.exportPrivateKeys(keys, "backup".toCharArray(), "backup".toCharArray(), true);

        assertThat(indexOf(exported, classicalPrivate)).isEqualTo(-1);
    }

    @Test
    public void shouldRejectWrongExportPassphrase() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var exported = keyManager.exportPrivateKeys(keys, "backup".toCharArray(), "backup".toCharArray(), true);

        assertThatThrownBy(() -> keyManager.importPrivateKeys(exported, "guess".toCharArray()))
                .isInstanceOf(AuthenticationException.class);
    }

    @Test
    public void shouldRejectModifiedExportHeader() {
        var keys = keyManager.generateKeys(HYBRID_A);
        var exported = keyManager.exportPrivateKeys(keys, "backup".toCharArray(), "backup".toCharArray(), true);
        // The suite id "HYBRID-A" follows the format id; change its final letter
        int index = indexOf(exported, Crypto.utf8("HYBRID-A"));
        exported[index + 7] = 'B';

        assertThatThrownBy(() -> keyManager.importPrivateKeys(exported, "backup".toCharArray()))
                .isInstanceOf(AuthenticationException.class);
    }

    @Test
    public void shouldRequireExplicitConfirmationToExport() {
        var keys = keyManager.generateKeys(HYBRID_A);

        assertThatThrownBy(() -> keyManager.exportPrivateKeys(keys, "backup".toCharArray(),
                "backup".toCharArray(), false))
                .isInstanceOf(ExportConfirmationException.class);
    }

    @Test
    public void shouldRequireMatchingPassphraseConfirmation() {
        var keys = keyManager.generateKeys(HYBRID_A);

        assertThatThrownBy(() -> keyManager.exportPrivateKeys(keys, "backup".toCharArray(),
                "backpu".toCharArray(), true))
                .isInstanceOf(ExportConfirmationException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    public void shouldRefuseToExportPublicKeysOnly() {
        var keys = keyManager.generateKeys(HYBRID_A).publicKeysOnly();

        assertThatThrownBy(() -> keyManager.exportPrivateKeys(keys, "backup".toCharArray(),
                "backup".toCharArray(), true))
                .isInstanceOf(InvalidKeyMaterialException.class);
    }

    @Test
    public void shouldRejectDataThatIsNotAnExport() {
        assertThatThrownBy(() -> keyManager.importPrivateKeys(new byte[] { 'A', 'G', 'C', 1, 0 },
                "backup".toCharArray()))
                .isInstanceOf(FormatMismatchException.class);
    }

    private static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
