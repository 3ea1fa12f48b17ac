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

import static io.agilecrypt.Crypto.utf8;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.Arrays;

import io.agilecrypt.config.PbkdfParameters;
import io.agilecrypt.config.SuiteDefinition;
import io.agilecrypt.config.SuiteType;
import io.agilecrypt.io.CborReader;
import io.agilecrypt.io.CborWriter;

/**
 * Derives, loads and exports the key material used by hybrid suites.
 * <p>
 * Passphrase-derived keys are produced in two stages. The suite's password-based KDF first stretches the passphrase
 * into a 64-byte secret, which makes guessing low-entropy passphrases expensive. A KDF then splits that secret into
 * two independent seeds, one for each KEM, using distinct info labels. Each KEM derives its key pair from its seed
 * deterministically, so the same passphrase and salt always recreate the same keys.
 */
public final class KeyManager {
    private static final RedactedLogger logger = RedactedLogger.getLogger(KeyManager.class);

    static final int SALT_LENGTH = 16;
    static final int STRETCHED_SECRET_LENGTH = 64;
    static final byte[] CLASSICAL_SEED_INFO = utf8("classical-kem-seed");
    static final byte[] PQC_SEED_INFO = utf8("pqc-kem-seed");

    static final String EXPORT_FORMAT_ID = "PRIVATE-KEY-EXPORT";
    private static final byte[] EXPORT_MAGIC = { 'A', 'G', 'K', 1 };
    private static final String EXPORT_PBKDF = "Argon2id";
    private static final String EXPORT_KDF = "HKDF-SHA256";
    private static final String EXPORT_AEAD = "AES256GCM";
    private static final byte[] EXPORT_KEY_INFO = utf8("agilecrypt/key-export/v1");
    private static final int MAX_EXPORT_MEMORY_KIB = 1 << 21;

    private final AlgorithmProvider provider;
    private final PbkdfParameters exportParameters;

    public KeyManager(AlgorithmProvider provider) {
        this(provider, PbkdfParameters.ARGON2ID_DEFAULTS);
    }

    /**
     * Creates a key manager with custom Argon2id cost parameters for private key exports.
     */
    public KeyManager(AlgorithmProvider provider, PbkdfParameters exportParameters) {
        this.provider = requireNonNull(provider, "provider");
        this.exportParameters = requireNonNull(exportParameters, "exportParameters");
    }

    /**
     * Generates a fresh random salt for passphrase-based key derivation.
     *
     * @return a new 16-byte salt.
     */
    public byte[] newSalt() {
        return Crypto.randomBytes(SALT_LENGTH);
    }

    /**
     * Deterministically derives the key pairs for a suite from a passphrase and salt.
     *
     * @param passphrase the passphrase. It is not modified or retained.
     * @param salt       the salt: a {@linkplain #newSalt() fresh salt} when encrypting, or the salt read from the
     *                   bundle when decrypting.
     * @param suite      the hybrid suite whose algorithms the keys are for.
     * @return the derived key material, which records the salt.
     * @throws AlgorithmUnavailableException if the suite names an unknown algorithm.
     */
    public KeyMaterial deriveKeysFromPassphrase(char[] passphrase, byte[] salt, SuiteDefinition suite) {
        requireHybrid(suite);
        Utils.require(passphrase.length > 0, "Passphrase must not be empty");
        Utils.require(salt.length >= SALT_LENGTH, "Salt must be at least " + SALT_LENGTH + " bytes");

        var pbkdf = provider.pbkdf(suite.getPbkdfAlgorithm());
        var kdf = provider.kdf(suite.getPassphraseKdfAlgorithm());
        var classicalKem = provider.classicalKem(suite.getClassicalKemAlgorithm());
        var pqcKem = provider.pqcKem(suite.getPqcKemAlgorithm());

        byte[] stretched = null;
        byte[] classicalSeed = null;
        byte[] pqcSeed = null;
        try {
            stretched = pbkdf.stretch(passphrase, salt, suite.getPbkdfParameters(), STRETCHED_SECRET_LENGTH);
            classicalSeed = kdf.derive(stretched, null, CLASSICAL_SEED_INFO, classicalKem.seedLength());
            pqcSeed = kdf.derive(stretched, null, PQC_SEED_INFO, pqcKem.seedLength());

            var keys = new KeyMaterial(suite.getId(), classicalKem.deriveKeyPair(classicalSeed),
                    pqcKem.deriveKeyPair(pqcSeed), salt);
            logger.debug("Derived {} keys from passphrase, fingerprint {}", suite.getId(), keys.fingerprint());
            return keys;
        } finally {
            Utils.wipe(stretched, classicalSeed, pqcSeed);
        }
    }

    /**
     * Generates random key pairs for a suite, for users who keep their keys in files rather than deriving them.
     */
    public KeyMaterial generateKeys(SuiteDefinition suite) {
        requireHybrid(suite);
        var keys = new KeyMaterial(suite.getId(),
                provider.classicalKem(suite.getClassicalKemAlgorithm()).generateKeyPair(),
                provider.pqcKem(suite.getPqcKemAlgorithm()).generateKeyPair(), null);
        logger.info("Generated new {} keys, fingerprint {}", suite.getId(), keys.fingerprint());
        return keys;
    }

    /**
     * Loads raw private keys from files and reconstructs the matching public keys.
     *
     * @param files the key file locations.
     * @param suite the suite the keys belong to.
     * @return the loaded key material.
     * @throws IOException                 if a file cannot be read.
     * @throws InvalidKeyMaterialException if a key has the wrong length for the suite's algorithms.
     */
    public KeyMaterial loadKeysFromExternalFiles(KeyFiles files, SuiteDefinition suite) throws IOException {
        byte[] classicalPrivateKey = null;
        byte[] pqcPrivateKey = null;
        try {
            classicalPrivateKey = Files.readAllBytes(files.classicalPrivateKey());
            pqcPrivateKey = Files.readAllBytes(files.pqcPrivateKey());
            var keys = keysFromPrivateKeys(suite, classicalPrivateKey, pqcPrivateKey);
            logger.debug("Loaded {} keys from files, fingerprint {}", suite.getId(), keys.fingerprint());
            return keys;
        } finally {
            Utils.wipe(classicalPrivateKey, pqcPrivateKey);
        }
    }

    /**
     * Reconstructs key material from raw private key bytes.
     *
     * @throws InvalidKeyMaterialException if a key has the wrong length for the suite's algorithms.
     */
    public KeyMaterial keysFromPrivateKeys(SuiteDefinition suite, byte[] classicalPrivateKey, byte[] pqcPrivateKey) {
        requireHybrid(suite);
        return buildKeyMaterial(suite.getId(), provider.classicalKem(suite.getClassicalKemAlgorithm()),
                provider.pqcKem(suite.getPqcKemAlgorithm()), classicalPrivateKey, pqcPrivateKey);
    }

    /**
     * Wraps the private keys in a passphrase-encrypted container. A fresh salt and nonce are used for every export,
     * and the container is authenticated, so it can be safely written to backup media.
     *
     * @param keys                   the key material to export. Must include private keys.
     * @param exportPassphrase       the passphrase protecting the export.
     * @param confirmExportPassphrase the passphrase entered a second time.
     * @param confirmed              the caller's explicit confirmation that private keys may leave the process.
     * @return the encrypted container.
     * @throws ExportConfirmationException if the export is not confirmed or the two passphrases differ.
     */
    public byte[] exportPrivateKeys(KeyMaterial keys, char[] exportPassphrase, char[] confirmExportPassphrase,
            boolean confirmed) {
        if (!confirmed) {
            throw new ExportConfirmationException("Export of private keys must be explicitly confirmed");
        }
        if (!Arrays.equals(exportPassphrase, confirmExportPassphrase)) {
            throw new ExportConfirmationException("Export passphrase confirmation does not match");
        }
        Utils.require(exportPassphrase.length > 0, "Export passphrase must not be empty");
        if (!keys.hasPrivateKeys()) {
            throw new InvalidKeyMaterialException("Key material has no private keys to export");
        }

        var aead = provider.aead(EXPORT_AEAD);
        var salt = newSalt();
        var nonce = Crypto.randomBytes(aead.nonceLength());
        var header = encodeExportHeader(keys.getSuiteId(), keys.getClassical().getAlgorithm(),
                keys.getPqc().getAlgorithm(), exportParameters, salt);

        byte[] wrappingKey = null;
        byte[] plaintext = null;
        try {
            wrappingKey = deriveExportKey(exportPassphrase, salt, exportParameters, aead.keyLength());
            plaintext = encodePrivateKeys(keys);
            var sealed = aead.seal(wrappingKey, nonce, plaintext, header);

            var out = new ByteArrayOutputStream();
            out.write(header);
            new CborWriter(out).writeBytes(nonce).writeBytes(sealed.ciphertext()).writeBytes(sealed.tag());
            logger.info("Exported private keys for suite {}, fingerprint {}", keys.getSuiteId(), keys.fingerprint());
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } finally {
            Utils.wipe(wrappingKey, plaintext);
        }
    }

    /**
     * Recovers the key material from a container produced by
     * {@link #exportPrivateKeys(KeyMaterial, char[], char[], boolean)}.
     *
     * @param exported         the exported container.
     * @param exportPassphrase the passphrase the container was protected with.
     * @return the recovered key material.
     * @throws FormatMismatchException if the data is not a key export container.
     * @throws AuthenticationException if the passphrase is wrong or the container has been modified.
     */
    public KeyMaterial importPrivateKeys(byte[] exported, char[] exportPassphrase) {
        if (exported.length <= EXPORT_MAGIC.length
                || !Arrays.equals(exported, 0, EXPORT_MAGIC.length, EXPORT_MAGIC, 0, EXPORT_MAGIC.length)) {
            throw new FormatMismatchException("Data is not an exported private key container");
        }
        var aead = provider.aead(EXPORT_AEAD);
        byte[] wrappingKey = null;
        byte[] plaintext = null;
        try (var reader = new CborReader(new ByteArrayInputStream(exported, EXPORT_MAGIC.length,
                exported.length - EXPORT_MAGIC.length))) {
            if (!EXPORT_FORMAT_ID.equals(reader.readString())) {
                throw new FormatMismatchException("Unknown key export format");
            }
            var suiteId = reader.readString();
            var classicalKem = provider.classicalKem(reader.readString());
            var pqcKem = provider.pqcKem(reader.readString());
            var parameters = new PbkdfParameters(reader.readUnsignedInt(), reader.readUnsignedInt(),
                    reader.readUnsignedInt());
            if (parameters.memoryKiB() > MAX_EXPORT_MEMORY_KIB) {
                throw new FormatMismatchException("Key export requests excessive memory cost");
            }
            var salt = reader.readBytes();
            var nonce = reader.readBytes();
            var ciphertext = reader.readBytes();
            var tag = reader.readBytes();
            reader.expectEnd();

            var header = encodeExportHeader(suiteId, classicalKem.name(), pqcKem.name(), parameters, salt);
            wrappingKey = deriveExportKey(exportPassphrase, salt, parameters, aead.keyLength());
            plaintext = aead.open(wrappingKey, nonce, ciphertext, tag, header);

            try (var keyReader = new CborReader(new ByteArrayInputStream(plaintext))) {
                var classicalPrivateKey = keyReader.readBytes();
                var pqcPrivateKey = keyReader.readBytes();
                try {
                    return buildKeyMaterial(suiteId, classicalKem, pqcKem, classicalPrivateKey, pqcPrivateKey);
                } finally {
                    Utils.wipe(classicalPrivateKey, pqcPrivateKey);
                }
            }
        } catch (IOException e) {
            throw new FormatMismatchException("Malformed key export container", e);
        } finally {
            Utils.wipe(wrappingKey, plaintext);
        }
    }

    private KeyMaterial buildKeyMaterial(String suiteId, Kem classicalKem, Kem pqcKem, byte[] classicalPrivateKey,
            byte[] pqcPrivateKey) {
        Utils.requireLength(classicalPrivateKey, classicalKem.privateKeyLength(),
                suiteId + " " + classicalKem.name() + " private key");
        Utils.requireLength(pqcPrivateKey, pqcKem.privateKeyLength(), suiteId + " " + pqcKem.name() + " private key");
        return new KeyMaterial(suiteId,
                KemKeyPair.of(classicalKem.name(), classicalKem.publicKeyFromPrivate(classicalPrivateKey),
                        classicalPrivateKey.clone()),
                KemKeyPair.of(pqcKem.name(), pqcKem.publicKeyFromPrivate(pqcPrivateKey), pqcPrivateKey.clone()),
                null);
    }

    private byte[] deriveExportKey(char[] passphrase, byte[] salt, PbkdfParameters parameters, int keyLength) {
        var stretched = provider.pbkdf(EXPORT_PBKDF).stretch(passphrase, salt, parameters, STRETCHED_SECRET_LENGTH);
        try {
            return provider.kdf(EXPORT_KDF).derive(stretched, salt, EXPORT_KEY_INFO, keyLength);
        } finally {
            Utils.wipe(stretched);
        }
    }

    private static byte[] encodeExportHeader(String suiteId, String classicalAlgorithm, String pqcAlgorithm,
            PbkdfParameters parameters, byte[] salt) {
        var out = new ByteArrayOutputStream();
        try {
            out.write(EXPORT_MAGIC);
            new CborWriter(out)
                    .writeString(EXPORT_FORMAT_ID)
                    .writeString(suiteId)
                    .writeString(classicalAlgorithm)
                    .writeString(pqcAlgorithm)
                    .writeUnsignedInt(parameters.memoryKiB())
                    .writeUnsignedInt(parameters.iterations())
                    .writeUnsignedInt(parameters.parallelism())
                    .writeBytes(salt);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    private static byte[] encodePrivateKeys(KeyMaterial keys) throws IOException {
        var classical = keys.getClassical().requirePrivateKey().getEncoded();
        var pqc = keys.getPqc().requirePrivateKey().getEncoded();
        try {
            var out = new ByteArrayOutputStream();
            new CborWriter(out).writeBytes(classical).writeBytes(pqc);
            return out.toByteArray();
        } finally {
            Utils.wipe(classical, pqc);
        }
    }

    private static void requireHybrid(SuiteDefinition suite) {
        if (suite.getType() != SuiteType.HYBRID) {
            throw new IllegalArgumentException("Suite " + suite.getId() + " does not use hybrid key material");
        }
    }
}
