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

import static io.agilecrypt.BundleCodec.HYBRID_FORMAT_ID;
import static java.util.Objects.requireNonNull;

import io.agilecrypt.DecryptionResult.Reason;
import io.agilecrypt.config.SuiteDefinition;
import io.agilecrypt.config.SuiteType;

/**
 * Hybrid encryption for one suite. The plaintext is protected by an AEAD cipher under a key derived from two shared
 * secrets, one from a classical KEM and one from a post-quantum KEM, so the data stays confidential as long as either
 * KEM remains unbroken.
 * <p>
 * The symmetric key is {@code KDF(secret_classical || secret_pqc, salt, "agilecrypt/hybrid-key/v1:" + suiteId)}
 * with a fresh random salt per bundle. The AEAD associated data covers the bundle header and both KEM ciphertexts.
 */
public final class HybridCryptoHandler implements CryptoHandler {
    private static final RedactedLogger logger = RedactedLogger.getLogger(HybridCryptoHandler.class);

    static final int HYBRID_SALT_LENGTH = 32;
    private static final String KEY_LABEL_PREFIX = "agilecrypt/hybrid-key/v1:";

    private final SuiteDefinition suite;
    private final Kem classicalKem;
    private final Kem pqcKem;
    private final Aead aead;
    private final Kdf kdf;
    private final byte[] keyLabel;

    /**
     * Creates a handler for the given hybrid suite.
     *
     * @throws AlgorithmUnavailableException if the suite names an algorithm the provider does not offer.
     */
    public HybridCryptoHandler(SuiteDefinition suite, AlgorithmProvider provider) {
        this.suite = requireNonNull(suite, "suite");
        if (suite.getType() != SuiteType.HYBRID) {
            throw new IllegalArgumentException("Not a hybrid suite: " + suite.getId());
        }
        this.classicalKem = provider.classicalKem(suite.getClassicalKemAlgorithm());
        this.pqcKem = provider.pqcKem(suite.getPqcKemAlgorithm());
        this.aead = provider.aead(suite.getSymmetricAlgorithm());
        this.kdf = provider.kdf(suite.getHybridKdfAlgorithm());
        this.keyLabel = Crypto.utf8(KEY_LABEL_PREFIX + suite.getId());
    }

    /**
     * Returns a factory that creates the handler lazily. The suite's algorithms are checked immediately, so a
     * misconfigured suite fails at registration rather than at first use.
     *
     * @throws AlgorithmUnavailableException if the suite names an algorithm the provider does not offer.
     */
    public static HandlerFactory factory(SuiteDefinition suite, AlgorithmProvider provider) {
        provider.checkAvailable(suite);
        return () -> new HybridCryptoHandler(suite, provider);
    }

    @Override
    public String suiteId() {
        return suite.getId();
    }

    @Override
    public boolean canHandle(byte[] data) {
        return BundleCodec.peekHeader(data)
                .filter(header -> header.version() == BundleCodec.VERSION)
                .filter(header -> HYBRID_FORMAT_ID.equals(header.formatId()))
                .filter(header -> suite.getId().equals(header.suiteId()))
                .isPresent();
    }

    @Override
    public EncryptedBundle encrypt(byte[] plaintext, KeySource keys) {
        var recipient = keys.keysForEncryption(suite);
        try {
            return encrypt(plaintext, recipient);
        } finally {
            recipient.destroy();
        }
    }

    /**
     * Encrypts data for the holder of the given keys. Only the public keys are used.
     *
     * @param plaintext the data to encrypt.
     * @param recipient the recipient's key material. Any passphrase salt it carries is recorded in the bundle.
     * @return the encrypted bundle.
     * @throws InvalidKeyMaterialException if the keys are not for this suite's algorithms.
     */
    public EncryptedBundle encrypt(byte[] plaintext, KeyMaterial recipient) {
        checkAlgorithms(recipient);
        Kem.Encapsulation classical = null;
        Kem.Encapsulation pqc = null;
        byte[] combined = null;
        byte[] key = null;
        try {
            classical = classicalKem.encapsulate(recipient.getClassical().getPublicKey());
            pqc = pqcKem.encapsulate(recipient.getPqc().getPublicKey());
            combined = Utils.concat(classical.sharedSecret(), pqc.sharedSecret());

            var hybridSalt = Crypto.randomBytes(HYBRID_SALT_LENGTH);
            key = kdf.derive(combined, hybridSalt, keyLabel, aead.keyLength());
            var nonce = Crypto.randomBytes(aead.nonceLength());
            var associatedData = associatedData(classical.ciphertext(), pqc.ciphertext());
            var sealed = aead.seal(key, nonce, plaintext, associatedData);

            logger.debug("Encrypted {} bytes with suite {} for keys {}", plaintext.length, suite.getId(),
                    recipient.fingerprint());
            return EncryptedBundle.builder(HYBRID_FORMAT_ID, suite.getId())
                    .classicalCiphertext(classical.ciphertext())
                    .pqcCiphertext(pqc.ciphertext())
                    .nonce(nonce)
                    .ciphertext(sealed.ciphertext())
                    .tag(sealed.tag())
                    .passphraseSalt(recipient.getPassphraseSalt().orElse(null))
                    .hybridSalt(hybridSalt)
                    .build();
        } finally {
            if (classical != null) {
                classical.destroy();
            }
            if (pqc != null) {
                pqc.destroy();
            }
            Utils.wipe(combined, key);
        }
    }

    @Override
    public DecryptionResult decrypt(byte[] data, KeySource keys) {
        EncryptedBundle bundle;
        try {
            bundle = BundleCodec.parse(data);
            checkBundle(bundle);
        } catch (FormatMismatchException e) {
            logger.debug("Suite {} does not match data: {}", suite.getId(), e.getMessage());
            return DecryptionResult.failure(Reason.FORMAT_MISMATCH);
        }

        KeyMaterial keyMaterial = null;
        try {
            keyMaterial = keys.keysForDecryption(suite, bundle.getPassphraseSalt());
            return DecryptionResult.success(decrypt(bundle, keyMaterial));
        } catch (FormatMismatchException e) {
            logger.debug("Suite {} rejected malformed bundle: {}", suite.getId(), e.getMessage());
            return DecryptionResult.failure(Reason.FORMAT_MISMATCH);
        } catch (AuthenticationException e) {
            logger.debug("Suite {} failed to authenticate bundle", suite.getId());
            return DecryptionResult.failure(Reason.AUTHENTICATION_FAILED);
        } catch (InvalidKeyMaterialException e) {
            logger.debug("Suite {} has no usable keys: {}", suite.getId(), e.getMessage());
            return DecryptionResult.failure(Reason.INVALID_KEY);
        } catch (AlgorithmUnavailableException e) {
            logger.warn("Suite {} cannot derive keys: {}", suite.getId(), e.getMessage());
            return DecryptionResult.failure(Reason.ALGORITHM_UNAVAILABLE);
        } finally {
            if (keyMaterial != null) {
                keyMaterial.destroy();
            }
        }
    }

    /**
     * Decrypts a bundle produced by this suite.
     *
     * @param bundle the bundle.
     * @param keys   key material including the private keys.
     * @return the plaintext.
     * @throws FormatMismatchException     if the bundle is for a different format or suite, or has fields of the
     *                                     wrong size.
     * @throws AuthenticationException     if the bundle has been tampered with or the keys are wrong.
     * @throws InvalidKeyMaterialException if the keys are not for this suite's algorithms.
     */
    public byte[] decrypt(EncryptedBundle bundle, KeyMaterial keys) {
        checkBundle(bundle);
        checkAlgorithms(keys);
        var classicalCiphertext = bundle.getClassicalCiphertext().orElseThrow();
        var pqcCiphertext = bundle.getPqcCiphertext();
        var nonce = bundle.getNonce();
        var hybridSalt = bundle.getHybridSalt().orElseThrow();

        byte[] classicalSecret = null;
        byte[] pqcSecret = null;
        byte[] combined = null;
        byte[] key = null;
        try {
            try {
                classicalSecret = classicalKem.decapsulate(keys.getClassical().requirePrivateKey(),
                        classicalCiphertext);
            } catch (InvalidKeyMaterialException e) {
                if (keys.getClassical().getPrivateKey().isEmpty()) {
                    throw e;
                }
                // A rejected ephemeral key means the bundle was modified
                throw new AuthenticationException("Authentication failed", e);
            }
            pqcSecret = pqcKem.decapsulate(keys.getPqc().requirePrivateKey(), pqcCiphertext);
            combined = Utils.concat(classicalSecret, pqcSecret);
            key = kdf.derive(combined, hybridSalt, keyLabel, aead.keyLength());

            var plaintext = aead.open(key, nonce, bundle.getCiphertext(), bundle.getTag(),
                    associatedData(classicalCiphertext, pqcCiphertext));
            logger.debug("Decrypted bundle with suite {}", suite.getId());
            return plaintext;
        } finally {
            Utils.wipe(classicalSecret, pqcSecret, combined, key);
        }
    }

    private byte[] associatedData(byte[] classicalCiphertext, byte[] pqcCiphertext) {
        return Utils.concat(BundleCodec.encodeHeader(HYBRID_FORMAT_ID, suite.getId()), classicalCiphertext,
                pqcCiphertext);
    }

    private void checkHeader(EncryptedBundle bundle) {
        if (!HYBRID_FORMAT_ID.equals(bundle.getFormatId())) {
            throw new FormatMismatchException("Unexpected format: " + bundle.getFormatId());
        }
        if (!suite.getId().equals(bundle.getSuiteId())) {
            throw new FormatMismatchException("Bundle was produced by suite " + bundle.getSuiteId() +
                    ", not " + suite.getId());
        }
    }

    private void checkBundle(EncryptedBundle bundle) {
        checkHeader(bundle);
        var classicalCiphertext = bundle.getClassicalCiphertext()
                .orElseThrow(() -> new FormatMismatchException("Bundle has no classical KEM ciphertext"));
        var hybridSalt = bundle.getHybridSalt()
                .orElseThrow(() -> new FormatMismatchException("Bundle has no hybrid KDF salt"));
        checkFieldLength(classicalCiphertext, classicalKem.ciphertextLength(), "classical KEM ciphertext");
        checkFieldLength(bundle.getPqcCiphertext(), pqcKem.ciphertextLength(), "post-quantum KEM ciphertext");
        checkFieldLength(bundle.getNonce(), aead.nonceLength(), "nonce");
        checkFieldLength(bundle.getTag(), aead.tagLength(), "tag");
        checkFieldLength(hybridSalt, HYBRID_SALT_LENGTH, "hybrid salt");
        var passphraseSalt = bundle.getPassphraseSalt();
        if (passphraseSalt.isPresent() && passphraseSalt.get().length < KeyManager.SALT_LENGTH) {
            throw new FormatMismatchException("Bundle passphrase salt must be at least " + KeyManager.SALT_LENGTH
                    + " bytes");
        }
    }

    private void checkAlgorithms(KeyMaterial keys) {
        if (!classicalKem.name().equals(keys.getClassical().getAlgorithm())
                || !pqcKem.name().equals(keys.getPqc().getAlgorithm())) {
            throw new InvalidKeyMaterialException("Keys for " + keys.getClassical().getAlgorithm() + "+" +
                    keys.getPqc().getAlgorithm() + " cannot be used with suite " + suite);
        }
    }

    private static void checkFieldLength(byte[] field, int expectedLength, String name) {
        if (field.length != expectedLength) {
            throw new FormatMismatchException("Bundle " + name + " must be " + expectedLength + " bytes");
        }
    }

    @Override
    public String toString() {
        return "HybridCryptoHandler{" + suite + "}";
    }
}
