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

import java.util.Optional;

import javax.security.auth.Destroyable;

import io.agilecrypt.config.SuiteDefinition;

/**
 * Derives keys from a passphrase through the {@link KeyManager}. Encryption uses a fresh random salt each time;
 * decryption uses the salt recorded in the bundle.
 */
public final class PassphraseKeySource implements KeySource, Destroyable {
    private final KeyManager keyManager;
    private final char[] passphrase;
    private final byte[] encryptionSalt;
    private volatile boolean destroyed;

    PassphraseKeySource(KeyManager keyManager, char[] passphrase, byte[] encryptionSalt) {
        this.keyManager = requireNonNull(keyManager, "keyManager");
        this.passphrase = requireNonNull(passphrase, "passphrase").clone();
        this.encryptionSalt = encryptionSalt == null ? null : encryptionSalt.clone();
    }

    /**
     * Returns a copy of this source that always encrypts with the given salt. Only for reproducible tests.
     */
    PassphraseKeySource withFixedEncryptionSalt(byte[] salt) {
        return new PassphraseKeySource(keyManager, passphrase, requireNonNull(salt));
    }

    @Override
    public KeyMaterial keysForEncryption(SuiteDefinition suite) {
        checkDestroyed();
        var salt = encryptionSalt != null ? encryptionSalt.clone() : keyManager.newSalt();
        return keyManager.deriveKeysFromPassphrase(passphrase, salt, suite);
    }

    @Override
    public KeyMaterial keysForDecryption(SuiteDefinition suite, Optional<byte[]> passphraseSalt) {
        checkDestroyed();
        var salt = passphraseSalt.orElseThrow(() ->
                new InvalidKeyMaterialException("Data was not encrypted with passphrase-derived keys"));
        return keyManager.deriveKeysFromPassphrase(passphrase, salt, suite);
    }

    @Override
    public Optional<char[]> legacyPassphrase() {
        checkDestroyed();
        return Optional.of(passphrase.clone());
    }

    @Override
    public void destroy() {
        destroyed = true;
        Utils.wipe(passphrase);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Passphrase has been destroyed");
        }
    }
}
