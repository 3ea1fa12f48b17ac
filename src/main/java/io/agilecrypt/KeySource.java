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

import java.util.Optional;

import io.agilecrypt.config.SuiteDefinition;

/**
 * Supplies per-operation key material to crypto handlers. The host creates a key source from whatever secret the
 * user provided, either a passphrase or keys loaded through the {@link KeyManager}. Each call returns new key material
 * that the handler destroys after use.
 */
public interface KeySource {

    /**
     * Returns the recipient keys to encrypt under the given suite. Passphrase-based sources derive keys with a fresh
     * salt, which the handler records in the bundle.
     *
     * @param suite the suite being used for encryption.
     * @return fresh key material.
     */
    KeyMaterial keysForEncryption(SuiteDefinition suite);

    /**
     * Returns the keys needed to decrypt a bundle produced by the given suite.
     *
     * @param suite          the suite named in the bundle.
     * @param passphraseSalt the salt embedded in the bundle, if any. Passphrase-based sources must derive keys with
     *                       exactly this salt.
     * @return fresh key material including the private keys.
     * @throws InvalidKeyMaterialException if no suitable keys are available.
     */
    KeyMaterial keysForDecryption(SuiteDefinition suite, Optional<byte[]> passphraseSalt);

    /**
     * The raw passphrase, for legacy formats that use it directly. Empty for sources without one.
     *
     * @return a copy of the passphrase, which the caller should wipe after use.
     */
    default Optional<char[]> legacyPassphrase() {
        return Optional.empty();
    }

    /**
     * A key source that derives all keys from a passphrase.
     *
     * @param keyManager the key manager used to derive keys.
     * @param passphrase the passphrase. The array is copied.
     * @return the key source.
     */
    static PassphraseKeySource passphrase(KeyManager keyManager, char[] passphrase) {
        return new PassphraseKeySource(keyManager, passphrase, null);
    }

    /**
     * A key source that hands out copies of already loaded key material, matched by suite id.
     *
     * @param keyMaterial the key material for each suite.
     * @return the key source.
     */
    static KeySource keys(KeyMaterial... keyMaterial) {
        return new StaticKeySource(keyMaterial);
    }
}
