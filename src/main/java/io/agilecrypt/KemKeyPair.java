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

/**
 * A raw-encoded KEM key pair for a named algorithm. The private half is absent for recipients whose key pair is only
 * used for encryption.
 */
public final class KemKeyPair implements Destroyable {
    private final String algorithm;
    private final byte[] publicKey;
    private final DestroyableSecretKey privateKey;

    private KemKeyPair(String algorithm, byte[] publicKey, DestroyableSecretKey privateKey) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.publicKey = requireNonNull(publicKey, "publicKey").clone();
        this.privateKey = privateKey;
    }

    /**
     * Creates a key pair, taking ownership of the private key bytes: the passed array is wiped.
     */
    static KemKeyPair of(String algorithm, byte[] publicKey, byte[] privateKey) {
        return new KemKeyPair(algorithm, publicKey, DestroyableSecretKey.takeOwnership(algorithm, privateKey));
    }

    public static KemKeyPair publicOnly(String algorithm, byte[] publicKey) {
        return new KemKeyPair(algorithm, publicKey, null);
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public byte[] getPublicKey() {
        return publicKey.clone();
    }

    public Optional<DestroyableSecretKey> getPrivateKey() {
        return Optional.ofNullable(privateKey);
    }

    DestroyableSecretKey requirePrivateKey() {
        if (privateKey == null) {
            throw new InvalidKeyMaterialException("No " + algorithm + " private key available");
        }
        return privateKey;
    }

    public KemKeyPair copy() {
        return new KemKeyPair(algorithm, publicKey, privateKey == null ? null : privateKey.copy());
    }

    public KemKeyPair withoutPrivateKey() {
        return publicOnly(algorithm, publicKey);
    }

    @Override
    public void destroy() {
        if (privateKey != null) {
            privateKey.destroy();
        }
    }

    @Override
    public boolean isDestroyed() {
        return privateKey != null && privateKey.isDestroyed();
    }

    @Override
    public String toString() {
        return "KemKeyPair{" +
                "algorithm='" + algorithm + '\'' +
                ", hasPrivateKey=" + (privateKey != null) +
                '}';
    }
}
