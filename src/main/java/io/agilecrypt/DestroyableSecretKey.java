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

import java.util.Arrays;

import javax.crypto.SecretKey;

/**
 * Holds raw secret key bytes (a KEM private key or a derived symmetric key) in memory. Unlike
 * {@link javax.crypto.spec.SecretKeySpec}, the {@link #destroy()} method actually scrubs the key material.
 */
public final class DestroyableSecretKey implements SecretKey {

    private final String algorithm;
    private final byte[] keyMaterial;
    private volatile boolean destroyed = false;

    public DestroyableSecretKey(String algorithm, byte[] keyMaterial) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.keyMaterial = requireNonNull(keyMaterial, "keyMaterial").clone();
    }

    /**
     * Creates a key from the given bytes and then wipes the caller's array.
     */
    static DestroyableSecretKey takeOwnership(String algorithm, byte[] keyMaterial) {
        try {
            return new DestroyableSecretKey(algorithm, keyMaterial);
        } finally {
            Utils.wipe(keyMaterial);
        }
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        checkDestroyed();
        return keyMaterial.clone();
    }

    public int length() {
        return keyMaterial.length;
    }

    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(keyMaterial, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    public DestroyableSecretKey copy() {
        checkDestroyed();
        return new DestroyableSecretKey(algorithm, keyMaterial);
    }

    @Override
    public String toString() {
        return "DestroyableSecretKey{" +
                "algorithm='" + algorithm + '\'' +
                ", length=" + keyMaterial.length +
                ", destroyed=" + destroyed +
                '}';
    }

    private void checkDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Key material has been destroyed");
        }
    }
}
