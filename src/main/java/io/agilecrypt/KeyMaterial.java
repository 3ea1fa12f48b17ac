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
 * The key pairs used by one hybrid suite: a classical KEM key pair and a post-quantum KEM key pair, plus the salt
 * they were derived with when they came from a passphrase. Key material is created fresh for each operation and
 * should be {@linkplain #destroy() destroyed} as soon as that operation completes.
 */
public final class KeyMaterial implements Destroyable {
    private final String suiteId;
    private final KemKeyPair classical;
    private final KemKeyPair pqc;
    private final byte[] passphraseSalt;

    KeyMaterial(String suiteId, KemKeyPair classical, KemKeyPair pqc, byte[] passphraseSalt) {
        this.suiteId = requireNonNull(suiteId, "suiteId");
        this.classical = requireNonNull(classical, "classical");
        this.pqc = requireNonNull(pqc, "pqc");
        this.passphraseSalt = passphraseSalt == null ? null : passphraseSalt.clone();
    }

    /**
     * Creates key material for encrypting to a recipient whose public keys are known.
     */
    public static KeyMaterial forRecipient(String suiteId, KemKeyPair classicalPublic, KemKeyPair pqcPublic) {
        return new KeyMaterial(suiteId, classicalPublic.withoutPrivateKey(), pqcPublic.withoutPrivateKey(), null);
    }

    public String getSuiteId() {
        return suiteId;
    }

    public KemKeyPair getClassical() {
        return classical;
    }

    public KemKeyPair getPqc() {
        return pqc;
    }

    public Optional<byte[]> getPassphraseSalt() {
        return Optional.ofNullable(passphraseSalt).map(byte[]::clone);
    }

    public boolean hasPrivateKeys() {
        return classical.getPrivateKey().isPresent() && pqc.getPrivateKey().isPresent();
    }

    /**
     * A short hash of the public keys, safe to log and useful to check that two key sets are the same.
     */
    public String fingerprint() {
        return Crypto.fingerprint(classical.getPublicKey(), pqc.getPublicKey());
    }

    public KeyMaterial copy() {
        return new KeyMaterial(suiteId, classical.copy(), pqc.copy(), passphraseSalt);
    }

    public KeyMaterial publicKeysOnly() {
        return new KeyMaterial(suiteId, classical.withoutPrivateKey(), pqc.withoutPrivateKey(), passphraseSalt);
    }

    @Override
    public void destroy() {
        classical.destroy();
        pqc.destroy();
    }

    @Override
    public boolean isDestroyed() {
        return classical.isDestroyed() || pqc.isDestroyed();
    }

    @Override
    public String toString() {
        return "KeyMaterial{" +
                "suiteId='" + suiteId + '\'' +
                ", classical=" + classical.getAlgorithm() +
                ", pqc=" + pqc.getAlgorithm() +
                ", fingerprint=" + fingerprint() +
                '}';
    }
}
