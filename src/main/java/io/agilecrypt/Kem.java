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

import java.util.Arrays;

import javax.security.auth.Destroyable;

/**
 * A Key Encapsulation Mechanism (KEM). The sender uses the recipient's public key to produce a random shared secret
 * along with an encapsulation (ciphertext) of that secret. The recipient recovers the same secret from the
 * encapsulation using their private key. Both the classical and post-quantum halves of a hybrid suite are KEMs;
 * for X25519 the encapsulation is simply an ephemeral public key.
 * <p>
 * All keys are exchanged as raw byte encodings, whose lengths are fixed by the algorithm and reported by the
 * {@code ...Length()} methods.
 */
public interface Kem {

    /**
     * The canonical name of the algorithm, such as "X25519" or "ML-KEM-768".
     *
     * @return the algorithm name.
     */
    String name();

    int publicKeyLength();

    int privateKeyLength();

    int ciphertextLength();

    /**
     * The length of seed required by {@link #deriveKeyPair(byte[])}.
     *
     * @return the seed length in bytes.
     */
    int seedLength();

    /**
     * Generates a fresh random key pair.
     *
     * @return the generated key pair.
     */
    KemKeyPair generateKeyPair();

    /**
     * Deterministically derives a key pair from the given seed. Calling this method twice with the same seed always
     * produces the same key pair, which is what allows keys derived from a passphrase to be recreated in a later
     * session.
     *
     * @param seed the seed, which must be exactly {@link #seedLength()} bytes of uniformly random data.
     * @return the derived key pair.
     * @throws InvalidKeyMaterialException if the seed has the wrong length.
     */
    KemKeyPair deriveKeyPair(byte[] seed);

    /**
     * Reconstructs the public key that corresponds to the given encoded private key.
     *
     * @param privateKey the raw private key.
     * @return the raw public key.
     * @throws InvalidKeyMaterialException if the private key is malformed.
     */
    byte[] publicKeyFromPrivate(byte[] privateKey);

    /**
     * Generates a random shared secret and encapsulates it for the owner of the given public key.
     *
     * @param publicKey the recipient's raw public key.
     * @return the encapsulation and shared secret.
     * @throws InvalidKeyMaterialException if the public key is malformed.
     */
    Encapsulation encapsulate(byte[] publicKey);

    /**
     * Recovers the shared secret from an encapsulation.
     *
     * @param privateKey the recipient's private key.
     * @param ciphertext the encapsulation produced by {@link #encapsulate(byte[])}.
     * @return the shared secret. Callers should wipe it after use.
     * @throws InvalidKeyMaterialException if the private key or ciphertext is malformed.
     */
    byte[] decapsulate(DestroyableSecretKey privateKey, byte[] ciphertext);

    /**
     * The result of encapsulating a shared secret.
     *
     * @param ciphertext   the encapsulation to send to the recipient.
     * @param sharedSecret the shared secret, which must be kept private.
     */
    record Encapsulation(byte[] ciphertext, byte[] sharedSecret) implements Destroyable {
        @Override
        public void destroy() {
            Arrays.fill(sharedSecret, (byte) 0);
        }

        @Override
        public String toString() {
            return "Encapsulation{ciphertextLength=" + ciphertext.length + "}";
        }
    }
}
