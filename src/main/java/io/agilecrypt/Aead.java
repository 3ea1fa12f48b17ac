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

/**
 * An authenticated encryption with associated data (AEAD) cipher. The ciphertext and authentication tag are kept
 * separate so that the bundle format can store them as distinct fields.
 */
public interface Aead {

    String name();

    int keyLength();

    int nonceLength();

    int tagLength();

    /**
     * Encrypts and authenticates the plaintext. The nonce must never be reused with the same key.
     *
     * @param key            the symmetric key, exactly {@link #keyLength()} bytes.
     * @param nonce          the nonce, exactly {@link #nonceLength()} bytes.
     * @param plaintext      the data to encrypt.
     * @param associatedData data that is authenticated but not encrypted. May be empty.
     * @return the ciphertext and tag.
     */
    Sealed seal(byte[] key, byte[] nonce, byte[] plaintext, byte[] associatedData);

    /**
     * Verifies the tag and decrypts the ciphertext. No plaintext is released if verification fails.
     *
     * @param key            the symmetric key.
     * @param nonce          the nonce used for encryption.
     * @param ciphertext     the ciphertext.
     * @param tag            the authentication tag.
     * @param associatedData the associated data that was passed to {@link #seal(byte[], byte[], byte[], byte[])}.
     * @return the decrypted plaintext.
     * @throws AuthenticationException if the tag is invalid, which covers both tampering and a wrong key.
     */
    byte[] open(byte[] key, byte[] nonce, byte[] ciphertext, byte[] tag, byte[] associatedData);

    record Sealed(byte[] ciphertext, byte[] tag) {}
}
