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
 * Encrypts and decrypts data for a single suite. The {@link AgileOrchestrator} treats all handlers uniformly through
 * this interface, so new schemes can be added without changing the orchestrator.
 */
public interface CryptoHandler {

    /**
     * The id of the suite this handler implements.
     *
     * @return the suite id.
     */
    String suiteId();

    /**
     * Cheaply checks whether the given data looks like it was produced by this handler. A positive answer does not
     * guarantee that decryption will succeed.
     *
     * @param data the encrypted data.
     * @return whether this handler recognises the data.
     */
    boolean canHandle(byte[] data);

    /**
     * Encrypts data under this handler's suite.
     *
     * @param plaintext the data to encrypt.
     * @param keys      the source of the recipient keys.
     * @return the encrypted bundle.
     * @throws UnsupportedOperationException if the handler only supports decryption.
     */
    EncryptedBundle encrypt(byte[] plaintext, KeySource keys);

    /**
     * Attempts to decrypt data. Failures are reported in the result rather than thrown, so that the caller can move
     * on to another handler.
     *
     * @param data the encrypted data.
     * @param keys the source of decryption keys.
     * @return the plaintext, or the reason decryption failed.
     */
    DecryptionResult decrypt(byte[] data, KeySource keys);
}
