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
 * A key derivation function that expands an input secret and a context label into uniformly distributed key
 * material.
 */
public interface Kdf {

    String name();

    /**
     * Derives key material.
     *
     * @param inputKeyMaterial the input secret.
     * @param salt             an optional salt. If null or empty, a zero salt of the hash length is used.
     * @param info             context information used for domain separation.
     * @param length           the number of bytes to derive.
     * @return the derived bytes.
     */
    byte[] derive(byte[] inputKeyMaterial, byte[] salt, byte[] info, int length);
}
