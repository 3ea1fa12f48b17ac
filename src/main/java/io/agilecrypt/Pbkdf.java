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

import io.agilecrypt.config.PbkdfParameters;

/**
 * A deliberately expensive password-based key derivation function, used to stretch low-entropy passphrases.
 */
public interface Pbkdf {

    String name();

    /**
     * Stretches a passphrase into a uniformly random secret.
     *
     * @param passphrase the passphrase. Not modified.
     * @param salt       a random salt, unique per derivation.
     * @param parameters the cost parameters.
     * @param length     the number of bytes to produce.
     * @return the stretched secret.
     */
    byte[] stretch(char[] passphrase, byte[] salt, PbkdfParameters parameters, int length);
}
