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

package io.agilecrypt.config;

/**
 * Cost parameters for a password-based key derivation function. Argon2id uses all three values; PBKDF2 only uses
 * the iteration count.
 *
 * @param memoryKiB   the memory cost in kibibytes.
 * @param iterations  the number of passes (Argon2id) or iterations (PBKDF2).
 * @param parallelism the number of lanes.
 */
public record PbkdfParameters(int memoryKiB, int iterations, int parallelism) {

    /**
     * 64 MiB, 3 passes, 1 lane. Takes a few hundred milliseconds on typical hardware.
     */
    public static final PbkdfParameters ARGON2ID_DEFAULTS = new PbkdfParameters(65536, 3, 1);

    public PbkdfParameters {
        if (memoryKiB < 0 || iterations < 1 || parallelism < 1) {
            throw new ConfigurationException("Invalid PBKDF parameters: memory=" + memoryKiB + "KiB, iterations="
                    + iterations + ", parallelism=" + parallelism);
        }
    }

    public static PbkdfParameters iterations(int iterations) {
        return new PbkdfParameters(0, iterations, 1);
    }
}
