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

import java.nio.file.Path;

/**
 * Locations of raw private key files, as supplied by the host after prompting the user.
 *
 * @param classicalPrivateKey file holding the raw classical KEM private key.
 * @param pqcPrivateKey       file holding the raw post-quantum KEM private key.
 */
public record KeyFiles(Path classicalPrivateKey, Path pqcPrivateKey) {
    public KeyFiles {
        requireNonNull(classicalPrivateKey, "classicalPrivateKey");
        requireNonNull(pqcPrivateKey, "pqcPrivateKey");
    }
}
