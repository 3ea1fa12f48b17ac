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

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

import io.agilecrypt.config.PbkdfParameters;

final class Argon2idPbkdf implements Pbkdf {
    static final String NAME = "Argon2id";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] stretch(char[] passphrase, byte[] salt, PbkdfParameters parameters, int length) {
        Utils.require(parameters.memoryKiB() >= 8 * parameters.parallelism(),
                "Argon2id memory must be at least 8KiB per lane");
        var argon2 = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withMemoryAsKB(parameters.memoryKiB())
                .withIterations(parameters.iterations())
                .withParallelism(parameters.parallelism())
                .withSalt(salt)
                .build();
        var generator = new Argon2BytesGenerator();
        generator.init(argon2);
        var output = new byte[length];
        generator.generateBytes(passphrase, output);
        return output;
    }
}
