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

import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import io.agilecrypt.config.PbkdfParameters;

/**
 * PBKDF2 with HMAC-SHA256, for suites that must avoid memory-hard functions. Only the iteration count of the
 * {@link PbkdfParameters} is used.
 */
final class Pbkdf2 implements Pbkdf {
    static final String NAME = "PBKDF2-SHA256";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public byte[] stretch(char[] passphrase, byte[] salt, PbkdfParameters parameters, int length) {
        var spec = new PBEKeySpec(passphrase, salt, parameters.iterations(), length * 8);
        try {
            var factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            return factory.generateSecret(spec).getEncoded();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        } catch (InvalidKeySpecException e) {
            throw new IllegalArgumentException(e);
        } finally {
            spec.clearPassword();
        }
    }
}
