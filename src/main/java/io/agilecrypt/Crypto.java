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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;

final class Crypto {
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    static final String HASH_ALGORITHM = "SHA-256";
    static final int FINGERPRINT_LENGTH = 8;

    static SecureRandom secureRandom() {
        return SECURE_RANDOM;
    }

    static byte[] randomBytes(int numBytes) {
        byte[] bytes = new byte[numBytes];
        SECURE_RANDOM.nextBytes(bytes);
        return bytes;
    }

    static byte[] hash(byte[]... data) {
        try {
            var digest = MessageDigest.getInstance(HASH_ALGORITHM);
            for (byte[] block : data) {
                digest.update(block);
            }
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Computes a short, non-secret identifier for a set of public keys that is safe to include in log messages.
     */
    static String fingerprint(byte[]... publicKeys) {
        return Utils.hex(Arrays.copyOf(hash(publicKeys), FINGERPRINT_LENGTH));
    }

    static byte[] utf8(String label) {
        return label.getBytes(UTF_8);
    }
}
