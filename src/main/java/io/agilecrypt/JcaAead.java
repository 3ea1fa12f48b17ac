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

import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.spec.AlgorithmParameterSpec;
import java.util.Arrays;
import java.util.function.Function;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AEAD ciphers provided by the JDK. A new {@link Cipher} is created for every call, so instances are thread-safe.
 */
final class JcaAead implements Aead {
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_LENGTH = 16;

    static final JcaAead AES_256_GCM = new JcaAead("AES256GCM", "AES/GCM/NoPadding", "AES", 32,
            nonce -> new GCMParameterSpec(TAG_LENGTH * 8, nonce));
    static final JcaAead AES_128_GCM = new JcaAead("AES128GCM", "AES/GCM/NoPadding", "AES", 16,
            nonce -> new GCMParameterSpec(TAG_LENGTH * 8, nonce));
    static final JcaAead CHACHA20_POLY1305 = new JcaAead("ChaCha20Poly1305", "ChaCha20-Poly1305", "ChaCha20", 32,
            IvParameterSpec::new);

    private final String name;
    private final String transformation;
    private final String keyAlgorithm;
    private final int keyLength;
    private final Function<byte[], AlgorithmParameterSpec> nonceSpec;

    private JcaAead(String name, String transformation, String keyAlgorithm, int keyLength,
            Function<byte[], AlgorithmParameterSpec> nonceSpec) {
        this.name = name;
        this.transformation = transformation;
        this.keyAlgorithm = keyAlgorithm;
        this.keyLength = keyLength;
        this.nonceSpec = nonceSpec;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int keyLength() {
        return keyLength;
    }

    @Override
    public int nonceLength() {
        return NONCE_LENGTH;
    }

    @Override
    public int tagLength() {
        return TAG_LENGTH;
    }

    @Override
    public Sealed seal(byte[] key, byte[] nonce, byte[] plaintext, byte[] associatedData) {
        try {
            var cipher = init(Cipher.ENCRYPT_MODE, key, nonce, associatedData);
            var output = cipher.doFinal(plaintext);
            int split = output.length - TAG_LENGTH;
            return new Sealed(Arrays.copyOf(output, split), Arrays.copyOfRange(output, split, output.length));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(name + " encryption failed", e);
        }
    }

    @Override
    public byte[] open(byte[] key, byte[] nonce, byte[] ciphertext, byte[] tag, byte[] associatedData) {
        if (tag.length != TAG_LENGTH) {
            throw new AuthenticationException("Authentication failed");
        }
        try {
            var cipher = init(Cipher.DECRYPT_MODE, key, nonce, associatedData);
            return cipher.doFinal(Utils.concat(ciphertext, tag));
        } catch (AEADBadTagException e) {
            throw new AuthenticationException("Authentication failed", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(name + " decryption failed", e);
        }
    }

    private Cipher init(int mode, byte[] key, byte[] nonce, byte[] associatedData) throws GeneralSecurityException {
        Utils.requireLength(key, keyLength, name + " key");
        Utils.require(nonce.length == NONCE_LENGTH, name + " nonce must be " + NONCE_LENGTH + " bytes");
        Cipher cipher;
        try {
            cipher = Cipher.getInstance(transformation);
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new IllegalStateException(transformation + " not supported by this JVM", e);
        }
        cipher.init(mode, new SecretKeySpec(key, keyAlgorithm), nonceSpec.apply(nonce));
        if (associatedData.length > 0) {
            cipher.updateAAD(associatedData);
        }
        return cipher;
    }
}
