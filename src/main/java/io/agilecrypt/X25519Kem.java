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

import static software.pando.crypto.nacl.Subtle.scalarMultiplication;

import java.math.BigInteger;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.XECPrivateKey;
import java.security.interfaces.XECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.NamedParameterSpec;
import java.security.spec.XECPrivateKeySpec;
import java.security.spec.XECPublicKeySpec;

/**
 * X25519 Diffie-Hellman used as a KEM. Encapsulation generates an ephemeral key pair: the ephemeral public key is
 * the ciphertext and the raw Diffie-Hellman output is the shared secret.
 */
final class X25519Kem implements Kem {
    private static final RedactedLogger logger = RedactedLogger.getLogger(X25519Kem.class);

    static final String NAME = "X25519";
    private static final int KEY_LENGTH = 32;
    private static final BigInteger FIELD_PRIME = BigInteger.TWO.pow(255).subtract(BigInteger.valueOf(19));

    private static final KeyPairGenerator keyPairGenerator;
    private static final KeyFactory keyFactory;
    private static final PublicKey BASE_POINT;

    static {
        try {
            keyPairGenerator = KeyPairGenerator.getInstance("X25519");
            keyFactory = KeyFactory.getInstance("X25519");
            BASE_POINT = keyFactory.generatePublic(new XECPublicKeySpec(NamedParameterSpec.X25519,
                    BigInteger.valueOf(9)));
        } catch (NoSuchAlgorithmException | InvalidKeySpecException e) {
            throw new AssertionError("X25519 not supported", e);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int publicKeyLength() {
        return KEY_LENGTH;
    }

    @Override
    public int privateKeyLength() {
        return KEY_LENGTH;
    }

    @Override
    public int ciphertextLength() {
        return KEY_LENGTH;
    }

    @Override
    public int seedLength() {
        return KEY_LENGTH;
    }

    @Override
    public KemKeyPair generateKeyPair() {
        KeyPair keyPair;
        synchronized (keyPairGenerator) {
            keyPair = keyPairGenerator.generateKeyPair();
        }
        var privateKey = ((XECPrivateKey) keyPair.getPrivate()).getScalar()
                .orElseThrow(() -> new IllegalStateException("X25519 private key cannot be encoded"));
        return KemKeyPair.of(NAME, encodePublicKey(keyPair.getPublic()), privateKey);
    }

    @Override
    public KemKeyPair deriveKeyPair(byte[] seed) {
        Utils.requireLength(seed, KEY_LENGTH, "X25519 seed");
        // X25519 clamps the scalar itself, so any 32 bytes are a valid private key
        var privateKey = seed.clone();
        return KemKeyPair.of(NAME, publicKeyFromPrivate(privateKey), privateKey);
    }

    @Override
    public byte[] publicKeyFromPrivate(byte[] privateKey) {
        return scalarMultiplication(decodePrivateKey(privateKey), BASE_POINT);
    }

    @Override
    public Encapsulation encapsulate(byte[] publicKey) {
        var recipient = decodePublicKey(publicKey);
        KeyPair ephemeral;
        synchronized (keyPairGenerator) {
            ephemeral = keyPairGenerator.generateKeyPair();
        }
        var sharedSecret = agree(ephemeral.getPrivate(), recipient);
        return new Encapsulation(encodePublicKey(ephemeral.getPublic()), sharedSecret);
    }

    @Override
    public byte[] decapsulate(DestroyableSecretKey privateKey, byte[] ciphertext) {
        var ephemeral = decodePublicKey(ciphertext);
        var encoded = privateKey.getEncoded();
        try {
            return agree(decodePrivateKey(encoded), ephemeral);
        } finally {
            Utils.wipe(encoded);
        }
    }

    private static byte[] agree(PrivateKey privateKey, PublicKey publicKey) {
        try {
            return scalarMultiplication(privateKey, publicKey);
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.debug("X25519 key agreement rejected the peer public key");
            throw new InvalidKeyMaterialException("X25519 key agreement failed", e);
        }
    }

    private static byte[] encodePublicKey(PublicKey pk) {
        assert pk instanceof XECPublicKey;
        return Utils.toUnsignedLittleEndian(((XECPublicKey) pk).getU(), KEY_LENGTH);
    }

    /**
     * Decodes a public key, rejecting non-canonical encodings (top bit set or u &gt;= p) so that every public key
     * has exactly one accepted encoding.
     */
    static PublicKey decodePublicKey(byte[] encoded) {
        Utils.requireLength(encoded, KEY_LENGTH, "X25519 public key");
        var u = Utils.fromUnsignedLittleEndian(encoded);
        if (u.compareTo(FIELD_PRIME) >= 0) {
            throw new InvalidKeyMaterialException("Non-canonical X25519 public key");
        }
        try {
            return keyFactory.generatePublic(new XECPublicKeySpec(NamedParameterSpec.X25519, u));
        } catch (InvalidKeySpecException e) {
            throw new InvalidKeyMaterialException("Invalid X25519 public key", e);
        }
    }

    private static PrivateKey decodePrivateKey(byte[] encoded) {
        Utils.requireLength(encoded, KEY_LENGTH, "X25519 private key");
        try {
            return keyFactory.generatePrivate(new XECPrivateKeySpec(NamedParameterSpec.X25519, encoded));
        } catch (InvalidKeySpecException e) {
            throw new InvalidKeyMaterialException("Invalid X25519 private key", e);
        }
    }
}
