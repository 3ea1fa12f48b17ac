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

import java.security.SecureRandom;
import java.util.Arrays;

import javax.security.auth.DestroyFailedException;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMExtractor;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyGenerationParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMKeyPairGenerator;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPrivateKeyParameters;
import org.bouncycastle.pqc.crypto.mlkem.MLKEMPublicKeyParameters;

/**
 * ML-KEM (FIPS 203) backed by the BouncyCastle lightweight API. Keys use the standard encodings: the public key is
 * the encapsulation key {@code ek} and the private key is the expanded decapsulation key
 * {@code dk = dk_PKE || ek || H(ek) || z}, so the public key can always be sliced out of the private key.
 */
final class MlKem implements Kem {
    private static final int SEED_LENGTH = 64;
    private static final int POLY_BYTES = 384;
    private static final int SYM_BYTES = 32;

    static final MlKem ML_KEM_512 = new MlKem("ML-KEM-512", MLKEMParameters.ml_kem_512, 2, 768);
    static final MlKem ML_KEM_768 = new MlKem("ML-KEM-768", MLKEMParameters.ml_kem_768, 3, 1088);
    static final MlKem ML_KEM_1024 = new MlKem("ML-KEM-1024", MLKEMParameters.ml_kem_1024, 4, 1568);

    private final String name;
    private final MLKEMParameters parameters;
    private final int k;
    private final int ciphertextLength;

    private MlKem(String name, MLKEMParameters parameters, int k, int ciphertextLength) {
        this.name = name;
        this.parameters = parameters;
        this.k = k;
        this.ciphertextLength = ciphertextLength;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int publicKeyLength() {
        return POLY_BYTES * k + SYM_BYTES;
    }

    @Override
    public int privateKeyLength() {
        return 2 * POLY_BYTES * k + 3 * SYM_BYTES;
    }

    @Override
    public int ciphertextLength() {
        return ciphertextLength;
    }

    @Override
    public int seedLength() {
        return SEED_LENGTH;
    }

    @Override
    public KemKeyPair generateKeyPair() {
        return generate(Crypto.secureRandom());
    }

    @Override
    public KemKeyPair deriveKeyPair(byte[] seed) {
        Utils.requireLength(seed, SEED_LENGTH, name + " seed");
        return generate(new SeededSecureRandom(seed));
    }

    private KemKeyPair generate(SecureRandom random) {
        var generator = new MLKEMKeyPairGenerator();
        generator.init(new MLKEMKeyGenerationParameters(random, parameters));
        AsymmetricCipherKeyPair keyPair = generator.generateKeyPair();
        var publicKey = ((MLKEMPublicKeyParameters) keyPair.getPublic()).getEncoded();
        var privateKey = ((MLKEMPrivateKeyParameters) keyPair.getPrivate()).getEncoded();
        if (privateKey.length != privateKeyLength()) {
            Utils.wipe(privateKey);
            throw new IllegalStateException("Unexpected " + name + " private key encoding");
        }
        return KemKeyPair.of(name, publicKey, privateKey);
    }

    @Override
    public byte[] publicKeyFromPrivate(byte[] privateKey) {
        Utils.requireLength(privateKey, privateKeyLength(), name + " private key");
        int offset = POLY_BYTES * k;
        return Arrays.copyOfRange(privateKey, offset, offset + publicKeyLength());
    }

    @Override
    public Encapsulation encapsulate(byte[] publicKey) {
        Utils.requireLength(publicKey, publicKeyLength(), name + " public key");
        MLKEMPublicKeyParameters recipient;
        try {
            recipient = new MLKEMPublicKeyParameters(parameters, publicKey);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("Invalid " + name + " public key", e);
        }
        var encapsulated = new MLKEMGenerator(Crypto.secureRandom()).generateEncapsulated(recipient);
        var result = new Encapsulation(encapsulated.getEncapsulation(), encapsulated.getSecret());
        try {
            encapsulated.destroy();
        } catch (DestroyFailedException e) {
            throw new IllegalStateException(e);
        }
        return result;
    }

    @Override
    public byte[] decapsulate(DestroyableSecretKey privateKey, byte[] ciphertext) {
        if (ciphertext.length != ciphertextLength) {
            throw new InvalidKeyMaterialException(name + " ciphertext must be " + ciphertextLength + " bytes");
        }
        var encoded = Utils.requireLength(privateKey.getEncoded(), privateKeyLength(), name + " private key");
        try {
            var extractor = new MLKEMExtractor(new MLKEMPrivateKeyParameters(parameters, encoded));
            // Invalid ciphertexts are implicitly rejected: they yield a pseudorandom secret rather than an error
            return extractor.extractSecret(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyMaterialException("Invalid " + name + " private key", e);
        } finally {
            Utils.wipe(encoded);
        }
    }
}
