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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class MlKemTest {

    @DataProvider
    public Object[][] parameterSets() {
        return new Object[][] {
                { MlKem.ML_KEM_512, 800, 1632, 768 },
                { MlKem.ML_KEM_768, 1184, 2400, 1088 },
                { MlKem.ML_KEM_1024, 1568, 3168, 1568 },
        };
    }

    @Test(dataProvider = "parameterSets")
    public void shouldProduceStandardSizes(MlKem kem, int publicKeyLength, int privateKeyLength,
            int ciphertextLength) {
        var keyPair = kem.generateKeyPair();
        var encapsulation = kem.encapsulate(keyPair.getPublicKey());

        assertThat(keyPair.getPublicKey()).hasSize(publicKeyLength);
        assertThat(keyPair.getPrivateKey().orElseThrow().length()).isEqualTo(privateKeyLength);
        assertThat(encapsulation.ciphertext()).hasSize(ciphertextLength);
        assertThat(encapsulation.sharedSecret()).hasSize(32);
    }

    @Test(dataProvider = "parameterSets")
    public void shouldRecoverSharedSecret(MlKem kem, int publicKeyLength, int privateKeyLength,
            int ciphertextLength) {
        var keyPair = kem.generateKeyPair();

        var encapsulation = kem.encapsulate(keyPair.getPublicKey());
        var secret = kem.decapsulate(keyPair.getPrivateKey().orElseThrow(), encapsulation.ciphertext());

        assertThat(secret).isEqualTo(encapsulation.sharedSecret());
    }

    @Test
    public void shouldDeriveSameKeyPairFromSameSeed() {
        var seed = new byte[64];
        Arrays.fill(seed, (byte) 42);

        var first = MlKem.ML_KEM_768.deriveKeyPair(seed);
        var second = MlKem.ML_KEM_768.deriveKeyPair(seed);

        assertThat(first.getPublicKey()).isEqualTo(second.getPublicKey());
        assertThat(first.getPrivateKey().orElseThrow().getEncoded())
                .isEqualTo(second.getPrivateKey().orElseThrow().getEncoded());
    }

    @Test
    public void shouldDeriveDifferentKeyPairsFromDifferentSeeds() {
        var seed = new byte[64];
        var first = MlKem.ML_KEM_768.deriveKeyPair(seed);
        seed[63] = 1;
        var second = MlKem.ML_KEM_768.deriveKeyPair(seed);

        assertThat(first.getPublicKey()).isNotEqualTo(second.getPublicKey());
    }

    @Test
    public void shouldSlicePublicKeyOutOfPrivateKey() {
        var keyPair = MlKem.ML_KEM_1024.generateKeyPair();
        var privateKey = keyPair.getPrivateKey().orElseThrow().getEncoded();

        assertThat(MlKem.ML_KEM_1024.publicKeyFromPrivate(privateKey)).isEqualTo(keyPair.getPublicKey());
    }

    @Test
    public void shouldImplicitlyRejectModifiedCiphertext() {
        var keyPair = MlKem.ML_KEM_768.generateKeyPair();
        var encapsulation = MlKem.ML_KEM_768.encapsulate(keyPair.getPublicKey());
        var ciphertext = encapsulation.ciphertext();
        ciphertext[0] ^= 1;

        var secret = MlKem.ML_KEM_768.decapsulate(keyPair.getPrivateKey().orElseThrow(), ciphertext);

        assertThat(secret).isNotEqualTo(encapsulation.sharedSecret());
    }

    @Test
    public void shouldRejectWrongLengthSeed() {
        assertThatThrownBy(() -> MlKem.ML_KEM_768.deriveKeyPair(new byte[32]))
                .isInstanceOf(InvalidKeyMaterialException.class);
    }
}
