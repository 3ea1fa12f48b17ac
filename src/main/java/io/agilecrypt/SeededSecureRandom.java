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

import org.bouncycastle.crypto.digests.SHAKEDigest;

/**
 * A {@link SecureRandom} whose output is a deterministic function of a seed: the SHAKE256 output stream of the seed.
 * Key pair generators that only accept a source of randomness can be made deterministic by passing them an
 * instance of this class. It must never be used for anything other than deriving keys from an already uniformly
 * random seed.
 */
final class SeededSecureRandom extends SecureRandom {
    private static final long serialVersionUID = 1L;

    private final transient SHAKEDigest xof = new SHAKEDigest(256);

    SeededSecureRandom(byte[] seed) {
        xof.update(seed, 0, seed.length);
    }

    @Override
    public synchronized void nextBytes(byte[] bytes) {
        xof.doOutput(bytes, 0, bytes.length);
    }

    @Override
    public void setSeed(long seed) {
        // Called from the java.util.Random constructor; ignored
    }

    @Override
    public synchronized void setSeed(byte[] seed) {
        throw new UnsupportedOperationException("Deterministic random source cannot be reseeded");
    }

    @Override
    public byte[] generateSeed(int numBytes) {
        var seed = new byte[numBytes];
        nextBytes(seed);
        return seed;
    }
}
