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

import java.util.function.Supplier;

import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA3Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * HKDF (RFC 5869) over HMAC with a configurable hash function.
 */
final class Hkdf implements Kdf {
    static final Hkdf HKDF_SHA256 = new Hkdf("HKDF-SHA256", SHA256Digest::new);
    static final Hkdf HKDF_SHA512 = new Hkdf("HKDF-SHA512", SHA512Digest::new);
    static final Hkdf HKDF_SHA3_512 = new Hkdf("HKDF-SHA3-512", () -> new SHA3Digest(512));

    private final String name;
    private final Supplier<Digest> digest;

    private Hkdf(String name, Supplier<Digest> digest) {
        this.name = name;
        this.digest = digest;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public byte[] derive(byte[] inputKeyMaterial, byte[] salt, byte[] info, int length) {
        var prk = extract(inputKeyMaterial, salt);
        try {
            return expand(prk, info, length);
        } finally {
            Utils.wipe(prk);
        }
    }

    byte[] extract(byte[] inputKeyMaterial, byte[] salt) {
        var hmac = new HMac(digest.get());
        if (salt == null || salt.length == 0) {
            salt = new byte[hmac.getMacSize()];
        }
        return hmac(hmac, salt, inputKeyMaterial);
    }

    byte[] expand(byte[] prk, byte[] info, int outputKeySizeBytes) {
        var hmac = new HMac(digest.get());
        int tagSize = hmac.getMacSize();
        if (outputKeySizeBytes <= 0 || outputKeySizeBytes > 255 * tagSize) {
            throw new IllegalArgumentException("Output size must be >= 1 and <= " + 255 * tagSize);
        }
        byte[] last = new byte[0];
        byte[] counter = new byte[1];
        byte[] output = new byte[outputKeySizeBytes];
        for (int i = 0; i < outputKeySizeBytes; i += tagSize) {
            counter[0]++;
            var next = hmac(hmac, prk, last, info, counter);
            Utils.wipe(last);
            last = next;
            System.arraycopy(last, 0, output, i, Math.min(outputKeySizeBytes - i, tagSize));
        }
        Utils.wipe(last);
        return output;
    }

    private static byte[] hmac(HMac hmac, byte[] key, byte[]... data) {
        hmac.init(new KeyParameter(key));
        for (byte[] block : data) {
            hmac.update(block, 0, block.length);
        }
        var tag = new byte[hmac.getMacSize()];
        hmac.doFinal(tag, 0);
        return tag;
    }
}
