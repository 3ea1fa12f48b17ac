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

import java.util.Optional;

/**
 * The output of hybrid encryption: the ciphertext plus every value (other than private keys) needed to decrypt it.
 * Bundles are immutable. Use {@link BundleCodec} to convert them to and from bytes.
 */
public final class EncryptedBundle {
    private final String formatId;
    private final String suiteId;
    private final byte[] classicalCiphertext;
    private final byte[] pqcCiphertext;
    private final byte[] nonce;
    private final byte[] ciphertext;
    private final byte[] tag;
    private final byte[] passphraseSalt;
    private final byte[] hybridSalt;

    private EncryptedBundle(Builder builder) {
        this.formatId = requireNonNull(builder.formatId, "formatId");
        this.suiteId = requireNonNull(builder.suiteId, "suiteId");
        this.classicalCiphertext = builder.classicalCiphertext;
        this.pqcCiphertext = requireNonNull(builder.pqcCiphertext, "pqcCiphertext");
        this.nonce = requireNonNull(builder.nonce, "nonce");
        this.ciphertext = requireNonNull(builder.ciphertext, "ciphertext");
        this.tag = requireNonNull(builder.tag, "tag");
        this.passphraseSalt = builder.passphraseSalt;
        this.hybridSalt = builder.hybridSalt;
    }

    public static Builder builder(String formatId, String suiteId) {
        return new Builder(formatId, suiteId);
    }

    public Builder toBuilder() {
        return new Builder(formatId, suiteId)
                .classicalCiphertext(classicalCiphertext)
                .pqcCiphertext(pqcCiphertext)
                .nonce(nonce)
                .ciphertext(ciphertext)
                .tag(tag)
                .passphraseSalt(passphraseSalt)
                .hybridSalt(hybridSalt);
    }

    public String getFormatId() {
        return formatId;
    }

    public String getSuiteId() {
        return suiteId;
    }

    /**
     * The classical KEM encapsulation. For X25519 this is the sender's ephemeral public key.
     */
    public Optional<byte[]> getClassicalCiphertext() {
        return Optional.ofNullable(classicalCiphertext).map(byte[]::clone);
    }

    public byte[] getPqcCiphertext() {
        return pqcCiphertext.clone();
    }

    public byte[] getNonce() {
        return nonce.clone();
    }

    public byte[] getCiphertext() {
        return ciphertext.clone();
    }

    public byte[] getTag() {
        return tag.clone();
    }

    /**
     * The salt that was used to derive the recipient keys from a passphrase, if the keys were passphrase-derived.
     */
    public Optional<byte[]> getPassphraseSalt() {
        return Optional.ofNullable(passphraseSalt).map(byte[]::clone);
    }

    public Optional<byte[]> getHybridSalt() {
        return Optional.ofNullable(hybridSalt).map(byte[]::clone);
    }

    @Override
    public String toString() {
        return "EncryptedBundle{" +
                "formatId='" + formatId + '\'' +
                ", suiteId='" + suiteId + '\'' +
                ", ciphertextLength=" + ciphertext.length +
                '}';
    }

    public static final class Builder {
        private final String formatId;
        private final String suiteId;
        private byte[] classicalCiphertext;
        private byte[] pqcCiphertext;
        private byte[] nonce;
        private byte[] ciphertext;
        private byte[] tag;
        private byte[] passphraseSalt;
        private byte[] hybridSalt;

        private Builder(String formatId, String suiteId) {
            this.formatId = formatId;
            this.suiteId = suiteId;
        }

        public Builder classicalCiphertext(byte[] classicalCiphertext) {
            this.classicalCiphertext = copyOf(classicalCiphertext);
            return this;
        }

        public Builder pqcCiphertext(byte[] pqcCiphertext) {
            this.pqcCiphertext = copyOf(pqcCiphertext);
            return this;
        }

        public Builder nonce(byte[] nonce) {
            this.nonce = copyOf(nonce);
            return this;
        }

        public Builder ciphertext(byte[] ciphertext) {
            this.ciphertext = copyOf(ciphertext);
            return this;
        }

        public Builder tag(byte[] tag) {
            this.tag = copyOf(tag);
            return this;
        }

        public Builder passphraseSalt(byte[] passphraseSalt) {
            this.passphraseSalt = copyOf(passphraseSalt);
            return this;
        }

        public Builder hybridSalt(byte[] hybridSalt) {
            this.hybridSalt = copyOf(hybridSalt);
            return this;
        }

        public EncryptedBundle build() {
            return new EncryptedBundle(this);
        }

        private static byte[] copyOf(byte[] data) {
            return data == null ? null : data.clone();
        }
    }
}
