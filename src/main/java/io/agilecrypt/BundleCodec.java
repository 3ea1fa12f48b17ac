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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Optional;

import io.agilecrypt.io.CborReader;
import io.agilecrypt.io.CborWriter;

/**
 * Converts {@link EncryptedBundle}s to and from their byte representation. Version 1 of the format is the magic
 * bytes {@code "AGC"}, a single version byte, and then a sequence of CBOR data items in a fixed order:
 * <ol>
 *     <li>format identifier (text)</li>
 *     <li>suite id (text)</li>
 *     <li>classical KEM ciphertext (bytes, or null)</li>
 *     <li>post-quantum KEM ciphertext (bytes)</li>
 *     <li>AEAD nonce (bytes)</li>
 *     <li>ciphertext (bytes)</li>
 *     <li>authentication tag (bytes)</li>
 *     <li>passphrase salt (bytes, or null)</li>
 *     <li>hybrid KDF salt (bytes, or null)</li>
 * </ol>
 * Field lengths are fixed by the suite and are checked by the handler rather than the codec.
 */
public final class BundleCodec {
    public static final String HYBRID_FORMAT_ID = "HYBRID-KEM-AEAD";
    static final int VERSION = 1;

    private static final byte[] MAGIC = { 'A', 'G', 'C' };
    private static final int PREFIX_LENGTH = MAGIC.length + 1;

    private BundleCodec() {}

    public static byte[] serialize(EncryptedBundle bundle) {
        var out = new ByteArrayOutputStream();
        try (var writer = writeHeader(out, bundle.getFormatId(), bundle.getSuiteId())) {
            writer.writeOptionalBytes(bundle.getClassicalCiphertext().orElse(null))
                    .writeBytes(bundle.getPqcCiphertext())
                    .writeBytes(bundle.getNonce())
                    .writeBytes(bundle.getCiphertext())
                    .writeBytes(bundle.getTag())
                    .writeOptionalBytes(bundle.getPassphraseSalt().orElse(null))
                    .writeOptionalBytes(bundle.getHybridSalt().orElse(null));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Parses a complete bundle.
     *
     * @param data the serialized bundle.
     * @return the parsed bundle.
     * @throws FormatMismatchException if the data is not a bundle in a supported version, or is malformed.
     */
    public static EncryptedBundle parse(byte[] data) {
        if (!hasMagic(data)) {
            throw new FormatMismatchException("Data is not an encrypted bundle");
        }
        if (data[MAGIC.length] != VERSION) {
            throw new FormatMismatchException("Unsupported bundle format version: " + data[MAGIC.length]);
        }
        try (var reader = new CborReader(new ByteArrayInputStream(data, PREFIX_LENGTH,
                data.length - PREFIX_LENGTH))) {
            var bundle = EncryptedBundle.builder(reader.readString(), reader.readString())
                    .classicalCiphertext(reader.readOptionalBytes())
                    .pqcCiphertext(reader.readBytes())
                    .nonce(reader.readBytes())
                    .ciphertext(reader.readBytes())
                    .tag(reader.readBytes())
                    .passphraseSalt(reader.readOptionalBytes())
                    .hybridSalt(reader.readOptionalBytes())
                    .build();
            reader.expectEnd();
            return bundle;
        } catch (IOException e) {
            throw new FormatMismatchException("Malformed encrypted bundle", e);
        }
    }

    /**
     * Reads just the header of a bundle, without parsing the remaining fields.
     *
     * @param data the candidate bundle bytes.
     * @return the header, or an empty result if the data does not start with a readable bundle header.
     */
    public static Optional<BundleHeader> peekHeader(byte[] data) {
        if (!hasMagic(data)) {
            return Optional.empty();
        }
        try (var reader = new CborReader(new ByteArrayInputStream(data, PREFIX_LENGTH,
                data.length - PREFIX_LENGTH))) {
            return Optional.of(new BundleHeader(data[MAGIC.length], reader.readString(), reader.readString()));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    /**
     * Encodes the header exactly as it appears at the start of a serialized bundle. Handlers authenticate these bytes
     * so that a bundle cannot be relabelled with a different format or suite.
     */
    static byte[] encodeHeader(String formatId, String suiteId) {
        var out = new ByteArrayOutputStream();
        try {
            writeHeader(out, formatId, suiteId);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static CborWriter writeHeader(ByteArrayOutputStream out, String formatId, String suiteId)
            throws IOException {
        out.write(MAGIC);
        out.write(VERSION);
        return new CborWriter(out).writeString(formatId).writeString(suiteId);
    }

    private static boolean hasMagic(byte[] data) {
        return data != null && data.length > PREFIX_LENGTH
                && Arrays.equals(data, 0, MAGIC.length, MAGIC, 0, MAGIC.length);
    }
}
