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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPEncryptedData;
import org.bouncycastle.openpgp.PGPEncryptedDataList;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPMarker;
import org.bouncycastle.openpgp.PGPPBEEncryptedData;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.bc.BcPGPObjectFactory;
import org.bouncycastle.openpgp.operator.bc.BcPBEDataDecryptorFactory;
import org.bouncycastle.openpgp.operator.bc.BcPGPDigestCalculatorProvider;
import org.bouncycastle.util.io.Streams;

import io.agilecrypt.DecryptionResult.Reason;

/**
 * Decrypt-only support for data written before hybrid encryption existed: OpenPGP messages encrypted with a
 * passphrase (as produced by {@code gpg --symmetric}), either ASCII-armored or binary. New data is never encrypted
 * in this format, so {@link #encrypt(byte[], KeySource)} always fails.
 */
public final class LegacyOpenPgpHandler implements CryptoHandler {
    private static final RedactedLogger logger = RedactedLogger.getLogger(LegacyOpenPgpHandler.class);

    public static final String DEFAULT_SUITE_ID = "LEGACY-OPENPGP";

    private static final byte[] ARMOR_HEADER = "-----BEGIN PGP MESSAGE-----".getBytes(US_ASCII);
    private static final int TAG_PUBLIC_KEY_ENCRYPTED_SESSION_KEY = 1;
    private static final int TAG_SYMMETRIC_KEY_ENCRYPTED_SESSION_KEY = 3;
    private static final int TAG_MARKER = 10;

    private final String suiteId;

    public LegacyOpenPgpHandler() {
        this(DEFAULT_SUITE_ID);
    }

    public LegacyOpenPgpHandler(String suiteId) {
        this.suiteId = requireNonNull(suiteId, "suiteId");
    }

    @Override
    public String suiteId() {
        return suiteId;
    }

    @Override
    public boolean canHandle(byte[] data) {
        if (data == null || data.length == 0) {
            return false;
        }
        if (startsWithArmorHeader(data)) {
            return true;
        }
        int first = data[0] & 0xFF;
        if ((first & 0x80) == 0) {
            return false;
        }
        // New-format packets keep the tag in the low six bits, old-format ones in bits 2-5
        int tag = (first & 0x40) != 0 ? first & 0x3F : (first >> 2) & 0x0F;
        return tag == TAG_SYMMETRIC_KEY_ENCRYPTED_SESSION_KEY || tag == TAG_PUBLIC_KEY_ENCRYPTED_SESSION_KEY
                || tag == TAG_MARKER;
    }

    @Override
    public EncryptedBundle encrypt(byte[] plaintext, KeySource keys) {
        throw new UnsupportedOperationException("Legacy OpenPGP format is decrypt-only");
    }

    @Override
    public DecryptionResult decrypt(byte[] data, KeySource keys) {
        if (!canHandle(data)) {
            return DecryptionResult.failure(Reason.FORMAT_MISMATCH);
        }
        var passphrase = keys.legacyPassphrase().orElse(null);
        if (passphrase == null) {
            logger.debug("No passphrase available for legacy suite {}", suiteId);
            return DecryptionResult.failure(Reason.INVALID_KEY);
        }
        try {
            return DecryptionResult.success(decrypt(data, passphrase));
        } catch (FormatMismatchException e) {
            logger.debug("Legacy suite {} cannot parse data: {}", suiteId, e.getMessage());
            return DecryptionResult.failure(Reason.FORMAT_MISMATCH);
        } catch (AuthenticationException e) {
            logger.debug("Legacy suite {} failed to decrypt data", suiteId);
            return DecryptionResult.failure(Reason.AUTHENTICATION_FAILED);
        } finally {
            Utils.wipe(passphrase);
        }
    }

    /**
     * Decrypts a passphrase-encrypted OpenPGP message.
     *
     * @param data       the armored or binary message.
     * @param passphrase the passphrase.
     * @return the literal data of the message.
     * @throws FormatMismatchException if the data is not a passphrase-encrypted OpenPGP message.
     * @throws AuthenticationException if the passphrase is wrong or the integrity check fails.
     */
    public byte[] decrypt(byte[] data, char[] passphrase) {
        var encryptedData = findPassphraseEncryptedData(data);
        try {
            var clear = encryptedData.getDataStream(
                    new BcPBEDataDecryptorFactory(passphrase, new BcPGPDigestCalculatorProvider()));
            var plaintext = readLiteralData(clear);
            if (encryptedData.isIntegrityProtected() && !encryptedData.verify()) {
                Utils.wipe(plaintext);
                throw new AuthenticationException("Authentication failed");
            }
            logger.debug("Decrypted legacy OpenPGP message with suite {}", suiteId);
            return plaintext;
        } catch (PGPException | IOException e) {
            throw new AuthenticationException("Authentication failed", e);
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            // BC reports some corrupt packets in the decrypted stream with unchecked exceptions
            throw new AuthenticationException("Authentication failed", e);
        }
    }

    private static PGPPBEEncryptedData findPassphraseEncryptedData(byte[] data) {
        try {
            // Not closed: the encrypted packet is streamed from it later. The source is in memory.
            var factory = new BcPGPObjectFactory(PGPUtil.getDecoderStream(new ByteArrayInputStream(data)));
            var object = factory.nextObject();
            while (object instanceof PGPMarker) {
                object = factory.nextObject();
            }
            if (!(object instanceof PGPEncryptedDataList)) {
                throw new FormatMismatchException("Not an encrypted OpenPGP message");
            }
            for (PGPEncryptedData encryptedData : (PGPEncryptedDataList) object) {
                if (encryptedData instanceof PGPPBEEncryptedData) {
                    return (PGPPBEEncryptedData) encryptedData;
                }
            }
            throw new FormatMismatchException("OpenPGP message is not encrypted with a passphrase");
        } catch (FormatMismatchException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new FormatMismatchException("Malformed OpenPGP message", e);
        }
    }

    private static byte[] readLiteralData(InputStream clear) throws IOException, PGPException {
        var factory = new BcPGPObjectFactory(clear);
        var message = factory.nextObject();
        if (message instanceof PGPCompressedData) {
            factory = new BcPGPObjectFactory(((PGPCompressedData) message).getDataStream());
            message = factory.nextObject();
        }
        if (!(message instanceof PGPLiteralData)) {
            throw new PGPException("OpenPGP message does not contain literal data");
        }
        return Streams.readAll(((PGPLiteralData) message).getInputStream());
    }

    private static boolean startsWithArmorHeader(byte[] data) {
        int start = 0;
        while (start < data.length && Character.isWhitespace(data[start])) {
            start++;
        }
        return data.length - start >= ARMOR_HEADER.length
                && Arrays.equals(data, start, start + ARMOR_HEADER.length, ARMOR_HEADER, 0, ARMOR_HEADER.length);
    }

    @Override
    public String toString() {
        return "LegacyOpenPgpHandler{" + suiteId + "}";
    }
}
