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

package io.agilecrypt.io;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

import co.nstant.in.cbor.CborDecoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.SimpleValue;
import co.nstant.in.cbor.model.SimpleValueType;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;

/**
 * Reads a sequence of <a href="https://cbor.io">CBOR</a> data items from an input stream. Only the few data types
 * used by the bundle and key-export formats are supported. The input is untrusted: the header of every item is
 * checked before it is decoded, so a declared string length can never exceed the data that is actually available.
 */
public final class CborReader implements Closeable {
    private static final int MAJOR_TYPE_UNSIGNED = 0;
    private static final int MAJOR_TYPE_NEGATIVE = 1;
    private static final int MAJOR_TYPE_BYTES = 2;
    private static final int MAJOR_TYPE_TEXT = 3;
    private static final int MAJOR_TYPE_SIMPLE = 7;
    private static final int INDEFINITE_LENGTH = 31;
    private static final int MAX_HEADER_LENGTH = 9;

    private final InputStream inputStream;
    private final CborDecoder decoder;

    /**
     * Initializes the reader with the given input stream.
     *
     * @param inputStream the stream to read CBOR data items from.
     */
    public CborReader(InputStream inputStream) {
        Objects.requireNonNull(inputStream, "inputStream");
        this.inputStream = inputStream.markSupported() ? inputStream : new BufferedInputStream(inputStream);
        this.decoder = new CborDecoder(this.inputStream);
    }

    /**
     * Reads a variable-length byte array from the input stream.
     *
     * @return the read byte string.
     * @throws IOException if an I/O error occurs while reading the value or if the value read is not a byte string.
     */
    public byte[] readBytes() throws IOException {
        return decodeNext(ByteString.class).getBytes();
    }

    /**
     * Reads a byte array that may be absent, encoded as CBOR {@code null}.
     *
     * @return the byte string, or {@code null} if a null value was read.
     * @throws IOException if an I/O error occurs or the value is neither a byte string nor null.
     */
    public byte[] readOptionalBytes() throws IOException {
        var dataItem = decodeNextItem();
        if (dataItem instanceof SimpleValue
                && ((SimpleValue) dataItem).getSimpleValueType() == SimpleValueType.NULL) {
            return null;
        }
        return cast(dataItem, ByteString.class).getBytes();
    }

    /**
     * Reads a Unicode string from the underlying input stream.
     *
     * @return the string that was read from the input.
     * @throws IOException if an I/O error occurs while reading the string or if the read data item is not a Unicode
     * string.
     */
    public String readString() throws IOException {
        return decodeNext(UnicodeString.class).getString();
    }

    /**
     * Reads an unsigned integer that must fit in a Java {@code int}.
     *
     * @return the value.
     * @throws IOException if an I/O error occurs, the item is not an unsigned integer, or it is too large.
     */
    public int readUnsignedInt() throws IOException {
        var value = decodeNext(UnsignedInteger.class).getValue();
        if (value.bitLength() > 31) {
            throw new IOException("Integer value out of range");
        }
        return value.intValue();
    }

    /**
     * Checks that the input has been completely consumed.
     *
     * @throws IOException if any further data item follows.
     */
    public void expectEnd() throws IOException {
        inputStream.mark(1);
        int next = inputStream.read();
        inputStream.reset();
        if (next != -1) {
            throw new IOException("Unexpected trailing data");
        }
    }

    /**
     * Closes the underlying input stream.
     *
     * @throws IOException if an I/O error occurs while closing the underlying stream.
     */
    @Override
    public void close() throws IOException {
        inputStream.close();
    }

    private <T extends DataItem> T decodeNext(Class<T> expectedType) throws IOException {
        return cast(decodeNextItem(), expectedType);
    }

    private DataItem decodeNextItem() throws IOException {
        checkNextItemHeader();
        try {
            var dataItem = decoder.decodeNext();
            if (dataItem == null) {
                throw new EOFException();
            }
            return dataItem;
        } catch (CborException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new IOException(e);
        } catch (RuntimeException e) {
            throw new IOException("Malformed CBOR data item", e);
        }
    }

    /**
     * Inspects the initial byte and length argument of the next item without consuming them. The decoder allocates
     * string buffers from the declared length, so that length is bounded by the remaining input first.
     */
    private void checkNextItemHeader() throws IOException {
        inputStream.mark(MAX_HEADER_LENGTH);
        try {
            int initialByte = inputStream.read();
            if (initialByte == -1) {
                return;
            }
            int majorType = initialByte >>> 5;
            int additionalInfo = initialByte & 0x1F;
            switch (majorType) {
                case MAJOR_TYPE_UNSIGNED:
                case MAJOR_TYPE_NEGATIVE:
                case MAJOR_TYPE_SIMPLE:
                    return;
                case MAJOR_TYPE_BYTES:
                case MAJOR_TYPE_TEXT:
                    break;
                default:
                    throw new IOException("Unsupported CBOR major type: " + majorType);
            }
            if (additionalInfo == INDEFINITE_LENGTH) {
                throw new IOException("Indefinite-length CBOR strings are not supported");
            }
            long length = readLengthArgument(additionalInfo);
            // Negative when the 64-bit argument has its top bit set
            if (length < 0 || length > inputStream.available()) {
                throw new IOException("CBOR string length " + Long.toUnsignedString(length)
                        + " exceeds the remaining input");
            }
        } finally {
            inputStream.reset();
        }
    }

    private long readLengthArgument(int additionalInfo) throws IOException {
        if (additionalInfo < 24) {
            return additionalInfo;
        }
        int size;
        switch (additionalInfo) {
            case 24: size = 1; break;
            case 25: size = 2; break;
            case 26: size = 4; break;
            case 27: size = 8; break;
            default: throw new IOException("Reserved CBOR additional information: " + additionalInfo);
        }
        long value = 0;
        for (int i = 0; i < size; i++) {
            int b = inputStream.read();
            if (b == -1) {
                throw new EOFException();
            }
            value = (value << 8) | b;
        }
        return value;
    }

    private static <T extends DataItem> T cast(DataItem dataItem, Class<T> expectedType) throws IOException {
        if (expectedType.isInstance(dataItem)) {
            return expectedType.cast(dataItem);
        }
        throw new IOException("Unexpected CBOR data item - expected " + expectedType.getSimpleName() +
                " but got " + dataItem.getClass().getSimpleName());
    }
}
