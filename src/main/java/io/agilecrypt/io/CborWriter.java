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

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import co.nstant.in.cbor.CborEncoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.SimpleValue;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;

/**
 * Writes a sequence of CBOR data items to an output stream. Methods return {@code this} so that calls can be
 * chained.
 */
public final class CborWriter implements Closeable, Flushable {
    private final OutputStream outputStream;
    private final CborEncoder encoder;

    public CborWriter(OutputStream outputStream) {
        this.outputStream = Objects.requireNonNull(outputStream, "outputStream");
        this.encoder = new CborEncoder(outputStream);
    }

    public CborWriter writeBytes(byte[] bytes) throws IOException {
        write(new ByteString(Objects.requireNonNull(bytes)));
        return this;
    }

    /**
     * Writes a byte string, or CBOR {@code null} if the argument is null.
     */
    public CborWriter writeOptionalBytes(byte[] bytes) throws IOException {
        write(bytes == null ? SimpleValue.NULL : new ByteString(bytes));
        return this;
    }

    public CborWriter writeString(String string) throws IOException {
        write(new UnicodeString(Objects.requireNonNull(string)));
        return this;
    }

    public CborWriter writeUnsignedInt(int value) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("Value must not be negative");
        }
        write(new UnsignedInteger(value));
        return this;
    }

    @Override
    public void close() throws IOException {
        outputStream.close();
    }

    @Override
    public void flush() throws IOException {
        outputStream.flush();
    }

    private void write(DataItem dataItem) throws IOException {
        try {
            encoder.encode(dataItem);
        } catch (CborException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new IOException(e);
        }
    }
}
