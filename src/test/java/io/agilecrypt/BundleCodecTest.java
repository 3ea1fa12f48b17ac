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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Random;

import org.testng.annotations.Test;

public class BundleCodecTest {

    private static EncryptedBundle sampleBundle() {
        return EncryptedBundle.builder(BundleCodec.HYBRID_FORMAT_ID, "HYBRID-A")
                .classicalCiphertext(new byte[32])
                .pqcCiphertext(new byte[1088])
                .nonce(new byte[12])
                .ciphertext("secret".getBytes(UTF_8))
                .tag(new byte[16])
                .passphraseSalt(SuiteFixtures.salt())
                .hybridSalt(new byte[32])
                .build();
    }

    @Test
    public void shouldParseWhatItSerializes() {
        var bytes = BundleCodec.serialize(sampleBundle());

        var parsed = BundleCodec.parse(bytes);

        assertThat(parsed.getFormatId()).isEqualTo(BundleCodec.HYBRID_FORMAT_ID);
        assertThat(parsed.getSuiteId()).isEqualTo("HYBRID-A");
        assertThat(parsed.getClassicalCiphertext()).hasValueSatisfying(ct -> assertThat(ct).hasSize(32));
        assertThat(parsed.getPqcCiphertext()).hasSize(1088);
        assertThat(parsed.getCiphertext()).asString(UTF_8).isEqualTo("secret");
        assertThat(parsed.getPassphraseSalt()).hasValueSatisfying(salt -> assertThat(salt).isEqualTo(
                SuiteFixtures.salt()));
    }

    @Test
    public void shouldStartWithMagicAndVersion() {
        var bytes = BundleCodec.serialize(sampleBundle());

        assertThat(Arrays.copyOf(bytes, 4)).containsExactly('A', 'G', 'C', 1);
    }

    @Test
    public void shouldEncodeAbsentOptionalFieldsAsNull() {
        var bundle = sampleBundle().toBuilder().classicalCiphertext(null).passphraseSalt(null).build();

        var parsed = BundleCodec.parse(BundleCodec.serialize(bundle));

        assertThat(parsed.getClassicalCiphertext()).isEmpty();
        assertThat(parsed.getPassphraseSalt()).isEmpty();
        assertThat(parsed.getHybridSalt()).isPresent();
    }

    @Test
    public void shouldPeekHeaderWithoutParsingBody() {
        var bytes = BundleCodec.serialize(sampleBundle());
        var truncated = Arrays.copyOf(bytes, BundleCodec.encodeHeader(BundleCodec.HYBRID_FORMAT_ID, "HYBRID-A").length);

        assertThat(BundleCodec.peekHeader(truncated))
                .contains(new BundleHeader(1, BundleCodec.HYBRID_FORMAT_ID, "HYBRID-A"));
        assertThatThrownBy(() -> BundleCodec.parse(truncated)).isInstanceOf(FormatMismatchException.class);
    }

    @Test
    public void shouldNotFindHeaderInForeignData() {
        assertThat(BundleCodec.peekHeader(new byte[0])).isEmpty();
        assertThat(BundleCodec.peekHeader("-----BEGIN PGP MESSAGE-----".getBytes(UTF_8))).isEmpty();
        assertThat(BundleCodec.peekHeader(new byte[] { 'A', 'G', 'C', 1, (byte) 0xff })).isEmpty();
    }

    @Test
    public void shouldRejectUnsupportedVersion() {
        var bytes = BundleCodec.serialize(sampleBundle());
        bytes[3] = 2;

        assertThatThrownBy(() -> BundleCodec.parse(bytes))
                .isInstanceOf(FormatMismatchException.class)
                .hasMessageContaining("version");
    }

    @Test
    public void shouldRejectTrailingData() {
        var bytes = BundleCodec.serialize(sampleBundle());
        var extended = Arrays.copyOf(bytes, bytes.length + 1);

        assertThatThrownBy(() -> BundleCodec.parse(extended)).isInstanceOf(FormatMismatchException.class);
    }

    @Test
    public void shouldRejectFieldOfWrongType() {
        var header = BundleCodec.encodeHeader(BundleCodec.HYBRID_FORMAT_ID, "HYBRID-A");
        // CBOR unsigned integer 1 where the classical ciphertext belongs
        var bytes = Utils.concat(header, new byte[] { 0x01 });

        assertThatThrownBy(() -> BundleCodec.parse(bytes)).isInstanceOf(FormatMismatchException.class);
    }

    @Test
    public void shouldReportMalformedLengthsAsFormatMismatch() {
        var header = BundleCodec.encodeHeader(BundleCodec.HYBRID_FORMAT_ID, "HYBRID-A");
        // Classical ciphertext field claiming 2^32 - 1 bytes
        var data = Arrays.copyOf(header, header.length + 5);
        data[header.length] = 0x5a;
        Arrays.fill(data, header.length + 1, data.length, (byte) 0xff);

        assertThatThrownBy(() -> BundleCodec.parse(data)).isInstanceOf(FormatMismatchException.class);
        assertThat(BundleCodec.peekHeader(data)).hasValueSatisfying(h ->
                assertThat(h.suiteId()).isEqualTo("HYBRID-A"));
    }

    @Test
    public void shouldOnlyEverRejectRandomDataWithFormatMismatch() {
        var random = new Random(42);
        for (int i = 0; i < 1000; i++) {
            var data = new byte[4 + random.nextInt(200)];
            random.nextBytes(data);
            data[0] = 'A';
            data[1] = 'G';
            data[2] = 'C';
            data[3] = 1;

            assertThatThrownBy(() -> BundleCodec.parse(data)).isInstanceOf(FormatMismatchException.class);
            BundleCodec.peekHeader(data);
        }
    }
}
