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

import javax.crypto.spec.SecretKeySpec;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class RedactedLoggerTest {

    @DataProvider
    public Object[][] secrets() {
        return new Object[][] {
                { new byte[] { 1, 2, 3 } },
                { "passphrase".toCharArray() },
                { new SecretKeySpec(new byte[32], "AES") },
                { new DestroyableSecretKey("X25519", new byte[32]) },
                { KemKeyPair.publicOnly("X25519", new byte[32]) },
        };
    }

    @Test(dataProvider = "secrets")
    public void shouldRedactSecretArguments(Object secret) {
        assertThat(RedactedLogger.redact(secret)).isEqualTo(RedactedLogger.REDACTED);
    }

    @Test
    public void shouldPassThroughOrdinaryArguments() {
        var exception = new IllegalStateException("boom");

        assertThat(RedactedLogger.redact("HYBRID-A")).isEqualTo("HYBRID-A");
        assertThat(RedactedLogger.redact(42)).isEqualTo(42);
        assertThat(RedactedLogger.redact(exception)).isSameAs(exception);
        assertThat(RedactedLogger.redact(null)).isNull();
    }
}
