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
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class HandlerRegistryTest {
    private HandlerRegistry registry;

    @BeforeMethod
    public void setup() {
        registry = new HandlerRegistry();
    }

    @AfterMethod
    public void resetRegistry() {
        registry.reset();
    }

    @Test
    public void shouldCreateHandlerOnceAndReuseIt() {
        var handler = mock(CryptoHandler.class);
        var factory = mock(HandlerFactory.class);
        given(factory.create()).willReturn(handler);
        registry.register("HYBRID-A", factory);

        var first = registry.getHandler("HYBRID-A");
        var second = registry.getHandler("HYBRID-A");

        assertThat(first).isSameAs(handler).isSameAs(second);
        verify(factory, times(1)).create();
    }

    @Test
    public void shouldNotCreateHandlerUntilRequested() {
        var factory = mock(HandlerFactory.class);

        registry.register("HYBRID-A", factory);

        assertThat(registry.isRegistered("HYBRID-A")).isTrue();
        verify(factory, times(0)).create();
    }

    @Test
    public void shouldCreateHandlerOnceUnderConcurrentAccess() throws Exception {
        var created = new AtomicInteger();
        var start = new CountDownLatch(1);
        registry.register("HYBRID-A", () -> {
            created.incrementAndGet();
            return new LegacyOpenPgpHandler("HYBRID-A");
        });
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            var futures = new CompletableFuture<?>[16];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = CompletableFuture.supplyAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        throw new IllegalStateException(e);
                    }
                    return registry.getHandler("HYBRID-A");
                }, executor);
            }
            start.countDown();
            CompletableFuture.allOf(futures).get();

            assertThat(created).hasValue(1);
            var expected = registry.getHandler("HYBRID-A");
            for (var future : futures) {
                assertThat(future.get()).isSameAs(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldThrowForUnknownSuite() {
        assertThatThrownBy(() -> registry.getHandler("HYBRID-Z"))
                .isInstanceOfSatisfying(HandlerNotFoundException.class,
                        e -> assertThat(e.getSuiteId()).isEqualTo("HYBRID-Z"));
    }

    @Test
    public void shouldReportFailingFactoryAsUnavailableAlgorithm() {
        registry.register("HYBRID-A", () -> {
            throw new IllegalStateException("no provider");
        });

        assertThatThrownBy(() -> registry.getHandler("HYBRID-A"))
                .isInstanceOf(AlgorithmUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    public void shouldForgetRegistrationsOnReset() {
        registry.register("LEGACY-OPENPGP", new LegacyOpenPgpHandler());

        registry.reset();

        assertThat(registry.isRegistered("LEGACY-OPENPGP")).isFalse();
        assertThat(registry.registeredSuiteIds()).isEmpty();
    }

    @Test
    public void shouldReplaceEarlierRegistration() {
        var first = new LegacyOpenPgpHandler();
        var second = new LegacyOpenPgpHandler();
        registry.register("LEGACY-OPENPGP", first);

        registry.register("LEGACY-OPENPGP", second);

        assertThat(registry.getHandler("LEGACY-OPENPGP")).isSameAs(second);
    }

    @Test
    public void shouldSelectHandlerFromBundleHeader() {
        var handler = mock(CryptoHandler.class);
        registry.register("HYBRID-A", handler);
        var header = BundleCodec.encodeHeader(BundleCodec.HYBRID_FORMAT_ID, "HYBRID-A");

        assertThat(registry.selectHandlerForBytes(header)).containsSame(handler);
        assertThat(registry.selectHandlerForBytes(BundleCodec.encodeHeader(BundleCodec.HYBRID_FORMAT_ID,
                "HYBRID-B"))).isEmpty();
        assertThat(registry.selectHandlerForBytes(new byte[] { (byte) 0x8c, 0x0d })).isEmpty();
    }
}
