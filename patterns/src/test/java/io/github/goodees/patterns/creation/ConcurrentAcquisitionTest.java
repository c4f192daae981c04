package io.github.goodees.patterns.creation;

/*-
 * #%L
 * patterns
 * %%
 * Copyright (C) 2018 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import org.junit.After;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class ConcurrentAcquisitionTest {
    private static final int THREADS = 8;
    private final ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    private final CountDownLatch constructionStarted = new CountDownLatch(1);
    private final CountDownLatch releaseConstruction = new CountDownLatch(1);
    private final AtomicInteger constructions = new AtomicInteger();

    @After
    public void tearDown() {
        releaseConstruction.countDown();
        executor.shutdownNow();
    }

    private Object blockingConstruct(String identifier) throws InterruptedException {
        constructions.incrementAndGet();
        constructionStarted.countDown();
        if (!releaseConstruction.await(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("Construction of " + identifier + " was never released");
        }
        return new Object();
    }

    @SuppressWarnings("unchecked")
    static <X extends Throwable> RuntimeException sneakyThrow(Throwable t) throws X {
        throw (X) t;
    }

    private List<Future<Object>> acquireConcurrently(CachingFlyweightFactory<Object> factory, String identifier)
            throws InterruptedException {
        Callable<Object> acquire = () -> factory.acquire(identifier);
        List<Future<Object>> results = new ArrayList<>();
        results.add(executor.submit(acquire));
        assertTrue("Construction should start", constructionStarted.await(5, TimeUnit.SECONDS));
        for (int i = 1; i < THREADS; i++) {
            results.add(executor.submit(acquire));
        }
        // every other caller counts as hit right before it starts waiting for the construction
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (factory.statistics().getHits() < THREADS - 1 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(THREADS - 1, factory.statistics().getHits());
        releaseConstruction.countDown();
        return results;
    }

    @Test
    public void concurrent_callers_share_single_construction() throws Exception {
        CachingFlyweightFactory<Object> factory = new CachingFlyweightFactory<>((id, ctx) -> {
            try {
                return blockingConstruct(id);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        List<Future<Object>> results = acquireConcurrently(factory, "shared");
        Object expected = results.get(0).get(5, TimeUnit.SECONDS);
        for (Future<Object> result : results) {
            assertSame(expected, result.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, constructions.get());
        assertEquals(1, factory.size());
        assertEquals(THREADS - 1, factory.statistics().getHits());
    }

    @Test
    public void concurrent_callers_share_failure_which_is_not_cached() throws Exception {
        IllegalStateException failure = new IllegalStateException("bam!");
        AtomicInteger attempt = new AtomicInteger();
        CachingFlyweightFactory<Object> factory = new CachingFlyweightFactory<>((id, ctx) -> {
            try {
                Object value = blockingConstruct(id);
                if (attempt.incrementAndGet() == 1) {
                    throw failure;
                }
                return value;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        for (Future<Object> result : acquireConcurrently(factory, "fragile")) {
            try {
                result.get(5, TimeUnit.SECONDS);
                fail("Every caller of failed construction should fail");
            } catch (ExecutionException e) {
                assertSame(failure, e.getCause());
            }
        }
        assertEquals(1, constructions.get());
        assertTrue(factory.isEmpty());

        assertNotNull(factory.acquire("fragile"));
        assertEquals(2, constructions.get());
        assertEquals(1, factory.size());
    }

    @Test
    public void different_keys_are_constructed_in_parallel() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        CachingFlyweightFactory<String> factory = new CachingFlyweightFactory<>((id, ctx) -> {
            bothStarted.countDown();
            try {
                // neither construction can finish unless the other one runs at the same time
                if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Constructions were serialized");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return id;
        });

        Future<String> first = executor.submit(() -> factory.acquire("first"));
        Future<String> second = executor.submit(() -> factory.acquire("second"));

        assertEquals("first", first.get(10, TimeUnit.SECONDS));
        assertEquals("second", second.get(10, TimeUnit.SECONDS));
        assertEquals(2, factory.size());
    }

    @Test
    public void undeclared_checked_exception_releases_all_callers() throws Exception {
        IOException failure = new IOException("checked");
        CachingFlyweightFactory<Object> factory = new CachingFlyweightFactory<>((id, ctx) -> {
            try {
                blockingConstruct(id);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            throw ConcurrentAcquisitionTest.<RuntimeException>sneakyThrow(failure);
        });

        for (Future<Object> result : acquireConcurrently(factory, "sneaky")) {
            try {
                result.get(5, TimeUnit.SECONDS);
                fail("Every caller of failed construction should fail");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() instanceof CompletionException ? e.getCause().getCause() : e.getCause();
                assertSame(failure, cause);
            }
        }
        assertEquals(1, constructions.get());
        assertEquals(1, factory.statistics().getFailures());
        assertTrue(factory.isEmpty());
    }

    @Test
    public void only_one_of_concurrent_evictions_succeeds() throws Exception {
        CachingFlyweightFactory<Object> factory = new CachingFlyweightFactory<>((id, ctx) -> new Object());
        factory.acquire("shared");
        CountDownLatch start = new CountDownLatch(1);

        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            results.add(executor.submit(() -> {
                start.await();
                return factory.evict("shared", null);
            }));
        }
        start.countDown();

        int evicted = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                evicted++;
            }
        }
        assertEquals(1, evicted);
        assertTrue(factory.isEmpty());
    }
}
