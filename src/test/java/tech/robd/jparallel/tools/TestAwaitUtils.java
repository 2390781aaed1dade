/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/tools/TestAwaitUtils.java
 description: Deterministic await helpers for concurrent tests.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: yes
 tags: [robokeytags,v1]
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 * Licensed under the Apache License, Version 2.0 (the "License");
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package tech.robd.jparallel.tools;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Deterministic wait helpers for concurrent tests.
 */
public final class TestAwaitUtils {
    private TestAwaitUtils() {
    }

    /**
     * Poll a boolean condition until true or timeout (fails the test on timeout).
     */
    public static void awaitTrue(BooleanSupplier cond, long timeoutMs, String msg) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (System.nanoTime() < deadline) {
            if (cond.getAsBoolean()) return;
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("Interrupted while waiting: " + msg);
            }
        }
        fail(msg);
    }

    /**
     * Await a CountDownLatch or fail with a useful message.
     */
    public static void awaitLatch(CountDownLatch latch, long timeoutMs, String msg) {
        try {
            assertTrue(latch.await(timeoutMs, TimeUnit.MILLISECONDS), msg);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for latch: " + e);
        }
    }

    /**
     * Await a CompletableFuture up to {@code timeoutMs} and return its value.
     * Fails the test if it times out, is cancelled, or completes exceptionally.
     */
    public static <T> T await(CompletableFuture<T> cf, long timeoutMs) {
        try {
            return cf.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            fail("Future not done within " + timeoutMs + "ms");
            throw new AssertionError(te); // unreachable
        } catch (CancellationException ce) {
            fail("Future was cancelled");
            throw ce; // unreachable
        } catch (ExecutionException ee) {
            fail("Future completed exceptionally: " + ee.getCause());
            throw new AssertionError(ee); // unreachable
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            fail("Interrupted while awaiting future: " + ie);
            throw new AssertionError(ie); // unreachable
        }
    }

    /**
     * Await a future that must fail and return the cause it failed with.
     */
    public static Throwable awaitFailure(CompletableFuture<?> cf, long timeoutMs) {
        try {
            Object value = cf.get(timeoutMs, TimeUnit.MILLISECONDS);
            fail("Future completed normally with " + value);
            throw new AssertionError(); // unreachable
        } catch (TimeoutException te) {
            fail("Future not done within " + timeoutMs + "ms");
            throw new AssertionError(te); // unreachable
        } catch (CancellationException ce) {
            return ce;
        } catch (ExecutionException ee) {
            return ee.getCause();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            fail("Interrupted while awaiting future: " + ie);
            throw new AssertionError(ie); // unreachable
        }
    }

    /**
     * Assert the future is still pending after {@code quietMs}.
     */
    public static void assertPending(CompletableFuture<?> cf, long quietMs, String msg) {
        try {
            Thread.sleep(quietMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted: " + msg);
        }
        assertTrue(!cf.isDone(), msg);
    }
}
