/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/pool/WorkerPoolTest.java
 description: Worker pool tests: caps, reuse, exclusive queuing, policies, exits and idle sweeping.
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
package tech.robd.jparallel.pool;

import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jparallel.error.AbortException;
import tech.robd.jparallel.error.WorkerExitedException;
import tech.robd.jparallel.error.WorkerSpawnException;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.protocol.ReturnMessage;
import tech.robd.jparallel.tools.FakeContextSpawner;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tech.robd.jparallel.tools.TestAwaitUtils.assertPending;
import static tech.robd.jparallel.tools.TestAwaitUtils.await;
import static tech.robd.jparallel.tools.TestAwaitUtils.awaitFailure;

final class WorkerPoolTest {

    private static final Duration NO_AUTO_SWEEP = Duration.ofHours(1);

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "pool-test-scheduler");
        t.setDaemon(true);
        return t;
    });
    private final RecordingHandler handler = new RecordingHandler();

    record Lost(PoolRecord record, Set<Long> taskIds, @Nullable Throwable error) {
    }

    static final class RecordingHandler implements PoolHandler {
        final List<ProtocolMessage> messages = new CopyOnWriteArrayList<>();
        final List<Lost> lost = new CopyOnWriteArrayList<>();

        @Override
        public void onMessage(PoolRecord record, ProtocolMessage message) {
            messages.add(message);
        }

        @Override
        public void onContextLost(PoolRecord record, Set<Long> taskIds, @Nullable Throwable error) {
            lost.add(new Lost(record, Set.copyOf(taskIds), error));
        }
    }

    private WorkerPool pool(int max, Duration idle, AssignmentPolicy policy, FakeContextSpawner spawner) {
        return new WorkerPool(max, idle, NO_AUTO_SWEEP, policy, spawner, handler, scheduler);
    }

    @AfterEach
    void stopScheduler() {
        scheduler.shutdownNow();
    }

    // 🧩 Section: acquire

    @Test
    @Timeout(2)
        // New contexts are spawned up to the cap; after that shared calls pile onto existing ones.
    void sharedAcquireRespectsCap() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(2, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);

        PoolRecord a = await(pool.acquireShared(1), 500);
        PoolRecord b = await(pool.acquireShared(2), 500);
        PoolRecord c = await(pool.acquireShared(3), 500);

        assertEquals(2, pool.size());
        assertEquals(2, spawner.spawned().size());
        assertNotSame(a, b);
        assertSame(a, c);
        assertEquals(2, a.taskCount());
    }

    @Test
    @Timeout(2)
        // An idle context is reused before a new one is spawned.
    void idleContextIsReused() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(4, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);

        PoolRecord first = await(pool.acquireShared(1), 500);
        pool.detach(first, 1);
        PoolRecord second = await(pool.acquireShared(2), 500);

        assertSame(first, second);
        assertEquals(1, spawner.spawned().size());
    }

    @Test
    @Timeout(2)
        // The record is handed out only once its context reports ready.
    void acquireWaitsForReady() {
        FakeContextSpawner spawner = new FakeContextSpawner();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);

        CompletableFuture<PoolRecord> acquired = pool.acquireExclusive(1);
        assertPending(acquired, 50, "record must not be handed out before ready");
        assertEquals(1, pool.size());

        spawner.get(0).ready();
        PoolRecord rec = await(acquired, 500);
        assertTrue(rec.isReady());
        assertTrue(rec.isBusy());
        assertSame(spawner.get(0), rec.context());
    }

    @Test
    @Timeout(2)
        // Exclusive requests beyond the cap queue up and are served in order.
    void exclusiveRequestsQueueFifo() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);

        PoolRecord rec = await(pool.acquireExclusive(1), 500);
        CompletableFuture<PoolRecord> second = pool.acquireExclusive(2);
        CompletableFuture<PoolRecord> third = pool.acquireExclusive(3);
        CompletableFuture<PoolRecord> shared = pool.acquireShared(4);
        assertEquals(3, pool.queued());
        assertPending(second, 30, "second must wait for the reserved context");

        pool.release(rec);
        assertSame(rec, await(second, 500));
        assertFalse(third.isDone());
        assertFalse(shared.isDone());

        pool.release(rec);
        assertSame(rec, await(third, 500));
        pool.release(rec);
        assertSame(rec, await(shared, 500));
        assertEquals(0, pool.queued());
        assertEquals(1, spawner.spawned().size());
    }

    @Test
    @Timeout(2)
        // A withdrawn request fails and is skipped when the context frees up.
    void cancelledWaiterIsSkipped() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);

        PoolRecord rec = await(pool.acquireExclusive(1), 500);
        CompletableFuture<PoolRecord> withdrawn = pool.acquireExclusive(2);
        CompletableFuture<PoolRecord> next = pool.acquireExclusive(3);

        AbortException stop = new AbortException("stop");
        assertTrue(pool.cancel(2, stop));
        assertFalse(pool.cancel(2, stop));
        assertEquals(1, pool.queued());
        assertSame(stop, awaitFailure(withdrawn, 500));

        pool.release(rec);
        assertSame(rec, await(next, 500));
        assertEquals(0, pool.queued());
    }

    @Test
    @Timeout(2)
        // Once the only request in the queue is withdrawn, retiring the busy context leaves the pool empty.
    void cancelledWaiterDoesNotSpawn() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);

        PoolRecord rec = await(pool.acquireExclusive(1), 500);
        pool.acquireExclusive(2);
        pool.cancel(2, new AbortException("stop"));

        pool.retire(rec);
        assertEquals(0, pool.size());
        assertEquals(1, spawner.spawned().size());
    }

    @Test
    @Timeout(2)
        // Retiring a reserved context frees a slot for the next queued request.
    void retireSpawnsReplacementForWaiter() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);

        PoolRecord rec = await(pool.acquireExclusive(1), 500);
        CompletableFuture<PoolRecord> next = pool.acquireExclusive(2);

        pool.retire(rec);
        assertTrue(spawner.get(0).isTerminated());
        assertFalse(rec.isLive());

        PoolRecord replacement = await(next, 500);
        assertNotSame(rec, replacement);
        assertEquals(2, spawner.spawned().size());
        assertEquals(1, pool.size());
    }

    @Test
    @Timeout(2)
    void spawnFailureFailsAcquire() {
        FakeContextSpawner spawner = new FakeContextSpawner().failWith(new IllegalStateException("no threads left"));
        WorkerPool pool = pool(2, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);

        Throwable failure = awaitFailure(pool.acquireShared(1), 500);
        WorkerSpawnException wse = assertInstanceOf(WorkerSpawnException.class, failure);
        assertTrue(wse.getMessage().contains("no threads left"));
        assertEquals(0, pool.size());

        spawner.failWith(null).readyOnSpawn();
        await(pool.acquireShared(2), 500);
        assertEquals(1, pool.size());
    }
    // [/🧩 Section: acquire]

    // 🧩 Section: policies

    @Test
    @Timeout(2)
    void moduloPolicyPicksByTaskId() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(2, Duration.ofSeconds(10), AssignmentPolicy.MODULO, spawner);

        PoolRecord first = await(pool.acquireShared(1), 500);
        PoolRecord second = await(pool.acquireShared(2), 500);

        assertSame(second, await(pool.acquireShared(5), 500));
        assertSame(first, await(pool.acquireShared(6), 500));
        assertSame(second, await(pool.acquireShared(7), 500));
        assertEquals(3, second.taskCount());
    }

    @Test
    @Timeout(2)
    void leastLoadedPolicyBalances() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(2, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);

        PoolRecord first = await(pool.acquireShared(1), 500);
        PoolRecord second = await(pool.acquireShared(2), 500);

        assertSame(first, await(pool.acquireShared(3), 500));
        assertSame(second, await(pool.acquireShared(4), 500));
        pool.detach(first, 1);
        pool.detach(first, 3);
        assertSame(first, await(pool.acquireShared(5), 500));
    }
    // [/🧩 Section: policies]

    // 🧩 Section: context-events

    @Test
    @Timeout(2)
    void messagesReachTheHandler() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);
        await(pool.acquireShared(1), 500);

        spawner.get(0).reply(new ReturnMessage(1, "Hi"));
        assertEquals(1, handler.messages.size());
        assertEquals("return", handler.messages.get(0).type());
    }

    @Test
    @Timeout(2)
        // A non-zero exit reports every attached task with the exit code and frees the slot.
    void exitReportsAttachedTasks() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);
        PoolRecord rec = await(pool.acquireShared(1), 500);
        await(pool.acquireShared(2), 500);

        spawner.get(0).exit(3);

        assertEquals(1, handler.lost.size());
        Lost lost = handler.lost.get(0);
        assertSame(rec, lost.record());
        assertEquals(Set.of(1L, 2L), lost.taskIds());
        assertEquals(3, assertInstanceOf(WorkerExitedException.class, lost.error()).exitCode());
        assertEquals(0, pool.size());
        assertFalse(rec.isLive());

        spawner.get(0).reply(new ReturnMessage(1, "late"));
        assertTrue(handler.messages.isEmpty());
    }

    @Test
    @Timeout(2)
    void cleanExitReportsNoError() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);
        await(pool.acquireExclusive(1), 500);

        spawner.get(0).exit(0);
        assertEquals(1, handler.lost.size());
        assertNull(handler.lost.get(0).error());
    }

    @Test
    @Timeout(2)
        // A context failure terminates it and reports the error.
    void errorTerminatesContext() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);
        await(pool.acquireShared(1), 500);

        IllegalStateException crash = new IllegalStateException("crashed");
        spawner.get(0).fail(crash);

        assertTrue(spawner.get(0).isTerminated());
        assertSame(crash, handler.lost.get(0).error());
        assertEquals(0, pool.size());
    }

    @Test
    @Timeout(2)
    void exitBeforeReadyFailsAcquire() {
        FakeContextSpawner spawner = new FakeContextSpawner();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);
        CompletableFuture<PoolRecord> acquired = pool.acquireExclusive(1);

        spawner.get(0).exit(1);
        assertInstanceOf(WorkerSpawnException.class, awaitFailure(acquired, 500));
        assertEquals(0, pool.size());
    }
    // [/🧩 Section: context-events]

    // 🧩 Section: idle-sweep

    @Test
    @Timeout(2)
        // Only contexts idle for at least the timeout are swept.
    void idleContextsAreSweptAfterTimeout() throws Exception {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(2, Duration.ofMillis(100), AssignmentPolicy.LEAST_LOADED, spawner);
        PoolRecord idle = await(pool.acquireShared(1), 500);
        PoolRecord busy = await(pool.acquireExclusive(2), 500);
        pool.detach(idle, 1);

        pool.sweepIdle();
        assertEquals(2, pool.size());

        Thread.sleep(150);
        pool.sweepIdle();
        assertEquals(1, pool.size());
        assertTrue(spawner.get(0).isTerminated());
        assertFalse(spawner.get(1).isTerminated());
        assertTrue(busy.isLive());
    }

    @Test
    @Timeout(2)
        // A context whose task just settled counts as freshly used.
    void detachRefreshesLastAccess() throws Exception {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofMillis(100), AssignmentPolicy.LEAST_LOADED, spawner);
        PoolRecord rec = await(pool.acquireShared(1), 500);

        Thread.sleep(150);
        pool.detach(rec, 1);
        pool.sweepIdle();
        assertEquals(1, pool.size());
    }
    // [/🧩 Section: idle-sweep]

    @Test
    @Timeout(2)
        // Close fails queued requests, reports attached tasks and terminates everything.
    void closeAbortsEverything() {
        FakeContextSpawner spawner = new FakeContextSpawner().readyOnSpawn();
        WorkerPool pool = pool(1, Duration.ofSeconds(10), AssignmentPolicy.LEAST_LOADED, spawner);
        await(pool.acquireExclusive(1), 500);
        CompletableFuture<PoolRecord> queued = pool.acquireExclusive(2);

        pool.close();

        assertInstanceOf(WorkerSpawnException.class, awaitFailure(queued, 500));
        assertEquals(Set.of(1L), handler.lost.get(0).taskIds());
        assertInstanceOf(AbortException.class, handler.lost.get(0).error());
        assertTrue(spawner.get(0).isTerminated());
        assertEquals(0, pool.size());
        assertInstanceOf(WorkerSpawnException.class, awaitFailure(pool.acquireShared(3), 500));
    }
}
