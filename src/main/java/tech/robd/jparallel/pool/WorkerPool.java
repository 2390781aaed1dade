/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/pool/WorkerPool.java
 description: Bounded pool of worker contexts with exclusive and shared acquisition and idle sweeping.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.error.AbortException;
import tech.robd.jparallel.error.WorkerExitedException;
import tech.robd.jparallel.error.WorkerSpawnException;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.protocol.Ready;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded set of worker contexts.
 *
 * <ul>
 *   <li>{@link #acquireShared(long)}: idle context, else a new one while under the cap, else
 *       one picked by the {@link AssignmentPolicy} among contexts not reserved exclusively.</li>
 *   <li>{@link #acquireExclusive(long)}: idle context, else a new one while under the cap, else
 *       the request waits in a FIFO queue until a context is released or dropped.</li>
 *   <li>A record counts towards the cap from the moment it is spawned and is handed out once
 *       its context reports {@code ready}.</li>
 *   <li>A periodic sweep terminates contexts idle for longer than the idle timeout.</li>
 *   <li>When a context exits or fails, its tasks are reported to the {@link PoolHandler}, the
 *       record is dropped and queued acquirers retry.</li>
 * </ul>
 */
public final class WorkerPool implements AutoCloseable {
    private static final Diagnostics DIAG = Diagnostics.of(WorkerPool.class);

    // 🧩 Section: state
    private final Object lock = new Object();
    private final int maxWorkers;
    private final long idleTimeoutNanos;
    private final Duration sweepInterval;
    private final AssignmentPolicy policy;
    private final ContextSpawner spawner;
    private final PoolHandler handler;
    private final ScheduledExecutorService scheduler;

    private final List<PoolRecord> records = new ArrayList<>();
    private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();
    private final AtomicLong workerIds = new AtomicLong();
    private @Nullable ScheduledFuture<?> sweep;
    private boolean closed;

    private record Waiter(boolean exclusive, long taskId, CompletableFuture<PoolRecord> assigned) {
    }
    // [/🧩 Section: state]

    /**
     * @param scheduler daemon scheduler running the idle sweep; owned by the caller
     */
    public WorkerPool(int maxWorkers,
                      @NonNull Duration idleTimeout,
                      @NonNull Duration sweepInterval,
                      @NonNull AssignmentPolicy policy,
                      @NonNull ContextSpawner spawner,
                      @NonNull PoolHandler handler,
                      @NonNull ScheduledExecutorService scheduler) {
        if (maxWorkers < 1) throw new IllegalArgumentException("maxWorkers must be at least 1");
        if (idleTimeout == null || sweepInterval == null || policy == null
                || spawner == null || handler == null || scheduler == null) {
            throw new IllegalArgumentException("Pool arguments cannot be null");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("Sweep interval must be positive");
        }
        this.maxWorkers = maxWorkers;
        this.idleTimeoutNanos = idleTimeout.toNanos();
        this.sweepInterval = sweepInterval;
        this.policy = policy;
        this.spawner = spawner;
        this.handler = handler;
        this.scheduler = scheduler;
    }

    // 🧩 Section: acquire

    /**
     * Attach {@code taskId} to a context that may host other tasks as well.
     *
     * @return completes with the record once its context is ready; fails with
     * {@link WorkerSpawnException} if the context cannot be started
     */
    public @NonNull CompletableFuture<PoolRecord> acquireShared(long taskId) {
        return acquire(false, taskId);
    }

    /**
     * Reserve a whole context for {@code taskId}; waits (FIFO) while the pool is saturated.
     */
    public @NonNull CompletableFuture<PoolRecord> acquireExclusive(long taskId) {
        return acquire(true, taskId);
    }

    private CompletableFuture<PoolRecord> acquire(boolean exclusive, long taskId) {
        CompletableFuture<PoolRecord> assigned = new CompletableFuture<>();
        synchronized (lock) {
            if (closed) return CompletableFuture.failedFuture(new WorkerSpawnException("worker pool is closed"));
            try {
                PoolRecord rec = waiters.isEmpty() || !exclusive ? tryAssignLocked(exclusive, taskId) : null;
                if (rec != null) {
                    assigned.complete(rec);
                } else {
                    waiters.addLast(new Waiter(exclusive, taskId, assigned));
                    DIAG.debug("task#{} queued for a {} context (queued={})",
                            taskId, exclusive ? "exclusive" : "shared", waiters.size());
                }
            } catch (WorkerSpawnException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return assigned.thenCompose(PoolRecord::whenReady);
    }

    private @Nullable PoolRecord tryAssignLocked(boolean exclusive, long taskId) {
        PoolRecord chosen = null;
        for (PoolRecord r : records) {
            if (r.idleLocked()) {
                chosen = r;
                break;
            }
        }
        if (chosen == null && records.size() < maxWorkers) {
            chosen = spawnLocked();
        }
        if (chosen == null && !exclusive) {
            List<PoolRecord> candidates = new ArrayList<>();
            for (PoolRecord r : records) {
                if (!r.busyLocked()) candidates.add(r);
            }
            if (!candidates.isEmpty()) chosen = policy.pick(candidates, taskId);
        }
        if (chosen == null) return null;

        if (exclusive) chosen.busyLocked(true);
        chosen.tasksLocked().add(taskId);
        chosen.touchLocked(System.nanoTime());
        DIAG.debug("task#{} -> {} ({}, tasks={})", taskId, chosen, exclusive ? "exclusive" : "shared",
                chosen.taskCountLocked());
        return chosen;
    }

    private PoolRecord spawnLocked() {
        PoolRecord rec = new PoolRecord(workerIds.incrementAndGet(), lock, System.nanoTime());
        records.add(rec);
        WorkerContext ctx;
        try {
            ctx = spawner.spawn(new RecordListener(rec));
        } catch (RuntimeException e) {
            records.remove(rec);
            rec.dropLocked();
            WorkerSpawnException failure = e instanceof WorkerSpawnException wse
                    ? wse
                    : new WorkerSpawnException("failed to spawn worker: " + e.getMessage(), e);
            rec.failStart(failure);
            DIAG.warn("{} failed to spawn", rec, failure);
            throw failure;
        }
        rec.bound(ctx);
        startSweepLocked();
        DIAG.debug("{} spawned ({}), pool size {}/{}", rec, ctx.describe(), records.size(), maxWorkers);
        return rec;
    }
    // [/🧩 Section: acquire]

    // 🧩 Section: give-back

    /**
     * End an exclusive reservation and keep the context for reuse.
     */
    public void release(@NonNull PoolRecord rec) {
        synchronized (lock) {
            if (!rec.liveLocked()) return;
            rec.busyLocked(false);
            rec.tasksLocked().clear();
            rec.touchLocked(System.nanoTime());
        }
        DIAG.debug("{} released", rec);
        drainWaiters();
    }

    /**
     * Remove {@code taskId} from a shared context. The context keeps running other tasks.
     */
    public void detach(@NonNull PoolRecord rec, long taskId) {
        synchronized (lock) {
            if (!rec.tasksLocked().remove(taskId)) return;
            rec.touchLocked(System.nanoTime());
        }
        DIAG.debug("task#{} detached from {}", taskId, rec);
        drainWaiters();
    }

    /**
     * Drop the record and terminate its context. Attached tasks are not notified.
     */
    public void retire(@NonNull PoolRecord rec) {
        synchronized (lock) {
            if (!records.remove(rec)) return;
            rec.dropLocked();
            rec.tasksLocked().clear();
        }
        DIAG.debug("{} retired", rec);
        shutdownContext(rec, new AbortException("worker retired before it was ready"));
        drainWaiters();
    }

    /**
     * Withdraw a queued acquire for {@code taskId}. Its future fails with {@code reason}.
     *
     * @return {@code false} if the task was not queued (it already holds a record, or never asked)
     */
    public boolean cancel(long taskId, @NonNull Throwable reason) {
        Waiter removed = null;
        synchronized (lock) {
            Iterator<Waiter> it = waiters.iterator();
            while (it.hasNext()) {
                Waiter w = it.next();
                if (w.taskId() == taskId) {
                    it.remove();
                    removed = w;
                    break;
                }
            }
        }
        if (removed == null) return false;
        DIAG.debug("task#{} withdrawn from the queue (queued={})", taskId, queued());
        removed.assigned().completeExceptionally(reason);
        return true;
    }

    private void drainWaiters() {
        List<Runnable> completions = new ArrayList<>();
        synchronized (lock) {
            Iterator<Waiter> it = waiters.iterator();
            while (it.hasNext()) {
                Waiter w = it.next();
                if (w.assigned().isDone()) {
                    it.remove();
                    continue;
                }
                PoolRecord rec;
                try {
                    rec = tryAssignLocked(w.exclusive(), w.taskId());
                } catch (WorkerSpawnException e) {
                    it.remove();
                    completions.add(() -> w.assigned().completeExceptionally(e));
                    continue;
                }
                if (rec == null) break;
                it.remove();
                completions.add(() -> w.assigned().complete(rec));
            }
        }
        completions.forEach(Runnable::run);
    }
    // [/🧩 Section: give-back]

    // 🧩 Section: context-events
    private final class RecordListener implements ContextListener {
        private final PoolRecord rec;

        RecordListener(PoolRecord rec) {
            this.rec = rec;
        }

        @Override
        public void onMessage(ProtocolMessage message) {
            if (message instanceof Ready) {
                DIAG.debug("{} ready", rec);
                rec.markReady();
                return;
            }
            synchronized (lock) {
                if (!rec.liveLocked()) {
                    DIAG.debug("{} dropped, ignoring {} message", rec, message.type());
                    return;
                }
                rec.touchLocked(System.nanoTime());
            }
            handler.onMessage(rec, message);
        }

        @Override
        public void onError(Throwable error) {
            DIAG.warn("{} failed", rec, error);
            lose(rec, error, true);
        }

        @Override
        public void onExit(int exitCode) {
            DIAG.debug("{} exited with code {}", rec, exitCode);
            lose(rec, exitCode == 0 ? null : new WorkerExitedException(exitCode), false);
        }
    }

    private void lose(PoolRecord rec, @Nullable Throwable error, boolean terminate) {
        Set<Long> orphaned;
        synchronized (lock) {
            if (!records.remove(rec)) return;
            rec.dropLocked();
            orphaned = new HashSet<>(rec.tasksLocked());
            rec.tasksLocked().clear();
        }
        if (!rec.isReady()) {
            rec.failStart(new WorkerSpawnException(rec + " exited before it was ready", error));
        }
        if (terminate) shutdownContext(rec, error);
        if (!orphaned.isEmpty()) {
            DIAG.debug("{} lost with {} attached task(s)", rec, orphaned.size());
            handler.onContextLost(rec, orphaned, error);
        }
        drainWaiters();
    }

    private void shutdownContext(PoolRecord rec, @Nullable Throwable reason) {
        if (!rec.isReady()) rec.failStart(new WorkerSpawnException(rec + " stopped before it was ready", reason));
        WorkerContext ctx = rec.contextOrNull();
        if (ctx != null) ctx.terminate();
    }
    // [/🧩 Section: context-events]

    // 🧩 Section: sweep
    private void startSweepLocked() {
        if (sweep != null) return;
        long period = sweepInterval.toNanos();
        sweep = scheduler.scheduleWithFixedDelay(this::sweepIdle, period, period, TimeUnit.NANOSECONDS);
    }

    void sweepIdle() {
        List<PoolRecord> expired = new ArrayList<>();
        synchronized (lock) {
            long now = System.nanoTime();
            Iterator<PoolRecord> it = records.iterator();
            while (it.hasNext()) {
                PoolRecord r = it.next();
                if (r.isReady() && r.idleLocked() && now - r.lastAccessLocked() >= idleTimeoutNanos) {
                    it.remove();
                    r.dropLocked();
                    expired.add(r);
                }
            }
            if (records.isEmpty() && sweep != null) {
                sweep.cancel(false);
                sweep = null;
            }
        }
        for (PoolRecord r : expired) {
            DIAG.debug("{} idle for {}ms, terminating", r, TimeUnit.NANOSECONDS.toMillis(idleTimeoutNanos));
            shutdownContext(r, null);
        }
    }
    // [/🧩 Section: sweep]

    // 🧩 Section: inspection
    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }

    public @NonNull List<PoolRecord> records() {
        synchronized (lock) {
            return List.copyOf(records);
        }
    }

    public int queued() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    public int maxWorkers() {
        return maxWorkers;
    }
    // [/🧩 Section: inspection]

    // 🧩 Section: close

    /**
     * Terminate every context. Attached tasks are reported lost with an {@link AbortException};
     * queued acquirers fail with {@link WorkerSpawnException}.
     */
    @Override
    public void close() {
        List<PoolRecord> all;
        List<Waiter> pending;
        List<Set<Long>> attached = new ArrayList<>();
        synchronized (lock) {
            if (closed) return;
            closed = true;
            all = new ArrayList<>(records);
            records.clear();
            for (PoolRecord r : all) {
                r.dropLocked();
                attached.add(new HashSet<>(r.tasksLocked()));
                r.tasksLocked().clear();
            }
            pending = new ArrayList<>(waiters);
            waiters.clear();
            if (sweep != null) {
                sweep.cancel(false);
                sweep = null;
            }
        }
        DIAG.debug("pool closing: {} context(s), {} queued acquire(s)", all.size(), pending.size());
        AbortException closing = new AbortException("worker pool closed");
        for (Waiter w : pending) w.assigned().completeExceptionally(new WorkerSpawnException("worker pool closed"));
        for (int i = 0; i < all.size(); i++) {
            PoolRecord r = all.get(i);
            shutdownContext(r, closing);
            if (!attached.get(i).isEmpty()) handler.onContextLost(r, attached.get(i), closing);
        }
    }
    // [/🧩 Section: close]
}
