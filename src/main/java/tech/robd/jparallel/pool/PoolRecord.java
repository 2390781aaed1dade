/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/pool/PoolRecord.java
 description: Pool bookkeeping for one worker context.
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

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * One live (or starting) worker context of a {@link WorkerPool}.
 *
 * <p>Mutable fields are guarded by the owning pool's monitor; the accessors without the
 * {@code Locked} suffix take that monitor themselves.</p>
 */
public final class PoolRecord {

    private final long workerId;
    private final Object poolLock;
    private final CompletableFuture<WorkerContext> spawned = new CompletableFuture<>();
    private final CompletableFuture<Void> readySignal = new CompletableFuture<>();
    private final CompletableFuture<PoolRecord> ready;

    private final Set<Long> tasks = new HashSet<>();
    private long lastAccess;
    private boolean busy;
    private boolean live = true;

    PoolRecord(long workerId, Object poolLock, long now) {
        this.workerId = workerId;
        this.poolLock = poolLock;
        this.lastAccess = now;
        this.ready = spawned.thenCombine(readySignal, (ctx, v) -> this);
    }

    public long workerId() {
        return workerId;
    }

    /**
     * @return the context; only valid once {@link #whenReady()} completed
     */
    public @NonNull WorkerContext context() {
        WorkerContext ctx = spawned.getNow(null);
        if (ctx == null) throw new IllegalStateException("worker#" + workerId + " is not started");
        return ctx;
    }

    public @NonNull CompletableFuture<PoolRecord> whenReady() {
        return ready;
    }

    public boolean isReady() {
        return ready.isDone() && !ready.isCompletedExceptionally();
    }

    public int taskCount() {
        synchronized (poolLock) {
            return tasks.size();
        }
    }

    public boolean isBusy() {
        synchronized (poolLock) {
            return busy;
        }
    }

    public boolean isLive() {
        synchronized (poolLock) {
            return live;
        }
    }

    // 🧩 Section: pool-internal
    void bound(WorkerContext ctx) {
        spawned.complete(ctx);
    }

    @Nullable WorkerContext contextOrNull() {
        return spawned.getNow(null);
    }

    void markReady() {
        readySignal.complete(null);
    }

    void failStart(Throwable error) {
        readySignal.completeExceptionally(error);
        spawned.completeExceptionally(error);
    }

    int taskCountLocked() {
        return tasks.size();
    }

    Set<Long> tasksLocked() {
        return tasks;
    }

    boolean busyLocked() {
        return busy;
    }

    void busyLocked(boolean value) {
        busy = value;
    }

    boolean liveLocked() {
        return live;
    }

    void dropLocked() {
        live = false;
    }

    long lastAccessLocked() {
        return lastAccess;
    }

    void touchLocked(long now) {
        lastAccess = now;
    }

    boolean idleLocked() {
        return !busy && tasks.isEmpty();
    }
    // [/🧩 Section: pool-internal]

    @Override
    public String toString() {
        return "worker#" + workerId;
    }
}
