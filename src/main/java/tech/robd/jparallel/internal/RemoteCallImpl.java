/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/internal/RemoteCallImpl.java
 description: Default remote call: ties a task to its pool record, timeout and cancellation.
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
package tech.robd.jparallel.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.CancellationToken;
import tech.robd.jparallel.RemoteCall;
import tech.robd.jparallel.RemoteGenerator;
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.error.AbortException;
import tech.robd.jparallel.error.OperationTimeoutException;
import tech.robd.jparallel.pool.PoolRecord;
import tech.robd.jparallel.pool.WorkerPool;
import tech.robd.jparallel.protocol.CallMessage;
import tech.robd.jparallel.task.Task;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link RemoteCall}. Ties a {@link Task} to the pool record it runs on and to a
 * cancellation token: cancelling the token aborts the call, settling the task gives the record
 * back to the pool.
 *
 * <ul>
 *   <li>exclusive call settles: the context is released when kept alive, retired otherwise;</li>
 *   <li>exclusive call aborted: the context is retired;</li>
 *   <li>shared call settles or is aborted: the task is detached from the context.</li>
 * </ul>
 */
public final class RemoteCallImpl<T> implements RemoteCall<T> {

    // 🧩 Section: diagnostics
    private static final Diagnostics DIAG = Diagnostics.of(RemoteCallImpl.class);
    // [/🧩 Section: diagnostics]

    // 🧩 Section: state
    private final Task task;
    private final ContextLink link;
    private final WorkerPool pool;
    private final boolean exclusive;
    private final boolean keepAlive;
    private final CancellationToken token;

    private @Nullable PoolRecord record;
    private @Nullable ScheduledFuture<?> timeout;
    private @Nullable RemoteGeneratorImpl<T> generator;
    private boolean aborted;
    // [/🧩 Section: state]

    // 🧩 Section: construction
    public RemoteCallImpl(@NonNull Task task,
                          @NonNull ContextLink link,
                          @NonNull WorkerPool pool,
                          @NonNull CancellationToken parent,
                          boolean exclusive,
                          boolean keepAlive) {
        if (task == null) throw new IllegalArgumentException("Task cannot be null");
        if (link == null || pool == null) throw new IllegalArgumentException("Link and pool cannot be null");
        if (parent == null) throw new IllegalArgumentException("CancellationToken cannot be null");
        this.task = task;
        this.link = link;
        this.pool = pool;
        this.exclusive = exclusive;
        this.keepAlive = keepAlive;
        this.token = parent.child();

        DIAG.debug("task#{} handle create ({})", task.id(), exclusive ? "exclusive" : "shared");

        // 🧩 Point: construction/token→task
        token.onCancel(this::onAbort);

        // 🧩 Point: construction/task→pool
        task.outcome().whenComplete((v, e) -> onSettled());
    }
    // [/🧩 Section: construction]

    // 🧩 Section: lifecycle

    /**
     * The pool handed out a ready record. Sends the call unless the task already settled.
     */
    public void onAcquired(@NonNull PoolRecord rec, @NonNull CallMessage call) {
        boolean settled;
        boolean wasAborted;
        synchronized (this) {
            record = rec;
            wasAborted = aborted;
            settled = wasAborted || task.isSettled();
        }
        if (settled) {
            DIAG.debug("task#{} settled before {} was ready, giving it back", task.id(), rec);
            if (!exclusive) pool.detach(rec, task.id());
            else if (wasAborted || !keepAlive) pool.retire(rec);
            else pool.release(rec);
            return;
        }
        DIAG.debug("task#{} dispatching {}.{} to {}", task.id(), call.module(), call.fn(), rec);
        link.bind(rec.context(), call);
    }

    /**
     * Abort the call with an {@link OperationTimeoutException} unless it settles within {@code after}.
     */
    public void scheduleTimeout(@NonNull ScheduledExecutorService scheduler, @NonNull Duration after) {
        ScheduledFuture<?> f = scheduler.schedule(
                () -> token.cancel(new OperationTimeoutException(after)),
                after.toNanos(), TimeUnit.NANOSECONDS);
        synchronized (this) {
            if (!task.isSettled()) {
                timeout = f;
                return;
            }
        }
        f.cancel(false);
    }

    private void onAbort(Throwable why) {
        PoolRecord rec;
        synchronized (this) {
            if (task.isSettled()) return;
            aborted = true;
            rec = record;
        }
        DIAG.debug("task#{} aborted: {}", task.id(), why.toString());
        link.cut();
        task.fail(why);
        if (rec == null) {
            // still queued: a context freed later must not be handed to this call
            pool.cancel(task.id(), why);
            return;
        }
        if (exclusive) pool.retire(rec);
        else pool.detach(rec, task.id());
    }

    private void onSettled() {
        PoolRecord rec;
        ScheduledFuture<?> t;
        boolean wasAborted;
        synchronized (this) {
            rec = record;
            t = timeout;
            timeout = null;
            wasAborted = aborted;
        }
        if (t != null) t.cancel(false);
        if (token instanceof CancellationTokenImpl impl) impl.markCompleted();
        if (wasAborted || rec == null) return;
        if (!exclusive) {
            pool.detach(rec, task.id());
        } else if (keepAlive) {
            pool.release(rec);
        } else {
            pool.retire(rec);
        }
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: API
    @Override
    public long taskId() {
        return task.id();
    }

    @Override
    public synchronized @NonNull OptionalLong workerId() {
        return record == null ? OptionalLong.empty() : OptionalLong.of(record.workerId());
    }

    @SuppressWarnings("unchecked")
    @Override
    public @NonNull CompletableFuture<T> result() {
        task.selectResult();
        return task.outcome().thenApply(v -> (T) v);
    }

    @Override
    public synchronized @NonNull RemoteGenerator<T> iterate() {
        if (generator == null) generator = new RemoteGeneratorImpl<>(task, task.selectIterate());
        return generator;
    }

    @Override
    public @Nullable T join() {
        return Futures.await(result(), "task#" + task.id());
    }

    @Override
    public boolean abort() {
        return abort(new AbortException("This operation was aborted"));
    }

    @Override
    public boolean abort(@NonNull String reason) {
        if (reason == null) throw new IllegalArgumentException("Reason cannot be null");
        return abort(new AbortException(reason));
    }

    @Override
    public boolean abort(@NonNull Throwable reason) {
        if (reason == null) throw new IllegalArgumentException("Reason cannot be null");
        if (task.isSettled()) {
            DIAG.debug("task#{} abort ignored (settled)", task.id());
            return false;
        }
        return token.cancel(reason);
    }

    @Override
    public boolean isDone() {
        return task.isSettled();
    }

    @Override
    public @NonNull CancellationToken cancellationToken() {
        return token;
    }
    // [/🧩 Section: API]

    @Override
    public String toString() {
        String status = task.isSettled()
                ? (task.outcome().isCompletedExceptionally() ? (aborted ? "ABORTED" : "FAILED") : "COMPLETED")
                : "ACTIVE";
        return "RemoteCall[task#" + task.id() + ", " + status + "]";
    }
}
