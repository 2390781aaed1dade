/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/ParallelRuntime.java
 description: Runtime facade: dispatches calls to the worker pool, routes replies to tasks, and owns shutdown.
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
package tech.robd.jparallel;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.error.AbortException;
import tech.robd.jparallel.internal.CancellationTokenImpl;
import tech.robd.jparallel.internal.ChannelHub;
import tech.robd.jparallel.internal.ContextLink;
import tech.robd.jparallel.internal.LocalCall;
import tech.robd.jparallel.internal.RemoteCallImpl;
import tech.robd.jparallel.pool.PoolHandler;
import tech.robd.jparallel.pool.PoolRecord;
import tech.robd.jparallel.pool.WorkerPool;
import tech.robd.jparallel.protocol.CallMessage;
import tech.robd.jparallel.protocol.ChannelMessage;
import tech.robd.jparallel.protocol.ErrorMessage;
import tech.robd.jparallel.protocol.GeneratorAck;
import tech.robd.jparallel.protocol.GeneratorRequest;
import tech.robd.jparallel.protocol.MessageVisitor;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.protocol.Ready;
import tech.robd.jparallel.protocol.ReturnMessage;
import tech.robd.jparallel.protocol.WireValues;
import tech.robd.jparallel.protocol.YieldMessage;
import tech.robd.jparallel.task.Task;
import tech.robd.jparallel.task.TaskIdSequence;
import tech.robd.jparallel.task.TaskRegistry;
import tech.robd.jparallel.worker.WorkerRuntime;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs module functions in pooled worker contexts.
 *
 * <ul>
 *   <li>{@link #run} reserves a context for the call (exclusive mode);</li>
 *   <li>{@link #call} and {@link #link} share contexts between calls (shared mode).</li>
 * </ul>
 *
 * <p>Calls made from a function already running in a worker context run in place.
 * {@link #close()} aborts every call in flight and terminates all contexts.</p>
 */
public final class ParallelRuntime implements AutoCloseable {
    private static final Diagnostics DIAG = Diagnostics.of(ParallelRuntime.class);

    // 🧩 Section: state
    private final RuntimeConfig config;
    private final ScheduledExecutorService scheduler;
    private final TaskRegistry tasks;
    private final ChannelHub channels = new ChannelHub(true);
    private final WorkerPool pool;
    private final CancellationTokenImpl rootToken = new CancellationTokenImpl();
    private final AtomicBoolean closed = new AtomicBoolean();
    // [/🧩 Section: state]

    public ParallelRuntime() {
        this(RuntimeConfig.fromSystemProperties());
    }

    public ParallelRuntime(@NonNull RuntimeConfig config) {
        if (config == null) throw new IllegalArgumentException("Config cannot be null");
        this.config = config;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jparallel-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.tasks = new TaskRegistry(new TaskIdSequence(config.taskIdCeiling()));
        this.pool = new WorkerPool(config.maxWorkers(), config.idleTimeout(), config.sweepInterval(),
                config.assignmentPolicy(), config.spawner(), new Handler(), scheduler);
        DIAG.info("runtime created {}", config);
    }

    // 🧩 Section: API

    /**
     * Run {@code module.fn} in a context reserved for this call.
     */
    public <T> @NonNull RemoteCall<T> run(@NonNull String module, @NonNull String fn,
                                          @NonNull List<?> args, @NonNull RunOptions options) {
        if (options == null) throw new IllegalArgumentException("Options cannot be null");
        return dispatch(true, module, fn, args, options);
    }

    public <T> @NonNull RemoteCall<T> run(@NonNull String module, @NonNull String fn, @Nullable Object... args) {
        return run(module, fn, asList(args), RunOptions.none());
    }

    /**
     * Call {@code module.fn} in a context that may run other calls at the same time.
     * {@link RunOptions#keepAlive()} does not apply: shared contexts always stay in the pool.
     */
    public <T> @NonNull RemoteCall<T> call(@NonNull String module, @NonNull String fn,
                                           @NonNull List<?> args, @NonNull RunOptions options) {
        if (options == null) throw new IllegalArgumentException("Options cannot be null");
        return dispatch(false, module, fn, args, options);
    }

    public <T> @NonNull RemoteCall<T> call(@NonNull String module, @NonNull String fn, @Nullable Object... args) {
        return call(module, fn, asList(args), RunOptions.none());
    }

    public @NonNull LinkedModule link(@NonNull String module) {
        if (module == null) throw new IllegalArgumentException("Module cannot be null");
        return new LinkedModule(this, module);
    }

    /**
     * Typed proxy for {@code module}; see {@link LinkedModule#as(Class)}.
     */
    public <I> @NonNull I link(@NonNull String module, @NonNull Class<I> api) {
        return link(module).as(api);
    }
    // [/🧩 Section: API]

    // 🧩 Section: dispatch
    private <T> RemoteCall<T> dispatch(boolean exclusive, String module, String fn, List<?> args, RunOptions options) {
        if (module == null || fn == null) throw new IllegalArgumentException("Module and fn cannot be null");
        if (args == null) throw new IllegalArgumentException("Args cannot be null");
        if (closed.get()) throw new IllegalStateException("Runtime is closed");

        Optional<WorkerRuntime> local = WorkerRuntime.current();
        if (local.isPresent()) return new LocalCall<>(local.get(), module, fn, args);

        Task task = tasks.register(module, fn);
        ContextLink link = new ContextLink(task.id());
        task.bindSink(link);
        WireValues.Encoded encoded;
        try {
            encoded = WireValues.encodeArgs(args, ch -> channels.share(ch, link));
        } catch (RuntimeException e) {
            task.fail(e);
            throw e;
        }
        CallMessage call = new CallMessage(task.id(), module, fn, encoded.values(), encoded.transfer());
        RemoteCallImpl<T> handle = new RemoteCallImpl<>(task, link, pool, rootToken, exclusive, options.keepAlive());

        CompletableFuture<PoolRecord> acquired = exclusive
                ? pool.acquireExclusive(task.id())
                : pool.acquireShared(task.id());
        acquired.whenComplete((rec, err) -> {
            if (err != null) {
                task.fail(err instanceof CompletionException && err.getCause() != null ? err.getCause() : err);
                return;
            }
            try {
                handle.onAcquired(rec, call);
            } catch (RuntimeException e) {
                DIAG.warn("task#{} dispatch to {} failed", task.id(), rec, e);
                task.fail(e);
            }
        });
        if (options.timeout() != null) handle.scheduleTimeout(scheduler, options.timeout());
        return handle;
    }

    private static List<?> asList(@Nullable Object[] args) {
        return args == null ? List.of() : Arrays.asList(args);
    }
    // [/🧩 Section: dispatch]

    // 🧩 Section: inbound
    private final class Handler implements PoolHandler {
        private final MessageVisitor<Void> inbound = new HostInbound();

        @Override
        public void onMessage(PoolRecord record, ProtocolMessage message) {
            message.accept(inbound);
        }

        @Override
        public void onContextLost(PoolRecord record, Set<Long> taskIds, @Nullable Throwable error) {
            DIAG.debug("{} lost, settling {} task(s)", record, taskIds.size());
            for (Long id : taskIds) {
                tasks.get(id).ifPresent(t -> {
                    if (error == null) t.settle(null);
                    else t.fail(error);
                });
            }
        }
    }

    private final class HostInbound implements MessageVisitor<Void> {
        @Override
        public Void visitReturn(ReturnMessage m) {
            tasks.route(m);
            return null;
        }

        @Override
        public Void visitYield(YieldMessage m) {
            tasks.route(m);
            return null;
        }

        @Override
        public Void visitError(ErrorMessage m) {
            tasks.route(m);
            return null;
        }

        @Override
        public Void visitGeneratorAck(GeneratorAck m) {
            tasks.route(m);
            return null;
        }

        @Override
        public Void visitChannel(ChannelMessage m) {
            channels.handle(m);
            return null;
        }

        @Override
        public Void visitReady(Ready m) {
            return unexpected(m);
        }

        @Override
        public Void visitCall(CallMessage m) {
            return unexpected(m);
        }

        @Override
        public Void visitGeneratorRequest(GeneratorRequest m) {
            return unexpected(m);
        }

        private Void unexpected(ProtocolMessage m) {
            DIAG.warn("host ignoring {} message from a worker", m.type());
            return null;
        }
    }
    // [/🧩 Section: inbound]

    // 🧩 Section: inspection
    public @NonNull RuntimeConfig config() {
        return config;
    }

    /**
     * @return the number of live (or starting) contexts
     */
    public int workerCount() {
        return pool.size();
    }

    /**
     * @return the number of calls that have not completed
     */
    public int inFlight() {
        return tasks.size();
    }

    public boolean isClosed() {
        return closed.get();
    }
    // [/🧩 Section: inspection]

    /**
     * Abort every call in flight with an {@link AbortException} and terminate all contexts.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        DIAG.info("runtime closing ({} call(s) in flight, {} context(s))", tasks.size(), pool.size());
        rootToken.cancel(new AbortException("runtime closed"));
        pool.close();
        scheduler.shutdownNow();
    }
}
