/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/internal/LocalCall.java
 description: Remote call run in place when dispatched from inside a worker context.
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
import tech.robd.jparallel.Step;
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.error.AbortException;
import tech.robd.jparallel.task.Task;
import tech.robd.jparallel.worker.Generator;
import tech.robd.jparallel.worker.RemoteFunction;
import tech.robd.jparallel.worker.WorkerRuntime;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A call made from inside a worker context. Runs the function in place on the context's
 * executor, without copying arguments, and offers the same consumption rules as a remote call.
 */
public final class LocalCall<T> implements RemoteCall<T> {
    private static final Diagnostics DIAG = Diagnostics.of(LocalCall.class);
    private static final AtomicLong IDS = new AtomicLong();

    private final long callId = IDS.incrementAndGet();
    private final ExecutorService executor;
    private final CompletableFuture<@Nullable Object> invoked;
    private final CompletableFuture<@Nullable Object> outcome = new CompletableFuture<>();
    private final CancellationTokenImpl token = new CancellationTokenImpl();
    private Task.Mode mode = Task.Mode.UNSELECTED;
    private @Nullable RemoteGenerator<T> generator;

    public LocalCall(@NonNull WorkerRuntime runtime, @NonNull String module, @NonNull String fn, @NonNull List<?> args) {
        this.executor = runtime.executor();
        List<@Nullable Object> actual = new ArrayList<>(args);
        DIAG.debug("local#{} {}.{}", callId, module, fn);
        this.invoked = CompletableFuture.supplyAsync(() -> {
            try {
                RemoteFunction function = runtime.resolver().function(module, fn);
                return function.invoke(actual);
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor).thenCompose(LocalCall::flatten);
        invoked.whenComplete((v, e) -> {
            if (e != null) outcome.completeExceptionally(unwrap(e));
            else if (!(v instanceof Generator<?>)) outcome.complete(v);
        });
        token.onCancel(why -> {
            outcome.completeExceptionally(why);
            Object v = invoked.getNow(null);
            if (v instanceof Generator<?> g) g.close();
        });
        outcome.whenComplete((v, e) -> token.markCompleted());
    }

    private static CompletionStage<@Nullable Object> flatten(@Nullable Object value) {
        if (value instanceof CompletionStage<?> stage) return stage.thenApply(x -> (Object) x);
        return CompletableFuture.completedFuture(value);
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    @Override
    public long taskId() {
        return callId;
    }

    @Override
    public @NonNull OptionalLong workerId() {
        return OptionalLong.empty();
    }

    @SuppressWarnings("unchecked")
    @Override
    public @NonNull CompletableFuture<T> result() {
        boolean first;
        synchronized (this) {
            if (mode == Task.Mode.ITERATE) throw new IllegalStateException("iterate() has been called");
            first = mode == Task.Mode.UNSELECTED;
            mode = Task.Mode.RESULT;
        }
        if (first) {
            invoked.thenAcceptAsync(v -> {
                if (v instanceof Generator<?> g) drain(g);
            }, executor);
        }
        return outcome.thenApply(v -> (T) v);
    }

    private void drain(Generator<?> g) {
        try {
            Step<?> step = g.next(null);
            while (!step.done() && !outcome.isDone()) step = g.next(null);
            outcome.complete(step.value());
        } catch (Exception e) {
            outcome.completeExceptionally(e);
        }
    }

    @Override
    public synchronized @NonNull RemoteGenerator<T> iterate() {
        if (mode == Task.Mode.RESULT) throw new IllegalStateException("result() has been called");
        if (invoked.isDone() && !invoked.isCompletedExceptionally() && !(invoked.getNow(null) instanceof Generator<?>)) {
            throw new IllegalStateException("the response is not iterable");
        }
        mode = Task.Mode.ITERATE;
        if (generator == null) generator = new LocalGenerator();
        return generator;
    }

    @Override
    public @Nullable T join() {
        return Futures.await(result(), "local#" + callId);
    }

    @Override
    public boolean abort() {
        return abort(new AbortException("This operation was aborted"));
    }

    @Override
    public boolean abort(@NonNull String reason) {
        return abort(new AbortException(reason));
    }

    @Override
    public boolean abort(@NonNull Throwable reason) {
        if (reason == null) throw new IllegalArgumentException("Reason cannot be null");
        if (outcome.isDone()) return false;
        return token.cancel(reason);
    }

    @Override
    public boolean isDone() {
        return outcome.isDone();
    }

    @Override
    public @NonNull CancellationToken cancellationToken() {
        return token;
    }

    // 🧩 Section: local-generator
    private final class LocalGenerator implements RemoteGenerator<T> {

        @SuppressWarnings("unchecked")
        private Generator<T> source() {
            Object v = Futures.await(invoked, "local#" + callId);
            if (!(v instanceof Generator<?>)) throw new IllegalStateException("the response is not iterable");
            return (Generator<T>) v;
        }

        private Step<T> track(StepCall<T> call) {
            if (outcome.isDone()) {
                Throwable failure = Futures.failure(outcome);
                if (failure != null) throw Futures.rethrow(failure);
                return Step.done(null);
            }
            try {
                Step<T> step = call.apply(source());
                if (step.done()) outcome.complete(step.value());
                return step;
            } catch (Exception e) {
                outcome.completeExceptionally(e);
                throw Futures.rethrow(e);
            }
        }

        @Override
        public @NonNull Step<T> next() {
            return track(g -> g.next(null));
        }

        @Override
        public @NonNull Step<T> next(@Nullable Object input) {
            return track(g -> g.next(input));
        }

        @Override
        public @NonNull Step<T> returnValue(@Nullable T value) {
            return track(g -> g.returnValue(value));
        }

        @Override
        public @NonNull Step<T> throwError(@NonNull Throwable error) {
            return track(g -> g.throwError(error));
        }

        @SuppressWarnings("unchecked")
        @Override
        public @NonNull CompletableFuture<T> completion() {
            return outcome.thenApply(v -> (T) v);
        }

        @Override
        public void close() {
            if (!outcome.isDone()) track(g -> g.returnValue(null));
        }

        @Override
        public @NonNull Iterator<T> iterator() {
            return new Iterator<>() {
                private @Nullable Step<T> pending;
                private boolean finished;

                @Override
                public boolean hasNext() {
                    if (pending != null) return true;
                    if (finished) return false;
                    Step<T> step = LocalGenerator.this.next();
                    if (step.done()) {
                        finished = true;
                        return false;
                    }
                    pending = step;
                    return true;
                }

                @Override
                public T next() {
                    if (!hasNext()) throw new NoSuchElementException("Generator finished");
                    T value = pending.value();
                    pending = null;
                    return value;
                }
            };
        }
    }

    @FunctionalInterface
    private interface StepCall<T> {
        Step<T> apply(Generator<T> g) throws Exception;
    }
    // [/🧩 Section: local-generator]

    @Override
    public String toString() {
        return "LocalCall[local#" + callId + (outcome.isDone() ? ", done" : "") + "]";
    }
}
