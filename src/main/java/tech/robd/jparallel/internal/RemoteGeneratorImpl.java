/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/internal/RemoteGeneratorImpl.java
 description: Host-side generator proxy over a task in iterate mode.
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
import tech.robd.jparallel.Channel;
import tech.robd.jparallel.RemoteGenerator;
import tech.robd.jparallel.Step;
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.protocol.GeneratorRequest;
import tech.robd.jparallel.task.Task;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

/**
 * {@link RemoteGenerator} over a task in iterate mode. Each step sends one generator request and
 * takes one step from the task's output channel. Steps are taken one at a time.
 */
public final class RemoteGeneratorImpl<T> implements RemoteGenerator<T> {
    private static final Diagnostics DIAG = Diagnostics.of(RemoteGeneratorImpl.class);

    private final Task task;
    private final Channel<Step<Object>> output;

    public RemoteGeneratorImpl(@NonNull Task task, @NonNull Channel<Step<Object>> output) {
        if (task == null || output == null) throw new IllegalArgumentException("Task and output cannot be null");
        this.task = task;
        this.output = output;
    }

    // 🧩 Section: steps
    @Override
    public @NonNull Step<T> next() {
        return exchange(GeneratorRequest.Kind.NEXT, null);
    }

    @Override
    public @NonNull Step<T> next(@Nullable Object input) {
        return exchange(GeneratorRequest.Kind.NEXT, input);
    }

    @Override
    public @NonNull Step<T> returnValue(@Nullable T value) {
        return exchange(GeneratorRequest.Kind.RETURN, value);
    }

    @Override
    public @NonNull Step<T> throwError(@NonNull Throwable error) {
        if (error == null) throw new IllegalArgumentException("Error cannot be null");
        return exchange(GeneratorRequest.Kind.THROW, error);
    }

    private synchronized Step<T> exchange(GeneratorRequest.Kind kind, @Nullable Object value) {
        awaitGenerator();
        if (!task.isSettled()) {
            DIAG.debug("task#{} -> {}", task.id(), kind.wire());
            task.request(kind, value);
        }
        try {
            return cast(output.receive());
        } catch (Channel.ClosedReceiveException closed) {
            return Step.done(null);
        }
    }

    private void awaitGenerator() {
        Boolean generator = Futures.await(task.generator(), "generator acknowledgement of task#" + task.id());
        if (Boolean.TRUE.equals(generator)) return;
        Throwable failure = Futures.failure(task.outcome());
        if (failure != null) throw Futures.rethrow(failure);
        throw new IllegalStateException("the response is not iterable");
    }

    @SuppressWarnings("unchecked")
    private static <T> Step<T> cast(Step<Object> step) {
        return (Step<T>) (Step<?>) step;
    }
    // [/🧩 Section: steps]

    @Override
    public @NonNull Iterator<T> iterator() {
        return new Iterator<>() {
            private @Nullable Step<T> pending;
            private boolean finished;

            @Override
            public boolean hasNext() {
                if (pending != null) return true;
                if (finished) return false;
                Step<T> step = RemoteGeneratorImpl.this.next();
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

    @SuppressWarnings("unchecked")
    @Override
    public @NonNull CompletableFuture<T> completion() {
        return task.outcome().thenApply(v -> (T) v);
    }

    @Override
    public void close() {
        if (task.isSettled() || !task.generator().getNow(false)) return;
        DIAG.debug("task#{} generator closed early", task.id());
        task.request(GeneratorRequest.Kind.RETURN, null);
    }

    @Override
    public String toString() {
        return "RemoteGenerator[" + task + (task.isSettled() ? ", done" : "") + "]";
    }
}
