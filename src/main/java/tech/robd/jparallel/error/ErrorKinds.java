/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/error/ErrorKinds.java
 description: Registry of error kinds the codec can rebuild by name or class.
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
package tech.robd.jparallel.error;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.diagnostics.Diagnostics;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Registry of exception types that {@link ErrorCodec#fromObject(ErrorRecord)} can rebuild.
 *
 * <p>A kind tag is the fully-qualified class name of the encoded throwable. Only tags present
 * here are turned back into their own type; everything else becomes a {@link ParallelException}.
 * The registry maps tags to factories and never loads a class by name.</p>
 */
public final class ErrorKinds {
    private static final Diagnostics DIAG = Diagnostics.of(ErrorKinds.class);

    /**
     * Builds an exception from a decoded message and cause.
     */
    @FunctionalInterface
    public interface Factory {
        @NonNull Throwable create(@Nullable String message, @Nullable Throwable cause);
    }

    private static final ConcurrentMap<String, Factory> KINDS = new ConcurrentHashMap<>();

    // 🧩 Section: built-in-kinds
    static {
        register(Exception.class, Exception::new);
        register(RuntimeException.class, RuntimeException::new);
        register(Error.class, Error::new);
        register(AssertionError.class, AssertionError::new);
        register(IllegalArgumentException.class, IllegalArgumentException::new);
        register(IllegalStateException.class, IllegalStateException::new);
        register(UnsupportedOperationException.class, UnsupportedOperationException::new);
        register(ConcurrentModificationException.class, ConcurrentModificationException::new);
        register(NullPointerException.class, (m, c) -> new NullPointerException(m));
        register(ArithmeticException.class, (m, c) -> new ArithmeticException(m));
        register(ClassCastException.class, (m, c) -> new ClassCastException(m));
        register(NumberFormatException.class, (m, c) -> new NumberFormatException(m));
        register(IndexOutOfBoundsException.class, (m, c) -> new IndexOutOfBoundsException(m));
        register(ArrayIndexOutOfBoundsException.class, (m, c) -> new ArrayIndexOutOfBoundsException(m));
        register(NoSuchElementException.class, (m, c) -> new NoSuchElementException(m));
        register(StackOverflowError.class, (m, c) -> new StackOverflowError(m));
        register(OutOfMemoryError.class, (m, c) -> new OutOfMemoryError(m));
        register(InterruptedException.class, (m, c) -> new InterruptedException(m));
        register(CancellationException.class, (m, c) -> new CancellationException(m));
        register(TimeoutException.class, (m, c) -> new TimeoutException(m));
        register(ExecutionException.class, ExecutionException::new);
        register(IOException.class, IOException::new);
        register(UncheckedIOException.class, (m, c) -> c instanceof IOException io
                ? new UncheckedIOException(m, io)
                : new UncheckedIOException(m, new IOException(m, c)));

        register(ParallelException.class, ParallelException::new);
        register(AbortException.class, AbortException::new);
        register(OperationTimeoutException.class, (m, c) -> new OperationTimeoutException(m));
        register(WorkerExitedException.class, (m, c) -> new WorkerExitedException(m));
        register(WorkerSpawnException.class, WorkerSpawnException::new);
        register(ModuleResolutionException.class, ModuleResolutionException::new);
        register(AggregateException.class, (m, c) -> new AggregateException(m, List.of(), c));
    }
    // [/🧩 Section: built-in-kinds]

    private ErrorKinds() {
    }

    // 🧩 Section: registry

    /**
     * Register (or replace) the factory for {@code type}. Application exception types have to be
     * registered on both sides of the boundary to survive a round trip with their own type.
     */
    public static <T extends Throwable> void register(@NonNull Class<T> type, @NonNull Factory factory) {
        if (type == null || factory == null) throw new IllegalArgumentException("Type and factory cannot be null");
        Factory previous = KINDS.put(type.getName(), factory);
        if (previous != null) DIAG.debug("Replaced error kind {}", type.getName());
    }

    public static @NonNull Optional<Factory> lookup(@NonNull String kind) {
        return Optional.ofNullable(KINDS.get(kind));
    }

    public static boolean isKnown(@NonNull String kind) {
        return KINDS.containsKey(kind);
    }

    /**
     * @return the kind tag written for {@code error}
     */
    public static @NonNull String kindOf(@NonNull Throwable error) {
        return error.getClass().getName();
    }
    // [/🧩 Section: registry]
}
