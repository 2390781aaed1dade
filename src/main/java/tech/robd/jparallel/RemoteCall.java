/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/RemoteCall.java
 description: Handle to a remote call: result or iteration, abort, and worker inspection.
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

import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;

/**
 * Handle to a function call running in a worker context.
 *
 * <p>The outcome is consumed either through {@link #result()} or through {@link #iterate()}, not
 * both. {@code result()} on a generator function drives the generator to its end and completes
 * with the return value.</p>
 *
 * @param <T> result (or yielded element) type
 */
public interface RemoteCall<T> {

    long taskId();

    /**
     * @return the id of the worker context running the call, empty while it waits for one
     */
    @NonNull OptionalLong workerId();

    /**
     * Future of the returned value, or of the final value of a generator.
     *
     * @throws IllegalStateException if {@link #iterate()} has been called
     */
    @NonNull CompletableFuture<T> result();

    /**
     * Consume a generator function step by step.
     *
     * @throws IllegalStateException if {@link #result()} has been called, or the call already
     *                               completed with a value that is not a generator
     */
    @NonNull RemoteGenerator<T> iterate();

    /**
     * Block until the call completes and return its result.
     *
     * @throws java.util.concurrent.CancellationException if the waiting thread is interrupted
     */
    @Nullable T join();

    /**
     * Abort with an {@link tech.robd.jparallel.error.AbortException}. An exclusive call terminates
     * its context; a shared call only detaches from it.
     *
     * @return {@code false} if the call had already completed or been aborted
     */
    boolean abort();

    boolean abort(@NonNull String reason);

    boolean abort(@NonNull Throwable reason);

    boolean isDone();

    @NonNull CancellationToken cancellationToken();
}
