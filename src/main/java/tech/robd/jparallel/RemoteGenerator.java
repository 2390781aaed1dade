/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/RemoteGenerator.java
 description: Blocking proxy for a generator running in a worker context.
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

import java.util.concurrent.CompletableFuture;

/**
 * Blocking proxy for a generator running in a worker context. Iteration yields the generated
 * values and leaves out the final return value, which {@link #completion()} carries.
 *
 * @param <T> element type
 */
public interface RemoteGenerator<T> extends Iterable<T>, AutoCloseable {

    @NonNull Step<T> next();

    /**
     * Resume the generator, passing {@code input} as the value of its pending yield.
     */
    @NonNull Step<T> next(@Nullable Object input);

    /**
     * Finish the generator early with {@code value}.
     */
    @NonNull Step<T> returnValue(@Nullable T value);

    /**
     * Raise {@code error} inside the generator at its pending yield.
     */
    @NonNull Step<T> throwError(@NonNull Throwable error);

    @NonNull CompletableFuture<T> completion();

    /**
     * Ask an unfinished generator to return. Does not wait for the answer.
     */
    @Override
    void close();
}
