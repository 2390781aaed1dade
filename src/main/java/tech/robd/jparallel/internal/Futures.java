/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/internal/Futures.java
 description: Blocking await, failure extraction and rethrow helpers for futures.
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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Blocking joins with the library's unwrapping rules.
 */
public final class Futures {

    private Futures() {
    }

    /**
     * Wait for {@code future}. Runtime exceptions and errors are rethrown as they are, checked
     * causes are wrapped in a {@link RuntimeException}.
     *
     * @throws CancellationException if the thread is interrupted while waiting
     */
    public static <T> T await(@NonNull CompletableFuture<T> future, @NonNull String what) {
        try {
            return future.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for " + what);
        } catch (ExecutionException ee) {
            throw rethrow(ee.getCause());
        }
    }

    public static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException re) return re;
        if (cause instanceof Error err) throw err;
        return new RuntimeException(cause);
    }

    /**
     * @return the failure of a completed future, or {@code null}
     */
    public static @Nullable Throwable failure(@NonNull CompletableFuture<?> future) {
        if (!future.isCompletedExceptionally()) return null;
        try {
            future.join();
            return null;
        } catch (CancellationException ce) {
            return ce;
        } catch (RuntimeException e) {
            return e.getCause() != null ? e.getCause() : e;
        }
    }
}
