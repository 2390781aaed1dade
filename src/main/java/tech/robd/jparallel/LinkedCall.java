/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/LinkedCall.java
 description: Awaitable and iterable call made through a linked module.
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

import java.util.Iterator;
import java.util.concurrent.CompletableFuture;

/**
 * Call made through a {@link LinkedModule}: awaitable and iterable. Whichever is used first
 * decides how the call is consumed.
 *
 * <p>Leaving a for-each loop early does not finish the remote generator. Iterate inside
 * try-with-resources so {@link #close()} asks it to return:</p>
 * <pre>{@code
 * try (LinkedCall<String> words = mod.call("sequence", list)) {
 *     for (String w : words) { if (w.isEmpty()) break; }
 * }
 * }</pre>
 *
 * @param <T> result (or yielded element) type
 */
public final class LinkedCall<T> implements Iterable<T>, AutoCloseable {
    private final RemoteCall<T> call;
    private @Nullable RemoteGenerator<T> generator;

    LinkedCall(@NonNull RemoteCall<T> call) {
        this.call = call;
    }

    public @NonNull CompletableFuture<T> result() {
        return call.result();
    }

    public @Nullable T join() {
        return call.join();
    }

    /**
     * Values yielded by a generator function; the return value is left out.
     */
    @Override
    public @NonNull Iterator<T> iterator() {
        return generator().iterator();
    }

    public synchronized @NonNull RemoteGenerator<T> generator() {
        if (generator == null) generator = call.iterate();
        return generator;
    }

    /**
     * Finish a generator left unfinished by iteration. Awaited calls are not affected.
     */
    @Override
    public void close() {
        RemoteGenerator<T> g;
        synchronized (this) {
            g = generator;
        }
        if (g != null) g.close();
    }

    public boolean abort() {
        return call.abort();
    }

    public @NonNull RemoteCall<T> handle() {
        return call;
    }

    @Override
    public String toString() {
        return "LinkedCall[" + call + "]";
    }
}
