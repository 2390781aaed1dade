/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/Channel.java
 description: Public channel type: blocking and async send/receive, close with error, and sharing with worker contexts.
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
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.internal.BaseChannel;

import java.util.Collection;
import java.util.function.Consumer;

/**
 * Asynchronous FIFO queue with an explicit close signal, usable between threads of the host
 * and, when passed as a call argument, between the host and a worker context.
 *
 * <p>Factories:
 * <ul>
 *   <li>{@link #unlimited()} – never blocks a sender</li>
 *   <li>{@link #buffered(int)} – blocks senders while {@code capacity} values are buffered</li>
 *   <li>{@link #rendezvous()} – capacity 0, every send waits for a receiver</li>
 * </ul>
 *
 * <p>A channel passed to a remote function is shared: values the function pushes show up here,
 * values sent here are forwarded to the function (round-robin when several calls share it),
 * and closing on either side closes both.</p>
 *
 * @param <T> element type
 */
public final class Channel<T> extends BaseChannel<T> {
    private static final Diagnostics DIAG = Diagnostics.of(Channel.class);

    // 🧩 Section: construction
    private Channel(int capacity) {
        super(capacity);
        DIAG.debug("ch#{} created (capacity={})", id(), capacity);
    }

    private Channel(long id, int capacity) {
        super(id, capacity);
        DIAG.debug("ch#{} proxy created (capacity={})", id, capacity);
    }

    public static <T> @NonNull Channel<T> unlimited() {
        return new Channel<>(UNLIMITED);
    }

    public static <T> @NonNull Channel<T> buffered(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("Capacity must be positive");
        return new Channel<>(capacity);
    }

    public static <T> @NonNull Channel<T> rendezvous() {
        return new Channel<>(0);
    }

    /**
     * @param capacity 0 for rendezvous, {@link #UNLIMITED} for unbounded
     */
    public static <T> @NonNull Channel<T> of(int capacity) {
        return new Channel<>(capacity);
    }

    /**
     * Counterpart of a channel owned by the other side of a worker boundary, keeping its id.
     * Used by the runtime when decoding channel arguments.
     */
    public static <T> @NonNull Channel<T> proxy(long id, int capacity) {
        return new Channel<>(id, capacity);
    }
    // [/🧩 Section: construction]

    // 🧩 Section: consume

    /**
     * Consume values until the channel is closed and drained.
     *
     * @throws RuntimeException the close error, if the channel was closed with one
     */
    @Override
    public void forEach(@NonNull Consumer<? super T> action) {
        if (action == null) throw new IllegalArgumentException("Action cannot be null");
        int count = 0;
        for (T v : this) {
            count++;
            action.accept(v);
        }
        DIAG.debug("ch#{} forEach completed after {} items", id(), count);
    }
    // [/🧩 Section: consume]

    @Override
    public String toString() {
        return "Channel#" + id() + "(capacity=" + (capacity() == UNLIMITED ? "unlimited" : capacity())
                + (isClosed() ? ", closed" : "") + ")";
    }

    /**
     * Drain every remaining value into {@code sink}, stopping once closed.
     */
    public void drainTo(@NonNull Collection<? super T> sink) {
        for (T v : this) sink.add(v);
    }
}
