/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/internal/BaseChannel.java
 description: Channel core: buffering, rendezvous, close semantics and remote writer fan-out.
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
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.protocol.ChannelMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-based FIFO channel core shared by {@code Channel}.
 *
 * <ul>
 *   <li>Capacity 0 is a rendezvous: a value stays with its sender until a receiver takes it.</li>
 *   <li>Senders that find the buffer full wait in a FIFO queue of pending sends; a receive moves
 *       the oldest pending send into the freed slot.</li>
 *   <li>{@code null} payloads are stored as a sentinel.</li>
 *   <li>Close fails pending senders, lets receivers drain the buffer, then reports completion
 *       through {@link ClosedReceiveException}. A close error is thrown once, to the first
 *       receiver that finds the channel drained.</li>
 *   <li>Once {@link #attachWriter(ChannelWriter) writers} are attached the channel is shared with
 *       worker contexts: user sends and closes go to the writers, and values coming back are
 *       {@link #deliver(Object) delivered} into the local buffer.</li>
 * </ul>
 *
 * @param <T> element type
 */
public abstract class BaseChannel<T> implements Iterable<T> {
    private static final Diagnostics DIAG = Diagnostics.of(BaseChannel.class);

    /**
     * Capacity of an unbounded channel.
     */
    public static final int UNLIMITED = Integer.MAX_VALUE;

    private static final AtomicLong IDS = new AtomicLong();
    private static final Object NULL = new Object();

    // 🧩 Section: state
    private final long chId;
    private final int capacity;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final ArrayDeque<Object> buffer = new ArrayDeque<>();
    private final ArrayDeque<PendingSend> senders = new ArrayDeque<>();
    private int waitingReceivers;
    private boolean closed;
    private @Nullable Throwable closeError;

    private final List<ChannelWriter> writers = new CopyOnWriteArrayList<>();
    private final AtomicLong writeCounter = new AtomicLong();

    private static final class PendingSend {
        final Object value;
        final CompletableFuture<Void> accepted = new CompletableFuture<>();

        PendingSend(Object value) {
            this.value = value;
        }
    }
    // [/🧩 Section: state]

    protected BaseChannel(int capacity) {
        this(IDS.incrementAndGet(), capacity);
    }

    protected BaseChannel(long id, int capacity) {
        if (capacity < 0) throw new IllegalArgumentException("Capacity cannot be negative");
        this.chId = id;
        this.capacity = capacity;
    }

    // 🧩 Section: send

    /**
     * Send a value, blocking while the channel is full (or, for capacity 0, until a receiver
     * takes it).
     *
     * @throws IllegalStateException if the channel is closed, before or while waiting
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public void send(@Nullable T value) {
        if (!writers.isEmpty()) {
            forward(value);
            return;
        }
        PendingSend pending = offer(mask(value));
        if (pending == null) return;
        try {
            pending.accepted.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            withdraw(pending);
            DIAG.warn("ch#{} send interrupted", chId);
            throw new CancellationException("Interrupted while sending");
        } catch (ExecutionException ee) {
            throw unwrap(ee.getCause());
        }
    }

    /**
     * Queue a value without blocking the caller. The future completes once the value is in the
     * buffer (or taken by a receiver), and fails if the channel closes first.
     */
    public @NonNull CompletableFuture<Void> sendAsync(@Nullable T value) {
        if (!writers.isEmpty()) {
            try {
                forward(value);
                return CompletableFuture.completedFuture(null);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        try {
            PendingSend pending = offer(mask(value));
            return pending == null ? CompletableFuture.completedFuture(null) : pending.accepted;
        } catch (IllegalStateException closedEx) {
            return CompletableFuture.failedFuture(closedEx);
        }
    }

    /**
     * Send only if that needs no waiting.
     *
     * @return {@code false} if the channel is closed or full (for capacity 0: no receiver waiting)
     */
    public boolean trySend(@Nullable T value) {
        if (!writers.isEmpty()) {
            if (isClosed()) return false;
            forward(value);
            return true;
        }
        lock.lock();
        try {
            if (closed) return false;
            if (senders.isEmpty() && buffer.size() < capacity) {
                buffer.addLast(mask(value));
                available.signal();
                return true;
            }
            if (capacity == 0 && waitingReceivers > senders.size()) {
                PendingSend pending = new PendingSend(mask(value));
                senders.addLast(pending);
                available.signal();
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Put a value received from the other side of a shared channel into the local buffer,
     * bypassing the writers. Never blocks; values arriving after close are dropped.
     */
    public void deliver(@Nullable Object value) {
        try {
            offer(value == null ? NULL : value);
        } catch (IllegalStateException closedEx) {
            DIAG.debug("ch#{} deliver after close, value dropped", chId);
        }
    }

    private @Nullable PendingSend offer(Object masked) {
        lock.lock();
        try {
            if (closed) {
                DIAG.debug("ch#{} send rejected: closed", chId);
                throw new IllegalStateException("Channel is closed");
            }
            if (senders.isEmpty() && buffer.size() < capacity) {
                buffer.addLast(masked);
                available.signal();
                DIAG.debug("ch#{} send ok (buffered={})", chId, buffer.size());
                return null;
            }
            PendingSend pending = new PendingSend(masked);
            senders.addLast(pending);
            available.signal();
            DIAG.debug("ch#{} send pending (waiting senders={})", chId, senders.size());
            return pending;
        } finally {
            lock.unlock();
        }
    }

    private void withdraw(PendingSend pending) {
        lock.lock();
        try {
            senders.remove(pending);
        } finally {
            lock.unlock();
        }
    }

    private void forward(@Nullable T value) {
        if (isClosed()) throw new IllegalStateException("Channel is closed");
        List<ChannelWriter> snapshot = new ArrayList<>(writers);
        if (snapshot.isEmpty()) throw new IllegalStateException("Channel is closed");
        ChannelWriter w = snapshot.get((int) (writeCounter.getAndIncrement() % snapshot.size()));
        w.write(ChannelMessage.Op.PUSH, chId, value);
    }
    // [/🧩 Section: send]

    // 🧩 Section: receive

    /**
     * Receive the next value, blocking until one is available.
     *
     * @throws ClosedReceiveException once the channel is closed and drained
     * @throws CancellationException  if the calling thread is interrupted while waiting
     */
    public @Nullable T receive() {
        lock.lock();
        try {
            waitingReceivers++;
            try {
                for (; ; ) {
                    Object o = takeLocked();
                    if (o != null) return unmask(o);
                    if (closed) throw closedSignal();
                    available.await();
                }
            } finally {
                waitingReceivers--;
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            DIAG.warn("ch#{} recv interrupted", chId);
            throw new CancellationException("Interrupted while receiving");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Take a value if one is ready.
     *
     * @return the value, or {@code null} if nothing is buffered (a buffered {@code null}
     * payload reads the same)
     * @throws ClosedReceiveException if the channel is closed and drained
     */
    public @Nullable T tryReceive() {
        lock.lock();
        try {
            Object o = takeLocked();
            if (o != null) return unmask(o);
            if (closed) throw closedSignal();
            return null;
        } finally {
            lock.unlock();
        }
    }

    // buffer first, then a pending sender; refills freed slots in FIFO order
    private @Nullable Object takeLocked() {
        Object o = buffer.pollFirst();
        if (o == null) {
            PendingSend direct = senders.pollFirst();
            if (direct == null) return null;
            direct.accepted.complete(null);
            return direct.value;
        }
        while (!senders.isEmpty() && buffer.size() < capacity) {
            PendingSend next = senders.pollFirst();
            buffer.addLast(next.value);
            next.accepted.complete(null);
        }
        return o;
    }

    private RuntimeException closedSignal() {
        Throwable err = closeError;
        if (err != null) {
            closeError = null;
            DIAG.debug("ch#{} recv -> close error {}", chId, err.toString());
            return unwrap(err);
        }
        DIAG.debug("ch#{} recv -> CLOSED (drained)", chId);
        return new ClosedReceiveException();
    }
    // [/🧩 Section: receive]

    // 🧩 Section: iteration

    /**
     * Blocking iterator that ends when the channel is closed and drained. A close error is
     * thrown from {@code hasNext()}.
     */
    @Override
    public @NonNull Iterator<T> iterator() {
        return new Iterator<>() {
            private boolean ready;
            private boolean done;
            private @Nullable T next;

            @Override
            public boolean hasNext() {
                if (ready) return true;
                if (done) return false;
                try {
                    next = receive();
                    ready = true;
                } catch (ClosedReceiveException closedEx) {
                    done = true;
                }
                return ready;
            }

            @Override
            public T next() {
                if (!hasNext()) throw new NoSuchElementException("Channel closed");
                ready = false;
                T v = next;
                next = null;
                return v;
            }
        };
    }
    // [/🧩 Section: iteration]

    // 🧩 Section: sharing

    /**
     * Share this channel with another context. Later sends round-robin over all writers and a
     * close is forwarded to each of them.
     */
    public void attachWriter(@NonNull ChannelWriter writer) {
        if (writer == null) throw new IllegalArgumentException("Writer cannot be null");
        writers.add(writer);
        DIAG.debug("ch#{} writer attached (writers={})", chId, writers.size());
    }

    public boolean isShared() {
        return !writers.isEmpty();
    }

    /**
     * Apply a close that arrived from the other side.
     *
     * @param error        close error, may be {@code null}
     * @param redistribute forward the close to every attached writer (host side, when the
     *                     channel is shared with several contexts)
     */
    public void closeFromRemote(@Nullable Throwable error, boolean redistribute) {
        List<ChannelWriter> snapshot = new ArrayList<>(writers);
        writers.clear();
        if (redistribute && snapshot.size() > 1) {
            for (ChannelWriter w : snapshot) w.write(ChannelMessage.Op.CLOSE, chId, error);
        }
        closeLocally(error);
    }
    // [/🧩 Section: sharing]

    // 🧩 Section: lifecycle
    public long id() {
        return chId;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        close(null);
    }

    /**
     * Close the channel. Receivers drain what is buffered, then get {@code error} once (if
     * non-null) and completion afterwards. Pending senders fail with
     * {@link IllegalStateException}. Repeated closes are ignored.
     */
    public void close(@Nullable Throwable error) {
        List<ChannelWriter> snapshot = new ArrayList<>(writers);
        writers.clear();
        for (ChannelWriter w : snapshot) w.write(ChannelMessage.Op.CLOSE, chId, error);
        closeLocally(error);
    }

    /**
     * Close without notifying writers.
     */
    public boolean closeLocally(@Nullable Throwable error) {
        List<PendingSend> failed;
        lock.lock();
        try {
            if (closed) {
                DIAG.debug("ch#{} close() ignored (already closed)", chId);
                return false;
            }
            closed = true;
            closeError = error;
            failed = new ArrayList<>(senders);
            senders.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        for (PendingSend p : failed) {
            p.accepted.completeExceptionally(new IllegalStateException("Channel is closed"));
        }
        DIAG.debug("ch#{} closed (error={}, failed senders={})", chId, error != null, failed.size());
        return true;
    }

    /**
     * Thrown by receive operations once the channel is closed and drained.
     */
    public static class ClosedReceiveException extends RuntimeException {
        public ClosedReceiveException() {
            super("Channel closed");
        }
    }
    // [/🧩 Section: lifecycle]

    // 🧩 Section: helpers
    private static Object mask(@Nullable Object value) {
        return value == null ? NULL : value;
    }

    @SuppressWarnings("unchecked")
    private static <T> @Nullable T unmask(Object o) {
        return o == NULL ? null : (T) o;
    }

    private static RuntimeException unwrap(@Nullable Throwable cause) {
        if (cause instanceof RuntimeException re) return re;
        if (cause instanceof Error err) throw err;
        return new RuntimeException(cause);
    }
    // [/🧩 Section: helpers]
}
