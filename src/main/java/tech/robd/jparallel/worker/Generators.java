/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/Generators.java
 description: Generator factories: from iterables and from thread-backed producer bodies.
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
package tech.robd.jparallel.worker;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.Step;
import tech.robd.jparallel.diagnostics.Diagnostics;

import java.util.Iterator;
import java.util.concurrent.CancellationException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Factories for worker-side {@link Generator}s.
 */
public final class Generators {
    private static final Diagnostics DIAG = Diagnostics.of(Generators.class);
    private static final AtomicLong IDS = new AtomicLong();

    /**
     * Passes values out of a {@link Body}. Returns the input of the next {@code next} call.
     */
    @FunctionalInterface
    public interface Emitter<T> {
        @Nullable Object emit(@Nullable T value) throws Exception;
    }

    /**
     * Generator code written as a plain method: emits values, then returns the final value.
     */
    @FunctionalInterface
    public interface Body<T> {
        @Nullable Object run(@NonNull Emitter<T> out) throws Exception;
    }

    private Generators() {
    }

    /**
     * Yield each element of {@code values}, then finish with {@code returnValue}.
     */
    public static <T> @NonNull Generator<T> of(@NonNull Iterable<? extends T> values, @Nullable Object returnValue) {
        if (values == null) throw new IllegalArgumentException("Values cannot be null");
        return new IteratorGenerator<>(values.iterator(), returnValue);
    }

    /**
     * Run {@code body} on its own daemon thread, suspended between emits until the host asks
     * for the next step.
     */
    public static <T> @NonNull Generator<T> produce(@NonNull Body<T> body) {
        if (body == null) throw new IllegalArgumentException("Body cannot be null");
        return new ProducedGenerator<>(body);
    }

    private static Exception asException(Throwable t) {
        if (t instanceof Error err) throw err;
        if (t instanceof Exception ex) return ex;
        return new RuntimeException(t);
    }

    @SuppressWarnings("unchecked")
    private static <T> Step<T> done(@Nullable Object value) {
        return Step.done((T) value);
    }

    // 🧩 Section: iterator-generator
    private static final class IteratorGenerator<T> implements Generator<T> {
        private final Iterator<? extends T> values;
        private final @Nullable Object returnValue;
        private boolean done;

        IteratorGenerator(Iterator<? extends T> values, @Nullable Object returnValue) {
            this.values = values;
            this.returnValue = returnValue;
        }

        @Override
        public synchronized Step<T> next(@Nullable Object input) {
            if (done) return Step.done(null);
            if (values.hasNext()) return Step.of(values.next());
            done = true;
            return done(returnValue);
        }

        @Override
        public synchronized Step<T> returnValue(@Nullable Object value) {
            done = true;
            return done(value);
        }

        @Override
        public synchronized Step<T> throwError(Throwable error) throws Exception {
            done = true;
            throw asException(error);
        }
    }
    // [/🧩 Section: iterator-generator]

    // 🧩 Section: produced-generator
    private static final class ProducedGenerator<T> implements Generator<T> {
        private enum Kind { NEXT, RETURN, THROW, YIELD, RETURNED, FAILED }

        private record Signal(Kind kind, @Nullable Object value) {
        }

        /** Unwinds the body for {@code returnValue}. */
        private static final class Returned extends Error {
            final @Nullable Object value;

            Returned(@Nullable Object value) {
                super(null, null, false, false);
                this.value = value;
            }
        }

        /** Unwinds the body when the generator is closed. */
        private static final class Closed extends Error {
            Closed() {
                super(null, null, false, false);
            }
        }

        private final long genId = IDS.incrementAndGet();
        private final Body<T> body;
        private final SynchronousQueue<Signal> toBody = new SynchronousQueue<>();
        private final SynchronousQueue<Signal> fromBody = new SynchronousQueue<>();
        private volatile @Nullable Thread thread;
        private volatile boolean closed;
        private boolean done;

        ProducedGenerator(Body<T> body) {
            this.body = body;
        }

        @Override
        public synchronized Step<T> next(@Nullable Object input) throws Exception {
            if (done) return Step.done(null);
            if (thread == null) start();
            else handOver(new Signal(Kind.NEXT, input));
            return await();
        }

        @Override
        public synchronized Step<T> returnValue(@Nullable Object value) throws Exception {
            if (done || thread == null) {
                done = true;
                return done(value);
            }
            handOver(new Signal(Kind.RETURN, value));
            return await();
        }

        @Override
        public synchronized Step<T> throwError(Throwable error) throws Exception {
            if (done || thread == null) {
                done = true;
                throw asException(error);
            }
            handOver(new Signal(Kind.THROW, error));
            return await();
        }

        @Override
        public void close() {
            closed = true;
            Thread t = thread;
            if (t != null && t.isAlive()) {
                DIAG.debug("gen#{} closed while suspended", genId);
                t.interrupt();
            }
        }

        private void start() {
            Thread t = new Thread(this::runBody, "jparallel-generator-" + genId);
            t.setDaemon(true);
            thread = t;
            t.start();
        }

        private void handOver(Signal signal) {
            try {
                toBody.put(signal);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while resuming generator");
            }
        }

        @SuppressWarnings("unchecked")
        private Step<T> await() throws Exception {
            Signal s;
            try {
                s = fromBody.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for generator");
            }
            switch (s.kind()) {
                case YIELD:
                    return Step.of((T) s.value());
                case RETURNED:
                    done = true;
                    return done(s.value());
                default:
                    done = true;
                    throw asException((Throwable) s.value());
            }
        }

        // runs on the generator thread
        private void runBody() {
            Signal last;
            try {
                last = new Signal(Kind.RETURNED, body.run(this::emit));
            } catch (Returned r) {
                last = new Signal(Kind.RETURNED, r.value);
            } catch (Closed c) {
                return;
            } catch (Throwable t) {
                if (closed) {
                    DIAG.debug("gen#{} body ended after close: {}", genId, t.toString());
                    return;
                }
                last = new Signal(Kind.FAILED, t);
            }
            try {
                fromBody.put(last);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                DIAG.debug("gen#{} final step dropped, generator closed", genId);
            }
        }

        private @Nullable Object emit(@Nullable T value) throws Exception {
            Signal resume;
            try {
                fromBody.put(new Signal(Kind.YIELD, value));
                resume = toBody.take();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new Closed();
            }
            switch (resume.kind()) {
                case RETURN:
                    throw new Returned(resume.value());
                case THROW:
                    throw asException((Throwable) resume.value());
                default:
                    return resume.value();
            }
        }
    }
    // [/🧩 Section: produced-generator]
}
