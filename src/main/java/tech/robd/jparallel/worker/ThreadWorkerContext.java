/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/ThreadWorkerContext.java
 description: Worker context running in host threads with a single-threaded inbox.
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
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.pool.ContextListener;
import tech.robd.jparallel.pool.WorkerContext;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.protocol.Ready;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Worker context made of threads in the host JVM: an inbox thread feeding a
 * {@link WorkerRuntime}, a cached pool running the calls, and a delivery thread handing the
 * replies to the listener in the order they were produced.
 */
public final class ThreadWorkerContext implements WorkerContext {
    private static final Diagnostics DIAG = Diagnostics.of(ThreadWorkerContext.class);

    private record Exit(int code) {
    }

    private record Fault(Throwable error) {
    }

    // 🧩 Section: state
    private final long ctxId;
    private final ContextListener listener;
    private final LinkedBlockingQueue<ProtocolMessage> inbox = new LinkedBlockingQueue<>();
    private final LinkedBlockingQueue<Object> outbox = new LinkedBlockingQueue<>();
    private final ExecutorService calls;
    private final WorkerRuntime runtime;
    private final Thread inboxThread;
    private final Thread deliveryThread;
    private final AtomicBoolean stopped = new AtomicBoolean();
    // [/🧩 Section: state]

    public ThreadWorkerContext(long ctxId, @NonNull ModuleResolver resolver, @NonNull ContextListener listener) {
        if (resolver == null || listener == null) throw new IllegalArgumentException("Resolver and listener cannot be null");
        this.ctxId = ctxId;
        this.listener = listener;
        this.calls = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "jparallel-worker-" + ctxId + "-call");
            t.setDaemon(true);
            return t;
        });
        this.runtime = new WorkerRuntime(resolver, this::post, calls, code -> outbox.add(new Exit(code)));
        this.inboxThread = new Thread(this::inboxLoop, "jparallel-worker-" + ctxId + "-inbox");
        this.deliveryThread = new Thread(this::deliveryLoop, "jparallel-worker-" + ctxId + "-delivery");
        inboxThread.setDaemon(true);
        deliveryThread.setDaemon(true);
    }

    /**
     * Start the threads. The first message delivered is {@code ready}.
     */
    public @NonNull ThreadWorkerContext start() {
        outbox.add(new Ready());
        inboxThread.start();
        deliveryThread.start();
        DIAG.debug("ctx#{} started", ctxId);
        return this;
    }

    // 🧩 Section: loops
    private void inboxLoop() {
        try {
            while (!stopped.get()) {
                ProtocolMessage m = inbox.take();
                try {
                    runtime.accept(m);
                } catch (RuntimeException e) {
                    DIAG.warn("ctx#{} failed handling {}", ctxId, m.type(), e);
                    outbox.add(new Fault(e));
                    return;
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            DIAG.debug("ctx#{} inbox stopped", ctxId);
        }
    }

    private void deliveryLoop() {
        try {
            while (!stopped.get()) {
                Object o = outbox.take();
                if (o instanceof Exit exit) {
                    stop();
                    listener.onExit(exit.code());
                    return;
                }
                if (o instanceof Fault fault) {
                    stop();
                    listener.onError(fault.error());
                    return;
                }
                if (stopped.get()) return;
                try {
                    listener.onMessage((ProtocolMessage) o);
                } catch (RuntimeException e) {
                    DIAG.warn("ctx#{} listener failed on {}", ctxId, ((ProtocolMessage) o).type(), e);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            DIAG.debug("ctx#{} delivery stopped", ctxId);
        }
    }
    // [/🧩 Section: loops]

    private void post(ProtocolMessage message) {
        if (!stopped.get()) outbox.add(message);
    }

    @Override
    public void send(ProtocolMessage message) {
        if (stopped.get()) {
            DIAG.debug("ctx#{} terminated, dropping {}", ctxId, message.type());
            return;
        }
        inbox.add(message);
    }

    @Override
    public void terminate() {
        if (!stop()) return;
        DIAG.debug("ctx#{} terminated", ctxId);
        if (Thread.currentThread() != deliveryThread) deliveryThread.interrupt();
        else outbox.clear();
    }

    private boolean stop() {
        if (!stopped.compareAndSet(false, true)) return false;
        inboxThread.interrupt();
        calls.shutdownNow();
        runtime.shutdown();
        return true;
    }

    @Override
    public String describe() {
        return "thread context ctx#" + ctxId;
    }
}
