/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/WorkerRuntime.java
 description: Worker-side dispatcher: runs calls, drives generators and relays channel traffic.
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
import tech.robd.jparallel.error.ErrorCodec;
import tech.robd.jparallel.error.ParallelException;
import tech.robd.jparallel.internal.ChannelHub;
import tech.robd.jparallel.protocol.CallMessage;
import tech.robd.jparallel.protocol.ChannelMessage;
import tech.robd.jparallel.protocol.ErrorMessage;
import tech.robd.jparallel.protocol.GeneratorAck;
import tech.robd.jparallel.protocol.GeneratorRequest;
import tech.robd.jparallel.protocol.MessageVisitor;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.protocol.Ready;
import tech.robd.jparallel.protocol.ReturnMessage;
import tech.robd.jparallel.protocol.WireValues;
import tech.robd.jparallel.protocol.YieldMessage;
import tech.robd.jparallel.task.MessageSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.IntConsumer;

/**
 * Context side of the dispatch protocol: runs calls on an executor, keeps the generators they
 * return and answers generator requests and channel operations.
 *
 * <p>Replies to a call:</p>
 * <ul>
 *   <li>a {@link Generator} result is kept and acknowledged with {@code gen};</li>
 *   <li>a {@link CompletionStage} result is answered with {@code return} or {@code error} once it
 *       completes;</li>
 *   <li>any other result is answered with {@code return};</li>
 *   <li>a thrown exception is answered with {@code error}.</li>
 * </ul>
 */
public final class WorkerRuntime implements MessageVisitor<Void> {
    private static final Diagnostics DIAG = Diagnostics.of(WorkerRuntime.class);
    private static final ThreadLocal<WorkerRuntime> CURRENT = new ThreadLocal<>();

    // 🧩 Section: state
    private final ModuleResolver resolver;
    private final MessageSink toHost;
    private final ExecutorService executor;
    private final IntConsumer exitHook;
    private final ChannelHub channels = new ChannelHub(false);
    private final ConcurrentMap<Long, Generator<?>> generators = new ConcurrentHashMap<>();
    // [/🧩 Section: state]

    /**
     * @param exitHook ends the context with an exit code (see {@link #exitContext(int)})
     */
    public WorkerRuntime(@NonNull ModuleResolver resolver,
                         @NonNull MessageSink toHost,
                         @NonNull ExecutorService executor,
                         @NonNull IntConsumer exitHook) {
        if (resolver == null || toHost == null) throw new IllegalArgumentException("Resolver and sink cannot be null");
        if (executor == null || exitHook == null) throw new IllegalArgumentException("Executor and exit hook cannot be null");
        this.resolver = resolver;
        this.toHost = toHost;
        this.executor = executor;
        this.exitHook = exitHook;
    }

    // 🧩 Section: context-access

    /**
     * @return the runtime of the worker context the calling thread runs a function for
     */
    public static @NonNull Optional<WorkerRuntime> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * End the worker context the calling function runs in.
     *
     * @throws IllegalStateException outside a worker context
     */
    public static void exitContext(int code) {
        WorkerRuntime rt = CURRENT.get();
        if (rt == null) throw new IllegalStateException("Not running inside a worker context");
        DIAG.debug("context exit requested with code {}", code);
        rt.exitHook.accept(code);
    }

    public @NonNull ModuleResolver resolver() {
        return resolver;
    }

    public @NonNull ExecutorService executor() {
        return executor;
    }
    // [/🧩 Section: context-access]

    public void accept(@NonNull ProtocolMessage message) {
        message.accept(this);
    }

    // 🧩 Section: calls
    /**
     * Arguments are decoded on the calling (inbox) thread, so channel messages that follow the
     * call find their channel registered; the function itself runs on the executor.
     */
    @Override
    public Void visitCall(CallMessage m) {
        List<@Nullable Object> args;
        try {
            args = WireValues.decodeArgs(m.args(), ref -> channels.resolve(ref, toHost));
        } catch (RuntimeException e) {
            fail(m.taskId(), e);
            return null;
        }
        executor.execute(() -> runCall(m, args));
        return null;
    }

    private void runCall(CallMessage m, List<@Nullable Object> args) {
        CURRENT.set(this);
        try {
            RemoteFunction fn = resolver.function(m.module(), m.fn());
            DIAG.debug("task#{} running {}.{}", m.taskId(), m.module(), m.fn());
            reply(m.taskId(), fn.invoke(args));
        } catch (Exception e) {
            fail(m.taskId(), e);
        } catch (Error err) {
            fail(m.taskId(), err);
            throw err;
        } finally {
            CURRENT.remove();
        }
    }

    private void reply(long taskId, @Nullable Object result) {
        if (result instanceof Generator<?> g) {
            generators.put(taskId, g);
            toHost.send(new GeneratorAck(taskId));
        } else if (result instanceof CompletionStage<?> stage) {
            stage.whenComplete((v, e) -> {
                if (e != null) fail(taskId, unwrap(e));
                else reply(taskId, v);
            });
        } else {
            try {
                toHost.send(new ReturnMessage(taskId, encode(result)));
            } catch (ParallelException cloneFailure) {
                fail(taskId, cloneFailure);
            }
        }
    }

    private void fail(long taskId, Throwable error) {
        DIAG.debug("task#{} failed: {}", taskId, error.toString());
        toHost.send(new ErrorMessage(taskId, ErrorCodec.toObject(error)));
    }

    private static Throwable unwrap(Throwable e) {
        if ((e instanceof CompletionException || e instanceof ExecutionException) && e.getCause() != null) {
            return e.getCause();
        }
        return e;
    }

    private static @Nullable Object encode(@Nullable Object value) {
        return WireValues.encode(value, WireValues.NO_CHANNELS, new ArrayList<>());
    }
    // [/🧩 Section: calls]

    // 🧩 Section: generators
    @Override
    public Void visitGeneratorRequest(GeneratorRequest m) {
        executor.execute(() -> step(m));
        return null;
    }

    private void step(GeneratorRequest m) {
        Generator<?> g = generators.get(m.taskId());
        if (g == null) {
            fail(m.taskId(), new IllegalStateException("task#" + m.taskId() + " has no running generator"));
            return;
        }
        CURRENT.set(this);
        try {
            Step<?> step;
            synchronized (g) {
                Object input = WireValues.decode(m.value(), WireValues.NO_CHANNEL_REFS);
                switch (m.kind()) {
                    case RETURN:
                        step = g.returnValue(input);
                        break;
                    case THROW:
                        step = g.throwError(input instanceof Throwable t ? t : new ParallelException(String.valueOf(input)));
                        break;
                    default:
                        step = g.next(input);
                        break;
                }
            }
            if (step.done()) generators.remove(m.taskId(), g);
            toHost.send(new YieldMessage(m.taskId(), encode(step.value()), step.done()));
        } catch (Exception e) {
            generators.remove(m.taskId(), g);
            fail(m.taskId(), e);
        } finally {
            CURRENT.remove();
        }
    }
    // [/🧩 Section: generators]

    @Override
    public Void visitChannel(ChannelMessage m) {
        channels.handle(m);
        return null;
    }

    // 🧩 Section: unexpected
    @Override
    public Void visitReady(Ready m) {
        return unexpected(m);
    }

    @Override
    public Void visitReturn(ReturnMessage m) {
        return unexpected(m);
    }

    @Override
    public Void visitYield(YieldMessage m) {
        return unexpected(m);
    }

    @Override
    public Void visitError(ErrorMessage m) {
        return unexpected(m);
    }

    @Override
    public Void visitGeneratorAck(GeneratorAck m) {
        return unexpected(m);
    }

    private Void unexpected(ProtocolMessage m) {
        DIAG.warn("worker ignoring {} message sent to it", m.type());
        return null;
    }
    // [/🧩 Section: unexpected]

    /**
     * Close every generator that has not finished.
     */
    public void shutdown() {
        int open = generators.size();
        for (Generator<?> g : generators.values()) g.close();
        generators.clear();
        if (open > 0) DIAG.debug("closed {} unfinished generator(s)", open);
    }
}
