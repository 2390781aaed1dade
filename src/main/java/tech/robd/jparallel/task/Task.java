/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/task/Task.java
 description: Host-side state of one call: settlement, consumption mode and generator steps.
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
package tech.robd.jparallel.task;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.Channel;
import tech.robd.jparallel.Step;
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.error.ErrorCodec;
import tech.robd.jparallel.internal.Futures;
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

import java.util.ArrayList;
import java.util.concurrent.CompletableFuture;

/**
 * Host-side state of one remote call.
 *
 * <p>The task settles once: with the returned value, with the final value of a generator, or
 * with an error. How it is consumed is selected lazily and only once:</p>
 * <ul>
 *   <li>{@link Mode#RESULT}: a generator is driven to completion by the task itself, sending
 *       {@code next} after the acknowledgement and after every yield;</li>
 *   <li>{@link Mode#ITERATE}: yields are pushed into an unlimited output channel and the
 *       consumer sends the requests ({@link #request}).</li>
 * </ul>
 */
public final class Task {
    private static final Diagnostics DIAG = Diagnostics.of(Task.class);

    public enum Mode {
        UNSELECTED,
        RESULT,
        ITERATE
    }

    // 🧩 Section: state
    private final long id;
    private final String module;
    private final String fn;
    private final CompletableFuture<@Nullable Object> outcome = new CompletableFuture<>();
    private final CompletableFuture<Boolean> generator = new CompletableFuture<>();

    private Mode mode = Mode.UNSELECTED;
    private @Nullable Channel<Step<Object>> output;
    private @Nullable MessageSink sink;
    // [/🧩 Section: state]

    Task(long id, @NonNull String module, @NonNull String fn) {
        this.id = id;
        this.module = module;
        this.fn = fn;
    }

    public long id() {
        return id;
    }

    public @NonNull String module() {
        return module;
    }

    public @NonNull String fn() {
        return fn;
    }

    /**
     * Settles with the return value (or final generator value) or the error.
     */
    public @NonNull CompletableFuture<@Nullable Object> outcome() {
        return outcome;
    }

    /**
     * Completes with {@code true} on the generator acknowledgement, or {@code false} when the
     * task settles without one.
     */
    public @NonNull CompletableFuture<Boolean> generator() {
        return generator;
    }

    public boolean isSettled() {
        return outcome.isDone();
    }

    public synchronized @NonNull Mode mode() {
        return mode;
    }

    public synchronized void bindSink(@NonNull MessageSink sink) {
        if (sink == null) throw new IllegalArgumentException("Sink cannot be null");
        this.sink = sink;
    }

    // 🧩 Section: consumption

    /**
     * Select result mode. Repeated calls are allowed.
     *
     * @throws IllegalStateException if {@link #selectIterate()} was called
     */
    public void selectResult() {
        boolean drive;
        synchronized (this) {
            if (mode == Mode.ITERATE) throw new IllegalStateException("iterate() has been called");
            if (mode == Mode.RESULT) return;
            mode = Mode.RESULT;
            drive = generator.getNow(false) && !outcome.isDone();
        }
        DIAG.debug("task#{} result mode (drive generator={})", id, drive);
        if (drive) request(GeneratorRequest.Kind.NEXT, null);
    }

    /**
     * Select iterate mode.
     *
     * @return the channel receiving generator steps
     * @throws IllegalStateException if {@link #selectResult()} was called, or the task already
     *                               settled with a plain value
     */
    public synchronized @NonNull Channel<Step<Object>> selectIterate() {
        if (mode == Mode.RESULT) throw new IllegalStateException("result() has been called");
        if (outcome.isDone() && !outcome.isCompletedExceptionally() && !generator.getNow(false)) {
            throw new IllegalStateException("the response is not iterable");
        }
        mode = Mode.ITERATE;
        DIAG.debug("task#{} iterate mode", id);
        return outputLocked();
    }

    private Channel<Step<Object>> outputLocked() {
        if (output == null) {
            output = Channel.unlimited();
            if (outcome.isDone()) output.closeLocally(Futures.failure(outcome));
        }
        return output;
    }

    /**
     * Forward a generator request to the context.
     */
    public void request(GeneratorRequest.@NonNull Kind kind, @Nullable Object value) {
        MessageSink s;
        synchronized (this) {
            s = sink;
        }
        if (s == null) throw new IllegalStateException("task#" + id + " is not dispatched");
        Object encoded = WireValues.encode(value, WireValues.NO_CHANNELS, new ArrayList<>());
        s.send(new GeneratorRequest(id, kind, encoded));
    }
    // [/🧩 Section: consumption]

    // 🧩 Section: settle

    public boolean settle(@Nullable Object value) {
        if (!outcome.complete(value)) return false;
        generator.complete(false);
        closeOutput(null);
        DIAG.debug("task#{} settled", id);
        return true;
    }

    public boolean fail(@NonNull Throwable error) {
        if (!outcome.completeExceptionally(error)) return false;
        generator.complete(false);
        closeOutput(error);
        DIAG.debug("task#{} failed: {}", id, error.toString());
        return true;
    }

    private void closeOutput(@Nullable Throwable error) {
        Channel<Step<Object>> out;
        synchronized (this) {
            out = output;
        }
        if (out != null) out.closeLocally(error);
    }
    // [/🧩 Section: settle]

    // 🧩 Section: inbound

    /**
     * Apply a message addressed to this task. Messages arriving after settlement are dropped.
     */
    public void handle(@NonNull ProtocolMessage message) {
        message.accept(inbound);
    }

    private final MessageVisitor<Void> inbound = new MessageVisitor<>() {
        @Override
        public Void visitGeneratorAck(GeneratorAck m) {
            boolean drive;
            synchronized (Task.this) {
                generator.complete(true);
                drive = mode == Mode.RESULT;
            }
            DIAG.debug("task#{} generator acknowledged", id);
            if (drive) request(GeneratorRequest.Kind.NEXT, null);
            return null;
        }

        @Override
        public Void visitYield(YieldMessage m) {
            Object value = WireValues.decode(m.value(), WireValues.NO_CHANNEL_REFS);
            Channel<Step<Object>> out;
            synchronized (Task.this) {
                out = mode == Mode.RESULT ? null : outputLocked();
            }
            if (m.done()) {
                if (out != null) out.deliver(Step.done(value));
                settle(value);
            } else if (out != null) {
                out.deliver(Step.of(value));
            } else {
                request(GeneratorRequest.Kind.NEXT, null);
            }
            return null;
        }

        @Override
        public Void visitReturn(ReturnMessage m) {
            settle(WireValues.decode(m.value(), WireValues.NO_CHANNEL_REFS));
            return null;
        }

        @Override
        public Void visitError(ErrorMessage m) {
            fail(ErrorCodec.fromObject(m.error()));
            return null;
        }

        @Override
        public Void visitReady(Ready m) {
            return ignored(m);
        }

        @Override
        public Void visitCall(CallMessage m) {
            return ignored(m);
        }

        @Override
        public Void visitGeneratorRequest(GeneratorRequest m) {
            return ignored(m);
        }

        @Override
        public Void visitChannel(ChannelMessage m) {
            return ignored(m);
        }

        private Void ignored(ProtocolMessage m) {
            DIAG.warn("task#{} ignoring unexpected {} message", id, m.type());
            return null;
        }
    };
    // [/🧩 Section: inbound]

    @Override
    public String toString() {
        return "Task#" + id + "(" + module + "." + fn + ")";
    }
}
