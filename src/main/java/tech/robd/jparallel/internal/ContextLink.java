/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/internal/ContextLink.java
 description: Message sink of one call, holding messages until the call is bound to a context.
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
import tech.robd.jparallel.pool.WorkerContext;
import tech.robd.jparallel.protocol.CallMessage;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.task.MessageSink;

import java.util.ArrayList;
import java.util.List;

/**
 * Outbound path of one call. Messages sent before the context is known (channel pushes made
 * right after dispatch, generator requests) are held back and flushed after the call message,
 * so nothing overtakes the call.
 */
public final class ContextLink implements MessageSink {
    private static final Diagnostics DIAG = Diagnostics.of(ContextLink.class);

    private final long taskId;
    private final List<ProtocolMessage> held = new ArrayList<>();
    private @Nullable WorkerContext context;
    private boolean cut;

    public ContextLink(long taskId) {
        this.taskId = taskId;
    }

    /**
     * Send {@code call} to {@code ctx}, then everything held back, in order.
     */
    public synchronized void bind(@NonNull WorkerContext ctx, @NonNull CallMessage call) {
        if (ctx == null || call == null) throw new IllegalArgumentException("Context and call cannot be null");
        if (cut) {
            DIAG.debug("task#{} link cut before bind, call not sent", taskId);
            return;
        }
        context = ctx;
        ctx.send(call);
        if (!held.isEmpty()) DIAG.debug("task#{} flushing {} held message(s)", taskId, held.size());
        for (ProtocolMessage m : held) ctx.send(m);
        held.clear();
    }

    @Override
    public synchronized void send(ProtocolMessage message) {
        if (cut) {
            DIAG.debug("task#{} link cut, dropping {}", taskId, message.type());
            return;
        }
        if (context == null) {
            held.add(message);
            return;
        }
        context.send(message);
    }

    /**
     * Stop forwarding; used once the context is gone.
     */
    public synchronized void cut() {
        cut = true;
        held.clear();
    }

    public synchronized boolean isBound() {
        return context != null;
    }
}
