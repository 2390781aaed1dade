/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/internal/CancellationTokenImpl.java
 description: Callback-driven cancellation token with weakly held children.
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
import tech.robd.jparallel.CancellationToken;
import tech.robd.jparallel.diagnostics.Diagnostics;

import java.lang.ref.WeakReference;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Callback-driven {@link CancellationToken}. Children are held weakly and unhook themselves from
 * the parent when {@linkplain #markCompleted() completed}, so a long-lived runtime token does
 * not retain finished calls.
 */
public final class CancellationTokenImpl implements CancellationToken {
    private static final Diagnostics DIAG = Diagnostics.of(CancellationTokenImpl.class);

    // 🧩 Section: state
    private final int tokId = System.identityHashCode(this);
    private final AtomicReference<@Nullable Throwable> reason = new AtomicReference<>();
    private final ConcurrentLinkedQueue<CallbackWrapper> callbacks = new ConcurrentLinkedQueue<>();
    private volatile @Nullable AutoCloseable parentHook;
    // [/🧩 Section: state]

    // 🧩 Section: callback-wrapper
    private static final class CallbackWrapper {
        private final AtomicReference<@Nullable Consumer<Throwable>> callbackRef;

        CallbackWrapper(Consumer<Throwable> callback) {
            this.callbackRef = new AtomicReference<>(callback);
        }

        void execute(Throwable why) {
            Consumer<Throwable> callback = callbackRef.getAndSet(null);
            if (callback != null) callback.accept(why);
        }

        void clear() {
            callbackRef.set(null);
        }
    }
    // [/🧩 Section: callback-wrapper]

    // 🧩 Section: query
    @Override
    public boolean isCancelled() {
        return reason.get() != null;
    }

    @Override
    public @Nullable Throwable reason() {
        return reason.get();
    }
    // [/🧩 Section: query]

    // 🧩 Section: registration
    @Override
    public @NonNull AutoCloseable onCancel(@NonNull Consumer<Throwable> callback) {
        if (callback == null) throw new IllegalArgumentException("Callback cannot be null");
        CallbackWrapper wrapper = new CallbackWrapper(callback);

        Throwable why = reason.get();
        if (why != null) {
            DIAG.debug("tok#{} onCancel: already cancelled -> run immediately", tokId);
            safeExecute(wrapper, why);
            return () -> {
            };
        }

        callbacks.offer(wrapper);

        why = reason.get();
        if (why != null && callbacks.remove(wrapper)) {
            DIAG.debug("tok#{} onCancel: race -> run after registration", tokId);
            safeExecute(wrapper, why);
        }

        return () -> {
            if (callbacks.remove(wrapper)) wrapper.clear();
        };
    }
    // [/🧩 Section: registration]

    // 🧩 Section: child
    @Override
    public @NonNull CancellationToken child() {
        CancellationTokenImpl child = new CancellationTokenImpl();
        WeakReference<CancellationTokenImpl> childRef = new WeakReference<>(child);
        child.parentHook = onCancel(why -> {
            CancellationTokenImpl c = childRef.get();
            if (c != null) {
                DIAG.debug("tok#{} cascading cancel to child tok#{}", tokId, c.tokId);
                c.cancel(why);
            }
        });
        DIAG.debug("tok#{} child created tok#{}", tokId, child.tokId);
        return child;
    }
    // [/🧩 Section: child]

    // 🧩 Section: cancel
    @Override
    public boolean cancel(@NonNull Throwable why) {
        if (why == null) throw new IllegalArgumentException("Reason cannot be null");
        if (!reason.compareAndSet(null, why)) {
            DIAG.debug("tok#{} cancel: already cancelled", tokId);
            return false;
        }
        DIAG.debug("tok#{} cancel: firing callbacks={} reason={}", tokId, callbacks.size(), why.toString());

        CallbackWrapper wrapper;
        while ((wrapper = callbacks.poll()) != null) {
            safeExecute(wrapper, why);
        }
        markCompleted();
        return true;
    }

    /**
     * Drop every registered callback and unhook from the parent. Called when the owning
     * operation settles without cancellation.
     */
    public void markCompleted() {
        AutoCloseable hook = parentHook;
        parentHook = null;
        if (hook != null) {
            try {
                hook.close();
            } catch (Exception e) {
                DIAG.debug("tok#{} error closing parent hook: {}", tokId, e.toString());
            }
        }
        CallbackWrapper wrapper;
        while ((wrapper = callbacks.poll()) != null) {
            wrapper.clear();
        }
    }
    // [/🧩 Section: cancel]

    private void safeExecute(CallbackWrapper wrapper, Throwable why) {
        try {
            wrapper.execute(why);
        } catch (RuntimeException e) {
            DIAG.warn("tok#{} cancel callback failed", tokId, e);
        }
    }
}
