/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/tools/FakeContextSpawner.java
 description: Scriptable fake worker contexts for pool tests.
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
package tech.robd.jparallel.tools;

import tech.robd.jparallel.pool.ContextListener;
import tech.robd.jparallel.pool.ContextSpawner;
import tech.robd.jparallel.pool.WorkerContext;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.protocol.Ready;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Spawner of scripted contexts for pool tests. Nothing runs on its own: the test decides when a
 * context reports ready, replies or exits.
 */
public final class FakeContextSpawner implements ContextSpawner {

    private final List<FakeContext> spawned = new CopyOnWriteArrayList<>();
    private volatile boolean readyOnSpawn;
    private volatile RuntimeException failure;

    /**
     * Contexts report ready as soon as they are spawned.
     */
    public FakeContextSpawner readyOnSpawn() {
        this.readyOnSpawn = true;
        return this;
    }

    /**
     * Make every following spawn throw {@code error}; {@code null} restores normal spawning.
     */
    public FakeContextSpawner failWith(RuntimeException error) {
        this.failure = error;
        return this;
    }

    @Override
    public WorkerContext spawn(ContextListener listener) {
        RuntimeException f = failure;
        if (f != null) throw f;
        FakeContext ctx = new FakeContext(spawned.size() + 1, listener);
        spawned.add(ctx);
        if (readyOnSpawn) ctx.ready();
        return ctx;
    }

    public List<FakeContext> spawned() {
        return spawned;
    }

    public FakeContext get(int index) {
        return spawned.get(index);
    }

    /**
     * One scripted context. Events are delivered on the calling thread.
     */
    public static final class FakeContext implements WorkerContext {
        private final int index;
        private final ContextListener listener;
        private final List<ProtocolMessage> received = new CopyOnWriteArrayList<>();
        private final AtomicBoolean terminated = new AtomicBoolean();

        FakeContext(int index, ContextListener listener) {
            this.index = index;
            this.listener = listener;
        }

        @Override
        public void send(ProtocolMessage message) {
            if (!terminated.get()) received.add(message);
        }

        @Override
        public void terminate() {
            terminated.set(true);
        }

        @Override
        public String describe() {
            return "fake context #" + index;
        }

        public void ready() {
            listener.onMessage(new Ready());
        }

        public void reply(ProtocolMessage message) {
            listener.onMessage(message);
        }

        public void exit(int code) {
            listener.onExit(code);
        }

        public void fail(Throwable error) {
            listener.onError(error);
        }

        public List<ProtocolMessage> received() {
            return received;
        }

        public boolean isTerminated() {
            return terminated.get();
        }
    }
}
