/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/ThreadContextSpawner.java
 description: Spawns in-process thread worker contexts.
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
import tech.robd.jparallel.pool.ContextListener;
import tech.robd.jparallel.pool.ContextSpawner;
import tech.robd.jparallel.pool.WorkerContext;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Spawns {@link ThreadWorkerContext}s resolving modules with a shared resolver.
 */
public final class ThreadContextSpawner implements ContextSpawner {
    private final AtomicLong ids = new AtomicLong();
    private final ModuleResolver resolver;

    public ThreadContextSpawner(@NonNull ModuleResolver resolver) {
        if (resolver == null) throw new IllegalArgumentException("Resolver cannot be null");
        this.resolver = resolver;
    }

    @Override
    public WorkerContext spawn(ContextListener listener) {
        return new ThreadWorkerContext(ids.incrementAndGet(), resolver, listener).start();
    }
}
