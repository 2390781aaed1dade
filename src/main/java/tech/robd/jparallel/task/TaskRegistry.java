/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/task/TaskRegistry.java
 description: Registry of in-flight tasks and routing of replies to them.
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
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.protocol.TaskMessage;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-flight tasks by id. A task leaves the registry when it settles.
 */
public final class TaskRegistry {
    private static final Diagnostics DIAG = Diagnostics.of(TaskRegistry.class);

    private final TaskIdSequence ids;
    private final ConcurrentMap<Long, Task> tasks = new ConcurrentHashMap<>();

    public TaskRegistry() {
        this(new TaskIdSequence());
    }

    public TaskRegistry(@NonNull TaskIdSequence ids) {
        if (ids == null) throw new IllegalArgumentException("Id sequence cannot be null");
        this.ids = ids;
    }

    /**
     * Allocate an id and register a pending task under it.
     *
     * @throws IllegalStateException if the id sequence wrapped around onto a task still in flight
     */
    public @NonNull Task register(@NonNull String module, @NonNull String fn) {
        if (module == null || fn == null) throw new IllegalArgumentException("Module and fn cannot be null");
        long id = ids.next();
        Task task = new Task(id, module, fn);
        Task previous = tasks.putIfAbsent(id, task);
        if (previous != null) {
            DIAG.error("task id {} wrapped onto in-flight {}", id, previous);
            throw new IllegalStateException("Task id " + id + " is still in flight (" + previous + ")");
        }
        task.outcome().whenComplete((v, e) -> tasks.remove(id, task));
        DIAG.debug("task#{} registered {}.{}", id, module, fn);
        return task;
    }

    public @NonNull Optional<Task> get(long id) {
        return Optional.ofNullable(tasks.get(id));
    }

    /**
     * Deliver a message to its task.
     *
     * @return {@code false} if no task with that id is in flight
     */
    public <M extends ProtocolMessage & TaskMessage> boolean route(@NonNull M message) {
        Task task = tasks.get(message.taskId());
        if (task == null) {
            DIAG.debug("dropping {} for unknown task#{}", message.type(), message.taskId());
            return false;
        }
        task.handle(message);
        return true;
    }

    public int size() {
        return tasks.size();
    }
}
