/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/task/TaskIdSequence.java
 description: Wrapping task id allocator.
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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic task ids in {@code [1, ceiling]}, starting over at 1 after the ceiling.
 */
public final class TaskIdSequence {

    /**
     * Largest integer a double represents exactly, so ids survive any JSON reader.
     */
    public static final long DEFAULT_CEILING = (1L << 53) - 1;

    private final long ceiling;
    private final AtomicLong last;

    public TaskIdSequence() {
        this(DEFAULT_CEILING);
    }

    public TaskIdSequence(long ceiling) {
        this(ceiling, 0);
    }

    /**
     * @param ceiling largest id handed out
     * @param start   id preceding the first one
     */
    public TaskIdSequence(long ceiling, long start) {
        if (ceiling < 1) throw new IllegalArgumentException("Ceiling must be positive");
        if (start < 0 || start > ceiling) throw new IllegalArgumentException("Start must be within [0, ceiling]");
        this.ceiling = ceiling;
        this.last = new AtomicLong(start);
    }

    public long next() {
        return last.updateAndGet(v -> v >= ceiling ? 1 : v + 1);
    }

    public long ceiling() {
        return ceiling;
    }
}
