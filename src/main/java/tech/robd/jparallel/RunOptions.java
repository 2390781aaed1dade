/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/RunOptions.java
 description: Per-call options: timeout and whether an exclusive context is kept for reuse.
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
package tech.robd.jparallel;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Duration;

/**
 * Options of an exclusive call.
 *
 * @param timeout   abort with an {@link tech.robd.jparallel.error.OperationTimeoutException} if the
 *                  call has not completed in time; {@code null} for no limit
 * @param keepAlive return the context to the pool after the call instead of terminating it
 */
public record RunOptions(@Nullable Duration timeout, boolean keepAlive) {

    private static final RunOptions NONE = new RunOptions(null, false);

    public RunOptions {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
    }

    public static @NonNull RunOptions none() {
        return NONE;
    }

    public static @NonNull RunOptions timeout(@NonNull Duration timeout) {
        if (timeout == null) throw new IllegalArgumentException("Timeout cannot be null");
        return new RunOptions(timeout, false);
    }

    /**
     * No timeout, context returned to the pool after the call.
     */
    public static @NonNull RunOptions reusingContext() {
        return new RunOptions(null, true);
    }

    public @NonNull RunOptions withTimeout(@Nullable Duration value) {
        return new RunOptions(value, keepAlive);
    }

    public @NonNull RunOptions withKeepAlive(boolean value) {
        return new RunOptions(timeout, value);
    }
}
