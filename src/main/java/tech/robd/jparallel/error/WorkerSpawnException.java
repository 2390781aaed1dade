/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/error/WorkerSpawnException.java
 description: Error raised when a worker context cannot be started.
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
package tech.robd.jparallel.error;

import org.jspecify.annotations.Nullable;

/**
 * A worker context could not be started, or failed before it reported ready.
 */
public class WorkerSpawnException extends ParallelException {

    public WorkerSpawnException(@Nullable String message) {
        super(message);
    }

    public WorkerSpawnException(@Nullable String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
