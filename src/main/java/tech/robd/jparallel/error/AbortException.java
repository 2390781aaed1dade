/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/error/AbortException.java
 description: Error raised when a call is aborted.
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
 * Default rejection reason of an aborted call.
 */
public class AbortException extends ParallelException {

    public static final String NAME = "AbortError";

    public AbortException(@Nullable String message) {
        super(NAME, message, null);
    }

    public AbortException(@Nullable String message, @Nullable Throwable cause) {
        super(NAME, message, cause);
    }

    protected AbortException(String name, @Nullable String message) {
        super(name, message, null);
    }
}
