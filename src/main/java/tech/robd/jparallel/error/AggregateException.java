/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/error/AggregateException.java
 description: Error grouping several failures, serialized with its members.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Several errors reported as one. The nested errors survive encoding one by one.
 */
public class AggregateException extends ParallelException {

    private final List<Throwable> errors;

    public AggregateException(@Nullable String message, @NonNull List<? extends Throwable> errors) {
        this(message, errors, null);
    }

    public AggregateException(@Nullable String message,
                              @NonNull List<? extends Throwable> errors,
                              @Nullable Throwable cause) {
        super(message, cause);
        if (errors == null) throw new IllegalArgumentException("Errors cannot be null");
        this.errors = List.copyOf(errors);
    }

    public @NonNull List<Throwable> errors() {
        return errors;
    }
}
