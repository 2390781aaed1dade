/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/Step.java
 description: One generator step: a value plus the done flag.
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

import org.jspecify.annotations.Nullable;

/**
 * One step of a generator: a yielded value, or the return value once {@code done}.
 *
 * @param value yielded or returned value
 * @param done  {@code true} for the final step
 * @param <T>   value type
 */
public record Step<T>(@Nullable T value, boolean done) {

    public static <T> Step<T> of(@Nullable T value) {
        return new Step<>(value, false);
    }

    public static <T> Step<T> done(@Nullable T value) {
        return new Step<>(value, true);
    }
}
