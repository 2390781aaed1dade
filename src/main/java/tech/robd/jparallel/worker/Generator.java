/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/Generator.java
 description: Worker-side generator driven one step at a time.
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

import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.Step;

/**
 * Worker-side generator returned by a {@link RemoteFunction}. The host drives it one step at a
 * time; each method returns the next yielded value, or the final value with {@code done} set.
 *
 * @param <T> element type
 * @see Generators
 */
public interface Generator<T> extends AutoCloseable {

    /**
     * Resume with {@code input} as the value of the pending yield. The first call starts the
     * generator and ignores its input.
     */
    Step<T> next(@Nullable Object input) throws Exception;

    /**
     * Finish early with {@code value}.
     */
    Step<T> returnValue(@Nullable Object value) throws Exception;

    /**
     * Raise {@code error} at the pending yield. Throws it if the generator does not handle it.
     */
    Step<T> throwError(Throwable error) throws Exception;

    /**
     * Release resources of an unfinished generator.
     */
    @Override
    default void close() {
    }
}
