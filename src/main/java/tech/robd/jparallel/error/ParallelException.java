/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/error/ParallelException.java
 description: Base runtime exception with a name, code and extra properties.
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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the library, and the generic kind every unknown error record
 * decodes to.
 *
 * <p>Besides message and cause it carries a {@linkplain #name() name} (the error's kind as the
 * remote side saw it) and a property map that travels across the worker boundary. The integer
 * {@linkplain #code() code} is stored as the {@code "code"} property.</p>
 */
public class ParallelException extends RuntimeException {

    private final Map<String, @Nullable Object> properties = new LinkedHashMap<>();
    private @NonNull String name;

    public ParallelException(@Nullable String message) {
        this(null, message, null);
    }

    public ParallelException(@Nullable String message, @Nullable Throwable cause) {
        this(null, message, cause);
    }

    /**
     * @param name    error name; {@code null} selects the simple class name
     * @param message detail message
     * @param cause   optional cause
     */
    public ParallelException(@Nullable String name, @Nullable String message, @Nullable Throwable cause) {
        super(message, cause);
        this.name = name != null ? name : getClass().getSimpleName();
    }

    // 🧩 Section: name-and-code
    public @NonNull String name() {
        return name;
    }

    void rename(@NonNull String name) {
        this.name = name;
    }

    /**
     * @return the {@code "code"} property as an int, or 0 when absent
     */
    public int code() {
        Object c = properties.get("code");
        return c instanceof Number n ? n.intValue() : 0;
    }

    public ParallelException withCode(int code) {
        properties.put("code", code);
        return this;
    }
    // [/🧩 Section: name-and-code]

    // 🧩 Section: properties

    /**
     * @return read-only view of the properties carried with this error
     */
    public @NonNull Map<String, @Nullable Object> properties() {
        return Collections.unmodifiableMap(properties);
    }

    public ParallelException withProperty(@NonNull String key, @Nullable Object value) {
        if (key == null) throw new IllegalArgumentException("Property key cannot be null");
        properties.put(key, value);
        return this;
    }

    void putProperties(@NonNull Map<String, @Nullable Object> values) {
        properties.putAll(values);
    }
    // [/🧩 Section: properties]

    @Override
    public String toString() {
        String msg = getLocalizedMessage();
        return msg != null ? name + ": " + msg : name;
    }
}
