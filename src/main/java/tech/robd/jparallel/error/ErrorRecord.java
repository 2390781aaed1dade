/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/error/ErrorRecord.java
 description: Serializable form of a throwable.
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
import java.util.List;
import java.util.Map;

/**
 * Transport-safe form of a {@link Throwable}: plain data only, so it can be copied between
 * threads or written as JSON.
 *
 * @param kind       registry tag used to pick the exception type on decode
 * @param name       error name as reported by the source side
 * @param message    detail message, may be {@code null}
 * @param stack      stack frames, outermost first
 * @param cause      encoded cause, if any
 * @param properties extra properties ({@link ParallelException#properties()})
 * @param errors     nested errors of an aggregate, or suppressed exceptions
 */
public record ErrorRecord(@NonNull String kind,
                          @NonNull String name,
                          @Nullable String message,
                          @NonNull List<StackFrameRecord> stack,
                          @Nullable ErrorRecord cause,
                          @NonNull Map<String, @Nullable Object> properties,
                          @NonNull List<ErrorRecord> errors) {

    public ErrorRecord {
        if (kind == null) throw new IllegalArgumentException("Kind cannot be null");
        if (name == null) name = kind;
        stack = stack == null ? List.of() : List.copyOf(stack);
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * One stack frame in data form. Loader and module fields are kept so a decoded frame
     * equals the original one.
     */
    public record StackFrameRecord(@Nullable String classLoaderName,
                                   @Nullable String moduleName,
                                   @Nullable String moduleVersion,
                                   @NonNull String declaringClass,
                                   @NonNull String methodName,
                                   @Nullable String fileName,
                                   int lineNumber) {

        static StackFrameRecord of(StackTraceElement e) {
            return new StackFrameRecord(e.getClassLoaderName(), e.getModuleName(), e.getModuleVersion(),
                    e.getClassName(), e.getMethodName(), e.getFileName(), e.getLineNumber());
        }

        StackTraceElement toElement() {
            return new StackTraceElement(classLoaderName, moduleName, moduleVersion,
                    declaringClass, methodName, fileName, lineNumber);
        }
    }
}
