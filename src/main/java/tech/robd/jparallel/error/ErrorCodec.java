/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/error/ErrorCodec.java
 description: Converts throwables to serializable error records and back, preserving causes and properties.
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
import tech.robd.jparallel.diagnostics.Diagnostics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts throwables to {@link ErrorRecord}s and back.
 *
 * <p>Encoding keeps the kind tag, name, message, stack, the cause chain, the properties of a
 * {@link ParallelException} and the nested errors of an {@link AggregateException} (or the
 * suppressed exceptions of any other throwable). Decoding picks the exception type from
 * {@link ErrorKinds} and falls back to {@link ParallelException}, keeping the original name and
 * message.</p>
 */
public final class ErrorCodec {
    private static final Diagnostics DIAG = Diagnostics.of(ErrorCodec.class);

    private ErrorCodec() {
    }

    // 🧩 Section: encode

    public static @NonNull ErrorRecord toObject(@NonNull Throwable error) {
        if (error == null) throw new IllegalArgumentException("Error cannot be null");
        return encode(error, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static ErrorRecord encode(Throwable error, Set<Throwable> seen) {
        seen.add(error);

        List<ErrorRecord.StackFrameRecord> stack = new ArrayList<>();
        for (StackTraceElement e : error.getStackTrace()) {
            stack.add(ErrorRecord.StackFrameRecord.of(e));
        }

        Throwable cause = error.getCause();
        ErrorRecord encodedCause = cause != null && !seen.contains(cause) ? encode(cause, seen) : null;

        Map<String, @Nullable Object> properties = new LinkedHashMap<>();
        String name;
        if (error instanceof ParallelException pe) {
            name = pe.name();
            pe.properties().forEach((k, v) -> properties.put(k, plain(v)));
        } else {
            name = error.getClass().getSimpleName().isEmpty()
                    ? error.getClass().getName()
                    : error.getClass().getSimpleName();
        }

        List<ErrorRecord> nested = new ArrayList<>();
        Collection<? extends Throwable> children = error instanceof AggregateException ae
                ? ae.errors()
                : List.of(error.getSuppressed());
        for (Throwable child : children) {
            if (!seen.contains(child)) nested.add(encode(child, seen));
        }

        return new ErrorRecord(ErrorKinds.kindOf(error), name, error.getMessage(), stack,
                encodedCause, properties, nested);
    }

    // property values are reduced to data: scalars stay, maps and collections are copied, the rest is printed
    private static @Nullable Object plain(@Nullable Object value) {
        if (value == null || value instanceof String || value instanceof Number
                || value instanceof Boolean || value instanceof Character) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, @Nullable Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), plain(v)));
            return copy;
        }
        if (value instanceof Collection<?> c) {
            List<@Nullable Object> copy = new ArrayList<>(c.size());
            for (Object o : c) copy.add(plain(o));
            return copy;
        }
        if (value instanceof Enum<?> e) return e.name();
        return String.valueOf(value);
    }
    // [/🧩 Section: encode]

    // 🧩 Section: decode

    public static @NonNull Throwable fromObject(@NonNull ErrorRecord record) {
        if (record == null) throw new IllegalArgumentException("Record cannot be null");

        Throwable cause = record.cause() != null ? fromObject(record.cause()) : null;
        List<Throwable> nested = new ArrayList<>(record.errors().size());
        for (ErrorRecord child : record.errors()) nested.add(fromObject(child));

        Throwable error;
        if (AggregateException.class.getName().equals(record.kind())) {
            error = new AggregateException(record.message(), nested, cause);
        } else {
            error = ErrorKinds.lookup(record.kind())
                    .map(f -> f.create(record.message(), cause))
                    .orElseGet(() -> {
                        DIAG.debug("Unknown error kind {}, decoding as ParallelException", record.kind());
                        return new ParallelException(record.name(), record.message(), cause);
                    });
            attachCause(error, cause);
            for (Throwable t : nested) error.addSuppressed(t);
        }

        if (error instanceof ParallelException pe) {
            pe.rename(record.name());
            pe.putProperties(record.properties());
        }

        if (!record.stack().isEmpty()) {
            StackTraceElement[] frames = new StackTraceElement[record.stack().size()];
            for (int i = 0; i < frames.length; i++) frames[i] = record.stack().get(i).toElement();
            error.setStackTrace(frames);
        }
        return error;
    }

    private static void attachCause(Throwable error, @Nullable Throwable cause) {
        if (cause == null || error.getCause() != null) return;
        try {
            error.initCause(cause);
        } catch (IllegalStateException e) {
            // some JDK types fix their cause at construction
            DIAG.debug("Cause not attached to {}: {}", error.getClass().getName(), e.getMessage());
        }
    }
    // [/🧩 Section: decode]
}
