/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/protocol/WireValues.java
 description: Structured copying of values across the worker boundary.
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
package tech.robd.jparallel.protocol;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.Channel;
import tech.robd.jparallel.error.ErrorCodec;
import tech.robd.jparallel.error.ErrorRecord;
import tech.robd.jparallel.error.ParallelException;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Copies values across the worker boundary.
 *
 * <p>Encoding rules:
 * <ul>
 *   <li>scalars, strings, enums and {@link UUID}s are immutable and pass as they are;</li>
 *   <li>records are rebuilt through their canonical constructor from copied components; a
 *       component that cannot be copied into its declared type fails the copy;</li>
 *   <li>{@code byte[]} and {@link ByteBuffer} pass without copying and are listed as transfers;</li>
 *   <li>other primitive arrays are copied; object arrays become lists;</li>
 *   <li>maps, sets and other collections are copied structurally (shared references and cycles
 *       are kept);</li>
 *   <li>throwables become {@link ErrorRecord}s, channels become {@link ChannelRef}s;</li>
 *   <li>anything else fails with a {@code DataCloneError}.</li>
 * </ul>
 * Decoding reverses the error and channel substitutions and copies containers again.</p>
 */
public final class WireValues {

    /**
     * Shares a channel with the receiving side and returns its wire reference.
     */
    @FunctionalInterface
    public interface ChannelEncoder {
        @NonNull ChannelRef share(@NonNull Channel<?> channel);
    }

    /**
     * Returns the local channel for a wire reference.
     */
    @FunctionalInterface
    public interface ChannelDecoder {
        @NonNull Channel<?> resolve(@NonNull ChannelRef ref);
    }

    /**
     * Encoder for values that may not contain channels (return values, yields, close errors).
     */
    public static final ChannelEncoder NO_CHANNELS = ch -> {
        throw new ParallelException("DataCloneError",
                "channel can only be passed as an argument to a remote function", null);
    };

    public static final ChannelDecoder NO_CHANNEL_REFS = ref -> {
        throw new IllegalStateException("No channel table available for channel#" + ref.id());
    };

    /**
     * Encoded argument list plus the buffers handed over with it.
     */
    public record Encoded(@NonNull List<@Nullable Object> values, @NonNull List<Object> transfer) {
    }

    private WireValues() {
    }

    // 🧩 Section: encode

    public static @NonNull Encoded encodeArgs(@NonNull List<?> args, @NonNull ChannelEncoder channels) {
        List<Object> transfer = new ArrayList<>();
        Map<Object, Object> seen = new IdentityHashMap<>();
        List<@Nullable Object> out = new ArrayList<>(args.size());
        for (Object a : args) out.add(encode(a, channels, transfer, seen));
        return new Encoded(out, transfer);
    }

    public static @Nullable Object encode(@Nullable Object value,
                                          @NonNull ChannelEncoder channels,
                                          @NonNull List<Object> transfer) {
        return encode(value, channels, transfer, new IdentityHashMap<>());
    }

    private static @Nullable Object encode(@Nullable Object value,
                                           ChannelEncoder channels,
                                           List<Object> transfer,
                                           Map<Object, Object> seen) {
        if (isImmutable(value)) return value;
        if (value instanceof byte[] || value instanceof ByteBuffer) {
            if (transfer.stream().noneMatch(t -> t == value)) transfer.add(value);
            return value;
        }
        if (value instanceof Throwable t) return ErrorCodec.toObject(t);
        if (value instanceof Channel<?> ch) return channels.share(ch);

        Object known = seen.get(value);
        if (known != null) return known;

        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            seen.put(value, copy);
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put(encode(e.getKey(), channels, transfer, seen), encode(e.getValue(), channels, transfer, seen));
            }
            return copy;
        }
        if (value instanceof Collection<?> c) {
            Collection<Object> copy = value instanceof Set<?> ? new LinkedHashSet<>() : new ArrayList<>(c.size());
            seen.put(value, copy);
            for (Object o : c) copy.add(encode(o, channels, transfer, seen));
            return copy;
        }
        if (value instanceof Record record) return copyRecord(record, channels, transfer, seen);
        if (value.getClass().isArray()) {
            Class<?> component = value.getClass().getComponentType();
            int length = Array.getLength(value);
            if (component.isPrimitive()) {
                Object copy = Array.newInstance(component, length);
                System.arraycopy(value, 0, copy, 0, length);
                return copy;
            }
            List<@Nullable Object> copy = new ArrayList<>(length);
            seen.put(value, copy);
            for (int i = 0; i < length; i++) copy.add(encode(Array.get(value, i), channels, transfer, seen));
            return copy;
        }
        throw new ParallelException("DataCloneError",
                "value of type " + value.getClass().getName() + " could not be cloned", null);
    }

    private static boolean isImmutable(@Nullable Object value) {
        return value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Character
                || value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte
                || value instanceof Double || value instanceof Float
                || value instanceof BigInteger || value instanceof BigDecimal
                || value instanceof Enum<?>
                || value instanceof UUID
                || value instanceof ErrorRecord
                || value instanceof ChannelRef;
    }

    private static Record copyRecord(Record value,
                                     ChannelEncoder channels,
                                     List<Object> transfer,
                                     Map<Object, Object> seen) {
        Class<?> type = value.getClass();
        RecordComponent[] components = type.getRecordComponents();
        Class<?>[] types = new Class<?>[components.length];
        Object[] copied = new Object[components.length];
        try {
            for (int i = 0; i < components.length; i++) {
                types[i] = components[i].getType();
                Method accessor = components[i].getAccessor();
                accessor.setAccessible(true);
                copied[i] = copyComponent(accessor.invoke(value), types[i], channels, transfer, seen);
            }
            Constructor<?> canonical = type.getDeclaredConstructor(types);
            canonical.setAccessible(true);
            Record copy = (Record) canonical.newInstance(copied);
            seen.put(value, copy);
            return copy;
        } catch (ReflectiveOperationException | RuntimeException e) {
            if (e instanceof ParallelException pe) throw pe;
            Throwable cause = e instanceof InvocationTargetException ite && ite.getCause() != null ? ite.getCause() : e;
            throw new ParallelException("DataCloneError",
                    "record of type " + type.getName() + " could not be cloned: " + cause, cause);
        }
    }

    // record components keep their declared type: object arrays stay arrays, the rest must fit as copied
    private static @Nullable Object copyComponent(@Nullable Object value,
                                                  Class<?> declared,
                                                  ChannelEncoder channels,
                                                  List<Object> transfer,
                                                  Map<Object, Object> seen) {
        if (value != null && declared.isArray() && !declared.getComponentType().isPrimitive()) {
            int length = Array.getLength(value);
            Object copy = Array.newInstance(declared.getComponentType(), length);
            for (int i = 0; i < length; i++) Array.set(copy, i, encode(Array.get(value, i), channels, transfer, seen));
            return copy;
        }
        Object copy = encode(value, channels, transfer, seen);
        if (copy != null && !declared.isPrimitive() && !declared.isInstance(copy)) {
            throw new ParallelException("DataCloneError",
                    "component of type " + declared.getName() + " could not be cloned as "
                            + copy.getClass().getName(), null);
        }
        return copy;
    }
    // [/🧩 Section: encode]

    // 🧩 Section: decode

    public static @NonNull List<@Nullable Object> decodeArgs(@NonNull List<?> args, @NonNull ChannelDecoder channels) {
        Map<Object, Object> seen = new IdentityHashMap<>();
        List<@Nullable Object> out = new ArrayList<>(args.size());
        for (Object a : args) out.add(decode(a, channels, seen));
        return out;
    }

    public static @Nullable Object decode(@Nullable Object wire, @NonNull ChannelDecoder channels) {
        return decode(wire, channels, new IdentityHashMap<>());
    }

    private static @Nullable Object decode(@Nullable Object wire, ChannelDecoder channels, Map<Object, Object> seen) {
        if (wire instanceof ErrorRecord record) return ErrorCodec.fromObject(record);
        if (wire instanceof ChannelRef ref) return channels.resolve(ref);
        if (wire == null || isImmutable(wire)) return wire;
        // records were rebuilt on encode and belong to the receiver
        if (wire instanceof Record) return wire;

        Object known = seen.get(wire);
        if (known != null) return known;

        if (wire instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            seen.put(wire, copy);
            for (Map.Entry<?, ?> e : map.entrySet()) {
                copy.put(decode(e.getKey(), channels, seen), decode(e.getValue(), channels, seen));
            }
            return copy;
        }
        if (wire instanceof Collection<?> c) {
            Collection<Object> copy = wire instanceof Set<?> ? new LinkedHashSet<>() : new ArrayList<>(c.size());
            seen.put(wire, copy);
            for (Object o : c) copy.add(decode(o, channels, seen));
            return copy;
        }
        return wire;
    }
    // [/🧩 Section: decode]
}
