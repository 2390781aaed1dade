/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/LinkedModule.java
 description: Module bound to a runtime, with untyped calls and typed interface proxies.
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
import tech.robd.jparallel.diagnostics.Diagnostics;

import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * A module whose functions are called in shared worker contexts.
 *
 * <pre>{@code
 * LinkedModule mod = runtime.link("com.example.Words");
 * String s = mod.<String>call("greet", "World").join();
 * for (String w : mod.<String>call("sequence", List.of("foo", "bar"))) { ... }
 * }</pre>
 */
public final class LinkedModule {
    private static final Diagnostics DIAG = Diagnostics.of(LinkedModule.class);

    private final ParallelRuntime runtime;
    private final String module;

    LinkedModule(@NonNull ParallelRuntime runtime, @NonNull String module) {
        this.runtime = runtime;
        this.module = module;
    }

    public @NonNull String id() {
        return module;
    }

    public <T> @NonNull LinkedCall<T> call(@NonNull String fn, @Nullable Object... args) {
        if (fn == null) throw new IllegalArgumentException("Function name cannot be null");
        List<?> list = args == null ? List.of() : Arrays.asList(args);
        return new LinkedCall<>(runtime.call(module, fn, list, RunOptions.none()));
    }

    /**
     * Typed view of the module. Each interface method calls the function of the same name and
     * adapts to the declared return type:
     * <ul>
     *   <li>{@link LinkedCall}, {@link RemoteCall}: the call itself;</li>
     *   <li>{@link java.util.concurrent.CompletableFuture}, {@link CompletionStage}: {@code result()};</li>
     *   <li>{@link RemoteGenerator}, {@link Iterable}: {@code iterate()};</li>
     *   <li>anything else, {@code void} included: blocks in {@code join()}; numbers are converted
     *       to the declared numeric type, {@code null} for a primitive fails with
     *       {@link IllegalStateException}.</li>
     * </ul>
     */
    public <I> @NonNull I as(@NonNull Class<I> api) {
        if (api == null || !api.isInterface()) throw new IllegalArgumentException("API type must be an interface");
        DIAG.debug("module {} linked as {}", module, api.getName());
        Object proxy = Proxy.newProxyInstance(api.getClassLoader(), new Class<?>[]{api},
                (self, method, args) -> {
                    if (method.getDeclaringClass() == Object.class) return objectMethod(self, method, args);
                    return adapt(method, call(method.getName(), args));
                });
        return api.cast(proxy);
    }

    private @Nullable Object objectMethod(Object self, Method method, Object @Nullable [] args) {
        switch (method.getName()) {
            case "equals":
                return args != null && self == args[0];
            case "hashCode":
                return System.identityHashCode(self);
            default:
                return "LinkedModule[" + module + "]";
        }
    }

    private static @Nullable Object adapt(Method method, LinkedCall<Object> call) {
        Class<?> type = method.getReturnType();
        if (type == LinkedCall.class) return call;
        if (type == RemoteCall.class) return call.handle();
        if (CompletionStage.class.isAssignableFrom(type)) return call.result();
        if (type == RemoteGenerator.class) return call.generator();
        if (type == Iterable.class) return call;
        Object value = call.join();
        return type == void.class ? null : returnValue(method, type, value);
    }

    // JSON numbers come back as Long/Double/BigInteger; narrow or widen them to the declared type
    private static @Nullable Object returnValue(Method method, Class<?> type, @Nullable Object value) {
        if (value == null) {
            if (type.isPrimitive()) {
                throw new IllegalStateException(method.getName() + " returned null, expected " + type.getName());
            }
            return null;
        }
        Class<?> boxed = box(type);
        if (boxed.isInstance(value)) return value;
        if (value instanceof Number n) {
            if (boxed == Integer.class) return n.intValue();
            if (boxed == Long.class) return n.longValue();
            if (boxed == Double.class) return n.doubleValue();
            if (boxed == Float.class) return n.floatValue();
            if (boxed == Short.class) return n.shortValue();
            if (boxed == Byte.class) return n.byteValue();
            if (boxed == BigInteger.class) return new BigDecimal(n.toString()).toBigInteger();
            if (boxed == BigDecimal.class) return new BigDecimal(n.toString());
        }
        if (value instanceof String str && boxed == Character.class && str.length() == 1) return str.charAt(0);
        throw new ClassCastException(method.getName() + " returned " + value.getClass().getName()
                + ", expected " + type.getName());
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) return type;
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == boolean.class) return Boolean.class;
        if (type == char.class) return Character.class;
        if (type == short.class) return Short.class;
        return Byte.class;
    }

    @Override
    public String toString() {
        return "LinkedModule[" + module + "]";
    }
}
