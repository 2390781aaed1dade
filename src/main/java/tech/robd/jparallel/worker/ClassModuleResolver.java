/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/ClassModuleResolver.java
 description: Resolves modules as classes whose public static methods are the exported functions.
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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.error.ModuleResolutionException;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolves a module id as a fully-qualified class name whose public static methods are the
 * exported functions. A static method named {@value #DEFAULT_METHOD} is also exported as
 * {@value RemoteModule#DEFAULT_FUNCTION}.
 *
 * <p>Overloads are chosen by argument count and compatibility. Numbers are converted to the
 * parameter's numeric type and lists to array parameters, since values decoded from JSON
 * arrive as the widest matching Java type.</p>
 */
public final class ClassModuleResolver implements ModuleResolver {
    private static final Diagnostics DIAG = Diagnostics.of(ClassModuleResolver.class);

    public static final String DEFAULT_METHOD = "call";

    private final ClassLoader loader;
    private final ConcurrentMap<String, RemoteModule> modules = new ConcurrentHashMap<>();

    public ClassModuleResolver() {
        this(ClassModuleResolver.class.getClassLoader());
    }

    public ClassModuleResolver(@NonNull ClassLoader loader) {
        if (loader == null) throw new IllegalArgumentException("ClassLoader cannot be null");
        this.loader = loader;
    }

    @Override
    public @NonNull RemoteModule resolve(@NonNull String moduleId) {
        if (moduleId == null) throw new IllegalArgumentException("Module id cannot be null");
        return modules.computeIfAbsent(moduleId, this::load);
    }

    private RemoteModule load(String moduleId) {
        Class<?> type;
        try {
            type = Class.forName(moduleId, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new ModuleResolutionException("Cannot find module '" + moduleId + "'", e);
        }
        Map<String, List<Method>> exported = new LinkedHashMap<>();
        for (Method m : type.getMethods()) {
            if (!Modifier.isStatic(m.getModifiers()) || m.getDeclaringClass() == Object.class) continue;
            exported.computeIfAbsent(m.getName(), k -> new ArrayList<>()).add(m);
            if (DEFAULT_METHOD.equals(m.getName())) {
                exported.computeIfAbsent(RemoteModule.DEFAULT_FUNCTION, k -> new ArrayList<>()).add(m);
            }
        }
        DIAG.debug("module {} loaded with {} function(s)", moduleId, exported.size());
        return new ClassModule(moduleId, exported);
    }

    private static final class ClassModule implements RemoteModule {
        private final String id;
        private final Map<String, List<Method>> exported;

        ClassModule(String id, Map<String, List<Method>> exported) {
            this.id = id;
            this.exported = exported;
        }

        @Override
        public @NonNull String id() {
            return id;
        }

        @Override
        public @Nullable RemoteFunction function(@NonNull String name) {
            List<Method> overloads = exported.get(name);
            if (overloads == null) return null;
            return args -> invoke(name, overloads, args);
        }

        @Override
        public @NonNull Set<String> functionNames() {
            return Set.copyOf(exported.keySet());
        }

        private @Nullable Object invoke(String name, List<Method> overloads, List<@Nullable Object> args) throws Exception {
            for (Method m : overloads) {
                Object[] actual = adapt(m, args);
                if (actual == null) continue;
                try {
                    return m.invoke(null, actual);
                } catch (InvocationTargetException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof Exception ex) throw ex;
                    if (cause instanceof Error err) throw err;
                    throw e;
                }
            }
            throw new ModuleResolutionException("No overload of " + id + "." + name
                    + " accepts " + args.size() + " argument(s) of the given types");
        }
    }

    // 🧩 Section: argument-adaptation
    private static Object @Nullable [] adapt(Method m, List<@Nullable Object> args) {
        Class<?>[] params = m.getParameterTypes();
        int fixed = m.isVarArgs() ? params.length - 1 : params.length;
        if (m.isVarArgs() ? args.size() < fixed : args.size() != fixed) return null;

        Object[] actual = new Object[params.length];
        for (int i = 0; i < fixed; i++) {
            Converted c = convert(args.get(i), params[i]);
            if (c == null) return null;
            actual[i] = c.value;
        }
        if (m.isVarArgs()) {
            Converted rest = convert(args.subList(fixed, args.size()), params[fixed]);
            if (rest == null) return null;
            actual[fixed] = rest.value;
        }
        return actual;
    }

    private record Converted(@Nullable Object value) {
    }

    private static @Nullable Converted convert(@Nullable Object arg, Class<?> target) {
        if (arg == null) return target.isPrimitive() ? null : new Converted(null);
        Class<?> boxed = box(target);
        if (boxed.isInstance(arg)) return new Converted(arg);
        if (arg instanceof Number n && Number.class.isAssignableFrom(boxed)) {
            Object v = convertNumber(n, boxed);
            return v == null ? null : new Converted(v);
        }
        if (arg instanceof Collection<?> c && target.isArray()) {
            Class<?> component = target.getComponentType();
            Object array = Array.newInstance(component, c.size());
            int i = 0;
            for (Object o : c) {
                Converted e = convert(o, component);
                if (e == null) return null;
                Array.set(array, i++, e.value);
            }
            return new Converted(array);
        }
        if (arg instanceof String s && (boxed == Character.class) && s.length() == 1) {
            return new Converted(s.charAt(0));
        }
        return null;
    }

    private static @Nullable Object convertNumber(Number n, Class<?> boxed) {
        if (boxed == Integer.class) return n.intValue();
        if (boxed == Long.class) return n.longValue();
        if (boxed == Double.class) return n.doubleValue();
        if (boxed == Float.class) return n.floatValue();
        if (boxed == Short.class) return n.shortValue();
        if (boxed == Byte.class) return n.byteValue();
        if (boxed == BigInteger.class) return new BigDecimal(n.toString()).toBigInteger();
        if (boxed == BigDecimal.class) return new BigDecimal(n.toString());
        if (boxed == Number.class) return n;
        return null;
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
        if (type == byte.class) return Byte.class;
        return Void.class;
    }
    // [/🧩 Section: argument-adaptation]
}
