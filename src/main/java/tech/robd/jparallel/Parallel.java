/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/Parallel.java
 description: Static entry points over a lazily created default runtime.
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

import java.util.List;

/**
 * Static entry points over a default {@link ParallelRuntime}, created on first use from
 * {@link RuntimeConfig#fromSystemProperties()}.
 *
 * <p>This class is sugar. For finer control, create and close your own runtime.</p>
 */
public final class Parallel {
    private static final Object LOCK = new Object();
    private static volatile @Nullable ParallelRuntime defaultRuntime;

    private Parallel() {
    }

    public static @NonNull ParallelRuntime runtime() {
        ParallelRuntime rt = defaultRuntime;
        if (rt != null) return rt;
        synchronized (LOCK) {
            if (defaultRuntime == null) defaultRuntime = new ParallelRuntime(RuntimeConfig.fromSystemProperties());
            return defaultRuntime;
        }
    }

    public static <T> @NonNull RemoteCall<T> run(@NonNull String module, @NonNull String fn, @Nullable Object... args) {
        return runtime().run(module, fn, args);
    }

    public static <T> @NonNull RemoteCall<T> run(@NonNull String module, @NonNull String fn,
                                                 @NonNull List<?> args, @NonNull RunOptions options) {
        return runtime().run(module, fn, args, options);
    }

    public static @NonNull LinkedModule link(@NonNull String module) {
        return runtime().link(module);
    }

    public static <I> @NonNull I link(@NonNull String module, @NonNull Class<I> api) {
        return runtime().link(module, api);
    }

    /**
     * Close the default runtime. The next call creates a new one.
     */
    public static void shutdown() {
        ParallelRuntime rt;
        synchronized (LOCK) {
            rt = defaultRuntime;
            defaultRuntime = null;
        }
        if (rt != null) rt.close();
    }
}
