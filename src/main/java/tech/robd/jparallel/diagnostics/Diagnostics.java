/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/diagnostics/Diagnostics.java
 description: Diagnostics facade used by every class for debug/info/warn/error logging.
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
package tech.robd.jparallel.diagnostics;

/**
 * Small logging facade bound to an owning {@link Class}.
 * <p>
 * Every call forwards to {@code DiagnosticsBackend}, which routes to SLF4J. Tracing output
 * ({@link #debug}, {@link #info}) is only produced while diagnostics are switched on with
 * {@code -Djparallel.diag=true} or {@link #enable()}; {@link #warn} and {@link #error} always
 * reach the logger because they describe worker failures the host has to know about.
 */
@FunctionalInterface
public interface Diagnostics {

    // 🧩 Section: identity

    /**
     * @return the class whose logger receives the output
     */
    Class<?> owner();
    // [/🧩 Section: identity]

    // 🧩 Section: forwarding

    /**
     * Trace-level detail about pool, task and protocol activity.
     *
     * @param msg  SLF4J-style message pattern
     * @param args pattern arguments (a trailing {@link Throwable} is logged as such)
     */
    default void debug(String msg, Object... args) {
        DiagnosticsBackend.debug(owner(), msg, args);
    }

    default void info(String msg, Object... args) {
        DiagnosticsBackend.info(owner(), msg, args);
    }

    default void warn(String msg, Object... args) {
        DiagnosticsBackend.warn(owner(), msg, args);
    }

    default void error(String msg, Object... args) {
        DiagnosticsBackend.error(owner(), msg, args);
    }

    /**
     * @return {@code true} when tracing output is currently switched on
     */
    default boolean isTracing() {
        return DiagnosticsBackend.isEnabled();
    }
    // [/🧩 Section: forwarding]

    // 🧩 Section: factories

    /**
     * Diagnostics for {@code owner}. Enablement is checked on each call, so switching tracing on
     * after class initialisation still takes effect.
     *
     * @param owner owning class (non-null)
     * @return diagnostics bound to the owner
     */
    static Diagnostics of(Class<?> owner) {
        if (owner == null) throw new IllegalArgumentException("Owner cannot be null");
        return new BoundDiagnostics(owner);
    }

    /**
     * Switch tracing output on for the whole JVM.
     */
    static void enable() {
        DiagnosticsBackend.enable();
    }

    /**
     * Switch tracing output off for the whole JVM.
     */
    static void disable() {
        DiagnosticsBackend.disable();
    }
    // [/🧩 Section: factories]
}
