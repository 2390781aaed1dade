/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/diagnostics/DiagnosticsBackend.java
 description: Backend contract behind the diagnostics facade.
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LocationAwareLogger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SLF4J sink behind {@link Diagnostics}.
 *
 * <ul>
 *   <li>Tracing switch from system property {@value #DIAGNOSTICS_PROPERTY_NAME} (default off),
 *       flipped at runtime by {@link #enable()} / {@link #disable()}.</li>
 *   <li>One cached {@link Logger} per owner class.</li>
 *   <li>{@link LocationAwareLogger} is used when the binding offers it, so the reported caller
 *       is the library class and not this backend.</li>
 * </ul>
 */
final class DiagnosticsBackend {

    // 🧩 Section: constants-and-state
    private static final String FQCN = DiagnosticsBackend.class.getName();

    private static final ConcurrentMap<Class<?>, Logger> LOGGERS = new ConcurrentHashMap<>();

    /**
     * {@code -Djparallel.diag=true} switches tracing on.
     */
    static final String DIAGNOSTICS_PROPERTY_NAME = "jparallel.diag";

    private static volatile boolean enabled =
            "true".equalsIgnoreCase(System.getProperty(DIAGNOSTICS_PROPERTY_NAME, "false").trim());
    // [/🧩 Section: constants-and-state]

    private DiagnosticsBackend() {
    }

    // 🧩 Section: enablement
    static void enable() {
        enabled = true;
    }

    static void disable() {
        enabled = false;
    }

    static boolean isEnabled() {
        return enabled;
    }
    // [/🧩 Section: enablement]

    // 🧩 Section: emitters
    static void debug(Class<?> owner, String msg, Object... args) {
        if (!enabled) return;
        emit(owner, LocationAwareLogger.DEBUG_INT, msg, args);
    }

    static void info(Class<?> owner, String msg, Object... args) {
        if (!enabled) return;
        emit(owner, LocationAwareLogger.INFO_INT, msg, args);
    }

    static void warn(Class<?> owner, String msg, Object... args) {
        emit(owner, LocationAwareLogger.WARN_INT, msg, args);
    }

    static void error(Class<?> owner, String msg, Object... args) {
        emit(owner, LocationAwareLogger.ERROR_INT, msg, args);
    }

    private static void emit(Class<?> owner, int level, String msg, Object[] args) {
        Logger log = LOGGERS.computeIfAbsent(owner, LoggerFactory::getLogger);
        if (log instanceof LocationAwareLogger law) {
            // 🧩 Point: emitters/location-aware
            Object[] params = args;
            Throwable thrown = null;
            if (args != null && args.length > 0 && args[args.length - 1] instanceof Throwable t) {
                thrown = t;
                params = new Object[args.length - 1];
                System.arraycopy(args, 0, params, 0, params.length);
            }
            law.log(null, FQCN, level, msg, params, thrown);
            return;
        }
        switch (level) {
            case LocationAwareLogger.DEBUG_INT -> log.debug(msg, args);
            case LocationAwareLogger.INFO_INT -> log.info(msg, args);
            case LocationAwareLogger.WARN_INT -> log.warn(msg, args);
            default -> log.error(msg, args);
        }
    }
    // [/🧩 Section: emitters]
}
