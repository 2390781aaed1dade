/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/ProcessContextSpawner.java
 description: Spawns worker contexts as child JVM processes.
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
import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.error.WorkerSpawnException;
import tech.robd.jparallel.pool.ContextListener;
import tech.robd.jparallel.pool.ContextSpawner;
import tech.robd.jparallel.pool.WorkerContext;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts worker JVMs running {@code workerEntry} (by default {@link WorkerMain}) on the given
 * class path. The child's stderr is inherited.
 */
public final class ProcessContextSpawner implements ContextSpawner {
    private static final Diagnostics DIAG = Diagnostics.of(ProcessContextSpawner.class);

    private final String javaBinary;
    private final String classpath;
    private final String workerEntry;
    private final List<String> jvmArgs;

    public ProcessContextSpawner(@NonNull String classpath, @NonNull String workerEntry, @NonNull List<String> jvmArgs) {
        if (classpath == null || workerEntry == null) throw new IllegalArgumentException("Classpath and entry cannot be null");
        if (jvmArgs == null) throw new IllegalArgumentException("JVM arguments cannot be null");
        this.javaBinary = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        this.classpath = classpath;
        this.workerEntry = workerEntry;
        this.jvmArgs = List.copyOf(jvmArgs);
    }

    @Override
    public WorkerContext spawn(ContextListener listener) {
        List<String> command = new ArrayList<>();
        command.add(javaBinary);
        command.addAll(jvmArgs);
        command.add("-cp");
        command.add(classpath);
        command.add(workerEntry);
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
        } catch (IOException e) {
            throw new WorkerSpawnException("failed to start worker process " + workerEntry, e);
        }
        DIAG.debug("pid#{} started {}", process.pid(), workerEntry);
        return new ProcessWorkerContext(process, listener).start();
    }
}
