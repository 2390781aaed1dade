/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/ProcessWorkerContext.java
 description: Worker context backed by a child JVM speaking line-delimited JSON.
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
import tech.robd.jparallel.error.WorkerExitedException;
import tech.robd.jparallel.pool.ContextListener;
import tech.robd.jparallel.pool.WorkerContext;
import tech.robd.jparallel.protocol.MessageCodec;
import tech.robd.jparallel.protocol.ProtocolMessage;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;

/**
 * Worker context backed by a child JVM. Messages travel as one JSON object per line over the
 * child's stdin and stdout; a reader thread delivers replies and reports the exit code once
 * stdout ends.
 */
public final class ProcessWorkerContext implements WorkerContext {
    private static final Diagnostics DIAG = Diagnostics.of(ProcessWorkerContext.class);

    private final Process process;
    private final ContextListener listener;
    private final BufferedWriter stdin;
    private final Thread reader;
    private volatile boolean terminated;

    public ProcessWorkerContext(@NonNull Process process, @NonNull ContextListener listener) {
        if (process == null || listener == null) throw new IllegalArgumentException("Process and listener cannot be null");
        this.process = process;
        this.listener = listener;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        this.reader = new Thread(this::readLoop, "jparallel-process-" + process.pid() + "-reader");
        reader.setDaemon(true);
    }

    public @NonNull ProcessWorkerContext start() {
        reader.start();
        DIAG.debug("pid#{} reader started", process.pid());
        return this;
    }

    // runs on the reader thread
    private void readLoop() {
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                ProtocolMessage message;
                try {
                    message = MessageCodec.decode(line, MessageCodec.Direction.TO_HOST);
                } catch (IllegalArgumentException e) {
                    DIAG.warn("pid#{} ignoring non-protocol output: {}", process.pid(), line);
                    continue;
                }
                listener.onMessage(message);
            }
        } catch (IOException e) {
            if (!terminated) {
                DIAG.warn("pid#{} stdout failed", process.pid(), e);
                listener.onError(e);
            }
        }
        try {
            int code = process.waitFor();
            DIAG.debug("pid#{} exited with code {}", process.pid(), code);
            listener.onExit(code);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            listener.onError(new WorkerExitedException("interrupted while waiting for worker process exit"));
        }
    }

    @Override
    public void send(ProtocolMessage message) {
        if (terminated || !process.isAlive()) {
            DIAG.debug("pid#{} not running, dropping {}", process.pid(), message.type());
            return;
        }
        String line = MessageCodec.encode(message);
        synchronized (stdin) {
            try {
                stdin.write(line);
                stdin.newLine();
                stdin.flush();
            } catch (IOException e) {
                DIAG.warn("pid#{} stdin failed", process.pid(), e);
                listener.onError(e);
            }
        }
    }

    @Override
    public void terminate() {
        if (terminated) return;
        terminated = true;
        DIAG.debug("pid#{} terminating", process.pid());
        process.destroyForcibly();
    }

    @Override
    public String describe() {
        return "process context pid#" + process.pid();
    }
}
