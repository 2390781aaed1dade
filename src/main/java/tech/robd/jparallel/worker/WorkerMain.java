/*
 [File Info]
 path: src/main/java/tech/robd/jparallel/worker/WorkerMain.java
 description: Entry point of a process worker context.
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

import tech.robd.jparallel.diagnostics.Diagnostics;
import tech.robd.jparallel.protocol.MessageCodec;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.protocol.Ready;
import tech.robd.jparallel.task.MessageSink;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Entry point of a process worker context. Protocol lines are read from stdin and written to
 * stdout; anything the called functions print goes to stderr.
 */
public final class WorkerMain {
    private static final Diagnostics DIAG = Diagnostics.of(WorkerMain.class);

    private WorkerMain() {
    }

    public static void main(String[] args) {
        PrintStream protocol = new PrintStream(System.out, false, StandardCharsets.UTF_8);
        System.setOut(System.err);

        MessageSink toHost = message -> {
            String line = MessageCodec.encode(message);
            synchronized (protocol) {
                protocol.println(line);
                protocol.flush();
            }
        };
        ExecutorService calls = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "jparallel-worker-call");
            t.setDaemon(true);
            return t;
        });
        WorkerRuntime runtime = new WorkerRuntime(new ClassModuleResolver(), toHost, calls, code -> {
            protocol.flush();
            System.exit(code);
        });

        toHost.send(new Ready());
        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (line.isBlank()) continue;
                ProtocolMessage message;
                try {
                    message = MessageCodec.decode(line, MessageCodec.Direction.TO_WORKER);
                } catch (IllegalArgumentException e) {
                    DIAG.warn("ignoring malformed input line", e);
                    continue;
                }
                runtime.accept(message);
            }
        } catch (IOException e) {
            DIAG.error("stdin failed", e);
            runtime.shutdown();
            System.exit(1);
        }
        runtime.shutdown();
        System.exit(0);
    }
}
