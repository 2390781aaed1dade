/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/ProcessModeTest.java
 description: Process-mode runtime tests running calls in child JVMs.
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

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jparallel.error.WorkerExitedException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static tech.robd.jparallel.examples.WorkerFunctions.MODULE;

/**
 * Runs calls in child JVMs started from the test classpath.
 */
final class ProcessModeTest {

    private static ParallelRuntime runtime;

    @BeforeAll
    static void startRuntime() {
        String classpath = System.getProperty("surefire.test.class.path", System.getProperty("java.class.path"));
        runtime = new ParallelRuntime(RuntimeConfig.builder()
                .contextKind(ContextKind.PROCESS)
                .classpath(classpath)
                .maxWorkers(2)
                .build());
    }

    @AfterAll
    static void stopRuntime() {
        runtime.close();
    }

    @Test
    @Timeout(30)
    void runsFunctionInChildProcess() {
        assertEquals("Hi, World", runtime.<String>call(MODULE, "greet", "World").join());
        assertEquals(45, runtime.<Integer>call(MODULE, "transfer", (Object) new byte[]{0, 1, 2, 3, 4, 5, 6, 7, 8, 9}).join());
    }

    @Test
    @Timeout(30)
        // Exceptions are rebuilt from their class name on the host.
    void remoteExceptionCrossesProcess() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> runtime.call(MODULE, "throwError", "boom").join());
        assertEquals("boom", e.getMessage());
    }

    @Test
    @Timeout(30)
    void generatorCrossesProcess() {
        RemoteGenerator<String> gen = runtime.<String>call(MODULE, "sequence", List.of("foo", "bar")).iterate();
        List<String> words = new ArrayList<>();
        for (String w : gen) words.add(w);
        assertEquals(List.of("foo", "bar"), words);
    }

    @Test
    @Timeout(30)
    void channelCrossesProcess() {
        Channel<Map<String, Object>> channel = Channel.unlimited();
        RemoteCall<Integer> job = runtime.run(MODULE, "twoTimesValues", channel);
        for (int i = 0; i <= 9; i++) channel.send(Map.of("value", i, "done", i == 9));

        List<Object> results = new ArrayList<>();
        channel.forEach(item -> results.add(item.get("value")));
        assertEquals(List.of(0, 2, 4, 6, 8, 10, 12, 14, 16, 18), results);
        assertEquals(10, job.join());
    }

    @Test
    @Timeout(30)
    void exitCodeReachesCaller() {
        WorkerExitedException e = assertThrows(WorkerExitedException.class,
                () -> runtime.run(MODULE, "exit", 3).join());
        assertEquals(3, e.exitCode());
    }
}
