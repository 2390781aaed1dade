/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/LinkedModuleTest.java
 description: Linked module tests: awaitable and iterable calls, typed proxies and static entry points.
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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jparallel.error.AbortException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tech.robd.jparallel.examples.WorkerFunctions.MODULE;
import static tech.robd.jparallel.tools.TestAwaitUtils.await;
import static tech.robd.jparallel.tools.TestAwaitUtils.awaitTrue;

final class LinkedModuleTest {

    interface Words {
        String greet(String name);

        CompletableFuture<String> greetLater(String name);

        Iterable<String> sequence(List<String> words);

        RemoteGenerator<Integer> accumulate();

        RemoteCall<String> takeTooLong(String text);

        LinkedCall<String> call(String name);

        void throwError(String message);
    }

    interface Sizes {
        int count(List<String> items);

        int nothing();

        int greet(String name);
    }

    private ParallelRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = new ParallelRuntime(RuntimeConfig.builder().maxWorkers(2).build());
    }

    @AfterEach
    void tearDown() {
        runtime.close();
    }

    @AfterAll
    static void closeDefaultRuntime() {
        Parallel.shutdown();
    }

    @Test
    @Timeout(5)
    void linkedCallIsAwaitable() {
        LinkedModule mod = runtime.link(MODULE);
        assertEquals(MODULE, mod.id());
        assertEquals("Hi, World", mod.<String>call("greet", "World").join());
        assertEquals("Hello, World", await(mod.<String>call("default", "World").result(), 3000));
    }

    @Test
    @Timeout(5)
        // Iterating a linked call yields the generated values and leaves out the return value.
    void linkedCallIsIterable() {
        LinkedModule mod = runtime.link(MODULE);
        List<String> words = new ArrayList<>();
        for (String w : mod.<String>call("sequence", List.of("foo", "bar"))) words.add(w);
        assertEquals(List.of("foo", "bar"), words);
    }

    @Test
    @Timeout(5)
    void linkedCallCanBeAborted() {
        LinkedCall<String> call = runtime.link(MODULE).call("takeTooLong", "slow");
        awaitTrue(() -> call.handle().workerId().isPresent(), 2000, "call should get a context");
        assertTrue(call.abort());
        assertThrows(AbortException.class, call::join);
        assertEquals(1, runtime.workerCount());
    }

    @Test
    @Timeout(5)
        // Interface methods adapt the call to their declared return types.
    void typedProxyAdaptsReturnTypes() {
        Words words = runtime.link(MODULE, Words.class);

        assertEquals("Hi, Ann", words.greet("Ann"));
        assertEquals("Later, Ann", await(words.greetLater("Ann"), 3000));
        assertEquals("Hello, Ann", words.call("Ann").join());

        List<String> seen = new ArrayList<>();
        for (String w : words.sequence(List.of("x", "y"))) seen.add(w);
        assertEquals(List.of("x", "y"), seen);

        RemoteGenerator<Integer> acc = words.accumulate();
        assertEquals(Step.of(0), acc.next());
        assertEquals(Step.of(4), acc.next(4));
        acc.close();

        RemoteCall<String> slow = words.takeTooLong("slow");
        assertFalse(slow.isDone());
        slow.abort();
    }

    @Test
    @Timeout(5)
        // Numeric results follow the declared return type; null and mismatched values fail clearly.
    void typedProxyConvertsReturnValues() {
        Sizes sizes = runtime.link(MODULE, Sizes.class);

        assertEquals(3, sizes.count(List.of("a", "b", "c")));

        IllegalStateException noValue = assertThrows(IllegalStateException.class, sizes::nothing);
        assertEquals("nothing returned null, expected int", noValue.getMessage());

        ClassCastException wrongType = assertThrows(ClassCastException.class, () -> sizes.greet("x"));
        assertTrue(wrongType.getMessage().startsWith("greet returned java.lang.String"));
    }

    @Test
    @Timeout(5)
        // Closing a linked call after breaking out of the loop finishes the remote generator.
    void closingLinkedCallFinishesGenerator() {
        LinkedModule mod = runtime.link(MODULE);
        LinkedCall<Integer> call = mod.call("accumulate");
        try (call) {
            for (Integer total : call) {
                assertEquals(0, total);
                break;
            }
        }
        assertNull(await(call.generator().completion(), 3000));
        awaitTrue(() -> runtime.inFlight() == 0, 1000, "finished generator should leave the registry");
    }

    @Test
    @Timeout(5)
    void typedProxyRethrowsRemoteErrors() {
        Words words = runtime.link(MODULE, Words.class);
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> words.throwError("bad"));
        assertEquals("bad", e.getMessage());
    }

    @Test
    @Timeout(2)
    void typedProxyObjectMethods() {
        Words words = runtime.link(MODULE, Words.class);
        assertEquals("LinkedModule[" + MODULE + "]", words.toString());
        assertEquals(words, words);
        assertEquals(System.identityHashCode(words), words.hashCode());
    }

    @Test
    @Timeout(2)
    void onlyInterfacesCanBeLinked() {
        LinkedModule mod = runtime.link(MODULE);
        assertThrows(IllegalArgumentException.class, () -> mod.as(String.class));
        assertThrows(IllegalArgumentException.class, () -> mod.call(null));
    }

    @Test
    @Timeout(5)
        // The static entry points share one default runtime.
    void staticEntryPoints() {
        assertEquals("Hi, static", Parallel.link(MODULE).<String>call("greet", "static").join());
        assertEquals("Hi, run", Parallel.<String>run(MODULE, "greet", "run").join());
        Words words = Parallel.link(MODULE, Words.class);
        assertEquals("Hi, typed", words.greet("typed"));
    }
}
