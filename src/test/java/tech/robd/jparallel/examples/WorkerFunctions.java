/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/examples/WorkerFunctions.java
 description: Module of worker functions used by the runtime tests.
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
package tech.robd.jparallel.examples;

import tech.robd.jparallel.Channel;
import tech.robd.jparallel.Parallel;
import tech.robd.jparallel.worker.Generator;
import tech.robd.jparallel.worker.Generators;
import tech.robd.jparallel.worker.WorkerRuntime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Module used by the runtime tests. Resolved by class name, so every public static method is a
 * remote function; {@link #call(String)} is the module's default export.
 */
public final class WorkerFunctions {

    public static final String MODULE = WorkerFunctions.class.getName();

    private WorkerFunctions() {
    }

    public static String call(String name) {
        return "Hello, " + name;
    }

    public static String greet(String name) {
        return "Hi, " + name;
    }

    public static String takeTooLong(String text) throws InterruptedException {
        Thread.sleep(1000);
        return text;
    }

    public static CompletableFuture<String> greetLater(String name) {
        return CompletableFuture.supplyAsync(() -> "Later, " + name);
    }

    // 🧩 Section: generators
    public static Generator<String> sequence(List<String> words) {
        return Generators.of(words, String.join(", ", words));
    }

    /**
     * Yields the running total of the values sent in with {@code next(input)}; a {@code null}
     * input ends it.
     */
    public static Generator<Integer> accumulate() {
        return Generators.produce(out -> {
            int total = 0;
            Object in = out.emit(total);
            while (in != null) {
                total += ((Number) in).intValue();
                in = out.emit(total);
            }
            return total;
        });
    }

    public static Generator<String> guarded() {
        return Generators.produce(out -> {
            try {
                out.emit("a");
                out.emit("b");
                return "finished";
            } catch (IllegalArgumentException e) {
                out.emit("caught " + e.getMessage());
                return "recovered";
            }
        });
    }
    // [/🧩 Section: generators]

    // 🧩 Section: errors
    public static Throwable transferError(Throwable err) {
        return err;
    }

    public static String throwError(String msg) {
        throw new IllegalStateException(msg);
    }
    // [/🧩 Section: errors]

    // 🧩 Section: channels

    /**
     * Reads {@code {value, done}} items until one is marked done, pushes them back doubled and
     * closes the channel.
     */
    public static int twoTimesValues(Channel<Map<String, Object>> channel) {
        List<Map<String, Object>> data = new ArrayList<>();
        for (Map<String, Object> item : channel) {
            boolean done = Boolean.TRUE.equals(item.get("done"));
            Map<String, Object> doubled = new LinkedHashMap<>();
            doubled.put("value", ((Number) item.get("value")).intValue() * 2);
            doubled.put("done", done);
            data.add(doubled);
            if (done) break;
        }
        for (Map<String, Object> item : data) channel.send(item);
        channel.close();
        return data.size();
    }

    /**
     * Takes five values, pushes each back tripled and returns the tripled values.
     */
    public static List<Integer> threeTimesValues(Channel<Number> channel) {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            Number n = channel.receive();
            int v = n.intValue() * 3;
            out.add(v);
            channel.send(v);
        }
        return out;
    }
    // [/🧩 Section: channels]

    public static long count(List<String> items) {
        return items.size();
    }

    public static Object nothing() {
        return null;
    }

    public record Tagged(List<String> items) {
    }

    public static Tagged tag(Tagged tagged) {
        tagged.items().add("from-worker");
        return tagged;
    }

    public static int transfer(byte[] bytes) {
        int sum = 0;
        for (byte b : bytes) sum += b;
        return sum;
    }

    public static Object exit(int code) {
        WorkerRuntime.exitContext(code);
        return null;
    }

    public static String nestedGreet(String name) {
        String inner = Parallel.<String>run(MODULE, "greet", name).join();
        return "nested: " + inner;
    }
}
