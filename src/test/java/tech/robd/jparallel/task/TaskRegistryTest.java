/*
 [File Info]
 path: src/test/java/tech/robd/jparallel/task/TaskRegistryTest.java
 description: Task registry tests: id wraparound, routing, settlement and consumption modes.
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
package tech.robd.jparallel.task;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import tech.robd.jparallel.Channel;
import tech.robd.jparallel.Step;
import tech.robd.jparallel.error.ErrorCodec;
import tech.robd.jparallel.protocol.ErrorMessage;
import tech.robd.jparallel.protocol.GeneratorAck;
import tech.robd.jparallel.protocol.GeneratorRequest;
import tech.robd.jparallel.protocol.ProtocolMessage;
import tech.robd.jparallel.protocol.ReturnMessage;
import tech.robd.jparallel.protocol.YieldMessage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static tech.robd.jparallel.tools.TestAwaitUtils.await;
import static tech.robd.jparallel.tools.TestAwaitUtils.awaitFailure;

final class TaskRegistryTest {

    private final List<ProtocolMessage> sent = new CopyOnWriteArrayList<>();

    private Task dispatched(TaskRegistry registry) {
        Task task = registry.register("mod", "fn");
        task.bindSink(sent::add);
        return task;
    }

    // 🧩 Section: ids

    @Test
        // Ids restart at 1 after the ceiling once earlier tasks have settled.
    void idsWrapAroundAfterCeiling() {
        TaskRegistry registry = new TaskRegistry(new TaskIdSequence(3));
        for (long expected = 1; expected <= 3; expected++) {
            Task t = registry.register("mod", "fn");
            assertEquals(expected, t.id());
            t.settle(null);
        }
        assertEquals(1, registry.register("mod", "fn").id());
    }

    @Test
        // Wrapping onto a task still in flight is refused.
    void collisionWithInFlightTaskThrows() {
        TaskRegistry registry = new TaskRegistry(new TaskIdSequence(2));
        registry.register("mod", "a");
        registry.register("mod", "b");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> registry.register("mod", "c"));
        assertTrue(e.getMessage().contains("still in flight"));
        assertEquals(2, registry.size());
    }

    @Test
    void settledTasksLeaveTheRegistry() {
        TaskRegistry registry = new TaskRegistry();
        Task ok = registry.register("mod", "ok");
        Task bad = registry.register("mod", "bad");
        assertEquals(2, registry.size());

        ok.settle("done");
        bad.fail(new IllegalStateException("nope"));
        assertEquals(0, registry.size());
        assertTrue(registry.get(ok.id()).isEmpty());
        assertFalse(registry.route(new ReturnMessage(ok.id(), "late")));
    }
    // [/🧩 Section: ids]

    // 🧩 Section: settlement

    @Test
    @Timeout(2)
    void returnSettlesWithValue() {
        TaskRegistry registry = new TaskRegistry();
        Task task = dispatched(registry);
        assertTrue(registry.route(new ReturnMessage(task.id(), "Hi")));
        assertEquals("Hi", await(task.outcome(), 500));
        assertFalse(await(task.generator(), 500));
        assertFalse(task.settle("again"));
    }

    @Test
    @Timeout(2)
    void errorFailsWithDecodedException() {
        TaskRegistry registry = new TaskRegistry();
        Task task = dispatched(registry);
        registry.route(new ErrorMessage(task.id(), ErrorCodec.toObject(new ArithmeticException("/ by zero"))));

        Throwable failure = awaitFailure(task.outcome(), 500);
        assertInstanceOf(ArithmeticException.class, failure);
        assertEquals("/ by zero", failure.getMessage());
    }
    // [/🧩 Section: settlement]

    // 🧩 Section: consumption-modes

    @Test
    @Timeout(2)
        // Result mode drives the generator itself: next after the ack and after each yield.
    void resultModeDrivesGenerator() {
        TaskRegistry registry = new TaskRegistry();
        Task task = dispatched(registry);
        task.selectResult();

        registry.route(new GeneratorAck(task.id()));
        registry.route(new YieldMessage(task.id(), "foo", false));
        registry.route(new YieldMessage(task.id(), "bar", false));
        registry.route(new YieldMessage(task.id(), "foo, bar", true));

        assertEquals("foo, bar", await(task.outcome(), 500));
        assertEquals(3, sent.size());
        for (ProtocolMessage m : sent) {
            assertEquals(GeneratorRequest.Kind.NEXT, assertInstanceOf(GeneratorRequest.class, m).kind());
        }
    }

    @Test
    @Timeout(2)
        // Selecting result mode after the ack starts driving right away.
    void lateResultSelectionStartsDriving() {
        TaskRegistry registry = new TaskRegistry();
        Task task = dispatched(registry);
        registry.route(new GeneratorAck(task.id()));
        assertTrue(sent.isEmpty());

        task.selectResult();
        assertEquals(1, sent.size());
    }

    @Test
    @Timeout(2)
        // Iterate mode pushes every step to the output channel and sends nothing on its own.
    void iterateModeQueuesSteps() {
        TaskRegistry registry = new TaskRegistry();
        Task task = dispatched(registry);
        Channel<Step<Object>> out = task.selectIterate();

        registry.route(new GeneratorAck(task.id()));
        registry.route(new YieldMessage(task.id(), "foo", false));
        registry.route(new YieldMessage(task.id(), "end", true));

        assertTrue(sent.isEmpty());
        assertEquals(Step.of("foo"), out.receive());
        assertEquals(Step.done("end"), out.receive());
        assertThrows(Channel.ClosedReceiveException.class, out::receive);
        assertEquals("end", await(task.outcome(), 500));
    }

    @Test
    void modesExcludeEachOther() {
        TaskRegistry registry = new TaskRegistry();
        Task iterating = dispatched(registry);
        iterating.selectIterate();
        IllegalStateException e1 = assertThrows(IllegalStateException.class, iterating::selectResult);
        assertEquals("iterate() has been called", e1.getMessage());

        Task awaiting = dispatched(registry);
        awaiting.selectResult();
        awaiting.selectResult();
        IllegalStateException e2 = assertThrows(IllegalStateException.class, awaiting::selectIterate);
        assertEquals("result() has been called", e2.getMessage());
        assertEquals(Task.Mode.RESULT, awaiting.mode());
    }

    @Test
    void plainValueIsNotIterable() {
        TaskRegistry registry = new TaskRegistry();
        Task task = dispatched(registry);
        task.settle(42);
        IllegalStateException e = assertThrows(IllegalStateException.class, task::selectIterate);
        assertEquals("the response is not iterable", e.getMessage());
    }

    @Test
    @Timeout(2)
        // A failure closes the output channel with the error.
    void failureReachesIterator() {
        TaskRegistry registry = new TaskRegistry();
        Task task = dispatched(registry);
        Channel<Step<Object>> out = task.selectIterate();
        registry.route(new GeneratorAck(task.id()));
        task.fail(new IllegalStateException("gone"));

        IllegalStateException e = assertThrows(IllegalStateException.class, out::receive);
        assertEquals("gone", e.getMessage());
    }

    @Test
    void requestBeforeDispatchIsRejected() {
        TaskRegistry registry = new TaskRegistry();
        Task task = registry.register("mod", "fn");
        assertThrows(IllegalStateException.class, () -> task.request(GeneratorRequest.Kind.NEXT, null));
    }
    // [/🧩 Section: consumption-modes]
}
