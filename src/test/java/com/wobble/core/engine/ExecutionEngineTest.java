package com.wobble.core.engine;

import com.wobble.core.discovery.DiscoveryEngine;
import com.wobble.core.discovery.DiscoveryFilter;
import com.wobble.core.discovery.DiscoveryRequest;
import com.wobble.core.events.EventBroadcastHub;
import com.wobble.core.events.EventType;
import com.wobble.core.events.ExecutionEvent;
import com.wobble.core.events.RunFinished;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.core.framework.NativeOutcome;
import com.wobble.core.framework.ReflectiveTestFramework;
import com.wobble.core.framework.TestFramework;
import com.wobble.core.model.CategorySource;
import com.wobble.core.model.ErrorDetail;
import com.wobble.core.model.RunSummary;
import com.wobble.core.model.TestCategory;
import com.wobble.core.model.TestStatus;
import com.wobble.core.model.TestUnit;
import com.wobble.fixtures.FixtureTrees;
import com.wobble.fixtures.SampleUnits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionEngineTest {

    private EventBroadcastHub hub;
    private List<ExecutionEvent> events;

    @BeforeEach
    void setUp() {
        hub = new EventBroadcastHub();
        events = new ArrayList<>();
        hub.register(events::add);
    }

    private List<TestFinished> finished() {
        return events.stream().filter(TestFinished.class::isInstance).map(TestFinished.class::cast).toList();
    }

    private List<TestUnit> units(int count) {
        List<TestUnit> units = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            units.add(SampleUnits.unit("com.acme.SampleCheck", "test" + i));
        }
        return units;
    }

    @Nested
    @DisplayName("with the reflective framework")
    class ReflectiveTests {

        @Test
        @DisplayName("errors and assertion failures are told apart and do not stop the run")
        void outcomes() throws Exception {
            try (ReflectiveTestFramework framework = new ReflectiveTestFramework(FixtureTrees.classesRoot(), List.of())) {
                List<TestUnit> units = new DiscoveryEngine(framework).discoverSelected(new DiscoveryRequest(
                        List.of(FixtureTrees.tree("outcomes")), "OutcomeCheck.class", DiscoveryFilter.all()));

                RunSummary summary = new ExecutionEngine(framework, hub)
                        .run("run-1", "wobble", units, new CancellationToken());

                Map<String, TestFinished> byMethod = finished().stream()
                        .collect(Collectors.toMap(f -> f.unit().methodName(), f -> f));
                TestFinished errored = byMethod.get("throwsUnexpectedly");
                assertEquals(TestStatus.ERRORED, errored.status());
                assertFalse(errored.trace().isEmpty());
                assertEquals("IllegalStateException", errored.error().type());
                assertTrue(errored.error().location().startsWith("OutcomeCheck.java:"));

                TestFinished failed = byMethod.get("assertionFails");
                assertEquals(TestStatus.FAILED, failed.status());
                assertTrue(failed.message().contains("sum is off"));

                assertEquals(TestStatus.PASSED, byMethod.get("passes").status());
                assertNull(byMethod.get("passes").message());
                assertEquals(TestStatus.SKIPPED, byMethod.get("skipsOnAssumption").status());
                assertEquals("not ready", byMethod.get("disabledTest").message());

                assertEquals(1, summary.passed());
                assertEquals(1, summary.failed());
                assertEquals(1, summary.errored());
                assertEquals(2, summary.skipped());
                assertEquals(units.size(), summary.testsRun());
                assertFalse(summary.interrupted());
            }
        }
    }

    @Nested
    @DisplayName("event stream")
    class EventStreamTests {

        @Test
        @DisplayName("emits RunStarted, started/finished per unit in order, then RunFinished")
        void eventOrder() {
            TestFramework framework = mock(TestFramework.class);
            when(framework.execute(any())).thenReturn(NativeOutcome.success());
            List<TestUnit> units = units(3);

            new ExecutionEngine(framework, hub).run("run-1", "wobble -c all", units, new CancellationToken());

            assertEquals(List.of(EventType.RUN_STARTED,
                    EventType.TEST_STARTED, EventType.TEST_FINISHED,
                    EventType.TEST_STARTED, EventType.TEST_FINISHED,
                    EventType.TEST_STARTED, EventType.TEST_FINISHED,
                    EventType.RUN_FINISHED), events.stream().map(ExecutionEvent::type).toList());
            assertEquals(units, finished().stream().map(TestFinished::unit).toList());

            RunStarted started = (RunStarted) events.get(0);
            assertEquals(3, started.plannedUnits());
            assertEquals("wobble -c all", started.command());
        }

        @Test
        @DisplayName("the published summary equals the returned one and carries timings")
        void summaryPublished() {
            TestFramework framework = mock(TestFramework.class);
            when(framework.execute(any())).thenReturn(NativeOutcome.success());

            RunSummary summary = new ExecutionEngine(framework, hub)
                    .run("run-1", "wobble", units(2), new CancellationToken());

            RunFinished runFinished = (RunFinished) events.get(events.size() - 1);
            assertEquals(summary, runFinished.summary());
            assertFalse(summary.timings().isEmpty());
            assertTrue(summary.timings().slowest().compareTo(summary.timings().fastest()) >= 0);
        }

        @Test
        @DisplayName("an empty selection still produces a complete stream")
        void emptyRun() {
            RunSummary summary = new ExecutionEngine(mock(TestFramework.class), hub)
                    .run("run-1", "wobble", List.of(), new CancellationToken());

            assertEquals(0, summary.testsRun());
            assertTrue(summary.timings().isEmpty());
            assertEquals(List.of(EventType.RUN_STARTED, EventType.RUN_FINISHED),
                    events.stream().map(ExecutionEvent::type).toList());
        }
    }

    @Nested
    @DisplayName("faults")
    class FaultTests {

        @Test
        @DisplayName("a throwable escaping the framework marks the unit errored and the run continues")
        void frameworkFault() {
            TestFramework framework = mock(TestFramework.class);
            List<TestUnit> units = units(2);
            when(framework.execute(units.get(0).handle())).thenThrow(new IllegalStateException("framework broke"));
            when(framework.execute(units.get(1).handle())).thenReturn(NativeOutcome.success());

            RunSummary summary = new ExecutionEngine(framework, hub).run("run-1", "wobble", units, new CancellationToken());

            assertEquals(TestStatus.ERRORED, finished().get(0).status());
            assertEquals("framework broke", finished().get(0).message());
            assertEquals(TestStatus.PASSED, finished().get(1).status());
            assertEquals(1, summary.errored());
            assertEquals(1, summary.passed());
        }

        @Test
        @DisplayName("load failure units are reported as errored without calling the framework")
        void loadFailures() {
            TestFramework framework = mock(TestFramework.class);
            TestUnit broken = TestUnit.loadFailure("com.acme.Broken", "com/acme/Broken.class",
                    TestCategory.UNCATEGORIZED, CategorySource.DEFAULT,
                    ErrorDetail.from(new NoClassDefFoundError("com/acme/Missing")));

            RunSummary summary = new ExecutionEngine(framework, hub)
                    .run("run-1", "wobble", List.of(broken), new CancellationToken());

            verify(framework, never()).execute(any());
            assertEquals(1, summary.errored());
            assertEquals("NoClassDefFoundError", finished().get(0).error().type());
        }

        @Test
        @DisplayName("a sink that throws on every event changes neither the summary nor the other sink's view")
        void sinkIsolation() {
            TestFramework framework = mock(TestFramework.class);
            when(framework.execute(any())).thenReturn(NativeOutcome.success(),
                    NativeOutcome.assertionFailure(new AssertionError("x")), NativeOutcome.success());
            EventBroadcastHub isolatedHub = new EventBroadcastHub();
            isolatedHub.register(event -> {
                throw new IllegalStateException("sink down");
            });
            List<ExecutionEvent> seen = new ArrayList<>();
            isolatedHub.register(seen::add);

            RunSummary withFaultySink = new ExecutionEngine(framework, isolatedHub)
                    .run("run-1", "wobble", units(3), new CancellationToken());

            assertEquals(8, seen.size());
            assertEquals(2, withFaultySink.passed());
            assertEquals(1, withFaultySink.failed());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("an interrupt mid-run finishes the current unit and reports only completed units")
        void midRunInterrupt() {
            TestFramework framework = mock(TestFramework.class);
            CancellationToken token = new CancellationToken();
            List<TestUnit> units = units(5);
            when(framework.execute(any())).thenReturn(NativeOutcome.success());
            when(framework.execute(units.get(1).handle())).thenAnswer(invocation -> {
                token.cancel();
                return NativeOutcome.success();
            });

            RunSummary summary = new ExecutionEngine(framework, hub).run("run-1", "wobble", units, token);

            assertTrue(summary.interrupted());
            assertEquals(2, summary.testsRun());
            assertEquals(2, finished().size());
            verify(framework, times(2)).execute(any());
            assertEquals(EventType.RUN_FINISHED, events.get(events.size() - 1).type());
        }

        @Test
        @DisplayName("a token cancelled before the run starts runs nothing")
        void cancelledUpFront() {
            TestFramework framework = mock(TestFramework.class);
            CancellationToken token = new CancellationToken();
            assertTrue(token.cancel());
            assertFalse(token.cancel());

            RunSummary summary = new ExecutionEngine(framework, hub).run("run-1", "wobble", units(3), token);

            assertTrue(summary.interrupted());
            assertEquals(0, summary.testsRun());
            verify(framework, never()).execute(any());
        }

        @Test
        @DisplayName("a thread interrupt pending before the next unit counts as cancellation")
        void threadInterrupt() {
            TestFramework framework = mock(TestFramework.class);
            when(framework.execute(any())).thenReturn(NativeOutcome.success());
            hub.register(event -> {
                if (event instanceof TestFinished) {
                    Thread.currentThread().interrupt();
                }
            });

            try {
                RunSummary summary = new ExecutionEngine(framework, hub)
                        .run("run-1", "wobble", units(3), new CancellationToken());
                assertTrue(summary.interrupted());
                assertEquals(1, summary.testsRun());
                assertEquals(EventType.RUN_FINISHED, events.get(events.size() - 1).type());
            } finally {
                Thread.interrupted();
            }
        }

        @Test
        @DisplayName("an interrupt flag left set by a test body is cleared and the run goes on")
        void interruptInsideUnit() {
            TestFramework framework = mock(TestFramework.class);
            when(framework.execute(any())).thenAnswer(invocation -> {
                Thread.currentThread().interrupt();
                return NativeOutcome.success();
            });

            RunSummary summary = new ExecutionEngine(framework, hub)
                    .run("run-1", "wobble", units(3), new CancellationToken());

            assertFalse(Thread.currentThread().isInterrupted());
            assertFalse(summary.interrupted());
            assertEquals(3, summary.passed());
            verify(framework, times(3)).execute(any());
        }
    }
}
