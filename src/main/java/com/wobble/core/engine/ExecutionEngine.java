package com.wobble.core.engine;

import com.wobble.core.events.EventBroadcastHub;
import com.wobble.core.events.RunFinished;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.core.events.TestStarted;
import com.wobble.core.framework.NativeOutcome;
import com.wobble.core.framework.TestFramework;
import com.wobble.core.logging.MdcContext;
import com.wobble.core.model.ErrorDetail;
import com.wobble.core.model.RunSummary;
import com.wobble.core.model.TestStatus;
import com.wobble.core.model.TestUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Drives the test framework over the selected units, one at a time, on the calling thread.
 * <p>
 * Every event is published through the {@link EventBroadcastHub} from this thread, in the order the
 * things it describes happen. A unit that faults is recorded as errored and the loop moves on; the
 * run itself never aborts because of one unit. Cancellation stops the loop before the next unit and
 * still produces a {@link RunFinished} with the partial summary. A thread interrupt that is pending
 * when the next unit is about to start cancels the run as well; one raised inside a unit is cleared
 * once the unit returns.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final TestFramework framework;
    private final EventBroadcastHub hub;
    private final Clock clock;

    public ExecutionEngine(TestFramework framework, EventBroadcastHub hub) {
        this(framework, hub, Clock.systemUTC());
    }

    ExecutionEngine(TestFramework framework, EventBroadcastHub hub, Clock clock) {
        this.framework = framework;
        this.hub = hub;
        this.clock = clock;
    }

    /**
     * Runs the units in order and returns the summary that was published with {@link RunFinished}.
     *
     * @param runId        identifier for the run
     * @param command      command line reported with {@link RunStarted}
     * @param units        units to run, in execution order
     * @param cancellation checked before each unit
     */
    public RunSummary run(String runId, String command, List<TestUnit> units, CancellationToken cancellation) {
        MdcContext.setRun(runId);
        try {
            Instant startedAt = clock.instant();
            long startNanos = System.nanoTime();
            hub.publish(new RunStarted(runId, units.size(), command, startedAt));
            log.info("Run {} started with {} unit(s)", runId, units.size());

            SummaryAccumulator accumulator = new SummaryAccumulator();
            for (TestUnit unit : units) {
                if (Thread.interrupted()) {
                    log.warn("Run {} thread interrupted between units", runId);
                    cancellation.cancel();
                }
                if (cancellation.isCancelled()) {
                    log.warn("Run {} cancelled after {} of {} unit(s)", runId, accumulator.completed(), units.size());
                    break;
                }
                TestFinished finished = executeUnit(runId, unit);
                accumulator.record(finished);
                hub.publish(finished);
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            RunSummary summary = accumulator.summarize(startedAt, clock.instant(), elapsed, cancellation.isCancelled());
            hub.publish(new RunFinished(runId, summary, clock.instant()));
            log.info("Run {} finished: {} run, {} failed, {} errored, {} skipped in {}ms",
                    runId, summary.testsRun(), summary.failed(), summary.errored(), summary.skipped(),
                    elapsed.toMillis());
            return summary;
        } finally {
            MdcContext.clear();
        }
    }

    private TestFinished executeUnit(String runId, TestUnit unit) {
        MdcContext.setUnit(runId, unit.id());
        try {
            hub.publish(new TestStarted(unit, clock.instant()));
            long start = System.nanoTime();

            if (unit.isLoadFailure()) {
                ErrorDetail failure = unit.loadFailure();
                return new TestFinished(unit, TestStatus.ERRORED, Duration.ofNanos(System.nanoTime() - start),
                        failure.message(), failure, clock.instant());
            }

            NativeOutcome outcome;
            try {
                outcome = framework.execute(unit.handle());
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable t) {
                log.warn("Framework fault while executing {}: {}", unit.id(), t.toString());
                outcome = NativeOutcome.error(t);
            } finally {
                // an interrupt flag left behind by the test body belongs to that test, not to the run
                if (Thread.interrupted()) {
                    log.debug("Cleared interrupt flag left set by {}", unit.id());
                }
            }
            Duration duration = Duration.ofNanos(System.nanoTime() - start);

            TestStatus status = OutcomeTranslator.toStatus(outcome);
            log.debug("{} -> {} in {}ms", unit.id(), status, duration.toMillis());
            return new TestFinished(unit, status, duration, messageOf(status, outcome),
                    errorOf(status, outcome, unit), clock.instant());
        } finally {
            MdcContext.clearUnit();
        }
    }

    private static String messageOf(TestStatus status, NativeOutcome outcome) {
        if (status == TestStatus.PASSED) return null;
        if (outcome == null) return "No outcome reported by the test framework";
        if (outcome.reason() != null) return outcome.reason();
        return outcome.cause() != null ? outcome.cause().toString() : null;
    }

    private static ErrorDetail errorOf(TestStatus status, NativeOutcome outcome, TestUnit unit) {
        if (!status.isProblem()) return null;
        if (outcome == null || outcome.cause() == null) {
            String message = outcome == null ? "No outcome reported by the test framework"
                    : String.valueOf(outcome.reason());
            return new ErrorDetail("UnknownFault", message, message, null);
        }
        return ErrorDetail.from(outcome.cause(), unit.className());
    }
}
