package com.linesplit.harness;

import com.linesplit.Constants;
import com.linesplit.error.BenchException;
import com.linesplit.error.ErrorType;
import com.linesplit.probe.FakeProbe;
import com.linesplit.strategy.FieldSink;
import com.linesplit.strategy.ParseStrategy;
import com.linesplit.strategy.SliceStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimedRunExecutor")
class TimedRunExecutorTest {

    private static final long STEP = 7_000_000L;

    @Nested
    @DisplayName("Timing protocol")
    class TimingProtocol {

        @Test
        @DisplayName("should measure from iteration 1 to the end of the loop")
        void shouldMeasureSteadyState() throws BenchException {
            var probe = new FakeProbe(STEP);
            var result = new TimedRunExecutor(probe).run(new SliceStrategy(), Constants.REFERENCE_LINE, FieldSink.NOOP, 1_000);

            assertEquals(2, probe.getClockReads());
            assertEquals(STEP, result.getElapsedNanos());
            assertEquals(7.0, result.getElapsedMillis(), 1e-9);
        }

        @Test
        @DisplayName("should start the clock only after the warmup iteration")
        void shouldExcludeWarmupIteration() throws BenchException {
            var probe = new FakeProbe(STEP);
            var clockReadsAtCall = new ArrayList<Integer>();
            ParseStrategy recording = (line, sink) -> clockReadsAtCall.add(probe.getClockReads());

            new TimedRunExecutor(probe).run(recording, Constants.REFERENCE_LINE, FieldSink.NOOP, 3);

            assertThat(clockReadsAtCall).containsExactly(0, 1, 1);
            assertEquals(2, probe.getClockReads());
        }

        @Test
        @DisplayName("should report no measurement window for a single iteration")
        void shouldReportZeroForOneIteration() throws BenchException {
            var probe = new FakeProbe(STEP, 3, 64);
            var calls = new int[1];
            ParseStrategy counting = (line, sink) -> calls[0]++;

            var result = new TimedRunExecutor(probe).run(counting, Constants.REFERENCE_LINE, FieldSink.NOOP, 1);

            assertEquals(1, calls[0]);
            assertEquals(0, probe.getClockReads());
            assertEquals(0, result.getElapsedNanos());
            assertEquals(3, result.getCollectionDelta());
            assertEquals(64, result.getAllocatedBytes());
        }

        @Test
        @DisplayName("should do nothing for zero iterations")
        void shouldDoNothingForZeroIterations() throws BenchException {
            var probe = new FakeProbe(STEP, 3, 64);
            ParseStrategy failing = (line, sink) -> {
                throw new AssertionError("strategy must not run");
            };

            var result = new TimedRunExecutor(probe).run(failing, Constants.REFERENCE_LINE, FieldSink.NOOP, 0);

            assertEquals(0, probe.getClockReads());
            assertEquals(RunResult.EMPTY, result);
            assertEquals(0, result.getCollectionDelta());
            assertEquals(0, result.getAllocatedBytes());
        }
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("should report the counter deltas across the loop")
        void shouldReportDeltas() throws BenchException {
            var probe = new FakeProbe(STEP, 2, 4096);
            var result = new TimedRunExecutor(probe).run(new SliceStrategy(), Constants.REFERENCE_LINE, FieldSink.NOOP, 10);

            assertEquals(new RunResult(STEP, 2, 4096), result);
        }

        @Test
        @DisplayName("should report zero deltas when counters stand still")
        void shouldReportZeroDeltas() throws BenchException {
            var result = new TimedRunExecutor(new FakeProbe(STEP)).run(new SliceStrategy(), Constants.REFERENCE_LINE, FieldSink.NOOP, 10);

            assertEquals(0, result.getCollectionDelta());
            assertEquals(0, result.getAllocatedBytes());
        }
    }

    @Nested
    @DisplayName("Workload")
    class Workload {

        @Test
        @DisplayName("should invoke the sink once per iteration")
        void shouldInvokeSinkPerIteration() throws BenchException {
            var calls = new int[1];
            FieldSink counting = (method, resource, httpVersion) -> calls[0]++;

            new TimedRunExecutor(new FakeProbe(STEP)).run(new SliceStrategy(), Constants.REFERENCE_LINE, counting, 12_345);

            assertEquals(12_345, calls[0]);
        }

        @Test
        @DisplayName("should propagate strategy errors")
        void shouldPropagateStrategyErrors() {
            var executor = new TimedRunExecutor(new FakeProbe(STEP));

            var e = assertThrows(BenchException.class,
                    () -> executor.run(new SliceStrategy(), "GET", FieldSink.NOOP, 10));
            assertEquals(ErrorType.MALFORMED_INPUT, e.getErrorType());
        }

        @Test
        @DisplayName("should reject negative iteration counts")
        void shouldRejectNegativeIterations() {
            var executor = new TimedRunExecutor(new FakeProbe(STEP));

            var e = assertThrows(BenchException.class,
                    () -> executor.run(new SliceStrategy(), Constants.REFERENCE_LINE, FieldSink.NOOP, -1));
            assertEquals(ErrorType.INVALID_CONFIGURATION, e.getErrorType());
        }

        @Test
        @DisplayName("should reject a null probe")
        void shouldRejectNullProbe() {
            assertThrows(NullPointerException.class, () -> new TimedRunExecutor(null));
        }
    }
}
