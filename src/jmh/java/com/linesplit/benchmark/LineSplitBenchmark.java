package com.linesplit.benchmark;

import com.linesplit.Constants;
import com.linesplit.strategy.FieldSink;
import com.linesplit.strategy.IndexSubstringStrategy;
import com.linesplit.strategy.SliceStrategy;
import com.linesplit.strategy.SplitStrategy;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * JMH counterpart of the trial harness, for cross-checking its numbers.
 * Run with {@code -prof gc} to see allocation per operation; the slice strategy should report ~0 B/op.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
public class LineSplitBenchmark {

    private String line;
    private SplitStrategy split;
    private IndexSubstringStrategy substring;
    private SliceStrategy slice;
    private BlackholeSink sink;

    @Setup
    public void setup() {
        line = Constants.REFERENCE_LINE;
        split = new SplitStrategy();
        substring = new IndexSubstringStrategy();
        slice = new SliceStrategy();
        sink = new BlackholeSink();
    }

    @Benchmark
    public void split(Blackhole bh) throws Exception {
        split.parse(line, sink.to(bh));
    }

    @Benchmark
    public void substring(Blackhole bh) throws Exception {
        substring.parse(line, sink.to(bh));
    }

    @Benchmark
    public void slice(Blackhole bh) throws Exception {
        slice.parse(line, sink.to(bh));
    }

    /**
     * Hands every field to the current benchmark's {@link Blackhole}. Reused across invocations so the
     * slice strategy stays allocation free.
     */
    private static final class BlackholeSink implements FieldSink {
        private Blackhole bh;

        BlackholeSink to(Blackhole bh) {
            this.bh = bh;
            return this;
        }

        @Override
        public void accept(CharSequence method, CharSequence resource, CharSequence httpVersion) {
            bh.consume(method);
            bh.consume(resource);
            bh.consume(httpVersion);
        }
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(LineSplitBenchmark.class.getSimpleName())
                .build();

        new Runner(opt).run();
    }
}
