package io.unistr.benchmarks;

import io.unistr.storage.UniqueStringHandle;
import io.unistr.store.UniqueStrings;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

/**
 * Benchmark for building a store from a repetitive token stream and reading it back.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 2, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class UniqueStringsBenchmark {

    @Param({"10000", "100000", "1000000"})
    public int tokenCount;

    @Param({"50", "5000"})
    public int distinctTokens;

    private String[] tokens;
    private UniqueStrings frozen;
    private UniqueStringHandle[] handles;

    @Setup(Level.Trial)
    public void setup() {
        tokens = UserAgentTokens.generate(tokenCount, distinctTokens);

        frozen = UniqueStrings.create();
        handles = new UniqueStringHandle[tokenCount];
        for (int i = 0; i < tokenCount; i++) {
            handles[i] = frozen.add(tokens[i]);
        }
        frozen.freeze();
    }

    @TearDown(Level.Trial)
    public void tearDown() {
        if (frozen != null) {
            frozen.destroy();
        }
    }

    @Benchmark
    public void buildAndFreeze(Blackhole blackhole) {
        try (UniqueStrings store = UniqueStrings.create()) {
            for (String token : tokens) {
                blackhole.consume(store.add(token));
            }
            store.freeze();
            blackhole.consume(store.stats());
        }
    }

    @Benchmark
    public void resolveFrozen(Blackhole blackhole) {
        for (UniqueStringHandle handle : handles) {
            blackhole.consume(frozen.resolve(handle));
        }
    }

    @Benchmark
    public void ownsFrozen(Blackhole blackhole) {
        for (UniqueStringHandle handle : handles) {
            blackhole.consume(frozen.owns(frozen.address(handle)));
        }
    }
}
