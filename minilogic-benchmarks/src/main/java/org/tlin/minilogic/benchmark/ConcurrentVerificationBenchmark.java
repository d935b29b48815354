package org.tlin.minilogic.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.openjdk.jmh.annotations.*;
import org.tlin.minilogic.MiniLogic;
import org.tlin.minilogic.benchmark.domain.RewriteFixtures;
import org.tlin.minilogic.eval.EvalConfig;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.value.Env;
import org.tlin.minilogic.value.Value;
import org.tlin.minilogic.verify.VerificationReport;

/**
 * Two threads verifying against one shared verifier and one shared starting environment.
 * Gives a contention baseline for callers that verify fixes in parallel.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dminilogic.debugIr=false"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentVerificationBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        MiniLogic miniLogic;
        Env env;
        Stmt[][] pairs;

        @Setup(Level.Trial)
        public void init() {
            miniLogic = MiniLogic.withConfig(EvalConfig.fromSystemProperties());
            env = Env.empty();
            env.set("v0", Value.of(5));
            env.set("x", Value.of(0));
            pairs = new Stmt[][] {
                    {RewriteFixtures.nestedChain(8), RewriteFixtures.flatChain(8)},
                    {RewriteFixtures.straightLine(200), RewriteFixtures.straightLine(200)}
            };
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public VerificationReport concurrentVerifyDifferentRewrites(SharedState shared, ThreadState local) {
        Stmt[] pair = shared.pairs[local.threadIndex];
        return shared.miniLogic.verify(pair[0], pair[1], shared.env);
    }
}
