package org.tlin.minilogic.benchmark;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.tlin.minilogic.MiniLogic;
import org.tlin.minilogic.benchmark.domain.RewriteFixtures;
import org.tlin.minilogic.eval.EvalConfig;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.verify.VerificationReport;

/**
 * Cost of one equivalence check for the rewrite shapes the lint rules emit. Chains use
 * symbolic conditions, so every level goes through branch merging.
 */
@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dminilogic.debugIr=false"
})
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 5, time = 2)
public class VerificationBenchmark {

    @State(Scope.Thread)
    public static class ChainState {

        @Param({"2", "8", "32"})
        int length;

        MiniLogic miniLogic;
        Stmt nested;
        Stmt flat;

        @Setup(Level.Trial)
        public void build() {
            miniLogic = MiniLogic.withConfig(EvalConfig.fromSystemProperties());
            nested = RewriteFixtures.nestedChain(length);
            flat = RewriteFixtures.flatChain(length);
        }
    }

    @State(Scope.Thread)
    public static class StraightLineState {

        MiniLogic miniLogic;
        Stmt body;

        @Setup(Level.Trial)
        public void build() {
            miniLogic = MiniLogic.withConfig(EvalConfig.fromSystemProperties());
            body = RewriteFixtures.straightLine(1_000);
        }
    }

    @Benchmark
    public VerificationReport verifyChainFlattening(ChainState state) {
        return state.miniLogic.verify(state.nested, state.flat);
    }

    @Benchmark
    public Stmt flattenAllChains(ChainState state) {
        return state.miniLogic.flattenAllIfElseChains(state.nested);
    }

    @Benchmark
    public VerificationReport verifyLongSequence(StraightLineState state) {
        return state.miniLogic.verify(state.body, state.body);
    }
}
