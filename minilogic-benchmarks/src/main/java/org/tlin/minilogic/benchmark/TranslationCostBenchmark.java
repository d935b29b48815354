package org.tlin.minilogic.benchmark;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.tlin.minilogic.MiniLogic;
import org.tlin.minilogic.benchmark.domain.RewriteFixtures;
import org.tlin.minilogic.eval.EvalConfig;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.javaparser.RewriteGate;
import org.tlin.minilogic.javaparser.SnippetTranslator;

/**
 * Parsing and lowering cost of source snippets, alone and as part of a full gate decision.
 * Shows how much of a gate check is spent outside verification.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dminilogic.debugIr=false"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TranslationCostBenchmark {

    @State(Scope.Thread)
    public static class TranslatorState {

        SnippetTranslator translator;
        RewriteGate gate;

        @Setup(Level.Trial)
        public void init() {
            translator = new SnippetTranslator();
            gate = new RewriteGate(MiniLogic.withConfig(EvalConfig.fromSystemProperties()), translator);
        }
    }

    @Benchmark
    public Optional<Stmt> translateNested(TranslatorState state) {
        return state.translator.translate(RewriteFixtures.NESTED_SNIPPET);
    }

    @Benchmark
    public boolean gateFlatteningRewrite(TranslatorState state) {
        return state.gate.isSafeRewrite(RewriteFixtures.NESTED_SNIPPET, RewriteFixtures.FLAT_SNIPPET);
    }
}
