package org.tlin.minilogic.verify;

import java.util.List;
import java.util.StringJoiner;

import org.tlin.minilogic.eval.CallRecord;
import org.tlin.minilogic.eval.Result;
import org.tlin.minilogic.value.Env;

/**
 * Renders evaluation results for diagnostics, in a compact single-line form and in the
 * multi-line form used by {@link IrReport}.
 */
public final class ResultFormatter {

    private ResultFormatter() {}

    public static String format(Result result) {
        if (result instanceof Result.Continue c) {
            return "Continue(env=" + c.env() + ", calls=" + formatCalls(c.calls()) + ")";
        }
        if (result instanceof Result.Return r) {
            return "Return(value=" + r.value().render() + ", calls=" + formatCalls(r.calls()) + ")";
        }
        if (result instanceof Result.Break || result instanceof Result.ContinueLoop) {
            return result.kind().label() + "(calls=" + formatCalls(result.calls()) + ")";
        }
        return "Unknown";
    }

    public static String pretty(Result result) {
        if (result instanceof Result.Continue c) {
            return "Continue(\n  env = " + prettyEnv(c.env()) + "\n  calls = " + formatCalls(c.calls()) + "\n)";
        }
        if (result instanceof Result.Return r) {
            return "Return(\n  value = " + r.value().render() + "\n  calls = " + formatCalls(r.calls()) + "\n)";
        }
        if (result instanceof Result.Break || result instanceof Result.ContinueLoop) {
            return result.kind().label() + "(\n  calls = " + formatCalls(result.calls()) + "\n)";
        }
        return "Unknown";
    }

    static String formatCalls(List<CallRecord> calls) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (CallRecord call : calls) {
            joiner.add(call.toString());
        }
        return joiner.toString();
    }

    private static String prettyEnv(Env env) {
        if (env.visibleNames().isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder("{");
        for (String name : env.visibleNames()) {
            sb.append("\n    ").append(name).append(" = ")
              .append(env.get(name).map(v -> v.render()).orElse("nil"));
        }
        return sb.append("\n  }").toString();
    }
}
