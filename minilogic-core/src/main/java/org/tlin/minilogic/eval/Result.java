package org.tlin.minilogic.eval;

import java.util.List;
import java.util.Objects;

import org.tlin.minilogic.value.Env;
import org.tlin.minilogic.value.Value;

/**
 * Outcome of executing a statement. Every variant carries the ordered calls made along
 * the path that produced it.
 */
public sealed interface Result {

    ResultKind kind();

    List<CallRecord> calls();

    default boolean isTerminating() {
        ResultKind kind = kind();
        return kind == ResultKind.RETURN || kind == ResultKind.BREAK || kind == ResultKind.CONTINUE_LOOP;
    }

    static Result continueWith(Env env, List<CallRecord> calls) {
        return new Continue(env, calls);
    }

    static Result returning(Value value, List<CallRecord> calls) {
        return new Return(value, calls);
    }

    static Result breaking(List<CallRecord> calls) {
        return new Break(calls);
    }

    static Result continuingLoop(List<CallRecord> calls) {
        return new ContinueLoop(calls);
    }

    static Result unknown() {
        return Unknown.INSTANCE;
    }

    record Continue(Env env, List<CallRecord> calls) implements Result {
        public Continue {
            Objects.requireNonNull(env, "env");
            calls = List.copyOf(calls);
        }

        @Override
        public ResultKind kind() {
            return ResultKind.CONTINUE;
        }

        @Override
        public String toString() {
            return "Continue(" + env + ")";
        }
    }

    record Return(Value value, List<CallRecord> calls) implements Result {
        public Return {
            Objects.requireNonNull(value, "value");
            calls = List.copyOf(calls);
        }

        @Override
        public ResultKind kind() {
            return ResultKind.RETURN;
        }

        @Override
        public String toString() {
            return "Return(" + value.render() + ")";
        }
    }

    record Break(List<CallRecord> calls) implements Result {
        public Break {
            calls = List.copyOf(calls);
        }

        @Override
        public ResultKind kind() {
            return ResultKind.BREAK;
        }

        @Override
        public String toString() {
            return "Break";
        }
    }

    record ContinueLoop(List<CallRecord> calls) implements Result {
        public ContinueLoop {
            calls = List.copyOf(calls);
        }

        @Override
        public ResultKind kind() {
            return ResultKind.CONTINUE_LOOP;
        }

        @Override
        public String toString() {
            return "ContinueLoop";
        }
    }

    record Unknown() implements Result {
        static final Unknown INSTANCE = new Unknown();

        @Override
        public ResultKind kind() {
            return ResultKind.UNKNOWN;
        }

        @Override
        public List<CallRecord> calls() {
            return List.of();
        }

        @Override
        public String toString() {
            return "Unknown";
        }
    }
}
