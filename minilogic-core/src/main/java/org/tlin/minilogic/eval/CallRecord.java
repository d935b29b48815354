package org.tlin.minilogic.eval;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

import org.tlin.minilogic.value.Value;

/**
 * One opaque call observed along an execution path: the function name and its argument
 * values, evaluated left to right.
 */
public record CallRecord(String function, List<Value> args) {

    public CallRecord {
        Objects.requireNonNull(function, "function");
        args = List.copyOf(args);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", function + "(", ")");
        for (Value arg : args) {
            joiner.add(arg.render());
        }
        return joiner.toString();
    }
}
