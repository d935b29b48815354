package org.tlin.minilogic.value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A runtime value of the MiniLogic language. The variant set is closed.
 * <p>
 * Equality is structural per variant. Two {@link SymbolicValue}s are equal iff their
 * names are equal, so placeholders that render identically compare equal even when
 * they were synthesized from different sub-structures.
 */
public sealed interface Value {

    /**
     * Longest name {@link #derived} keeps verbatim.
     */
    int MAX_DERIVED_NAME_LENGTH = 256;

    /**
     * Source-like rendering used in reports and in the names of derived symbolic values.
     */
    String render();

    default boolean isSymbolic() {
        return this instanceof SymbolicValue;
    }

    /**
     * Truthiness of a concrete value used by {@code if}: booleans as-is, non-zero ints,
     * non-empty strings. {@code nil} is false. Symbolic values are never asked.
     */
    default boolean isTruthy() {
        if (this instanceof BoolValue b) {
            return b.value();
        }
        if (this instanceof IntValue i) {
            return i.value() != 0;
        }
        if (this instanceof StringValue s) {
            return !s.value().isEmpty();
        }
        return !(this instanceof NilValue);
    }

    static IntValue of(long value) {
        return new IntValue(value);
    }

    static BoolValue of(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    static StringValue of(String value) {
        return new StringValue(value);
    }

    static NilValue nil() {
        return NilValue.INSTANCE;
    }

    static SymbolicValue symbolic(String name) {
        return new SymbolicValue(name);
    }

    /**
     * Symbolic value for a name built from the renderings of other values. Names longer
     * than {@link #MAX_DERIVED_NAME_LENGTH} are replaced by {@code sym#} and the SHA-256 of
     * the full name, so repeated derivation stays bounded while equal names still map to
     * equal values.
     */
    static SymbolicValue derived(String name) {
        if (name.length() <= MAX_DERIVED_NAME_LENGTH) {
            return new SymbolicValue(name);
        }
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(name.getBytes(StandardCharsets.UTF_8));
            return new SymbolicValue("sym#" + HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    record IntValue(long value) implements Value {
        @Override
        public String render() {
            return Long.toString(value);
        }

        @Override
        public String toString() {
            return render();
        }
    }

    record BoolValue(boolean value) implements Value {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        @Override
        public String render() {
            return Boolean.toString(value);
        }

        @Override
        public String toString() {
            return render();
        }
    }

    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }

        @Override
        public String toString() {
            return render();
        }
    }

    record NilValue() implements Value {
        static final NilValue INSTANCE = new NilValue();

        @Override
        public String render() {
            return "nil";
        }

        @Override
        public String toString() {
            return render();
        }
    }

    /**
     * A value unknown at verification time, identified only by its name.
     */
    record SymbolicValue(String name) implements Value {
        public SymbolicValue {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String render() {
            return "<" + name + ">";
        }

        @Override
        public String toString() {
            return render();
        }
    }
}
