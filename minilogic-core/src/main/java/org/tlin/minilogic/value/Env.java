package org.tlin.minilogic.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * Variable store of the evaluator: a local frame of name to {@link Value} bindings plus an
 * optional parent frame.
 * <p>
 * The parent link exists only to scope variables declared by an {@code if} initializer to
 * that statement. Lookups resolve outward through the parent chain; {@link #set} always
 * writes the local frame and never touches a parent. {@link #copy()} duplicates the local
 * frame and shares the parent pointer, which is never mutated by the evaluator.
 */
public final class Env {

    private final Map<String, Value> vars;
    private final Env parent;

    private Env(Map<String, Value> vars, Env parent) {
        this.vars = vars;
        this.parent = parent;
    }

    public static Env empty() {
        return new Env(new LinkedHashMap<>(), null);
    }

    /**
     * Create an empty frame whose lookups fall back to {@code parent}.
     */
    public static Env childOf(Env parent) {
        return new Env(new LinkedHashMap<>(), Objects.requireNonNull(parent, "parent"));
    }

    public Env child() {
        return childOf(this);
    }

    /**
     * Resolve a variable through this frame and its parents.
     */
    public Optional<Value> get(String name) {
        for (Env env = this; env != null; env = env.parent) {
            Value value = env.vars.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public boolean contains(String name) {
        return get(name).isPresent();
    }

    /**
     * Bind {@code name} in the local frame.
     */
    public void set(String name, Value value) {
        vars.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    }

    /**
     * Copy of this frame with {@code name} bound locally; this frame is left untouched.
     */
    public Env with(String name, Value value) {
        Env copy = copy();
        copy.set(name, value);
        return copy;
    }

    public Env copy() {
        return new Env(new LinkedHashMap<>(vars), parent);
    }

    public Optional<Env> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Names bound in the local frame only.
     */
    public Set<String> localNames() {
        return Collections.unmodifiableSet(vars.keySet());
    }

    /**
     * Names visible through the whole parent chain, sorted.
     */
    public Set<String> visibleNames() {
        Set<String> names = new TreeSet<>();
        for (Env env = this; env != null; env = env.parent) {
            names.addAll(env.vars.keySet());
        }
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Env other)) {
            return false;
        }
        Set<String> names = visibleNames();
        names.addAll(other.visibleNames());
        for (String name : names) {
            if (!get(name).equals(other.get(name))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (String name : visibleNames()) {
            hash = 31 * hash + Objects.hash(name, get(name).orElse(null));
        }
        return hash;
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (String name : visibleNames()) {
            joiner.add(name + "=" + get(name).map(Value::render).orElse("nil"));
        }
        return joiner.toString();
    }
}
