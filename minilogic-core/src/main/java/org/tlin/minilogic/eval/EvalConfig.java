package org.tlin.minilogic.eval;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

import org.tlin.minilogic.MiniLogicException;
import org.tlin.minilogic.ir.IrScanner;

/**
 * Immutable evaluation settings shared by the evaluator, normalizer and verifier.
 * <p>
 * Settings can also be read from {@link Properties} (or JVM system properties) using the
 * {@code minilogic.*} keys below, e.g. {@code -Dminilogic.inLoopContext=true}.
 */
public final class EvalConfig {

    public static final String CALL_POLICY = "minilogic.callPolicy";
    public static final String CONTROL_FLOW_MODE = "minilogic.controlFlowMode";
    public static final String IN_LOOP_CONTEXT = "minilogic.inLoopContext";
    public static final String DEBUG_IR = "minilogic.debugIr";
    public static final String MAX_DEPTH = "minilogic.maxDepth";

    private static final EvalConfig DEFAULTS = builder().build();

    private final CallPolicy callPolicy;
    private final ControlFlowMode controlFlowMode;
    private final boolean inLoopContext;
    private final CondSolver condSolver;
    private final boolean debugIr;
    private final int maxDepth;

    private EvalConfig(Builder builder) {
        this.callPolicy = builder.callPolicy;
        this.controlFlowMode = builder.controlFlowMode;
        this.inLoopContext = builder.inLoopContext;
        this.condSolver = builder.condSolver;
        this.debugIr = builder.debugIr;
        this.maxDepth = builder.maxDepth;
    }

    /**
     * Opaque calls, early-return aware, outside any loop, {@link BasicCondSolver}.
     */
    public static EvalConfig defaults() {
        return DEFAULTS;
    }

    public static EvalConfig forLoopContext() {
        return builder().inLoopContext(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .callPolicy(callPolicy)
                .controlFlowMode(controlFlowMode)
                .inLoopContext(inLoopContext)
                .condSolver(condSolver)
                .debugIr(debugIr)
                .maxDepth(maxDepth);
    }

    public static EvalConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Read settings from {@code props}; absent keys keep their default.
     *
     * @throws MiniLogicException if a present value cannot be parsed
     */
    public static EvalConfig fromProperties(Properties props) {
        Builder builder = builder();
        String value = props.getProperty(CALL_POLICY);
        if (value != null) {
            builder.callPolicy(parseEnum(CallPolicy.class, CALL_POLICY, value));
        }
        value = props.getProperty(CONTROL_FLOW_MODE);
        if (value != null) {
            builder.controlFlowMode(parseEnum(ControlFlowMode.class, CONTROL_FLOW_MODE, value));
        }
        value = props.getProperty(IN_LOOP_CONTEXT);
        if (value != null) {
            builder.inLoopContext(parseBoolean(IN_LOOP_CONTEXT, value));
        }
        value = props.getProperty(DEBUG_IR);
        if (value != null) {
            builder.debugIr(parseBoolean(DEBUG_IR, value));
        }
        value = props.getProperty(MAX_DEPTH);
        if (value != null) {
            try {
                builder.maxDepth(Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                throw new MiniLogicException("Invalid value '" + value + "' for " + MAX_DEPTH, e);
            }
        }
        return builder.build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new MiniLogicException("Invalid value '" + value + "' for " + key, e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new MiniLogicException("Invalid value '" + value + "' for " + key);
    }

    public CallPolicy callPolicy() {
        return callPolicy;
    }

    public ControlFlowMode controlFlowMode() {
        return controlFlowMode;
    }

    public boolean inLoopContext() {
        return inLoopContext;
    }

    /**
     * May be {@code null}, in which case symbolic conditions go straight to branch merging.
     */
    public CondSolver condSolver() {
        return condSolver;
    }

    public boolean debugIr() {
        return debugIr;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public boolean isEarlyReturnAware() {
        return controlFlowMode == ControlFlowMode.EARLY_RETURN_AWARE;
    }

    public boolean allowsLoopControl() {
        return isEarlyReturnAware() && inLoopContext;
    }

    @Override
    public String toString() {
        return "EvalConfig{callPolicy=" + callPolicy
                + ", controlFlowMode=" + controlFlowMode
                + ", inLoopContext=" + inLoopContext
                + ", condSolver=" + (condSolver == null ? "none" : condSolver.getClass().getSimpleName())
                + ", debugIr=" + debugIr
                + ", maxDepth=" + maxDepth + "}";
    }

    public static final class Builder {
        private CallPolicy callPolicy = CallPolicy.OPAQUE;
        private ControlFlowMode controlFlowMode = ControlFlowMode.EARLY_RETURN_AWARE;
        private boolean inLoopContext;
        private CondSolver condSolver = BasicCondSolver.INSTANCE;
        private boolean debugIr;
        private int maxDepth = IrScanner.DEFAULT_MAX_DEPTH;

        private Builder() {}

        public Builder callPolicy(CallPolicy callPolicy) {
            this.callPolicy = Objects.requireNonNull(callPolicy, "callPolicy");
            return this;
        }

        public Builder controlFlowMode(ControlFlowMode controlFlowMode) {
            this.controlFlowMode = Objects.requireNonNull(controlFlowMode, "controlFlowMode");
            return this;
        }

        public Builder inLoopContext(boolean inLoopContext) {
            this.inLoopContext = inLoopContext;
            return this;
        }

        public Builder condSolver(CondSolver condSolver) {
            this.condSolver = condSolver;
            return this;
        }

        public Builder debugIr(boolean debugIr) {
            this.debugIr = debugIr;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth < 1) {
                throw new MiniLogicException("maxDepth must be positive, got " + maxDepth);
            }
            this.maxDepth = maxDepth;
            return this;
        }

        public EvalConfig build() {
            return new EvalConfig(this);
        }
    }
}
