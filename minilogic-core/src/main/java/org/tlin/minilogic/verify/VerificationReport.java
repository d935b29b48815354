package org.tlin.minilogic.verify;

import java.util.Objects;
import java.util.Optional;

public record VerificationReport(VerificationResult result, ReasonCode reason, String detail, IrReport ir) {

    public VerificationReport {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(reason, "reason");
        detail = detail == null ? "" : detail;
    }

    public static VerificationReport of(VerificationResult result, ReasonCode reason, String detail) {
        return new VerificationReport(result, reason, detail, null);
    }

    public static VerificationReport equivalent(String detail) {
        return of(VerificationResult.EQUIVALENT, ReasonCode.SAME_RESULT, detail);
    }

    public static VerificationReport notEquivalent(ReasonCode reason, String detail) {
        return of(VerificationResult.NOT_EQUIVALENT, reason, detail);
    }

    public static VerificationReport unknown(ReasonCode reason, String detail) {
        return of(VerificationResult.UNKNOWN, reason, detail);
    }

    public Optional<IrReport> irReport() {
        return Optional.ofNullable(ir);
    }

    public boolean isEquivalent() {
        return result == VerificationResult.EQUIVALENT;
    }

    public boolean isNotEquivalent() {
        return result == VerificationResult.NOT_EQUIVALENT;
    }

    public boolean isUnknown() {
        return result == VerificationResult.UNKNOWN;
    }

    VerificationReport withIr(IrReport report) {
        String base = detail.strip();
        String dump = "IR(original):\n" + indent(report.original()) + "\nIR(transformed):\n" + indent(report.transformed());
        return new VerificationReport(result, reason, base.isEmpty() ? dump : base + "\n" + dump, report);
    }

    private static String indent(String text) {
        return "  " + text.replace("\n", "\n  ");
    }

    @Override
    public String toString() {
        return result.label() + " (" + reason.description() + ")" + (detail.isEmpty() ? "" : ": " + detail);
    }
}
