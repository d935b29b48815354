package org.tlin.minilogic;

import java.util.List;
import java.util.stream.Collectors;

import org.tlin.minilogic.verify.VerificationResult;

/**
 * Outcome of {@link MiniLogic#batchVerify(List)}; results keep the input order.
 */
public final class BatchVerificationReport {

    private final List<TransformationResult> results;

    BatchVerificationReport(List<TransformationResult> results) {
        this.results = List.copyOf(results);
    }

    public List<TransformationResult> results() {
        return results;
    }

    public int total() {
        return results.size();
    }

    public int equivalent() {
        return count(VerificationResult.EQUIVALENT);
    }

    public int notEquivalent() {
        return count(VerificationResult.NOT_EQUIVALENT);
    }

    public int unknown() {
        return count(VerificationResult.UNKNOWN);
    }

    public List<TransformationResult> safeTransformations() {
        return select(VerificationResult.EQUIVALENT);
    }

    public List<TransformationResult> unsafeTransformations() {
        return select(VerificationResult.NOT_EQUIVALENT);
    }

    public List<TransformationResult> unknownTransformations() {
        return select(VerificationResult.UNKNOWN);
    }

    public String summary() {
        return String.format("Verified %d transformations: %d equivalent, %d not equivalent, %d unknown",
                total(), equivalent(), notEquivalent(), unknown());
    }

    private int count(VerificationResult result) {
        return select(result).size();
    }

    private List<TransformationResult> select(VerificationResult result) {
        return results.stream()
                .filter(r -> r.report().result() == result)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return summary();
    }
}
