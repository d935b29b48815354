package org.tlin.minilogic;

import org.tlin.minilogic.verify.VerificationReport;

public record TransformationResult(TransformationContext context, VerificationReport report) {
}
