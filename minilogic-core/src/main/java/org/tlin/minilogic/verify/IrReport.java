package org.tlin.minilogic.verify;

/**
 * Pretty-printed evaluation results of both sides of a check, attached to a report when
 * IR debugging is enabled.
 */
public record IrReport(String original, String transformed) {
}
