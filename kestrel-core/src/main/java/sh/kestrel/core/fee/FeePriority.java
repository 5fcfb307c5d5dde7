// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.fee;

/**
 * Confirmation-target presets offered for fee selection.
 */
public enum FeePriority {
    FASTEST,
    HALF_HOUR,
    HOUR,
    MINIMUM
}
