// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

/**
 * Recipient layout of a send draft.
 */
public enum SendMode {
    /** One destination; supports max send. */
    SINGLE,
    /** Two or more destinations in one transaction. */
    MULTI
}
