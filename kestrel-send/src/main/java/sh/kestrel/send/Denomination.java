// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.send;

/**
 * Unit in which the user types amounts.
 */
public enum Denomination {
    /** Whole satoshis; {@code ,} grouping separators are accepted. */
    SATS,
    /** Bitcoin with up to eight fractional digits. */
    BTC
}
