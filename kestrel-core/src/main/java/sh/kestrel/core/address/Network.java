// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.address;

/**
 * Bitcoin network an address belongs to.
 *
 * @since 0.1.0
 */
public enum Network {
    MAINNET("bc"),
    TESTNET("tb");

    private final String bech32Hrp;

    Network(final String bech32Hrp) {
        this.bech32Hrp = bech32Hrp;
    }

    /**
     * Returns the human-readable part used by segwit addresses on this network.
     *
     * @return {@code "bc"} or {@code "tb"}
     */
    public String bech32Hrp() {
        return bech32Hrp;
    }
}
