// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.address;

/**
 * Output script family implied by an address.
 *
 * @since 0.1.0
 */
public enum AddressType {
    /** Legacy pay-to-pubkey-hash (Base58Check). */
    P2PKH,
    /** Pay-to-script-hash (Base58Check). */
    P2SH,
    /** Segwit v0 key hash (Bech32, 20-byte program). */
    P2WPKH,
    /** Segwit v0 script hash (Bech32, 32-byte program). */
    P2WSH,
    /** Taproot, segwit v1 (Bech32m). */
    P2TR,
    /** Checksum-valid segwit address with an unrecognised program length or version. */
    WITNESS_UNKNOWN;

    public boolean isSegwit() {
        return this == P2WPKH || this == P2WSH || this == P2TR || this == WITNESS_UNKNOWN;
    }
}
