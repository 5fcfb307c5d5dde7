// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.kestrel.core.address;

import java.util.Objects;

/**
 * Type and network of a checksum-valid address.
 *
 * @param type    the script family
 * @param network the network
 */
public record AddressInfo(AddressType type, Network network) {

    public AddressInfo {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(network, "network");
    }
}
