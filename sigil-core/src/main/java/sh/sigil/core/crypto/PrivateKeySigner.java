// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.crypto;

import java.util.Objects;

import sh.sigil.core.types.Address;
import sh.sigil.core.types.Hash;

/**
 * {@link Signer} backed by a raw secp256k1 private key.
 */
public final class PrivateKeySigner implements Signer {

    private final PrivateKey privateKey;
    private final Address address;

    /**
     * Creates a signer from a hex-encoded private key.
     *
     * @param privateKeyHex the private key (with or without 0x prefix)
     * @throws IllegalArgumentException if the private key is invalid
     */
    public PrivateKeySigner(final String privateKeyHex) {
        this(PrivateKey.fromHex(privateKeyHex));
    }

    public PrivateKeySigner(final PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        this.address = privateKey.toAddress();
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Signature signHash(final Hash digest) {
        Objects.requireNonNull(digest, "digest");
        return privateKey.sign(digest.toBytes()).withOffsetV();
    }

    @Override
    public String toString() {
        return "PrivateKeySigner[address=" + address.value() + "]";
    }
}
