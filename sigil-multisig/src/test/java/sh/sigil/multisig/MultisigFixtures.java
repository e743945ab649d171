// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.multisig;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import sh.sigil.core.crypto.PrivateKeySigner;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.types.Address;
import sh.sigil.multisig.client.SignatureCollector;

/**
 * Well-known development keys and wallet fixtures shared by the wallet tests.
 */
public final class MultisigFixtures {

    public static final Address WALLET = new Address("0x5fbdb2315678afecb367f032d93f642f64180aa3");
    public static final Address TARGET = new Address("0xe7f1725e7734ce288f8367e1bb143e90bb3f0512");

    private static final String[] KEYS = {
        "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80",
        "0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d",
        "0x5de4111afa1a4b94908f83103eb1f1706367c2e68ca870fc3fb9a804cdab365a",
        "0x7c852118294e51e653712a81e05800f419141751be58f605c371e15141b007a6",
        "0x47e179ec197488593b187f80a00eb0da91f1b9d0b13f8733639f19c30a34926a",
        "0x8b3a350cf5c34c9194ca85829a2df0ec3153be0318b5e2d3348e872092edffba",
        "0x92db14e403b83dfe3df233f83dfa3a0d7096f21ca9b0d6d6b8d88b2b4ec1564e",
        "0x4bbbf85ce3377467afe5d46f804f221813b2bb87f24d81f60f1fcdbf7cbf4356",
        "0xdbda1821b80551c9d65939329250298aa3472ba22feea921c0cf5d620ea67b97",
        "0x2a871d0798f97d79848a013d4936a73bf4cc922c825d33c1cf7073dff6d409c6",
    };

    private MultisigFixtures() {}

    public static PrivateKeySigner signer(final int index) {
        return new PrivateKeySigner(KEYS[index]);
    }

    /** Signers {@code 0..count-1}. */
    public static List<PrivateKeySigner> first(final int count) {
        final List<PrivateKeySigner> signers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            signers.add(signer(i));
        }
        return signers;
    }

    public static List<PrivateKeySigner> signers(final int... indexes) {
        return Arrays.stream(indexes).mapToObj(MultisigFixtures::signer).toList();
    }

    public static List<Address> addresses(final List<PrivateKeySigner> signers) {
        return signers.stream().map(PrivateKeySigner::address).toList();
    }

    public static MultisigConfig config(final List<PrivateKeySigner> trusted, final long quorum) {
        return MultisigConfig.builder()
            .name("Sigil")
            .chainId(1L)
            .address(WALLET)
            .signers(addresses(trusted))
            .quorum(quorum)
            .build();
    }

    /** Sorted signatures over {@code action} at the wallet's current nonce. */
    public static List<Signature> approve(
            final MultisigWallet wallet, final MultisigAction action, final List<PrivateKeySigner> signers) {
        return approve(wallet, action, wallet.nonce(), signers);
    }

    public static List<Signature> approve(
            final MultisigWallet wallet, final MultisigAction action, final long nonce,
            final List<PrivateKeySigner> signers) {
        return new SignatureCollector(wallet.domainSeparator()).collect(action, nonce, signers);
    }
}
