// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.examples;

import java.util.List;

import sh.sigil.core.SigilDebug;
import sh.sigil.core.crypto.PrivateKeySigner;
import sh.sigil.core.crypto.Signature;
import sh.sigil.core.error.AuthorizationException;
import sh.sigil.core.types.Address;
import sh.sigil.core.types.HexData;
import sh.sigil.core.types.Wei;
import sh.sigil.multisig.CallRouter;
import sh.sigil.multisig.Execute;
import sh.sigil.multisig.InvocationResult;
import sh.sigil.multisig.MultisigConfig;
import sh.sigil.multisig.MultisigWallet;
import sh.sigil.multisig.UpdateQuorum;
import sh.sigil.multisig.UpdateSigner;
import sh.sigil.multisig.client.SignatureBundle;
import sh.sigil.multisig.client.SignatureBundleJson;
import sh.sigil.multisig.client.SignatureCollector;
import sh.sigil.multisig.client.SignatureRequest;
import sh.sigil.multisig.client.SignatureRequests;
import sh.sigil.multisig.client.SignerSetReplay;

/**
 * Walks through the full approval protocol of a 2-of-3 wallet.
 *
 * <p>This example demonstrates:
 * <ol>
 *   <li>Configuring a wallet and its signing domain</li>
 *   <li>Publishing a typed-data signing request and decoding it on the signer side</li>
 *   <li>Collecting signatures in submission order and exchanging them as JSON</li>
 *   <li>Executing a call, then rotating a signer and raising the quorum</li>
 *   <li>Seeing a replayed approval rejected</li>
 * </ol>
 *
 * <p>Usage:
 * <pre>
 * mvn -pl sigil-examples -am exec:java \
 *     -Dexec.mainClass=sh.sigil.examples.MultisigWalkthroughExample
 * </pre>
 */
public final class MultisigWalkthroughExample {

    // Anvil development accounts #0 to #3
    private static final PrivateKeySigner ALICE =
        new PrivateKeySigner("0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80");
    private static final PrivateKeySigner BOB =
        new PrivateKeySigner("0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d");
    private static final PrivateKeySigner CAROL =
        new PrivateKeySigner("0x5de4111afa1a4b94908f83103eb1f1706367c2e68ca870fc3fb9a804cdab365a");
    private static final PrivateKeySigner DAVE =
        new PrivateKeySigner("0x7c852118294e51e653712a81e05800f419141751be58f605c371e15141b007a6");

    private static final Address WALLET = new Address("0x5fbdb2315678afecb367f032d93f642f64180aa3");
    private static final Address VAULT = new Address("0xe7f1725e7734ce288f8367e1bb143e90bb3f0512");

    private MultisigWalkthroughExample() {
        // Prevent instantiation
    }

    public static void main(String[] args) {
        System.out.println("=== Multisig Walkthrough ===\n");
        SigilDebug.setExecutionLogging(true);

        // =====================================================================
        // Step 1: Configure a 2-of-3 wallet
        // =====================================================================
        System.out.println("[1] Creating wallet");

        CallRouter router = new CallRouter()
            .register(VAULT, (value, payload) -> {
                System.out.println("  Vault received " + value.value() + " wei, payload " + payload.value());
                return InvocationResult.ok(new HexData("0x01"));
            });

        MultisigConfig config = MultisigConfig.builder()
            .name("Sigil Treasury")
            .chainId(1L)
            .address(WALLET)
            .signers(List.of(ALICE.address(), BOB.address(), CAROL.address()))
            .quorum(2)
            .build();
        MultisigWallet wallet = MultisigWallet.create(config, router);

        SignerSetReplay signerSet = new SignerSetReplay(config.signers());
        wallet.addListener(signerSet);
        wallet.addListener(event -> System.out.println("  Event " + event + " topic0=" + event.topic0().value()));

        wallet.deposit(Wei.of(1_000_000));
        System.out.println("  Domain separator: " + wallet.domainSeparator().value());
        System.out.println("  Quorum: " + wallet.quorum() + ", nonce: " + wallet.nonce());

        // =====================================================================
        // Step 2: Publish a signing request
        // =====================================================================
        System.out.println("\n[2] Publishing signing request");

        Execute execute = new Execute(VAULT, Wei.of(250_000), new HexData("0xd0e30db0"));
        String requestJson = SignatureRequests.toJson(wallet.domain(), execute, wallet.nonce());
        System.out.println(requestJson);

        SignatureRequest request = SignatureRequests.parse(requestJson);
        System.out.println("  Signers approve digest " + request.digest().value());

        // =====================================================================
        // Step 3: Collect signatures and exchange them
        // =====================================================================
        System.out.println("\n[3] Collecting signatures");

        SignatureCollector collector = new SignatureCollector(wallet.domain());
        List<Signature> signatures = collector.collect(request.action(), request.nonce(), List.of(CAROL, ALICE));
        String bundleJson = SignatureBundleJson.toJson(
            new SignatureBundle(request.action().primaryType(), request.nonce(), signatures));
        System.out.println("  Bundle: " + bundleJson);

        // =====================================================================
        // Step 4: Submit
        // =====================================================================
        System.out.println("\n[4] Executing");

        SignatureBundle bundle = SignatureBundleJson.parse(bundleJson);
        HexData result = wallet.submit(request.action(), bundle.signatures());
        System.out.println("  Returned " + result.value() + ", balance " + wallet.balance().value()
            + ", nonce " + wallet.nonce());

        // =====================================================================
        // Step 5: Replay is rejected
        // =====================================================================
        System.out.println("\n[5] Replaying the same approvals");
        try {
            wallet.submit(request.action(), bundle.signatures());
        } catch (AuthorizationException e) {
            System.out.println("  Rejected: " + e.getMessage());
        }

        // =====================================================================
        // Step 6: Governance
        // =====================================================================
        System.out.println("\n[6] Rotating Bob out for Dave, then raising quorum to 3");

        UpdateSigner addDave = new UpdateSigner(DAVE.address(), true);
        wallet.submit(addDave, collector.collect(addDave, wallet.nonce(), List.of(ALICE, BOB)));

        UpdateSigner removeBob = new UpdateSigner(BOB.address(), false);
        wallet.submit(removeBob, collector.collect(removeBob, wallet.nonce(), List.of(CAROL, DAVE)));

        UpdateQuorum raise = new UpdateQuorum(3);
        wallet.submit(raise, collector.collect(raise, wallet.nonce(), List.of(ALICE, DAVE)));

        System.out.println("  Quorum: " + wallet.quorum() + ", nonce: " + wallet.nonce());
        System.out.println("  Trusted signers: " + signerSet.trusted());
        System.out.println("  Bob still trusted: " + wallet.isSigner(BOB.address()));

        System.out.println("\n=== Done ===");
    }
}
