// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sigil.core.error;

/**
 * Fewer signatures were supplied than the quorum requires.
 * <p>
 * Verification reads exactly {@code quorum} entries, so this is raised at the
 * first index past the end of the supplied list, after every earlier entry has
 * been checked. It is kept separate from {@link InvalidSignaturesException};
 * an EVM verifier reports the same condition as {@code Panic(0x32)}.
 *
 * @since 0.1.0
 */
public final class MissingSignaturesException extends AuthorizationException {

    /** Panic code for an out-of-bounds array access. */
    public static final int PANIC_CODE = 0x32;

    private final long required;
    private final int supplied;

    public MissingSignaturesException(final long required, final int supplied) {
        super("Missing signatures: quorum requires " + required + ", got " + supplied);
        this.required = required;
        this.supplied = supplied;
    }

    public long required() {
        return required;
    }

    public int supplied() {
        return supplied;
    }
}
