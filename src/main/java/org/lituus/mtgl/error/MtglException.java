package org.lituus.mtgl.error;

/**
 * Unchecked carrier of an {@link MtglError}.
 */
public final class MtglException extends RuntimeException {
    private final MtglError error;

    public MtglException(MtglError error) {
        super(error.message());
        this.error = error;
    }

    public MtglError error() {
        return error;
    }
}
