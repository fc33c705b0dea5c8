package com.e2eq.cnl.exceptions;

/**
 * Thrown when a mutation names an id that does not exist, would remove a protected
 * morph, or would leave another record pointing at something that no longer exists.
 * <p>
 * The mutation that raised it has not been applied.
 * </p>
 */
public class ReferentialException extends CnlGraphException {
    private static final long serialVersionUID = 1L;

    private final ReferentialErrorKind kind;
    private final String referenceId;

    public ReferentialException(ReferentialErrorKind kind, String referenceId, String message) {
        super(message);
        this.kind = kind;
        this.referenceId = referenceId;
    }

    public static ReferentialException notFound(String what, String id) {
        return new ReferentialException(ReferentialErrorKind.NOT_FOUND, id,
                String.format("%s '%s' does not exist", what, id));
    }

    public static ReferentialException protectedMorph(String morphId) {
        return new ReferentialException(ReferentialErrorKind.PROTECTED_MORPH, morphId,
                String.format("Morph '%s' is the basic morph of its node and cannot be deleted", morphId));
    }

    public static ReferentialException dangling(String id, String message) {
        return new ReferentialException(ReferentialErrorKind.DANGLING_REFERENCE, id, message);
    }

    public ReferentialErrorKind getKind() {
        return kind;
    }

    /**
     * The id that could not be resolved or is still referenced.
     */
    public String getReferenceId() {
        return referenceId;
    }
}
