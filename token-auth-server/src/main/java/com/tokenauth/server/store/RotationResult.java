package com.tokenauth.server.store;

public enum RotationResult {
    /** The presented hash was current and has been replaced. */
    ROTATED,
    /** A superseded refresh token was presented; the family is now revoked. */
    REUSE_DETECTED,
    /** The family had already been revoked. */
    REVOKED,
    /** No such family, or it was garbage collected. */
    NOT_FOUND
}
