package uk.gegc.planconfigurator.features.backend.domain.model;

public enum ErrorKind {
    /** No response received (connection refused, reset, DNS...). */
    NETWORK,
    /** No response within the per-attempt timeout. */
    TIMEOUT,
    /** Backend error in one of the recognised shapes. */
    BACKEND,
    /** Backend error in a shape no extractor understands. */
    UNPARSED_BACKEND,
    /** Backend payload does not match the mapping table. */
    SHAPE_MISMATCH,
    /** Non-public operation called without a token. */
    UNAUTHENTICATED,
    /** A newer call for the same slot was issued before this one settled. */
    SUPERSEDED
}
