package io.bowler.core.error;

/**
 * Classification assigned by {@link ExceptionTranslator}.
 */
public enum ErrorKind {

    /** Topology declaration conflicts with state already held by the broker. */
    DECLARATION_MISMATCH,

    /** Connection, authentication or protocol negotiation failure. */
    INVALID_SETUP,

    /** Any other failure surfaced from the broker boundary. */
    BOWLER_GENERAL
}
