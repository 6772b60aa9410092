package com.sommerph.musigbackend.exception;

public enum WalletErrorCode {

    // Configuration
    INVALID_THRESHOLD,
    INVALID_KEY_SET,
    INVALID_PATH,
    UNSUPPORTED_NETWORK,

    // Key recovery
    INVALID_BACKUP_PHRASE,
    INVALID_INDEX,

    // Authorization
    UNAUTHORIZED_SIGNER,
    DUPLICATE_SIGNATURE,

    // Funds
    EMPTY_INPUT_SET,
    EMPTY_OUTPUT_SET,
    NEGATIVE_FEE,
    INSUFFICIENT_FUNDS,
    INVALID_DESTINATION,
    NON_POSITIVE_OUTPUT_AMOUNT,
    INVALID_INPUT,

    VERIFICATION_FAILED,

    // Fatal encoding
    ADDRESS_DERIVATION_FAILURE,
    FINALIZATION_FAILURE,

    WALLET_NOT_FOUND,
    MALFORMED_DRAFT

}
