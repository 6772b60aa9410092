package com.sommerph.musigbackend.exception;

public class InvalidDraftException extends MultisigWalletException {

    public InvalidDraftException(WalletErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public InvalidDraftException(WalletErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

}
