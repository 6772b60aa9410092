package com.sommerph.musigbackend.exception;

public class VerificationException extends MultisigWalletException {

    public VerificationException(WalletErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public VerificationException(WalletErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

}
