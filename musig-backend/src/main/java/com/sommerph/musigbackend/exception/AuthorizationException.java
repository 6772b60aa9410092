package com.sommerph.musigbackend.exception;

public class AuthorizationException extends MultisigWalletException {

    public AuthorizationException(WalletErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public AuthorizationException(WalletErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

}
