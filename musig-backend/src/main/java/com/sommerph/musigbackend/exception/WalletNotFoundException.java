package com.sommerph.musigbackend.exception;

public class WalletNotFoundException extends MultisigWalletException {

    public WalletNotFoundException(WalletErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public WalletNotFoundException(WalletErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

}
