package com.sommerph.musigbackend.exception;

public class FundsException extends MultisigWalletException {

    public FundsException(WalletErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public FundsException(WalletErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

}
