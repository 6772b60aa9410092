package com.sommerph.musigbackend.exception;

public class FatalEncodingException extends MultisigWalletException {

    public FatalEncodingException(WalletErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public FatalEncodingException(WalletErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

}
