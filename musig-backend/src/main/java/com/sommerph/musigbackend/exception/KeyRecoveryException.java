package com.sommerph.musigbackend.exception;

public class KeyRecoveryException extends MultisigWalletException {

    public KeyRecoveryException(WalletErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public KeyRecoveryException(WalletErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

}
