package com.sommerph.musigbackend.exception;

import lombok.Getter;

@Getter
public abstract class MultisigWalletException extends RuntimeException {

    private final WalletErrorCode errorCode;

    protected MultisigWalletException(WalletErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MultisigWalletException(WalletErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

}
