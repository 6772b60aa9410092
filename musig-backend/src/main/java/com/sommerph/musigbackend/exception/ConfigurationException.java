package com.sommerph.musigbackend.exception;

public class ConfigurationException extends MultisigWalletException {

    public ConfigurationException(WalletErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ConfigurationException(WalletErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

}
