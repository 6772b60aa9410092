package com.sommerph.musigbackend.model.wallet;

import com.sommerph.musigbackend.exception.ConfigurationException;
import com.sommerph.musigbackend.exception.WalletErrorCode;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.params.RegTestParams;
import org.bitcoinj.params.TestNet3Params;

import java.util.Locale;

public enum BitcoinNetwork {

    MAINNET(MainNetParams.get(), 0),
    TESTNET(TestNet3Params.get(), 1),
    REGTEST(RegTestParams.get(), 1);

    private final NetworkParameters parameters;
    private final int coinType;

    BitcoinNetwork(NetworkParameters parameters, int coinType) {
        this.parameters = parameters;
        this.coinType = coinType;
    }

    public NetworkParameters getParameters() {
        return parameters;
    }

    public String defaultPathPrefix() {
        return "m/48'/" + coinType + "'/0'/2'";
    }

    public static BitcoinNetwork fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException(WalletErrorCode.UNSUPPORTED_NETWORK, "Network must be specified");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(WalletErrorCode.UNSUPPORTED_NETWORK, "Unsupported network: " + name, e);
        }
    }

}
