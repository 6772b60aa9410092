package com.sommerph.musigbackend.model.wallet;

import org.bitcoinj.script.Script;

import java.util.List;

public class MultisigWallet {

    private final String walletId;
    private final BitcoinNetwork network;
    private final MultisigPolicy policy;
    private final Script redeemScript;
    private final WalletAddresses addresses;
    private final String derivationPathPrefix;
    private final List<String> derivationPaths;
    private final SigningSession session = new SigningSession();

    public MultisigWallet(String walletId, BitcoinNetwork network, MultisigPolicy policy, Script redeemScript,
                          WalletAddresses addresses, String derivationPathPrefix, List<String> derivationPaths) {
        this.walletId = walletId;
        this.network = network;
        this.policy = policy;
        this.redeemScript = redeemScript;
        this.addresses = addresses;
        this.derivationPathPrefix = derivationPathPrefix;
        this.derivationPaths = List.copyOf(derivationPaths);
    }

    public String getWalletId() {
        return walletId;
    }

    public BitcoinNetwork getNetwork() {
        return network;
    }

    public MultisigPolicy getPolicy() {
        return policy;
    }

    public Script getRedeemScript() {
        return redeemScript;
    }

    public WalletAddresses getAddresses() {
        return new WalletAddresses(addresses.getP2sh(), addresses.getP2wsh());
    }

    public String getDerivationPathPrefix() {
        return derivationPathPrefix;
    }

    public List<String> getDerivationPaths() {
        return derivationPaths;
    }

    public SigningSession getSession() {
        return session;
    }

}
