package com.sommerph.musigbackend.support;

import com.sommerph.musigbackend.model.transaction.SpendableOutput;
import com.sommerph.musigbackend.model.wallet.BitcoinNetwork;
import com.sommerph.musigbackend.model.wallet.MultisigPolicy;
import com.sommerph.musigbackend.model.wallet.MultisigWallet;
import com.sommerph.musigbackend.service.script.MultisigScriptService;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed keys and funding outputs shared by the signing and assembly tests.
 */
public final class WalletFixtures {

    public static final String TESTNET_DESTINATION = "tb1qw508d6qejxtdg4y5r3zarvary0c5xw7kxpjzsx";
    public static final String FUNDING_TXID = "a1b2c3d4e5f60718293a4b5c6d7e8f90112233445566778899aabbccddeeff00";

    private WalletFixtures() {
    }

    public static ECKey key(long secret) {
        return ECKey.fromPrivate(BigInteger.valueOf(secret));
    }

    public static List<ECKey> keys(long... secrets) {
        List<ECKey> keys = new ArrayList<>();
        for (long secret : secrets) {
            keys.add(key(secret));
        }
        return keys;
    }

    public static List<byte[]> publicKeys(List<ECKey> keys) {
        List<byte[]> publicKeys = new ArrayList<>();
        keys.forEach(key -> publicKeys.add(key.getPubKey()));
        return publicKeys;
    }

    public static MultisigWallet wallet(String walletId, int threshold, List<ECKey> keys, BitcoinNetwork network) {
        MultisigScriptService scriptService = new MultisigScriptService();
        MultisigPolicy policy = scriptService.buildPolicy(threshold, publicKeys(keys));
        Script redeemScript = scriptService.buildScript(policy);
        return new MultisigWallet(walletId, network, policy, redeemScript,
                scriptService.deriveAddresses(redeemScript, network.getParameters()), null, List.of());
    }

    public static byte[] p2wshProgram(Script redeemScript) {
        return new ScriptBuilder().smallNum(0).data(Sha256Hash.hash(redeemScript.getProgram())).build().getProgram();
    }

    public static byte[] p2shProgram(Script redeemScript) {
        return ScriptBuilder.createP2SHOutputScript(redeemScript).getProgram();
    }

    public static SpendableOutput witnessUtxo(MultisigWallet wallet, long amount) {
        return new SpendableOutput(FUNDING_TXID, 0, amount, p2wshProgram(wallet.getRedeemScript()));
    }

    /**
     * A funding transaction that pays {@code amount} to the wallet's P2SH script at output 0.
     */
    public static Transaction fundingTransaction(MultisigWallet wallet, long amount) {
        NetworkParameters params = wallet.getNetwork().getParameters();
        Transaction funding = new Transaction(params);
        funding.addInput(new TransactionInput(params, funding, new byte[]{0x51}));
        funding.addOutput(Coin.valueOf(amount), new Script(p2shProgram(wallet.getRedeemScript())));
        return funding;
    }

    public static SpendableOutput legacyUtxo(MultisigWallet wallet, long amount) {
        Transaction funding = fundingTransaction(wallet, amount);
        return new SpendableOutput(funding.getTxId().toString(), 0, amount,
                p2shProgram(wallet.getRedeemScript()), funding.bitcoinSerialize());
    }

}
