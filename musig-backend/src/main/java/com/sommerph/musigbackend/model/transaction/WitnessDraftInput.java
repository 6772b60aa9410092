package com.sommerph.musigbackend.model.transaction;

import org.bitcoinj.core.Coin;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionWitness;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;

import java.util.List;

public class WitnessDraftInput extends DraftInput {

    public WitnessDraftInput(String txid, long vout, long amount, byte[] committedScript) {
        super(txid, vout, amount, committedScript);
    }

    @Override
    public InputForm getForm() {
        return InputForm.WITNESS;
    }

    @Override
    public Sha256Hash signingDigest(Transaction transaction, int inputIndex, Script redeemScript) {
        return transaction.hashForWitnessSignature(inputIndex, redeemScript, Coin.valueOf(getAmount()),
                Transaction.SigHash.ALL, false);
    }

    @Override
    public void applyUnlocking(TransactionInput input, List<byte[]> signatures, Script redeemScript) {
        TransactionWitness witness = new TransactionWitness(signatures.size() + 2);
        witness.setPush(0, new byte[0]);
        for (int i = 0; i < signatures.size(); i++) {
            witness.setPush(i + 1, signatures.get(i));
        }
        witness.setPush(signatures.size() + 1, redeemScript.getProgram());
        input.setWitness(witness);
        input.setScriptSig(ScriptBuilder.createEmpty());
    }

}
