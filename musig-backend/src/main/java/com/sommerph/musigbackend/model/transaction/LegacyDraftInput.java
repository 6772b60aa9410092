package com.sommerph.musigbackend.model.transaction;

import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;

import java.util.List;

public class LegacyDraftInput extends DraftInput {

    private final byte[] previousTransaction;

    public LegacyDraftInput(String txid, long vout, long amount, byte[] committedScript, byte[] previousTransaction) {
        super(txid, vout, amount, committedScript);
        this.previousTransaction = previousTransaction.clone();
    }

    public byte[] getPreviousTransaction() {
        return previousTransaction.clone();
    }

    @Override
    public InputForm getForm() {
        return InputForm.LEGACY;
    }

    @Override
    public Sha256Hash signingDigest(Transaction transaction, int inputIndex, Script redeemScript) {
        return transaction.hashForSignature(inputIndex, redeemScript, Transaction.SigHash.ALL, false);
    }

    @Override
    public void applyUnlocking(TransactionInput input, List<byte[]> signatures, Script redeemScript) {
        ScriptBuilder builder = new ScriptBuilder().smallNum(0);
        signatures.forEach(builder::data);
        builder.data(redeemScript.getProgram());
        input.setScriptSig(builder.build());
    }

}
