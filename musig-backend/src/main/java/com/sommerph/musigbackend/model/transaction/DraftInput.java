package com.sommerph.musigbackend.model.transaction;

import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.script.Script;

import java.util.List;

/**
 * An input of a draft, tagged with the form of the output it spends. The form is decided once
 * when the draft is assembled; each form knows its own signing digest and unlocking layout.
 */
public abstract class DraftInput {

    private final String txid;
    private final long vout;
    private final long amount;
    private final byte[] committedScript;

    protected DraftInput(String txid, long vout, long amount, byte[] committedScript) {
        this.txid = txid;
        this.vout = vout;
        this.amount = amount;
        this.committedScript = committedScript.clone();
    }

    public String getTxid() {
        return txid;
    }

    public long getVout() {
        return vout;
    }

    public long getAmount() {
        return amount;
    }

    public byte[] getCommittedScript() {
        return committedScript.clone();
    }

    public abstract InputForm getForm();

    public abstract Sha256Hash signingDigest(Transaction transaction, int inputIndex, Script redeemScript);

    /**
     * Writes the unlocking data: a dummy empty push, the signatures in key order, then the redeem script.
     */
    public abstract void applyUnlocking(TransactionInput input, List<byte[]> signatures, Script redeemScript);

}
