package com.sommerph.musigbackend.model.transaction;

import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.Utils;
import org.bitcoinj.script.Script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An unsigned spending transaction plus the partial signatures collected for each input.
 * <p>
 * Once {@link #markFinalized(String)} has been called the draft is terminal: no further
 * signatures are accepted and the finalized encoding never changes.
 */
public class TransactionDraft {

    private final Transaction transaction;
    private final List<DraftInput> inputs;
    private final List<List<PartialSignature>> partialSignatures;
    private String finalizedTransaction;

    public TransactionDraft(Transaction transaction, List<DraftInput> inputs) {
        if (transaction.getInputs().size() != inputs.size()) {
            throw new IllegalArgumentException("Draft inputs do not match transaction inputs");
        }
        this.transaction = transaction;
        this.inputs = List.copyOf(inputs);
        this.partialSignatures = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            partialSignatures.add(new ArrayList<>());
        }
    }

    public int getInputCount() {
        return inputs.size();
    }

    public List<DraftInput> getInputs() {
        return inputs;
    }

    public int getOutputCount() {
        return transaction.getOutputs().size();
    }

    public Sha256Hash signingDigest(int inputIndex, Script redeemScript) {
        return inputs.get(inputIndex).signingDigest(transaction, inputIndex, redeemScript);
    }

    public synchronized void addPartialSignature(int inputIndex, PartialSignature signature) {
        if (finalizedTransaction != null) {
            throw new IllegalStateException("Transaction is already finalized");
        }
        partialSignatures.get(inputIndex).add(signature);
    }

    public synchronized List<PartialSignature> getPartialSignatures(int inputIndex) {
        return Collections.unmodifiableList(new ArrayList<>(partialSignatures.get(inputIndex)));
    }

    public synchronized int getSignatureCount() {
        return partialSignatures.stream().mapToInt(List::size).sum();
    }

    /**
     * A fresh copy of the unsigned transaction, safe to fill with unlocking data.
     */
    public Transaction copyUnsignedTransaction() {
        return new Transaction(transaction.getParams(), transaction.bitcoinSerialize());
    }

    public String getUnsignedTransactionHex() {
        return Utils.HEX.encode(transaction.bitcoinSerialize());
    }

    public synchronized boolean isFinalized() {
        return finalizedTransaction != null;
    }

    public synchronized String getFinalizedTransaction() {
        return finalizedTransaction;
    }

    public synchronized void markFinalized(String transactionHex) {
        if (finalizedTransaction != null && !finalizedTransaction.equals(transactionHex)) {
            throw new IllegalStateException("Transaction is already finalized");
        }
        finalizedTransaction = transactionHex;
    }

}
