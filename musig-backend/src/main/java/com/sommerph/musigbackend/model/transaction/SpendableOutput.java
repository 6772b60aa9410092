package com.sommerph.musigbackend.model.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SpendableOutput {

    private final String txid;
    private final long vout;
    private final long amount;
    private final byte[] committedScript;
    private final byte[] previousTransaction;

    public SpendableOutput(String txid, long vout, long amount, byte[] committedScript) {
        this(txid, vout, amount, committedScript, null);
    }

}
