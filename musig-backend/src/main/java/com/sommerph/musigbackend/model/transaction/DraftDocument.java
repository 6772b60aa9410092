package com.sommerph.musigbackend.model.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DraftDocument {

    private String unsignedTransactionHex;
    private List<InputDocument> inputs = new ArrayList<>();
    private List<SignatureDocument> signatures = new ArrayList<>();
    private String finalizedTransactionHex;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class InputDocument {
        private String form;
        private String txid;
        private long vout;
        private long amount;
        private String committedScriptHex;
        private String previousTransactionHex;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignatureDocument {
        private int inputIndex;
        private String publicKeyHex;
        private String signatureHex;
    }

}
