package com.sommerph.musigbackend.model.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.bitcoinj.core.Utils;

@Data
@AllArgsConstructor
public class PartialSignature {

    private final byte[] publicKey;
    private final byte[] signature;

    public String publicKeyHex() {
        return Utils.HEX.encode(publicKey);
    }

}
