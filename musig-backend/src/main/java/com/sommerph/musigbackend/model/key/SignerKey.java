package com.sommerph.musigbackend.model.key;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Utils;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SignerKey {

    private int index;
    private String derivationPath;

    private byte[] publicKey;
    // Absent once the key has been reduced to its public half
    private byte[] privateKey;

    private List<String> mnemonic;

    public boolean hasPrivateKey() {
        return privateKey != null;
    }

    public String publicKeyHex() {
        return Utils.HEX.encode(publicKey);
    }

    public ECKey toECKey() {
        return hasPrivateKey() ? ECKey.fromPrivate(privateKey) : ECKey.fromPublicOnly(publicKey);
    }

}
