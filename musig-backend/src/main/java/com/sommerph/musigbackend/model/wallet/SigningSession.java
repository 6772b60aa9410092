package com.sommerph.musigbackend.model.wallet;

import org.bitcoinj.core.Utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class SigningSession {

    private final Set<String> usedSigners = new LinkedHashSet<>();

    public synchronized boolean hasSigned(byte[] publicKey) {
        return usedSigners.contains(Utils.HEX.encode(publicKey));
    }

    public synchronized void markSigned(byte[] publicKey) {
        usedSigners.add(Utils.HEX.encode(publicKey));
    }

    public synchronized void reset() {
        usedSigners.clear();
    }

    public synchronized List<String> snapshot() {
        return new ArrayList<>(usedSigners);
    }

    public synchronized void restore(Collection<String> publicKeysHex) {
        usedSigners.clear();
        usedSigners.addAll(publicKeysHex);
    }

}
