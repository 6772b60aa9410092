package com.sommerph.musigbackend.model.wallet;

import org.bitcoinj.core.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Threshold {@code m} over public keys held in canonical (unsigned byte-lexicographic) order.
 * Instances are only built by the script service, which validates and sorts the keys.
 */
public final class MultisigPolicy {

    private final int threshold;
    private final List<byte[]> orderedKeys;

    public MultisigPolicy(int threshold, List<byte[]> orderedKeys) {
        this.threshold = threshold;
        List<byte[]> copy = new ArrayList<>(orderedKeys.size());
        orderedKeys.forEach(key -> copy.add(key.clone()));
        this.orderedKeys = Collections.unmodifiableList(copy);
    }

    public int getThreshold() {
        return threshold;
    }

    public int getSignerCount() {
        return orderedKeys.size();
    }

    public List<byte[]> getOrderedKeys() {
        List<byte[]> copy = new ArrayList<>(orderedKeys.size());
        orderedKeys.forEach(key -> copy.add(key.clone()));
        return copy;
    }

    public List<String> getOrderedKeysHex() {
        List<String> hex = new ArrayList<>(orderedKeys.size());
        orderedKeys.forEach(key -> hex.add(Utils.HEX.encode(key)));
        return hex;
    }

    public int indexOf(byte[] publicKey) {
        for (int i = 0; i < orderedKeys.size(); i++) {
            if (Arrays.equals(orderedKeys.get(i), publicKey)) {
                return i;
            }
        }
        return -1;
    }

    public boolean containsKey(byte[] publicKey) {
        return indexOf(publicKey) >= 0;
    }

}
