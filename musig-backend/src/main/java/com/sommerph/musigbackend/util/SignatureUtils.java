package com.sommerph.musigbackend.util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.Arrays;

import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1InputStream;
import org.bouncycastle.asn1.ASN1Sequence;

public class SignatureUtils {

    /**
     * Sighash flag of a transaction signature (the byte appended after the DER body).
     */
    public static int sigHashFlag(byte[] transactionSignature) {
        if (transactionSignature == null || transactionSignature.length < 2) {
            throw new IllegalArgumentException("Transaction signature is too short");
        }
        return transactionSignature[transactionSignature.length - 1] & 0xff;
    }

    public static byte[] derBody(byte[] transactionSignature) {
        sigHashFlag(transactionSignature);
        return Arrays.copyOf(transactionSignature, transactionSignature.length - 1);
    }

    public static EcdsaSignature decodeDerSignature(byte[] derBytes) {
        try (ASN1InputStream asn1InputStream = new ASN1InputStream(new ByteArrayInputStream(derBytes))) {
            ASN1Sequence sequence = (ASN1Sequence) asn1InputStream.readObject();
            BigInteger r = ((ASN1Integer) sequence.getObjectAt(0)).getValue();
            BigInteger s = ((ASN1Integer) sequence.getObjectAt(1)).getValue();
            return new EcdsaSignature(r, s);
        } catch (IOException | ClassCastException e) {
            throw new IllegalArgumentException("Failed to parse DER-encoded ECDSA signature", e);
        }
    }

    public static boolean verify(Sha256Hash digest, byte[] transactionSignature, byte[] publicKey) {
        EcdsaSignature signature = decodeDerSignature(derBody(transactionSignature));
        return ECKey.verify(digest.getBytes(), new ECKey.ECDSASignature(signature.getR(), signature.getS()), publicKey);
    }

    public static class EcdsaSignature {
        private final BigInteger r;
        private final BigInteger s;

        public EcdsaSignature(BigInteger r, BigInteger s) {
            this.r = r;
            this.s = s;
        }

        public BigInteger getR() {
            return r;
        }

        public BigInteger getS() {
            return s;
        }
    }

}
