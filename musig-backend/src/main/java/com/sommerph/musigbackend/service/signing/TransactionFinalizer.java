package com.sommerph.musigbackend.service.signing;

import com.sommerph.musigbackend.exception.FatalEncodingException;
import com.sommerph.musigbackend.exception.VerificationException;
import com.sommerph.musigbackend.exception.WalletErrorCode;
import com.sommerph.musigbackend.model.transaction.PartialSignature;
import com.sommerph.musigbackend.model.transaction.TransactionDraft;
import com.sommerph.musigbackend.model.wallet.MultisigPolicy;
import com.sommerph.musigbackend.model.wallet.MultisigWallet;
import com.sommerph.musigbackend.util.SignatureUtils;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.Utils;
import org.bitcoinj.script.Script;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class TransactionFinalizer {

    public boolean verify(MultisigWallet wallet, TransactionDraft draft) {
        MultisigPolicy policy = wallet.getPolicy();
        for (int i = 0; i < draft.getInputCount(); i++) {
            List<PartialSignature> signatures = draft.getPartialSignatures(i);
            if (signatures.size() < policy.getThreshold()) {
                return false;
            }
            Set<String> signers = new HashSet<>();
            for (PartialSignature signature : signatures) {
                if (!signers.add(signature.publicKeyHex())) {
                    return false;
                }
                if (!policy.containsKey(signature.getPublicKey())) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Builds the fully unlocked transaction and returns its hex wire encoding. The draft is only
     * touched once everything has succeeded, when it is marked finalized; calling this again on a
     * finalized draft returns the same encoding.
     */
    public String finalizeTransaction(MultisigWallet wallet, TransactionDraft draft) {
        synchronized (draft) {
            if (draft.isFinalized()) {
                return draft.getFinalizedTransaction();
            }
            log.info("Finalize transaction for wallet {}", wallet.getWalletId());
            if (!verify(wallet, draft)) {
                throw new VerificationException(WalletErrorCode.VERIFICATION_FAILED, "Transaction verification failed");
            }

            Script redeemScript = wallet.getRedeemScript();
            try {
                Transaction transaction = draft.copyUnsignedTransaction();
                for (int i = 0; i < draft.getInputCount(); i++) {
                    List<byte[]> signatures = selectSignatures(wallet.getPolicy(), draft, i, redeemScript);
                    draft.getInputs().get(i).applyUnlocking(transaction.getInput(i), signatures, redeemScript);
                }
                String transactionHex = Utils.HEX.encode(transaction.bitcoinSerialize());
                draft.markFinalized(transactionHex);
                return transactionHex;
            } catch (FatalEncodingException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Transaction finalization failed for wallet {}", wallet.getWalletId(), e);
                throw new FatalEncodingException(WalletErrorCode.FINALIZATION_FAILURE, "Transaction finalization failed: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Picks m signatures for one input, ordered like their keys in the redeem script, which is
     * the order OP_CHECKMULTISIG consumes them in.
     */
    private List<byte[]> selectSignatures(MultisigPolicy policy, TransactionDraft draft, int inputIndex, Script redeemScript) {
        List<PartialSignature> recorded = draft.getPartialSignatures(inputIndex);
        Sha256Hash digest = draft.signingDigest(inputIndex, redeemScript);
        List<byte[]> selected = new ArrayList<>(policy.getThreshold());
        for (byte[] key : policy.getOrderedKeys()) {
            PartialSignature match = recorded.stream()
                    .filter(signature -> Arrays.equals(signature.getPublicKey(), key))
                    .findFirst()
                    .orElse(null);
            if (match == null) {
                continue;
            }
            byte[] signature = match.getSignature();
            if (SignatureUtils.sigHashFlag(signature) != Transaction.SigHash.ALL.value) {
                throw new FatalEncodingException(WalletErrorCode.FINALIZATION_FAILURE,
                        "Signature of " + match.publicKeyHex() + " on input " + inputIndex + " is not SIGHASH_ALL");
            }
            if (!SignatureUtils.verify(digest, signature, key)) {
                throw new FatalEncodingException(WalletErrorCode.FINALIZATION_FAILURE,
                        "Signature of " + match.publicKeyHex() + " on input " + inputIndex + " does not verify");
            }
            selected.add(signature);
            if (selected.size() == policy.getThreshold()) {
                break;
            }
        }
        return selected;
    }

}
