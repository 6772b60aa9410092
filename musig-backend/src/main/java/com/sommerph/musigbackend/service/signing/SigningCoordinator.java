package com.sommerph.musigbackend.service.signing;

import com.sommerph.musigbackend.exception.AuthorizationException;
import com.sommerph.musigbackend.exception.WalletErrorCode;
import com.sommerph.musigbackend.model.transaction.PartialSignature;
import com.sommerph.musigbackend.model.transaction.TransactionDraft;
import com.sommerph.musigbackend.model.wallet.MultisigWallet;
import com.sommerph.musigbackend.model.wallet.SigningSession;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.crypto.TransactionSignature;
import org.springframework.stereotype.Service;

/**
 * Collects partial signatures. Every signature is SIGHASH_ALL, committing to all inputs and outputs.
 * <p>
 * Policy violations (unknown signer, repeated signer) are thrown; a failure of the signing
 * step itself is logged and reported as {@code false} so batch-signing loops can carry on.
 */
@Slf4j
@Service
public class SigningCoordinator {

    public boolean submitSignature(MultisigWallet wallet, TransactionDraft draft, ECKey signer, int inputIndex) {
        log.info("Sign input {} for wallet {}", inputIndex, wallet.getWalletId());
        if (draft.isFinalized()) {
            throw new IllegalStateException("Transaction is already finalized");
        }
        byte[] publicKey = signer.getPubKey();
        if (!wallet.getPolicy().containsKey(publicKey)) {
            throw new AuthorizationException(WalletErrorCode.UNAUTHORIZED_SIGNER, "Signer is not part of the multisig setup");
        }

        SigningSession session = wallet.getSession();
        synchronized (session) {
            if (session.hasSigned(publicKey)) {
                throw new AuthorizationException(WalletErrorCode.DUPLICATE_SIGNATURE, "This key has already signed");
            }
            try {
                Sha256Hash digest = draft.signingDigest(inputIndex, wallet.getRedeemScript());
                TransactionSignature signature = new TransactionSignature(signer.sign(digest), Transaction.SigHash.ALL, false);
                draft.addPartialSignature(inputIndex, new PartialSignature(publicKey, signature.encodeToBitcoin()));
                session.markSigned(publicKey);
                return true;
            } catch (IllegalStateException e) {
                // finalized after the check above
                throw e;
            } catch (RuntimeException e) {
                log.error("Signing error on input {} for wallet {}", inputIndex, wallet.getWalletId(), e);
                return false;
            }
        }
    }

    public void resetSession(MultisigWallet wallet) {
        log.info("Reset signing session for wallet {}", wallet.getWalletId());
        wallet.getSession().reset();
    }

}
