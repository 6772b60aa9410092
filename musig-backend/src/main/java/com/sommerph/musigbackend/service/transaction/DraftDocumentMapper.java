package com.sommerph.musigbackend.service.transaction;

import com.sommerph.musigbackend.exception.InvalidDraftException;
import com.sommerph.musigbackend.exception.MultisigWalletException;
import com.sommerph.musigbackend.exception.WalletErrorCode;
import com.sommerph.musigbackend.model.transaction.DraftDocument;
import com.sommerph.musigbackend.model.transaction.DraftInput;
import com.sommerph.musigbackend.model.transaction.LegacyDraftInput;
import com.sommerph.musigbackend.model.transaction.PartialSignature;
import com.sommerph.musigbackend.model.transaction.SpendableOutput;
import com.sommerph.musigbackend.model.transaction.TransactionDraft;
import com.sommerph.musigbackend.model.wallet.MultisigWallet;
import com.sommerph.musigbackend.service.signing.TransactionFinalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionOutPoint;
import org.bitcoinj.core.Utils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class DraftDocumentMapper {

    private final TransactionAssemblyService assemblyService;
    private final TransactionFinalizer finalizer;

    public DraftDocument toDocument(TransactionDraft draft) {
        List<DraftDocument.InputDocument> inputs = new ArrayList<>();
        List<DraftDocument.SignatureDocument> signatures = new ArrayList<>();
        for (int i = 0; i < draft.getInputCount(); i++) {
            DraftInput input = draft.getInputs().get(i);
            String previousTransactionHex = switch (input.getForm()) {
                case LEGACY -> Utils.HEX.encode(((LegacyDraftInput) input).getPreviousTransaction());
                case WITNESS -> null;
            };
            inputs.add(new DraftDocument.InputDocument(
                    input.getForm().name(),
                    input.getTxid(),
                    input.getVout(),
                    input.getAmount(),
                    Utils.HEX.encode(input.getCommittedScript()),
                    previousTransactionHex
            ));
            for (PartialSignature signature : draft.getPartialSignatures(i)) {
                signatures.add(new DraftDocument.SignatureDocument(
                        i, signature.publicKeyHex(), Utils.HEX.encode(signature.getSignature())));
            }
        }
        return new DraftDocument(draft.getUnsignedTransactionHex(), inputs, signatures, draft.getFinalizedTransaction());
    }

    /**
     * Rebuilds a draft from a caller-supplied document. Input forms are re-derived from the
     * committed scripts, and a claimed final transaction is only accepted if finalizing the
     * recorded signatures reproduces it.
     */
    public TransactionDraft toDraft(MultisigWallet wallet, DraftDocument document) {
        if (document == null || document.getUnsignedTransactionHex() == null
                || document.getInputs() == null || document.getInputs().isEmpty()) {
            throw new InvalidDraftException(WalletErrorCode.MALFORMED_DRAFT, "Draft is missing its transaction or inputs");
        }
        NetworkParameters params = wallet.getNetwork().getParameters();
        try {
            Transaction transaction = new Transaction(params, Utils.HEX.decode(document.getUnsignedTransactionHex()));
            if (transaction.getInputs().size() != document.getInputs().size()) {
                throw new InvalidDraftException(WalletErrorCode.MALFORMED_DRAFT, "Draft inputs do not match its transaction");
            }

            List<DraftInput> inputs = new ArrayList<>();
            for (int i = 0; i < document.getInputs().size(); i++) {
                DraftDocument.InputDocument input = document.getInputs().get(i);
                TransactionOutPoint outPoint = transaction.getInput(i).getOutpoint();
                if (!outPoint.getHash().toString().equals(input.getTxid()) || outPoint.getIndex() != input.getVout()) {
                    throw new InvalidDraftException(WalletErrorCode.MALFORMED_DRAFT, "Draft input " + i + " does not match its transaction");
                }
                inputs.add(assemblyService.resolveInput(params, new SpendableOutput(
                        input.getTxid(),
                        input.getVout(),
                        input.getAmount(),
                        decodeHex(input.getCommittedScriptHex()),
                        decodeHex(input.getPreviousTransactionHex())
                )));
            }

            TransactionDraft draft = new TransactionDraft(transaction, inputs);
            if (document.getSignatures() != null) {
                for (DraftDocument.SignatureDocument signature : document.getSignatures()) {
                    if (signature.getInputIndex() < 0 || signature.getInputIndex() >= inputs.size()) {
                        throw new InvalidDraftException(WalletErrorCode.MALFORMED_DRAFT,
                                "Signature refers to missing input " + signature.getInputIndex());
                    }
                    draft.addPartialSignature(signature.getInputIndex(), new PartialSignature(
                            Utils.HEX.decode(signature.getPublicKeyHex()), Utils.HEX.decode(signature.getSignatureHex())));
                }
            }
            if (document.getFinalizedTransactionHex() != null) {
                restoreFinalized(wallet, draft, document.getFinalizedTransactionHex());
            }
            return draft;
        } catch (MultisigWalletException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed to decode draft for wallet {}", wallet.getWalletId(), e);
            throw new InvalidDraftException(WalletErrorCode.MALFORMED_DRAFT, "Malformed draft: " + e.getMessage(), e);
        }
    }

    private void restoreFinalized(MultisigWallet wallet, TransactionDraft draft, String claimedHex) {
        String rebuiltHex;
        try {
            rebuiltHex = finalizer.finalizeTransaction(wallet, draft);
        } catch (MultisigWalletException e) {
            log.warn("Rejected finalized draft for wallet {}: {}", wallet.getWalletId(), e.getMessage());
            throw new InvalidDraftException(WalletErrorCode.MALFORMED_DRAFT,
                    "Finalized transaction is not backed by the draft's signatures", e);
        }
        if (!rebuiltHex.equalsIgnoreCase(claimedHex)) {
            throw new InvalidDraftException(WalletErrorCode.MALFORMED_DRAFT,
                    "Finalized transaction does not match the draft's signatures");
        }
    }

    private byte[] decodeHex(String hex) {
        return hex == null ? null : Utils.HEX.decode(hex);
    }

}
