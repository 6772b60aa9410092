package com.sommerph.musigbackend.controller;

import com.sommerph.musigbackend.exception.AuthorizationException;
import com.sommerph.musigbackend.exception.FatalEncodingException;
import com.sommerph.musigbackend.exception.MultisigWalletException;
import com.sommerph.musigbackend.exception.VerificationException;
import com.sommerph.musigbackend.exception.WalletNotFoundException;
import com.sommerph.musigbackend.model.key.SignerKey;
import com.sommerph.musigbackend.model.transaction.DesiredOutput;
import com.sommerph.musigbackend.model.transaction.DraftDocument;
import com.sommerph.musigbackend.model.transaction.SpendableOutput;
import com.sommerph.musigbackend.model.transaction.TransactionDraft;
import com.sommerph.musigbackend.model.wallet.MultisigWallet;
import com.sommerph.musigbackend.model.wallet.WalletDescriptor;
import com.sommerph.musigbackend.service.MultisigWalletService;
import com.sommerph.musigbackend.service.transaction.DraftDocumentMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Utils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/multisig/wallets")
@RequiredArgsConstructor
@Tag(name = "Multisig", description = "Endpoints for m-of-n multisig wallet operations")
public class MultisigWalletController {

    private final MultisigWalletService walletService;
    private final DraftDocumentMapper draftMapper;

    @Operation(summary = "Create a multisig wallet over the given public keys")
    @PostMapping("/{walletId}")
    public ResponseEntity<?> createWallet(@PathVariable @NotBlank String walletId, @Valid @RequestBody CreateWalletRequest request) {
        log.info("Create multisig wallet: {}", walletId);
        try {
            List<byte[]> publicKeys = new ArrayList<>();
            request.getPublicKeys().forEach(key -> publicKeys.add(Utils.HEX.decode(key)));
            MultisigWallet wallet = walletService.createWallet(walletId, request.getThreshold(), publicKeys, request.getNetwork());
            return ResponseEntity.ok(walletService.describe(wallet));
        } catch (Exception e) {
            return error("Create multisig wallet " + walletId, e);
        }
    }

    @Operation(summary = "Create a multisig wallet with freshly generated signer keys; mnemonics are returned only once")
    @PostMapping("/{walletId}/generate")
    public ResponseEntity<?> generateWallet(@PathVariable @NotBlank String walletId, @Valid @RequestBody GenerateWalletRequest request) {
        log.info("Generate multisig wallet: {}", walletId);
        try {
            MultisigWalletService.GeneratedWallet generated = walletService.generateWallet(walletId, request.getThreshold(),
                    request.getSignerCount(), request.getNetwork(), request.getDerivationPathPrefix());
            List<SignerKeyResponse> signers = new ArrayList<>();
            generated.getSigners().forEach(signer -> signers.add(SignerKeyResponse.of(signer)));
            return ResponseEntity.ok(new GeneratedWalletResponse(walletService.describe(generated.getWallet()), signers));
        } catch (Exception e) {
            return error("Generate multisig wallet " + walletId, e);
        }
    }

    @Operation(summary = "Get the descriptor of a multisig wallet")
    @GetMapping("/{walletId}")
    public ResponseEntity<?> getWallet(@PathVariable @NotBlank String walletId) {
        log.info("Load multisig wallet: {}", walletId);
        try {
            return ResponseEntity.ok(walletService.getDescriptor(walletId));
        } catch (Exception e) {
            return error("Load multisig wallet " + walletId, e);
        }
    }

    @Operation(summary = "Get the P2SH and P2WSH addresses of a multisig wallet")
    @GetMapping("/{walletId}/addresses")
    public ResponseEntity<?> getAddresses(@PathVariable @NotBlank String walletId) {
        try {
            return ResponseEntity.ok(walletService.getAddresses(walletId));
        } catch (Exception e) {
            return error("Get addresses of " + walletId, e);
        }
    }

    @Operation(summary = "Get the redeem script of a multisig wallet as hex")
    @GetMapping("/{walletId}/redeem-script")
    public ResponseEntity<?> getRedeemScript(@PathVariable @NotBlank String walletId) {
        try {
            return ResponseEntity.ok(new RedeemScriptResponse(walletService.getRedeemScriptHex(walletId)));
        } catch (Exception e) {
            return error("Get redeem script of " + walletId, e);
        }
    }

    @Operation(summary = "Restore a signer key of a multisig wallet from its mnemonic")
    @PostMapping("/{walletId}/recover")
    public ResponseEntity<?> recoverSigner(@PathVariable @NotBlank String walletId, @Valid @RequestBody RecoverRequest request) {
        log.info("Recover signer {} of multisig wallet: {}", request.getIndex(), walletId);
        try {
            SignerKey signer = walletService.restoreFromMnemonic(walletId, request.getMnemonic(), request.getIndex());
            return ResponseEntity.ok(new SignerKeyResponse(signer.getIndex(), signer.getDerivationPath(), signer.publicKeyHex(), null));
        } catch (Exception e) {
            return error("Recover signer of " + walletId, e);
        }
    }

    @Operation(summary = "Assemble an unsigned transaction spending the given outputs")
    @PostMapping("/{walletId}/transactions")
    public ResponseEntity<?> createTransaction(@PathVariable @NotBlank String walletId, @Valid @RequestBody CreateTransactionRequest request) {
        log.info("Create transaction for multisig wallet: {}", walletId);
        try {
            List<SpendableOutput> utxos = new ArrayList<>();
            for (UtxoRequest utxo : request.getUtxos()) {
                utxos.add(new SpendableOutput(utxo.getTxid(), utxo.getVout(), utxo.getAmount(),
                        Utils.HEX.decode(utxo.getScriptHex()),
                        utxo.getPreviousTransactionHex() == null ? null : Utils.HEX.decode(utxo.getPreviousTransactionHex())));
            }
            List<DesiredOutput> outputs = new ArrayList<>();
            request.getOutputs().forEach(output -> outputs.add(new DesiredOutput(output.getAddress(), output.getAmount())));
            TransactionDraft draft = walletService.createTransaction(walletId, utxos, outputs, request.getFee());
            return ResponseEntity.ok(draftMapper.toDocument(draft));
        } catch (Exception e) {
            return error("Create transaction for " + walletId, e);
        }
    }

    @Operation(summary = "Add one signer's signature over one input of a draft")
    @PostMapping("/{walletId}/transactions/sign")
    public ResponseEntity<?> signTransaction(@PathVariable @NotBlank String walletId, @Valid @RequestBody SignRequest request) {
        log.info("Sign input {} of a transaction for multisig wallet: {}", request.getInputIndex(), walletId);
        try {
            TransactionDraft draft = toDraft(walletId, request.getDraft());
            boolean signed = walletService.signTransaction(walletId, draft, signerKey(walletId, request), request.getInputIndex());
            return ResponseEntity.ok(new SignResponse(signed, draftMapper.toDocument(draft)));
        } catch (Exception e) {
            return error("Sign transaction for " + walletId, e);
        }
    }

    @Operation(summary = "Check whether a draft carries enough valid signatures")
    @PostMapping("/{walletId}/transactions/verify")
    public ResponseEntity<?> verifyTransaction(@PathVariable @NotBlank String walletId, @Valid @RequestBody @NotNull DraftDocument document) {
        try {
            return ResponseEntity.ok(new VerifyResponse(walletService.verifyTransaction(walletId, toDraft(walletId, document))));
        } catch (Exception e) {
            return error("Verify transaction for " + walletId, e);
        }
    }

    @Operation(summary = "Finalize a fully signed draft into a broadcastable transaction")
    @PostMapping("/{walletId}/transactions/finalize")
    public ResponseEntity<?> finalizeTransaction(@PathVariable @NotBlank String walletId, @Valid @RequestBody @NotNull DraftDocument document) {
        log.info("Finalize transaction for multisig wallet: {}", walletId);
        try {
            TransactionDraft draft = toDraft(walletId, document);
            String transactionHex = walletService.finalizeTransaction(walletId, draft);
            return ResponseEntity.ok(new FinalizeResponse(transactionHex, draftMapper.toDocument(draft)));
        } catch (Exception e) {
            return error("Finalize transaction for " + walletId, e);
        }
    }

    @Operation(summary = "Forget which signers have signed for this wallet")
    @PostMapping("/{walletId}/signers/reset")
    public ResponseEntity<?> resetSigners(@PathVariable @NotBlank String walletId) {
        log.info("Reset signers of multisig wallet: {}", walletId);
        try {
            walletService.resetSigners(walletId);
            return ResponseEntity.ok("Signers reset for multisig wallet: " + walletId);
        } catch (Exception e) {
            return error("Reset signers of " + walletId, e);
        }
    }

    private TransactionDraft toDraft(String walletId, DraftDocument document) {
        return draftMapper.toDraft(walletService.loadWallet(walletId), document);
    }

    private ECKey signerKey(String walletId, SignRequest request) {
        if (request.getPrivateKeyHex() != null && !request.getPrivateKeyHex().isBlank()) {
            return ECKey.fromPrivate(Utils.HEX.decode(request.getPrivateKeyHex()));
        }
        if (request.getMnemonic() == null || request.getSignerIndex() == null) {
            throw new IllegalArgumentException("Either privateKeyHex or mnemonic with signerIndex is required");
        }
        return walletService.restoreFromMnemonic(walletId, request.getMnemonic(), request.getSignerIndex()).toECKey();
    }

    private ResponseEntity<ErrorResponse> error(String action, Exception e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("{} failed", action, e);
        } else {
            log.warn("{} rejected: {}", action, e.getMessage());
        }
        String code = e instanceof MultisigWalletException
                ? ((MultisigWalletException) e).getErrorCode().name()
                : status.name();
        return ResponseEntity.status(status).body(new ErrorResponse(code, e.getMessage()));
    }

    private HttpStatus statusFor(Exception e) {
        if (e instanceof WalletNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof AuthorizationException) {
            return HttpStatus.FORBIDDEN;
        }
        if (e instanceof VerificationException || e instanceof IllegalStateException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof FatalEncodingException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (e instanceof MultisigWalletException || e instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @Data
    public static class CreateWalletRequest {
        @Min(1)
        private int threshold;
        @NotEmpty
        private List<@NotBlank String> publicKeys;
        private String network;
    }

    @Data
    public static class GenerateWalletRequest {
        @Min(1)
        private int threshold;
        @Min(1)
        private int signerCount;
        private String network;
        private String derivationPathPrefix;
    }

    @Data
    public static class RecoverRequest {
        @NotBlank
        private String mnemonic;
        @Min(0)
        private int index;
    }

    @Data
    public static class UtxoRequest {
        @NotBlank
        private String txid;
        @Min(0)
        private long vout;
        private long amount;
        @NotBlank
        private String scriptHex;
        private String previousTransactionHex;
    }

    @Data
    public static class OutputRequest {
        private String address;
        private long amount;
    }

    @Data
    public static class CreateTransactionRequest {
        private List<@Valid UtxoRequest> utxos = new ArrayList<>();
        private List<@Valid OutputRequest> outputs = new ArrayList<>();
        private long fee;
    }

    @Data
    public static class SignRequest {
        @NotNull
        private DraftDocument draft;
        private String privateKeyHex;
        private String mnemonic;
        private Integer signerIndex;
        @Min(0)
        private int inputIndex;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignerKeyResponse {
        private int index;
        private String derivationPath;
        private String publicKeyHex;
        private List<String> mnemonic;

        static SignerKeyResponse of(SignerKey signer) {
            return new SignerKeyResponse(signer.getIndex(), signer.getDerivationPath(), signer.publicKeyHex(), signer.getMnemonic());
        }
    }

    @Data
    @AllArgsConstructor
    public static class GeneratedWalletResponse {
        private WalletDescriptor wallet;
        private List<SignerKeyResponse> signers;
    }

    @Data
    @AllArgsConstructor
    public static class RedeemScriptResponse {
        private String redeemScriptHex;
    }

    @Data
    @AllArgsConstructor
    public static class SignResponse {
        private boolean signed;
        private DraftDocument draft;
    }

    @Data
    @AllArgsConstructor
    public static class VerifyResponse {
        private boolean valid;
    }

    @Data
    @AllArgsConstructor
    public static class FinalizeResponse {
        private String transactionHex;
        private DraftDocument draft;
    }

    @Data
    @AllArgsConstructor
    public static class ErrorResponse {
        private String code;
        private String message;
    }

}
