package com.sommerph.musigbackend.service.transaction;

import com.sommerph.musigbackend.exception.FundsException;
import com.sommerph.musigbackend.exception.WalletErrorCode;
import com.sommerph.musigbackend.model.transaction.DesiredOutput;
import com.sommerph.musigbackend.model.transaction.DraftInput;
import com.sommerph.musigbackend.model.transaction.LegacyDraftInput;
import com.sommerph.musigbackend.model.transaction.SpendableOutput;
import com.sommerph.musigbackend.model.transaction.TransactionDraft;
import com.sommerph.musigbackend.model.transaction.WitnessDraftInput;
import com.sommerph.musigbackend.model.wallet.MultisigWallet;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Address;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Coin;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.core.TransactionInput;
import org.bitcoinj.core.TransactionOutPoint;
import org.bitcoinj.core.TransactionOutput;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptPattern;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Slf4j
@Service
public class TransactionAssemblyService {

    private static final int TRANSACTION_VERSION = 2;
    private static final long MAX_OUTPUT_INDEX = 0xFFFFFFFFL;

    public TransactionDraft assemble(MultisigWallet wallet, List<SpendableOutput> utxos, List<DesiredOutput> outputs, long fee) {
        log.info("Assemble transaction for wallet {} with {} inputs and {} outputs",
                wallet.getWalletId(), utxos == null ? 0 : utxos.size(), outputs == null ? 0 : outputs.size());
        if (utxos == null || utxos.isEmpty()) {
            throw new FundsException(WalletErrorCode.EMPTY_INPUT_SET, "UTXOs array cannot be empty");
        }
        if (outputs == null || outputs.isEmpty()) {
            throw new FundsException(WalletErrorCode.EMPTY_OUTPUT_SET, "Outputs array cannot be empty");
        }
        if (fee < 0) {
            throw new FundsException(WalletErrorCode.NEGATIVE_FEE, "Fee cannot be negative");
        }

        long totalInput = 0;
        for (SpendableOutput utxo : utxos) {
            if (utxo.getAmount() < 0) {
                throw new FundsException(WalletErrorCode.INVALID_INPUT, "UTXO amount cannot be negative: " + utxo.getTxid() + ":" + utxo.getVout());
            }
            totalInput = addAmounts(totalInput, utxo.getAmount());
        }
        long totalOutput = 0;
        for (DesiredOutput output : outputs) {
            totalOutput = addAmounts(totalOutput, output.getAmount());
        }
        if (totalInput < addAmounts(totalOutput, fee)) {
            throw new FundsException(WalletErrorCode.INSUFFICIENT_FUNDS, "Insufficient funds for transaction");
        }

        NetworkParameters params = wallet.getNetwork().getParameters();
        Transaction transaction = new Transaction(params);
        transaction.setVersion(TRANSACTION_VERSION);

        List<DraftInput> draftInputs = new ArrayList<>(utxos.size());
        for (SpendableOutput utxo : utxos) {
            DraftInput draftInput = resolveInput(params, utxo);
            TransactionOutPoint outPoint = new TransactionOutPoint(params, utxo.getVout(), Sha256Hash.wrap(utxo.getTxid()));
            transaction.addInput(new TransactionInput(params, transaction, new byte[0], outPoint, Coin.valueOf(utxo.getAmount())));
            draftInputs.add(draftInput);
        }

        for (DesiredOutput output : outputs) {
            Address destination = parseDestination(params, output.getAddress());
            if (output.getAmount() <= 0) {
                throw new FundsException(WalletErrorCode.NON_POSITIVE_OUTPUT_AMOUNT, "Output value must be positive");
            }
            transaction.addOutput(Coin.valueOf(output.getAmount()), destination);
        }

        return new TransactionDraft(transaction, draftInputs);
    }

    /**
     * Tags a spendable output with its input form. P2WSH programs become witness inputs;
     * anything else is spent the legacy way and must come with the transaction that created it.
     */
    public DraftInput resolveInput(NetworkParameters params, SpendableOutput utxo) {
        String outPoint = utxo.getTxid() + ":" + utxo.getVout();
        if (utxo.getTxid() == null || utxo.getCommittedScript() == null || utxo.getVout() < 0) {
            throw new FundsException(WalletErrorCode.INVALID_INPUT, "Incomplete UTXO " + outPoint);
        }
        // Outpoint indexes are serialized as uint32
        if (utxo.getVout() > MAX_OUTPUT_INDEX) {
            throw new FundsException(WalletErrorCode.INVALID_INPUT, "Output index out of range in UTXO " + outPoint);
        }
        Sha256Hash txid;
        Script committedScript;
        try {
            txid = Sha256Hash.wrap(utxo.getTxid());
            committedScript = new Script(utxo.getCommittedScript());
        } catch (RuntimeException e) {
            throw new FundsException(WalletErrorCode.INVALID_INPUT, "Malformed UTXO " + outPoint, e);
        }

        if (ScriptPattern.isP2WSH(committedScript)) {
            return new WitnessDraftInput(utxo.getTxid(), utxo.getVout(), utxo.getAmount(), utxo.getCommittedScript());
        }

        if (utxo.getPreviousTransaction() == null) {
            throw new FundsException(WalletErrorCode.INVALID_INPUT, "Legacy input " + outPoint + " requires the previous transaction");
        }
        Transaction previous;
        try {
            previous = new Transaction(params, utxo.getPreviousTransaction());
        } catch (RuntimeException e) {
            throw new FundsException(WalletErrorCode.INVALID_INPUT, "Cannot decode previous transaction of " + outPoint, e);
        }
        if (!previous.getTxId().equals(txid)) {
            throw new FundsException(WalletErrorCode.INVALID_INPUT, "Previous transaction does not match txid of " + outPoint);
        }
        if (utxo.getVout() >= previous.getOutputs().size()) {
            throw new FundsException(WalletErrorCode.INVALID_INPUT, "Previous transaction has no output " + outPoint);
        }
        TransactionOutput spent = previous.getOutput(utxo.getVout());
        if (spent.getValue().value != utxo.getAmount() || !Arrays.equals(spent.getScriptBytes(), utxo.getCommittedScript())) {
            throw new FundsException(WalletErrorCode.INVALID_INPUT, "Previous transaction output differs from UTXO " + outPoint);
        }
        return new LegacyDraftInput(utxo.getTxid(), utxo.getVout(), utxo.getAmount(), utxo.getCommittedScript(),
                utxo.getPreviousTransaction());
    }

    private Address parseDestination(NetworkParameters params, String address) {
        if (address == null || address.isBlank()) {
            throw new FundsException(WalletErrorCode.INVALID_DESTINATION, "Invalid address: " + address);
        }
        try {
            return Address.fromString(params, address);
        } catch (AddressFormatException e) {
            throw new FundsException(WalletErrorCode.INVALID_DESTINATION, "Invalid address: " + address, e);
        }
    }

    private long addAmounts(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new FundsException(WalletErrorCode.INVALID_INPUT, "Amounts overflow", e);
        }
    }

}
