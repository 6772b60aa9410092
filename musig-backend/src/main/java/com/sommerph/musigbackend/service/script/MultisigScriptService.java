package com.sommerph.musigbackend.service.script;

import com.google.common.primitives.UnsignedBytes;
import com.sommerph.musigbackend.exception.ConfigurationException;
import com.sommerph.musigbackend.exception.FatalEncodingException;
import com.sommerph.musigbackend.exception.WalletErrorCode;
import com.sommerph.musigbackend.model.wallet.MultisigPolicy;
import com.sommerph.musigbackend.model.wallet.WalletAddresses;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Address;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.LegacyAddress;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.SegwitAddress;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;
import org.bitcoinj.script.ScriptChunk;
import org.bitcoinj.script.ScriptOpCodes;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Service
public class MultisigScriptService {

    /**
     * Largest key set whose redeem script still fits the 520-byte P2SH push limit.
     */
    public static final int MAX_SIGNERS = 15;

    private static final int COMPRESSED_KEY_LENGTH = 33;
    private static final Comparator<byte[]> CANONICAL_ORDER = UnsignedBytes.lexicographicalComparator();

    public MultisigPolicy buildPolicy(int threshold, List<byte[]> publicKeys) {
        log.info("Build {}-of-{} multisig policy", threshold, publicKeys == null ? 0 : publicKeys.size());
        if (threshold <= 0) {
            throw new ConfigurationException(WalletErrorCode.INVALID_THRESHOLD, "Required signatures must be a positive integer");
        }
        if (publicKeys == null || publicKeys.isEmpty()) {
            throw new ConfigurationException(WalletErrorCode.INVALID_KEY_SET, "Public keys array cannot be empty");
        }
        if (threshold > publicKeys.size()) {
            throw new ConfigurationException(WalletErrorCode.INVALID_THRESHOLD, "Required signatures cannot exceed number of public keys");
        }
        if (publicKeys.size() > MAX_SIGNERS) {
            throw new ConfigurationException(WalletErrorCode.INVALID_KEY_SET,
                    "At most " + MAX_SIGNERS + " public keys are supported, got " + publicKeys.size());
        }
        for (int i = 0; i < publicKeys.size(); i++) {
            if (!isValidPublicKey(publicKeys.get(i))) {
                throw new ConfigurationException(WalletErrorCode.INVALID_KEY_SET, "Invalid public key at index " + i);
            }
        }

        List<byte[]> ordered = new ArrayList<>(publicKeys);
        ordered.sort(CANONICAL_ORDER);
        for (int i = 1; i < ordered.size(); i++) {
            if (CANONICAL_ORDER.compare(ordered.get(i - 1), ordered.get(i)) == 0) {
                throw new ConfigurationException(WalletErrorCode.INVALID_KEY_SET,
                        "Duplicate public key " + Utils.HEX.encode(ordered.get(i)));
            }
        }
        return new MultisigPolicy(threshold, ordered);
    }

    /**
     * {@code OP_m <key_1> ... <key_n> OP_n OP_CHECKMULTISIG}, keys in canonical order.
     */
    public Script buildScript(MultisigPolicy policy) {
        ScriptBuilder builder = new ScriptBuilder().smallNum(policy.getThreshold());
        for (byte[] key : policy.getOrderedKeys()) {
            builder.data(key);
        }
        return builder
                .smallNum(policy.getSignerCount())
                .op(ScriptOpCodes.OP_CHECKMULTISIG)
                .build();
    }

    public WalletAddresses deriveAddresses(Script redeemScript, NetworkParameters params) {
        log.info("Derive P2SH and P2WSH addresses on {}", params.getId());
        try {
            byte[] program = redeemScript.getProgram();
            Address p2sh = LegacyAddress.fromScriptHash(params, Utils.sha256hash160(program));
            Address p2wsh = SegwitAddress.fromHash(params, Sha256Hash.hash(program));
            return new WalletAddresses(p2sh.toString(), p2wsh.toString());
        } catch (RuntimeException e) {
            log.error("Failed to derive addresses for redeem script", e);
            throw new FatalEncodingException(WalletErrorCode.ADDRESS_DERIVATION_FAILURE, "Failed to generate addresses", e);
        }
    }

    // OP_m <33-byte key>... OP_n OP_CHECKMULTISIG with 1 <= m <= n
    public boolean validateMultisigScript(Script script) {
        List<ScriptChunk> chunks = script.getChunks();
        if (chunks.size() < 4) {
            return false;
        }
        if (!chunks.get(chunks.size() - 1).equalsOpCode(ScriptOpCodes.OP_CHECKMULTISIG)) {
            return false;
        }
        ScriptChunk first = chunks.get(0);
        ScriptChunk last = chunks.get(chunks.size() - 2);
        if (!isPositiveSmallNum(first) || !isPositiveSmallNum(last)) {
            return false;
        }
        int m = Script.decodeFromOpN(first.opcode);
        int n = Script.decodeFromOpN(last.opcode);
        if (m > n || n != chunks.size() - 3) {
            return false;
        }
        for (ScriptChunk chunk : chunks.subList(1, chunks.size() - 2)) {
            if (chunk.data == null || chunk.data.length != COMPRESSED_KEY_LENGTH) {
                return false;
            }
        }
        return true;
    }

    public boolean isValidPublicKey(byte[] publicKey) {
        if (publicKey == null || publicKey.length != COMPRESSED_KEY_LENGTH) {
            return false;
        }
        try {
            // fromPublicOnly keeps the encoding lazily, so decode the point here
            return ECKey.CURVE.getCurve().decodePoint(publicKey).isValid();
        } catch (RuntimeException e) {
            return false;
        }
    }

    private boolean isPositiveSmallNum(ScriptChunk chunk) {
        return chunk.isOpCode() && chunk.opcode >= ScriptOpCodes.OP_1 && chunk.opcode <= ScriptOpCodes.OP_16;
    }

}
