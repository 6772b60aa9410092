package com.sommerph.musigbackend.service;

import com.google.common.util.concurrent.Striped;
import com.sommerph.musigbackend.config.MultisigProperties;
import com.sommerph.musigbackend.exception.ConfigurationException;
import com.sommerph.musigbackend.exception.FatalEncodingException;
import com.sommerph.musigbackend.exception.WalletErrorCode;
import com.sommerph.musigbackend.exception.WalletNotFoundException;
import com.sommerph.musigbackend.model.key.DerivationScheme;
import com.sommerph.musigbackend.model.key.SignerKey;
import com.sommerph.musigbackend.model.transaction.DesiredOutput;
import com.sommerph.musigbackend.model.transaction.SpendableOutput;
import com.sommerph.musigbackend.model.transaction.TransactionDraft;
import com.sommerph.musigbackend.model.wallet.BitcoinNetwork;
import com.sommerph.musigbackend.model.wallet.MultisigPolicy;
import com.sommerph.musigbackend.model.wallet.MultisigWallet;
import com.sommerph.musigbackend.model.wallet.WalletAddresses;
import com.sommerph.musigbackend.model.wallet.WalletDescriptor;
import com.sommerph.musigbackend.repository.WalletRegistry;
import com.sommerph.musigbackend.service.key.KeyDerivationService;
import com.sommerph.musigbackend.service.script.MultisigScriptService;
import com.sommerph.musigbackend.service.signing.SigningCoordinator;
import com.sommerph.musigbackend.service.signing.TransactionFinalizer;
import com.sommerph.musigbackend.service.transaction.TransactionAssemblyService;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Utils;
import org.bitcoinj.script.Script;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class MultisigWalletService {

    private final KeyDerivationService keyDerivationService;
    private final MultisigScriptService scriptService;
    private final TransactionAssemblyService assemblyService;
    private final SigningCoordinator signingCoordinator;
    private final TransactionFinalizer finalizer;
    private final WalletRegistry walletRegistry;
    private final MultisigProperties properties;

    private static final int LOCK_STRIPES = 64;

    // Registry reads and writes for one wallet id happen under its stripe
    private final Striped<Lock> walletLocks = Striped.lock(LOCK_STRIPES);

    public MultisigWallet createWallet(String walletId, int threshold, List<byte[]> publicKeys, String network) {
        log.info("Create {}-of-{} multisig wallet {}", threshold, publicKeys == null ? 0 : publicKeys.size(), walletId);
        return withWalletLock(walletId, () -> {
            checkAbsent(walletId);
            BitcoinNetwork bitcoinNetwork = resolveNetwork(network);
            MultisigWallet wallet = buildWallet(walletId, bitcoinNetwork, scriptService.buildPolicy(threshold, publicKeys), null, List.of());
            walletRegistry.save(describe(wallet));
            return wallet;
        });
    }

    /**
     * Generates a fresh mnemonic and key for each of the {@code signerCount} signers and builds
     * the wallet over their public keys. The mnemonics are returned once and never stored.
     */
    public GeneratedWallet generateWallet(String walletId, int threshold, int signerCount, String network, String pathPrefix) {
        log.info("Generate {}-of-{} multisig wallet {}", threshold, signerCount, walletId);
        return withWalletLock(walletId, () -> {
            checkAbsent(walletId);
            return generate(walletId, threshold, signerCount, network, pathPrefix);
        });
    }

    public MultisigWallet loadWallet(String walletId) {
        log.info("Load multisig wallet {}", walletId);
        WalletDescriptor descriptor = walletRegistry.exists(walletId) ? walletRegistry.load(walletId) : null;
        if (descriptor == null) {
            throw new WalletNotFoundException(WalletErrorCode.WALLET_NOT_FOUND, "No multisig wallet found: " + walletId);
        }
        List<byte[]> publicKeys = new ArrayList<>();
        descriptor.getPublicKeys().forEach(key -> publicKeys.add(Utils.HEX.decode(key)));
        MultisigWallet wallet = buildWallet(descriptor.getWalletId(), BitcoinNetwork.fromName(descriptor.getNetwork()),
                scriptService.buildPolicy(descriptor.getThreshold(), publicKeys),
                descriptor.getDerivationPathPrefix(), descriptor.getDerivationPaths());
        wallet.getSession().restore(descriptor.getUsedSigners());
        return wallet;
    }

    public boolean walletExists(String walletId) {
        return walletRegistry.exists(walletId);
    }

    public WalletDescriptor getDescriptor(String walletId) {
        return describe(loadWallet(walletId));
    }

    public WalletAddresses getAddresses(String walletId) {
        return loadWallet(walletId).getAddresses();
    }

    public String getRedeemScriptHex(String walletId) {
        return Utils.HEX.encode(loadWallet(walletId).getRedeemScript().getProgram());
    }

    public List<String> getDerivationPaths(String walletId) {
        return loadWallet(walletId).getDerivationPaths();
    }

    public SignerKey restoreFromMnemonic(String walletId, String mnemonic, int index) {
        MultisigWallet wallet = loadWallet(walletId);
        SignerKey signer = keyDerivationService.recover(schemeFor(wallet), mnemonic, index);
        if (!wallet.getPolicy().containsKey(signer.getPublicKey())) {
            log.warn("Recovered key at index {} is not a signer of wallet {}", index, walletId);
        }
        return signer;
    }

    public TransactionDraft createTransaction(String walletId, List<SpendableOutput> utxos, List<DesiredOutput> outputs, long fee) {
        return assemblyService.assemble(loadWallet(walletId), utxos, outputs, fee);
    }

    public boolean signTransaction(String walletId, TransactionDraft draft, ECKey signer, int inputIndex) {
        return withWalletLock(walletId, () -> {
            MultisigWallet wallet = loadWallet(walletId);
            boolean signed = signingCoordinator.submitSignature(wallet, draft, signer, inputIndex);
            if (signed) {
                walletRegistry.save(describe(wallet));
            }
            return signed;
        });
    }

    public boolean verifyTransaction(String walletId, TransactionDraft draft) {
        return finalizer.verify(loadWallet(walletId), draft);
    }

    public String finalizeTransaction(String walletId, TransactionDraft draft) {
        return finalizer.finalizeTransaction(loadWallet(walletId), draft);
    }

    public void resetSigners(String walletId) {
        withWalletLock(walletId, () -> {
            MultisigWallet wallet = loadWallet(walletId);
            signingCoordinator.resetSession(wallet);
            walletRegistry.save(describe(wallet));
            return null;
        });
    }

    public WalletDescriptor describe(MultisigWallet wallet) {
        return new WalletDescriptor(
                wallet.getWalletId(),
                wallet.getNetwork().name().toLowerCase(),
                wallet.getPolicy().getThreshold(),
                wallet.getPolicy().getOrderedKeysHex(),
                wallet.getDerivationPathPrefix(),
                new ArrayList<>(wallet.getDerivationPaths()),
                wallet.getSession().snapshot()
        );
    }

    private GeneratedWallet generate(String walletId, int threshold, int signerCount, String network, String pathPrefix) {
        BitcoinNetwork bitcoinNetwork = resolveNetwork(network);
        String prefix = resolvePathPrefix(bitcoinNetwork, pathPrefix);
        keyDerivationService.validatePathPrefix(prefix);
        // Reject a bad policy before spending time on key generation
        if (threshold <= 0) {
            throw new ConfigurationException(WalletErrorCode.INVALID_THRESHOLD, "Required signatures must be a positive integer");
        }
        if (threshold > signerCount) {
            throw new ConfigurationException(WalletErrorCode.INVALID_THRESHOLD, "Required signatures cannot exceed number of public keys");
        }
        if (signerCount > MultisigScriptService.MAX_SIGNERS) {
            throw new ConfigurationException(WalletErrorCode.INVALID_KEY_SET,
                    "At most " + MultisigScriptService.MAX_SIGNERS + " public keys are supported, got " + signerCount);
        }

        DerivationScheme scheme = new DerivationScheme(prefix, signerCount, properties.getDerivation().getEntropyBits());
        List<SignerKey> signers = new ArrayList<>(signerCount);
        List<byte[]> publicKeys = new ArrayList<>(signerCount);
        List<String> paths = new ArrayList<>(signerCount);
        for (int i = 0; i < signerCount; i++) {
            SignerKey signer = keyDerivationService.generate(scheme, i);
            signers.add(signer);
            publicKeys.add(signer.getPublicKey());
            paths.add(signer.getDerivationPath());
        }

        MultisigWallet wallet = buildWallet(walletId, bitcoinNetwork, scriptService.buildPolicy(threshold, publicKeys), prefix, paths);
        walletRegistry.save(describe(wallet));
        return new GeneratedWallet(wallet, signers);
    }

    private MultisigWallet buildWallet(String walletId, BitcoinNetwork network, MultisigPolicy policy,
                                       String pathPrefix, List<String> derivationPaths) {
        Script redeemScript = scriptService.buildScript(policy);
        if (!scriptService.validateMultisigScript(redeemScript)) {
            log.error("Rebuilt redeem script of wallet {} is not a multisig script", walletId);
            throw new FatalEncodingException(WalletErrorCode.ADDRESS_DERIVATION_FAILURE, "Invalid multisig redeem script for wallet " + walletId);
        }
        WalletAddresses addresses = scriptService.deriveAddresses(redeemScript, network.getParameters());
        return new MultisigWallet(walletId, network, policy, redeemScript, addresses, pathPrefix, derivationPaths);
    }

    private DerivationScheme schemeFor(MultisigWallet wallet) {
        String prefix = wallet.getDerivationPathPrefix() != null
                ? wallet.getDerivationPathPrefix()
                : resolvePathPrefix(wallet.getNetwork(), null);
        return new DerivationScheme(prefix, wallet.getPolicy().getSignerCount(), properties.getDerivation().getEntropyBits());
    }

    private BitcoinNetwork resolveNetwork(String network) {
        return BitcoinNetwork.fromName(network != null ? network : properties.getNetwork());
    }

    private String resolvePathPrefix(BitcoinNetwork network, String pathPrefix) {
        if (pathPrefix != null && !pathPrefix.isBlank()) {
            return pathPrefix.trim();
        }
        String configured = properties.getDerivation().getPathPrefix();
        return configured != null && !configured.isBlank() ? configured.trim() : network.defaultPathPrefix();
    }

    private void checkAbsent(String walletId) {
        if (walletRegistry.exists(walletId)) {
            throw new IllegalStateException("Multisig wallet already exists: " + walletId);
        }
    }

    private <T> T withWalletLock(String walletId, Supplier<T> action) {
        Lock lock = walletLocks.get(walletId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    @Data
    @AllArgsConstructor
    public static class GeneratedWallet {
        private MultisigWallet wallet;
        private List<SignerKey> signers;
    }

}
