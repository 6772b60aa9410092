package com.sommerph.musigbackend.repository;

import com.sommerph.musigbackend.model.wallet.WalletDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class InMemoryWalletRegistry implements WalletRegistry {

    private final Map<String, WalletDescriptor> walletStore = new ConcurrentHashMap<>();

    @Override
    public void save(WalletDescriptor wallet) {
        log.info("Save multisig wallet {}", wallet.getWalletId());
        walletStore.put(wallet.getWalletId(), copy(wallet));
    }

    @Override
    public WalletDescriptor load(String walletId) {
        log.info("Load multisig wallet {}", walletId);
        WalletDescriptor wallet = walletStore.get(walletId);
        return wallet == null ? null : copy(wallet);
    }

    @Override
    public boolean exists(String walletId) {
        return walletStore.containsKey(walletId);
    }

    // Callers mutate what they load; keep the stored descriptor out of reach.
    private WalletDescriptor copy(WalletDescriptor wallet) {
        return new WalletDescriptor(
                wallet.getWalletId(),
                wallet.getNetwork(),
                wallet.getThreshold(),
                new ArrayList<>(wallet.getPublicKeys()),
                wallet.getDerivationPathPrefix(),
                new ArrayList<>(wallet.getDerivationPaths()),
                new ArrayList<>(wallet.getUsedSigners())
        );
    }

}
