package com.sommerph.musigbackend.repository;

import com.sommerph.musigbackend.model.wallet.WalletDescriptor;

public interface WalletRegistry {

    void save(WalletDescriptor wallet);

    WalletDescriptor load(String walletId);

    boolean exists(String walletId);

}
