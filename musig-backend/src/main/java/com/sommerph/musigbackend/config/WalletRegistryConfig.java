package com.sommerph.musigbackend.config;

import com.sommerph.musigbackend.repository.InMemoryWalletRegistry;
import com.sommerph.musigbackend.repository.JsonFileWalletRegistry;
import com.sommerph.musigbackend.repository.WalletRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class WalletRegistryConfig {

    @Value("${multisig.wallet.registry.type:memory}")
    private String registryType;

    @Value("${multisig.wallet.storage.path:data/wallets}")
    private String storagePath;

    @Bean
    public WalletRegistry walletRegistry() throws IOException {
        return switch (registryType.toLowerCase()) {
            case "json" -> new JsonFileWalletRegistry(storagePath);
            case "memory" -> new InMemoryWalletRegistry();
            default -> throw new IllegalArgumentException("Unsupported registry type: " + registryType);
        };
    }

}
