package com.sommerph.musigbackend.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sommerph.musigbackend.model.wallet.WalletDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.*;

@Slf4j
public class JsonFileWalletRegistry implements WalletRegistry {

    private final Path storageDir;
    private final ObjectMapper mapper;

    public JsonFileWalletRegistry(String path) throws IOException {
        this.storageDir = Paths.get(path);
        Files.createDirectories(storageDir);
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void save(WalletDescriptor wallet) {
        log.info("Save multisig wallet {}", wallet.getWalletId());
        Path filePath = fileFor(wallet.getWalletId());
        try {
            mapper.writeValue(filePath.toFile(), wallet);
        } catch (IOException e) {
            log.error("Failed to save multisig wallet: {}", wallet.getWalletId(), e);
            throw new RuntimeException("Failed to save multisig wallet: " + wallet.getWalletId(), e);
        }
    }

    @Override
    public WalletDescriptor load(String walletId) {
        log.info("Load multisig wallet {}", walletId);
        Path filePath = fileFor(walletId);
        if (!Files.exists(filePath)) {
            return null;
        }
        try {
            return mapper.readValue(filePath.toFile(), WalletDescriptor.class);
        } catch (IOException e) {
            log.error("Failed to load multisig wallet: {}", walletId, e);
            throw new RuntimeException("Failed to load multisig wallet: " + walletId, e);
        }
    }

    @Override
    public boolean exists(String walletId) {
        return Files.exists(fileFor(walletId));
    }

    private Path fileFor(String walletId) {
        return storageDir.resolve(walletId + "-multisig-wallet.json");
    }

}
