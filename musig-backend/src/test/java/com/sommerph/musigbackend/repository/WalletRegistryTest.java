package com.sommerph.musigbackend.repository;

import com.sommerph.musigbackend.model.wallet.WalletDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WalletRegistry")
class WalletRegistryTest {

    private static WalletDescriptor descriptor() {
        return new WalletDescriptor("treasury", "testnet", 2,
                new ArrayList<>(List.of("02aa", "03bb", "02cc")),
                "m/48'/1'/0'/2'",
                new ArrayList<>(List.of("m/48'/1'/0'/2'/0", "m/48'/1'/0'/2'/1", "m/48'/1'/0'/2'/2")),
                new ArrayList<>(List.of("03bb")));
    }

    @Nested
    @DisplayName("InMemoryWalletRegistry")
    class InMemory {

        private final InMemoryWalletRegistry registry = new InMemoryWalletRegistry();

        @Test
        @DisplayName("Should return what was saved")
        void shouldRoundTrip() {
            registry.save(descriptor());

            assertThat(registry.exists("treasury")).isTrue();
            assertThat(registry.load("treasury")).isEqualTo(descriptor());
        }

        @Test
        @DisplayName("Should not expose the stored descriptor to callers")
        void shouldIsolateStoredCopy() {
            registry.save(descriptor());

            registry.load("treasury").getUsedSigners().clear();

            assertThat(registry.load("treasury").getUsedSigners()).containsExactly("03bb");
        }

        @Test
        @DisplayName("Should return null for an unknown wallet")
        void shouldReturnNullWhenMissing() {
            assertThat(registry.exists("missing")).isFalse();
            assertThat(registry.load("missing")).isNull();
        }

    }

    @Nested
    @DisplayName("JsonFileWalletRegistry")
    class JsonFile {

        @TempDir
        Path storage;

        @Test
        @DisplayName("Should persist descriptors as JSON files")
        void shouldPersistToDisk() throws Exception {
            JsonFileWalletRegistry registry = new JsonFileWalletRegistry(storage.toString());

            registry.save(descriptor());

            Path file = storage.resolve("treasury-multisig-wallet.json");
            assertThat(file).exists();
            assertThat(Files.readString(file)).contains("\"threshold\" : 2").doesNotContain("privateKey");
            assertThat(new JsonFileWalletRegistry(storage.toString()).load("treasury")).isEqualTo(descriptor());
        }

        @Test
        @DisplayName("Should overwrite the previous state on save")
        void shouldOverwrite() throws Exception {
            JsonFileWalletRegistry registry = new JsonFileWalletRegistry(storage.toString());
            registry.save(descriptor());
            WalletDescriptor reset = descriptor();
            reset.setUsedSigners(new ArrayList<>());

            registry.save(reset);

            assertThat(registry.load("treasury").getUsedSigners()).isEmpty();
        }

        @Test
        @DisplayName("Should return null for an unknown wallet")
        void shouldReturnNullWhenMissing() throws Exception {
            JsonFileWalletRegistry registry = new JsonFileWalletRegistry(storage.resolve("nested").toString());

            assertThat(registry.exists("missing")).isFalse();
            assertThat(registry.load("missing")).isNull();
        }

    }

}
