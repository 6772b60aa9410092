package com.sommerph.musigbackend.service.key;

import com.sommerph.musigbackend.exception.ConfigurationException;
import com.sommerph.musigbackend.exception.KeyRecoveryException;
import com.sommerph.musigbackend.exception.WalletErrorCode;
import com.sommerph.musigbackend.model.key.DerivationScheme;
import com.sommerph.musigbackend.model.key.SignerKey;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.wallet.DeterministicKeyChain;
import org.bitcoinj.wallet.DeterministicSeed;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class KeyDerivationService {

    private static final Pattern SEGMENT = Pattern.compile("(\\d{1,10})(['hH]?)");
    private static final long MAX_CHILD_INDEX = 0x7fffffffL;

    private final SecureRandom random = new SecureRandom();

    public SignerKey generate(DerivationScheme scheme, int index) {
        log.info("Generate signer key at index {}", index);
        checkIndex(scheme, index);
        List<ChildNumber> path = parsePrefixedPath(scheme, index);
        List<String> mnemonic = generateMnemonic(scheme.getEntropyBits());
        return derive(mnemonic, scheme.pathFor(index), path, index);
    }

    public SignerKey recover(DerivationScheme scheme, String mnemonic, int index) {
        log.info("Recover signer key at index {}", index);
        List<String> words = splitMnemonic(mnemonic);
        try {
            MnemonicCode.INSTANCE.check(words);
        } catch (Exception e) {
            throw new KeyRecoveryException(WalletErrorCode.INVALID_BACKUP_PHRASE, "Invalid mnemonic", e);
        }
        checkIndex(scheme, index);
        return derive(words, scheme.pathFor(index), parsePrefixedPath(scheme, index), index);
    }

    /**
     * A path is well-formed when it starts at {@code m} and every segment above the leaf is
     * hardened. The leaf (address index) may be either.
     */
    public boolean validatePath(String path) {
        try {
            parsePath(path);
            return true;
        } catch (ConfigurationException e) {
            return false;
        }
    }

    public void validatePathPrefix(String pathPrefix) {
        parsePath(pathPrefix + "/0");
    }

    public List<ChildNumber> parsePath(String path) {
        if (path == null || path.isBlank()) {
            throw invalidPath(path, "path is empty");
        }
        String[] segments = path.trim().split("/", -1);
        if (!segments[0].equals("m") && !segments[0].equals("M")) {
            throw invalidPath(path, "path must start at the master key 'm'");
        }
        if (segments.length < 2) {
            throw invalidPath(path, "path has no segments below the master key");
        }
        List<ChildNumber> childNumbers = new ArrayList<>(segments.length - 1);
        for (int i = 1; i < segments.length; i++) {
            Matcher matcher = SEGMENT.matcher(segments[i].trim());
            if (!matcher.matches()) {
                throw invalidPath(path, "malformed segment '" + segments[i] + "'");
            }
            long number = Long.parseLong(matcher.group(1));
            if (number > MAX_CHILD_INDEX) {
                throw invalidPath(path, "segment " + segments[i] + " is out of range");
            }
            boolean hardened = !matcher.group(2).isEmpty();
            if (!hardened && i < segments.length - 1) {
                throw invalidPath(path, "segment " + segments[i] + " must be hardened");
            }
            childNumbers.add(new ChildNumber((int) number, hardened));
        }
        return childNumbers;
    }

    private List<String> generateMnemonic(int entropyBits) {
        try {
            byte[] entropy = new byte[entropyBits / 8];
            random.nextBytes(entropy);
            return MnemonicCode.INSTANCE.toMnemonic(entropy);
        } catch (Exception e) {
            log.error("Failed to generate mnemonic", e);
            throw new RuntimeException("Mnemonic generation failed", e);
        }
    }

    private SignerKey derive(List<String> mnemonic, String pathString, List<ChildNumber> path, int index) {
        try {
            DeterministicSeed seed = new DeterministicSeed(mnemonic, null, "", 0L);
            DeterministicKeyChain keyChain = DeterministicKeyChain.builder().seed(seed).build();
            DeterministicKey key = keyChain.getKeyByPath(path, true);
            return new SignerKey(index, pathString, key.getPubKey(), key.getPrivKeyBytes(), List.copyOf(mnemonic));
        } catch (Exception e) {
            log.error("Failed to derive signer key at index {}", index, e);
            throw new RuntimeException("Signer key derivation failed at index " + index, e);
        }
    }

    private List<ChildNumber> parsePrefixedPath(DerivationScheme scheme, int index) {
        validatePathPrefix(scheme.getPathPrefix());
        return parsePath(scheme.pathFor(index));
    }

    private void checkIndex(DerivationScheme scheme, int index) {
        if (index < 0 || index >= scheme.getSignerCount()) {
            throw new KeyRecoveryException(WalletErrorCode.INVALID_INDEX,
                    "Invalid signer index " + index + ", expected 0.." + (scheme.getSignerCount() - 1));
        }
    }

    private List<String> splitMnemonic(String mnemonic) {
        if (mnemonic == null || mnemonic.isBlank()) {
            throw new KeyRecoveryException(WalletErrorCode.INVALID_BACKUP_PHRASE, "Invalid mnemonic");
        }
        return List.of(mnemonic.trim().split("\\s+"));
    }

    private ConfigurationException invalidPath(String path, String reason) {
        return new ConfigurationException(WalletErrorCode.INVALID_PATH, "Invalid derivation path '" + path + "': " + reason);
    }

}
