package com.sommerph.musigbackend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "multisig")
public class MultisigProperties {

    @NotBlank
    private String network = "testnet";

    @Valid
    private Derivation derivation = new Derivation();

    @Data
    public static class Derivation {
        // Falls back to the BIP48 P2WSH prefix of the network when unset
        private String pathPrefix;
        private int entropyBits = 256;

        // BIP39 allows 128 to 256 bits in steps of 32
        @AssertTrue(message = "entropy-bits must be one of 128, 160, 192, 224 or 256")
        public boolean isEntropyBitsSupported() {
            return entropyBits >= 128 && entropyBits <= 256 && entropyBits % 32 == 0;
        }
    }

}
