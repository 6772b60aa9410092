package com.sommerph.musigbackend.model.key;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DerivationScheme {

    private String pathPrefix;
    private int signerCount;
    private int entropyBits;

    public String pathFor(int index) {
        return pathPrefix + "/" + index;
    }

}
