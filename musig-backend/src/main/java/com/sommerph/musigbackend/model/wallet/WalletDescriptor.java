package com.sommerph.musigbackend.model.wallet;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WalletDescriptor {

    private String walletId;
    private String network;
    private int threshold;

    private List<String> publicKeys = new ArrayList<>();

    private String derivationPathPrefix;
    private List<String> derivationPaths = new ArrayList<>();

    private List<String> usedSigners = new ArrayList<>();

}
