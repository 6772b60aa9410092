package com.sommerph.musigbackend.model.wallet;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class WalletAddresses {
    private String p2sh;
    private String p2wsh;
}
