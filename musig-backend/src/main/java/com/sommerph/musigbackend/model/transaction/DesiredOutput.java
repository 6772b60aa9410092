package com.sommerph.musigbackend.model.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DesiredOutput {
    private final String address;
    private final long amount;
}
