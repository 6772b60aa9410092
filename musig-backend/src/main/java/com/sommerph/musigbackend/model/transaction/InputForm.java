package com.sommerph.musigbackend.model.transaction;

public enum InputForm {
    LEGACY,
    WITNESS
}
