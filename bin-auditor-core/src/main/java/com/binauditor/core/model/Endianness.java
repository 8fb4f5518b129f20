package com.binauditor.core.model;

public enum Endianness {
    LITTLE,
    BIG
}
