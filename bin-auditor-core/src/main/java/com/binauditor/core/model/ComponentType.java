package com.binauditor.core.model;

public enum ComponentType {
    APPLICATION,
    LIBRARY
}
