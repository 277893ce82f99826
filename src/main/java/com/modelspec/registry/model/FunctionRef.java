package com.modelspec.registry.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Name of an engine callable and, optionally, the package it comes from.
 */
@Value
public class FunctionRef {

    String pkg;

    @NonNull
    String name;

    public static FunctionRef of(String pkg, String name) {
        return new FunctionRef(pkg, name);
    }

    public static FunctionRef of(String name) {
        return new FunctionRef(null, name);
    }

    @Override
    public String toString() {
        return pkg == null ? name : pkg + "::" + name;
    }
}
