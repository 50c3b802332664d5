package com.stagecraft.engine.provider;

public class ProviderNotFoundException extends RuntimeException {
    public ProviderNotFoundException(String name) {
        super("No image provider registered with name: '" + name + "'");
    }
}
