package com.stagecraft.engine.storage;

public class ImageStoreException extends RuntimeException {

    public ImageStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
