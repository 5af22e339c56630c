package com.libragraph.vcl.formats.api;

/**
 * Thrown when compressed content cannot be decoded, i.e. it is corrupt or truncated.
 */
public class DecodeException extends RuntimeException {

    private final String codec;

    public DecodeException(String codec, String message, Throwable cause) {
        super(message, cause);
        this.codec = codec;
    }

    public DecodeException(String codec, String message) {
        super(message);
        this.codec = codec;
    }

    public String codec() {
        return codec;
    }
}
