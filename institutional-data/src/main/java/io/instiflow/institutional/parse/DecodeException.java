package io.instiflow.institutional.parse;

public class DecodeException extends Exception {
    public DecodeException(String message) {
        super(message);
    }
}
