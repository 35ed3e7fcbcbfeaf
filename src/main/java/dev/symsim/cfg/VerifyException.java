package dev.symsim.cfg;

public final class VerifyException extends Exception {
    public VerifyException(String message) {
        super(message);
    }
}
