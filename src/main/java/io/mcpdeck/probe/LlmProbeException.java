package io.mcpdeck.probe;

public final class LlmProbeException extends RuntimeException {
    public LlmProbeException(String message) {
        super(message);
    }

    public LlmProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
