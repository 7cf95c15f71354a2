package com.ciro.jtemplatex.error;

public class TxRenderException extends RuntimeException {

    private final RenderFailure failure;

    public TxRenderException(RenderFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public TxRenderException(RenderFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public RenderFailure failure() {
        return failure;
    }

    public static TxRenderException parseFailed(String message, Throwable cause) {
        return new TxRenderException(RenderFailure.PARSE_FAILED, message, cause);
    }

    @Override
    public String toString() {
        return "TxRenderException[" + failure + "]: " + getMessage();
    }
}
