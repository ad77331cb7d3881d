package io.perfectdict.core;

public class PerfectDictException extends RuntimeException {

    public PerfectDictException(Throwable cause) {
        super(cause);
    }

    public PerfectDictException(String message, Throwable cause) {
        super(message, cause);
    }

    public PerfectDictException(String message) {
        super(message);
    }

}
