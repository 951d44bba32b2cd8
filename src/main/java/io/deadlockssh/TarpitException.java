package io.deadlockssh;

import lombok.Getter;

@Getter
public class TarpitException extends Exception {
    private final TarpitExceptionType type;

    public TarpitException(TarpitExceptionType type, String errorMessage) {
        super(errorMessage);
        this.type = type;
    }

    public TarpitException(TarpitExceptionType type, String errorMessage, Throwable cause) {
        super(errorMessage, cause);
        this.type = type;
    }
}
