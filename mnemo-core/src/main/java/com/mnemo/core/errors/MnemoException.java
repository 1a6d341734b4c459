package com.mnemo.core.errors;

import lombok.Getter;

/**
 * Raised for configuration problems and failures of collaborators that the caller has to see
 */
@Getter
public class MnemoException extends RuntimeException {
    private final ErrorType errorType;

    public MnemoException(ErrorType errorType, Object... args) {
        super(errorType.getMessage().formatted(args));
        this.errorType = errorType;
    }

    public MnemoException(Throwable cause, ErrorType errorType, Object... args) {
        super(errorType.getMessage().formatted(args), cause);
        this.errorType = errorType;
    }
}
