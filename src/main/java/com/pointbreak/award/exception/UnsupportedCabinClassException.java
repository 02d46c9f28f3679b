package com.pointbreak.award.exception;

public class UnsupportedCabinClassException extends SearchValidationException {
    public UnsupportedCabinClassException(String message) {
        super(message);
    }

    public UnsupportedCabinClassException(String message, Throwable e) {
        super(message, e);
    }
}
