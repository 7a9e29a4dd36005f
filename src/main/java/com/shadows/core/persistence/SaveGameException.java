package com.shadows.core.persistence;

/**
 * A save file or scenario document could not be read or written.
 */
public class SaveGameException extends RuntimeException {

    public SaveGameException(String message, Throwable cause) {
        super(message, cause);
    }
}
