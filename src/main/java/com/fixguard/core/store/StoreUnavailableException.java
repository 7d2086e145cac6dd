package com.fixguard.core.store;

/**
 * Raised when the backing key-value store cannot be reached or rejects a command.
 * Callers treat it as fatal for the current operation; it is never retried locally.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message)                  { super(message); }
    public StoreUnavailableException(String message, Throwable cause) { super(message, cause); }
}
