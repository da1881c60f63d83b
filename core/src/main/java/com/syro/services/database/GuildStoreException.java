package com.syro.services.database;

/**
 * Raised by a {@link GuildSettingsStore} when the backing storage cannot be read or written.
 */
public class GuildStoreException extends RuntimeException {
    public GuildStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
