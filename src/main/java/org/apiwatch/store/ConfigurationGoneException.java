package org.apiwatch.store;

/**
 * A result referenced a configuration that was deleted in the meantime.
 */
public class ConfigurationGoneException extends StoreException {

    private final long configId;

    public ConfigurationGoneException(long configId, Throwable cause) {
        super("Configuration " + configId + " no longer exists", cause);
        this.configId = configId;
    }

    public long getConfigId() {
        return configId;
    }
}
