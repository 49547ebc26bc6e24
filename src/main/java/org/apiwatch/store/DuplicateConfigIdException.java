package org.apiwatch.store;

public class DuplicateConfigIdException extends StoreException {

    private final long configId;

    public DuplicateConfigIdException(long configId, Throwable cause) {
        super("config_id " + configId + " already exists", cause);
        this.configId = configId;
    }

    public long getConfigId() {
        return configId;
    }
}
