package io.github.crudgraph.service.storage;

import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ServerError;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide holder of the storage client.
 * <p>
 * Lifecycle: {@link #initialize(StorageClient)} exactly once at startup, {@link #client()} afterwards,
 * {@link #close()} on shutdown. A second initialization fails with
 * {@link ServerError#STORAGE_ALREADY_INITIALIZED}; access before initialization fails with
 * {@link ServerError#STORAGE_NOT_INITIALIZED}.
 */
@Slf4j
public class StorageConnection implements AutoCloseable {

    private final AtomicReference<StorageClient> client = new AtomicReference<>();

    public StorageClient initialize(StorageClient storageClient) {
        if (!client.compareAndSet(null, storageClient)) {
            throw new ApplicationException(ServerError.STORAGE_ALREADY_INITIALIZED);
        }
        log.info("Storage connection initialized with {}", storageClient.getClass().getSimpleName());
        return storageClient;
    }

    public StorageClient client() {
        StorageClient current = client.get();
        if (current == null) {
            throw new ApplicationException(ServerError.STORAGE_NOT_INITIALIZED);
        }
        return current;
    }

    public boolean isInitialized() {
        return client.get() != null;
    }

    @Override
    public void close() {
        if (client.getAndSet(null) != null) {
            log.info("Storage connection closed");
        }
    }
}
