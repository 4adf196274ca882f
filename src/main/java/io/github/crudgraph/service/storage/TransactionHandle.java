package io.github.crudgraph.service.storage;

/**
 * Handle of the storage transaction a write callback runs in.
 */
public interface TransactionHandle {

    boolean isActive();

    void setRollbackOnly();
}
