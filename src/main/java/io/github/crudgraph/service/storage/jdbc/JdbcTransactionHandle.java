package io.github.crudgraph.service.storage.jdbc;

import io.github.crudgraph.service.storage.TransactionHandle;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.TransactionStatus;

@RequiredArgsConstructor
class JdbcTransactionHandle implements TransactionHandle {

    private final TransactionStatus status;

    @Override
    public boolean isActive() {
        return !status.isCompleted();
    }

    @Override
    public void setRollbackOnly() {
        status.setRollbackOnly();
    }
}
