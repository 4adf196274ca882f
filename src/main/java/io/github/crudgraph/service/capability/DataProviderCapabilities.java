package io.github.crudgraph.service.capability;

import io.github.crudgraph.core.enums.CrudGraphOperation;
import io.github.crudgraph.core.exception.ApplicationException;
import io.github.crudgraph.core.exception.ClientError;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Operations a data provider supports, resolved once from the capability interfaces it implements.
 */
@Getter
public final class DataProviderCapabilities {

    private final Object provider;
    private final Set<CrudGraphOperation> operations;

    private DataProviderCapabilities(Object provider, Set<CrudGraphOperation> operations) {
        this.provider = provider;
        this.operations = Collections.unmodifiableSet(operations);
    }

    public static DataProviderCapabilities of(Object provider) {
        Set<CrudGraphOperation> operations = EnumSet.noneOf(CrudGraphOperation.class);
        if (provider instanceof ListCapable) {
            operations.add(CrudGraphOperation.GET_LIST);
        }
        if (provider instanceof GetCapable) {
            operations.add(CrudGraphOperation.GET_ITEM);
        }
        if (provider instanceof CreateCapable) {
            operations.add(CrudGraphOperation.CREATE);
        }
        if (provider instanceof UpdateCapable) {
            operations.add(CrudGraphOperation.UPDATE);
        }
        if (provider instanceof DeleteCapable) {
            operations.add(CrudGraphOperation.DELETE);
        }
        return new DataProviderCapabilities(provider, operations);
    }

    public boolean supports(CrudGraphOperation operation) {
        return operations.contains(operation);
    }

    @SuppressWarnings("unchecked")
    public <R> ListCapable<R> lister() {
        require(CrudGraphOperation.GET_LIST);
        return (ListCapable<R>) provider;
    }

    @SuppressWarnings("unchecked")
    public <R> GetCapable<R> getter() {
        require(CrudGraphOperation.GET_ITEM);
        return (GetCapable<R>) provider;
    }

    @SuppressWarnings("unchecked")
    public <R> CreateCapable<R> creator() {
        require(CrudGraphOperation.CREATE);
        return (CreateCapable<R>) provider;
    }

    @SuppressWarnings("unchecked")
    public <R> UpdateCapable<R> updater() {
        require(CrudGraphOperation.UPDATE);
        return (UpdateCapable<R>) provider;
    }

    @SuppressWarnings("unchecked")
    public <R> DeleteCapable<R> deleter() {
        require(CrudGraphOperation.DELETE);
        return (DeleteCapable<R>) provider;
    }

    private void require(CrudGraphOperation operation) {
        if (!supports(operation)) {
            throw new ApplicationException(ClientError.OPERATION_NOT_SUPPORTED, Map.of("operation", operation));
        }
    }
}
