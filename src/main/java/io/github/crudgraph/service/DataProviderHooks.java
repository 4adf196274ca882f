package io.github.crudgraph.service;

import io.github.crudgraph.core.context.AuthContext;

import java.util.Map;

/**
 * Lifecycle hook methods for EntityDataProvider
 * All methods pass their input through by default - override as needed
 */
public abstract class DataProviderHooks {

    // ==================== CREATE HOOKS ====================

    /**
     * Called before the input of a create is deserialized and persisted
     * @param input The validated input
     * @return the input to persist
     */
    protected Map<String, Object> beforeCreate(AuthContext auth, Map<String, Object> input) {
        return input;
    }

    /**
     * Called after the created item has been read back
     * @param created The created item with generated ids
     * @param input The input it was created from
     * @return the item to serialize
     */
    protected Map<String, Object> afterCreate(AuthContext auth, Map<String, Object> created, Map<String, Object> input) {
        return created;
    }

    // ==================== UPDATE HOOKS ====================

    /**
     * Called before the completed input of an update is persisted
     * @param input The input, merged with the existing item for partial updates
     * @param existing The current state of the item
     * @return the input to persist
     */
    protected Map<String, Object> beforeUpdate(AuthContext auth, Map<String, Object> input,
                                               Map<String, Object> existing) {
        return input;
    }

    /**
     * Called after the updated item has been read back
     * @param updated The updated item
     * @param existing The previous state of the item
     * @return the item to serialize
     */
    protected Map<String, Object> afterUpdate(AuthContext auth, Map<String, Object> updated,
                                              Map<String, Object> existing) {
        return updated;
    }
}
