package io.github.crudgraph.generator;

import io.github.crudgraph.core.context.AuthContext;
import lombok.Value;

import java.util.function.Predicate;

/**
 * Scoping rule keyed on an auth metadata entry. The key doubles as the path restricted by the metadata values.
 */
@Value
public class PermissionDefinition {

    String key;
    Predicate<AuthContext> shouldApply;

    public static PermissionDefinition of(String key) {
        return new PermissionDefinition(key, null);
    }

    public static PermissionDefinition of(String key, Predicate<AuthContext> shouldApply) {
        return new PermissionDefinition(key, shouldApply);
    }

    public boolean appliesTo(AuthContext auth) {
        return shouldApply == null || shouldApply.test(auth);
    }
}
