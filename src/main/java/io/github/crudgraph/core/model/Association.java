package io.github.crudgraph.core.model;

import io.github.crudgraph.core.enums.AssociationType;
import lombok.Value;
import lombok.With;

/**
 * Declared relationship from a source entity to a target entity.
 * <ul>
 *     <li>{@code BELONGS_TO}: {@code foreignKey} is an attribute of the source</li>
 *     <li>{@code HAS_ONE} / {@code HAS_MANY}: {@code foreignKey} is an attribute of the target</li>
 *     <li>{@code BELONGS_TO_MANY}: {@code foreignKey} (to the source) and {@code otherKey} (to the target)
 *     are attributes of the {@code through} entity</li>
 * </ul>
 */
@Value
@With
public class Association {

    AssociationType type;
    String as;
    String source;
    String target;
    String foreignKey;
    String through;
    String otherKey;

    public static Association belongsTo(String as, String target, String foreignKey) {
        return new Association(AssociationType.BELONGS_TO, as, null, target, foreignKey, null, null);
    }

    public static Association hasOne(String as, String target, String foreignKey) {
        return new Association(AssociationType.HAS_ONE, as, null, target, foreignKey, null, null);
    }

    public static Association hasMany(String as, String target, String foreignKey) {
        return new Association(AssociationType.HAS_MANY, as, null, target, foreignKey, null, null);
    }

    public static Association belongsToMany(String as, String target, String through,
                                            String foreignKey, String otherKey) {
        return new Association(AssociationType.BELONGS_TO_MANY, as, null, target, foreignKey, through, otherKey);
    }

    public boolean isForeignKeyOnSource() {
        return type.isForeignKeyOnSource();
    }
}
