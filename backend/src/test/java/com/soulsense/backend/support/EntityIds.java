package com.soulsense.backend.support;

import java.lang.reflect.Field;
import java.util.UUID;

/**
 * Assigns the generated id the way Hibernate would, for entities that never see a database.
 */
public final class EntityIds {

    private EntityIds() {
    }

    public static <T> T assign(T entity, UUID id) {
        try {
            Field idField = entity.getClass().getDeclaredField("id");
            idField.setAccessible(true);
            if (idField.get(entity) == null) {
                idField.set(entity, id);
            }
            return entity;
        } catch (ReflectiveOperationException ex) {
            throw new IllegalStateException(ex);
        }
    }

    public static <T> T assign(T entity) {
        return assign(entity, UUID.randomUUID());
    }
}
