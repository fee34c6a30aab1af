package com.orgscope.backend.support;

import java.lang.reflect.Field;

/**
 * Assigns database-generated ids to entities built in unit tests.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static <T> T withId(T entity, Long id) {
        Class<?> type = entity.getClass();
        while (type != null) {
            try {
                Field idField = type.getDeclaredField("id");
                idField.setAccessible(true);
                idField.set(entity, id);
                return entity;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (ReflectiveOperationException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalStateException("No id field on " + entity.getClass().getName());
    }
}
