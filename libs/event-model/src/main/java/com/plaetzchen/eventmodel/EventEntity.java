package com.plaetzchen.eventmodel;

/**
 * The domain entity an event relates to.
 *
 * @param entityType the kind of entity, see {@link EntityType}
 * @param entityId database id of the entity instance
 */
public record EventEntity(String entityType, String entityId) {

    public static EventEntity of(EntityType type, long id) {
        return new EventEntity(type.value(), Long.toString(id));
    }
}
