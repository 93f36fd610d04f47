package com.ivamare.architecture.repository;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.architecture.entity.Entity;
import com.ivamare.architecture.exception.SerializationException;

/**
 * Encodes entities to JSON snapshots and back at persistence boundaries.
 *
 * <p>Fields are read directly so entities need no setters.
 */
public class EntitySerializer {

    private final ObjectMapper objectMapper;

    public EntitySerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
            .setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE)
            .setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Serialize an entity.
     *
     * @param entity The entity
     * @return JSON snapshot
     * @throws SerializationException if the entity cannot be encoded
     */
    public String serialize(Entity<?> entity) {
        try {
            return objectMapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + entity, e);
        }
    }

    /**
     * Materialize a fresh entity instance from a snapshot.
     *
     * @param json JSON snapshot
     * @param type Entity class
     * @param <E> entity type
     * @return new instance
     * @throws SerializationException if the snapshot cannot be decoded
     */
    public <E> E deserialize(String json, Class<E> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to deserialize " + type.getSimpleName(), e);
        }
    }
}
