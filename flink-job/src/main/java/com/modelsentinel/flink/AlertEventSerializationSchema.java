package com.modelsentinel.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;

import java.nio.charset.StandardCharsets;

/**
 * Writes {@link AlertEvent}s as JSON for the alerts topic. The record key is
 * the model id (see {@link #keySchema()}) so every event of a model lands in
 * one partition, in order.
 */
public class AlertEventSerializationSchema implements SerializationSchema<AlertEvent> {

    private static final long serialVersionUID = 1L;

    private transient ObjectMapper mapper;

    /**
     * @throws IllegalStateException if the event cannot be written as JSON
     */
    @Override
    public byte[] serialize(AlertEvent event) {
        try {
            return objectMapper().writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize alert event " + event, e);
        }
    }

    /**
     * @return schema producing the UTF-8 model id of an event
     */
    public static SerializationSchema<AlertEvent> keySchema() {
        return event -> event.getAlert().getModelId().getBytes(StandardCharsets.UTF_8);
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
