package com.modelsentinel.flink;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.modelsentinel.core.error.ValidationException;
import com.modelsentinel.core.model.MetricObservation;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts raw Kafka bytes into a validated {@link MetricObservation}.
 *
 * <p>
 * Malformed or invalid messages are logged and dropped (returns
 * {@code null}) so one bad record cannot stop the pipeline.
 * </p>
 */
public class MetricObservationDeserializationSchema implements DeserializationSchema<MetricObservation> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricObservationDeserializationSchema.class);

    private transient ObjectMapper mapper;

    @Override
    public MetricObservation deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return objectMapper().readValue(message, MetricObservation.class);
        } catch (Exception e) {
            LOG.warn("Dropping invalid metric observation: {}", describe(e));
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(MetricObservation nextElement) {
        return false;
    }

    @Override
    public TypeInformation<MetricObservation> getProducedType() {
        return TypeInformation.of(MetricObservation.class);
    }

    private static String describe(Exception e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ValidationException) {
                return t.getMessage();
            }
        }
        return e.getMessage();
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        }
        return mapper;
    }
}
