package de.htwsaar.datalinker.common.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public final class JacksonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static {
        MAPPER.registerModule(new JavaTimeModule());
        // Instants als ISO-8601 statt Epoch-Zahl
        MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private JacksonCodec() {
        // Utility
    }

    /**
     * Liefert den gemeinsam genutzten, vorkonfigurierten Mapper.
     *
     * @return ObjectMapper mit JavaTimeModule
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new DatalinkSerializationException("Failed to serialize object to the JSON format", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new DatalinkSerializationException(
                    "Failed to deserialize JSON format to : [" + clazz.getSimpleName() + "]", e);
        }
    }

    public static <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DatalinkSerializationException(
                    "Failed to deserialize JSON format to : [" + type.getType().getTypeName() + "]", e);
        }
    }
}
