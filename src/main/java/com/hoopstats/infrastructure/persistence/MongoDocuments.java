package com.hoopstats.infrastructure.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.bson.Document;

import java.util.Map;

/**
 * Converts domain objects to and from BSON documents through Jackson.
 *
 * <p>Instants are written as ISO-8601 strings so that they read back without BSON-specific
 * types; the Mongo {@code _id} is dropped on the way back.</p>
 */
final class MongoDocuments {

    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        OBJECT_MAPPER.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private MongoDocuments() {
    }

    @SuppressWarnings("unchecked")
    static Document toDocument(Object value) {
        Map<String, Object> map = OBJECT_MAPPER.convertValue(value, Map.class);
        return new Document(map);
    }

    static <T> T fromDocument(Document doc, Class<T> type) {
        Document copy = new Document(doc);
        copy.remove("_id");
        return OBJECT_MAPPER.convertValue(copy, type);
    }
}
