package org.ecschema.rdf.tool;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Object mapping service class.
 */
public final class MapperUtils {
    private static final ObjectMapper mapper;
    static {
        mapper = JsonMapper.builder()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
                .build();
    }

    public static ObjectMapper getObjectMapper() {
        return mapper;
    }

    private MapperUtils() {}
}
