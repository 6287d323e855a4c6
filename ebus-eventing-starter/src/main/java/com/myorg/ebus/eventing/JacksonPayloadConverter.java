package com.myorg.ebus.eventing;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;

public class JacksonPayloadConverter implements PayloadConverter {

    private final ObjectMapper mapper;

    public JacksonPayloadConverter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T read(byte[] body, Class<T> type) {
        if (body == null) {
            throw new IllegalArgumentException("Cannot convert empty body to " + type.getName());
        }
        // raw text subscribers get the body as is
        if (type == String.class) {
            return (T) new String(body, StandardCharsets.UTF_8);
        }
        if (type == byte[].class) {
            return (T) body;
        }
        try {
            return mapper.readValue(body, type);
        } catch (Exception e) {
            throw new IllegalArgumentException(
                    "Cannot convert message body to " + type.getName() + ", length=" + body.length, e
            );
        }
    }
}
