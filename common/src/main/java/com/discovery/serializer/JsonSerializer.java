package com.discovery.serializer;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Json 序列化器
 *
 * @author sakame
 * @version 1.0
 */
public class JsonSerializer implements Serializer {

    private static final Gson GSON = new Gson();

    @Override
    public <T> byte[] serialize(T object) throws IOException {
        return GSON.toJson(object).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public <T> T deserialize(byte[] bytes, Class<T> type) throws IOException {
        try {
            return GSON.fromJson(new String(bytes, StandardCharsets.UTF_8), type);
        } catch (JsonParseException e) {
            throw new IOException("malformed json for " + type.getSimpleName(), e);
        }
    }
}
