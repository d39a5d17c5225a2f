package com.gdin.inspection.perspective.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 输入记录允许携带额外字段（例如原数据集里的 t1 / t2 / response1）
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static ObjectMapper mapper() {
        return simpleMapper;
    }

    public static String jsonSerialize(Object obj) throws JsonProcessingException {
        return jsonSerialize(obj, false);
    }

    public static String jsonSerialize(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) return null;
        if (pretty) return simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        else return simpleMapper.writeValueAsString(obj);
    }

    public static JsonNode readTree(InputStream is) throws IOException {
        return simpleMapper.readTree(is);
    }
}
