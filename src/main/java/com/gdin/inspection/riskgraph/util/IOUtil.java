package com.gdin.inspection.riskgraph.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

public class IOUtil {
    private static final ObjectMapper simpleMapper = new ObjectMapper();

    static {
        simpleMapper.registerModule(new JavaTimeModule());
        // 避免写成时间戳（否则 Instant 会变成 long）
        simpleMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        simpleMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static ObjectMapper mapper() {
        return simpleMapper;
    }

    public static String jsonSerialize(Object obj, boolean pretty) throws JsonProcessingException {
        if (obj == null) return null;
        return pretty
                ? simpleMapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj)
                : simpleMapper.writeValueAsString(obj);
    }

    /**
     * 读取 JSON 数组为指定类型的列表；流为空内容时返回空列表，格式错误直接抛出。
     */
    public static <T> List<T> readList(InputStream is, Class<T> elementType) throws IOException {
        JavaType type = simpleMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        List<T> list = simpleMapper.readValue(is, type);
        return list == null ? Collections.emptyList() : list;
    }

    public static void writeJson(Path path, Object obj) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(path, jsonSerialize(obj, true));
    }
}
