package com.eyelevel.imageprocessor.common.json.jackson;

import com.eyelevel.imageprocessor.common.json.JsonParser;
import com.eyelevel.imageprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Implementation of the {@link JsonParser} interface backed by the application's Jackson {@link ObjectMapper}.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        return parseJson(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        return parseJson(jsonBytes, valueType);
    }

    @Override
    public <T> T parseFile(Path file, Class<T> valueType) {
        log.debug("Parsing JSON file '{}' to object of type: {}", file, valueType.getName());
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new JsonParsingException("Unable to read JSON file " + file, e);
        }
        return parseJson(bytes, valueType);
    }

    private <T> T parseJson(byte[] jsonBytes, Class<T> valueType) {
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing was successful: {}", result);
            return result;
        } catch (IOException e) {
            log.error("Error parsing JSON with Class: {}", valueType.getName(), e);
            throw new JsonParsingException("Error parsing JSON into " + valueType.getSimpleName(), e);
        }
    }
}
