package com.eyelevel.imageprocessor.common.json.jackson;

import com.eyelevel.imageprocessor.common.json.JsonSerializer;
import com.eyelevel.imageprocessor.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        return serialize(object, false);
    }

    @Override
    public <T> String serialize(T object, boolean prettyPrint) {
        log.debug("Serializing {} to JSON string (prettyPrint: {})", object.getClass().getSimpleName(), prettyPrint);
        try {
            return writer(prettyPrint).writeValueAsString(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing {} to JSON", object.getClass().getName(), e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }

    @Override
    public <T> byte[] serializeToBytes(T object, boolean prettyPrint) {
        try {
            return writer(prettyPrint).writeValueAsBytes(object);
        } catch (JsonProcessingException e) {
            log.error("Error serializing {} to JSON bytes", object.getClass().getName(), e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }

    @Override
    public <T> void writeToFile(T object, Path target) {
        log.debug("Writing {} as JSON to '{}'", object.getClass().getSimpleName(), target);
        try {
            Files.write(target, serializeToBytes(object, true));
        } catch (IOException e) {
            log.error("Error writing JSON file '{}'", target, e);
            throw new JsonParsingException("Error writing JSON file " + target, e);
        }
    }

    private ObjectWriter writer(boolean prettyPrint) {
        return prettyPrint ? objectMapper.writerWithDefaultPrettyPrinter() : objectMapper.writer();
    }
}
