package com.eyelevel.imageprocessor.common.json;

import java.nio.file.Path;

/**
 * Defines the contract for reading JSON documents (checkpoint records, indexes and batch reports)
 * into Java objects.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @param json      The JSON data as a string.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     * @return The parsed Java object.
     * @throws com.eyelevel.imageprocessor.exception.json.JsonParsingException if the JSON cannot be parsed.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @throws com.eyelevel.imageprocessor.exception.json.JsonParsingException if the JSON cannot be parsed.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Reads and parses a JSON file.
     *
     * @param file      The file to read.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     * @return The parsed Java object.
     * @throws com.eyelevel.imageprocessor.exception.json.JsonParsingException if the file cannot be read or parsed.
     */
    <T> T parseFile(Path file, Class<T> valueType);
}
