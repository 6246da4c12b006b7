package com.eyelevel.imageprocessor.common.json;

import java.nio.file.Path;

/**
 * Defines the contract for serializing Java objects into JSON data.
 */
public interface JsonSerializer {

    /**
     * Serializes a Java object into its compact JSON representation.
     *
     * @throws com.eyelevel.imageprocessor.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object);

    /**
     * Serializes a Java object into its JSON representation.
     *
     * @param object      The Java object to serialize.
     * @param prettyPrint whether to format the JSON with indentation and line breaks.
     * @param <T>         The type of the Java object.
     * @return The JSON representation of the object as a string.
     * @throws com.eyelevel.imageprocessor.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object, boolean prettyPrint);

    /**
     * Serializes a Java object into UTF-8 JSON bytes.
     *
     * @throws com.eyelevel.imageprocessor.exception.json.JsonParsingException if serialization fails.
     */
    <T> byte[] serializeToBytes(T object, boolean prettyPrint);

    /**
     * Writes the pretty-printed JSON representation of {@code object} to {@code target}, replacing
     * any existing file.
     *
     * @throws com.eyelevel.imageprocessor.exception.json.JsonParsingException if the file cannot be written.
     */
    <T> void writeToFile(T object, Path target);
}
