package com.eyelevel.uploadqueue.common.json;

/**
 * Defines the contract for parsing JSON payloads received from external services.
 */
public interface JsonParser {

    /**
     * Parses JSON bytes into an object of the given type.
     *
     * @throws com.eyelevel.uploadqueue.exception.json.JsonParsingException if the bytes are not valid JSON
     *                                                                      for {@code valueType}
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
