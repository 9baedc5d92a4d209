package io.blogapi.json.spi;

/**
 * Raised by a {@link JsonCodec} when a request body cannot be bound to its target type or a response
 * cannot be encoded. The message names the target type; the cause is the codec's own exception.
 */
public class JsonException extends Exception {
    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
