package io.blogapi.server.core;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}
}
