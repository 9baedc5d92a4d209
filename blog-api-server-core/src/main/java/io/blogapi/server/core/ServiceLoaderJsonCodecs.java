package io.blogapi.server.core;

import io.blogapi.json.spi.JsonCodec;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Resolves a {@link JsonCodec} through {@link ServiceLoader}.
 *
 * <p>Used when no codec is passed to {@link BlogApiHandler.Builder#jsonCodec(JsonCodec)}. Add a codec
 * module such as {@code blog-api-json-jackson} to the classpath.
 */
public final class ServiceLoaderJsonCodecs {

    private ServiceLoaderJsonCodecs() {}

    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    /**
     * @throws IllegalStateException if no codec is installed
     */
    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodec> it = ServiceLoader.load(JsonCodec.class, cl).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("no JsonCodec installed; add blog-api-json-jackson to the classpath");
        }
        return it.next();
    }
}
