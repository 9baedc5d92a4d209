package io.blogapi.server.core;

import java.util.Map;

/**
 * Values captured from {@code {name}} segments of a route pattern.
 */
public record PathParams(Map<String, String> values) {

    public PathParams {
        values = Map.copyOf(values);
    }

    /**
     * @throws IllegalArgumentException if the route has no such parameter
     */
    public String get(String name) {
        String v = values.get(name);
        if (v == null) throw new IllegalArgumentException("no path parameter " + name);
        return v;
    }
}
