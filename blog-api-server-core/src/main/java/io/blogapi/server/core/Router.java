package io.blogapi.server.core;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Matches a method and path against registered route patterns.
 *
 * <p>Patterns are slash-separated; a segment of the form {@code {name}} captures exactly one path
 * segment. A single trailing slash on the request path is ignored.
 */
public final class Router {

    /**
     * Endpoint bound to a route.
     */
    @FunctionalInterface
    public interface Route {
        ServerResponse handle(ServerRequest request, PathParams params) throws Exception;
    }

    /**
     * Result of {@link #match(HttpMethod, String)}.
     */
    public sealed interface Match permits Match.Found, Match.MethodNotAllowed, Match.NotFound {

        record Found(Route route, PathParams params) implements Match {}

        /**
         * The path exists but not for this method.
         *
         * @param allowed methods registered for the path
         */
        record MethodNotAllowed(Set<HttpMethod> allowed) implements Match {}

        record NotFound() implements Match {}
    }

    private final List<Entry> entries = new ArrayList<>();

    public Router add(HttpMethod method, String pattern, Route route) {
        entries.add(new Entry(
                Objects.requireNonNull(method, "method"),
                segments(Objects.requireNonNull(pattern, "pattern")),
                Objects.requireNonNull(route, "route")));
        return this;
    }

    public Match match(HttpMethod method, String path) {
        String[] actual = segments(path);
        EnumSet<HttpMethod> allowed = EnumSet.noneOf(HttpMethod.class);

        for (Entry e : entries) {
            Map<String, String> params = e.bind(actual);
            if (params == null) continue;
            if (e.method == method) {
                return new Match.Found(e.route, new PathParams(params));
            }
            allowed.add(e.method);
        }
        return allowed.isEmpty() ? new Match.NotFound() : new Match.MethodNotAllowed(allowed);
    }

    /**
     * True if any route pattern matches the path, whatever its method.
     */
    public boolean knows(String path) {
        String[] actual = segments(path);
        for (Entry e : entries) {
            if (e.bind(actual) != null) return true;
        }
        return false;
    }

    private static String[] segments(String path) {
        String p = path;
        if (p.endsWith("/") && p.length() > 1) p = p.substring(0, p.length() - 1);
        if (p.startsWith("/")) p = p.substring(1);
        return p.isEmpty() ? new String[0] : p.split("/", -1);
    }

    private static final class Entry {
        private final HttpMethod method;
        private final String[] pattern;
        private final Route route;

        private Entry(HttpMethod method, String[] pattern, Route route) {
            this.method = method;
            this.pattern = pattern;
            this.route = route;
        }

        // null when the path does not fit the pattern
        Map<String, String> bind(String[] actual) {
            if (actual.length != pattern.length) return null;
            Map<String, String> params = new HashMap<>();
            for (int i = 0; i < pattern.length; i++) {
                String seg = pattern[i];
                if (seg.startsWith("{") && seg.endsWith("}")) {
                    if (actual[i].isEmpty()) return null;
                    params.put(seg.substring(1, seg.length() - 1), actual[i]);
                } else if (!seg.equals(actual[i])) {
                    return null;
                }
            }
            return params;
        }
    }
}
