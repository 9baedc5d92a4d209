package io.blogapi.servlet;

import io.blogapi.core.Protocol;
import io.blogapi.server.core.BlogApiHandler;
import io.blogapi.server.core.HttpMethod;
import io.blogapi.server.core.ResponseBody;
import io.blogapi.server.core.ServerRequest;
import io.blogapi.server.core.ServerResponse;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Jakarta Servlet adapter for {@link BlogApiHandler}.
 *
 * <p>Mount it at {@code <base-path>/*}. The part of the request path after the mount point is
 * resolved against {@code /api}, so the handler sees the same paths whatever the base path and
 * context path are.
 */
public final class BlogApiServlet extends HttpServlet {

    private static final Logger LOG = LoggerFactory.getLogger(BlogApiServlet.class);

    private final transient BlogApiHandler handler;

    public BlogApiServlet(BlogApiHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        Optional<HttpMethod> method = HttpMethod.parse(req.getMethod());
        if (method.isEmpty()) {
            writeRaw(resp, 405, "{\"detail\":\"Method Not Allowed\"}");
            return;
        }

        ServerResponse engineResp;
        try {
            engineResp = handler.handle(toEngineRequest(req, method.get()), req.getRemoteAddr());
        } catch (URISyntaxException e) {
            LOG.debug("Rejected request URI {}: {}", req.getRequestURI(), e.getMessage());
            writeRaw(resp, 400, "{\"detail\":\"Bad Request\"}");
            return;
        }

        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));

        ResponseBody body = engineResp.body();
        if (body instanceof ResponseBody.Bytes bytes) {
            resp.setContentLength(bytes.bytes().length);
            resp.getOutputStream().write(bytes.bytes());
        }
    }

    private static ServerRequest toEngineRequest(HttpServletRequest req, HttpMethod method)
            throws IOException, URISyntaxException {
        String pathInfo = req.getPathInfo();
        String path = Protocol.API_PREFIX + (pathInfo == null ? "" : pathInfo);
        URI uri = new URI(null, null, path, req.getQueryString(), null);

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }

        // the handler enforces the body size limit while reading
        return new ServerRequest(method, uri, headers, req.getInputStream());
    }

    private static void writeRaw(HttpServletResponse resp, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        resp.setStatus(status);
        resp.setContentType(Protocol.CT_JSON);
        resp.setContentLength(bytes.length);
        resp.getOutputStream().write(bytes);
    }
}
