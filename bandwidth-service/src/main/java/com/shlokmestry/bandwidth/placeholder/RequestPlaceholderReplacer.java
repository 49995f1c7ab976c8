package com.shlokmestry.bandwidth.placeholder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Resolves placeholders against the current servlet request.
 *
 * <p>Recognised keys:
 * <ul>
 *   <li>{@code http.request.method}, {@code http.request.scheme}, {@code http.request.host},
 *       {@code http.request.port}, {@code http.request.remote.host}</li>
 *   <li>{@code http.request.uri}, {@code http.request.uri.path}, {@code http.request.uri.query}</li>
 *   <li>{@code http.request.header.<Name>}, {@code http.request.uri.query.<name>},
 *       {@code http.request.cookie.<name>}</li>
 *   <li>{@code http.vars.<name>} - request attribute</li>
 *   <li>{@code env.<NAME>} - process environment</li>
 * </ul>
 */
public final class RequestPlaceholderReplacer implements PlaceholderReplacer {

    private static final String HEADER = "http.request.header.";
    private static final String QUERY_PARAM = "http.request.uri.query.";
    private static final String COOKIE = "http.request.cookie.";
    private static final String VARS = "http.vars.";
    private static final String ENV = "env.";

    private final HttpServletRequest request;

    public RequestPlaceholderReplacer(HttpServletRequest request) {
        this.request = request;
    }

    @Override
    public String replaceAll(String input, String empty) {
        return Placeholders.replaceAll(input, this::lookup, empty);
    }

    Optional<String> lookup(String key) {
        switch (key) {
            case "http.request.method":
                return Optional.ofNullable(request.getMethod());
            case "http.request.scheme":
                return Optional.ofNullable(request.getScheme());
            case "http.request.host":
                return Optional.ofNullable(request.getServerName());
            case "http.request.port":
                return Optional.of(String.valueOf(request.getServerPort()));
            case "http.request.remote.host":
                return Optional.ofNullable(request.getRemoteAddr());
            case "http.request.uri":
                String query = request.getQueryString();
                return Optional.ofNullable(request.getRequestURI())
                        .map(uri -> query == null ? uri : uri + "?" + query);
            case "http.request.uri.path":
                return Optional.ofNullable(request.getRequestURI());
            case "http.request.uri.query":
                return Optional.ofNullable(request.getQueryString());
            default:
                break;
        }

        if (key.startsWith(HEADER)) {
            return Optional.ofNullable(request.getHeader(key.substring(HEADER.length())));
        }
        if (key.startsWith(QUERY_PARAM)) {
            return queryParam(key.substring(QUERY_PARAM.length()));
        }
        if (key.startsWith(COOKIE)) {
            return cookie(key.substring(COOKIE.length()));
        }
        if (key.startsWith(VARS)) {
            return Optional.ofNullable(request.getAttribute(key.substring(VARS.length()))).map(String::valueOf);
        }
        if (key.startsWith(ENV)) {
            return Optional.ofNullable(System.getenv(key.substring(ENV.length())));
        }
        return Optional.empty();
    }

    private Optional<String> queryParam(String name) {
        String query = request.getQueryString();
        if (query == null) {
            return Optional.ofNullable(request.getParameter(name));
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String k = eq == -1 ? pair : pair.substring(0, eq);
            if (name.equals(URLDecoder.decode(k, StandardCharsets.UTF_8))) {
                return Optional.of(eq == -1 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return Optional.empty();
    }

    private Optional<String> cookie(String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) return Optional.empty();
        for (Cookie c : cookies) {
            if (name.equals(c.getName())) return Optional.ofNullable(c.getValue());
        }
        return Optional.empty();
    }
}
