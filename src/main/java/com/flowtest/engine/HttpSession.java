package com.flowtest.engine;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseCookie;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * The HTTP client state shared by the steps of one flow run.
 * <p>
 * Cookies set by a response are sent with later requests of the same session whose host and path
 * match the cookie, unless the request carries a cookie of the same name. A cookie without a
 * {@code Domain} attribute is only sent back to the host that set it; with one, it is also sent to
 * subdomains of that domain. A cookie with a max age of zero is dropped.
 */
public final class HttpSession {

    private final Map<CookieKey, StoredCookie> cookies = new LinkedHashMap<>();
    private final WebClient client;

    public HttpSession(WebClient baseClient) {
        this.client = baseClient.mutate().filter(cookieJar()).build();
    }

    public WebClient client() {
        return client;
    }

    /**
     * All stored cookies by name, regardless of the host they belong to.
     */
    public Map<String, String> cookies() {
        Map<String, String> byName = new LinkedHashMap<>();
        synchronized (cookies) {
            cookies.values().forEach(cookie -> byName.put(cookie.name(), cookie.value()));
        }
        return byName;
    }

    /**
     * The stored cookies that a request to {@code uri} should carry.
     */
    List<StoredCookie> cookiesFor(URI uri) {
        String host = host(uri);
        String path = StringUtils.hasLength(uri.getRawPath()) ? uri.getRawPath() : "/";
        List<StoredCookie> matching = new ArrayList<>();
        synchronized (cookies) {
            for (StoredCookie cookie : cookies.values()) {
                if (cookie.matchesHost(host) && cookie.matchesPath(path)) {
                    matching.add(cookie);
                }
            }
        }
        return matching;
    }

    void store(URI origin, ResponseCookie received) {
        String domain = received.getDomain();
        boolean hostOnly = !StringUtils.hasText(domain);
        String cookieDomain = hostOnly ? host(origin) : trimLeadingDot(domain.toLowerCase(Locale.ROOT));
        String cookiePath = StringUtils.hasText(received.getPath()) && received.getPath().startsWith("/")
                ? received.getPath() : defaultPath(origin);
        CookieKey key = new CookieKey(received.getName(), cookieDomain, cookiePath);
        synchronized (cookies) {
            if (received.getMaxAge().isZero()) {
                cookies.remove(key);
            } else {
                cookies.put(key, new StoredCookie(received.getName(), received.getValue(), cookieDomain, hostOnly, cookiePath));
            }
        }
    }

    private ExchangeFilterFunction cookieJar() {
        return (request, next) -> {
            ClientRequest withCookies = ClientRequest.from(request)
                    .cookies(jar -> cookiesFor(request.url()).forEach(cookie -> {
                        if (!jar.containsKey(cookie.name())) {
                            jar.add(cookie.name(), cookie.value());
                        }
                    }))
                    .build();
            return next.exchange(withCookies).doOnNext(response ->
                    response.cookies().forEach((name, received) ->
                            received.forEach(cookie -> store(request.url(), cookie))));
        };
    }

    private static String host(URI uri) {
        return uri.getHost() != null ? uri.getHost().toLowerCase(Locale.ROOT) : "";
    }

    private static String trimLeadingDot(String domain) {
        return domain.startsWith(".") ? domain.substring(1) : domain;
    }

    /**
     * The directory of the request path: {@code /users/7} yields {@code /users}, {@code /login} yields {@code /}.
     */
    private static String defaultPath(URI uri) {
        String path = uri.getRawPath();
        if (!StringUtils.hasLength(path) || !path.startsWith("/")) {
            return "/";
        }
        int lastSlash = path.lastIndexOf('/');
        return lastSlash == 0 ? "/" : path.substring(0, lastSlash);
    }

    private record CookieKey(String name, String domain, String path) {
    }

    record StoredCookie(String name, String value, String domain, boolean hostOnly, String path) {

        boolean matchesHost(String host) {
            if (hostOnly) {
                return host.equals(domain);
            }
            return host.equals(domain) || host.endsWith("." + domain);
        }

        boolean matchesPath(String requestPath) {
            if (requestPath.equals(path)) {
                return true;
            }
            if (!requestPath.startsWith(path)) {
                return false;
            }
            return path.endsWith("/") || requestPath.charAt(path.length()) == '/';
        }
    }
}
