package com.pricetracker.scraper.domain.proxy;

import java.net.URI;
import java.util.Locale;

/**
 * Upstream proxy address. Credentials are optional and never rendered by {@link #toString()}.
 */
public record ProxyEndpoint(String scheme, String host, int port, String username, String password) {

    public static ProxyEndpoint parse(String raw) {
        URI uri;
        try {
            uri = URI.create(raw.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed proxy address: " + raw, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null || uri.getPort() <= 0) {
            throw new IllegalArgumentException(
                    "Proxy address must look like scheme://[user:pass@]host:port, got " + raw);
        }
        String username = null;
        String password = null;
        var userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            var separator = userInfo.indexOf(':');
            username = separator < 0 ? userInfo : userInfo.substring(0, separator);
            password = separator < 0 ? null : userInfo.substring(separator + 1);
        }
        return new ProxyEndpoint(
                uri.getScheme().toLowerCase(Locale.ROOT), uri.getHost(), uri.getPort(), username, password);
    }

    public boolean hasCredentials() {
        return username != null;
    }

    public String address() {
        return scheme + "://" + host + ":" + port;
    }

    @Override
    public String toString() {
        return address();
    }
}
