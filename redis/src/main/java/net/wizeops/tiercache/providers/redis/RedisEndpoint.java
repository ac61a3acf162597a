package net.wizeops.tiercache.providers.redis;

import lombok.Value;
import net.wizeops.tiercache.exceptions.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * Host, port, database and optional credentials parsed from a {@code redis://} or
 * {@code rediss://} URL.
 */
@Value
public class RedisEndpoint {
    public static final int DEFAULT_PORT = 6379;

    String host;
    int port;
    int database;
    boolean tls;
    String username;
    String password;

    public static RedisEndpoint parse(String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("remoteUrl: must not be blank");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new ConfigurationException("remoteUrl: malformed URL", e);
        }
        String scheme = uri.getScheme();
        if (!"redis".equals(scheme) && !"rediss".equals(scheme)) {
            throw new ConfigurationException("remoteUrl: scheme must be redis:// or rediss://");
        }
        if (uri.getHost() == null) {
            throw new ConfigurationException("remoteUrl: missing host");
        }

        String username = null;
        String password = null;
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int colon = userInfo.indexOf(':');
            if (colon < 0) {
                password = decode(userInfo);
            } else {
                username = colon > 0 ? decode(userInfo.substring(0, colon)) : null;
                password = decode(userInfo.substring(colon + 1));
            }
        }

        return new RedisEndpoint(uri.getHost(),
                uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT,
                parseDatabase(uri.getPath()),
                "rediss".equals(scheme),
                username,
                password);
    }

    public boolean hasCredentials() {
        return password != null && !password.isEmpty();
    }

    /**
     * Address without credentials, safe to log.
     */
    public String describe() {
        return (tls ? "rediss://" : "redis://") + host + ":" + port + "/" + database;
    }

    private static int parseDatabase(String path) {
        if (path == null || path.isEmpty() || "/".equals(path)) {
            return 0;
        }
        try {
            int database = Integer.parseInt(path.substring(1));
            if (database < 0) {
                throw new ConfigurationException("remoteUrl: database index must not be negative");
            }
            return database;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("remoteUrl: database must be a number, got '" + path.substring(1) + "'", e);
        }
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
