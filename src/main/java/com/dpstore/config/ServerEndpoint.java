package com.dpstore.config;

import java.util.Objects;

/**
 * One backend server entry from the configuration file.
 *
 * Format: {@code host:port:password:timeoutSeconds:useTLS:caCertPath}. Every field
 * after the host may be empty or missing, in which case the default applies.
 * IPv6 hosts must be bracketed, e.g. {@code [::1]:9001}.
 */
public final class ServerEndpoint {

    public static final int DEFAULT_TIMEOUT_SECONDS = 3;

    private final String host;
    private final int port;
    private final String password;
    private final int timeoutSeconds;
    private final boolean useTls;
    private final String caCertPath;

    public ServerEndpoint(String host, int port, String password, int timeoutSeconds,
                          boolean useTls, String caCertPath) {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("Host cannot be null or empty");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535, got: " + port);
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive, got: " + timeoutSeconds);
        }
        this.host = host;
        this.port = port;
        this.password = password != null ? password : "";
        this.timeoutSeconds = timeoutSeconds;
        this.useTls = useTls;
        this.caCertPath = caCertPath != null ? caCertPath : "";
    }

    /**
     * Create an endpoint with default password, timeout and TLS settings.
     */
    public static ServerEndpoint of(String host, int port) {
        return new ServerEndpoint(host, port, "", DEFAULT_TIMEOUT_SECONDS, false, "");
    }

    /**
     * Parse a server entry line.
     *
     * @param entry       the entry text
     * @param defaultPort port used when the port field is empty or missing
     * @return the parsed endpoint
     * @throws IllegalArgumentException if the entry is malformed
     */
    public static ServerEndpoint parse(String entry, int defaultPort) {
        if (entry == null || entry.trim().isEmpty()) {
            throw new IllegalArgumentException("Server entry cannot be null or empty");
        }
        String text = entry.trim();

        String host;
        String rest;
        if (text.startsWith("[")) {
            int closeBracket = text.indexOf(']');
            if (closeBracket == -1) {
                throw new IllegalArgumentException("Invalid IPv6 address (missing ']'): " + entry);
            }
            host = text.substring(1, closeBracket);
            rest = text.substring(closeBracket + 1);
            if (!rest.isEmpty()) {
                if (rest.charAt(0) != ':') {
                    throw new IllegalArgumentException("Expected ':' after ']' in: " + entry);
                }
                rest = rest.substring(1);
            }
        } else {
            int firstColon = text.indexOf(':');
            host = firstColon == -1 ? text : text.substring(0, firstColon);
            rest = firstColon == -1 ? "" : text.substring(firstColon + 1);
        }

        // Limit -1 keeps trailing empty fields
        String[] fields = rest.isEmpty() ? new String[0] : rest.split(":", -1);

        int port = defaultPort;
        String portField = field(fields, 0);
        if (!portField.isEmpty()) {
            try {
                port = Integer.parseInt(portField);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port number in: " + entry, e);
            }
        }

        String password = field(fields, 1);

        int timeout = DEFAULT_TIMEOUT_SECONDS;
        String timeoutField = field(fields, 2);
        if (!timeoutField.isEmpty()) {
            try {
                timeout = Integer.parseInt(timeoutField);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid timeout in: " + entry, e);
            }
            if (timeout <= 0) {
                timeout = DEFAULT_TIMEOUT_SECONDS;
            }
        }

        String tlsField = field(fields, 3);
        boolean useTls = "true".equalsIgnoreCase(tlsField) || "1".equals(tlsField)
            || "yes".equalsIgnoreCase(tlsField);

        // The CA path may itself contain colons (e.g. a Windows drive letter)
        String caCertPath = "";
        if (fields.length > 4) {
            caCertPath = String.join(":", java.util.Arrays.copyOfRange(fields, 4, fields.length)).trim();
        }

        return new ServerEndpoint(host, port, password, timeout, useTls, caCertPath);
    }

    private static String field(String[] fields, int index) {
        return index < fields.length ? fields[index].trim() : "";
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getPassword() {
        return password;
    }

    public boolean hasPassword() {
        return !password.isEmpty();
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean isUseTls() {
        return useTls;
    }

    public String getCaCertPath() {
        return caCertPath;
    }

    /**
     * Address in host:port form, bracketing IPv6 hosts.
     */
    public String getAddress() {
        return (host.indexOf(':') >= 0 ? "[" + host + "]" : host) + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServerEndpoint that = (ServerEndpoint) o;
        return port == that.port &&
               timeoutSeconds == that.timeoutSeconds &&
               useTls == that.useTls &&
               host.equals(that.host) &&
               password.equals(that.password) &&
               caCertPath.equals(that.caCertPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, password, timeoutSeconds, useTls, caCertPath);
    }

    @Override
    public String toString() {
        // Password intentionally omitted
        return "ServerEndpoint{" +
               "address=" + getAddress() +
               ", timeoutSeconds=" + timeoutSeconds +
               ", useTls=" + useTls +
               '}';
    }
}
