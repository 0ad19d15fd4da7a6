package warden.core.service.common;

/**
 * Derives the rate-limit identity of a client from its request.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>RFC 7239 {@code Forwarded} header's {@code for} parameter</li>
 *   <li>{@code X-Forwarded-For} header (first address in the chain)</li>
 *   <li>{@code X-Real-IP} header</li>
 *   <li>the socket's remote address</li>
 * </ol>
 */
public final class ClientIpExtractor {

    public static final String IDENTITY_PREFIX = "ip:";
    static final String UNKNOWN = "unknown";

    private ClientIpExtractor() {}

    /**
     * Extract the client address.
     *
     * @return the address, or {@code "unknown"} if none is available
     */
    public static String extract(String forwarded, String xForwardedFor, String xRealIp, String remoteAddress) {
        if (forwarded != null) {
            var forValue = extractForwardedParam(forwarded, "for");
            if (forValue != null && !forValue.isBlank()) {
                return stripPort(forValue);
            }
        }

        if (xForwardedFor != null && !xForwardedFor.isBlank()) {
            return xForwardedFor.split(",")[0].trim();
        }

        if (xRealIp != null && !xRealIp.isBlank()) {
            return xRealIp.trim();
        }

        return remoteAddress != null && !remoteAddress.isBlank() ? remoteAddress : UNKNOWN;
    }

    /**
     * The rate-limit identity for a client address.
     */
    public static String identity(String address) {
        return IDENTITY_PREFIX + address;
    }

    /**
     * Extract a parameter from the first element of an RFC 7239 Forwarded header.
     *
     * @param forwarded the header value
     * @param param the parameter name (e.g. "for", "proto")
     * @return the unquoted value, or null if absent
     */
    static String extractForwardedParam(String forwarded, String param) {
        var first = forwarded.split(",")[0].trim();
        for (var part : first.split(";")) {
            var keyValue = part.trim().split("=", 2);
            if (keyValue.length == 2 && keyValue[0].trim().equalsIgnoreCase(param)) {
                var value = keyValue[1].trim();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value;
            }
        }
        return null;
    }

    // "[2001:db8::1]:4711" -> "2001:db8::1", "192.0.2.43:47011" -> "192.0.2.43"
    static String stripPort(String node) {
        if (node.startsWith("[")) {
            var end = node.indexOf(']');
            return end > 0 ? node.substring(1, end) : node;
        }
        var colon = node.indexOf(':');
        if (colon > 0 && colon == node.lastIndexOf(':')) {
            return node.substring(0, colon);
        }
        return node;
    }
}
