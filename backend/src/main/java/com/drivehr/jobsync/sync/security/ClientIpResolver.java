package com.drivehr.jobsync.sync.security;

import org.springframework.stereotype.Component;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Resolves the originating client address behind CDNs and proxies. Forwarded headers are only
 * trusted when they carry a public, non-reserved IP literal.
 */
@Component
public class ClientIpResolver {
    public static final String FALLBACK_ADDRESS = "0.0.0.0";

    static final List<String> FORWARDED_HEADERS = List.of(
        "CF-Connecting-IP",
        "X-Forwarded-For",
        "X-Forwarded",
        "X-Cluster-Client-IP",
        "Forwarded-For",
        "Forwarded"
    );

    private static final Pattern IPV4 = Pattern.compile(
        "^(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}$"
    );
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");

    public String resolve(Function<String, String> headerLookup, String remoteAddress) {
        for (String header : FORWARDED_HEADERS) {
            String value = headerLookup.apply(header);
            if (value == null || value.isBlank()) {
                continue;
            }
            String candidate = firstToken(value);
            if (isPublicAddress(candidate)) {
                return candidate;
            }
        }
        if (remoteAddress == null || remoteAddress.isBlank()) {
            return FALLBACK_ADDRESS;
        }
        return remoteAddress.trim();
    }

    static String firstToken(String headerValue) {
        String token = headerValue.split(",", 2)[0].trim();
        int semicolon = token.indexOf(';');
        if (semicolon >= 0) {
            token = token.substring(0, semicolon).trim();
        }
        if (token.toLowerCase(Locale.ROOT).startsWith("for=")) {
            token = token.substring(4).trim();
        }
        if (token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")) {
            token = token.substring(1, token.length() - 1).trim();
        }
        if (token.startsWith("[")) {
            int close = token.indexOf(']');
            if (close > 0) {
                token = token.substring(1, close);
            }
        }
        return token;
    }

    public boolean isPublicAddress(String candidate) {
        InetAddress address = parseLiteral(candidate);
        if (address == null) {
            return false;
        }
        if (address.isAnyLocalAddress()
            || address.isLoopbackAddress()
            || address.isLinkLocalAddress()
            || address.isSiteLocalAddress()
            || address.isMulticastAddress()) {
            return false;
        }
        byte[] bytes = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = bytes[0] & 0xff;
            // 0.0.0.0/8 and 240.0.0.0/4
            return first != 0 && first < 240;
        }
        if (address instanceof Inet6Address) {
            int first = bytes[0] & 0xff;
            // unique local fc00::/7
            return (first & 0xfe) != 0xfc;
        }
        return false;
    }

    private InetAddress parseLiteral(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String value = candidate.trim();
        boolean literal = IPV4.matcher(value).matches()
            || (value.indexOf(':') >= 0 && IPV6_CHARS.matcher(value).matches());
        if (!literal) {
            return null;
        }
        try {
            // literal input only, so no name service lookup happens here
            return InetAddress.getByName(value);
        } catch (UnknownHostException e) {
            return null;
        }
    }
}
