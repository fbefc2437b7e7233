package com.distributedraft.node.coordination;

import com.distributedraft.common.exception.ErrorCode;
import com.distributedraft.common.exception.MembershipException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Network address of a cluster member, in normalized {@code host:port} form.
 *
 * The host is an IPv4 literal, an IPv6 literal (written in brackets) or, in configuration
 * only, a DNS host name. Parsing never resolves names.
 */
@Getter
@EqualsAndHashCode
public final class PeerAddress {

    private static final Pattern IPV4 = Pattern.compile(
            "((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)");
    private static final Pattern IPV6_CHARS = Pattern.compile("[0-9A-Fa-f:.]+");
    private static final Pattern HOST_LABEL = Pattern.compile("[A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,5}");

    private final String host;
    private final int port;
    private final boolean ipv6;

    private PeerAddress(String host, int port, boolean ipv6) {
        this.host = host;
        this.port = port;
        this.ipv6 = ipv6;
    }

    public static PeerAddress of(String host, int port) {
        return parse(host.contains(":") ? "[" + host + "]:" + port : host + ":" + port);
    }

    /**
     * Decode the raw body of a Join request.
     *
     * Only IP literals are accepted here; host names are left to configuration.
     *
     * @throws MembershipException MALFORMED_PAYLOAD when the bytes are not UTF-8,
     *                             INVALID_ADDRESS when the text is not an ip:port address
     */
    public static PeerAddress fromJoinPayload(byte[] payload) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload == null ? new byte[0] : payload))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MembershipException(ErrorCode.MALFORMED_PAYLOAD,
                    "Join payload is not valid UTF-8 text", e);
        }
        return parse(text, false);
    }

    /**
     * Parse {@code host:port}, {@code [ipv6]:port} style text.
     *
     * @throws MembershipException INVALID_ADDRESS when the text is not an address
     */
    public static PeerAddress parse(String text) {
        return parse(text, true);
    }

    private static PeerAddress parse(String text, boolean allowHostNames) {
        if (text == null || text.isBlank()) {
            throw invalid(text);
        }
        String value = text.trim();

        String host;
        String portText;
        boolean ipv6 = false;

        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            if (close < 0 || close + 1 >= value.length() || value.charAt(close + 1) != ':') {
                throw invalid(text);
            }
            InetAddress literal = parseIpv6(value.substring(1, close), text);
            host = literal.getHostAddress();
            portText = value.substring(close + 2);
            // ::ffff:a.b.c.d comes back as a plain IPv4 address
            ipv6 = literal instanceof Inet6Address;
        } else {
            int colon = value.lastIndexOf(':');
            if (colon <= 0) {
                throw invalid(text);
            }
            host = value.substring(0, colon);
            portText = value.substring(colon + 1);
            if (!IPV4.matcher(host).matches() && !(allowHostNames && isHostName(host))) {
                throw invalid(text);
            }
            host = host.toLowerCase(Locale.ROOT);
        }

        return new PeerAddress(host, parsePort(portText, text), ipv6);
    }

    private static int parsePort(String portText, String original) {
        if (!DIGITS.matcher(portText).matches()) {
            throw invalid(original);
        }
        int port = Integer.parseInt(portText);
        if (port > 65535) {
            throw invalid(original);
        }
        return port;
    }

    private static InetAddress parseIpv6(String literal, String original) {
        if (!literal.contains(":") || !IPV6_CHARS.matcher(literal).matches()) {
            throw invalid(original);
        }
        try {
            // bracketed literals are parsed, never looked up
            return InetAddress.getByName("[" + literal + "]");
        } catch (UnknownHostException e) {
            throw invalid(original);
        }
    }

    private static boolean isHostName(String host) {
        if (host.length() > 253 || host.endsWith(".")) {
            return false;
        }
        String[] labels = host.split("\\.", -1);
        for (String label : labels) {
            if (!HOST_LABEL.matcher(label).matches()) {
                return false;
            }
        }
        // a numeric last label means a malformed IPv4 literal, not a name
        return !labels[labels.length - 1].chars().allMatch(Character::isDigit);
    }

    private static MembershipException invalid(String text) {
        return new MembershipException(ErrorCode.INVALID_ADDRESS,
                "Not a valid host:port address: '" + text + "'");
    }

    @Override
    public String toString() {
        return ipv6 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
