package alpha.nomagicresponder.util;

import static java.util.Objects.requireNonNull;

/**
 * String utilities for header names and values.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Strings
{
    private Strings() {
        // Empty
    }

    /**
     * Requires that the given string has no leading or trailing whitespace.
     *
     * @param str to test
     * @return the given string
     * @throws NullPointerException
     *             if {@code str} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code str} has leading or trailing whitespace
     */
    public static String requireNoSurroundingWS(String str) {
        requireNonNull(str);
        if (!str.isEmpty() && (isWS(str.charAt(0)) ||
                               isWS(str.charAt(str.length() - 1)))) {
            throw new IllegalArgumentException(
                    "Leading and/or trailing whitespace: \"" + str + "\"");
        }
        return str;
    }

    /**
     * Requires that the given string is a valid header name.<p>
     *
     * A header name is a non-empty token (
     * <a href="https://datatracker.ietf.org/doc/html/rfc7230#section-3.2.6">RFC 7230 §3.2.6</a>
     * ). That is, visible US-ASCII characters except delimiters.
     *
     * @param name to test
     * @return the given name
     * @throws NullPointerException
     *             if {@code name} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code name} is not a token
     */
    public static String requireToken(String name) {
        requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Empty header name.");
        }
        for (int i = 0; i < name.length(); ++i) {
            char c = name.charAt(i);
            if (!isTokenChar(c)) {
                throw new IllegalArgumentException(
                        "Illegal char at index " + i + " in header name: \"" + name + "\"");
            }
        }
        return name;
    }

    /**
     * Requires that the given string is a valid header value.<p>
     *
     * The value may be empty. It must not have leading or trailing
     * whitespace, and must not contain control characters other than
     * horizontal tab (
     * <a href="https://datatracker.ietf.org/doc/html/rfc7230#section-3.2">RFC 7230 §3.2</a>
     * ). CR and LF are thereby rejected.
     *
     * @param value to test
     * @return the given value
     * @throws NullPointerException
     *             if {@code value} is {@code null}
     * @throws IllegalArgumentException
     *             if {@code value} is not a valid field value
     */
    public static String requireFieldValue(String value) {
        requireNoSurroundingWS(value);
        for (int i = 0; i < value.length(); ++i) {
            char c = value.charAt(i);
            if ((c < 0x20 && c != '\t') || c == 0x7F) {
                throw new IllegalArgumentException(
                        "Illegal char at index " + i + " in header value: \"" + value + "\"");
            }
        }
        return value;
    }

    private static boolean isWS(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    private static boolean isTokenChar(char c) {
        if (c <= 0x20 || c >= 0x7F) {
            return false;
        }
        // Delimiters
        return "\"(),/:;<=>?@[\\]{}".indexOf(c) == -1;
    }
}
