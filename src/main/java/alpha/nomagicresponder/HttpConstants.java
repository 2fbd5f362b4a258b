package alpha.nomagicresponder;

import alpha.nomagicresponder.message.Response;
import alpha.nomagicresponder.message.Responses;

/**
 * Namespace of HTTP constants used when building responses.<p>
 *
 * The constants are a subset of what is registered with IANA; the status
 * codes and reason phrases a response-producing library has reason to refer
 * to, as well as the header names and media types that the responders of
 * this library set.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }

    /**
     * Status codes are grouped by class:
     *
     * <ul>
     *   <li>1XX (Informational): Interim response, a final one will follow.</li>
     *   <li>2XX (Successful): The request was understood and accepted.</li>
     *   <li>3XX (Redirection): Further action is needed by the client.</li>
     *   <li>4XX (Client Error): The request was malformed or rejected.</li>
     *   <li>5XX (Server Error): The server failed to fulfil a valid
     *     request.</li>
     * </ul>
     *
     * As far as this library is concerned, the status code of a
     * {@link Response} may be any integer. The predicates of this class
     * operate on the numeric range only.
     *
     * @see <a href="https://tools.ietf.org/html/rfc7231#section-6">RFC 7231 §6</a>
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }

        /** {@value} {@value ReasonPhrase#CONTINUE}. */
        public static final int ONE_HUNDRED = 100;

        /** {@value} {@value ReasonPhrase#PROCESSING}. */
        public static final int ONE_HUNDRED_TWO = 102;

        /**
         * {@value} {@value ReasonPhrase#OK}.<p>
         *
         * Standard code for a successful request. Every primitive responder
         * resolves to this code.
         */
        public static final int TWO_HUNDRED = 200;

        /** {@value} {@value ReasonPhrase#CREATED}. */
        public static final int TWO_HUNDRED_ONE = 201;

        /** {@value} {@value ReasonPhrase#ACCEPTED}. */
        public static final int TWO_HUNDRED_TWO = 202;

        /**
         * {@value} {@value ReasonPhrase#NO_CONTENT}.<p>
         *
         * A response with this code must not have a body.
         */
        public static final int TWO_HUNDRED_FOUR = 204;

        /** {@value} {@value ReasonPhrase#MOVED_PERMANENTLY}. */
        public static final int THREE_HUNDRED_ONE = 301;

        /** {@value} {@value ReasonPhrase#FOUND}. */
        public static final int THREE_HUNDRED_TWO = 302;

        /**
         * {@value} {@value ReasonPhrase#NOT_MODIFIED}.<p>
         *
         * A response with this code must not have a body.
         */
        public static final int THREE_HUNDRED_FOUR = 304;

        /** {@value} {@value ReasonPhrase#BAD_REQUEST}. */
        public static final int FOUR_HUNDRED = 400;

        /** {@value} {@value ReasonPhrase#UNAUTHORIZED}. */
        public static final int FOUR_HUNDRED_ONE = 401;

        /** {@value} {@value ReasonPhrase#FORBIDDEN}. */
        public static final int FOUR_HUNDRED_THREE = 403;

        /**
         * {@value} {@value ReasonPhrase#NOT_FOUND}.<p>
         *
         * An absent optional value resolves to this code.
         */
        public static final int FOUR_HUNDRED_FOUR = 404;

        /** {@value} {@value ReasonPhrase#METHOD_NOT_ALLOWED}. */
        public static final int FOUR_HUNDRED_FIVE = 405;

        /** {@value} {@value ReasonPhrase#CONFLICT}. */
        public static final int FOUR_HUNDRED_NINE = 409;

        /** {@value} {@value ReasonPhrase#UNPROCESSABLE_ENTITY}. */
        public static final int FOUR_HUNDRED_TWENTY_TWO = 422;

        /**
         * {@value} {@value ReasonPhrase#INTERNAL_SERVER_ERROR}.<p>
         *
         * The status of a failure that carries no status of its own.
         */
        public static final int FIVE_HUNDRED = 500;

        /** {@value} {@value ReasonPhrase#NOT_IMPLEMENTED}. */
        public static final int FIVE_HUNDRED_ONE = 501;

        /** {@value} {@value ReasonPhrase#BAD_GATEWAY}. */
        public static final int FIVE_HUNDRED_TWO = 502;

        /** {@value} {@value ReasonPhrase#SERVICE_UNAVAILABLE}. */
        public static final int FIVE_HUNDRED_THREE = 503;

        /**
         * All status codes declared in this class, in ascending order.<p>
         *
         * The array index of a code is the same index of its reason phrase in
         * {@link ReasonPhrase#VALUES}. The array must not be modified.
         */
        static final int[] VALUES = {
            ONE_HUNDRED, ONE_HUNDRED_TWO,
            TWO_HUNDRED, TWO_HUNDRED_ONE, TWO_HUNDRED_TWO, TWO_HUNDRED_FOUR,
            THREE_HUNDRED_ONE, THREE_HUNDRED_TWO, THREE_HUNDRED_FOUR,
            FOUR_HUNDRED, FOUR_HUNDRED_ONE, FOUR_HUNDRED_THREE,
            FOUR_HUNDRED_FOUR, FOUR_HUNDRED_FIVE, FOUR_HUNDRED_NINE,
            FOUR_HUNDRED_TWENTY_TWO,
            FIVE_HUNDRED, FIVE_HUNDRED_ONE, FIVE_HUNDRED_TWO,
            FIVE_HUNDRED_THREE };

        /**
         * Returns {@code true} if the given code is 1XX (Informational).
         *
         * @param code to test
         * @return see JavaDoc
         */
        public static boolean isInformational(int code) {
            return code >= 100 && code <= 199;
        }

        /**
         * Returns {@code true} if the given code is 2XX (Successful).
         *
         * @param code to test
         * @return see JavaDoc
         */
        public static boolean isSuccessful(int code) {
            return code >= 200 && code <= 299;
        }

        /**
         * Returns {@code true} if the given code is 3XX (Redirection).
         *
         * @param code to test
         * @return see JavaDoc
         */
        public static boolean isRedirection(int code) {
            return code >= 300 && code <= 399;
        }

        /**
         * Returns {@code true} if the given code is 4XX (Client Error).
         *
         * @param code to test
         * @return see JavaDoc
         */
        public static boolean isClientError(int code) {
            return code >= 400 && code <= 499;
        }

        /**
         * Returns {@code true} if the given code is 5XX (Server Error).
         *
         * @param code to test
         * @return see JavaDoc
         */
        public static boolean isServerError(int code) {
            return code >= 500 && code <= 599;
        }

        /**
         * Returns {@code true} if the given code is not 1XX (Informational).
         *
         * @param code to test
         * @return see JavaDoc
         */
        public static boolean isFinal(int code) {
            return !isInformational(code);
        }
    }

    /**
     * "The reason-phrase element exists for the sole purpose of providing a
     * textual description associated with the numeric status code" (
     * <a href="https://tools.ietf.org/html/rfc7230#section-3.1.2">RFC 7230 §3.1.2</a>
     * ).<p>
     *
     * Most applications will not need to set a reason phrase explicitly, as it
     * will be set implicitly by {@link Responses response factory methods} and
     * by the builder when the status code is one of the well-known.
     */
    public static final class ReasonPhrase {
        private ReasonPhrase() {
            // Private
        }

        /** {@value} is the default used when no other phrase is known. */
        public static final String UNKNOWN = "Unknown";

        /** Goes with status code {@value StatusCode#ONE_HUNDRED}. */
        public static final String CONTINUE = "Continue";

        /** Goes with status code {@value StatusCode#ONE_HUNDRED_TWO}. */
        public static final String PROCESSING = "Processing";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED}. */
        public static final String OK = "OK";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED_ONE}. */
        public static final String CREATED = "Created";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED_TWO}. */
        public static final String ACCEPTED = "Accepted";

        /** Goes with status code {@value StatusCode#TWO_HUNDRED_FOUR}. */
        public static final String NO_CONTENT = "No Content";

        /** Goes with status code {@value StatusCode#THREE_HUNDRED_ONE}. */
        public static final String MOVED_PERMANENTLY = "Moved Permanently";

        /** Goes with status code {@value StatusCode#THREE_HUNDRED_TWO}. */
        public static final String FOUND = "Found";

        /** Goes with status code {@value StatusCode#THREE_HUNDRED_FOUR}. */
        public static final String NOT_MODIFIED = "Not Modified";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED}. */
        public static final String BAD_REQUEST = "Bad Request";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_ONE}. */
        public static final String UNAUTHORIZED = "Unauthorized";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_THREE}. */
        public static final String FORBIDDEN = "Forbidden";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_FOUR}. */
        public static final String NOT_FOUND = "Not Found";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_FIVE}. */
        public static final String METHOD_NOT_ALLOWED = "Method Not Allowed";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_NINE}. */
        public static final String CONFLICT = "Conflict";

        /** Goes with status code {@value StatusCode#FOUR_HUNDRED_TWENTY_TWO}. */
        public static final String UNPROCESSABLE_ENTITY = "Unprocessable Entity";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED}. */
        public static final String INTERNAL_SERVER_ERROR = "Internal Server Error";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED_ONE}. */
        public static final String NOT_IMPLEMENTED = "Not Implemented";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED_TWO}. */
        public static final String BAD_GATEWAY = "Bad Gateway";

        /** Goes with status code {@value StatusCode#FIVE_HUNDRED_THREE}. */
        public static final String SERVICE_UNAVAILABLE = "Service Unavailable";

        static final String[] VALUES = {
            CONTINUE, PROCESSING,
            OK, CREATED, ACCEPTED, NO_CONTENT,
            MOVED_PERMANENTLY, FOUND, NOT_MODIFIED,
            BAD_REQUEST, UNAUTHORIZED, FORBIDDEN,
            NOT_FOUND, METHOD_NOT_ALLOWED, CONFLICT,
            UNPROCESSABLE_ENTITY,
            INTERNAL_SERVER_ERROR, NOT_IMPLEMENTED, BAD_GATEWAY,
            SERVICE_UNAVAILABLE };

        /**
         * Returns the reason phrase that goes with the given status code.<p>
         *
         * If the code is not declared in {@link StatusCode}, {@value #UNKNOWN}
         * is returned.
         *
         * @param statusCode of response
         * @return a reason phrase (never {@code null})
         */
        public static String of(int statusCode) {
            for (int i = 0; i < StatusCode.VALUES.length; ++i) {
                if (StatusCode.VALUES[i] == statusCode) {
                    return VALUES[i];
                }
            }
            return UNKNOWN;
        }
    }

    /**
     * Header names.<p>
     *
     * Header names are case-insensitive. The constants use the casing most
     * commonly seen on the wire.
     */
    public static final class HeaderName {
        private HeaderName() {
            // Private
        }

        /** {@value} */
        public static final String CACHE_CONTROL = "Cache-Control";

        /** {@value} */
        public static final String CONNECTION = "Connection";

        /** {@value} */
        public static final String CONTENT_LENGTH = "Content-Length";

        /**
         * {@value}<p>
         *
         * Set by the text and byte responders.
         */
        public static final String CONTENT_TYPE = "Content-Type";

        /** {@value} */
        public static final String LOCATION = "Location";

        /** {@value} */
        public static final String RETRY_AFTER = "Retry-After";
    }

    /**
     * Content-Type values set by this library.
     */
    public static final class MediaType {
        private MediaType() {
            // Private
        }

        /** {@value} */
        public static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";

        /** {@value} */
        public static final String APPLICATION_OCTET_STREAM = "application/octet-stream";
    }
}
