package alpha.nomagicresponder.message;

import alpha.nomagicresponder.HttpConstants;
import alpha.nomagicresponder.responder.Responder;

import java.nio.ByteBuffer;

import static alpha.nomagicresponder.HttpConstants.ReasonPhrase;
import static alpha.nomagicresponder.HttpConstants.StatusCode;

/**
 * A status line, followed by optional headers and a body.<p>
 *
 * Can be built using a {@link Response.Builder}:
 *
 * <pre>{@code
 *   // May use HttpConstants.StatusCode/ReasonPhrase instead of int and "string"
 *   Response r = Response.builder(204, "No Content")
 *                        .header("My-Header", "value")
 *                        .build();
 * }</pre>
 *
 * The {@code Response} object is immutable, but the builder that built the
 * response can be retrieved and used to create new response derivatives. This
 * is how the {@linkplain Responder#withStatus(int) status} and
 * {@linkplain Responder#withHeader(String, String) header} overrides of a
 * responder are applied; the resolved response is turned back into a builder,
 * modified, and built anew.<p>
 *
 * The {@link Responses} class can be considered a repository of commonly used
 * responses.<p>
 *
 * The implementation is thread-safe. It does not necessarily implement
 * {@code hashCode} and {@code equals}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 *
 * @see Response.Builder
 * @see Responder
 */
public interface Response
{
    /**
     * Returns a {@code Response} builder.<p>
     *
     * The reason phrase will be set to the phrase that goes with the given
     * status code, or "Unknown" if the code is not well-known.
     *
     * @param statusCode response status code
     * @return a builder (doesn't have to be a new instance)
     * @see #statusCode()
     */
    static Builder builder(int statusCode) {
        return Responses.status(statusCode).toBuilder();
    }

    /**
     * Returns a {@code Response} builder.
     *
     * @param statusCode response status code
     * @param reasonPhrase response reason phrase
     *
     * @return a builder (doesn't have to be a new instance)
     *
     * @throws NullPointerException
     *             if {@code reasonPhrase} is {@code null}
     */
    static Builder builder(int statusCode, String reasonPhrase) {
        return Responses.status(statusCode, reasonPhrase).toBuilder();
    }

    /**
     * Returns the status code.<p>
     *
     * As far as this library is concerned, the returned value may be any
     * integer value, but should be conforming to the HTTP protocol.
     *
     * @return the status code
     * @see HttpConstants.StatusCode
     */
    int statusCode();

    /**
     * Returns the reason phrase.
     *
     * @return the reason phrase (never {@code null}, possibly empty)
     * @see HttpConstants.ReasonPhrase
     */
    String reasonPhrase();

    /**
     * Returns the headers.
     *
     * @return the headers (never {@code null})
     */
    Headers headers();

    /**
     * Returns the message body.<p>
     *
     * Each call returns a new read-only view positioned at the first byte of
     * the body. Reading from the view does not affect the response.
     *
     * @return the message body (possibly empty)
     */
    ByteBuffer body();

    /**
     * Returns {@code true} if the body is empty.
     *
     * @return see JavaDoc
     */
    default boolean isBodyEmpty() {
        return !body().hasRemaining();
    }

    /**
     * Returns {@code true} if the status-code is 1XX (Informational).
     *
     * @return see JavaDoc
     */
    default boolean isInformational() {
        return StatusCode.isInformational(statusCode());
    }

    /**
     * Returns {@code true} if the status-code is 2XX (Successful).
     *
     * @return see JavaDoc
     */
    default boolean isSuccessful() {
        return StatusCode.isSuccessful(statusCode());
    }

    /**
     * Returns {@code true} if the status-code is 4XX (Client Error).
     *
     * @return see JavaDoc
     */
    default boolean isClientError() {
        return StatusCode.isClientError(statusCode());
    }

    /**
     * Returns {@code true} if the status-code is 5XX (Server Error).
     *
     * @return see JavaDoc
     */
    default boolean isServerError() {
        return StatusCode.isServerError(statusCode());
    }

    /**
     * Returns {@code true} if the status-code is not 1XX (Informational).
     *
     * @return see JavaDoc
     */
    default boolean isFinal() {
        return StatusCode.isFinal(statusCode());
    }

    /**
     * Returns the builder instance that built this response.<p>
     *
     * The builder may be used for further response templating.
     *
     * @return the builder instance that built this response
     */
    Builder toBuilder();

    /**
     * Builder of a {@link Response}.<p>
     *
     * The builder is immutable. All builder-returning methods return a new
     * instance representing the new state.<p>
     *
     * Status code is the only required field. If the reason phrase is not set,
     * the phrase will be derived from the status code using
     * {@link ReasonPhrase#of(int)}. If the body is not set, it will be
     * empty.<p>
     *
     * Header names are not accepted to be empty, and neither names nor values
     * are accepted to have leading or trailing whitespace (
     * <a href="https://datatracker.ietf.org/doc/html/rfc7230/#section-3.2.4">RFC §3.2.4. Field Parsing</a>
     * ). Other than that, the content is not validated.<p>
     *
     * Adding values to the same header name replicates the header across
     * multiple rows in the response. It does <strong>not</strong> join the
     * values on the same row.<p>
     *
     * The implementation is thread-safe and non-blocking.
     *
     * @author Martin Andersson (webmaster at martinandersson.com)
     *
     * @see HttpConstants.HeaderName
     */
    interface Builder
    {
        /**
         * Sets a status code.<p>
         *
         * If the reason phrase has not been set explicitly, the phrase of the
         * built response will go with the last status code set.
         *
         * @param statusCode value (any integer value)
         * @return a new builder representing the new state
         */
        Builder statusCode(int statusCode);

        /**
         * Sets a reason phrase.
         *
         * @param reasonPhrase value (any non-null string)
         * @return a new builder representing the new state
         * @throws NullPointerException
         *             if {@code reasonPhrase} is {@code null}
         */
        Builder reasonPhrase(String reasonPhrase);

        /**
         * Sets a header.<p>
         *
         * This method replaces all previously set values for the given name
         * (case-insensitive).
         *
         * @param name of header
         * @param value of header
         *
         * @return a new builder representing the new state
         *
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if any argument has leading or trailing whitespace
         * @throws IllegalArgumentException
         *             if {@code name} is empty
         */
        Builder header(String name, String value);

        /**
         * Adds a header.<p>
         *
         * If the header is already present, then it will be repeated in the
         * response.
         *
         * @param name of header
         * @param value of header
         *
         * @return a new builder representing the new state
         *
         * @throws NullPointerException
         *             if any argument is {@code null}
         * @throws IllegalArgumentException
         *             if any argument has leading or trailing whitespace
         * @throws IllegalArgumentException
         *             if {@code name} is empty
         */
        Builder addHeader(String name, String value);

        /**
         * Adds header(s).<p>
         *
         * This method is equivalent to calling
         * {@link #addHeader(String, String) addHeader}, for each given pair.
         * Iterating the {@code String[]} must alternate between header-names
         * and values.
         *
         * @param name of header
         * @param value of header
         * @param morePairs of headers
         *
         * @return a new builder representing the new state
         *
         * @throws NullPointerException
         *             if any argument or array element is {@code null}
         * @throws IllegalArgumentException
         *             if {@code morePairs.length} is odd
         * @throws IllegalArgumentException
         *             if any given string has leading or trailing whitespace
         * @throws IllegalArgumentException
         *             if a name is empty
         */
        Builder addHeaders(String name, String value, String... morePairs);

        /**
         * Removes <i>all</i> occurrences of a header.<p>
         *
         * This method operates without regard to casing.
         *
         * @param name of the header
         *
         * @return a new builder representing the new state
         *
         * @throws NullPointerException
         *             if {@code name} is {@code null}
         * @throws IllegalArgumentException
         *             if {@code name} has leading or trailing whitespace
         * @throws IllegalArgumentException
         *             if {@code name} is empty
         */
        Builder removeHeader(String name);

        /**
         * Sets a message body.<p>
         *
         * The remaining bytes of a writable buffer are copied; subsequent
         * changes to the buffer do not affect the builder. A
         * {@linkplain ByteBuffer#isReadOnly() read-only} buffer is used as-is,
         * and the application must not modify its backing content.
         * The position of the given buffer is not changed.<p>
         *
         * The application should also set the Content-Type header.
         *
         * @param body content
         * @return a new builder representing the new state
         * @throws NullPointerException
         *             if {@code body} is {@code null}
         */
        Builder body(ByteBuffer body);

        /**
         * Sets a message body.<p>
         *
         * The given array is copied.
         *
         * @param body content
         * @return a new builder representing the new state
         * @throws NullPointerException
         *             if {@code body} is {@code null}
         */
        Builder body(byte[] body);

        /**
         * Builds the response.<p>
         *
         * This method returns a new response object on each call.
         *
         * @return a response
         *
         * @throws IllegalStateException
         *             if no status code has been set
         * @throws IllegalStateException
         *             if a header name is repeated using different casing
         * @throws IllegalResponseBodyException
         *             if the body is not empty and the status code is one of
         *             1XX (Informational), 204 (No Content), 304 (Not
         *             Modified)
         */
        Response build();
    }
}
