package alpha.nomagicresponder.message;

import alpha.nomagicresponder.HttpConstants;
import alpha.nomagicresponder.HttpConstants.ReasonPhrase;
import alpha.nomagicresponder.HttpConstants.StatusCode;

import java.util.Map;
import java.util.stream.IntStream;

import static alpha.nomagicresponder.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicresponder.HttpConstants.MediaType.APPLICATION_OCTET_STREAM;
import static alpha.nomagicresponder.HttpConstants.MediaType.TEXT_PLAIN_UTF8;
import static alpha.nomagicresponder.HttpConstants.StatusCode.FOUR_HUNDRED;
import static alpha.nomagicresponder.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static alpha.nomagicresponder.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.nomagicresponder.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static java.util.function.Function.identity;
import static java.util.stream.Collectors.toUnmodifiableMap;

/**
 * Factories of {@link Response}s.<p>
 *
 * Even though this class produces ready-built responses, further modifications
 * of the response is easy to accomplish using {@code toBuilder()}.
 *
 * <pre>
 *   Response update = Responses.notFound() // 404 (Not Found)
 *                              .toBuilder()
 *                              .header("Cache-Control", "no-store")
 *                              .build();
 * </pre>
 *
 * Responses without a body, of all status codes declared in
 * {@link HttpConstants.StatusCode}, are built once during classloading and
 * reused. Responses with a body are created anew.<p>
 *
 * All methods herein as well as the responses they return are thread-safe and
 * non-blocking.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Responses
{
    private static final Map<Integer, Response> CACHE =
            IntStream.rangeClosed(100, 599)
                     .filter(c -> !ReasonPhrase.of(c).equals(ReasonPhrase.UNKNOWN))
                     .boxed()
                     .collect(toUnmodifiableMap(identity(), c ->
                         DefaultResponse.DefaultBuilder.ROOT.statusCode(c).build()));

    private Responses() {
        // Empty
    }

    /**
     * Returns a response with the specified status code, and no body.<p>
     *
     * If the status code is a constant declared in {@link StatusCode}, then
     * the returned reference is a cached response. For any other status code,
     * the response will be created anew each time.
     *
     * @param code HTTP status code
     * @return a response with the specified status code
     */
    public static Response status(int code) {
        var rsp = CACHE.get(code);
        return rsp != null ? rsp :
                DefaultResponse.DefaultBuilder.ROOT.statusCode(code).build();
    }

    /**
     * Returns a response with the specified status code and reason phrase,
     * and no body.<p>
     *
     * If the code and phrase are a related pair as declared in
     * {@link StatusCode} and {@link ReasonPhrase} (case-sensitive), then the
     * returned reference is a cached response.
     *
     * @param code HTTP status code
     * @param phrase reason phrase
     * @return a response with the specified status code and reason phrase
     * @throws NullPointerException if {@code phrase} is {@code null}
     */
    public static Response status(int code, String phrase) {
        requireNonNull(phrase, "phrase");
        var rsp = CACHE.get(code);
        return rsp != null && rsp.reasonPhrase().equals(phrase) ? rsp :
                DefaultResponse.DefaultBuilder.ROOT
                        .statusCode(code)
                        .reasonPhrase(phrase)
                        .build();
    }

    /**
     * Retrieves a cached 200 (OK) response without a body.
     *
     * @return a cached 200 (OK) response
     */
    public static Response ok() {
        return status(TWO_HUNDRED);
    }

    /**
     * Creates a new 200 (OK) response with a text body.<p>
     *
     * The content-type header will be set to
     * {@value HttpConstants.MediaType#TEXT_PLAIN_UTF8}.
     *
     * @param textPlain message body
     * @return a new 200 (OK) response
     * @throws NullPointerException if {@code textPlain} is {@code null}
     */
    public static Response text(String textPlain) {
        return ok().toBuilder()
                   .header(CONTENT_TYPE, TEXT_PLAIN_UTF8)
                   .body(textPlain.getBytes(UTF_8))
                   .build();
    }

    /**
     * Creates a new 200 (OK) response with a binary body.<p>
     *
     * The content-type header will be set to
     * {@value HttpConstants.MediaType#APPLICATION_OCTET_STREAM}.
     *
     * @param bytes message body (copied)
     * @return a new 200 (OK) response
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static Response octetStream(byte[] bytes) {
        return ok().toBuilder()
                   .header(CONTENT_TYPE, APPLICATION_OCTET_STREAM)
                   .body(bytes)
                   .build();
    }

    /**
     * Retrieves a cached 204 (No Content) response.
     *
     * @return a cached 204 (No Content) response
     */
    public static Response noContent() {
        return status(TWO_HUNDRED_FOUR);
    }

    /**
     * Retrieves a cached 400 (Bad Request) response.
     *
     * @return a cached 400 (Bad Request) response
     */
    public static Response badRequest() {
        return status(FOUR_HUNDRED);
    }

    /**
     * Retrieves a cached 404 (Not Found) response.<p>
     *
     * This is what an absent optional value resolves to.
     *
     * @return a cached 404 (Not Found) response
     */
    public static Response notFound() {
        return status(FOUR_HUNDRED_FOUR);
    }
}
