package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;
import alpha.nomagicresponder.message.Responses;
import alpha.nomagicresponder.util.ByteSink;
import alpha.nomagicresponder.util.Result;

import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

import static alpha.nomagicresponder.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicresponder.HttpConstants.MediaType.APPLICATION_OCTET_STREAM;
import static java.util.Objects.requireNonNull;

/**
 * Factories of responders.<p>
 *
 * The primitive responders respond immediately; the returned stage is already
 * completed. They respond with status 200 (OK) and
 * <ul>
 *   <li>{@link #empty()}: no headers and no body,</li>
 *   <li>{@code text}: a UTF-8 encoded body, and a {@value
 *       alpha.nomagicresponder.HttpConstants.MediaType#TEXT_PLAIN_UTF8}
 *       content-type,</li>
 *   <li>{@code bytes}: a binary body, and a {@value
 *       alpha.nomagicresponder.HttpConstants.MediaType#APPLICATION_OCTET_STREAM}
 *       content-type.</li>
 * </ul>
 *
 * If the response can not be built, the primitive responder fails with the
 * error, converted into an {@link HttpException}. This can only happen for
 * {@link #of(Response.Builder)} and {@link #bytes(ByteSink)}.<p>
 *
 * The remaining factories create composite responders.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Responders
{
    private Responders() {
        // Empty
    }

    /**
     * Returns a responder of an empty 200 (OK) response.
     *
     * @return a responder
     */
    public static Responder<HttpException> empty() {
        return req -> CompletableFuture.completedFuture(Responses.ok());
    }

    /**
     * Returns a responder of text.
     *
     * @param text body
     * @return a responder
     * @throws NullPointerException if {@code text} is {@code null}
     */
    public static Responder<HttpException> text(String text) {
        requireNonNull(text, "text");
        return req -> immediate(req, () -> Responses.text(text));
    }

    /**
     * Returns a responder of text.<p>
     *
     * The characters are read when the responder responds.
     *
     * @param text body
     * @return a responder
     * @throws NullPointerException if {@code text} is {@code null}
     */
    public static Responder<HttpException> text(CharSequence text) {
        requireNonNull(text, "text");
        return req -> immediate(req, () -> Responses.text(text.toString()));
    }

    /**
     * Returns a responder of bytes.<p>
     *
     * The bytes are copied when the responder responds.
     *
     * @param bytes body
     * @return a responder
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static Responder<HttpException> bytes(byte[] bytes) {
        requireNonNull(bytes, "bytes");
        return req -> immediate(req, () -> Responses.octetStream(bytes));
    }

    /**
     * Returns a responder of bytes.<p>
     *
     * The remaining bytes of the buffer are the body. A writable buffer is
     * copied when the responder responds, a read-only buffer is not. The
     * buffer's position is not modified.
     *
     * @param bytes body
     * @return a responder
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static Responder<HttpException> bytes(ByteBuffer bytes) {
        requireNonNull(bytes, "bytes");
        return req -> immediate(req, () -> octetStream().body(bytes).build());
    }

    /**
     * Returns a responder of bytes.<p>
     *
     * The sink is frozen when the responder responds, and its bytes become the
     * body without being copied. A sink that was already frozen fails the
     * response.
     *
     * @param bytes body
     * @return a responder
     * @throws NullPointerException if {@code bytes} is {@code null}
     */
    public static Responder<HttpException> bytes(ByteSink bytes) {
        requireNonNull(bytes, "bytes");
        return req -> immediate(req, () -> octetStream().body(bytes.freeze()).build());
    }

    /**
     * Returns a responder of the given response.
     *
     * @param response to respond
     * @return a responder
     * @throws NullPointerException if {@code response} is {@code null}
     */
    public static Responder<HttpException> of(Response response) {
        requireNonNull(response, "response");
        return req -> CompletableFuture.completedFuture(response);
    }

    /**
     * Returns a responder of the response built by the given builder.<p>
     *
     * The response is built when the responder responds. If the builder
     * throws an exception, the responder fails.
     *
     * @param builder of response
     * @return a responder
     * @throws NullPointerException if {@code builder} is {@code null}
     */
    public static Responder<HttpException> of(Response.Builder builder) {
        requireNonNull(builder, "builder");
        return req -> immediate(req, builder::build);
    }

    /**
     * Returns a responder that responds 404 (Not Found) if the given responder
     * is absent.
     *
     * @param responder optional responder
     * @param <E> type of failure
     * @return a responder
     * @throws NullPointerException if {@code responder} is {@code null}
     * @see OptionalResponder
     */
    public static <E extends Throwable> OptionalResponder<E> optional(
            Optional<? extends Responder<E>> responder) {
        return new OptionalResponder<>(responder);
    }

    /**
     * Returns a responder of the given result.
     *
     * @param result of a computation
     * @return a responder
     * @throws NullPointerException if {@code result} is {@code null}
     * @see ResultResponder
     */
    public static ResultResponder result(
            Result<? extends Responder<?>, ? extends Throwable> result) {
        return new ResultResponder(result);
    }

    /**
     * Returns a responder that responds with the given status code.
     *
     * @param responder of response
     * @param statusCode of response
     * @param <E> type of failure
     * @return a responder
     * @throws NullPointerException if {@code responder} is {@code null}
     * @see StatusResponder
     */
    public static <E extends Throwable> StatusResponder<E> pair(
            Responder<E> responder, int statusCode) {
        return new StatusResponder<>(responder, statusCode);
    }

    private static Response.Builder octetStream() {
        return Responses.ok().toBuilder().header(CONTENT_TYPE, APPLICATION_OCTET_STREAM);
    }

    private static CompletionStage<Response> immediate(
            Request req, Supplier<? extends Response> response) {
        try {
            return CompletableFuture.completedFuture(response.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    req.config().failureConverter().convert(e));
        }
    }
}
