package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;

import java.util.concurrent.CompletionStage;

/**
 * Converts itself into a {@link Response}.<p>
 *
 * A responder is what a request handler returns. The server, having received
 * the responder, calls {@link #respondTo(Request)} exactly once and awaits the
 * returned stage, which completes either normally with the response to write,
 * or exceptionally with a failure of type {@code E}. The failure is then
 * converted into an {@link HttpException} by a {@link FailureConverter} and
 * rendered by the server's error handling.
 *
 * <pre>{@code
 *   Responder<HttpException> greet = Responders.text("Hello")
 *           .withStatus(201)
 *           .withHeader("Cache-Control", "no-store");
 * }</pre>
 *
 * Responders for the most basic value shapes are provided by
 * {@link Responders}. Composite responders wrap other responders:
 * {@link CustomResponder} overrides status and headers, {@link Either} unifies
 * two responder types, {@link OptionalResponder} and {@link ResultResponder}
 * adapt optional and fallible values.<p>
 *
 * A responder is consumed by the conversion. It must not be reused after
 * {@code respondTo} has been called, and the implementation does not need to
 * be thread-safe.<p>
 *
 * The implementation must not throw an exception from {@code respondTo}. A
 * failure, even one detected immediately, is returned as an exceptionally
 * completed stage. The stage completes exceptionally with the failure itself,
 * not wrapped in a {@code CompletionException}.
 *
 * @param <E> type of failure
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface Responder<E extends Throwable>
{
    /**
     * Converts this responder into a response.
     *
     * @param request the request being responded to
     * @return a stage of the response (never {@code null})
     */
    CompletionStage<Response> respondTo(Request request);

    /**
     * Overrides the status code of this responder's response.<p>
     *
     * The reason phrase will be replaced with the phrase that goes with the
     * new status code.
     *
     * <pre>{@code
     *   Responder<?> created = Responders.text("Welcome!").withStatus(201);
     * }</pre>
     *
     * @implSpec
     * The default implementation is equivalent to:
     * <pre>
     *   return CustomResponder.{@link CustomResponder#of(Responder)
     *     of}(this).withStatus(statusCode);
     * </pre>
     *
     * @param statusCode new status code
     * @return a decorator of this responder
     */
    default CustomResponder<E> withStatus(int statusCode) {
        return CustomResponder.of(this).withStatus(statusCode);
    }

    /**
     * Adds a header to this responder's response.<p>
     *
     * All values of the same header name in the response will be replaced by
     * the value(s) added through this method.
     *
     * <pre>{@code
     *   Responder<?> versioned = Responders.text(json)
     *           .withHeader("Content-Type", "application/json")
     *           .withHeader("X-Version", "1.2.3");
     * }</pre>
     *
     * An invalid name or value does not cause this method to throw, see
     * {@link CustomResponder#withHeader(String, String)}.
     *
     * @implSpec
     * The default implementation is equivalent to:
     * <pre>
     *   return CustomResponder.{@link CustomResponder#of(Responder)
     *     of}(this).withHeader(name, value);
     * </pre>
     *
     * @param name of header
     * @param value of header
     * @return a decorator of this responder
     * @throws NullPointerException if any argument is {@code null}
     */
    default CustomResponder<E> withHeader(String name, String value) {
        return CustomResponder.of(this).withHeader(name, value);
    }
}
