package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.Config;
import alpha.nomagicresponder.message.Response;

import java.util.function.Function;

import static alpha.nomagicresponder.HttpConstants.ReasonPhrase.INTERNAL_SERVER_ERROR;
import static alpha.nomagicresponder.HttpConstants.StatusCode.FIVE_HUNDRED;
import static alpha.nomagicresponder.responder.Stages.unwrap;
import static java.util.Objects.requireNonNull;

/**
 * Converts a failure of any type into an {@link HttpException}.<p>
 *
 * The converter used is {@link Config#failureConverter()}, which by default is
 * {@link #BASE}. A custom converter is usually derived from the base converter,
 * for example:
 *
 * <pre>{@code
 *   FailureConverter c = FailureConverter.BASE
 *       .on(NoSuchElementException.class, e -> new HttpException(404, e.getMessage(), e))
 *       .on(TimeoutException.class, e -> new HttpException(503, null, e));
 * }</pre>
 *
 * The implementation must not throw an exception.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
@FunctionalInterface
public interface FailureConverter
{
    /**
     * The base converter.<p>
     *
     * Any {@code CompletionException} or {@code ExecutionException} is first
     * unwrapped. Then,
     * <ul>
     *   <li>an {@code HttpException} is returned as-is,</li>
     *   <li>a failure that implements {@link HasResponse} (for example, a
     *       {@link StatusError}) becomes an exception with the advisory
     *       response of the failure, and the failure's message,</li>
     *   <li>anything else becomes a 500 (Internal Server Error).</li>
     * </ul>
     *
     * The failure is set as the cause of a new exception.
     */
    FailureConverter BASE = failure -> {
        final Throwable t = unwrap(requireNonNull(failure));
        if (t instanceof HttpException) {
            return (HttpException) t;
        }
        if (t instanceof HasResponse) {
            final Response rsp;
            try {
                rsp = ((HasResponse) t).getResponse();
            } catch (RuntimeException e) {
                e.addSuppressed(t);
                return new HttpException(FIVE_HUNDRED, INTERNAL_SERVER_ERROR, e);
            }
            if (rsp != null) {
                return new HttpException(rsp, t.getMessage(), t);
            }
        }
        return new HttpException(FIVE_HUNDRED, INTERNAL_SERVER_ERROR, t);
    };

    /**
     * Converts the given failure.
     *
     * @param failure to convert
     * @return an exception (never {@code null})
     * @throws NullPointerException if {@code failure} is {@code null}
     */
    HttpException convert(Throwable failure);

    /**
     * Returns a converter that converts failures of the given type using the
     * given function, and delegates all other failures to this converter.<p>
     *
     * The failure is unwrapped before it is tested against the type. If the
     * function returns {@code null} or throws an exception, then this
     * converter is used instead; a thrown exception will be added as
     * suppressed to the failure.
     *
     * @param type of failure
     * @param function of failure
     * @param <X> type of failure
     * @return a new converter
     * @throws NullPointerException if any argument is {@code null}
     */
    default <X extends Throwable> FailureConverter on(
            Class<X> type, Function<? super X, ? extends HttpException> function) {
        requireNonNull(type, "type");
        requireNonNull(function, "function");
        return failure -> {
            final Throwable t = unwrap(requireNonNull(failure));
            if (type.isInstance(t)) {
                HttpException e = null;
                try {
                    e = function.apply(type.cast(t));
                } catch (RuntimeException thrown) {
                    t.addSuppressed(thrown);
                }
                if (e != null) {
                    return e;
                }
            }
            return convert(t);
        };
    }
}
