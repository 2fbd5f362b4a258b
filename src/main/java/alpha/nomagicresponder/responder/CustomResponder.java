package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.Config;
import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletionStage;

import static alpha.nomagicresponder.util.Strings.requireFieldValue;
import static alpha.nomagicresponder.util.Strings.requireToken;
import static java.util.Objects.requireNonNull;

/**
 * A responder decorated with a status code override and header overrides.<p>
 *
 * The decorator is created by {@link Responder#withStatus(int)} or {@link
 * Responder#withHeader(String, String)}, and these methods called on the
 * decorator itself accumulate overrides on the same instance.<p>
 *
 * If the status code is overridden many times, the last write wins.<p>
 *
 * Header overrides are accumulated in order. At the time of conversion, all
 * values of a given name (case-insensitive) in the inner response are replaced
 * by the values added for the name through this class. Headers of other names
 * remain untouched.<p>
 *
 * A header name or value that is invalid does not cause {@code withHeader} to
 * throw. The header is skipped and the error is recorded, to be acted upon when
 * the response is produced; the response is failed with the error if
 * {@link Config#rejectInvalidHeaderOverride()} is {@code true}, otherwise the
 * error is logged and the response is produced without the invalid header.
 * If more than one error occurred, only the last one is kept.<p>
 *
 * A failure of the inner responder passes through unchanged and no overrides
 * are applied.<p>
 *
 * Two failures of the stage are not an {@code E}. An {@link
 * alpha.nomagicresponder.message.IllegalResponseBodyException
 * IllegalResponseBodyException} if the status code override does not allow the
 * body of the inner response, and the recorded {@code
 * IllegalArgumentException} if {@code rejectInvalidHeaderOverride} is
 * {@code true}.<p>
 *
 * This class is mutable and not thread-safe.
 *
 * @param <E> type of failure
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class CustomResponder<E extends Throwable> implements Responder<E>
{
    /**
     * Returns a decorator of the given responder, without overrides.<p>
     *
     * If the given responder is already a decorator, then it is returned
     * as-is.
     *
     * @param responder to decorate
     * @param <E> type of failure
     * @return a decorator of the given responder
     * @throws NullPointerException if {@code responder} is {@code null}
     */
    public static <E extends Throwable> CustomResponder<E> of(Responder<E> responder) {
        if (responder instanceof CustomResponder) {
            @SuppressWarnings("unchecked")
            CustomResponder<E> c = (CustomResponder<E>) responder;
            return c;
        }
        return new CustomResponder<>(responder);
    }

    private final Responder<E> responder;
    private final List<Map.Entry<String, String>> headers;
    private Integer status;
    private IllegalArgumentException invalidHeader;

    private CustomResponder(Responder<E> responder) {
        this.responder = requireNonNull(responder, "responder");
        this.headers = new ArrayList<>();
    }

    /**
     * Overrides the status code.<p>
     *
     * The reason phrase of the response will be the phrase that goes with the
     * new status code.
     *
     * @param statusCode new status code
     * @return this
     */
    @Override
    public CustomResponder<E> withStatus(int statusCode) {
        status = statusCode;
        return this;
    }

    /**
     * Adds a header override.<p>
     *
     * The name must be a token and the value must not contain control
     * characters nor leading or trailing whitespace. An invalid header is not
     * added and the error is recorded, see {@link #pendingError()}.
     *
     * @param name of header
     * @param value of header
     * @return this
     * @throws NullPointerException if any argument is {@code null}
     */
    @Override
    public CustomResponder<E> withHeader(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        try {
            headers.add(Map.entry(requireToken(name), requireFieldValue(value)));
        } catch (IllegalArgumentException e) {
            invalidHeader = e;
        }
        return this;
    }

    /**
     * Returns the status code override, if set.
     *
     * @return the status code override, if set
     */
    public OptionalInt statusOverride() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }

    /**
     * Returns all valid header overrides, in order of addition.
     *
     * @return all valid header overrides (unmodifiable)
     */
    public List<Map.Entry<String, String>> headerOverrides() {
        return List.copyOf(headers);
    }

    /**
     * Returns the last recorded header error, if any.
     *
     * @return the last recorded header error, if any
     */
    public Optional<IllegalArgumentException> pendingError() {
        return Optional.ofNullable(invalidHeader);
    }

    @Override
    public CompletionStage<Response> respondTo(Request request) {
        return OverrideFuture.start(
                responder.respondTo(request),
                status,
                List.copyOf(headers),
                invalidHeader,
                request.config().rejectInvalidHeaderOverride());
    }

    @Override
    public String toString() {
        return CustomResponder.class.getSimpleName() + "{" +
                "responder=" + responder +
                ", status=" + status +
                ", headers=" + headers +
                ", pendingError=" + invalidHeader +
                '}';
    }
}
