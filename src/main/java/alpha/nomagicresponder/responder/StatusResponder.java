package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;

import java.util.List;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * A responder paired with a status code.<p>
 *
 * The produced response is the response of the paired responder, with the
 * status code and reason phrase replaced. A failure passes through
 * unchanged.<p>
 *
 * Unlike {@link CustomResponder}, this class is an immutable value. Calling
 * {@link #withStatus(int)} on it returns a decorator wrapping the pair, and so
 * the decorator's status code is the one that ends up in the response.<p>
 *
 * The stage may also fail with an {@link
 * alpha.nomagicresponder.message.IllegalResponseBodyException
 * IllegalResponseBodyException}, which is not an {@code E}. This happens if the
 * status code does not allow a body and the paired response has one.
 *
 * @param <E> type of failure
 *
 * @see Responders#pair(Responder, int)
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class StatusResponder<E extends Throwable> implements Responder<E>
{
    private final Responder<E> responder;
    private final int statusCode;

    StatusResponder(Responder<E> responder, int statusCode) {
        this.responder = requireNonNull(responder, "responder");
        this.statusCode = statusCode;
    }

    /**
     * Returns the paired responder.
     *
     * @return the paired responder
     */
    public Responder<E> responder() {
        return responder;
    }

    /**
     * Returns the paired status code.
     *
     * @return the paired status code
     */
    public int statusCode() {
        return statusCode;
    }

    @Override
    public CompletionStage<Response> respondTo(Request request) {
        return OverrideFuture.start(
                responder.respondTo(request), statusCode, List.of(), null, false);
    }

    @Override
    public String toString() {
        return StatusResponder.class.getSimpleName() + "{" +
                "responder=" + responder +
                ", statusCode=" + statusCode +
                '}';
    }
}
