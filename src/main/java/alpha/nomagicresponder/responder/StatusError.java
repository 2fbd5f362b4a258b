package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static alpha.nomagicresponder.HttpConstants.StatusCode.FIVE_HUNDRED;

/**
 * A failure with a status code and a detail.<p>
 *
 * The exception may be thrown, or returned as a responder. As a responder, it
 * always fails, with itself converted into an {@link HttpException} by the
 * {@link FailureConverter} configured for the request. The base converter
 * keeps the status code and uses the detail as message.
 *
 * <pre>{@code
 *   if (user == null) {
 *       return new StatusError(404, "No such user: " + id);
 *   }
 * }</pre>
 *
 * The detail may be any object; its string form is the message of the
 * exception, and the body of the advisory response.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class StatusError extends RuntimeException
        implements Responder<HttpException>, HasResponse
{
    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final transient Object detail;

    /**
     * Constructs a 500 (Internal Server Error) with the given detail.
     *
     * @param detail of failure (may be {@code null})
     */
    public StatusError(Object detail) {
        this(FIVE_HUNDRED, detail);
    }

    /**
     * Constructs this object.
     *
     * @param statusCode of failure
     * @param detail of failure (may be {@code null})
     */
    public StatusError(int statusCode, Object detail) {
        this(statusCode, detail, null);
    }

    /**
     * Constructs this object.
     *
     * @param statusCode of failure
     * @param detail of failure (may be {@code null})
     * @param cause of failure (may be {@code null})
     */
    public StatusError(int statusCode, Object detail, Throwable cause) {
        super(detail == null ? null : detail.toString(), cause);
        this.statusCode = statusCode;
        this.detail = detail;
    }

    /**
     * Returns the status code.
     *
     * @return the status code
     */
    public final int statusCode() {
        return statusCode;
    }

    /**
     * Returns the detail.
     *
     * @return the detail (may be {@code null})
     */
    public final Object detail() {
        return detail;
    }

    /**
     * {@inheritDoc}<p>
     *
     * The response is the same as the advisory response of an {@link
     * HttpException} with the same status code and message.
     */
    @Override
    public Response getResponse() {
        return new HttpException(statusCode, getMessage()).getResponse();
    }

    @Override
    public CompletionStage<Response> respondTo(Request request) {
        return CompletableFuture.failedFuture(
                request.config().failureConverter().convert(this));
    }
}
