package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.HttpConstants.ReasonPhrase;
import alpha.nomagicresponder.HttpConstants.StatusCode;
import alpha.nomagicresponder.message.Response;
import alpha.nomagicresponder.message.Responses;

import static alpha.nomagicresponder.HttpConstants.HeaderName.CONTENT_TYPE;
import static alpha.nomagicresponder.HttpConstants.MediaType.TEXT_PLAIN_UTF8;
import static alpha.nomagicresponder.HttpConstants.StatusCode.THREE_HUNDRED_FOUR;
import static alpha.nomagicresponder.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * The normalized failure of a responder.<p>
 *
 * All failures, whatever their type, are eventually converted into this
 * exception by a {@link FailureConverter}. The exception carries a status code
 * and an advisory response the server may send.<p>
 *
 * Unless given explicitly, the advisory response is a response with the
 * status code of this exception, and with the message of this exception as a
 * {@value alpha.nomagicresponder.HttpConstants.MediaType#TEXT_PLAIN_UTF8} body,
 * if there is a message and the status code allows a body.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class HttpException extends RuntimeException implements HasResponse
{
    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final transient Response response;

    /**
     * Constructs this object.
     *
     * @param statusCode of failure
     * @param message of failure (may be {@code null})
     */
    public HttpException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    /**
     * Constructs this object.
     *
     * @param statusCode of failure
     * @param message of failure (may be {@code null})
     * @param cause of failure (may be {@code null})
     */
    public HttpException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.response = null;
    }

    /**
     * Constructs this object.<p>
     *
     * The status code of this exception will be the status code of the given
     * response.
     *
     * @param response advisory response
     * @param message of failure (may be {@code null})
     * @param cause of failure (may be {@code null})
     * @throws NullPointerException if {@code response} is {@code null}
     */
    public HttpException(Response response, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = response.statusCode();
        this.response = response;
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
     * Returns the reason phrase of the status code.
     *
     * @return the reason phrase of the status code
     */
    public final String reasonPhrase() {
        return response != null ?
                response.reasonPhrase() : ReasonPhrase.of(statusCode);
    }

    /**
     * Returns {@code true} if the status code is 5XX (Server Error).
     *
     * @return see JavaDoc
     */
    public final boolean isServerError() {
        return StatusCode.isServerError(statusCode);
    }

    @Override
    public Response getResponse() {
        if (response != null) {
            return response;
        }
        var rsp = Responses.status(statusCode);
        var msg = getMessage();
        if (msg == null || msg.isEmpty() || !allowsBody()) {
            return rsp;
        }
        return rsp.toBuilder()
                  .header(CONTENT_TYPE, TEXT_PLAIN_UTF8)
                  .body(msg.getBytes(UTF_8))
                  .build();
    }

    private boolean allowsBody() {
        return StatusCode.isFinal(statusCode) &&
               statusCode != TWO_HUNDRED_FOUR &&
               statusCode != THREE_HUNDRED_FOUR;
    }
}
