package alpha.nomagicresponder.message;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by {@link Response.Builder#build()} if a body is presumably present
 * in a response that must not have one.<p>
 *
 * A status override applied by a responder may cause this exception. For
 * example, overriding the status of a text response with 204 (No Content).
 * The responder then resolves to a failure carrying this exception.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class IllegalResponseBodyException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    private final transient Response response;

    /**
     * Constructs this object.
     *
     * @param message passed through to {@link Throwable#Throwable(String)}
     * @param response the offending message
     * @throws NullPointerException if {@code response} is {@code null}
     */
    public IllegalResponseBodyException(String message, Response response) {
        super(message);
        this.response = requireNonNull(response);
    }

    /**
     * Returns the response that failed to build.
     *
     * @return the response that failed to build
     */
    public Response response() {
        return response;
    }
}
