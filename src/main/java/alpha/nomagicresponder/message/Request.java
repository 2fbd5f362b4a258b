package alpha.nomagicresponder.message;

import alpha.nomagicresponder.Config;
import alpha.nomagicresponder.responder.Responder;

/**
 * A read-only handle of the request being responded to.<p>
 *
 * The request object is passed through every
 * {@link Responder#respondTo(Request)} call. None of the responders of this
 * library inspects the request, except for reading the {@link #config()} that
 * governs the conversion. Parsing the request is the job of the server that
 * dispatches to the handler; this interface exposes only what the conversion
 * needs, plus the request-line components useful for logging.<p>
 *
 * The implementation is immutable and thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Request
{
    /**
     * Returns a request using {@link Config#DEFAULT}.
     *
     * @param method of request
     * @param target of request
     * @return a request
     * @throws NullPointerException if any argument is {@code null}
     */
    static Request of(String method, String target) {
        return of(method, target, Config.DEFAULT);
    }

    /**
     * Returns a request.
     *
     * @param method of request
     * @param target of request
     * @param config governing the conversion of the response
     * @return a request
     * @throws NullPointerException if any argument is {@code null}
     */
    static Request of(String method, String target, Config config) {
        return new DefaultRequest(method, target, config);
    }

    /**
     * Returns the request method, e.g. "GET".
     *
     * @return the request method (never {@code null})
     */
    String method();

    /**
     * Returns the raw request-target, e.g. "/hello?name=John".
     *
     * @return the request-target (never {@code null})
     */
    String target();

    /**
     * Returns the configuration that governs the conversion of the response.
     *
     * @return the configuration (never {@code null})
     */
    Config config();
}
