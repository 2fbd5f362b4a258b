package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Response;

/**
 * Is implemented by exceptions that know which response to send the client.<p>
 *
 * The response is only advisory. Error handling may choose to send a
 * different response.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface HasResponse
{
    /**
     * Returns an advisory response.
     *
     * @return an advisory response (never {@code null})
     */
    Response getResponse();
}
