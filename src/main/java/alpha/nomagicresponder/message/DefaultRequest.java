package alpha.nomagicresponder.message;

import alpha.nomagicresponder.Config;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@code Request}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
record DefaultRequest(String method, String target, Config config) implements Request
{
    DefaultRequest {
        requireNonNull(method, "method");
        requireNonNull(target, "target");
        requireNonNull(config, "config");
    }
}
