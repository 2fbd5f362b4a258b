package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;
import alpha.nomagicresponder.message.Responses;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * A responder that may be absent.<p>
 *
 * A present responder is used as-is; its outcome, success or failure, is the
 * outcome of this responder. An absent responder produces a 404 (Not Found)
 * response with no body.
 *
 * @param <E> type of failure
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class OptionalResponder<E extends Throwable> implements Responder<E>
{
    private final Optional<? extends Responder<E>> responder;

    OptionalResponder(Optional<? extends Responder<E>> responder) {
        this.responder = requireNonNull(responder, "responder");
    }

    @Override
    public CompletionStage<Response> respondTo(Request request) {
        if (responder.isEmpty()) {
            return CompletableFuture.completedFuture(Responses.notFound());
        }
        return responder.get().respondTo(request);
    }

    @Override
    public String toString() {
        return OptionalResponder.class.getSimpleName() + "{" + responder + '}';
    }
}
