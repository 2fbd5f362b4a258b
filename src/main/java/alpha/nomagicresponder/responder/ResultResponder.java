package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;
import alpha.nomagicresponder.util.Result;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * A responder of a fallible computation.<p>
 *
 * If the result is ok, then the contained responder is used, and its failure,
 * if any, is converted into an {@link HttpException} (see {@link
 * NormalizedFuture}). If the result is an error, then this responder fails
 * with the error, converted.<p>
 *
 * The conversion is performed by the {@link FailureConverter} configured for
 * the request.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ResultResponder implements Responder<HttpException>
{
    private final Result<? extends Responder<?>, ? extends Throwable> result;

    ResultResponder(Result<? extends Responder<?>, ? extends Throwable> result) {
        this.result = requireNonNull(result, "result");
    }

    @Override
    public CompletionStage<Response> respondTo(Request request) {
        var c = request.config().failureConverter();
        return result.fold(
            ok  -> NormalizedFuture.of(ok.respondTo(request), c),
            err -> CompletableFuture.failedFuture(c.convert(err)));
    }

    @Override
    public String toString() {
        return ResultResponder.class.getSimpleName() + "{" + result + '}';
    }
}
