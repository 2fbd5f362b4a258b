package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Response;

import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * A future of a response that fails only with {@link HttpException}.<p>
 *
 * The future mirrors a source stage. A response of the source passes through
 * unchanged. A failure of the source, of whatever type, is converted into an
 * {@code HttpException} using a {@link FailureConverter}.<p>
 *
 * This is how the generic responders of this package, for example
 * {@link ResultResponder}, unify the failure type of an arbitrary responder
 * with the failure type they declare.<p>
 *
 * The future completes when the source completes, and cancelling it cancels
 * the source.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public class NormalizedFuture extends RelayFuture
{
    /**
     * Returns a future mirroring the given source.
     *
     * @param source stage of response
     * @param converter of failures
     * @return a future mirroring the given source
     * @throws NullPointerException if any argument is {@code null}
     */
    public static NormalizedFuture of(
            CompletionStage<? extends Response> source, FailureConverter converter) {
        var f = new NormalizedFuture(source, converter);
        f.start();
        return f;
    }

    private final FailureConverter converter;

    NormalizedFuture(
            CompletionStage<? extends Response> source, FailureConverter converter) {
        super(source);
        this.converter = requireNonNull(converter, "converter");
    }

    @Override
    final Response onSuccess(Response rsp) {
        return rsp;
    }

    @Override
    final Throwable onFailure(Throwable failure) {
        return converter.convert(failure);
    }
}
