package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Response;

import java.util.concurrent.CompletionStage;

import static java.util.Objects.requireNonNull;

/**
 * The future of an {@link Either}.<p>
 *
 * The future completes the same way {@link NormalizedFuture} does, and also
 * knows which branch it is mirroring.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class EitherFuture extends NormalizedFuture
{
    static EitherFuture of(
            Either.Branch branch,
            CompletionStage<? extends Response> source,
            FailureConverter converter) {
        var f = new EitherFuture(branch, source, converter);
        f.start();
        return f;
    }

    private final Either.Branch branch;

    private EitherFuture(
            Either.Branch branch,
            CompletionStage<? extends Response> source,
            FailureConverter converter) {
        super(source, converter);
        this.branch = requireNonNull(branch);
    }

    /**
     * Returns the branch of the {@code Either} that produced this future.
     *
     * @return the branch of the {@code Either} that produced this future
     */
    public Either.Branch branch() {
        return branch;
    }
}
