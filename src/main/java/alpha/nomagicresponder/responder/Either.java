package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Request;

import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One of two responders.<p>
 *
 * A handler that must return different responder types from different code
 * paths may return an {@code Either}. Whichever branch is held produces the
 * response. A failure of the held responder, of whatever type, is converted
 * into an {@link HttpException}.
 *
 * <pre>{@code
 *   Either<StatusResponder<HttpException>, Responder<HttpException>> rsp
 *           = found ? Either.b(Responders.text(body))
 *                   : Either.a(Responders.pair(Responders.empty(), 410));
 * }</pre>
 *
 * The returned future reports which branch produced the response, see {@link
 * EitherFuture#branch()}.
 *
 * @param <A> type of first responder
 * @param <B> type of second responder
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class Either<A extends Responder<?>, B extends Responder<?>>
        implements Responder<HttpException>
{
    /**
     * The branch held by an {@code Either}.
     */
    public enum Branch {
        /** The first branch. */
        A,
        /** The second branch. */
        B
    }

    /**
     * Returns an {@code Either} holding the first branch.
     *
     * @param responder held
     * @param <A> type of first responder
     * @param <B> type of second responder
     * @return an {@code Either} holding the first branch
     * @throws NullPointerException if {@code responder} is {@code null}
     */
    public static <A extends Responder<?>, B extends Responder<?>> Either<A, B> a(A responder) {
        return new Either<>(Branch.A, requireNonNull(responder));
    }

    /**
     * Returns an {@code Either} holding the second branch.
     *
     * @param responder held
     * @param <A> type of first responder
     * @param <B> type of second responder
     * @return an {@code Either} holding the second branch
     * @throws NullPointerException if {@code responder} is {@code null}
     */
    public static <A extends Responder<?>, B extends Responder<?>> Either<A, B> b(B responder) {
        return new Either<>(Branch.B, requireNonNull(responder));
    }

    private final Branch branch;
    private final Responder<?> responder;

    private Either(Branch branch, Responder<?> responder) {
        this.branch = branch;
        this.responder = responder;
    }

    /**
     * Returns the branch held.
     *
     * @return the branch held
     */
    public Branch branch() {
        return branch;
    }

    /**
     * Returns the first responder, if held.
     *
     * @return the first responder, if held
     */
    @SuppressWarnings("unchecked")
    public Optional<A> first() {
        return branch == Branch.A ? Optional.of((A) responder) : Optional.empty();
    }

    /**
     * Returns the second responder, if held.
     *
     * @return the second responder, if held
     */
    @SuppressWarnings("unchecked")
    public Optional<B> second() {
        return branch == Branch.B ? Optional.of((B) responder) : Optional.empty();
    }

    @Override
    public EitherFuture respondTo(Request request) {
        return EitherFuture.of(
                branch,
                responder.respondTo(request),
                request.config().failureConverter());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Either)) {
            return false;
        }
        var other = (Either<?, ?>) obj;
        return branch == other.branch && responder.equals(other.responder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(branch, responder);
    }

    @Override
    public String toString() {
        return Either.class.getSimpleName() + "." + branch + "{" + responder + '}';
    }
}
