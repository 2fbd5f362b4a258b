package alpha.nomagicresponder.util;

import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * The result of an operation that may fail.<p>
 *
 * Either {@link Ok} carrying the value, or {@link Err} carrying the
 * error. A handler may return a {@code Result} of a responder to let the
 * error short-circuit the conversion into a response.
 *
 * <pre>{@code
 *   Result<Responder<?>, StatusError> r = user == null ?
 *       Result.err(new StatusError(404, "No such user")) :
 *       Result.ok(Responders.text(user.name()));
 * }</pre>
 *
 * @param <T> type of value
 * @param <X> type of error
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public sealed interface Result<T, X extends Throwable>
        permits Result.Ok, Result.Err
{
    /**
     * Returns a successful result.
     *
     * @param value the value
     * @param <T> type of value
     * @param <X> type of error
     * @return a successful result
     * @throws NullPointerException if {@code value} is {@code null}
     */
    static <T, X extends Throwable> Result<T, X> ok(T value) {
        return new Ok<>(value);
    }

    /**
     * Returns a failed result.
     *
     * @param error the error
     * @param <T> type of value
     * @param <X> type of error
     * @return a failed result
     * @throws NullPointerException if {@code error} is {@code null}
     */
    static <T, X extends Throwable> Result<T, X> err(X error) {
        return new Err<>(error);
    }

    /**
     * Returns {@code true} if this is an {@link Ok}.
     *
     * @return see JavaDoc
     */
    boolean isOk();

    /**
     * Returns the value, or throws the error.
     *
     * @return the value
     * @throws X if this is an {@link Err}
     */
    T getOrThrow() throws X;

    /**
     * Applies one of the given functions.
     *
     * @param ifOk applied to the value of an {@code Ok}
     * @param ifErr applied to the error of an {@code Err}
     * @param <R> type of outcome
     * @return the function's outcome
     */
    <R> R fold(Function<? super T, ? extends R> ifOk,
               Function<? super X, ? extends R> ifErr);

    /**
     * A successful result.
     *
     * @param value the value
     * @param <T> type of value
     * @param <X> type of error
     */
    record Ok<T, X extends Throwable>(T value) implements Result<T, X> {
        /**
         * Constructs this object.
         *
         * @param value the value
         * @throws NullPointerException if {@code value} is {@code null}
         */
        public Ok {
            requireNonNull(value, "value");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> ifOk,
                          Function<? super X, ? extends R> ifErr) {
            return ifOk.apply(value);
        }
    }

    /**
     * A failed result.
     *
     * @param error the error
     * @param <T> type of value
     * @param <X> type of error
     */
    record Err<T, X extends Throwable>(X error) implements Result<T, X> {
        /**
         * Constructs this object.
         *
         * @param error the error
         * @throws NullPointerException if {@code error} is {@code null}
         */
        public Err {
            requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T getOrThrow() throws X {
            throw error;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> ifOk,
                          Function<? super X, ? extends R> ifErr) {
            return ifErr.apply(error);
        }
    }
}
