package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Response;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static alpha.nomagicresponder.responder.Stages.unwrap;
import static java.util.Objects.requireNonNull;

/**
 * A future that completes when a source stage completes, after one
 * transformation step.<p>
 *
 * The step is applied exactly once; synchronously by the thread that
 * completes the source, or by the thread calling {@link #start()} if the source
 * has already completed. A failure of the source is unwrapped from any
 * {@code CompletionException} before being handed to
 * {@link #onFailure(Throwable)}.<p>
 *
 * Cancelling this future cancels the source.<p>
 *
 * The subclass must call {@code start()} after construction.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
abstract class RelayFuture extends CompletableFuture<Response>
{
    private final CompletionStage<? extends Response> source;

    RelayFuture(CompletionStage<? extends Response> source) {
        this.source = requireNonNull(source, "source");
    }

    /**
     * Subscribes to the source.
     */
    final void start() {
        source.whenComplete((rsp, thr) -> {
            if (thr == null) {
                relaySuccess(rsp);
            } else {
                relayFailure(unwrap(thr));
            }
        });
    }

    /**
     * Transforms the response of the source.<p>
     *
     * An exception thrown by this method completes this future exceptionally
     * with the exception.
     *
     * @param rsp response of source (never {@code null})
     * @return the response to complete this future with
     */
    abstract Response onSuccess(Response rsp);

    /**
     * Transforms the failure of the source.
     *
     * @param failure of source (never {@code null}, never a
     *        {@code CompletionException} with a cause)
     * @return the failure to complete this future with
     */
    abstract Throwable onFailure(Throwable failure);

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        boolean cancelled = super.cancel(mayInterruptIfRunning);
        if (cancelled) {
            Stages.cancel(source);
        }
        return cancelled;
    }

    private void relaySuccess(Response rsp) {
        final Response r;
        try {
            r = onSuccess(requireNonNull(rsp, "Source completed with null."));
        } catch (RuntimeException e) {
            relayFailure(e);
            return;
        }
        complete(r);
    }

    private void relayFailure(Throwable failure) {
        Throwable t;
        try {
            t = onFailure(failure);
        } catch (RuntimeException e) {
            e.addSuppressed(failure);
            t = e;
        }
        completeExceptionally(t);
    }
}
