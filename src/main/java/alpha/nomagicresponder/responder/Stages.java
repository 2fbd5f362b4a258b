package alpha.nomagicresponder.responder;

import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import static java.lang.System.Logger.Level.DEBUG;

/**
 * Utilities for {@code CompletionStage}s.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class Stages
{
    private static final System.Logger LOG
            = System.getLogger(Stages.class.getPackageName());

    private Stages() {
        // Empty
    }

    /**
     * Returns the cause of a {@code CompletionException} or an
     * {@code ExecutionException}, recursively.<p>
     *
     * Any other throwable, or a wrapper without a cause, is returned as-is.
     *
     * @param thr to unwrap
     * @return the cause
     */
    static Throwable unwrap(Throwable thr) {
        Throwable t = thr;
        while ((t instanceof CompletionException ||
                t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Cancels the given stage, if it supports cancellation.
     *
     * @param stage to cancel
     */
    static void cancel(CompletionStage<?> stage) {
        try {
            stage.toCompletableFuture().cancel(false);
        } catch (UnsupportedOperationException e) {
            LOG.log(DEBUG, "Stage does not support cancellation: " + stage, e);
        }
    }
}
