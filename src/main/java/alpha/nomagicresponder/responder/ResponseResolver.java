package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.Config;
import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static alpha.nomagicresponder.responder.Stages.unwrap;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.util.Objects.requireNonNull;

/**
 * Resolves the value returned by a request handler into a response.<p>
 *
 * This is where the server meets the responders. The value is adapted into a
 * responder using {@link Config#adapters()}, the responder is asked to respond
 * exactly once, and any failure, including an exception thrown by a
 * misbehaving responder or adapter, is converted into an {@link
 * HttpException} using {@link Config#failureConverter()}. The configuration
 * used is the one of the request.<p>
 *
 * Failures are logged. A failure with a 5XX (Server Error) status code is
 * logged on level {@code ERROR}, all other failures on level {@code DEBUG}.
 * A cancelled resolution is not a failure of the responder and is logged on
 * level {@code DEBUG}.<p>
 *
 * Cancelling a returned stage cancels the stage of the responder.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ResponseResolver
{
    private static final System.Logger LOG
            = System.getLogger(ResponseResolver.class.getPackageName());

    private ResponseResolver() {
        // Empty
    }

    /**
     * Resolves the given value into a response.<p>
     *
     * The returned future completes exceptionally only with an {@link
     * HttpException}.
     *
     * @param value returned by a request handler (may be {@code null})
     * @param request being responded to
     * @return a future of the response
     * @throws NullPointerException if {@code request} is {@code null}
     */
    public static NormalizedFuture resolve(Object value, Request request) {
        requireNonNull(request, "request");
        final Config c = request.config();
        CompletionStage<Response> stage;
        try {
            stage = requireNonNull(c.adapters().adapt(value).respondTo(request),
                    "Responder returned null.");
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        var f = NormalizedFuture.of(stage, c.failureConverter());
        f.whenComplete((rsp, thr) -> {
            if (thr != null) {
                log(unwrap(thr), request);
            }
        });
        return f;
    }

    /**
     * Resolves the given value into a response, falling back to the advisory
     * response of a failure.<p>
     *
     * The returned stage completes normally, unless it is cancelled. Cancelling
     * it cancels the resolution.
     *
     * @param value returned by a request handler (may be {@code null})
     * @param request being responded to
     * @return a stage of the response
     * @throws NullPointerException if {@code request} is {@code null}
     * @see HttpException#getResponse()
     */
    public static CompletionStage<Response> respond(Object value, Request request) {
        var f = new FallbackFuture(
                resolve(value, request), request.config().failureConverter());
        f.start();
        return f;
    }

    private static void log(Throwable thr, Request req) {
        var target = "\"" + req.method() + " " + req.target() + "\".";
        if (thr instanceof CancellationException) {
            LOG.log(DEBUG, () -> "Cancelled response to " + target);
            return;
        }
        boolean serverError = !(thr instanceof HttpException) ||
                ((HttpException) thr).isServerError();
        var msg = "Failed to respond to " + target;
        if (serverError) {
            LOG.log(ERROR, msg, thr);
        } else {
            LOG.log(DEBUG, msg, thr);
        }
    }

    /**
     * Completes with the response of a resolution, or with the advisory
     * response of its failure. Cancelling this future cancels the resolution.
     */
    private static final class FallbackFuture extends CompletableFuture<Response>
    {
        private final NormalizedFuture resolution;
        private final FailureConverter converter;

        FallbackFuture(NormalizedFuture resolution, FailureConverter converter) {
            this.resolution = resolution;
            this.converter = converter;
        }

        void start() {
            resolution.whenComplete((rsp, thr) -> {
                if (thr == null) {
                    complete(rsp);
                } else {
                    complete(converter.convert(unwrap(thr)).getResponse());
                }
            });
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            boolean cancelled = super.cancel(mayInterruptIfRunning);
            if (cancelled) {
                resolution.cancel(mayInterruptIfRunning);
            }
            return cancelled;
        }
    }
}
