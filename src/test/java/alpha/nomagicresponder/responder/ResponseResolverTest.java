package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.Config;
import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;
import alpha.nomagicresponder.message.Responses;
import alpha.nomagicresponder.testutil.Logging;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static alpha.nomagicresponder.testutil.Assertions.assertFailed;
import static alpha.nomagicresponder.testutil.Assertions.assertSucceeded;
import static alpha.nomagicresponder.testutil.Assertions.assertText;
import static alpha.nomagicresponder.testutil.Logging.rec;
import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link ResponseResolver}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ResponseResolverTest
{
    private static final Request REQ = Request.of("GET", "/greeting");

    private final Logging.Recorder log = Logging.startRecording(ResponseResolver.class);

    @AfterEach
    void stopRecording() {
        log.stop();
    }

    @Test
    void success() {
        assertText(assertSucceeded(ResponseResolver.resolve("Hello", REQ)), 200, "Hello");
        log.assertThatNoWarningOrErrorWasLogged();
    }

    @Test
    void decoratedOptional() {
        var rsp = assertSucceeded(ResponseResolver.resolve(
                Responders.optional(Optional.of(Responders.text("x")))
                          .withHeader("X-A", "1"), REQ));
        assertThat(rsp.headers().firstValue("x-a")).hasValue("1");
    }

    @Test
    void clientError_loggedOnDebug() {
        var se = new StatusError(404, "No such greeting");
        var thr = assertFailed(ResponseResolver.resolve(se, REQ));
        assertThat(((HttpException) thr).statusCode()).isEqualTo(404);
        log.assertThatLogContainsOnlyOnce(
                rec(DEBUG, "Failed to respond to \"GET /greeting\".", thr));
    }

    @Test
    void serverError_loggedOnError() {
        var ise = new IllegalStateException("boom");
        Responder<IllegalStateException> failing = req -> CompletableFuture.failedFuture(ise);
        var thr = assertFailed(ResponseResolver.resolve(failing, REQ));
        assertThat(thr).isExactlyInstanceOf(HttpException.class).hasCause(ise);
        log.assertThatLogContainsOnlyOnce(
                rec(ERROR, "Failed to respond to \"GET /greeting\".", thr));
    }

    @Test
    void unknownType_fails() {
        var thr = assertFailed(ResponseResolver.resolve(LocalDate.EPOCH, REQ));
        assertThat(thr).isExactlyInstanceOf(HttpException.class)
                       .hasCauseExactlyInstanceOf(IllegalArgumentException.class);
        assertThat(((HttpException) thr).statusCode()).isEqualTo(500);
    }

    @Test
    void responderThrows_fails() {
        var oops = new UnsupportedOperationException();
        Responder<RuntimeException> bad = req -> { throw oops; };
        var thr = assertFailed(ResponseResolver.resolve(bad, REQ));
        assertThat(thr).hasCause(oops);
    }

    @Test
    void responderReturnsNull_fails() {
        Responder<RuntimeException> bad = req -> null;
        var thr = assertFailed(ResponseResolver.resolve(bad, REQ));
        assertThat(thr).hasCauseExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void customAdapters() {
        var cfg = Config.configuration()
                .adapters(ResponderAdapters.BASE.with(
                        LocalDate.class, d -> Responders.text(d.toString())))
                .build();
        var rsp = assertSucceeded(ResponseResolver.resolve(
                LocalDate.EPOCH, Request.of("GET", "/", cfg)));
        assertText(rsp, 200, "1970-01-01");
    }

    @Test
    void respond_fallsBackToAdvisoryResponse() {
        Response rsp = assertSucceeded(ResponseResolver.respond(
                new StatusError(409, "Taken"), REQ));
        assertText(rsp, 409, "Taken");
    }

    @Test
    void respond_serverError() {
        Responder<RuntimeException> failing =
                req -> CompletableFuture.failedFuture(new RuntimeException("secret"));
        Response rsp = assertSucceeded(ResponseResolver.respond(failing, REQ));
        assertText(rsp, 500, "Internal Server Error");
    }

    @Test
    void cancel_reachesResponder() {
        var inner = new CompletableFuture<Response>();
        var f = ResponseResolver.resolve((Responder<RuntimeException>) req -> inner, REQ);
        assertThat(f.cancel(false)).isTrue();
        assertThat(inner).isCancelled();
        log.assertThatNoWarningOrErrorWasLogged();
        log.assertThatLogContainsOnlyOnce(
                rec(DEBUG, "Cancelled response to \"GET /greeting\".", null));
    }

    @Test
    void respond_cancel_reachesResponder() {
        var inner = new CompletableFuture<Response>();
        var stage = ResponseResolver.respond(
                (Responder<RuntimeException>) req -> inner, REQ).toCompletableFuture();
        assertThat(stage.cancel(false)).isTrue();
        assertThat(stage).isCancelled();
        assertThat(inner).isCancelled();
        log.assertThatNoWarningOrErrorWasLogged();
    }

    @Test
    void respond_suspendsUntilResponderCompletes() {
        var inner = new CompletableFuture<Response>();
        var stage = ResponseResolver.respond(
                (Responder<RuntimeException>) req -> inner, REQ).toCompletableFuture();
        assertThat(stage).isNotDone();
        inner.complete(Responses.badRequest());
        assertThat(assertSucceeded(stage)).isSameAs(Responses.badRequest());
    }

    @Test
    void nullRequest() {
        assertThatThrownBy(() -> ResponseResolver.resolve("x", null))
                .isExactlyInstanceOf(NullPointerException.class);
    }
}
