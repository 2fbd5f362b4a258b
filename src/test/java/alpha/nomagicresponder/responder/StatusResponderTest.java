package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.IllegalResponseBodyException;
import alpha.nomagicresponder.message.Request;
import org.junit.jupiter.api.Test;

import static alpha.nomagicresponder.testutil.Assertions.assertFailed;
import static alpha.nomagicresponder.testutil.Assertions.assertSucceeded;
import static alpha.nomagicresponder.testutil.Assertions.assertText;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link StatusResponder}, alone and combined with the other
 * responders.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class StatusResponderTest
{
    private static final Request REQ = Request.of("GET", "/");

    @Test
    void pair() {
        var p = Responders.pair(Responders.text("test"), 400);
        assertThat(p.statusCode()).isEqualTo(400);
        var rsp = assertSucceeded(p.respondTo(REQ));
        assertText(rsp, 400, "test");
        assertThat(rsp.reasonPhrase()).isEqualTo("Bad Request");
    }

    @Test
    void bodyNotAllowed() {
        var thr = assertFailed(Responders.pair(Responders.text("test"), 204).respondTo(REQ));
        assertThat(thr).isExactlyInstanceOf(IllegalResponseBodyException.class);
    }

    @Test
    void decoratedWithHeader_keepsStatus() {
        var rsp = assertSucceeded(Responders.pair(Responders.text("test"), 400)
                .withHeader("X-Custom", "1")
                .respondTo(REQ));
        assertText(rsp, 400, "test");
        assertThat(rsp.headers().firstValue("x-custom")).hasValue("1");
    }

    @Test
    void nested() {
        var rsp = assertSucceeded(Responders.pair(
                Responders.pair(Responders.empty(), 201), 202).respondTo(REQ));
        assertThat(rsp.statusCode()).isEqualTo(202);
    }

    @Test
    void inEither() {
        Either<Responder<HttpException>, StatusResponder<HttpException>>
                a = Either.a(Responders.text("test")),
                b = Either.b(Responders.pair(Responders.text("test"), 400));
        assertText(assertSucceeded(a.respondTo(REQ)), 200, "test");
        assertText(assertSucceeded(b.respondTo(REQ)), 400, "test");
    }
}
