package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.Config;
import alpha.nomagicresponder.message.Request;
import org.junit.jupiter.api.Test;

import static alpha.nomagicresponder.testutil.Assertions.assertFailed;
import static alpha.nomagicresponder.testutil.Assertions.assertText;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link StatusError}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class StatusErrorTest
{
    private static final Request REQ = Request.of("POST", "/users");

    @Test
    void respondsWithFailure() {
        var se = new StatusError(409, "Username taken");
        var thr = assertFailed(se.respondTo(REQ));
        assertThat(thr).isExactlyInstanceOf(HttpException.class)
                       .hasMessage("Username taken")
                       .hasCause(se);
        var he = (HttpException) thr;
        assertThat(he.statusCode()).isEqualTo(409);
        assertThat(he.reasonPhrase()).isEqualTo("Conflict");
        assertText(he.getResponse(), 409, "Username taken");
    }

    @Test
    void defaultIs500() {
        var se = new StatusError("oops");
        assertThat(se.statusCode()).isEqualTo(500);
        assertThat(se.detail()).isEqualTo("oops");
    }

    @Test
    void detailMayBeAnyObject() {
        var se = new StatusError(400, 42);
        assertThat(se.detail()).isEqualTo(42);
        assertThat(se).hasMessage("42");
    }

    @Test
    void noDetail_noBody() {
        var se = new StatusError(403, null);
        assertThat(se.getMessage()).isNull();
        var rsp = se.getResponse();
        assertThat(rsp.statusCode()).isEqualTo(403);
        assertThat(rsp.isBodyEmpty()).isTrue();
    }

    @Test
    void convertedByConfiguredConverter() {
        var custom = new HttpException(418, "teapot");
        var cfg = Config.configuration()
                .failureConverter(FailureConverter.BASE.on(StatusError.class, e -> custom))
                .build();
        var thr = assertFailed(new StatusError(400, "x").respondTo(Request.of("GET", "/", cfg)));
        assertThat(thr).isSameAs(custom);
    }

    @Test
    void decorated_failurePassesThrough() {
        var thr = assertFailed(new StatusError(404, "none")
                .withHeader("X-A", "b")
                .respondTo(REQ));
        assertThat(((HttpException) thr).statusCode()).isEqualTo(404);
    }
}
