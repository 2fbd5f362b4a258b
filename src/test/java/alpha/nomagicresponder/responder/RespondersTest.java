package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.message.Response;
import alpha.nomagicresponder.message.Responses;
import alpha.nomagicresponder.message.IllegalResponseBodyException;
import alpha.nomagicresponder.util.ByteSink;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static alpha.nomagicresponder.testutil.Assertions.assertFailed;
import static alpha.nomagicresponder.testutil.Assertions.assertSucceeded;
import static alpha.nomagicresponder.testutil.Assertions.assertText;
import static alpha.nomagicresponder.testutil.Assertions.bodyAsString;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Small tests of {@link Responders}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class RespondersTest
{
    private static final Request REQ = Request.of("GET", "/");

    @Test
    void empty() {
        var rsp = assertSucceeded(Responders.empty().respondTo(REQ));
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.reasonPhrase()).isEqualTo("OK");
        assertThat(rsp.headers().isEmpty()).isTrue();
        assertThat(rsp.isBodyEmpty()).isTrue();
    }

    @Test
    void text() {
        var rsp = assertSucceeded(Responders.text("Hello").respondTo(REQ));
        assertText(rsp, 200, "Hello");
    }

    @Test
    void text_utf8() {
        var rsp = assertSucceeded(Responders.text("åäö").respondTo(REQ));
        assertThat(rsp.body().remaining()).isEqualTo(6);
        assertThat(bodyAsString(rsp)).isEqualTo("åäö");
    }

    @Test
    void text_charSequenceIsReadWhenResponding() {
        var sb = new StringBuilder("Hello");
        var responder = Responders.text(sb);
        sb.append(" World");
        assertText(assertSucceeded(responder.respondTo(REQ)), 200, "Hello World");
    }

    @Test
    void bytes_array() {
        var arr = "abc".getBytes(US_ASCII);
        var rsp = assertSucceeded(Responders.bytes(arr).respondTo(REQ));
        arr[0] = 'x';
        assertThat(rsp.statusCode()).isEqualTo(200);
        assertThat(rsp.headers().allValues("content-type"))
                .containsExactly("application/octet-stream");
        assertThat(bodyAsString(rsp)).isEqualTo("abc");
    }

    @Test
    void bytes_buffer() {
        var buf = ByteBuffer.wrap("abc".getBytes(US_ASCII)).asReadOnlyBuffer();
        var rsp = assertSucceeded(Responders.bytes(buf).respondTo(REQ));
        assertThat(bodyAsString(rsp)).isEqualTo("abc");
        assertThat(buf.position()).isZero();
    }

    @Test
    void bytes_sink() throws IOException {
        var sink = new ByteSink();
        sink.write("abc".getBytes(US_ASCII));
        var rsp = assertSucceeded(Responders.bytes(sink).respondTo(REQ));
        assertThat(bodyAsString(rsp)).isEqualTo("abc");
        assertThatThrownBy(() -> sink.write(1))
                .isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void bytes_sinkAlreadyFrozen() {
        var sink = new ByteSink();
        sink.freeze();
        var thr = assertFailed(Responders.bytes(sink).respondTo(REQ));
        assertThat(thr)
                .isExactlyInstanceOf(HttpException.class)
                .hasCauseExactlyInstanceOf(IllegalStateException.class);
        assertThat(((HttpException) thr).statusCode()).isEqualTo(500);
    }

    @Test
    void of_response() {
        Response r = Responses.noContent();
        assertThat(assertSucceeded(Responders.of(r).respondTo(REQ))).isSameAs(r);
    }

    @Test
    void of_builder() {
        var b = Response.builder(202).header("X-Id", "7");
        var rsp = assertSucceeded(Responders.of(b).respondTo(REQ));
        assertThat(rsp.statusCode()).isEqualTo(202);
        assertThat(rsp.headers().firstValue("x-id")).hasValue("7");
    }

    @Test
    void of_builderFails() {
        var b = Response.builder(204).body(new byte[]{1});
        var thr = assertFailed(Responders.of(b).respondTo(REQ));
        assertThat(thr)
                .isExactlyInstanceOf(HttpException.class)
                .hasCauseExactlyInstanceOf(IllegalResponseBodyException.class);
    }

    @Test
    void requestIsNotInspected() {
        var req = mock(Request.class);
        assertSucceeded(Responders.empty().respondTo(req));
        assertSucceeded(Responders.text("x").respondTo(req));
        verifyNoInteractions(req);
    }

    @Test
    void nulls() {
        assertThatThrownBy(() -> Responders.text((String) null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Responders.bytes((byte[]) null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Responders.of((Response) null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Responders.optional(null))
                .isExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void optional_present() {
        var rsp = assertSucceeded(
                Responders.optional(Optional.of(Responders.text("x"))).respondTo(REQ));
        assertText(rsp, 200, "x");
    }

    @Test
    void optional_absent() {
        var rsp = assertSucceeded(
                Responders.<HttpException>optional(Optional.empty()).respondTo(REQ));
        assertThat(rsp.statusCode()).isEqualTo(404);
        assertThat(rsp.reasonPhrase()).isEqualTo("Not Found");
        assertThat(rsp.headers().isEmpty()).isTrue();
        assertThat(rsp.isBodyEmpty()).isTrue();
    }

    @Test
    void optional_presentFailure() {
        var e = new HttpException(409, "taken");
        Responder<HttpException> failing = req ->
                CompletableFuture.failedFuture(e);
        var thr = assertFailed(Responders.optional(Optional.of(failing)).respondTo(REQ));
        assertThat(thr).isSameAs(e);
    }

    @Test
    void pair() {
        var rsp = assertSucceeded(
                Responders.pair(Responders.text("Created!"), 201).respondTo(REQ));
        assertText(rsp, 201, "Created!");
        assertThat(rsp.reasonPhrase()).isEqualTo("Created");
    }

    @Test
    void pair_passesThroughFailure() {
        var e = new IllegalStateException();
        Responder<IllegalStateException> failing = req ->
                CompletableFuture.failedFuture(e);
        assertThat(assertFailed(Responders.pair(failing, 201).respondTo(REQ))).isSameAs(e);
    }

    @Test
    void pair_decoratedStatusWins() {
        var rsp = assertSucceeded(Responders.pair(Responders.empty(), 201)
                .withStatus(202)
                .respondTo(REQ));
        assertThat(rsp.statusCode()).isEqualTo(202);
    }
}
