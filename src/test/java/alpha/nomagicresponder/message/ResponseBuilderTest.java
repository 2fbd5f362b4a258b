package alpha.nomagicresponder.message;

import org.assertj.core.api.MapAssert;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;

import static alpha.nomagicresponder.message.Response.builder;
import static alpha.nomagicresponder.testutil.Assertions.bodyAsString;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.List.of;
import static java.util.Map.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Response.Builder}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class ResponseBuilderTest
{
    @Test
    void happyPath() {
        Response r = builder(200, "OK").build();
        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.reasonPhrase()).isEqualTo("OK");
        assertHeadersMap(r).isEmpty();
        assertThat(r.isBodyEmpty()).isTrue();
    }

    @Test
    void unknownStatusCode() {
        Response r = builder(299).build();
        assertThat(r.statusCode()).isEqualTo(299);
        assertThat(r.reasonPhrase()).isEqualTo("Unknown");
    }

    @Test
    void reasonPhraseFollowsNewStatusCode() {
        Response r = builder(200).statusCode(404).build();
        assertThat(r.reasonPhrase()).isEqualTo("Not Found");
    }

    @Test
    void changesAffectNewInstanceNotOld() {
        Response.Builder b1 = builder(1).reasonPhrase(""),
                         b2 = b1.statusCode(2),
                         b3 = b2.statusCode(3);
        assertThat(b1.build().statusCode()).isEqualTo(1);
        assertThat(b2.build().statusCode()).isEqualTo(2);
        assertThat(b3.build().statusCode()).isEqualTo(3);
    }

    @Test
    void headersAddRepeated() {
        Response r = builder(-1)
            .header(    "k", "v2")
            .addHeader( "k", "v1")
            .addHeaders("k", "v3",
                        "k", "v2")
            .build();
        assertHeadersMap(r).containsOnly(
            entry("k", of("v2", "v1", "v3", "v2")));
    }

    @Test
    void headerEmptyValues() {
        var r = builder(-1).addHeaders(
            "k1", "",
            "k2", "",
            "k1", "").build();
        assertHeadersMap(r).containsExactly(
            entry("k1", of("", "")),
            entry("k2", of("")));
    }

    @Test
    void noSurroundingWhiteSpace() {
        var b = builder(-1);
        assertThatThrownBy(() -> b.addHeader(" k", "v"))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Leading and/or trailing whitespace: \" k\"");
        assertThatThrownBy(() -> b.header("k", "v "))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Leading and/or trailing whitespace: \"v \"");
    }

    @Test
    void headerRemove() {
        Response r = builder(-1).header("k", "v").removeHeader("K").build();
        assertHeadersMap(r).isEmpty();
    }

    @Test
    void headerReplace_caseInsensitive() {
        Response r = builder(-1).header("k", "v1").header("K", "v2").build();
        assertHeadersMap(r).containsOnly(
            entry("K", of("v2")));
    }

    @Test
    void headerLookup_caseInsensitive() {
        var h = builder(-1).addHeaders("Content-Type", "text/plain").build().headers();
        assertThat(h.contains("content-type")).isTrue();
        assertThat(h.firstValue("CONTENT-TYPE")).hasValue("text/plain");
        assertThat(h.allValues("x")).isEmpty();
    }

    @Test
    void headerNameIsRepeatedWithDifferentCasing() {
        var b = builder(-1).addHeaders("Abc", "X", "abC", "Boom!");
        assertThatThrownBy(b::build)
            .isExactlyInstanceOf(IllegalStateException.class)
            .hasCauseExactlyInstanceOf(IllegalArgumentException.class)
            .cause()
            .hasMessage("Header name repeated with different casing: abC");
    }

    @Test
    void statusCodeNotSet() {
        assertThatThrownBy(() -> DefaultResponse.DefaultBuilder.ROOT.build())
            .isExactlyInstanceOf(IllegalStateException.class)
            .hasMessage("Status code not set.");
    }

    @Test
    void body_writableBufferIsCopied() {
        var buf = ByteBuffer.wrap("abc".getBytes(US_ASCII));
        var r = builder(200).body(buf).build();
        buf.put(0, (byte) 'x');
        assertThat(bodyAsString(r)).isEqualTo("abc");
        assertThat(buf.position()).isZero();
    }

    @Test
    void body_eachCallIsNewView() {
        var r = builder(200).body("abc".getBytes(US_ASCII)).build();
        r.body().get();
        assertThat(r.body().remaining()).isEqualTo(3);
        assertThat(r.body().isReadOnly()).isTrue();
    }

    @Test
    void body_notAllowed() {
        var b = builder(204).body(new byte[]{1});
        assertThatThrownBy(b::build)
            .isExactlyInstanceOf(IllegalResponseBodyException.class)
            .hasMessage("Presumably a body in a 204 (No Content) response.");
    }

    private static MapAssert<String, List<String>> assertHeadersMap(Response r) {
        return assertThat(r.headers().asMap());
    }
}
