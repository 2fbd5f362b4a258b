package alpha.nomagicresponder;

import org.junit.jupiter.api.Test;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static alpha.nomagicresponder.HttpConstants.ReasonPhrase;
import static alpha.nomagicresponder.HttpConstants.ReasonPhrase.UNKNOWN;
import static alpha.nomagicresponder.HttpConstants.StatusCode;
import static java.util.Arrays.stream;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Small tests for {@link HttpConstants}.<p>
 *
 * The status code constants and the reason phrase constants must be reflected
 * in the respective "#VALUES" array, declared in the same order, as the phrase
 * of a code is looked up using the array index.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class HttpConstantsTest
{
    @Test
    void statusCode_constants_eq_values() {
        assertEquals(
            // All constants ...
            constants(StatusCode.class, int.class),
            // Must be in VALUES.
            IntStream.of(StatusCode.VALUES).boxed().collect(Collectors.toSet()));
    }

    @Test
    void reasonPhrase_constants_eq_values() {
        var phrases = constants(ReasonPhrase.class, String.class);
        phrases.remove(UNKNOWN);
        assertEquals(phrases, Set.of(ReasonPhrase.VALUES));
    }

    @Test
    void valuesSameSize() {
        assertEquals(StatusCode.VALUES.length, ReasonPhrase.VALUES.length);
    }

    @Test
    void phraseOf() {
        assertThat(ReasonPhrase.of(200)).isEqualTo("OK");
        assertThat(ReasonPhrase.of(422)).isEqualTo("Unprocessable Entity");
        assertThat(ReasonPhrase.of(599)).isEqualTo(UNKNOWN);
    }

    @Test
    void classes() {
        assertThat(StatusCode.isInformational(102)).isTrue();
        assertThat(StatusCode.isFinal(102)).isFalse();
        assertThat(StatusCode.isSuccessful(204)).isTrue();
        assertThat(StatusCode.isRedirection(304)).isTrue();
        assertThat(StatusCode.isClientError(499)).isTrue();
        assertThat(StatusCode.isServerError(500)).isTrue();
        assertThat(StatusCode.isServerError(600)).isFalse();
    }

    private static Set<Object> constants(Class<?> holder, Class<?> type) {
        return stream(holder.getFields())
                .filter(f -> f.getType() == type && Modifier.isStatic(f.getModifiers()))
                .map(HttpConstantsTest::get)
                .collect(Collectors.toSet());
    }

    private static Object get(Field f) {
        try {
            return f.get(null);
        } catch (IllegalAccessException e) {
            throw new AssertionError(e);
        }
    }
}
