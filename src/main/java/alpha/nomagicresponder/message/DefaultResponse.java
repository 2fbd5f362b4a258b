package alpha.nomagicresponder.message;

import alpha.nomagicresponder.HttpConstants.ReasonPhrase;
import alpha.nomagicresponder.util.AbstractImmutableBuilder;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static alpha.nomagicresponder.HttpConstants.StatusCode.THREE_HUNDRED_FOUR;
import static alpha.nomagicresponder.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;
import static alpha.nomagicresponder.util.Strings.requireNoSurroundingWS;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@code Response}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultResponse implements Response
{
    private static final ByteBuffer EMPTY = ByteBuffer.allocate(0).asReadOnlyBuffer();

    private final int statusCode;
    private final String reasonPhrase;
    private final Headers headers;
    // Read-only
    private final ByteBuffer body;
    private final DefaultBuilder origin;

    private DefaultResponse(
            int statusCode,
            String reasonPhrase,
            Headers headers,
            ByteBuffer body,
            DefaultBuilder origin)
    {
        this.statusCode = statusCode;
        this.reasonPhrase = reasonPhrase;
        this.headers = headers;
        this.body = body;
        this.origin = origin;
    }

    @Override
    public int statusCode() {
        return statusCode;
    }

    @Override
    public String reasonPhrase() {
        return reasonPhrase;
    }

    @Override
    public Headers headers() {
        return headers;
    }

    @Override
    public ByteBuffer body() {
        return body.duplicate();
    }

    @Override
    public boolean isBodyEmpty() {
        return !body.hasRemaining();
    }

    @Override
    public Response.Builder toBuilder() {
        return origin;
    }

    @Override
    public String toString() {
        return DefaultResponse.class.getSimpleName() + "{" +
                "statusCode=" + statusCode +
                ", reasonPhrase='" + reasonPhrase + '\'' +
                ", headers=" + headers +
                ", body=" + body.remaining() + " byte(s)" +
                '}';
    }

    /**
     * Default implementation of {@code Response.Builder}.
     *
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Response.Builder
    {
        private static class MutableState {
            Integer statusCode;
            String reasonPhrase;
            LinkedHashMap<String, List<String>> headers;
            ByteBuffer body;

            void removeHeader(String name) {
                if (headers == null) {
                    return;
                }
                headers.entrySet().removeIf(e ->
                    e.getKey().equalsIgnoreCase(name));
            }

            void addHeader(String name, String value) {
                getOrCreateHeaders().computeIfAbsent(
                        name, k -> new ArrayList<>(1)).add(value);
            }

            private Map<String, List<String>> getOrCreateHeaders() {
                var h = headers;
                return h == null ? (headers = new LinkedHashMap<>()) : h;
            }
        }

        static final Response.Builder ROOT = new DefaultBuilder();

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Response.Builder statusCode(int statusCode) {
            return new DefaultBuilder(this, s -> s.statusCode = statusCode);
        }

        @Override
        public Response.Builder reasonPhrase(String reasonPhrase) {
            requireNonNull(reasonPhrase, "reasonPhrase");
            return new DefaultBuilder(this, s -> s.reasonPhrase = reasonPhrase);
        }

        @Override
        public Response.Builder header(String name, String value) {
            final String key = requireNotEmpty(requireNoSurroundingWS(name)),
                         val = requireNoSurroundingWS(value);
            return new DefaultBuilder(this, s -> {
                s.removeHeader(key);
                s.addHeader(key, val);
            });
        }

        @Override
        public Response.Builder addHeader(String name, String value) {
            final String key = requireNotEmpty(requireNoSurroundingWS(name)),
                         val = requireNoSurroundingWS(value);
            return new DefaultBuilder(this, s -> s.addHeader(key, val));
        }

        @Override
        public Response.Builder addHeaders(String name, String value, String... morePairs) {
            final String key1 = requireNotEmpty(requireNoSurroundingWS(name)),
                         val1 = requireNoSurroundingWS(value);
            if (morePairs.length % 2 != 0) {
                throw new IllegalArgumentException("morePairs.length is not even");
            }
            final String[] copy = morePairs.clone();
            for (int i = 0; i < copy.length; ++i) {
                if (i % 2 == 0) {
                    // Key
                    requireNotEmpty(requireNoSurroundingWS(copy[i]));
                } else {
                    // Val
                    requireNoSurroundingWS(copy[i]);
                }
            }
            return new DefaultBuilder(this, s -> {
                s.addHeader(key1, val1);
                for (int i = 0; i < copy.length - 1; i += 2) {
                    s.addHeader(copy[i], copy[i + 1]);
                }
            });
        }

        @Override
        public Response.Builder removeHeader(String name) {
            final String key = requireNotEmpty(requireNoSurroundingWS(name));
            return new DefaultBuilder(this, s -> s.removeHeader(key));
        }

        @Override
        public Response.Builder body(ByteBuffer body) {
            final ByteBuffer b = readOnlyCopy(requireNonNull(body, "body"));
            return new DefaultBuilder(this, s -> s.body = b);
        }

        @Override
        public Response.Builder body(byte[] body) {
            requireNonNull(body, "body");
            final ByteBuffer b = ByteBuffer.wrap(body.clone()).asReadOnlyBuffer();
            return new DefaultBuilder(this, s -> s.body = b);
        }

        @Override
        public Response build() {
            MutableState s = constructState(MutableState::new);
            if (s.statusCode == null) {
                throw new IllegalStateException("Status code not set.");
            }
            setDefaults(s);

            final Headers headers;
            try {
                headers = s.headers == null ?
                        DefaultHeaders.empty() :
                        new DefaultHeaders(s.headers);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(e);
            }

            Response r = new DefaultResponse(
                    s.statusCode,
                    s.reasonPhrase,
                    headers,
                    s.body,
                    this);

            if ((r.isInformational()                     ||
                 r.statusCode() == TWO_HUNDRED_FOUR      ||
                 r.statusCode() == THREE_HUNDRED_FOUR) && !r.isBodyEmpty()) {
                throw new IllegalResponseBodyException(
                        "Presumably a body in a " + r.statusCode() + " (" + r.reasonPhrase() + ") response.", r);
            }

            return r;
        }

        private static String requireNotEmpty(String name) {
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Empty header name");
            }
            return name;
        }

        private static void setDefaults(MutableState s) {
            if (s.reasonPhrase == null) {
                s.reasonPhrase = ReasonPhrase.of(s.statusCode); }

            if (s.body == null) {
                s.body = EMPTY; }
        }

        private static ByteBuffer readOnlyCopy(ByteBuffer body) {
            if (body.isReadOnly()) {
                return body.slice();
            }
            var copy = ByteBuffer.allocate(body.remaining());
            copy.put(body.duplicate());
            return copy.flip().asReadOnlyBuffer();
        }
    }
}
