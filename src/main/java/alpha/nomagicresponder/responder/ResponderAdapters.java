package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.Config;
import alpha.nomagicresponder.message.Response;
import alpha.nomagicresponder.util.ByteSink;
import alpha.nomagicresponder.util.Result;

import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Adapts values returned by request handlers into responders.<p>
 *
 * The {@link #BASE} adapters know the following values:
 * <ul>
 *   <li>{@link Responder}: used as-is,</li>
 *   <li>{@code null}: {@link Responders#empty()},</li>
 *   <li>{@code String} and {@code CharSequence}: {@code Responders.text},</li>
 *   <li>{@code byte[]}, {@link ByteBuffer} and {@link ByteSink}:
 *       {@code Responders.bytes},</li>
 *   <li>{@link Response} and {@link Response.Builder}:
 *       {@code Responders.of},</li>
 *   <li>{@link Optional}: {@link Responders#optional(Optional)}, the contained
 *       value adapted,</li>
 *   <li>{@link Result}: {@link Responders#result(Result)}, the ok value
 *       adapted.</li>
 * </ul>
 *
 * More adapters can be registered using {@link #with(Class, Function)}, which
 * returns a new table. An adapter registered last takes precedence over all
 * others, including the base adapters. The table used is {@link
 * Config#adapters()}.<p>
 *
 * This class is immutable and thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public final class ResponderAdapters
{
    /**
     * A table with only the base adapters.
     */
    public static final ResponderAdapters BASE = new ResponderAdapters(null, null, null);

    private final ResponderAdapters prev;
    private final Class<?> type;
    private final Function<Object, ? extends Responder<?>> adapter;

    private ResponderAdapters(
            ResponderAdapters prev,
            Class<?> type,
            Function<Object, ? extends Responder<?>> adapter) {
        this.prev = prev;
        this.type = type;
        this.adapter = adapter;
    }

    /**
     * Returns a new table with the given adapter registered.
     *
     * @param type of value
     * @param adapter of value
     * @param <T> type of value
     * @return a new table
     * @throws NullPointerException if any argument is {@code null}
     */
    public <T> ResponderAdapters with(
            Class<T> type, Function<? super T, ? extends Responder<?>> adapter) {
        requireNonNull(type, "type");
        requireNonNull(adapter, "adapter");
        return new ResponderAdapters(this, type, v -> adapter.apply(type.cast(v)));
    }

    /**
     * Adapts the given value into a responder.
     *
     * @param value to adapt (may be {@code null})
     * @return a responder (never {@code null})
     * @throws IllegalArgumentException
     *             if no adapter knows the type of the value, or an adapter
     *             returned {@code null}
     */
    public Responder<?> adapt(Object value) {
        for (var t = this; t.prev != null; t = t.prev) {
            if (t.type.isInstance(value)) {
                Responder<?> r = t.adapter.apply(value);
                if (r == null) {
                    throw new IllegalArgumentException(
                            "Adapter of " + t.type.getName() + " returned null.");
                }
                return r;
            }
        }
        return base(value);
    }

    private Responder<?> base(Object value) {
        if (value == null) {
            return Responders.empty();
        } else if (value instanceof Responder) {
            return (Responder<?>) value;
        } else if (value instanceof String) {
            return Responders.text((String) value);
        } else if (value instanceof CharSequence) {
            return Responders.text((CharSequence) value);
        } else if (value instanceof byte[]) {
            return Responders.bytes((byte[]) value);
        } else if (value instanceof ByteBuffer) {
            return Responders.bytes((ByteBuffer) value);
        } else if (value instanceof ByteSink) {
            return Responders.bytes((ByteSink) value);
        } else if (value instanceof Response) {
            return Responders.of((Response) value);
        } else if (value instanceof Response.Builder) {
            return Responders.of((Response.Builder) value);
        } else if (value instanceof Optional) {
            return Responders.optional(((Optional<?>) value).map(this::adaptForOptional));
        } else if (value instanceof Result) {
            Result<?, ? extends Throwable> r = (Result<?, ?>) value;
            return Responders.result(r.<Result<Responder<?>, Throwable>>fold(
                    ok  -> Result.ok(adapt(ok)),
                    Result::err));
        }
        throw new IllegalArgumentException(
                "No responder adapter for type: " + value.getClass().getName());
    }

    // Failure type is lost in the adaptation
    @SuppressWarnings("unchecked")
    private Responder<Throwable> adaptForOptional(Object value) {
        return (Responder<Throwable>) adapt(value);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder(ResponderAdapters.class.getSimpleName()).append("{base");
        for (var t = this; t.prev != null; t = t.prev) {
            sb.append(", ").append(t.type.getName());
        }
        return sb.append('}').toString();
    }
}
