package alpha.nomagicresponder.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Collections.reverse;
import static java.util.Objects.requireNonNull;

/**
 * Baseclass for immutable builders.<p>
 *
 * Each builder instance links to the builder it was derived from and stores
 * one modifying action. Deriving a new builder is therefore cheap and never
 * affects the builder derived from. All actions in the chain are replayed, in
 * the order they were added, against a fresh mutable state container when
 * {@link #constructState(Supplier)} is called.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S> {
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;

    /**
     * Constructs a root builder (no modifier).
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }

    /**
     * Constructs a builder derived from {@code prev}.
     *
     * @param prev builder derived from
     * @param modifier action to apply on the mutable state
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev, "prev");
        this.modifier = requireNonNull(modifier, "modifier");
    }

    /**
     * Creates a state container and replays all modifiers against it.<p>
     *
     * A concrete builder's {@code build} method calls this method and hands
     * the returned state to the constructor of the built object. Each call
     * returns a new state container.
     *
     * @param factory of state
     * @return the populated state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        List<Consumer<? super S>> mods = new ArrayList<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            mods.add(b.modifier);
        }
        reverse(mods);
        S s = factory.get();
        mods.forEach(m -> m.accept(s));
        return s;
    }
}
