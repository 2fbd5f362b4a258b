package alpha.nomagicresponder;

import alpha.nomagicresponder.responder.FailureConverter;
import alpha.nomagicresponder.responder.ResponderAdapters;
import alpha.nomagicresponder.util.AbstractImmutableBuilder;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultConfig implements Config {
    private final Builder           builder;
    private final boolean           rejectInvalidHeaderOverride;
    private final FailureConverter  failureConverter;
    private final ResponderAdapters adapters;

    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder                     = b;
        rejectInvalidHeaderOverride = s.rejectInvalidHeaderOverride;
        failureConverter            = s.failureConverter;
        adapters                    = s.adapters;
    }

    @Override
    public boolean rejectInvalidHeaderOverride() {
        return rejectInvalidHeaderOverride;
    }

    @Override
    public FailureConverter failureConverter() {
        return failureConverter;
    }

    @Override
    public ResponderAdapters adapters() {
        return adapters;
    }

    @Override
    public Builder toBuilder() {
        return builder;
    }

    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "rejectInvalidHeaderOverride=" + rejectInvalidHeaderOverride +
                ", failureConverter=" + failureConverter +
                ", adapters=" + adapters +
                '}';
    }

    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();

        static class MutableState {
            boolean           rejectInvalidHeaderOverride = false;
            FailureConverter  failureConverter            = FailureConverter.BASE;
            ResponderAdapters adapters                    = ResponderAdapters.BASE;
        }

        private DefaultBuilder() {
            // super()
        }

        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }

        @Override
        public Builder rejectInvalidHeaderOverride(boolean newVal) {
            return new DefaultBuilder(this, s -> s.rejectInvalidHeaderOverride = newVal);
        }

        @Override
        public Builder failureConverter(FailureConverter newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.failureConverter = newVal);
        }

        @Override
        public Builder adapters(ResponderAdapters newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.adapters = newVal);
        }

        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
