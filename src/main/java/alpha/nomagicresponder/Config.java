package alpha.nomagicresponder;

import alpha.nomagicresponder.message.Request;
import alpha.nomagicresponder.responder.CustomResponder;
import alpha.nomagicresponder.responder.FailureConverter;
import alpha.nomagicresponder.responder.HttpException;
import alpha.nomagicresponder.responder.ResponderAdapters;
import alpha.nomagicresponder.responder.ResponseResolver;

/**
 * Response-conversion configuration.<p>
 *
 * The implementation is immutable and thread-safe.<p>
 *
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 *
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.<p>
 *
 * The configuration reaches the responders through {@link Request#config()}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Config
{
    /**
     * Values used:<p>
     *
     * Reject invalid header override = false <br>
     * Failure converter = {@link FailureConverter#BASE} <br>
     * Adapters = {@link ResponderAdapters#BASE}
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();

    /**
     * Returns whether an invalid header override fails the response.<p>
     *
     * {@link CustomResponder#withHeader(String, String)} does not throw when
     * given an invalid header name or value. Instead, the error is recorded
     * and the header is not added. If this method returns {@code false}, the
     * recorded error is logged on level {@code WARNING} when the responder
     * resolves, and the response is produced without the header. If this
     * method returns {@code true}, the responder resolves to a failure; the
     * recorded {@code IllegalArgumentException}.<p>
     *
     * The default implementation returns {@code false}.
     *
     * @return whether an invalid header override fails the response
     */
    boolean rejectInvalidHeaderOverride();

    /**
     * Returns the converter of failures into {@link HttpException}.<p>
     *
     * The default is {@link FailureConverter#BASE}.
     *
     * @return the failure converter (never {@code null})
     */
    FailureConverter failureConverter();

    /**
     * Returns the adapters used by {@link ResponseResolver} to turn a handler's
     * return value into a responder.<p>
     *
     * The default is {@link ResponderAdapters#BASE}.
     *
     * @return the adapters (never {@code null})
     */
    ResponderAdapters adapters();

    /**
     * Returns the builder instance that built this configuration.<p>
     *
     * The builder may be used for further customization.
     *
     * @return the builder instance that built this configuration
     */
    Config.Builder toBuilder();

    /**
     * Returns the builder used to build the default configuration.
     *
     * @return the builder used to build the default configuration
     * @see #toBuilder()
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }

    /**
     * Builder of a {@link Config}.<p>
     *
     * The builder is immutable. All builder-returning methods return a new
     * instance representing the new state.<p>
     *
     * The builder can be used as a template to modify configuration state.
     * The initial builder is retrieved using {@link #configuration()}, or
     * {@link Config#toBuilder()} of an already built configuration.
     *
     * @author Martin Andersson (webmaster at martinandersson.com)
     */
    interface Builder {
        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#rejectInvalidHeaderOverride()
         */
        Builder rejectInvalidHeaderOverride(boolean newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#failureConverter()
         */
        Builder failureConverter(FailureConverter newVal);

        /**
         * Set a new value.
         *
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#adapters()
         */
        Builder adapters(ResponderAdapters newVal);

        /**
         * Builds the configuration.
         *
         * @return a configuration
         */
        Config build();
    }
}
