package alpha.nomagicresponder.responder;

import alpha.nomagicresponder.HttpConstants.ReasonPhrase;
import alpha.nomagicresponder.message.Response;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionStage;

import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Applies status and header overrides to the response of a source stage.<p>
 *
 * Failures of the source pass through unchanged.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class OverrideFuture extends RelayFuture
{
    private static final System.Logger LOG
            = System.getLogger(OverrideFuture.class.getPackageName());

    /**
     * Returns a future of the source's response, overridden.
     *
     * @param source stage of response
     * @param status status code override, or {@code null}
     * @param headers header overrides, in order of addition
     * @param invalidHeader recorded header error, or {@code null}
     * @param reject {@code true} if {@code invalidHeader} fails the response
     * @return a future of the source's response
     */
    static OverrideFuture start(
            CompletionStage<Response> source,
            Integer status,
            List<Map.Entry<String, String>> headers,
            IllegalArgumentException invalidHeader,
            boolean reject) {
        var f = new OverrideFuture(source, status, headers, invalidHeader, reject);
        f.start();
        return f;
    }

    private final Integer status;
    private final List<Map.Entry<String, String>> headers;
    private final IllegalArgumentException invalidHeader;
    private final boolean reject;

    private OverrideFuture(
            CompletionStage<Response> source,
            Integer status,
            List<Map.Entry<String, String>> headers,
            IllegalArgumentException invalidHeader,
            boolean reject) {
        super(source);
        this.status = status;
        this.headers = requireNonNull(headers);
        this.invalidHeader = invalidHeader;
        this.reject = reject;
    }

    @Override
    Response onSuccess(Response rsp) {
        if (invalidHeader != null) {
            if (reject) {
                throw invalidHeader;
            }
            LOG.log(WARNING, "Discarding invalid header override.", invalidHeader);
        }
        if (status == null && headers.isEmpty()) {
            return rsp;
        }
        var b = rsp.toBuilder();
        if (status != null) {
            b = b.statusCode(status).reasonPhrase(ReasonPhrase.of(status));
        }
        for (var group : groupByName().values()) {
            final String name = group.get(0).getKey();
            b = b.removeHeader(name);
            for (var h : group) {
                b = b.addHeader(name, h.getValue());
            }
        }
        return b.build();
    }

    @Override
    Throwable onFailure(Throwable failure) {
        return failure;
    }

    // Case-insensitive; first-seen casing and order of names, addition order of values
    private Map<String, List<Map.Entry<String, String>>> groupByName() {
        var m = new LinkedHashMap<String, List<Map.Entry<String, String>>>();
        for (var h : headers) {
            m.computeIfAbsent(h.getKey().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
             .add(h);
        }
        return m;
    }
}
