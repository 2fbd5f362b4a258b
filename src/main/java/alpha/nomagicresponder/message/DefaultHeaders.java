package alpha.nomagicresponder.message;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Headers}.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
final class DefaultHeaders implements Headers
{
    private static final DefaultHeaders EMPTY = new DefaultHeaders(new LinkedHashMap<>());

    /**
     * Returns an empty instance.
     *
     * @return an empty instance
     */
    static DefaultHeaders empty() {
        return EMPTY;
    }

    private final Map<String, List<String>> view;
    // Key is lower-cased name
    private final Map<String, List<String>> lookup;

    /**
     * Constructs this object.<p>
     *
     * The given map is copied.
     *
     * @param headers the headers
     * @throws IllegalArgumentException
     *             if a header name is repeated using different casing
     */
    DefaultHeaders(Map<String, List<String>> headers) {
        var copy = new LinkedHashMap<String, List<String>>();
        var lookup = new LinkedHashMap<String, List<String>>();
        headers.forEach((k, v) -> {
            var vals = List.copyOf(v);
            copy.put(k, vals);
            if (lookup.put(lowerCase(k), vals) != null) {
                throw new IllegalArgumentException(
                        "Header name repeated with different casing: " + k);
            }
        });
        this.view = unmodifiableMap(copy);
        this.lookup = lookup;
    }

    @Override
    public boolean contains(String name) {
        return lookup.containsKey(lowerCase(name));
    }

    @Override
    public Optional<String> firstValue(String name) {
        var vals = allValues(name);
        return vals.isEmpty() ? Optional.empty() : Optional.of(vals.get(0));
    }

    @Override
    public List<String> allValues(String name) {
        var vals = lookup.get(lowerCase(name));
        return vals == null ? Collections.emptyList() : vals;
    }

    @Override
    public boolean isEmpty() {
        return view.isEmpty();
    }

    @Override
    public Map<String, List<String>> asMap() {
        return view;
    }

    @Override
    public Iterator<Map.Entry<String, List<String>>> iterator() {
        return view.entrySet().iterator();
    }

    @Override
    public String toString() {
        return view.toString();
    }

    private static String lowerCase(String name) {
        return requireNonNull(name, "name").toLowerCase(Locale.ROOT);
    }
}
