package alpha.nomagicresponder.message;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Headers of a response.<p>
 *
 * Iteration and {@link #asMap()} yield the header names in the order they
 * were first added, using the casing they were added with. All lookup methods
 * operate without regard to casing.<p>
 *
 * The implementation is immutable and thread-safe.
 *
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
public interface Headers extends Iterable<Map.Entry<String, List<String>>>
{
    /**
     * If a header is present, returns {@code true}, otherwise {@code false}.
     *
     * @param name the header name
     * @return see JavaDoc
     * @throws NullPointerException if {@code name} is {@code null}
     */
    boolean contains(String name);

    /**
     * Returns the first value of the given header, if present.
     *
     * @param name the header name
     * @return the first value (possibly empty)
     * @throws NullPointerException if {@code name} is {@code null}
     */
    Optional<String> firstValue(String name);

    /**
     * Returns all values of the given header.
     *
     * @param name the header name
     * @return all values (unmodifiable, possibly empty)
     * @throws NullPointerException if {@code name} is {@code null}
     */
    List<String> allValues(String name);

    /**
     * Returns {@code true} if there are no headers.
     *
     * @return see JavaDoc
     */
    boolean isEmpty();

    /**
     * Returns an unmodifiable, ordered map view of all headers.
     *
     * @return an unmodifiable, ordered map view of all headers
     */
    Map<String, List<String>> asMap();
}
