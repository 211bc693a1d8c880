package io.surfworks.templar.inline;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Logger;

import io.surfworks.templar.function.FunctionTemplate;

/**
 * Function templates by name and version.
 *
 * <p>A name may have several versions. Lookups with an opset version return the
 * newest template whose {@code sinceVersion} is not above it.
 */
public final class FunctionLibrary {

    private static final Logger LOG = Logger.getLogger(FunctionLibrary.class.getName());

    private final Map<String, NavigableMap<Integer, FunctionTemplate>> templates = new ConcurrentHashMap<>();

    /**
     * Registers a template.
     *
     * @param template the template to add
     * @return this library for chaining
     * @throws IllegalStateException if a template with the same name and version is already registered
     */
    public FunctionLibrary register(FunctionTemplate template) {
        Objects.requireNonNull(template, "template");
        NavigableMap<Integer, FunctionTemplate> versions =
                templates.computeIfAbsent(template.name(), k -> new ConcurrentSkipListMap<>());
        FunctionTemplate previous = versions.putIfAbsent(template.sinceVersion(), template);
        if (previous != null) {
            throw new IllegalStateException(String.format(
                    "Function %s v%d is already registered", template.name(), template.sinceVersion()));
        }
        LOG.fine(() -> "Registered " + template);
        return this;
    }

    /**
     * Returns the newest version of the named function.
     */
    public Optional<FunctionTemplate> find(String name) {
        NavigableMap<Integer, FunctionTemplate> versions = templates.get(name);
        if (versions == null || versions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(versions.lastEntry().getValue());
    }

    /**
     * Returns the newest version of the named function available at {@code opsetVersion}.
     */
    public Optional<FunctionTemplate> find(String name, int opsetVersion) {
        NavigableMap<Integer, FunctionTemplate> versions = templates.get(name);
        if (versions == null) {
            return Optional.empty();
        }
        Map.Entry<Integer, FunctionTemplate> entry = versions.floorEntry(opsetVersion);
        return entry == null ? Optional.empty() : Optional.of(entry.getValue());
    }

    public boolean contains(String name) {
        return templates.containsKey(name);
    }

    /**
     * Returns the registered function names, sorted.
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(templates.keySet()));
    }

    @Override
    public String toString() {
        return String.format("FunctionLibrary[functions=%d]", templates.size());
    }
}
