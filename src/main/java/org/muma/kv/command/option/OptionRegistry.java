package org.muma.kv.command.option;

import org.muma.kv.exception.OptionConflictException;
import org.muma.kv.exception.UnknownOptionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Named boolean flags of one command plus their mutual-exclusion rules.
 * <p>
 * Names are case-insensitive. Incompatibility is symmetric: activating {@code A} fails when
 * {@code A} declares an active option incompatible, or when an active option declares {@code A}.
 * Not thread-safe; every command parse owns its own instance.
 */
public class OptionRegistry {

    private final Map<String, Set<String>> incompatibilities = new LinkedHashMap<>();
    private final Set<String> active = new LinkedHashSet<>();

    public OptionRegistry register(String name, String... incompatibleNames) {
        Set<String> names = new LinkedHashSet<>();
        for (String n : incompatibleNames) {
            names.add(normalize(n));
        }
        incompatibilities.put(normalize(name), names);
        return this;
    }

    /**
     * @throws UnknownOptionException  name was never registered
     * @throws OptionConflictException name clashes with an already active option
     */
    public void activate(String name) {
        String option = normalize(name);
        Set<String> declared = incompatibilities.get(option);
        if (declared == null) {
            throw new UnknownOptionException(option);
        }
        if (active.contains(option)) {
            return;
        }
        for (String other : active) {
            if (declared.contains(other) || incompatibilities.get(other).contains(option)) {
                throw new OptionConflictException(option, other);
            }
        }
        active.add(option);
    }

    public boolean isSet(String name) {
        return active.contains(normalize(name));
    }

    public boolean isRegistered(String name) {
        return incompatibilities.containsKey(normalize(name));
    }

    public Set<String> activeOptions() {
        return Collections.unmodifiableSet(active);
    }

    public void reset() {
        active.clear();
    }

    private static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
