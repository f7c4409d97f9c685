package org.muma.kv.command.option;

import java.util.Set;

/**
 * Common shape of the per-command option objects: each one seeds a private {@link OptionRegistry}
 * with its legal flags at construction.
 */
public abstract class CommandOptions {

    protected final OptionRegistry registry = new OptionRegistry();

    public void activate(String name) {
        registry.activate(name);
    }

    public boolean isSet(String name) {
        return registry.isSet(name);
    }

    public boolean accepts(String name) {
        return registry.isRegistered(name);
    }

    public Set<String> activeOptions() {
        return registry.activeOptions();
    }

    public void reset() {
        registry.reset();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + activeOptions();
    }
}
