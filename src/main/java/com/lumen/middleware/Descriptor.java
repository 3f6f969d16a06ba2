package com.lumen.middleware;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * What a middleware declares about itself, used only when composing a pipeline.
 *
 * <ul>
 *   <li>{@code name}: capability naming the middleware itself</li>
 *   <li>{@code handles}: ops it serves (each op name is also a capability)</li>
 *   <li>{@code requires}: capabilities whose provider must come strictly before it</li>
 *   <li>{@code expects}: capabilities that must be present anywhere in the pipeline</li>
 * </ul>
 */
public final class Descriptor {

    private final String name;
    private final Set<String> requires;
    private final Set<String> expects;
    private final Map<String, OpDoc> handles;

    private Descriptor(String name, Set<String> requires, Set<String> expects, Map<String, OpDoc> handles) {
        this.name = name;
        this.requires = Collections.unmodifiableSet(new LinkedHashSet<>(requires));
        this.expects = Collections.unmodifiableSet(new LinkedHashSet<>(expects));
        this.handles = Collections.unmodifiableMap(new LinkedHashMap<>(handles));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() { return name; }
    public Set<String> requires() { return requires; }
    public Set<String> expects() { return expects; }
    public Map<String, OpDoc> handles() { return handles; }

    /** Name plus handled ops. */
    public Set<String> provides() {
        Set<String> out = new LinkedHashSet<>();
        out.add(name);
        out.addAll(handles.keySet());
        return out;
    }

    @Override
    public String toString() {
        return "Descriptor[" + name + " handles=" + handles.keySet() + " requires=" + requires + " expects=" + expects + "]";
    }

    public static final class Builder {
        private final String name;
        private final Set<String> requires = new LinkedHashSet<>();
        private final Set<String> expects = new LinkedHashSet<>();
        private final Map<String, OpDoc> handles = new LinkedHashMap<>();

        private Builder(String name) {
            if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("descriptor name required");
            this.name = name;
        }

        public Builder requires(String... capabilities) {
            requires.addAll(Arrays.asList(capabilities));
            return this;
        }

        public Builder expects(String... capabilities) {
            expects.addAll(Arrays.asList(capabilities));
            return this;
        }

        public Builder handles(String op, OpDoc doc) {
            handles.put(op, doc == null ? OpDoc.of("") : doc);
            return this;
        }

        public Descriptor build() {
            return new Descriptor(name, requires, expects, handles);
        }
    }
}
