package com.lumen.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Vector literal / value: {@code [1 2 3]}. Lists are plain {@link java.util.List}s. */
public final class Vec {
    public final List<Object> items;

    public Vec(List<Object> items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Vec) && items.equals(((Vec) o).items);
    }

    @Override
    public int hashCode() { return items.hashCode(); }

    @Override
    public String toString() { return Printer.print(this); }
}
