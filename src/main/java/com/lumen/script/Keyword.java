package com.lumen.script;

public final class Keyword {
    public final String name;

    public Keyword(String name) { this.name = name; }

    @Override
    public boolean equals(Object o) {
        return (o instanceof Keyword) && name.equals(((Keyword) o).name);
    }

    @Override
    public int hashCode() { return name.hashCode() * 31 + 7; }

    @Override
    public String toString() { return ":" + name; }
}
