package com.pipeline.dag.api;

/** Edge {@code from -> to}: {@code to} needs {@code from} to finish first. */
public record DependencyEdge(String from, String to) {

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
