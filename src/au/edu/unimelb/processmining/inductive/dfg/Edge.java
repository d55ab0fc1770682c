package au.edu.unimelb.processmining.inductive.dfg;

import java.util.Objects;

/**
 * A directly-follows pair: {@code source} is immediately followed by {@code target}.
 */
public final class Edge implements Comparable<Edge> {

    public final String source;
    public final String target;

    public Edge(String source, String target) {
        this.source = Objects.requireNonNull(source);
        this.target = Objects.requireNonNull(target);
    }

    @Override
    public int compareTo(Edge o) {
        int c = source.compareTo(o.source);
        return c != 0 ? c : target.compareTo(o.target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge edge = (Edge) o;
        return source.equals(edge.source) && target.equals(edge.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return source + "->" + target;
    }
}
