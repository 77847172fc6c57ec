package com.algo.wgraph.util;

import com.algo.wgraph.api.GraphListener;
import java.util.Arrays;

/**
 * Aggregates multiple {@link GraphListener} instances, notifying them in
 * registration order.
 */
public class CompositeGraphListener implements GraphListener {
    private GraphListener[] listeners = new GraphListener[0];

    public void addForComposite(GraphListener listener) {
        GraphListener[] old = listeners;
        GraphListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onVertexAdded(String vertex) {
        for (GraphListener l : listeners)
            l.onVertexAdded(vertex);
    }

    @Override
    public void onEdgeAdded(String source, String target, double weight, boolean directed) {
        for (GraphListener l : listeners)
            l.onEdgeAdded(source, target, weight, directed);
    }

    @Override
    public void onDirectednessChanged(boolean directed, int edgeEntries) {
        for (GraphListener l : listeners)
            l.onDirectednessChanged(directed, edgeEntries);
    }
}
