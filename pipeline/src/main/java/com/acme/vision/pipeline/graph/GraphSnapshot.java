package com.acme.vision.pipeline.graph;

import com.acme.vision.pipeline.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time topology downstream of one source, for logging and tests.
 * Node ids are assigned in breadth-first visit order starting at 0 for the root.
 */
public record GraphSnapshot(List<Node> nodes, List<Edge> edges) {

    public record Node(int id, String type, int maximumInputs, int boundInputs) {}

    public record Edge(int from, int to, int slot) {}

    public GraphSnapshot {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    static GraphSnapshot capture(ImageSource root) {
        Map<Object, Integer> ids = new IdentityHashMap<>();
        List<Node> nodes = new ArrayList<>();
        List<Edge> edges = new ArrayList<>();
        Deque<Object> pending = new ArrayDeque<>();
        register(root, ids, nodes, pending);
        while (!pending.isEmpty()) {
            Object node = pending.removeFirst();
            if (!(node instanceof ImageSource source)) {
                continue;
            }
            int from = ids.get(node);
            for (TargetList.Target target : source.targets().snapshot()) {
                int to = register(target.consumer(), ids, nodes, pending);
                edges.add(new Edge(from, to, target.slot()));
            }
        }
        return new GraphSnapshot(nodes, edges);
    }

    private static int register(Object node, Map<Object, Integer> ids, List<Node> nodes, Deque<Object> pending) {
        Integer existing = ids.get(node);
        if (existing != null) {
            return existing;
        }
        int id = nodes.size();
        ids.put(node, id);
        int maximumInputs = 0;
        int boundInputs = 0;
        if (node instanceof ImageConsumer consumer) {
            maximumInputs = consumer.maximumInputs();
            boundInputs = consumer.sources().size();
        }
        nodes.add(new Node(id, node.getClass().getSimpleName(), maximumInputs, boundInputs));
        pending.addLast(node);
        return id;
    }

    public String toJson() {
        try {
            return JsonCodec.writeString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Graph snapshot is not serializable", e);
        }
    }
}
