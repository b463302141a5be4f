package org.sensiblaw.semantic.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Iterative Tarjan strongly-connected-components pass. Reports every component that is
 * a real cycle: two or more nodes, or one node with an edge to itself.
 */
final class CycleDetector {

    private CycleDetector() {}

    static List<List<String>> cycles(Collection<String> nodes, Collection<GraphEdge> edges) {
        Map<String, TreeSet<String>> adjacency = new TreeMap<>();
        for (String node : nodes) adjacency.put(node, new TreeSet<>());
        for (GraphEdge edge : edges) {
            adjacency.computeIfAbsent(edge.from(), k -> new TreeSet<>()).add(edge.to());
            adjacency.computeIfAbsent(edge.to(), k -> new TreeSet<>());
        }

        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<List<String>> components = new ArrayList<>();
        int counter = 0;

        for (String root : adjacency.keySet()) {
            if (index.containsKey(root)) continue;
            Deque<Frame> work = new ArrayDeque<>();
            work.push(new Frame(root, new ArrayList<>(adjacency.get(root))));
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.next < frame.successors.size()) {
                    String w = frame.successors.get(frame.next++);
                    if (!index.containsKey(w)) {
                        index.put(w, counter);
                        lowLink.put(w, counter);
                        counter++;
                        stack.push(w);
                        onStack.add(w);
                        work.push(new Frame(w, new ArrayList<>(adjacency.get(w))));
                    } else if (onStack.contains(w)) {
                        lowLink.put(frame.node, Math.min(lowLink.get(frame.node), index.get(w)));
                    }
                    continue;
                }
                work.pop();
                if (!work.isEmpty()) {
                    String parent = work.peek().node;
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(frame.node)));
                }
                if (lowLink.get(frame.node).equals(index.get(frame.node))) {
                    List<String> component = new ArrayList<>();
                    String w;
                    do {
                        w = stack.pop();
                        onStack.remove(w);
                        component.add(w);
                    } while (!w.equals(frame.node));
                    boolean selfLoop = component.size() == 1
                            && adjacency.get(frame.node).contains(frame.node);
                    if (component.size() > 1 || selfLoop) {
                        component.sort(Comparator.naturalOrder());
                        components.add(component);
                    }
                }
            }
        }
        components.sort(Comparator.comparing(c -> c.get(0)));
        return components;
    }

    private static final class Frame {
        final String node;
        final List<String> successors;
        int next;

        Frame(String node, List<String> successors) {
            this.node = node;
            this.successors = successors;
        }
    }
}
