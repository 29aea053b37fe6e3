package com.blastradius.engine.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds dependency cycles (mutual recursion, circular module dependencies).
 *
 * A cycle is reported as the member ids of one strongly connected component
 * with more than one node, or a single node with a self-loop. Uses an
 * iterative Tarjan walk so deep call chains do not exhaust the thread stack.
 */
public final class CycleDetector {

    private CycleDetector() {}

    /**
     * @return one sorted id list per cycle, ordered by the first id
     */
    public static List<List<String>> findCycles(DependencyGraph graph) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<List<String>> cycles = new ArrayList<>();
        int counter = 0;

        for (String root : graph.nodeIds()) {
            if (index.containsKey(root)) continue;

            // Each frame: node id and the position of the next outgoing edge to inspect
            Deque<int[]> positions = new ArrayDeque<>();
            Deque<String> frames = new ArrayDeque<>();
            frames.push(root);
            positions.push(new int[]{0});
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);

            while (!frames.isEmpty()) {
                String current = frames.peek();
                int[] position = positions.peek();
                List<Edge> out = graph.outgoing(current);

                if (position[0] < out.size()) {
                    String next = out.get(position[0]++).targetId();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        frames.push(next);
                        positions.push(new int[]{0});
                    } else if (onStack.contains(next)) {
                        lowLink.put(current, Math.min(lowLink.get(current), index.get(next)));
                    }
                    continue;
                }

                frames.pop();
                positions.pop();
                if (!frames.isEmpty()) {
                    String parent = frames.peek();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(current)));
                }
                if (lowLink.get(current).equals(index.get(current))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(current));

                    if (component.size() > 1 || hasSelfLoop(graph, current)) {
                        Collections.sort(component);
                        cycles.add(component);
                    }
                }
            }
        }

        cycles.sort((a, b) -> a.get(0).compareTo(b.get(0)));
        return cycles;
    }

    private static boolean hasSelfLoop(DependencyGraph graph, String id) {
        for (Edge e : graph.outgoing(id)) {
            if (e.isSelfLoop()) return true;
        }
        return false;
    }
}
