/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.flowsmith.workflow.validation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the strongly connected components of a node graph that contain more than one
 * node (Tarjan). Self-loops are not part of the adjacency and never form a component
 * on their own. Members of each component are returned in the order of {@code nodes}.
 */
final class CycleFinder {

    private final List<String> nodes;
    private final Map<String, List<String>> adjacency;

    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> lowLink = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new HashSet<>();
    private final List<List<String>> components = new ArrayList<>();
    private int counter;

    CycleFinder(Collection<String> nodes, Map<String, List<String>> adjacency) {
        this.nodes = new ArrayList<>(nodes);
        this.adjacency = adjacency;
    }

    List<List<String>> findCycles() {
        for (String node : nodes) {
            if (!index.containsKey(node)) {
                connect(node);
            }
        }

        List<List<String>> ordered = new ArrayList<>();
        for (List<String> component : components) {
            Set<String> members = new HashSet<>(component);
            List<String> sorted = new ArrayList<>();
            for (String node : nodes) {
                if (members.contains(node)) {
                    sorted.add(node);
                }
            }
            ordered.add(sorted);
        }
        ordered.sort((a, b) -> Integer.compare(nodes.indexOf(a.get(0)), nodes.indexOf(b.get(0))));
        return ordered;
    }

    private void connect(String node) {
        index.put(node, counter);
        lowLink.put(node, counter);
        counter++;
        stack.push(node);
        onStack.add(node);

        for (String next : adjacency.getOrDefault(node, List.of())) {
            if (!index.containsKey(next)) {
                connect(next);
                lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
            } else if (onStack.contains(next)) {
                lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
            }
        }

        if (lowLink.get(node).equals(index.get(node))) {
            List<String> component = new ArrayList<>();
            String member;
            do {
                member = stack.pop();
                onStack.remove(member);
                component.add(member);
            } while (!member.equals(node));
            if (component.size() > 1) {
                components.add(component);
            }
        }
    }
}
