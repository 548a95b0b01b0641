/*
 * Copyright 2025 AxonOps
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

package com.axonops.zhfilter.algo;

import com.axonops.zhfilter.api.MatchResult;
import com.axonops.zhfilter.util.PatternHasher;
import com.axonops.zhfilter.util.PositionMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

/**
 * Aho-Corasick automaton over the UTF-8 bytes of the patterns.
 *
 * <p>Nodes live in an arena ({@code nodes}); a node is referred to by its index, the root is
 * index 0. Each node has a dense 256-entry child table holding child indices or {@link #ABSENT}.
 *
 * <p>After all patterns are inserted, failure links are computed breadth-first. When a child's
 * failure link is set, the output list of the failure target is appended to the child's own
 * list, so every node reports all patterns that end at any suffix of its path. Matching is then
 * a single left-to-right byte scan.
 *
 * <p>Thread-safe after construction: the arena and the failure table are never modified again.
 *
 * @since 1.0.0
 */
public final class AhoCorasickMatcher implements ExactMatcher {
    private static final Logger logger = LoggerFactory.getLogger(AhoCorasickMatcher.class);

    static final int ROOT = 0;
    static final int ABSENT = -1;
    private static final int ALPHABET = 256;

    private final List<String> patterns;
    private final List<Node> nodes = new ArrayList<>();
    private final Map<String, Integer> byteLengths = new HashMap<>();
    private final int[] fail;

    public AhoCorasickMatcher(List<String> patterns) {
        this.patterns = PatternValidator.validate(patterns);

        long startNanos = System.nanoTime();
        nodes.add(new Node());
        for (String pattern : this.patterns) {
            insert(pattern);
        }
        this.fail = calculateFail();

        logger.debug("ZhFilter: Aho-Corasick built - patterns: {}, nodes: {}, timeNs: {}",
            PatternHasher.hashAll(this.patterns), nodes.size(), System.nanoTime() - startNanos);
    }

    private void insert(String pattern) {
        byte[] encoded = PositionMapper.encode(pattern);
        byteLengths.put(pattern, encoded.length);

        int cur = ROOT;
        for (byte b : encoded) {
            int symbol = b & 0xff;
            Node node = nodes.get(cur);
            if (node.children[symbol] == ABSENT) {
                nodes.add(new Node());
                node.children[symbol] = nodes.size() - 1;
            }
            cur = node.children[symbol];
        }
        nodes.get(cur).outputs.add(pattern);
        logger.trace("ZhFilter: Inserted pattern {} ending at node {}", PatternHasher.hash(pattern), cur);
    }

    private int[] calculateFail() {
        int[] links = new int[nodes.size()];
        Arrays.fill(links, ABSENT);

        Queue<Integer> queue = new ArrayDeque<>();
        queue.add(ROOT);
        while (!queue.isEmpty()) {
            int parent = queue.poll();
            int[] children = nodes.get(parent).children;

            for (int symbol = 0; symbol < ALPHABET; symbol++) {
                int child = children[symbol];
                if (child == ABSENT) {
                    continue;
                }

                // Walk up the parent's failure chain to the first node with a child on this byte.
                // The root's own link is still unset during the walk, which ends the chain there.
                int ancestor = links[parent];
                while (ancestor != ABSENT && nodes.get(ancestor).children[symbol] == ABSENT) {
                    ancestor = links[ancestor];
                }

                if (ancestor == ABSENT) {
                    links[child] = ROOT;
                } else {
                    int target = nodes.get(ancestor).children[symbol];
                    links[child] = target;
                    nodes.get(child).outputs.addAll(nodes.get(target).outputs);
                }
                queue.add(child);
            }
        }

        links[ROOT] = ROOT;
        return links;
    }

    @Override
    public MatchResult match(String text) {
        PatternValidator.requireText(text);
        if (text.isEmpty()) {
            return MatchResult.empty();
        }

        MatchResult.Builder matches = MatchResult.builder();
        byte[] textBytes = PositionMapper.encode(text);

        int cur = ROOT;
        for (int pos = 0; pos < textBytes.length; pos++) {
            int symbol = textBytes[pos] & 0xff;

            while (cur != ROOT && nodes.get(cur).children[symbol] == ABSENT) {
                cur = fail[cur];
            }

            int next = nodes.get(cur).children[symbol];
            if (next == ABSENT) {
                // At the root with no transition: stay and continue
                continue;
            }
            cur = next;

            for (String pattern : nodes.get(cur).outputs) {
                int offset = PositionMapper.toCharOffset(textBytes, pos, byteLengths.get(pattern));
                matches.add(offset, pattern);
            }
        }
        return matches.build();
    }

    /**
     * Number of nodes in the automaton, root included.
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Failure link of a node.
     *
     * @param node node index
     * @return index of the node for the longest proper suffix that is also a pattern prefix
     */
    public int failureLink(int node) {
        return fail[node];
    }

    /**
     * Patterns reported when the scan reaches a node, failure-copied ones included.
     */
    public List<String> outputs(int node) {
        return Collections.unmodifiableList(nodes.get(node).outputs);
    }

    @Override
    public List<String> dump() {
        List<String> lines = new ArrayList<>(nodes.size() + 1);
        lines.add("AC: " + patterns.size() + " patterns, " + nodes.size() + " nodes");
        for (int idx = 0; idx < nodes.size(); idx++) {
            lines.add("Node " + idx + ": " + nodes.get(idx) + ", fail: " + fail[idx]);
        }
        return lines;
    }

    @Override
    public Algorithm algorithm() {
        return Algorithm.AHO_CORASICK;
    }

    @Override
    public List<String> patterns() {
        return patterns;
    }

    private static final class Node {
        final int[] children = new int[ALPHABET];
        final List<String> outputs = new ArrayList<>(1);

        Node() {
            Arrays.fill(children, ABSENT);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("Node(patterns=").append(outputs).append(", children={");
            boolean first = true;
            for (int symbol = 0; symbol < ALPHABET; symbol++) {
                if (children[symbol] == ABSENT) {
                    continue;
                }
                if (!first) {
                    sb.append(", ");
                }
                sb.append(String.format("0x%02x", symbol)).append('=').append(children[symbol]);
                first = false;
            }
            return sb.append("})").toString();
        }
    }
}
