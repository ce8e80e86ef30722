package com.vidnyan.ust.domain.analysis;

import com.vidnyan.ust.domain.model.AstNode;
import com.vidnyan.ust.domain.model.NodeType;
import com.vidnyan.ust.domain.model.UniversalSyntaxTree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Read-only whole-tree metrics. Each is a single O(n) traversal.
 */
public final class TreeMetrics {

    /**
     * Node types counted by {@link #cyclomaticEstimate(UniversalSyntaxTree)}.
     * Every binary expression counts, not only short-circuit operators: a coarse proxy.
     */
    public static final Set<NodeType> CONTROL_FLOW_TYPES = EnumSet.of(
            NodeType.IF_STATEMENT,
            NodeType.WHILE_STATEMENT,
            NodeType.FOR_STATEMENT,
            NodeType.BINARY_EXPRESSION
    );

    private TreeMetrics() {
    }

    /**
     * Longest root-to-leaf path in edges; a lone root has depth 0.
     */
    public static int depth(UniversalSyntaxTree tree) {
        int max = 0;
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(tree.root(), 0));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            max = Math.max(max, frame.depth());
            for (AstNode child : frame.node().getChildren()) {
                stack.push(new Frame(child, frame.depth() + 1));
            }
        }
        return max;
    }

    public static Map<NodeType, Long> nodeTypeHistogram(UniversalSyntaxTree tree) {
        Map<NodeType, Long> histogram = new EnumMap<>(NodeType.class);
        tree.walk(node -> histogram.merge(node.getType(), 1L, Long::sum));
        return histogram;
    }

    public static int cyclomaticEstimate(UniversalSyntaxTree tree) {
        int[] complexity = {1};
        tree.walk(node -> {
            if (CONTROL_FLOW_TYPES.contains(node.getType())) {
                complexity[0]++;
            }
        });
        return complexity[0];
    }

    public static int nodeCount(UniversalSyntaxTree tree) {
        int[] count = {0};
        tree.walk(node -> count[0]++);
        return count[0];
    }

    private record Frame(AstNode node, int depth) {}
}
