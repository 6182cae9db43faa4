package org.finos.legend.sqlexpr.plan;

import org.eclipse.collections.api.factory.Stacks;
import org.eclipse.collections.api.factory.primitive.IntStacks;
import org.eclipse.collections.api.stack.MutableStack;
import org.eclipse.collections.api.stack.primitive.MutableIntStack;

/**
 * Measures the depth of an expression tree without recursion, so arbitrarily
 * deep trees can be rejected before any recursive traversal runs.
 */
public final class ExpressionDepth {

    private ExpressionDepth() {
    }

    /**
     * @return The number of nodes on the longest root-to-leaf path (a leaf has depth 1)
     */
    public static int of(Expression root) {
        MutableStack<Expression> nodes = Stacks.mutable.empty();
        MutableIntStack depths = IntStacks.mutable.empty();
        nodes.push(root);
        depths.push(1);

        int max = 0;
        while (!nodes.isEmpty()) {
            Expression node = nodes.pop();
            int depth = depths.pop();
            max = Math.max(max, depth);
            for (Expression child : node.children()) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return max;
    }

    /**
     * @return true if the tree is deeper than {@code limit}; stops as soon as the limit is crossed
     */
    public static boolean exceeds(Expression root, int limit) {
        MutableStack<Expression> nodes = Stacks.mutable.empty();
        MutableIntStack depths = IntStacks.mutable.empty();
        nodes.push(root);
        depths.push(1);

        while (!nodes.isEmpty()) {
            Expression node = nodes.pop();
            int depth = depths.pop();
            if (depth > limit) {
                return true;
            }
            for (Expression child : node.children()) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return false;
    }
}
