package org.urdfast.engine.expression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Operation forest of one or more related expressions (e.g. the cells of a
 * matrix).
 *
 * All records live in one list; parent and child links are indices into it.
 * An operand is linked to the record whose total span equals the operand span
 * once enclosing grouping parentheses are removed; operands without such a
 * record are leaves (numbers or symbols). Records that no root reaches are
 * redundant detections and are ignored by traversals.
 *
 * Example:
 *
 * <pre>
 * ExpressionForest forest = ExpressionForest.parse("(a+b)*c");
 * OperationRecord root = forest.record(forest.root(0)); // '*' node
 * int child = forest.child(forest.root(0), 0); // '+' node spanning "a+b"
 * </pre>
 */
public final class ExpressionForest {

    private final List<SourceText> sources;
    private final List<OperationRecord> records;
    private final int[] parents;
    private final int[][] children;
    private final int[] depths;
    private final int[] heights;
    private final int[] roots;
    private final boolean[] reachable;

    private ExpressionForest(List<SourceText> sources, List<OperationRecord> records) {
        this.sources = sources;
        this.records = records;
        this.parents = new int[records.size()];
        this.children = new int[records.size()][];
        this.depths = new int[records.size()];
        this.heights = new int[records.size()];
        this.roots = new int[sources.size()];
        this.reachable = new boolean[records.size()];
        link();
    }

    /**
     * Parses one expression. Whitespace is removed first.
     *
     * @throws ExpressionParseException if the expression is malformed
     */
    public static ExpressionForest parse(String expression) {
        return parse(List.of(expression));
    }

    /**
     * Parses several expressions into one forest, one root per expression.
     *
     * @throws ExpressionParseException if any expression is malformed
     */
    public static ExpressionForest parse(List<String> expressions) {
        Objects.requireNonNull(expressions, "Expressions cannot be null");
        List<SourceText> sources = new ArrayList<>(expressions.size());
        List<OperationRecord> records = new ArrayList<>();
        for (int i = 0; i < expressions.size(); i++) {
            SourceText text = new SourceText(normalize(expressions.get(i)));
            sources.add(text);
            records.addAll(new ExpressionScanner(text, i).scan());
        }
        return new ExpressionForest(sources, records);
    }

    /**
     * Removes every whitespace character.
     */
    public static String normalize(String expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        StringBuilder sb = new StringBuilder(expression.length());
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // ==================== Linking ====================

    private void link() {
        Arrays.fill(parents, -1);
        List<Map<Span, Integer>> bySpan = new ArrayList<>();
        for (int s = 0; s < sources.size(); s++) {
            bySpan.add(new HashMap<>());
        }
        for (int r = 0; r < records.size(); r++) {
            OperationRecord record = records.get(r);
            Map<Span, Integer> index = bySpan.get(record.source());
            Integer existing = index.get(record.span());
            if (existing == null || records.get(existing).span().length() < record.span().length()) {
                index.put(record.span(), r);
            }
        }

        for (int r = 0; r < records.size(); r++) {
            OperationRecord record = records.get(r);
            SourceText text = sources.get(record.source());
            int[] links = new int[record.operandCount()];
            for (int k = 0; k < links.length; k++) {
                Span operand = record.operands().get(k);
                Integer child = operand.isEmpty() ? null : bySpan.get(record.source()).get(text.stripGrouping(operand));
                links[k] = child == null ? -1 : child;
            }
            children[r] = links;
        }

        for (int s = 0; s < sources.size(); s++) {
            SourceText text = sources.get(s);
            Integer root = bySpan.get(s).get(text.stripGrouping(new Span(0, text.length())));
            roots[s] = root == null ? -1 : root;
            if (root != null) {
                measure(root, -1, 0);
            }
        }
    }

    private int measure(int record, int parent, int depth) {
        reachable[record] = true;
        parents[record] = parent;
        depths[record] = depth;
        int height = 0;
        for (int child : children[record]) {
            if (child >= 0) {
                height = Math.max(height, measure(child, record, depth + 1) + 1);
            }
        }
        heights[record] = height;
        return height;
    }

    // ==================== Accessors ====================

    public int sourceCount() {
        return sources.size();
    }

    /**
     * @return The normalized text of expression {@code source}
     */
    public String source(int source) {
        return sources.get(source).text();
    }

    public int size() {
        return records.size();
    }

    public OperationRecord record(int index) {
        return records.get(index);
    }

    /**
     * @return Root record of expression {@code source}, or -1 if the
     *         expression is a single atom
     */
    public int root(int source) {
        return roots[source];
    }

    public int parent(int record) {
        return parents[record];
    }

    /**
     * @return Record producing operand {@code operand} of {@code record}, or -1
     *         if that operand is a leaf
     */
    public int child(int record, int operand) {
        return children[record][operand];
    }

    /**
     * @return Distance from the root, 0 for roots
     */
    public int depth(int record) {
        return depths[record];
    }

    /**
     * @return Longest path down to a leaf operation, 0 for records without
     *         child operations
     */
    public int height(int record) {
        return heights[record];
    }

    /**
     * @return true if the record belongs to the tree of some expression
     */
    public boolean isReachable(int record) {
        return reachable[record];
    }

    /**
     * @return Reachable records, in discovery order
     */
    public List<Integer> reachableRecords() {
        List<Integer> result = new ArrayList<>();
        for (int r = 0; r < records.size(); r++) {
            if (reachable[r]) {
                result.add(r);
            }
        }
        return result;
    }

    /**
     * @return Text of a leaf operand without enclosing grouping parentheses
     */
    public String leafText(int record, int operand) {
        OperationRecord op = records.get(record);
        SourceText text = sources.get(op.source());
        return text.stripGrouping(op.operands().get(operand)).text(text.text());
    }

    /**
     * @return Text of an atom expression without enclosing grouping
     *         parentheses
     */
    public String atomText(int source) {
        SourceText text = sources.get(source);
        return text.stripGrouping(new Span(0, text.length())).text(text.text());
    }

    /**
     * Collects the leaf operands of one expression, left to right.
     */
    public List<String> leaves(int source) {
        List<String> result = new ArrayList<>();
        if (roots[source] < 0) {
            result.add(atomText(source));
        } else {
            collectLeaves(roots[source], result);
        }
        return result;
    }

    private void collectLeaves(int record, List<String> result) {
        for (int k = 0; k < children[record].length; k++) {
            if (children[record][k] >= 0) {
                collectLeaves(children[record][k], result);
            } else if (!records.get(record).operands().get(k).isEmpty()) {
                result.add(leafText(record, k));
            }
        }
    }

    /**
     * @return true if {@code ancestor} is a proper ancestor of {@code record}
     */
    public boolean isAncestor(int ancestor, int record) {
        int current = parents[record];
        while (current >= 0) {
            if (current == ancestor) {
                return true;
            }
            current = parents[current];
        }
        return false;
    }
}
