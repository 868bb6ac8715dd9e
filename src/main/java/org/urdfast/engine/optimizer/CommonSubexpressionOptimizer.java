package org.urdfast.engine.optimizer;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.factory.Sets;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.multimap.list.MutableListMultimap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Multimaps;
import org.urdfast.engine.expression.ExpressionForest;
import org.urdfast.engine.expression.ExpressionRenderer;
import org.urdfast.engine.expression.ExpressionRenderer.Rewrites;
import org.urdfast.engine.expression.OperationKind;
import org.urdfast.engine.expression.OperationRecord;
import org.urdfast.engine.expression.Operator;
import org.urdfast.engine.expression.VariableSubstitution;
import org.urdfast.engine.model.NamedVariable;
import org.urdfast.engine.model.VariableKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Common subexpression elimination over a set of related expressions.
 *
 * The input is an ordered list of variables (each value may use earlier
 * variables) followed by terminal expressions, for example the cells of one
 * matrix. All of them are parsed into one {@link ExpressionForest}; operations
 * whose canonical renderings are equal at two or more places receive one fresh
 * variable, and every occurrence is replaced by its name.
 *
 * Extraction runs in rounds, innermost first: a repeated operation is named
 * only once none of its descendants still belongs to another repeated group,
 * so {@code cos(x-y)} is found after {@code x-y} has been named. Rounds repeat
 * until nothing is repeated. Extracted variables that end up used only once
 * are then inlined back into their single user.
 *
 * Not extracted:
 * <ul>
 * <li>{@code +} and {@code *} chains (operand order would have to be
 * normalized to compare them);</li>
 * <li>signs of an atom ({@code -a}) and subscripts of atoms
 * ({@code q[0]}), which are as cheap as a variable reference;</li>
 * <li>slices, and list literals unless enabled.</li>
 * </ul>
 *
 * Instances are immutable; all working state is local to one call.
 */
public final class CommonSubexpressionOptimizer {

    /**
     * Functions whose value is a matrix or a vector in every profile.
     */
    private static final ImmutableSet<String> MATRIX_FUNCTIONS = Sets.immutable.of("eye", "zeros");
    private static final ImmutableSet<String> VECTOR_FUNCTIONS = Sets.immutable.of("cross");

    private final boolean includeLists;

    public CommonSubexpressionOptimizer() {
        this(false);
    }

    /**
     * @param includeLists Also extract repeated list literals
     */
    public CommonSubexpressionOptimizer(boolean includeLists) {
        this.includeLists = includeLists;
    }

    public OptimizationResult optimize(String expression) {
        return optimize(List.of(), List.of(expression), Set.of());
    }

    public OptimizationResult optimize(List<String> expressions) {
        return optimize(List.of(), expressions, Set.of());
    }

    public OptimizationResult optimize(List<NamedVariable> variables, List<String> expressions) {
        return optimize(variables, expressions, Set.of());
    }

    /**
     * Optimizes variables and terminal expressions together.
     *
     * @param variables   Existing variables, in definition order
     * @param expressions Terminal expressions
     * @param reserved    Extra names generated variables must not take
     *                    (function parameters, for instance)
     * @return Rewritten variables and expressions; the inputs unchanged if
     *         nothing is repeated or a variable name is assigned twice
     * @throws org.urdfast.engine.expression.ExpressionParseException if an
     *         expression is malformed
     */
    public OptimizationResult optimize(List<NamedVariable> variables, List<String> expressions,
            Collection<String> reserved) {
        Objects.requireNonNull(variables, "Variables cannot be null");
        Objects.requireNonNull(expressions, "Expressions cannot be null");
        Objects.requireNonNull(reserved, "Reserved names cannot be null");

        if (expressions.isEmpty() || hasReassignment(variables)) {
            return new OptimizationResult(variables, expressions, 0);
        }

        MutableList<NamedVariable> vars = Lists.mutable.withAll(variables);
        MutableList<String> terminals = Lists.mutable.withAll(expressions);
        MutableSet<String> extracted = Sets.mutable.empty();
        VariableNamer namer = new VariableNamer(reservedNames(vars, terminals, reserved));

        boolean repeated = true;
        while (repeated) {
            repeated = extractRound(vars, terminals, namer, extracted);
        }
        if (extracted.isEmpty()) {
            return new OptimizationResult(variables, expressions, 0);
        }

        inlineSingleUses(vars, terminals, extracted);
        int count = vars.count(v -> extracted.contains(v.name()));
        return new OptimizationResult(vars, terminals, count);
    }

    // ==================== Extraction ====================

    private boolean extractRound(MutableList<NamedVariable> vars, MutableList<String> terminals,
            VariableNamer namer, MutableSet<String> extracted) {
        ExpressionForest forest = ExpressionForest.parse(slots(vars, terminals));
        List<List<Integer>> groups = innermostRepeatedGroups(forest);
        if (groups.isEmpty()) {
            return false;
        }

        MutableMap<Integer, String> names = Maps.mutable.empty();
        MutableListMultimap<Integer, NamedVariable> insertions = Multimaps.mutable.list.empty();
        for (List<Integer> group : groups) {
            int first = group.get(0);
            OperationRecord record = forest.record(first);
            String name = namer.nameFor(record);
            String value = ExpressionRenderer.CANONICAL.renderRecord(forest, first, Rewrites.NONE, false).text();
            int host = Integer.MAX_VALUE;
            for (int member : group) {
                names.put(member, name);
                host = Math.min(host, forest.record(member).source());
            }
            insertions.put(host, new NamedVariable(name, value, kindOf(forest, first)));
            extracted.add(name);
        }

        Rewrites rewrites = Rewrites.naming(names);
        MutableList<NamedVariable> rewritten = Lists.mutable.empty();
        for (int i = 0; i < vars.size(); i++) {
            rewritten.addAll(insertions.get(i));
            NamedVariable variable = vars.get(i);
            String value = ExpressionRenderer.CANONICAL.render(forest, i, rewrites).text();
            rewritten.add(new NamedVariable(variable.name(), value, variable.kind()));
        }
        for (int t = 0; t < terminals.size(); t++) {
            int source = vars.size() + t;
            rewritten.addAll(insertions.get(source));
            terminals.set(t, ExpressionRenderer.CANONICAL.render(forest, source, rewrites).text());
        }
        vars.clear();
        vars.addAll(rewritten);
        return true;
    }

    /**
     * Groups reachable candidate records by canonical rendering and keeps the
     * repeated groups none of whose members contains a member of another
     * repeated group. Deepest groups come first, ties in order of first
     * occurrence.
     */
    private List<List<Integer>> innermostRepeatedGroups(ExpressionForest forest) {
        MutableListMultimap<String, Integer> byRendering = Multimaps.mutable.list.empty();
        MutableList<String> order = Lists.mutable.empty();
        for (int record : forest.reachableRecords()) {
            if (!isCandidate(forest, record)) {
                continue;
            }
            String key = ExpressionRenderer.CANONICAL.renderRecord(forest, record, Rewrites.NONE, false).text();
            if (!byRendering.containsKey(key)) {
                order.add(key);
            }
            byRendering.put(key, record);
        }

        MutableList<String> repeated = order.select(key -> byRendering.get(key).size() >= 2);
        MutableSet<Integer> blocked = Sets.mutable.empty();
        for (String key : repeated) {
            for (int member : byRendering.get(key)) {
                for (int p = forest.parent(member); p >= 0; p = forest.parent(p)) {
                    blocked.add(p);
                }
            }
        }

        List<List<Integer>> groups = new ArrayList<>();
        for (String key : repeated) {
            List<Integer> members = byRendering.get(key);
            if (members.stream().noneMatch(blocked::contains)) {
                groups.add(members);
            }
        }
        groups.sort(Comparator.comparingInt((List<Integer> g) -> maxDepth(forest, g)).reversed());
        return groups;
    }

    private boolean isCandidate(ExpressionForest forest, int record) {
        OperationRecord op = forest.record(record);
        return switch (op.kind()) {
            case BINARY -> !op.operator().isCommutative();
            case UNARY -> forest.child(record, 0) >= 0;
            case FUNCTION -> true;
            case SUBSCRIPT -> hasChildRecord(forest, record);
            case LIST -> includeLists;
            case SLICE -> false;
        };
    }

    private static boolean hasChildRecord(ExpressionForest forest, int record) {
        for (int k = 0; k < forest.record(record).operandCount(); k++) {
            if (forest.child(record, k) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static int maxDepth(ExpressionForest forest, List<Integer> group) {
        int depth = 0;
        for (int member : group) {
            depth = Math.max(depth, forest.depth(member));
        }
        return depth;
    }

    private static VariableKind kindOf(ExpressionForest forest, int record) {
        OperationRecord op = forest.record(record);
        if (op.kind() == OperationKind.LIST) {
            return VariableKind.VECTOR;
        }
        if (op.operator() == Operator.MATMUL && op.kind() == OperationKind.BINARY) {
            return VariableKind.MATRIX;
        }
        if (op.kind() == OperationKind.FUNCTION) {
            if (MATRIX_FUNCTIONS.contains(op.name())) {
                return VariableKind.MATRIX;
            }
            if (VECTOR_FUNCTIONS.contains(op.name())) {
                return VariableKind.VECTOR;
            }
        }
        if (op.kind() == OperationKind.SUBSCRIPT) {
            for (int k = 0; k < op.operandCount(); k++) {
                int child = forest.child(record, k);
                if (child >= 0 && forest.record(child).kind() == OperationKind.SLICE) {
                    return VariableKind.MATRIX;
                }
            }
        }
        return VariableKind.SCALAR;
    }

    // ==================== Inlining ====================

    /**
     * Folds extracted variables referenced exactly once back into their user.
     */
    private static void inlineSingleUses(MutableList<NamedVariable> vars, MutableList<String> terminals,
            MutableSet<String> extracted) {
        boolean changed = true;
        while (changed) {
            changed = false;
            ExpressionForest forest = ExpressionForest.parse(slots(vars, terminals));
            for (int i = 0; i < vars.size() && !changed; i++) {
                NamedVariable candidate = vars.get(i);
                if (!extracted.contains(candidate.name())) {
                    continue;
                }
                int user = singleUser(forest, candidate.name());
                if (user < 0) {
                    continue;
                }
                if (user < vars.size()) {
                    NamedVariable target = vars.get(user);
                    String value = VariableSubstitution.substitute(target.value(), candidate.name(), candidate.value());
                    vars.set(user, new NamedVariable(target.name(), value, target.kind()));
                } else {
                    int t = user - vars.size();
                    terminals.set(t, VariableSubstitution.substitute(terminals.get(t), candidate.name(),
                            candidate.value()));
                }
                vars.remove(i);
                changed = true;
            }
        }
    }

    /**
     * @return The only slot using {@code name}, -1 if it is used zero times or
     *         more than once
     */
    private static int singleUser(ExpressionForest forest, String name) {
        int user = -1;
        int uses = 0;
        for (int s = 0; s < forest.sourceCount(); s++) {
            for (String leaf : forest.leaves(s)) {
                if (leaf.equals(name)) {
                    uses++;
                    user = s;
                }
            }
        }
        return uses == 1 ? user : -1;
    }

    // ==================== Helpers ====================

    private static List<String> slots(List<NamedVariable> vars, List<String> terminals) {
        List<String> slots = new ArrayList<>(vars.size() + terminals.size());
        for (NamedVariable variable : vars) {
            slots.add(variable.value());
        }
        slots.addAll(terminals);
        return slots;
    }

    private static boolean hasReassignment(List<NamedVariable> variables) {
        MutableSet<String> seen = Sets.mutable.empty();
        for (NamedVariable variable : variables) {
            if (!seen.add(variable.name())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Symbols, function and object names, variable names and the extra
     * reserved names.
     */
    private static Set<String> reservedNames(List<NamedVariable> vars, List<String> terminals,
            Collection<String> reserved) {
        MutableSet<String> names = Sets.mutable.withAll(reserved);
        ExpressionForest forest = ExpressionForest.parse(slots(vars, terminals));
        for (int s = 0; s < forest.sourceCount(); s++) {
            for (String leaf : forest.leaves(s)) {
                if (!leaf.isEmpty() && !Character.isDigit(leaf.charAt(0))) {
                    names.add(leaf);
                }
            }
        }
        for (int r = 0; r < forest.size(); r++) {
            if (forest.record(r).isFunction()) {
                names.add(forest.record(r).name());
            }
        }
        for (NamedVariable variable : vars) {
            names.add(variable.name());
        }
        return names;
    }
}
