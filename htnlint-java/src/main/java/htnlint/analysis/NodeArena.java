package htnlint.analysis;

import htnlint.ast.Rule;
import htnlint.ast.Term;

import java.util.*;

/**
 * Mutable node store used while one analysis builds its call graph.
 *
 * <p>A node is created either by a reference (role METHOD, no definitions) or by a definition.
 * Every definition seen for a key sets the role and position from that rule and bumps the
 * definition count.
 */
final class NodeArena {

    static final class Node {
        final String key;
        final String name;
        final int arity;
        NodeRole role = NodeRole.METHOD;
        int line;
        int column;
        final Set<String> calls = new LinkedHashSet<>();
        final Set<String> calledBy = new LinkedHashSet<>();
        final List<String> deletes = new ArrayList<>();
        final List<String> adds = new ArrayList<>();
        final List<String> conditions = new ArrayList<>();
        boolean hasElse, hasAllOf, hasAnyOf;
        int definitionCount;

        Node(String key, String name, int arity, int line, int column) {
            this.key = key;
            this.name = name;
            this.arity = arity;
            this.line = line;
            this.column = column;
        }

        CallGraphNode freeze() {
            return new CallGraphNode(key, name, arity, role, line, column,
                    Collections.unmodifiableSet(new LinkedHashSet<>(calls)),
                    Collections.unmodifiableSet(new LinkedHashSet<>(calledBy)),
                    List.copyOf(deletes), List.copyOf(adds), List.copyOf(conditions),
                    hasElse, hasAllOf, hasAnyOf, definitionCount);
        }
    }

    private final Map<String, Node> nodes = new LinkedHashMap<>();

    Node define(Rule rule) {
        Term head = rule.head();
        Node node = nodes.computeIfAbsent(head.key(),
                k -> new Node(k, head.name(), head.arity(), rule.line(), head.column()));
        node.role = NodeRole.of(rule);
        node.line = rule.line();
        node.column = head.column();
        node.definitionCount++;
        node.hasElse |= rule.hasElse();
        node.hasAllOf |= rule.hasAllOf();
        node.hasAnyOf |= rule.hasAnyOf();
        return node;
    }

    Node reference(Term callee) {
        return nodes.computeIfAbsent(callee.key(),
                k -> new Node(k, callee.name(), callee.arity(), callee.line(), callee.column()));
    }

    Node get(String key) {
        return nodes.get(key);
    }

    Collection<Node> all() {
        return nodes.values();
    }

    Set<String> keys() {
        return nodes.keySet();
    }

    Map<String, CallGraphNode> freeze() {
        Map<String, CallGraphNode> out = new LinkedHashMap<>();
        nodes.forEach((k, n) -> out.put(k, n.freeze()));
        return Collections.unmodifiableMap(out);
    }
}
