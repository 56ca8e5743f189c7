package htnlint.sema;

import java.util.*;
import java.util.function.Function;

/**
 * Depth-first cycle search over a call graph, run with an explicit frame stack so deep call
 * chains cannot overflow the Java stack.
 *
 * <p>When an edge reaches a node still on the current path, the path slice starting at that node
 * is reported. Nodes finished by an earlier search are not revisited, so every cycle is reported
 * at most once per entry point.
 */
public final class CycleFinder {
    private final Collection<String> roots;
    private final Function<String, ? extends Collection<String>> successors;

    public CycleFinder(Collection<String> roots, Function<String, ? extends Collection<String>> successors) {
        this.roots = roots;
        this.successors = successors;
    }

    private static final class Frame {
        final String node;
        final Iterator<String> next;

        Frame(String node, Iterator<String> next) {
            this.node = node;
            this.next = next;
        }
    }

    /** Open cycles, each starting at the node the back edge returned to, in discovery order. */
    public List<List<String>> find() {
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();
        List<String> path = new ArrayList<>();
        List<List<String>> cycles = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (String root : roots) {
            if (visited.contains(root)) continue;
            enter(root, visited, onPath, path, stack);

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.next.hasNext()) {
                    String callee = top.next.next();
                    if (!visited.contains(callee)) {
                        enter(callee, visited, onPath, path, stack);
                    } else if (onPath.contains(callee)) {
                        cycles.add(List.copyOf(path.subList(path.indexOf(callee), path.size())));
                    }
                } else {
                    stack.pop();
                    path.remove(path.size() - 1);
                    onPath.remove(top.node);
                }
            }
        }
        return cycles;
    }

    private void enter(String node, Set<String> visited, Set<String> onPath, List<String> path, Deque<Frame> stack) {
        visited.add(node);
        onPath.add(node);
        path.add(node);
        Collection<String> out = successors.apply(node);
        stack.push(new Frame(node, out == null ? Collections.emptyIterator() : out.iterator()));
    }
}
