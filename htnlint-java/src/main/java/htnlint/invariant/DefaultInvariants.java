package htnlint.invariant;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Invariants for grid/unit domains, where {@code at(Unit, Tile)} records positions and
 * {@code unit(U)} records existence. Patterns come from each invariant's configuration and are
 * matched at the start of a rendered fact.
 */
public final class DefaultInvariants {
    private DefaultInvariants() {}

    public static final String SINGLE_POSITION = "single_position";
    public static final String NO_ORPHAN_UNITS = "no_orphan_units";
    public static final String TILE_CAPACITY = "tile_capacity";
    public static final String STATE_CONSISTENCY = "state_consistency";
    public static final String DELETE_EXISTS = "delete_exists";

    private static final Pattern VARIABLE_ARG = Pattern.compile("(^|[(,\\[\\s])(\\?|[A-Z_])");

    public static List<StateInvariant> all() {
        return List.of(
                new StateInvariant(new InvariantDefinition(SINGLE_POSITION, "Single Position",
                        "Each unit can only occupy one position at a time", "position", true,
                        Map.of("pattern", "at\\(([^,]+),\\s*(.+)\\)")),
                        DefaultInvariants::singlePosition),
                new StateInvariant(new InvariantDefinition(NO_ORPHAN_UNITS, "No Orphan Units",
                        "Units must always have a valid position", "position", true,
                        orderedConfig("position_pattern", "at\\(([^,]+),", "unit_pattern", "unit\\(([^)]+)\\)")),
                        DefaultInvariants::noOrphanUnits),
                new StateInvariant(new InvariantDefinition(TILE_CAPACITY, "Tile Capacity",
                        "Tiles cannot have more than max_capacity units", "position", true,
                        orderedConfig("pattern", "at\\([^,]+,\\s*(.+)\\)", "max_capacity", 1)),
                        DefaultInvariants::tileCapacity),
                new StateInvariant(new InvariantDefinition(STATE_CONSISTENCY, "State Consistency",
                        "Detect obviously inconsistent state changes", "consistency", true,
                        Map.of("conflicts", List.of())),
                        DefaultInvariants::stateConsistency),
                // off by default
                new StateInvariant(new InvariantDefinition(DELETE_EXISTS, "Delete Exists",
                        "Warn when deleting facts that may not exist", "consistency", false, Map.of()),
                        DefaultInvariants::deleteExists)
        );
    }

    static String singlePosition(CheckContext ctx) {
        Pattern position = Pattern.compile(ctx.stringConfig("pattern", "at\\(([^,]+),\\s*(.+)\\)"));
        Set<String> added = firstGroups(position, ctx.adds());
        added.removeAll(firstGroups(position, ctx.deletes()));

        for (String unit : added) {
            if (!isVariable(unit)) return "Unit '" + unit + "' may get multiple positions (no del before add)";
        }
        return null;
    }

    static String noOrphanUnits(CheckContext ctx) {
        Pattern position = Pattern.compile(ctx.stringConfig("position_pattern", "at\\(([^,]+),"));
        Pattern unit = Pattern.compile(ctx.stringConfig("unit_pattern", "unit\\(([^)]+)\\)"));

        Set<String> losing = firstGroups(position, ctx.deletes());
        losing.removeAll(firstGroups(position, ctx.adds()));
        losing.removeAll(firstGroups(unit, ctx.deletes()));

        for (String u : losing) {
            if (!isVariable(u)) return "Unit '" + u + "' may be left without a position";
        }
        return null;
    }

    static String tileCapacity(CheckContext ctx) {
        Pattern position = Pattern.compile(ctx.stringConfig("pattern", "at\\([^,]+,\\s*(.+)\\)"));
        int capacity = ctx.intConfig("max_capacity", 1);

        Map<String, Integer> net = new LinkedHashMap<>();
        for (String tile : allFirstGroups(position, ctx.adds())) net.merge(tile, 1, Integer::sum);
        for (String tile : allFirstGroups(position, ctx.deletes())) net.merge(tile, -1, Integer::sum);

        for (Map.Entry<String, Integer> e : net.entrySet()) {
            if (e.getValue() >= capacity && !isVariable(e.getKey())) {
                return "Tile '" + e.getKey() + "' may exceed capacity (adding without removing)";
            }
        }
        return null;
    }

    static String stateConsistency(CheckContext ctx) {
        for (String add : ctx.adds()) {
            if (ctx.deletes().contains(add)) return "Fact '" + add + "' is both added and deleted (no-op?)";
        }

        Object conflicts = ctx.config().get("conflicts");
        if (!(conflicts instanceof List<?> pairs)) return null;
        for (Object pair : pairs) {
            if (!(pair instanceof List<?> p) || p.size() != 2) {
                throw new IllegalArgumentException("conflicts entries must be [pattern, pattern] pairs: " + pair);
            }
            String first = firstMatch(Pattern.compile(p.get(0).toString()), ctx.adds());
            String second = firstMatch(Pattern.compile(p.get(1).toString()), ctx.adds());
            if (first != null && second != null) {
                return "Potentially conflicting facts added: " + first + " and " + second;
            }
        }
        return null;
    }

    static String deleteExists(CheckContext ctx) {
        for (String delete : ctx.deletes()) {
            if (VARIABLE_ARG.matcher(delete).find()) continue;

            int paren = delete.indexOf('(');
            String functor = paren < 0 ? delete : delete.substring(0, paren);
            boolean exists = ctx.initialFacts().stream()
                    .anyMatch(f -> f.equals(functor) || f.startsWith(functor + "("));
            if (!exists) return "Deleting '" + delete + "' but no matching fact exists in initial state";
        }
        return null;
    }

    // ---------- helpers ----------
    static boolean isVariable(String text) {
        if (text.isEmpty()) return false;
        char c = text.charAt(0);
        return c == '?' || c == '_' || Character.isUpperCase(c);
    }

    private static Set<String> firstGroups(Pattern p, List<String> facts) {
        return new LinkedHashSet<>(allFirstGroups(p, facts));
    }

    private static List<String> allFirstGroups(Pattern p, List<String> facts) {
        List<String> out = new ArrayList<>();
        for (String fact : facts) {
            Matcher m = p.matcher(fact);
            if (m.lookingAt() && m.groupCount() >= 1) out.add(m.group(1).trim());
        }
        return out;
    }

    private static String firstMatch(Pattern p, List<String> facts) {
        for (String fact : facts) {
            if (p.matcher(fact).lookingAt()) return fact;
        }
        return null;
    }

    private static Map<String, Object> orderedConfig(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(k1, v1);
        m.put(k2, v2);
        return m;
    }
}
