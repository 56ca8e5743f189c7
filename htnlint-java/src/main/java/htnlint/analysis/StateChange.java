package htnlint.analysis;

import java.util.List;

/** Declared effects of one operator; {@code netEffect} reads like {@code -{a, b} +{c}}. */
public record StateChange(List<String> deletes, List<String> adds, String netEffect) {

    public static final String NO_CHANGE = "(no state change)";

    public static StateChange of(List<String> deletes, List<String> adds) {
        StringBuilder sb = new StringBuilder();
        if (!deletes.isEmpty()) sb.append("-{").append(String.join(", ", deletes)).append('}');
        if (!adds.isEmpty()) {
            if (sb.length() > 0) sb.append(' ');
            sb.append("+{").append(String.join(", ", adds)).append('}');
        }
        return new StateChange(List.copyOf(deletes), List.copyOf(adds), sb.length() == 0 ? NO_CHANGE : sb.toString());
    }
}
