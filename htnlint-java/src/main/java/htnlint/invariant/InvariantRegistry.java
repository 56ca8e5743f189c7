package htnlint.invariant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Invariants by id, in registration order.
 *
 * <p>Reads return snapshots; {@link #enable} and {@link #configure} replace one entry's
 * definition under the write lock, so analyses already holding a snapshot are unaffected.
 */
public final class InvariantRegistry {
    private static final Logger log = LoggerFactory.getLogger(InvariantRegistry.class);

    private final Map<String, StateInvariant> invariants = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private static final class Shared {
        static final InvariantRegistry INSTANCE = withDefaults();
    }

    /** The process-wide registry, created with the default invariants on first use. */
    public static InvariantRegistry shared() {
        return Shared.INSTANCE;
    }

    public static InvariantRegistry withDefaults() {
        InvariantRegistry registry = new InvariantRegistry();
        DefaultInvariants.all().forEach(registry::register);
        return registry;
    }

    /** Adds or replaces the invariant with the same id. */
    public void register(StateInvariant invariant) {
        lock.writeLock().lock();
        try {
            invariants.put(invariant.id(), invariant);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public StateInvariant get(String id) {
        lock.readLock().lock();
        try {
            return invariants.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<StateInvariant> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(invariants.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Snapshot of the enabled invariants, for one analysis. */
    public List<StateInvariant> enabled() {
        return all().stream().filter(StateInvariant::enabled).toList();
    }

    public List<InvariantDefinition> list() {
        return all().stream().map(StateInvariant::definition).toList();
    }

    public List<StateInvariant> byCategory(String category) {
        return all().stream().filter(i -> i.definition().category().equals(category)).toList();
    }

    public Set<String> categories() {
        Set<String> out = new LinkedHashSet<>();
        for (StateInvariant i : all()) out.add(i.definition().category());
        return out;
    }

    public void enable(String id, boolean enabled) {
        update(id, d -> d.withEnabled(enabled));
        log.info("Invariant {} {}", id, enabled ? "enabled" : "disabled");
    }

    /** Merges {@code config} over the invariant's current configuration. */
    public void configure(String id, Map<String, Object> config) {
        update(id, d -> d.withConfig(config));
        log.info("Invariant {} configured: {}", id, config.keySet());
    }

    private void update(String id, UnaryOperator<InvariantDefinition> change) {
        lock.writeLock().lock();
        try {
            StateInvariant current = invariants.get(id);
            if (current == null) throw new IllegalArgumentException("Unknown invariant: " + id);
            invariants.put(id, current.withDefinition(change.apply(current.definition())));
        } finally {
            lock.writeLock().unlock();
        }
    }
}
