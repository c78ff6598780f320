package org.e2immu.analyzer.mwp.flow.choice;

import org.e2immu.analyzer.mwp.flow.semiring.Delta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.IntFunction;

/*
The set of infinite paths collected while compiling a function: every monomial that was turned into 'i'
contributes its delta list. A choice assignment that satisfies one of these paths leads to unbounded growth.

Fusion simplifies the set: when, for every case recorded at one index, the path extended with that case is
implied by some path in the set, the path without that index is added. Paths that contain another path
are dropped. Once the empty path is present, every choice assignment leads to unbounded growth.
 */
public class DeltaGraph {
    private static final Logger LOGGER = LoggerFactory.getLogger("mwp-choice");

    private final IntFunction<Collection<Integer>> domain;
    private Set<List<Delta>> paths = new LinkedHashSet<>();

    public DeltaGraph(ChoiceRegistry registry) {
        this(registry::cases);
    }

    public DeltaGraph(IntFunction<Collection<Integer>> domain) {
        this.domain = domain;
    }

    public void insert(List<Delta> path) {
        paths.add(List.copyOf(path));
    }

    public boolean isFull() {
        return paths.contains(List.of());
    }

    public boolean isEmpty() {
        return paths.isEmpty();
    }

    public Set<List<Delta>> paths() {
        return Collections.unmodifiableSet(paths);
    }

    public void fusion() {
        int before = paths.size();
        paths = normalize(paths, domain);
        LOGGER.debug("Fusion: {} -> {} paths, full? {}", before, paths.size(), isFull());
    }

    /**
     * @return the fused set of paths, without a path that contains another one
     */
    public static Set<List<Delta>> normalize(Collection<List<Delta>> input, IntFunction<Collection<Integer>> domain) {
        Set<List<Delta>> current = removeSupersets(input);
        boolean changed = true;
        while (changed && !current.contains(List.of())) {
            changed = false;
            Set<List<Delta>> fused = new LinkedHashSet<>(current);
            for (List<Delta> path : current) {
                for (int i = 0; i < path.size(); i++) {
                    List<Delta> base = without(path, i);
                    if (!isImplied(fused, base) && coversDomain(current, base, path.get(i).index(), domain)) {
                        fused.add(base);
                        changed = true;
                    }
                }
            }
            if (changed) current = removeSupersets(fused);
        }
        return current;
    }

    private static boolean coversDomain(Set<List<Delta>> paths, List<Delta> base, int index,
                                        IntFunction<Collection<Integer>> domain) {
        Collection<Integer> values = domain.apply(index);
        if (values.isEmpty()) return false;
        for (int value : values) {
            if (!isImplied(paths, with(base, new Delta(value, index)))) return false;
        }
        return true;
    }

    // some path is a subset of the given one
    private static boolean isImplied(Set<List<Delta>> paths, List<Delta> path) {
        for (List<Delta> p : paths) {
            if (path.containsAll(p)) return true;
        }
        return false;
    }

    private static List<Delta> without(List<Delta> path, int position) {
        List<Delta> list = new ArrayList<>(path.size() - 1);
        for (int i = 0; i < path.size(); i++) {
            if (i != position) list.add(path.get(i));
        }
        return List.copyOf(list);
    }

    private static List<Delta> with(List<Delta> base, Delta delta) {
        List<Delta> list = new ArrayList<>(base.size() + 1);
        list.addAll(base);
        list.add(delta);
        Collections.sort(list);
        return list;
    }

    static Set<List<Delta>> removeSupersets(Collection<List<Delta>> input) {
        List<List<Delta>> bySize = new ArrayList<>(input);
        bySize.sort(Comparator.comparingInt(List::size));
        Set<List<Delta>> result = new LinkedHashSet<>();
        for (List<Delta> path : bySize) {
            boolean superset = false;
            for (List<Delta> kept : result) {
                if (path.containsAll(kept)) {
                    superset = true;
                    break;
                }
            }
            if (!superset) result.add(path);
        }
        return result;
    }

    @Override
    public String toString() {
        return paths.toString();
    }
}
