package org.e2immu.analyzer.mwp.flow.choice;

import org.e2immu.analyzer.mwp.flow.semiring.Delta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
Computes the admissible choice vectors that avoid a set of infinite paths.

The paths are normalized first (fusion, removal of supersets). Starting from the vector that allows every
recorded case, the vectors are refined path by path: a vector that already avoids the path is kept; otherwise
it is replaced by one vector per delta of the path, each excluding that delta's value. Empty vectors are dropped,
and so are vectors contained in another one, which keeps the result minimal.
 */
public class ChoiceSolver {
    private static final Logger LOGGER = LoggerFactory.getLogger("mwp-choice");

    private ChoiceSolver() {
    }

    /**
     * @param domain          the cases of every index
     * @param numberOfIndices the number of indices
     * @param infinite        the infinite paths
     */
    public static Choices generate(List<Integer> domain, int numberOfIndices, Collection<List<Delta>> infinite) {
        return generate(Collections.nCopies(numberOfIndices, domain), infinite);
    }

    public static Choices generate(ChoiceRegistry registry, Collection<List<Delta>> infinite) {
        return generate(registry.domains(), infinite);
    }

    /**
     * @param domains  for every index, the cases that may be chosen
     * @param infinite the infinite paths
     */
    public static Choices generate(List<List<Integer>> domains, Collection<List<Delta>> infinite) {
        int n = domains.size();
        Set<List<Delta>> paths = DeltaGraph.normalize(sortedPaths(infinite), i -> i < n ? domains.get(i) : List.of());
        ChoiceVector all = new ChoiceVector(domains);
        if (all.isEmpty() && n > 0 || paths.contains(List.of())) {
            LOGGER.debug("No admissible choices: {} paths after normalization, full", paths.size());
            return new Choices(n, List.of());
        }
        List<ChoiceVector> vectors = List.of(all);
        for (List<Delta> path : paths) {
            List<ChoiceVector> refined = new ArrayList<>();
            for (ChoiceVector vector : vectors) {
                if (vector.avoids(path)) {
                    refined.add(vector);
                } else {
                    for (Delta delta : path) {
                        ChoiceVector excluded = vector.exclude(delta);
                        if (!excluded.isEmpty()) refined.add(excluded);
                    }
                }
            }
            vectors = removeContained(refined);
            if (vectors.isEmpty()) break;
        }
        LOGGER.debug("{} paths, {} indices -> {} choice vector(s)", paths.size(), n, vectors.size());
        return new Choices(n, vectors);
    }

    private static List<List<Delta>> sortedPaths(Collection<List<Delta>> infinite) {
        List<List<Delta>> list = new ArrayList<>(infinite.size());
        for (List<Delta> path : infinite) {
            List<Delta> sorted = new ArrayList<>(new TreeSet<>(path));
            list.add(List.copyOf(sorted));
        }
        return list;
    }

    private static List<ChoiceVector> removeContained(List<ChoiceVector> vectors) {
        List<ChoiceVector> result = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            ChoiceVector v = vectors.get(i);
            boolean contained = false;
            for (int j = 0; j < vectors.size(); j++) {
                if (i == j) continue;
                ChoiceVector w = vectors.get(j);
                // of two equal vectors, keep the first one
                if (v.isContainedIn(w) && (!w.isContainedIn(v) || j < i)) {
                    contained = true;
                    break;
                }
            }
            if (!contained) result.add(v);
        }
        return result;
    }
}
