package org.learningjava.benchtrend.domain.service.compare;

import org.learningjava.benchtrend.domain.model.compare.Navigation;
import org.learningjava.benchtrend.domain.model.measurement.CollatedResults;
import org.learningjava.benchtrend.domain.model.measurement.ResultsByBenchmark;
import org.learningjava.benchtrend.domain.service.collate.NumericAwareComparator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class NavigationBuilder {

    public Navigation getNavigation(CollatedResults results) {
        List<Navigation.Entry> nav = new ArrayList<>();
        Map<String, Integer> exesPerSuite = new HashMap<>();

        for (Map.Entry<String, Map<String, ResultsByBenchmark>> exe : results.byExecutionUnit().entrySet()) {
            List<String> suites = new ArrayList<>(exe.getValue().keySet());
            nav.add(new Navigation.Entry(exe.getKey(), List.copyOf(suites)));
            for (String suite : suites) {
                exesPerSuite.merge(suite, 1, Integer::sum);
            }
        }

        List<String> shared = exesPerSuite.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .sorted(NumericAwareComparator.INSTANCE)
                .toList();

        return new Navigation(nav, shared);
    }
}
