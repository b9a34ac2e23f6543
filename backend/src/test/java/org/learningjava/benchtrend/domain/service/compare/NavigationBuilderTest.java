package org.learningjava.benchtrend.domain.service.compare;

import org.junit.jupiter.api.Test;
import org.learningjava.benchtrend.domain.model.compare.Navigation;
import org.learningjava.benchtrend.domain.model.measurement.CollatedResults;
import org.learningjava.benchtrend.domain.service.collate.MeasurementCollator;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.learningjava.benchtrend.domain.model.measurement.TestRows.row;

class NavigationBuilderTest {

    private final MeasurementCollator collator = new MeasurementCollator();
    private final NavigationBuilder builder = new NavigationBuilder();

    @Test
    void getNavigation_listsSuitesPerExe_and_sharedSuites() {
        CollatedResults r = collator.collate(List.of(
                row("TruffleSOM", "macro", "Richards", "total", "c", 1, "abc", 1, 1, 1, 1, 1),
                row("TruffleSOM", "micro", "Fib", "total", "c", 1, "abc", 1, 1, 1, 1, 1),
                row("SOMns", "macro", "Richards", "total", "c", 1, "abc", 1, 1, 1, 1, 1),
                row("SOMns", "startup", "Hello", "total", "c", 1, "abc", 1, 1, 1, 1, 1)));

        Navigation nav = builder.getNavigation(r);

        assertThat(nav.nav(), hasSize(2));
        assertEquals("SOMns", nav.nav().get(0).exeName());
        assertEquals(List.of("macro", "startup"), nav.nav().get(0).suites());
        assertEquals("TruffleSOM", nav.nav().get(1).exeName());
        assertEquals(List.of("macro", "micro"), nav.nav().get(1).suites());
        assertEquals(List.of("macro"), nav.exeComparisonSuites());
    }

    @Test
    void getNavigation_singleExe_hasNoSharedSuites() {
        CollatedResults r = collator.collate(List.of(
                row("som", "macro", "Richards", "total", "c", 1, "abc", 1, 1, 1, 1, 1)));

        Navigation nav = builder.getNavigation(r);

        assertThat(nav.nav(), hasSize(1));
        assertThat(nav.exeComparisonSuites(), empty());
    }
}
