package com.autoconcurrency.scheduler.translate;

import com.autoconcurrency.scheduler.decision.StrategyDecision;
import com.autoconcurrency.scheduler.model.GroupingScope;
import com.autoconcurrency.scheduler.model.Strategy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterTranslatorTest {

    final ParameterTranslator translator = new ParameterTranslator();

    @Test
    void isolated_noGrouping_perItem() {
        StrategyDecision d = new StrategyDecision(Strategy.ISOLATED_PROCESS, 8, false, null);

        assertThat(translator.toDistributor(d))
                .isEqualTo(new DistributorParameters(8, DistributionMode.PER_ITEM));
    }

    @Test
    void isolated_fileGrouping_perGroupFile() {
        StrategyDecision d = new StrategyDecision(Strategy.ISOLATED_PROCESS, 4, true, GroupingScope.FILE);

        assertThat(translator.toDistributor(d).distributionMode()).isEqualTo(DistributionMode.PER_GROUP_FILE);
        assertThat(translator.toArguments(d)).containsExactly("-n", "4", "--dist", "loadfile");
    }

    @Test
    void isolated_packageGrouping_loadgroup() {
        StrategyDecision d = new StrategyDecision(Strategy.ISOLATED_PROCESS, 2, true, GroupingScope.PACKAGE);

        assertThat(translator.toArguments(d)).containsExactly("-n", "2", "--dist", "loadgroup");
        assertThat(translator.toArguments(d)).doesNotContain("loadfile");
    }

    @Test
    void isolated_noGrouping_noDistArgument() {
        StrategyDecision d = new StrategyDecision(Strategy.ISOLATED_PROCESS, 8, false, null);

        assertThat(translator.toArguments(d)).containsExactly("-n", "8");
    }

    @Test
    void threaded_passesThroughWorkerCountAndGrouping() {
        StrategyDecision d = new StrategyDecision(Strategy.THREADED, 4, true, GroupingScope.FILE);

        assertThat(translator.toThreaded(d)).isEqualTo(new ThreadedParameters(4, true));
        assertThat(translator.toArguments(d)).containsExactly("--workers", "4");
    }

    @Test
    void wrongStrategy_rejected() {
        StrategyDecision threaded = new StrategyDecision(Strategy.THREADED, 2, false, null);
        StrategyDecision isolated = new StrategyDecision(Strategy.ISOLATED_PROCESS, 2, false, null);

        assertThatThrownBy(() -> translator.toDistributor(threaded))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> translator.toThreaded(isolated))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
