package github.sarthakdev143.scene_composer.config;

import github.sarthakdev143.scene_composer.composition.SectionProfiler;
import github.sarthakdev143.scene_composer.model.rules.MotionBands;
import github.sarthakdev143.scene_composer.model.rules.ProfileRules;
import github.sarthakdev143.scene_composer.model.rules.ScoringWeights;
import github.sarthakdev143.scene_composer.model.rules.TransitionRules;
import github.sarthakdev143.scene_composer.service.SemanticAnalysisService;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;

import java.time.Duration;

/**
 * Rule tables used by the decision core. Each is immutable; replace a bean to tune behavior.
 */
@Configuration
public class CompositionRulesConfiguration {

    @Bean
    public ProfileRules profileRules() {
        return ProfileRules.defaults();
    }

    @Bean
    public ScoringWeights scoringWeights() {
        return ScoringWeights.defaults();
    }

    @Bean
    public TransitionRules transitionRules() {
        return TransitionRules.defaults();
    }

    @Bean
    public MotionBands motionBands() {
        return MotionBands.defaults();
    }

    @Bean
    public SectionProfiler sectionProfiler(
            ProfileRules profileRules,
            ObjectProvider<SemanticAnalysisService> analysisService,
            TaskExecutor taskExecutor,
            SceneComposerProperties properties,
            MeterRegistry meterRegistry) {
        return new SectionProfiler(
                profileRules,
                analysisService.getIfAvailable(),
                taskExecutor,
                Duration.ofMillis(properties.analysis().timeoutMillis()),
                meterRegistry);
    }
}
