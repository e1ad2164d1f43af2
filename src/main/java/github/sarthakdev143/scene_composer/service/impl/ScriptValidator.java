package github.sarthakdev143.scene_composer.service.impl;

import github.sarthakdev143.scene_composer.composition.CompositionConfigurationException;
import github.sarthakdev143.scene_composer.model.ScriptSection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on a script. Returns the sections ordered by index.
 */
@Component
public class ScriptValidator {

    private static final int MAX_SECTIONS = 200;
    private static final double MAX_SECTION_DURATION_SECONDS = 600.0;
    private static final double MAX_TOTAL_DURATION_SECONDS = 10.0 * 60.0 * 60.0;
    private static final double EPSILON = 1e-9;

    public List<ScriptSection> validateAndOrder(List<ScriptSection> sections) {
        if (sections == null || sections.isEmpty()) {
            throw new CompositionConfigurationException("script.sections must contain at least one section.");
        }
        if (sections.size() > MAX_SECTIONS) {
            throw new CompositionConfigurationException(
                    "script.sections supports at most " + MAX_SECTIONS + " sections.");
        }

        Set<Integer> seenIndexes = new HashSet<>();
        double totalDurationSeconds = 0.0;
        for (int position = 0; position < sections.size(); position++) {
            ScriptSection section = sections.get(position);
            if (section == null) {
                throw new CompositionConfigurationException("script.sections[" + position + "] must not be null.");
            }
            if (section.index() < 0) {
                throw new CompositionConfigurationException(
                        "script.sections[" + position + "].index must be non-negative.");
            }
            if (!seenIndexes.add(section.index())) {
                throw new CompositionConfigurationException(
                        "script.sections[" + position + "].index " + section.index() + " is duplicated.");
            }

            double duration = section.targetDuration();
            if (!Double.isFinite(duration) || duration <= EPSILON) {
                throw new CompositionConfigurationException(
                        "script.sections[" + position + "].targetDuration must be a positive number.");
            }
            if (duration > MAX_SECTION_DURATION_SECONDS + EPSILON) {
                throw new CompositionConfigurationException(
                        "script.sections[" + position + "].targetDuration must be at most "
                                + MAX_SECTION_DURATION_SECONDS
                                + " seconds.");
            }
            totalDurationSeconds += duration;
        }

        if (totalDurationSeconds > MAX_TOTAL_DURATION_SECONDS + EPSILON) {
            throw new CompositionConfigurationException(
                    "Total script duration must be less than or equal to 36000 seconds.");
        }

        List<ScriptSection> ordered = new ArrayList<>(sections);
        ordered.sort(Comparator.comparingInt(ScriptSection::index));
        return List.copyOf(ordered);
    }
}
