package github.sarthakdev143.scene_composer.model.rules;

import github.sarthakdev143.scene_composer.model.SectionLabel;

public record LabelPair(SectionLabel from, SectionLabel to) {
}
