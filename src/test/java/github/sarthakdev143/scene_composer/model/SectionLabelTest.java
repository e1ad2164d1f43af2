package github.sarthakdev143.scene_composer.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SectionLabelTest {

    @Test
    void resolvesExplicitLabelsAndAliases() {
        assertThat(SectionLabel.resolve("HOOK", null)).isEqualTo(SectionLabel.HOOK);
        assertThat(SectionLabel.resolve("main content", null)).isEqualTo(SectionLabel.MAIN_CONTENT);
        assertThat(SectionLabel.resolve("call-to-action", null)).isEqualTo(SectionLabel.CALL_TO_ACTION);
        assertThat(SectionLabel.resolve("cta", null)).isEqualTo(SectionLabel.CALL_TO_ACTION);
        assertThat(SectionLabel.resolve("Outro", null)).isEqualTo(SectionLabel.SUMMARY);
    }

    @Test
    void fallsBackToKeywordsInSectionName() {
        assertThat(SectionLabel.resolve(null, "Historical background")).isEqualTo(SectionLabel.BACKGROUND);
        assertThat(SectionLabel.resolve("unknown", "Quick recap")).isEqualTo(SectionLabel.SUMMARY);
    }

    @Test
    void nameKeywordsMatchWholeWordsOnly() {
        assertThat(SectionLabel.resolve(null, "Domain overview")).isEqualTo(SectionLabel.INTRODUCTION);
        assertThat(SectionLabel.resolve(null, "Transaction costs")).isEqualTo(SectionLabel.CUSTOM);
        assertThat(SectionLabel.resolve(null, "Please subscribe!")).isEqualTo(SectionLabel.CALL_TO_ACTION);
        assertThat(SectionLabel.resolve(null, "Wrap up")).isEqualTo(SectionLabel.SUMMARY);
    }

    @Test
    void unknownInputIsCustom() {
        assertThat(SectionLabel.resolve("interlude", "Musical break")).isEqualTo(SectionLabel.CUSTOM);
        assertThat(SectionLabel.resolve(null, null)).isEqualTo(SectionLabel.CUSTOM);
    }
}
