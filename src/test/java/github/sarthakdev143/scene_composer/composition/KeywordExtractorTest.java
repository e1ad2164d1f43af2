package github.sarthakdev143.scene_composer.composition;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordExtractorTest {

    @Test
    void tokensAreLowerCasedAndStripped() {
        assertThat(KeywordExtractor.tokens("Mind-blowing!  'Quoted' words -"))
                .containsExactly("mind-blowing", "quoted", "words");
    }

    @Test
    void keywordsDropStopWordsAndShortTokensAndKeepFirstOccurrenceOrder() {
        assertThat(KeywordExtractor.keywords(10, "The galaxy and the stars", "galaxy of light"))
                .containsExactly("galaxy", "stars", "light");
    }

    @Test
    void keywordsRespectLimit() {
        assertThat(KeywordExtractor.keywords(2, "alpha beta gamma delta")).containsExactly("alpha", "beta");
    }

    @Test
    void containsTermMatchesWholeWordsAndPhrases() {
        String text = KeywordExtractor.normalizedText("This changes everything, step by step.");

        assertThat(KeywordExtractor.containsTerm(text, "changes everything")).isTrue();
        assertThat(KeywordExtractor.containsTerm(text, "step by step")).isTrue();
        assertThat(KeywordExtractor.containsTerm(text, "change")).isFalse();
        assertThat(KeywordExtractor.containsTerm(text, " ")).isFalse();
    }
}
