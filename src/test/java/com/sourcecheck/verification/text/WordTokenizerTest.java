package com.sourcecheck.verification.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WordTokenizerTest {

    private final StopWords stopWords = new StopWords();

    @Test
    void testTokenize_DefaultFilters() {
        WordTokenizer tokenizer = WordTokenizer.builder(stopWords).removeOneLetter(true).build();

        List<WordTokenizer.Term> terms = tokenizer.tokenize("The Tenant shall pay a deposit of 1,500.");

        assertThat(terms).extracting(WordTokenizer.Term::getText)
                .containsExactly("tenant", "pay", "deposit", "1500");
        assertThat(terms).extracting(WordTokenizer.Term::getTokenIndex).containsExactly(1, 3, 5, 7);
    }

    @Test
    void testTokenize_KeepsCaseAndStopWordsWhenDisabled() {
        WordTokenizer tokenizer = WordTokenizer.builder(stopWords)
                .lowerCase(false)
                .removeStopWords(false)
                .build();

        List<WordTokenizer.Term> terms = tokenizer.tokenize("The 2 Parties: agree");

        assertThat(terms).extracting(WordTokenizer.Term::getText).containsExactly("The", "2", "Parties", "agree");
    }

    @Test
    void testTokenize_PunctuationKeptWhenDisabled() {
        WordTokenizer tokenizer = WordTokenizer.builder(stopWords).removePunctuation(false).build();

        assertThat(tokenizer.tokenize("Total: $50,000.00")).extracting(WordTokenizer.Term::getText)
                .containsExactly("total:", "$50,000.00");
    }

    @Test
    void testStopWords_LoadedFromClasspath() {
        assertThat(stopWords.size()).isGreaterThan(100);
        assertThat(stopWords.contains("The")).isTrue();
        assertThat(stopWords.contains("ten")).isFalse();
        assertThat(stopWords.contains("percent")).isFalse();
    }

    @Test
    void testStopWords_MissingListFailsFast() {
        assertThatThrownBy(() -> StopWords.load("no-such-stopwords.txt"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("no-such-stopwords.txt");
    }

    @Test
    void testTokenOffsetIndex_JoinClampsBounds() {
        TokenOffsetIndex index = TokenOffsetIndex.of("  alpha\tbeta\n gamma ");

        assertThat(index.size()).isEqualTo(3);
        assertThat(index.get(1).getStart()).isEqualTo(8);
        assertThat(index.join(-5, 50)).isEqualTo("alpha beta gamma");
        assertThat(index.join(1, 2)).isEqualTo("beta");
    }
}
