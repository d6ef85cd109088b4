package com.doctext.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class TextNormalizerTest {

    @Test
    void stripsAccentsAndLowercases() {
        assertThat(TextNormalizer.normalize("Ação Judicial: AVIÃO, Pêssego!")).isEqualTo("acao judicial aviao pessego");
    }

    @Test
    void punctuationAndWhitespaceCollapseToSingleSpaces() {
        assertThat(TextNormalizer.normalize("  R$ 1.234,56\t-\n(CNPJ)  ")).isEqualTo("r 1 234 56 cnpj");
    }

    @Test
    void emptyAndNullGiveEmpty() {
        assertThat(TextNormalizer.normalize("")).isEmpty();
        assertThat(TextNormalizer.normalize(null)).isEmpty();
        assertThat(TextNormalizer.normalize(" ¡¿ ")).isEmpty();
    }

    @Test
    void nonLatinLettersBecomeSeparators() {
        assertThat(TextNormalizer.normalize("straße 東京 rua")).isEqualTo("stra e rua");
    }

    @Test
    void normalizingTwiceChangesNothing() {
        List<String> samples = List.of(
            "Nota Fiscal Eletrônica de Serviço – Nº 000.123",
            "ÇÃÕ éèê  mixed\r\nLINES",
            "é combined marks",
            "already normal text 123");
        for (String sample : samples) {
            String once = TextNormalizer.normalize(sample);
            assertThat(TextNormalizer.normalize(once)).isEqualTo(once);
            assertThat(once).matches("[a-z0-9 ]*").doesNotStartWith(" ").doesNotEndWith(" ").doesNotContain("  ");
        }
    }
}
