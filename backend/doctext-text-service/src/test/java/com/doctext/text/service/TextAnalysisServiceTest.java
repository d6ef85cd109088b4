package com.doctext.text.service;

import com.doctext.text.InvalidChunkConfigurationException;
import com.doctext.text.Keyword;
import com.doctext.text.KeywordExtractor;
import com.doctext.text.Stopwords;
import com.doctext.text.TextChunker;
import com.doctext.text.config.TextProcessingProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TextAnalysisServiceTest {

    private SimpleMeterRegistry metrics;
    private TextAnalysisService service;

    @BeforeEach
    void setUp() {
        metrics = new SimpleMeterRegistry();
        TextProcessingProperties properties = new TextProcessingProperties();
        properties.setDisplayMaxLength(8);
        properties.setSummaryMaxWords(2);
        service = new TextAnalysisService(Stopwords.portuguese(), new KeywordExtractor(),
            new TextChunker(10, 0), properties, metrics);
    }

    @Test
    void appliesConfiguredDefaults() {
        assertThat(service.keywords("casa casa carro casa carro avião"))
            .containsExactly(new Keyword("casa", 3), new Keyword("carro", 2));
        assertThat(service.chunk("aaaa bbbb cccc dddd")).containsExactly("aaaa bbbb", "cccc dddd");
        assertThat(service.truncateForDisplay("documento longo")).isEqualTo("docum...");
        assertThat(service.summarize("um dois tres")).isEqualTo("um dois...");
    }

    @Test
    void explicitChunkSettingsOverrideDefaults() {
        assertThat(service.chunk("aaaa bbbb cccc dddd", 100, 10)).containsExactly("aaaa bbbb cccc dddd");
    }

    @Test
    void rejectedChunkSettingsAreCountedAndRethrown() {
        assertThatThrownBy(() -> service.chunk("texto", 5, 5)).isInstanceOf(InvalidChunkConfigurationException.class);
        assertThat(metrics.counter("doctext_chunking_rejected_total").count()).isEqualTo(1.0);
    }

    @Test
    void invalidJsonIsCounted() {
        assertThat(service.isValidJson("{\"a\":1}")).isTrue();
        assertThat(service.isValidJson("{a:1}")).isFalse();
        assertThat(service.parseJson("not json")).isEmpty();
        assertThat(metrics.counter("doctext_json_invalid_total").count()).isEqualTo(2.0);
    }

    @Test
    void delegatesToTextUtilities() {
        assertThat(service.normalize("Órgão Público")).isEqualTo("orgao publico");
        assertThat(service.stripHtml("<b>oi</b>&nbsp;")).isEqualTo("oi");
        assertThat(service.similarity("abc", "abc")).isEqualTo(1.0);
        assertThat(service.wordCount("um dois")).isEqualTo(2);
        assertThat(service.charCount("um dois", false)).isEqualTo(6);
        assertThat(service.extractEntities("Pagamento em 15/01/2024").dates()).containsExactly("15/01/2024");
    }
}
