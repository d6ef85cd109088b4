package com.doctext.text.config;

import java.util.HashSet;
import java.util.Optional;

import com.doctext.text.KeywordExtractor;
import com.doctext.text.Stopwords;
import com.doctext.text.TextChunker;
import com.doctext.text.Tokenizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TextProcessingConfig {

    private final TextProcessingProperties properties;

    public TextProcessingConfig(TextProcessingProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Stopwords stopwords() {
        boolean bundled = Stopwords.DEFAULT_FILE.equals(properties.getStopwordsFile());
        if (bundled && properties.getExtraStopwords().isEmpty()) {
            return Stopwords.portuguese();
        }
        return Stopwords.load(Optional.ofNullable(properties.getStopwordsFile()),
            new HashSet<>(properties.getExtraStopwords()));
    }

    @Bean
    public KeywordExtractor keywordExtractor(Stopwords stopwords) {
        return new KeywordExtractor(new Tokenizer(stopwords, properties.getKeywordMinLength()));
    }

    // fails startup on an unusable window configuration
    @Bean
    public TextChunker textChunker() {
        return new TextChunker(properties.getChunkSize(), properties.getChunkOverlap());
    }
}
