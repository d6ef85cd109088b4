package com.doctext.text.service;

import java.util.List;
import java.util.Optional;

import com.doctext.text.HtmlStripper;
import com.doctext.text.InvalidChunkConfigurationException;
import com.doctext.text.JsonGate;
import com.doctext.text.Keyword;
import com.doctext.text.KeywordExtractor;
import com.doctext.text.SimilarityScorer;
import com.doctext.text.Stopwords;
import com.doctext.text.TextChunker;
import com.doctext.text.TextMetrics;
import com.doctext.text.TextNormalizer;
import com.doctext.text.config.TextProcessingProperties;
import com.doctext.text.extract.EntityExtractors;
import com.doctext.text.extract.ExtractedEntities;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers holding already-extracted document text. Applies the
 * configured defaults and delegates to the stateless text utilities.
 */
@Service
public class TextAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TextAnalysisService.class);

    private final Stopwords stopwords;
    private final KeywordExtractor keywordExtractor;
    private final TextChunker defaultChunker;
    private final TextProcessingProperties properties;
    private final Counter chunkingRejected;
    private final Counter jsonInvalid;

    public TextAnalysisService(Stopwords stopwords,
                               KeywordExtractor keywordExtractor,
                               TextChunker defaultChunker,
                               TextProcessingProperties properties,
                               MeterRegistry metrics) {
        this.stopwords = stopwords;
        this.keywordExtractor = keywordExtractor;
        this.defaultChunker = defaultChunker;
        this.properties = properties;
        this.chunkingRejected = metrics.counter("doctext_chunking_rejected_total");
        this.jsonInvalid = metrics.counter("doctext_json_invalid_total");
    }

    @PostConstruct
    void logStopwords() {
        log.info("Loaded {} stopwords from {} (+{} extras)",
            stopwords.size(), properties.getStopwordsFile(), properties.getExtraStopwords().size());
    }

    public String normalize(String text) {
        return TextNormalizer.normalize(text);
    }

    public String stripHtml(String text) {
        return HtmlStripper.strip(text);
    }

    public ExtractedEntities extractEntities(String text) {
        ExtractedEntities entities = EntityExtractors.extractAll(text);
        if (log.isDebugEnabled()) {
            log.debug("Extracted entities from {} chars: dates={} money={} taxIds={} phones={} ceps={} emails={}",
                length(text), entities.dates().size(), entities.monetaryValues().size(), entities.taxIds().size(),
                entities.phoneNumbers().size(), entities.postalCodes().size(), entities.emails().size());
        }
        return entities;
    }

    public double similarity(String a, String b) {
        return SimilarityScorer.similarity(a, b);
    }

    public List<String> chunk(String text) {
        List<String> chunks = defaultChunker.chunk(text);
        log.debug("Chunked {} chars into {} chunks (size={}, overlap={})",
            length(text), chunks.size(), defaultChunker.getChunkSize(), defaultChunker.getChunkOverlap());
        return chunks;
    }

    /**
     * @throws InvalidChunkConfigurationException when the window cannot advance
     */
    public List<String> chunk(String text, int chunkSize, int chunkOverlap) {
        TextChunker chunker;
        try {
            chunker = new TextChunker(chunkSize, chunkOverlap);
        } catch (InvalidChunkConfigurationException e) {
            chunkingRejected.increment();
            log.warn("Rejected chunking request: {}", e.getMessage());
            throw e;
        }
        List<String> chunks = chunker.chunk(text);
        log.debug("Chunked {} chars into {} chunks (size={}, overlap={})",
            length(text), chunks.size(), chunkSize, chunkOverlap);
        return chunks;
    }

    public List<Keyword> keywords(String text) {
        return keywords(text, properties.getKeywordMinFrequency());
    }

    public List<Keyword> keywords(String text, int minFrequency) {
        List<Keyword> keywords = keywordExtractor.extract(text, minFrequency);
        log.debug("Found {} keywords with frequency >= {}", keywords.size(), minFrequency);
        return keywords;
    }

    public boolean isValidJson(String text) {
        boolean valid = JsonGate.isValidJson(text);
        if (!valid) jsonInvalid.increment();
        return valid;
    }

    public Optional<JsonNode> parseJson(String text) {
        Optional<JsonNode> parsed = JsonGate.parse(text);
        if (parsed.isEmpty()) jsonInvalid.increment();
        return parsed;
    }

    public String truncateForDisplay(String text) {
        return TextMetrics.truncateForDisplay(text, properties.getDisplayMaxLength());
    }

    public String summarize(String text) {
        return TextMetrics.summarize(text, properties.getSummaryMaxWords());
    }

    public int wordCount(String text) {
        return TextMetrics.wordCount(text);
    }

    public int charCount(String text, boolean includeSpaces) {
        return TextMetrics.charCount(text, includeSpaces);
    }

    private static int length(String text) {
        return text == null ? 0 : text.length();
    }
}
