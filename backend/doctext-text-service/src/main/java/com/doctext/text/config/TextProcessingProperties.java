package com.doctext.text.config;

import java.util.ArrayList;
import java.util.List;

import com.doctext.text.KeywordExtractor;
import com.doctext.text.Stopwords;
import com.doctext.text.TextChunker;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "doctext.text")
public class TextProcessingProperties {

    private int chunkSize = TextChunker.DEFAULT_CHUNK_SIZE;
    private int chunkOverlap = TextChunker.DEFAULT_CHUNK_OVERLAP;
    private int keywordMinFrequency = 2;
    private int keywordMinLength = KeywordExtractor.DEFAULT_MIN_TOKEN_LENGTH;
    private int displayMaxLength = 100;
    private int summaryMaxWords = 50;
    private String stopwordsFile = Stopwords.DEFAULT_FILE;
    private List<String> extraStopwords = new ArrayList<>();

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getChunkOverlap() {
        return chunkOverlap;
    }

    public void setChunkOverlap(int chunkOverlap) {
        this.chunkOverlap = chunkOverlap;
    }

    public int getKeywordMinFrequency() {
        return keywordMinFrequency;
    }

    public void setKeywordMinFrequency(int keywordMinFrequency) {
        this.keywordMinFrequency = keywordMinFrequency;
    }

    public int getKeywordMinLength() {
        return keywordMinLength;
    }

    public void setKeywordMinLength(int keywordMinLength) {
        this.keywordMinLength = keywordMinLength;
    }

    public int getDisplayMaxLength() {
        return displayMaxLength;
    }

    public void setDisplayMaxLength(int displayMaxLength) {
        this.displayMaxLength = displayMaxLength;
    }

    public int getSummaryMaxWords() {
        return summaryMaxWords;
    }

    public void setSummaryMaxWords(int summaryMaxWords) {
        this.summaryMaxWords = summaryMaxWords;
    }

    public String getStopwordsFile() {
        return stopwordsFile;
    }

    public void setStopwordsFile(String stopwordsFile) {
        this.stopwordsFile = stopwordsFile;
    }

    public List<String> getExtraStopwords() {
        return extraStopwords;
    }

    public void setExtraStopwords(List<String> extraStopwords) {
        this.extraStopwords = extraStopwords;
    }
}
