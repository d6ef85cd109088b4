package com.doctext.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.apache.lucene.analysis.CharArraySet;

/**
 * Immutable stopword table. Entries are kept as written in the list file
 * (accents included) and compared against tokens verbatim.
 */
public final class Stopwords {

    public static final String DEFAULT_FILE = "/stopwords-pt.txt";

    private final CharArraySet merged;

    private Stopwords(CharArraySet merged) {
        this.merged = merged;
    }

    /** The bundled Portuguese list, loaded once on first use. */
    public static Stopwords portuguese() {
        return Holder.PORTUGUESE;
    }

    public static Stopwords load(Optional<String> classpathFile, Set<String> runtimeExtras) {
        Set<String> out = new LinkedHashSet<>();

        classpathFile.ifPresent(path -> out.addAll(readList(path)));

        if (runtimeExtras != null) {
            runtimeExtras.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.strip().toLowerCase(Locale.ROOT))
                .forEach(out::add);
        }

        return new Stopwords(CharArraySet.unmodifiableSet(new CharArraySet(out, false)));
    }

    private static Set<String> readList(String path) {
        Set<String> words = new LinkedHashSet<>();
        try (InputStream in = Stopwords.class.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Stopword list not found on classpath: " + path);
            }
            try (var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.strip();
                    if (!line.isEmpty() && !line.startsWith("#")) {
                        words.add(line.toLowerCase(Locale.ROOT));
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read stopword list: " + path, e);
        }
        return words;
    }

    public boolean contains(String token) {
        return token != null && merged.contains(token);
    }

    public int size() {
        return merged.size();
    }

    private static final class Holder {
        private static final Stopwords PORTUGUESE = load(Optional.of(DEFAULT_FILE), Set.of());
    }
}
