package com.nlfhir.clinical.extraction;

import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered, de-duplicated word list loaded from a classpath text file.
 *
 * <p>Format: one entry per line, blank lines and lines starting with {@code #} ignored,
 * entries lower-cased. The matching code stays generic over the table so the tables can be
 * extended without touching control flow.</p>
 */
public final class Lexicon {

    public static final String BASE_PATH = "lexicons/";

    private final String name;
    private final List<String> entries;
    private final Set<String> lookup;

    private Lexicon(String name, List<String> entries) {
        this.name = name;
        this.entries = List.copyOf(entries);
        this.lookup = Set.copyOf(entries);
    }

    public static Lexicon of(String name, List<String> entries) {
        return new Lexicon(name, entries.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .filter(e -> !e.isEmpty())
                .distinct()
                .toList());
    }

    /**
     * Loads {@code lexicons/<name>.txt} from the classpath.
     *
     * @throws IllegalStateException if the resource is missing or empty
     */
    public static Lexicon load(String name) {
        ClassPathResource resource = new ClassPathResource(BASE_PATH + name + ".txt");
        if (!resource.exists()) {
            throw new IllegalStateException("Lexicon resource not found: " + resource.getPath());
        }
        Set<String> entries = new LinkedHashSet<>();
        try (InputStream in = resource.getInputStream();
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String entry = line.trim();
                if (!entry.isEmpty() && !entry.startsWith("#")) {
                    entries.add(entry.toLowerCase(Locale.ROOT));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read lexicon " + name, e);
        }
        if (entries.isEmpty()) {
            throw new IllegalStateException("Lexicon " + name + " is empty");
        }
        return new Lexicon(name, List.copyOf(entries));
    }

    public String name() {
        return name;
    }

    public List<String> entries() {
        return entries;
    }

    public boolean contains(String word) {
        return word != null && lookup.contains(word.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * First entry that occurs as a plain substring of {@code lowerText}, or null.
     */
    public String firstContainedIn(String lowerText) {
        for (String entry : entries) {
            if (lowerText.contains(entry)) {
                return entry;
            }
        }
        return null;
    }

    /**
     * Regex alternation of all entries, quoted, with internal spaces relaxed to {@code \s+}.
     * Entry order is preserved so longer phrases listed first win.
     */
    public String alternation() {
        return entries.stream()
                .map(entry -> Pattern.quote(entry).replace(" ", "\\E\\s+\\Q"))
                .collect(Collectors.joining("|"));
    }

    /**
     * Case-insensitive whole-phrase pattern capturing any entry in group 1.
     */
    public Pattern wholePhrasePattern() {
        return Pattern.compile("\\b(" + alternation() + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "Lexicon[" + name + ", " + entries.size() + " entries]";
    }
}
