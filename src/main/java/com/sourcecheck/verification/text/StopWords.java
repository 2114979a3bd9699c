package com.sourcecheck.verification.text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * English stopword list loaded from {@code stopwords.txt} on the classpath.
 */
@Component
public class StopWords {

    private static final Logger logger = LoggerFactory.getLogger(StopWords.class);
    static final String RESOURCE = "stopwords.txt";

    private final Set<String> words;

    public StopWords() {
        this.words = Collections.unmodifiableSet(load(RESOURCE));
        logger.debug("Loaded {} stopwords from {}", words.size(), RESOURCE);
    }

    public StopWords(Set<String> words) {
        Set<String> lower = new HashSet<>();
        for (String word : words) {
            lower.add(word.toLowerCase(Locale.ROOT));
        }
        this.words = Collections.unmodifiableSet(lower);
    }

    public boolean contains(String word) {
        return word != null && words.contains(word.toLowerCase(Locale.ROOT));
    }

    public int size() {
        return words.size();
    }

    static Set<String> load(String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new IllegalStateException("Stopword list not found on classpath: " + path);
        }
        String content;
        try (InputStream in = resource.getInputStream()) {
            content = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read stopword list " + path, e);
        }

        Set<String> loaded = new HashSet<>();
        for (String line : content.split("\\R")) {
            String word = line.trim();
            if (!word.isEmpty() && !word.startsWith("#")) {
                loaded.add(word.toLowerCase(Locale.ROOT));
            }
        }
        return loaded;
    }
}
