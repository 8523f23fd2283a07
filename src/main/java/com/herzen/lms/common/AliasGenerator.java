package com.herzen.lms.common;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntSupplier;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Builds URL-safe slugs from titles and disambiguates them against existing aliases.
 */
@Component
public class AliasGenerator {
    static final int MAX_RANDOM_TRIES = 1000;

    private static final Pattern INVALID_CHARS = Pattern.compile("[^\\w\\s-]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DASHES = Pattern.compile("-+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    private final IntSupplier suffixSource;

    public AliasGenerator() {
        this(() -> ThreadLocalRandom.current().nextInt(1000));
    }

    AliasGenerator(IntSupplier suffixSource) {
        this.suffixSource = suffixSource;
    }

    public static String normalize(String title) {
        if (title == null || title.isEmpty()) return "";
        String alias = title.toLowerCase(Locale.ROOT);
        alias = INVALID_CHARS.matcher(alias).replaceAll("");
        alias = WHITESPACE.matcher(alias).replaceAll("-");
        alias = DASHES.matcher(alias).replaceAll("-");
        return EDGE_DASHES.matcher(alias).replaceAll("");
    }

    public String uniqueAlias(String title, Predicate<String> exists) {
        String base = normalize(title);
        if (!exists.test(base)) return base;
        for (int i = 0; i < MAX_RANDOM_TRIES; i++) {
            String candidate = base + "-" + suffixSource.getAsInt();
            if (!exists.test(candidate)) return candidate;
        }
        return base + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
