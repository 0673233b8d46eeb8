package com.prospectenhancer.common;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical NAICS 2022 code to description table. Descriptions shown to users always come from here,
 * never from model output.
 */
@Slf4j
@Component
public class NaicsCatalog {

    static final String DEFAULT_RESOURCE = "naics/naics-2022.tsv";

    private static final Pattern SIX_DIGITS = Pattern.compile("\\d{6}");
    private static final Set<String> PLACEHOLDERS = Set.of("TBD", "TO BE DETERMINED", "N/A", "NA");

    private final Map<String, String> descriptions;

    public NaicsCatalog() {
        this(DEFAULT_RESOURCE);
    }

    NaicsCatalog(String resource) {
        this.descriptions = Collections.unmodifiableMap(load(resource));
        log.debug("Loaded {} NAICS codes from {}", descriptions.size(), resource);
    }

    /**
     * Description for a code. Non-digits are stripped first; placeholders and anything that is not
     * six digits resolve to empty.
     */
    public Optional<String> describe(String code) {
        if (code == null || code.isBlank() || isPlaceholder(code)) {
            return Optional.empty();
        }
        String digits = code.replaceAll("\\D", "");
        if (digits.length() != 6) {
            log.warn("Invalid NAICS code format: {}", code);
            return Optional.empty();
        }
        return Optional.ofNullable(descriptions.get(digits));
    }

    /** True when the code is exactly six digits and present in the table. */
    public boolean isValid(String code) {
        if (code == null) {
            return false;
        }
        String trimmed = code.strip();
        return SIX_DIGITS.matcher(trimmed).matches() && descriptions.containsKey(trimmed);
    }

    public int size() {
        return descriptions.size();
    }

    public static boolean isPlaceholder(String value) {
        return value != null && PLACEHOLDERS.contains(value.strip().toUpperCase());
    }

    private static Map<String, String> load(String resource) {
        Map<String, String> map = new HashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                new ClassPathResource(resource).getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                int tab = line.indexOf('\t');
                if (tab == 6) {
                    map.put(line.substring(0, tab), line.substring(tab + 1).strip());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load NAICS table " + resource, e);
        }
        return map;
    }
}
