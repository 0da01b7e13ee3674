package com.contractlink.harvester.harvest.normalize;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps codes, full names and "City, ST 12345" style locations to a two-letter code for the 50
 * states and DC. Input that does not map exactly yields empty.
 */
@Component
public class StateNormalizer {
    static final String STATES_RESOURCE = "/reference/states.csv";

    private static final Set<String> DC_ALIASES = Set.of(
        "washington dc",
        "washington d c",
        "district of columbia",
        "d c",
        "dc"
    );
    private static final Pattern TRAILING_ZIP = Pattern.compile("\\s+\\d{5}(?:-\\d{4})?$");
    private static final Pattern NON_NAME_CHARS = Pattern.compile("[^a-z ]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<String, String> namesByCode;
    private final Map<String, String> codesByName;

    public StateNormalizer() {
        this(STATES_RESOURCE);
    }

    StateNormalizer(String resource) {
        Map<String, String> names = new LinkedHashMap<>();
        Map<String, String> codes = new LinkedHashMap<>();
        try (InputStream in = StateNormalizer.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("state table not found on classpath: " + resource);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
                 CSVParser parser = csvParser(reader)) {
                for (CSVRecord record : parser) {
                    String code = record.get("code").trim().toUpperCase(Locale.ROOT);
                    String name = record.get("name").trim();
                    names.put(code, name);
                    codes.put(nameKey(name), code);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to load state table " + resource, e);
        }
        this.namesByCode = Collections.unmodifiableMap(names);
        this.codesByName = Collections.unmodifiableMap(codes);
    }

    public Optional<String> toCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String direct = lookup(raw);
        if (direct != null) {
            return Optional.of(direct);
        }
        int comma = raw.lastIndexOf(',');
        if (comma >= 0 && comma < raw.length() - 1) {
            String tail = TRAILING_ZIP.matcher(raw.substring(comma + 1).trim()).replaceFirst("");
            String fromTail = lookup(tail);
            if (fromTail != null) {
                return Optional.of(fromTail);
            }
        }
        return Optional.empty();
    }

    public Optional<String> nameFor(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(namesByCode.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    public boolean isKnownCode(String code) {
        return code != null && namesByCode.containsKey(code.trim().toUpperCase(Locale.ROOT));
    }

    public Set<String> codes() {
        return namesByCode.keySet();
    }

    private String lookup(String candidate) {
        String trimmed = TRAILING_ZIP.matcher(candidate.trim()).replaceFirst("");
        if (trimmed.length() == 2) {
            String code = trimmed.toUpperCase(Locale.ROOT);
            if (namesByCode.containsKey(code)) {
                return code;
            }
        }
        String key = nameKey(trimmed);
        if (DC_ALIASES.contains(key)) {
            return "DC";
        }
        return codesByName.get(key);
    }

    private static String nameKey(String value) {
        String lower = value.toLowerCase(Locale.ROOT).replace('.', ' ');
        Matcher cleaned = NON_NAME_CHARS.matcher(lower);
        return WHITESPACE.matcher(cleaned.replaceAll(" ")).replaceAll(" ").trim();
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }
}
