package com.bcnjobs.tracker.scrape.registry;

import com.bcnjobs.tracker.config.TrackerProperties;
import com.bcnjobs.tracker.scrape.model.CompanyEntry;
import com.bcnjobs.tracker.scrape.model.SourceFamily;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Read-only list of companies and the feed each one is scraped from, loaded from
 * {@code tracker.registry.companies-csv}. Row order is preserved.
 */
@Component
public class CompanyRegistry {
    private static final Logger log = LoggerFactory.getLogger(CompanyRegistry.class);

    private final TrackerProperties properties;

    public CompanyRegistry(TrackerProperties properties) {
        this.properties = properties;
    }

    public List<CompanyEntry> companies() {
        Path path = resolvePath(properties.getRegistry().getCompaniesCsv());
        if (!Files.isRegularFile(path)) {
            log.error("Company registry not found at {}", path);
            return List.of();
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            log.error("Failed to read company registry at {}: {}", path, rootMessage(e));
            return List.of();
        }
    }

    public CompanyEntry findById(String companyId) {
        if (companyId == null || companyId.isBlank()) {
            return null;
        }
        for (CompanyEntry company : companies()) {
            if (company.id().equalsIgnoreCase(companyId.trim())) {
                return company;
            }
        }
        return null;
    }

    List<CompanyEntry> parse(Reader reader) throws IOException {
        List<CompanyEntry> out = new ArrayList<>();
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String id = getColumn(record, "id", "company_id");
                if (id == null) {
                    log.warn("Skipping registry row {} without id", record.getRecordNumber());
                    continue;
                }
                String rawFamily = getColumn(record, "source_family", "scraper_type", "platform");
                SourceFamily family = SourceFamily.fromValue(rawFamily);
                if (family == null && rawFamily != null) {
                    log.warn("Unknown source family '{}' for company {}; it will not be scraped", rawFamily, id);
                }
                out.add(new CompanyEntry(
                    id,
                    getColumn(record, "name"),
                    family,
                    getColumn(record, "source_identifier", "ats_id"),
                    parseBoolean(getColumn(record, "known_visa_sponsor")),
                    getColumn(record, "ethics_rating"),
                    getColumn(record, "notes")
                ));
            }
        }
        return List.copyOf(out);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name) && record.isSet(header)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private boolean parseBoolean(String raw) {
        if (raw == null) {
            return false;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("yes") || normalized.equals("1") || normalized.equals("y");
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath == null || configuredPath.isBlank() ? "companies.csv" : configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }

    private String rootMessage(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.toString() : current.getMessage();
    }
}
