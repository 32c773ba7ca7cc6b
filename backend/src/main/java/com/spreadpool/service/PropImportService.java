package com.spreadpool.service;

import com.spreadpool.dto.PropImportResult;
import com.spreadpool.model.PropBet;
import com.spreadpool.model.PropDomain;
import com.spreadpool.model.PropOutcome;
import com.spreadpool.model.Week;
import com.spreadpool.repository.PropBetRepository;
import com.spreadpool.repository.WeekRepository;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads proposition bets for a week from CSV with header
 * {@code game_label,description,option_a,option_b}. Bad rows are reported and skipped.
 */
@Service
public class PropImportService {
    private static final Logger log = LoggerFactory.getLogger(PropImportService.class);

    private final WeekRepository weekRepository;
    private final PropBetRepository propBetRepository;

    public PropImportService(WeekRepository weekRepository, PropBetRepository propBetRepository) {
        this.weekRepository = weekRepository;
        this.propBetRepository = propBetRepository;
    }

    @Transactional
    public PropImportResult importCsv(int seasonYear, int weekNumber, String csv) {
        return importCsv(seasonYear, weekNumber, new StringReader(csv == null ? "" : csv));
    }

    @Transactional
    public PropImportResult importCsv(int seasonYear, int weekNumber, Reader reader) {
        Week week = weekRepository.findBySeasonYearAndWeekNumber(seasonYear, weekNumber)
                .orElseThrow(() -> new IllegalArgumentException("Unknown week " + seasonYear + "-W" + weekNumber));
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
        List<PropBet> toSave = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int total = 0;
        try (CSVParser parser = new CSVParser(reader, fmt)) {
            int rowNum = 1; // header
            for (CSVRecord rec : parser) {
                rowNum++;
                total++;
                try {
                    String label = opt(rec, "game_label");
                    String description = get(rec, "description");
                    PropOutcome a = outcome(get(rec, "option_a"));
                    PropOutcome b = outcome(get(rec, "option_b"));
                    PropDomain domain = PropDomain.of(a, b)
                            .orElseThrow(() -> new IllegalArgumentException("Options " + a + "/" + b + " are not a supported pair"));
                    toSave.add(new PropBet(week, label, description, domain));
                } catch (IllegalArgumentException e) {
                    errors.add("Row " + rowNum + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read prop CSV", e);
        }
        propBetRepository.saveAll(toSave);
        log.info("Imported {} props for {} ({} rows, {} errors)", toSave.size(), week.label(), total, errors.size());
        return PropImportResult.of(total, toSave.size(), errors);
    }

    private static PropOutcome outcome(String raw) {
        return PropOutcome.parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown option: " + raw));
    }

    private static String get(CSVRecord rec, String key) {
        String v = opt(rec, key);
        if (v == null || v.isBlank()) throw new IllegalArgumentException("Missing required column: " + key);
        return v;
    }

    private static String opt(CSVRecord rec, String key) {
        if (!rec.isMapped(key) || !rec.isSet(key)) return null;
        String v = rec.get(key);
        return v == null ? null : v.trim();
    }
}
