package com.demo.loanmodel.dataset;

import com.demo.loanmodel.exception.DatasetNotFoundException;
import com.demo.loanmodel.exception.DatasetReadException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Component
public class DatasetLoader {

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    /**
     * Reads the whole CSV into memory. The first record is the header; its names are trimmed.
     * Cell values are kept verbatim.
     */
    public LoanTable load(Path path) {
        if (!Files.exists(path)) {
            throw new DatasetNotFoundException(path);
        }

        List<String[]> records;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = csvMapper.readerFor(String[].class).readValues(reader)) {
            records = it.readAll();
        } catch (IOException e) {
            throw new DatasetReadException(path, e);
        }

        if (records.isEmpty()) {
            log.warn("Dataset {} has no header row", path);
            return LoanTable.of(List.of(), List.of());
        }

        List<String> header = Arrays.stream(records.get(0))
                .map(h -> h == null ? "" : h.replace("\uFEFF", "").strip())
                .toList();
        Set<String> seen = new HashSet<>();
        for (String name : header) {
            if (!seen.add(name)) {
                throw new DatasetReadException(path, "duplicate column '" + name + "' in header");
            }
        }

        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        int overlong = 0;
        for (String[] r : records.subList(1, records.size())) {
            if (r.length > header.size()) overlong++;
            rows.add(Arrays.asList(r));
        }
        if (overlong > 0) {
            log.warn("{} rows in {} have more cells than the {} header columns; extra cells are ignored",
                    overlong, path, header.size());
        }

        LoanTable table = LoanTable.of(header, rows);
        log.info("Loaded dataset with {} records and {} columns", table.rowCount(), header.size());
        return table;
    }
}
