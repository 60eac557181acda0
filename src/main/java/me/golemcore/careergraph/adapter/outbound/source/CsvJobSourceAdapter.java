/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.careergraph.adapter.outbound.source;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.careergraph.domain.exception.GraphException;
import me.golemcore.careergraph.domain.model.CanonicalJobRow;
import me.golemcore.careergraph.infrastructure.config.CareerGraphProperties;
import me.golemcore.careergraph.port.outbound.JobSourcePort;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the canonical job dataset from a CSV file with the header
 * {@code job_id,title,company,required_skills}. Extra columns are ignored.
 *
 * <p>
 * Location configured via {@code careergraph.reconciliation.source-path}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CsvJobSourceAdapter implements JobSourcePort {

    static final String JOB_ID = "job_id";
    static final String TITLE = "title";
    static final String COMPANY = "company";
    static final String REQUIRED_SKILLS = "required_skills";

    private static final List<String> REQUIRED_COLUMNS = List.of(JOB_ID, TITLE, COMPANY, REQUIRED_SKILLS);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final CareerGraphProperties properties;

    @Override
    public List<CanonicalJobRow> loadJobs() {
        Path source = Paths.get(properties.getReconciliation().getSourcePath()).toAbsolutePath();
        if (!Files.isRegularFile(source)) {
            throw GraphException.sourceInvalid("Job source not found: " + source);
        }
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            List<CanonicalJobRow> rows = parse(reader);
            log.info("[Source] Loaded {} job rows from {}", rows.size(), source);
            return rows;
        } catch (IOException | UncheckedIOException e) {
            throw GraphException.sourceInvalid("Failed to read job source " + source + ": " + e.getMessage(), e);
        }
    }

    List<CanonicalJobRow> parse(Reader reader) throws IOException {
        try (CSVParser parser = FORMAT.parse(reader)) {
            List<String> header = parser.getHeaderNames();
            for (String column : REQUIRED_COLUMNS) {
                if (!header.contains(column)) {
                    throw GraphException.sourceInvalid("Job source is missing column '" + column + "'");
                }
            }

            List<CanonicalJobRow> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                String jobId = value(record, JOB_ID);
                String company = value(record, COMPANY);
                if (jobId.isEmpty() || company.isEmpty()) {
                    throw GraphException.sourceInvalid(
                            "Row " + record.getRecordNumber() + " lacks job_id or company");
                }
                rows.add(new CanonicalJobRow(jobId, value(record, TITLE), company, value(record, REQUIRED_SKILLS)));
            }
            if (rows.isEmpty()) {
                throw GraphException.sourceInvalid("Job source is empty");
            }
            return rows;
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw GraphException.sourceInvalid("Malformed job source: " + e.getMessage(), e);
        }
    }

    private static String value(CSVRecord record, String column) {
        if (!record.isSet(column)) {
            return "";
        }
        String value = record.get(column);
        return value != null ? value.trim() : "";
    }
}
