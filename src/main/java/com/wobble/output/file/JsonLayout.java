package com.wobble.output.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wobble.output.report.JsonReport;

import java.io.IOException;
import java.io.Writer;

/**
 * Collects run info and per-unit results and writes one JSON document when the summary arrives.
 */
class JsonLayout implements RecordLayout {

    private final JsonReport report;
    private final ObjectMapper objectMapper;
    private final ArrayNode results;
    private ObjectNode runInfo;

    JsonLayout(JsonReport report, ObjectMapper objectMapper) {
        this.report = report;
        this.objectMapper = objectMapper;
        this.results = objectMapper.createArrayNode();
    }

    @Override
    public void write(WriteJob job, Writer out) throws IOException {
        switch (job.type()) {
            case RUN_STARTED -> runInfo = (ObjectNode) objectMapper.readTree(job.payload());
            case TEST_FINISHED -> {
                if (!job.payload().isEmpty()) {
                    results.add(objectMapper.readTree(job.payload()));
                }
            }
            case RUN_FINISHED -> {
                ObjectNode document = (ObjectNode) objectMapper.readTree(job.payload());
                if (runInfo != null) {
                    document.set("run_info", runInfo);
                }
                if (report.includesResults()) {
                    document.set("results", results);
                }
                out.write(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document));
                out.write(System.lineSeparator());
            }
            case TEST_STARTED -> {
            }
        }
    }
}
