package com.forumprep.cli;

import com.forumprep.util.dom.DomMetrics;

import java.time.Instant;
import java.util.List;

/**
 * JSON report of one CLI run.
 */
public class FlattenReport {
    public String inputFile;
    public String outputFile;
    public List<String> phases;
    public Instant processedAt;
    public DomMetrics metrics;

    public FlattenReport() {
    }

    public FlattenReport(String inputFile, String outputFile, List<String> phases,
                         Instant processedAt, DomMetrics metrics) {
        this.inputFile = inputFile;
        this.outputFile = outputFile;
        this.phases = phases;
        this.processedAt = processedAt;
        this.metrics = metrics;
    }
}
