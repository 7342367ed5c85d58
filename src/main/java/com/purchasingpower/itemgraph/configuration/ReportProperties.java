package com.purchasingpower.itemgraph.configuration;

import lombok.Data;

@Data
public class ReportProperties {

    /** Where the JSON report is written. Blank disables writing. */
    private String outputPath = "target/ingestion-report.json";
}
