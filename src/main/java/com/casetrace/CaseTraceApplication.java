package com.casetrace;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Case-scoped security log ingestion and search.
 *
 * Uploaded event logs, EDR exports, firewall CSVs and generic JSON are
 * normalized into one OpenSearch index per case. A scheduled repair pass keeps
 * per-file processing state consistent with the task queue and the indices.
 */
@SpringBootApplication
@EnableScheduling
public class CaseTraceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaseTraceApplication.class, args);
    }
}
