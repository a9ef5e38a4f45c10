package com.confer.mortgageServer.ingestion.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionConfigTest {

    @Test
    void parsesCommaSeparatedDomains() {
        assertThat(IngestionConfig.parseDomains(" storage.googleapis.com , s3.amazonaws.com,,mortgage-docs.confer.ai "))
                .containsExactlyInAnyOrder("storage.googleapis.com", "s3.amazonaws.com", "mortgage-docs.confer.ai");
    }

    @Test
    void emptySettingAllowsNothing() {
        assertThat(IngestionConfig.parseDomains("")).isEmpty();
    }

    @Test
    void duplicatesCollapse() {
        assertThat(IngestionConfig.parseDomains("s3.amazonaws.com,s3.amazonaws.com")).containsExactly("s3.amazonaws.com");
    }
}
