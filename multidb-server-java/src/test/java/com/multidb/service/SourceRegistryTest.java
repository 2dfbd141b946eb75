package com.multidb.service;

import com.multidb.config.MultiDbProperties;
import org.junit.jupiter.api.Test;

import static com.multidb.service.TestSources.CHINOOK;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceRegistryTest {

    @Test
    void keywordsAreLowercasedAndDeduplicated() {
        SourceRegistry registry = TestSources.registry(
            TestSources.source("sakila", "Movie Rental", "Film", "actor", "ACTOR"));

        assertThat(registry.getProfile("sakila").get().getKeywords()).containsExactly("film", "actor");
    }

    @Test
    void missingDescriptionAndKeywordsBecomeEmpty() {
        MultiDbProperties.Source bare = TestSources.source("archive", null);
        bare.setKeywords(null);

        SourceRegistry registry = TestSources.registry(bare);

        assertThat(registry.getDescription("archive")).isEmpty();
        assertThat(registry.getProfile("archive").get().getKeywords()).isEmpty();
        assertThat(registry.describe(registry.getSourceNames())).isEqualTo("archive ()");
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThatThrownBy(() -> TestSources.registry(
            TestSources.source(CHINOOK, "Music Store"),
            TestSources.source(CHINOOK, "Music Store copy")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Duplicate source name: chinook");
    }

    @Test
    void unknownSourceHasNoSettings() {
        SourceRegistry registry = TestSources.registry();

        assertThat(registry.contains("warehouse")).isFalse();
        assertThat(registry.getConnectionSettings("warehouse")).isEmpty();
        assertThat(registry.getDescription("warehouse")).isEmpty();
    }
}
