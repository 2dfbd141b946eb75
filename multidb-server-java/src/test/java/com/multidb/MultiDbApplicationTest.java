package com.multidb;

import com.multidb.service.SourceRegistry;
import com.multidb.service.TemplateDispatcher;
import com.multidb.service.ToolService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class MultiDbApplicationTest {

    @Autowired
    private SourceRegistry sourceRegistry;

    @Autowired
    private TemplateDispatcher templateDispatcher;

    @Autowired
    private ToolService toolService;

    @Test
    void bundledSourcesAreConfiguredWithoutConnecting() {
        assertThat(sourceRegistry.getSourceNames()).containsExactly("school_erp", "chinook", "sakila");
        assertThat(sourceRegistry.getProfile("chinook").get().getKeywords()).contains("album", "artist");
        assertThat(sourceRegistry.getConnectionSettings("sakila").get().getPort()).isEqualTo(3306);
    }

    @Test
    void everySourceHasAStatementCatalog() {
        for (String source : sourceRegistry.getSourceNames()) {
            assertThat(templateDispatcher.getCatalog(source)).as(source).isPresent();
        }
    }

    @Test
    void databasesToolAnswersFromConfiguration() {
        assertThat(toolService.invoke("databases", null)).containsEntry("total", 3);
    }
}
