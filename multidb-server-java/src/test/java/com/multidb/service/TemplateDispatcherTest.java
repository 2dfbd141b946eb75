package com.multidb.service;

import com.multidb.model.QueryTemplate;
import com.multidb.model.SearchType;
import com.multidb.service.catalog.SourceCatalog;
import org.junit.jupiter.api.Test;

import static com.multidb.service.TestSources.CHINOOK;
import static com.multidb.service.TestSources.SAKILA;
import static com.multidb.service.TestSources.SCHOOL;
import static org.assertj.core.api.Assertions.assertThat;

class TemplateDispatcherTest {

    private final TemplateDispatcher dispatcher = TestSources.dispatcher();

    @Test
    void studentsPerClassAreGroupedByClassAndSection() {
        String sql = dispatcher.buildStatement(SCHOOL, "How many students are in class 10?");

        assertThat(sql).contains("GROUP BY cs.class_number, cs.section").endsWith("LIMIT 50");
    }

    @Test
    void plainStudentCountIsASingleTotal() {
        assertThat(dispatcher.buildStatement(SCHOOL, "how many students do we have"))
            .isEqualTo("SELECT COUNT(*) as total_students FROM sms_students");
    }

    @Test
    void albumsByArtistJoinsArtistAndOrdersByBothNames() {
        String sql = dispatcher.buildStatement(CHINOOK, "Show me albums by artist");

        assertThat(sql)
            .contains("JOIN artist ar ON al.ArtistId = ar.ArtistId")
            .contains("ORDER BY ar.Name, al.Title")
            .endsWith("LIMIT 50");
    }

    @Test
    void firstMatchingTemplateWins() {
        assertThat(dispatcher.buildStatement(SAKILA, "which actor appears in each film"))
            .contains("film_actor");
        assertThat(dispatcher.buildStatement(SAKILA, "list films"))
            .doesNotContain("film_actor");
    }

    @Test
    void unmatchedQuestionGetsTheHelpStatement() {
        String help = TestSources.dispatcher().getCatalog(CHINOOK).get().helpStatement().strip();

        assertThat(dispatcher.buildStatement(CHINOOK, "hello there")).isEqualTo(help);
    }

    @Test
    void unknownSourceGetsThePlaceholder() {
        assertThat(dispatcher.buildStatement("warehouse", "albums"))
            .isEqualTo(TemplateDispatcher.UNKNOWN_SOURCE_STATEMENT);
        assertThat(dispatcher.buildCrossSourceStatement("warehouse", "compare revenue"))
            .isEqualTo(TemplateDispatcher.UNKNOWN_SOURCE_STATEMENT);
    }

    @Test
    void sameQuestionAlwaysGivesTheSameStatement() {
        String question = "show me the latest invoices";

        assertThat(dispatcher.buildStatement(CHINOOK, question)).isEqualTo(dispatcher.buildStatement(CHINOOK, question));
    }

    @Test
    void questionTextNeverReachesTheStatement() {
        String question = "show album'; DROP TABLE album; -- xyzzy";

        for (String source : new String[] {SCHOOL, CHINOOK, SAKILA}) {
            assertThat(dispatcher.buildStatement(source, question)).doesNotContain("xyzzy").doesNotContain("DROP");
            assertThat(dispatcher.buildCrossSourceStatement(source, question)).doesNotContain("xyzzy");
        }
    }

    @Test
    void crossSourceRevenueAndDefaultCounts() {
        assertThat(dispatcher.buildCrossSourceStatement(SAKILA, "compare revenue")).contains("SUM(amount)");
        assertThat(dispatcher.buildCrossSourceStatement(CHINOOK, "compare everything"))
            .contains("UNION ALL")
            .contains("'Artists' as entity");
    }

    @Test
    void listingTemplatesAreBounded() {
        for (String source : new String[] {SCHOOL, CHINOOK, SAKILA}) {
            SourceCatalog catalog = dispatcher.getCatalog(source).get();
            for (QueryTemplate template : catalog.queryTemplates()) {
                assertThat(template.getStatement()).containsAnyOf("LIMIT", "COUNT(*)");
            }
        }
    }

    @Test
    void broadSearchCoversEveryKind() {
        SourceCatalog chinook = dispatcher.getCatalog(CHINOOK).get();
        String all = chinook.searchStatement(SearchType.ALL).get();

        assertThat(chinook.searchStatement(SearchType.ID)).contains(all);
        assertThat(all)
            .contains(chinook.searchStatement(SearchType.NAME).get().replace("\nLIMIT 50", ""))
            .contains(chinook.searchStatement(SearchType.EMAIL).get().replace("\nLIMIT 50", ""))
            .contains(chinook.searchStatement(SearchType.TITLE).get().replace("\nLIMIT 50", ""))
            .endsWith("LIMIT 50");
    }
}
