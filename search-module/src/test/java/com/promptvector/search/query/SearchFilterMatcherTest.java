package com.promptvector.search.query;

import com.promptvector.common.model.DocumentMetadata;
import com.promptvector.common.model.DocumentType;
import com.promptvector.common.model.SearchFilters;
import com.promptvector.common.model.VectorDocument;
import com.promptvector.search.EngineFixture;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SearchFilterMatcherTest {

    private static final Instant CREATED = Instant.parse("2026-01-10T00:00:00Z");

    private final VectorDocument document = EngineFixture.document("doc",
        DocumentMetadata.builder()
            .type(DocumentType.TEMPLATE)
            .domain("coding")
            .created(CREATED)
            .tags(Set.of("java", "spring"))
            .build(),
        1, 0, 0);

    @Test
    void shouldMatchEverythingWithoutFilters() {
        assertThat(SearchFilterMatcher.isEmpty(null)).isTrue();
        assertThat(SearchFilterMatcher.isEmpty(SearchFilters.builder().build())).isTrue();
        assertThat(SearchFilterMatcher.matches(document, null)).isTrue();
        assertThat(SearchFilterMatcher.matches(document, SearchFilters.builder().build())).isTrue();
    }

    @Test
    void shouldFilterByDomainAndType() {
        assertThat(SearchFilterMatcher.matches(document, SearchFilters.builder().domains(Set.of("coding", "writing")).build())).isTrue();
        assertThat(SearchFilterMatcher.matches(document, SearchFilters.builder().domains(Set.of("writing")).build())).isFalse();
        assertThat(SearchFilterMatcher.matches(document, SearchFilters.builder().types(Set.of(DocumentType.TEMPLATE)).build())).isTrue();
        assertThat(SearchFilterMatcher.matches(document, SearchFilters.builder().types(Set.of(DocumentType.PROMPT)).build())).isFalse();
    }

    @Test
    void shouldMatchAnyTag() {
        assertThat(SearchFilterMatcher.matches(document, SearchFilters.builder().tags(Set.of("spring", "python")).build())).isTrue();
        assertThat(SearchFilterMatcher.matches(document, SearchFilters.builder().tags(Set.of("python")).build())).isFalse();
    }

    @Test
    void shouldTreatMissingEffectivenessAsZero() {
        assertThat(SearchFilterMatcher.matches(document, SearchFilters.builder().effectivenessMin(0.0).build())).isTrue();
        assertThat(SearchFilterMatcher.matches(document, SearchFilters.builder().effectivenessMin(0.1).build())).isFalse();

        VectorDocument effective = document.toBuilder()
            .metadata(document.metadata().toBuilder().effectiveness(0.8).build())
            .build();
        assertThat(SearchFilterMatcher.matches(effective, SearchFilters.builder().effectivenessMin(0.8).build())).isTrue();
    }

    @Test
    void shouldApplyInclusiveCreatedRange() {
        assertThat(SearchFilterMatcher.matches(document,
            SearchFilters.builder().createdAfter(CREATED).createdBefore(CREATED).build())).isTrue();
        assertThat(SearchFilterMatcher.matches(document,
            SearchFilters.builder().createdAfter(CREATED.plusSeconds(1)).build())).isFalse();
        assertThat(SearchFilterMatcher.matches(document,
            SearchFilters.builder().createdBefore(CREATED.minusSeconds(1)).build())).isFalse();
    }
}
