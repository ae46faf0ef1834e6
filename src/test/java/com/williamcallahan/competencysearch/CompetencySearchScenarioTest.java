package com.williamcallahan.competencysearch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.CompetencyFilter;
import com.williamcallahan.competencysearch.domain.CompetencyType;
import com.williamcallahan.competencysearch.domain.FilterOperator;
import com.williamcallahan.competencysearch.domain.Language;
import com.williamcallahan.competencysearch.domain.Provider;
import com.williamcallahan.competencysearch.domain.SearchMode;
import com.williamcallahan.competencysearch.domain.SearchQuery;
import com.williamcallahan.competencysearch.domain.SearchResult;
import com.williamcallahan.competencysearch.service.HybridSearchService;
import com.williamcallahan.competencysearch.service.IndexingService;
import com.williamcallahan.competencysearch.service.store.InMemoryVectorRepository;
import com.williamcallahan.competencysearch.service.store.VectorRepository;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

/**
 * End-to-end indexing and search against the in-memory store with hashing embeddings.
 */
@SpringBootTest
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class CompetencySearchScenarioTest {

    @Autowired
    IndexingService indexingService;

    @Autowired
    HybridSearchService hybridSearchService;

    @Autowired
    VectorRepository vectorRepository;

    private String pythonIdentifier;

    @BeforeEach
    void indexCatalog() {
        pythonIdentifier = index(skill(
                Provider.ESCO,
                "ESCO-S123",
                "Python Programming",
                "Writing and maintaining Python code",
                "ESCO-S123 Python Programming. Writing and maintaining Python code"));
        index(skill(Provider.ROME, "ROME-D001", "Data Analysis", "Interpreting datasets with statistics", null));
        index(skill(Provider.FORMA, "FORMA-C001", "Cloud Computing", "Operating hosted infrastructure", null));
        index(skill(Provider.ESCO, "ESCO-S789", "Project management", "Planning and leading projects", null));
    }

    @Test
    void hybridSearchRanksProgrammingSkillFirst() {
        List<SearchResult> results =
                hybridSearchService.search(new SearchQuery("programming", SearchMode.HYBRID, 2, null));

        assertEquals(2, results.size());
        assertEquals(pythonIdentifier, results.get(0).identifier());
        assertEquals("Python Programming", results.get(0).competency().title());
        assertTrue(results.get(0).score() >= results.get(1).score());
        for (SearchResult result : results) {
            assertTrue(result.score() >= 0.0 && result.score() <= 1.0, "score out of range: " + result.score());
        }
    }

    @Test
    void semanticScoresNeverIncrease() {
        List<SearchResult> results =
                hybridSearchService.search(new SearchQuery("cloud data", SearchMode.SEMANTIC, 10, null));

        assertEquals(4, results.size());
        for (int position = 1; position < results.size(); position++) {
            assertTrue(results.get(position).score() <= results.get(position - 1).score());
        }
    }

    @Test
    void sparseSearchRanksExactCodeAboveRepeatedPrefix() {
        String decoyIdentifier = index(skill(
                Provider.ESCO,
                "ESCO-S999",
                "Taxonomy overview",
                "An ESCO skill from the ESCO taxonomy, see ESCO",
                null));

        List<SearchResult> results =
                hybridSearchService.search(new SearchQuery("ESCO-S123", SearchMode.SPARSE, 5, null));

        assertEquals(pythonIdentifier, results.get(0).identifier());
        SearchResult decoy = results.stream()
                .filter(result -> result.identifier().equals(decoyIdentifier))
                .findFirst()
                .orElseThrow();
        assertTrue(results.get(0).score() > decoy.score() + 1.0,
                "exact code " + results.get(0).score() + " vs repeated prefix " + decoy.score());
    }

    @Test
    void languageFilterOverEnglishCatalogReturnsNothing() {
        List<SearchResult> results = hybridSearchService.search(new SearchQuery(
                "Python Programming", SearchMode.HYBRID, 5, List.of(CompetencyFilter.eq("lang", "fr"))));

        assertTrue(results.isEmpty());
    }

    @Test
    void combinedFiltersEqualIntersectionOfEachFilter() {
        CompetencyFilter providers = CompetencyFilter.of("provider", FilterOperator.IN, List.of("esco", "forma"));
        CompetencyFilter notProjectManagement = CompetencyFilter.of("code", FilterOperator.NEQ, "ESCO-S789");

        Set<String> first = identifiers(List.of(providers));
        Set<String> second = identifiers(List.of(notProjectManagement));
        Set<String> both = identifiers(List.of(providers, notProjectManagement));

        Set<String> intersection = new HashSet<>(first);
        intersection.retainAll(second);
        assertEquals(intersection, both);
        assertEquals(2, both.size());
    }

    @Test
    void everyResultSatisfiesEveryFilter() {
        List<SearchResult> results = hybridSearchService.search(new SearchQuery(
                "computing",
                SearchMode.SEMANTIC,
                10,
                List.of(CompetencyFilter.eq("provider", "forma"), CompetencyFilter.eq("type", "skill"))));

        assertEquals(1, results.size());
        Competency match = results.get(0).competency();
        assertEquals(Provider.FORMA, match.provider());
        assertEquals(CompetencyType.SKILL, match.type());
    }

    @Test
    void reindexingSameIdentifierKeepsOneRecord() {
        Competency competency = indexingService.get(pythonIdentifier).competency();

        indexingService.index(competency, Optional.of(pythonIdentifier));
        indexingService.index(competency, Optional.of(pythonIdentifier));

        assertEquals(4, ((InMemoryVectorRepository) vectorRepository).size());
        assertEquals(competency, indexingService.get(pythonIdentifier).competency());
    }

    @Test
    void storedRecordRoundTrips() {
        Competency stored = indexingService.get(pythonIdentifier).competency();

        assertEquals(
                skill(
                        Provider.ESCO,
                        "ESCO-S123",
                        "Python Programming",
                        "Writing and maintaining Python code",
                        "ESCO-S123 Python Programming. Writing and maintaining Python code"),
                stored);
    }

    @Test
    void repeatedSearchesAreIdentical() {
        SearchQuery query = new SearchQuery("data programming", SearchMode.HYBRID, 3, null);

        assertEquals(hybridSearchService.search(query), hybridSearchService.search(query));
    }

    @Test
    void deletedRecordsDisappearFromResults() {
        indexingService.delete(pythonIdentifier);

        Set<String> remaining = hybridSearchService
                .search(new SearchQuery("Python Programming", SearchMode.HYBRID, 10, null))
                .stream()
                .map(SearchResult::identifier)
                .collect(Collectors.toSet());

        assertFalse(remaining.contains(pythonIdentifier));
    }

    private String index(Competency competency) {
        return indexingService.index(competency, Optional.empty()).identifier();
    }

    private Set<String> identifiers(List<CompetencyFilter> filters) {
        return hybridSearchService.search(new SearchQuery("skills", SearchMode.SEMANTIC, 10, filters)).stream()
                .map(SearchResult::identifier)
                .collect(Collectors.toSet());
    }

    private static Competency skill(
            Provider provider, String code, String title, String description, String indexedText) {
        return new Competency(
                code,
                Language.EN,
                CompetencyType.SKILL,
                provider,
                title,
                null,
                null,
                description,
                List.of("Curated"),
                indexedText,
                null);
    }
}
