package com.williamcallahan.competencysearch.importer;

import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.IndexedCompetency;
import com.williamcallahan.competencysearch.service.IndexingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Imports raw provider records: map, expand with the indexing strategy, then index every expanded
 * competency in-process.
 *
 * <p>Every record of a batch is mapped before anything is indexed, so a malformed record rejects the
 * batch without partial writes. Failures while indexing stop the batch; records indexed before the
 * failure stay in the store.</p>
 */
@Service
public class CompetencyImportService {
    private static final Logger log = LoggerFactory.getLogger(CompetencyImportService.class);

    private final MapperRegistry mapperRegistry;
    private final IndexingService indexingService;

    public CompetencyImportService(MapperRegistry mapperRegistry, IndexingService indexingService) {
        this.mapperRegistry = Objects.requireNonNull(mapperRegistry, "mapperRegistry");
        this.indexingService = Objects.requireNonNull(indexingService, "indexingService");
    }

    /**
     * Imports a batch of raw records.
     *
     * @param context provider, type and language shared by the batch
     * @param strategy expansion strategy
     * @param rawRecords raw JSON objects
     * @return identifiers of every indexed record, in import order
     */
    public List<String> importRecords(
            ImportContext context, IndexingStrategy strategy, List<Map<String, Object>> rawRecords) {
        List<Competency> expanded = new ArrayList<>();
        for (Map<String, Object> rawRecord : rawRecords) {
            Competency mapped = mapperRegistry.mapperFor(context, rawRecord).toCompetency();
            expanded.addAll(strategy.expand(mapped));
        }

        List<String> identifiers = new ArrayList<>(expanded.size());
        for (Competency competency : expanded) {
            IndexedCompetency indexed = indexingService.index(competency, Optional.empty());
            identifiers.add(indexed.identifier());
        }
        log.info(
                "[IMPORT] Imported {} {} record(s) as {} indexed competencies",
                rawRecords.size(),
                context.provider().token(),
                identifiers.size());
        return List.copyOf(identifiers);
    }
}
