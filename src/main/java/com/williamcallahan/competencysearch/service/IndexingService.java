package com.williamcallahan.competencysearch.service;

import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.IndexedCompetency;
import com.williamcallahan.competencysearch.domain.errors.CompetencyNotFoundException;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.service.encoding.EncodingService;
import com.williamcallahan.competencysearch.service.encoding.EncodingService.EncodedText;
import com.williamcallahan.competencysearch.service.store.VectorRepository;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Populates the store: validates a competency, derives its indexed text, encodes it and writes
 * both vectors with the payload in one upsert.
 *
 * <p>Nothing is retried here. A storage failure after a successful encode surfaces unchanged to the
 * caller, who owns the retry decision.</p>
 */
@Service
public class IndexingService {
    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private static final String TEXT_SEPARATOR = ". ";

    private final EncodingService encodingService;
    private final VectorRepository vectorRepository;

    public IndexingService(EncodingService encodingService, VectorRepository vectorRepository) {
        this.encodingService = Objects.requireNonNull(encodingService, "encodingService");
        this.vectorRepository = Objects.requireNonNull(vectorRepository, "vectorRepository");
    }

    /**
     * Indexes a competency.
     *
     * @param competency record to index
     * @param identifier identifier to upsert under; a fresh UUID is minted when empty
     * @return stored identifier and the payload as written
     * @throws ValidationException when required fields are missing or the identifier is not a UUID
     * @throws com.williamcallahan.competencysearch.domain.errors.EncodingFailureException when encoding fails
     * @throws com.williamcallahan.competencysearch.domain.errors.StorageFailureException when the upsert fails
     */
    public IndexedCompetency index(Competency competency, Optional<String> identifier) {
        validate(competency);
        String resolvedIdentifier = identifier.map(IndexingService::requireUuid)
                .orElseGet(() -> UUID.randomUUID().toString());
        Competency stored = competency.hasIndexedText()
                ? competency
                : competency.withIndexedText(defaultIndexedText(competency));

        EncodedText encoded = encodingService.encodeBoth(stored.indexedText());
        vectorRepository.upsert(resolvedIdentifier, encoded.denseVector(), encoded.sparseVector(), stored);
        log.info("[INDEX] Indexed {} {} as {}", stored.provider().token(), stored.code(), resolvedIdentifier);
        return new IndexedCompetency(resolvedIdentifier, stored);
    }

    /**
     * Fetches a stored competency.
     *
     * @param identifier UUID string
     * @return stored record
     * @throws CompetencyNotFoundException when nothing is stored under the identifier
     */
    public IndexedCompetency get(String identifier) {
        String resolvedIdentifier = requireUuid(identifier);
        return vectorRepository.get(resolvedIdentifier)
                .map(competency -> new IndexedCompetency(resolvedIdentifier, competency))
                .orElseThrow(() -> new CompetencyNotFoundException(resolvedIdentifier));
    }

    /**
     * Re-indexes an existing competency under its identifier.
     *
     * @param identifier UUID string of an existing record
     * @param competency replacement record
     * @return stored record
     * @throws CompetencyNotFoundException when nothing is stored under the identifier
     */
    public IndexedCompetency replace(String identifier, Competency competency) {
        String resolvedIdentifier = requireExisting(identifier);
        return index(competency, Optional.of(resolvedIdentifier));
    }

    /**
     * Deletes an existing competency.
     *
     * @param identifier UUID string of an existing record
     * @throws CompetencyNotFoundException when nothing is stored under the identifier
     */
    public void delete(String identifier) {
        String resolvedIdentifier = requireExisting(identifier);
        vectorRepository.delete(resolvedIdentifier);
        log.info("[INDEX] Deleted {}", resolvedIdentifier);
    }

    /**
     * Trimmed title, then the trimmed description when there is one. A trailing period of the
     * title is dropped before joining so the separator is not doubled.
     */
    static String defaultIndexedText(Competency competency) {
        String title = competency.title().trim();
        String description = competency.description() == null ? "" : competency.description().trim();
        if (description.isEmpty()) {
            return title;
        }
        String head = title.endsWith(".") ? title.substring(0, title.length() - 1) : title;
        return head + TEXT_SEPARATOR + description;
    }

    private String requireExisting(String identifier) {
        String resolvedIdentifier = requireUuid(identifier);
        if (vectorRepository.get(resolvedIdentifier).isEmpty()) {
            throw new CompetencyNotFoundException(resolvedIdentifier);
        }
        return resolvedIdentifier;
    }

    private static void validate(Competency competency) {
        if (competency == null) {
            throw new ValidationException("Competency is required");
        }
        List<String> missingFields = competency.missingRequiredFields();
        if (!missingFields.isEmpty()) {
            throw new ValidationException("Competency is missing required fields: " + String.join(", ", missingFields));
        }
    }

    private static String requireUuid(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new ValidationException("Identifier must not be blank");
        }
        try {
            return UUID.fromString(identifier.trim()).toString();
        } catch (IllegalArgumentException invalidUuid) {
            throw new ValidationException("Identifier is not a UUID: " + identifier);
        }
    }
}
