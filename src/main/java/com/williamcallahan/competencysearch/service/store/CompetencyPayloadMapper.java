package com.williamcallahan.competencysearch.service.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.errors.StorageFailureException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Converts competencies to and from the plain map payload stored next to the vectors.
 *
 * <p>Enum fields are stored as their wire tokens and absent fields are omitted, so filters see the
 * same names and values the API accepts.</p>
 */
@Component
public class CompetencyPayloadMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CompetencyPayloadMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public Map<String, Object> toPayload(Competency competency) {
        return objectMapper.convertValue(Objects.requireNonNull(competency, "competency"), PAYLOAD_TYPE);
    }

    /**
     * Rebuilds a competency from a stored payload.
     *
     * @param identifier identifier the payload was read from, for error messages
     * @param payload stored payload
     * @return competency
     * @throws StorageFailureException when the stored payload is not a valid competency
     */
    public Competency fromPayload(String identifier, Map<String, Object> payload) {
        try {
            return objectMapper.convertValue(payload, Competency.class);
        } catch (IllegalArgumentException invalidPayload) {
            throw new StorageFailureException(
                    "Stored payload for " + identifier + " is not a valid competency", invalidPayload);
        }
    }
}
