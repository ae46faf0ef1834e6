package com.williamcallahan.competencysearch.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.competencysearch.domain.Provider;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.support.FailureMessages;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Provider-keyed registry of mapper factories, built once at startup.
 */
@Component
public class MapperRegistry {
    private static final Logger log = LoggerFactory.getLogger(MapperRegistry.class);

    private final ObjectMapper objectMapper;
    private final Map<Provider, MapperFactory> factories = new EnumMap<>(Provider.class);

    public MapperRegistry(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        factories.put(Provider.ESCO, (context, rawRecord) ->
                new EscoMapper(context, convert(rawRecord, EscoMapper.Raw.class)));
        factories.put(Provider.ROME, (context, rawRecord) ->
                new RomeMapper(context, convert(rawRecord, RomeMapper.Raw.class)));
        factories.put(Provider.FORMA, (context, rawRecord) ->
                new FormaMapper(context, convert(rawRecord, FormaMapper.Raw.class)));
        factories.put(Provider.FORMA14, (context, rawRecord) ->
                new Forma14Mapper(context, convert(rawRecord, Forma14Mapper.Raw.class)));
        log.debug("[IMPORT] Registered mappers for {}", factories.keySet());
    }

    /**
     * Builds the mapper for one raw record.
     *
     * @param context import attributes; its provider selects the mapper
     * @param rawRecord raw JSON object
     * @return mapper for the record
     * @throws ValidationException when no mapper is registered or the record is malformed
     */
    public CompetencyMapper mapperFor(ImportContext context, Map<String, Object> rawRecord) {
        MapperFactory factory = factories.get(context.provider());
        if (factory == null) {
            throw new ValidationException("No mapper registered for provider '" + context.provider().token() + "'");
        }
        if (rawRecord == null) {
            throw new ValidationException("Import data must be a JSON object");
        }
        return factory.create(context, rawRecord);
    }

    private <T> T convert(Map<String, Object> rawRecord, Class<T> rawType) {
        try {
            return objectMapper.convertValue(rawRecord, rawType);
        } catch (IllegalArgumentException conversionFailure) {
            throw new ValidationException("Malformed " + rawType.getEnclosingClass().getSimpleName() + " record: "
                    + FailureMessages.describe(conversionFailure));
        }
    }
}
