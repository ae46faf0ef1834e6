package com.williamcallahan.competencysearch.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.competencysearch.domain.CompetencyType;
import com.williamcallahan.competencysearch.domain.Language;
import com.williamcallahan.competencysearch.domain.Provider;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.importer.CompetencyImportService;
import com.williamcallahan.competencysearch.importer.ImportContext;
import com.williamcallahan.competencysearch.importer.IndexedField;
import com.williamcallahan.competencysearch.importer.IndexingStrategyType;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Imports raw provider records, one per request or a JSON array per uploaded file.
 */
@RestController
@RequestMapping("/import")
public class ImportController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(ImportController.class);

    private static final TypeReference<Map<String, Object>> RAW_RECORD = new TypeReference<>() {};

    private final CompetencyImportService importService;
    private final ObjectMapper objectMapper;

    public ImportController(
            CompetencyImportService importService, ObjectMapper objectMapper, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.importService = importService;
        this.objectMapper = objectMapper;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ImportResponse importRecord(@RequestBody ImportRequest request) {
        if (request == null) {
            throw new ValidationException("Import request body is required");
        }
        if (request.data() == null) {
            throw new ValidationException("Import data is required");
        }
        ImportContext context = new ImportContext(request.provider(), request.competencyType(), request.lang());
        IndexingStrategyType strategyType = request.indexingStrategy() == null
                ? IndexingStrategyType.FIELD_DUPLICATION
                : request.indexingStrategy();
        List<String> identifiers = importService.importRecords(
                context, strategyType.create(request.fieldsToIndex()), List.of(request.data()));
        return new ImportResponse(identifiers);
    }

    /**
     * Imports every object of an uploaded JSON array.
     */
    @PostMapping(path = "/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public ImportResponse importFile(
            @RequestParam("file") MultipartFile file,
            @RequestParam("provider") String provider,
            @RequestParam("competency_type") String competencyType,
            @RequestParam(name = "lang", defaultValue = "fr") String lang,
            @RequestParam(name = "indexing_strategy", defaultValue = "field_duplication") String indexingStrategy,
            @RequestParam(name = "fields_to_index", required = false) String fieldsToIndex) {
        ImportContext context = new ImportContext(
                parseToken(provider, "provider", Provider::fromToken),
                parseToken(competencyType, "competency_type", CompetencyType::fromToken),
                parseToken(lang, "lang", Language::fromToken));
        IndexingStrategyType strategyType =
                parseToken(indexingStrategy, "indexing_strategy", IndexingStrategyType::fromToken);
        List<IndexedField> fields = parseFields(fieldsToIndex);
        List<Map<String, Object>> rawRecords = readRecords(file);
        log.info("[IMPORT] Received file with {} record(s) for {}", rawRecords.size(), context.provider().token());
        return new ImportResponse(importService.importRecords(context, strategyType.create(fields), rawRecords));
    }

    private List<Map<String, Object>> readRecords(MultipartFile file) {
        JsonNode root;
        try {
            root = objectMapper.readTree(file.getInputStream());
        } catch (JsonProcessingException malformedJson) {
            throw new ValidationException("Invalid JSON format: " + malformedJson.getOriginalMessage());
        } catch (IOException readFailure) {
            throw new ValidationException("Uploaded file could not be read");
        }
        if (root == null || !root.isArray()) {
            throw new ValidationException("JSON must be an array of items");
        }
        List<Map<String, Object>> rawRecords = new ArrayList<>(root.size());
        for (JsonNode item : root) {
            if (!item.isObject()) {
                throw new ValidationException("Every item of the JSON array must be an object");
            }
            rawRecords.add(objectMapper.convertValue(item, RAW_RECORD));
        }
        return rawRecords;
    }

    private static List<IndexedField> parseFields(String fieldsToIndex) {
        List<IndexedField> fields = new ArrayList<>();
        if (fieldsToIndex == null) {
            return fields;
        }
        for (String token : fieldsToIndex.split(",")) {
            if (!token.isBlank()) {
                fields.add(parseToken(token, "fields_to_index", IndexedField::fromToken));
            }
        }
        return fields;
    }

    private static <E> E parseToken(String token, String parameter, Function<String, E> resolver) {
        try {
            return resolver.apply(token);
        } catch (IllegalArgumentException unknownToken) {
            throw new ValidationException("Invalid " + parameter + ": " + unknownToken.getMessage());
        }
    }
}
