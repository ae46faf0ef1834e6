package com.williamcallahan.competencysearch.web;

import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.service.IndexingService;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Create, read, replace and delete single competencies.
 */
@RestController
@RequestMapping("/entities")
public class EntityController extends BaseController {

    private final IndexingService indexingService;

    public EntityController(IndexingService indexingService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.indexingService = indexingService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public EntityResponse create(@RequestBody EntityRequest request) {
        return EntityResponse.from(indexingService.index(requireCompetency(request), Optional.empty()));
    }

    @GetMapping("/{identifier}")
    public EntityResponse get(@PathVariable("identifier") String identifier) {
        return EntityResponse.from(indexingService.get(identifier));
    }

    @PutMapping("/{identifier}")
    public EntityResponse replace(@PathVariable("identifier") String identifier, @RequestBody EntityRequest request) {
        return EntityResponse.from(indexingService.replace(identifier, requireCompetency(request)));
    }

    @DeleteMapping("/{identifier}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("identifier") String identifier) {
        indexingService.delete(identifier);
    }

    private static Competency requireCompetency(EntityRequest request) {
        if (request == null || request.competency() == null) {
            throw new ValidationException("Request body must contain a competency");
        }
        return request.competency();
    }
}
