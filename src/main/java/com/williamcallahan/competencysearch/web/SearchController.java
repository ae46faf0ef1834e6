package com.williamcallahan.competencysearch.web;

import com.williamcallahan.competencysearch.domain.errors.ValidationException;
import com.williamcallahan.competencysearch.service.HybridSearchService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Text search over indexed competencies.
 */
@RestController
@RequestMapping("/search")
public class SearchController extends BaseController {

    private final HybridSearchService hybridSearchService;

    public SearchController(HybridSearchService hybridSearchService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.hybridSearchService = hybridSearchService;
    }

    /**
     * Runs a semantic, sparse or hybrid search.
     *
     * @param request query text, search type, result count and filters
     * @return ranked results
     */
    @PostMapping("/text")
    public SearchResponse searchText(@RequestBody SearchRequest request) {
        if (request == null) {
            throw new ValidationException("Search request body is required");
        }
        return new SearchResponse(hybridSearchService.search(request.toQuery()));
    }
}
