package com.williamcallahan.competencysearch.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.competencysearch.domain.Competency;
import com.williamcallahan.competencysearch.domain.CompetencyFixtures;
import com.williamcallahan.competencysearch.domain.IndexedCompetency;
import com.williamcallahan.competencysearch.domain.Language;
import com.williamcallahan.competencysearch.domain.errors.CompetencyNotFoundException;
import com.williamcallahan.competencysearch.domain.errors.EncodingFailureException;
import com.williamcallahan.competencysearch.service.IndexingService;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies entity create, read, replace and delete status codes under WebMvcTest.
 */
@WebMvcTest(controllers = EntityController.class)
@Import(ExceptionResponseBuilder.class)
class EntityControllerTest {

    private static final String IDENTIFIER = "0b6c5f0e-2a4e-4f53-8f5a-6f4d1f3e9c21";
    private static final String COMPETENCY_JSON = """
            {"competency":{"code":"ESCO-S123","lang":"en","type":"skill","provider":"esco",
             "title":"Python Programming","description":"Writing Python code"}}
            """;

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    IndexingService indexingService;

    @Test
    void createReturnsCreatedWithIdentifier() throws Exception {
        given(indexingService.index(any(), eq(Optional.empty()))).willAnswer(invocation -> new IndexedCompetency(
                IDENTIFIER, invocation.getArgument(0, Competency.class)));

        mockMvc.perform(post("/entities").contentType(MediaType.APPLICATION_JSON).content(COMPETENCY_JSON))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.identifier").value(IDENTIFIER))
                .andExpect(jsonPath("$.competency.provider").value("esco"))
                .andExpect(jsonPath("$.competency.type").value("skill"));
    }

    @Test
    void missingCompetencyIsBadRequest() throws Exception {
        mockMvc.perform(post("/entities").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Request body must contain a competency"));
    }

    @Test
    void getReturnsStoredRecord() throws Exception {
        given(indexingService.get(IDENTIFIER)).willReturn(new IndexedCompetency(
                IDENTIFIER, CompetencyFixtures.skill("ESCO-S123", Language.EN, "Python Programming", null)));

        mockMvc.perform(get("/entities/{identifier}", IDENTIFIER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.competency.title").value("Python Programming"))
                .andExpect(jsonPath("$.competency.description").doesNotExist());
    }

    @Test
    void unknownIdentifierIsNotFound() throws Exception {
        given(indexingService.get(IDENTIFIER)).willThrow(new CompetencyNotFoundException(IDENTIFIER));

        mockMvc.perform(get("/entities/{identifier}", IDENTIFIER))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void replaceEncodingFailureIsRetryable() throws Exception {
        given(indexingService.replace(eq(IDENTIFIER), any()))
                .willThrow(new EncodingFailureException("dense encoding failed: connection refused"));

        mockMvc.perform(put("/entities/{identifier}", IDENTIFIER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(COMPETENCY_JSON))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "1"));
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/entities/{identifier}", IDENTIFIER)).andExpect(status().isNoContent());

        then(indexingService).should().delete(IDENTIFIER);
    }

    @Test
    void deleteOfUnknownIdentifierIsNotFound() throws Exception {
        willThrow(new CompetencyNotFoundException(IDENTIFIER)).given(indexingService).delete(IDENTIFIER);

        mockMvc.perform(delete("/entities/{identifier}", IDENTIFIER)).andExpect(status().isNotFound());
    }
}
