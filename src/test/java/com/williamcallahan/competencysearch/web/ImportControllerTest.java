package com.williamcallahan.competencysearch.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.competencysearch.domain.CompetencyType;
import com.williamcallahan.competencysearch.domain.Language;
import com.williamcallahan.competencysearch.domain.Provider;
import com.williamcallahan.competencysearch.importer.CompetencyImportService;
import com.williamcallahan.competencysearch.importer.FieldCombinationStrategy;
import com.williamcallahan.competencysearch.importer.FieldDuplicationStrategy;
import com.williamcallahan.competencysearch.importer.ImportContext;
import com.williamcallahan.competencysearch.importer.IndexingStrategy;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Verifies single-record and file imports under WebMvcTest.
 */
@WebMvcTest(controllers = ImportController.class)
@Import(ExceptionResponseBuilder.class)
class ImportControllerTest {

    private static final List<String> IDENTIFIERS =
            List.of("8a1f4c2d-6b7e-4f90-a1b2-c3d4e5f60718", "9b2e5d3c-7c8f-4a01-b2c3-d4e5f6071829");

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    CompetencyImportService importService;

    @Test
    @SuppressWarnings("unchecked")
    void importsSingleRecordWithDefaultStrategy() throws Exception {
        given(importService.importRecords(any(), any(), any())).willReturn(IDENTIFIERS);

        mockMvc.perform(post("/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"provider":"rome","competency_type":"occupation","lang":"fr",
                                 "data":{"code":"A1101","intitule":"Conducteur / Conductrice d'engins agricoles"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.identifiers[0]").value(IDENTIFIERS.get(0)))
                .andExpect(jsonPath("$.identifiers[1]").value(IDENTIFIERS.get(1)));

        ArgumentCaptor<ImportContext> context = ArgumentCaptor.forClass(ImportContext.class);
        ArgumentCaptor<IndexingStrategy> strategy = ArgumentCaptor.forClass(IndexingStrategy.class);
        ArgumentCaptor<List<Map<String, Object>>> records = ArgumentCaptor.forClass(List.class);
        then(importService).should().importRecords(context.capture(), strategy.capture(), records.capture());
        assertEquals(new ImportContext(Provider.ROME, CompetencyType.OCCUPATION, Language.FR), context.getValue());
        assertInstanceOf(FieldDuplicationStrategy.class, strategy.getValue());
        assertEquals("A1101", records.getValue().get(0).get("code"));
    }

    @Test
    void missingProviderIsBadRequest() throws Exception {
        mockMvc.perform(post("/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"competency_type\":\"skill\",\"lang\":\"en\",\"data\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Import provider is required"));

        verifyNoInteractions(importService);
    }

    @Test
    void unknownProviderTokenIsBadRequest() throws Exception {
        mockMvc.perform(post("/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"onet\",\"competency_type\":\"skill\",\"lang\":\"en\",\"data\":{}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(importService);
    }

    @Test
    void importsEveryObjectOfUploadedArray() throws Exception {
        given(importService.importRecords(any(), any(), any())).willReturn(IDENTIFIERS);
        MockMultipartFile file = new MockMultipartFile(
                "file",
                "skills.json",
                MediaType.APPLICATION_JSON_VALUE,
                """
                [{"preferredLabel":"Python","conceptUri":"http://data.europa.eu/esco/skill/1","description":"x"},
                 {"preferredLabel":"Java","conceptUri":"http://data.europa.eu/esco/skill/2","description":"y"}]
                """.getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/import/file")
                        .file(file)
                        .param("provider", "ESCO")
                        .param("competency_type", "skill")
                        .param("lang", "en")
                        .param("indexing_strategy", "field_combination")
                        .param("fields_to_index", "title, description"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.identifiers.length()").value(2));

        ArgumentCaptor<IndexingStrategy> strategy = ArgumentCaptor.forClass(IndexingStrategy.class);
        then(importService).should().importRecords(any(), strategy.capture(), any());
        assertInstanceOf(FieldCombinationStrategy.class, strategy.getValue());
    }

    @Test
    void uploadThatIsNotAnArrayIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "skill.json", MediaType.APPLICATION_JSON_VALUE, "{\"preferredLabel\":\"Python\"}".getBytes(
                        StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/import/file")
                        .file(file)
                        .param("provider", "esco")
                        .param("competency_type", "skill"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("JSON must be an array of items"));

        verifyNoInteractions(importService);
    }

    @Test
    void malformedUploadIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "broken.json", MediaType.APPLICATION_JSON_VALUE, "[{\"code\":".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/import/file")
                        .file(file)
                        .param("provider", "rome")
                        .param("competency_type", "occupation"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(importService);
    }

    @Test
    void unknownIndexedFieldIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "skills.json", MediaType.APPLICATION_JSON_VALUE, "[]".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/import/file")
                        .file(file)
                        .param("provider", "esco")
                        .param("competency_type", "skill")
                        .param("fields_to_index", "title,url"))
                .andExpect(status().isBadRequest());
    }
}
