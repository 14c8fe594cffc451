package com.ai.courseassistant.controller;

import com.ai.courseassistant.dto.ContentGenerationRequest;
import com.ai.courseassistant.dto.GeneratedContentResponse;
import com.ai.courseassistant.exception.GlobalExceptionHandler;
import com.ai.courseassistant.model.ContentType;
import com.ai.courseassistant.service.ContentGenerationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ContentControllerTest {

    @Mock
    private ContentGenerationService contentGenerationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ContentController(contentGenerationService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void generatesContent() throws Exception {
        when(contentGenerationService.generate(any(ContentGenerationRequest.class)))
                .thenReturn(GeneratedContentResponse.builder()
                        .contentId("content-1")
                        .contentType(ContentType.MCQ)
                        .facultyId("faculty-1")
                        .documentIds(List.of("doc-1"))
                        .questions(List.of())
                        .origin("SYNTHESIZED")
                        .build());

        mockMvc.perform(post("/api/faculty/content")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"facultyId\": \"faculty-1\", \"contentType\": \"mcq\","
                                + " \"documentIds\": [\"doc-1\"], \"numQuestions\": 5, \"difficulty\": \"hard\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.contentId").value("content-1"))
                .andExpect(jsonPath("$.contentType").value("mcq"))
                .andExpect(jsonPath("$.origin").value("SYNTHESIZED"));

        ArgumentCaptor<ContentGenerationRequest> request = ArgumentCaptor.forClass(ContentGenerationRequest.class);
        verify(contentGenerationService).generate(request.capture());
        assertThat(request.getValue().getContentType()).isEqualTo(ContentType.MCQ);
        assertThat(request.getValue().getNumQuestions()).isEqualTo(5);
    }

    @Test
    void missingDocumentsAreRejected() throws Exception {
        mockMvc.perform(post("/api/faculty/content")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"facultyId\": \"faculty-1\", \"contentType\": \"viva\", \"documentIds\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_FAILED"));
        verifyNoInteractions(contentGenerationService);
    }

    @Test
    void listsHistoryForFaculty() throws Exception {
        when(contentGenerationService.listByFaculty("faculty-1")).thenReturn(List.of(
                GeneratedContentResponse.builder().contentId("c-2").contentType(ContentType.VIVA).build(),
                GeneratedContentResponse.builder().contentId("c-1").contentType(ContentType.ASSIGNMENT).build()));

        mockMvc.perform(get("/api/faculty/content").param("facultyId", "faculty-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].contentId").value("c-2"))
                .andExpect(jsonPath("$[1].contentType").value("assignment"));
    }
}
