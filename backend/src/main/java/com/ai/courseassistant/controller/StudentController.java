package com.ai.courseassistant.controller;

import com.ai.courseassistant.dto.StudentAnswerResponse;
import com.ai.courseassistant.dto.StudentQueryRequest;
import com.ai.courseassistant.service.StudentAssistantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * StudentController exposes the RAG-powered study endpoint.
 *
 * <pre>
 *   POST /api/student/ask
 *   Body: { "userId": "...", "query": "What is backpropagation?", "mode": "qa" }
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/student")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class StudentController {

    private final StudentAssistantService studentAssistantService;

    @PostMapping("/ask")
    public ResponseEntity<StudentAnswerResponse> ask(@Valid @RequestBody StudentQueryRequest request) {
        return ResponseEntity.ok(studentAssistantService.ask(
                request.getUserId(), request.getQuery(), request.getMode()));
    }
}
