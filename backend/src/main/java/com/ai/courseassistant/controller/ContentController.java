package com.ai.courseassistant.controller;

import com.ai.courseassistant.dto.ContentGenerationRequest;
import com.ai.courseassistant.dto.GeneratedContentResponse;
import com.ai.courseassistant.service.ContentGenerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/faculty/content")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class ContentController {

    private final ContentGenerationService contentGenerationService;

    // ── POST /api/faculty/content ────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<GeneratedContentResponse> generate(@Valid @RequestBody ContentGenerationRequest request) {
        GeneratedContentResponse response = contentGenerationService.generate(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    // ── GET /api/faculty/content?facultyId= ──────────────────────────────────

    @GetMapping
    public ResponseEntity<List<GeneratedContentResponse>> list(@RequestParam("facultyId") String facultyId) {
        return ResponseEntity.ok(contentGenerationService.listByFaculty(facultyId));
    }

    @GetMapping("/{contentId}")
    public ResponseEntity<GeneratedContentResponse> get(@PathVariable String contentId) {
        return ResponseEntity.ok(contentGenerationService.get(contentId));
    }
}
