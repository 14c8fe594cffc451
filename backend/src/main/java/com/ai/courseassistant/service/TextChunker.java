package com.ai.courseassistant.service;

import com.ai.courseassistant.config.CourseAssistantProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits extracted text into overlapping fixed-size character windows.
 *
 * <p>
 * Window {@code n} starts at {@code n * (size - overlap)}, so consecutive
 * chunks share {@code overlap} characters and no chunk is longer than
 * {@code size}. Windows that are blank after trimming are dropped.
 * </p>
 */
@Slf4j
@Component
public class TextChunker {

    private final int chunkSize;
    private final int chunkOverlap;

    @Autowired
    public TextChunker(CourseAssistantProperties properties) {
        this(properties.getChunking().getSize(), properties.getChunking().getOverlap());
    }

    public TextChunker(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0 || chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "Invalid chunking window: size=" + chunkSize + ", overlap=" + chunkOverlap);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public List<String> chunk(String text) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        int step = chunkSize - chunkOverlap;
        int i = 0;

        while (i < text.length()) {
            int end = Math.min(i + chunkSize, text.length());
            String chunk = text.substring(i, end).trim();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
            if (end == text.length()) {
                break;
            }
            i += step;
        }

        log.debug("Chunked text ({} chars) into {} chunks (size={}, overlap={})",
                text.length(), chunks.size(), chunkSize, chunkOverlap);
        return chunks;
    }
}
