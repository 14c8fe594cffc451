package com.ai.courseassistant.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkerTest {

    private final TextChunker chunker = new TextChunker(1000, 200);

    @Test
    @DisplayName("Short text yields a single chunk")
    void shortTextSingleChunk() {
        List<String> chunks = chunker.chunk("Neural networks are function approximators.");

        assertThat(chunks).containsExactly("Neural networks are function approximators.");
    }

    @Test
    @DisplayName("Chunks never exceed the window and consecutive chunks overlap")
    void windowAndOverlap() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 2600; i++) {
            sb.append((char) ('a' + i % 26));
        }
        String text = sb.toString();

        List<String> chunks = chunker.chunk(text);

        // windows start at 0, 800, 1600; the one at 1600 reaches the end
        assertThat(chunks).hasSize(3);
        assertThat(chunks).allSatisfy(c -> assertThat(c.length()).isLessThanOrEqualTo(1000));
        assertThat(chunks.get(0)).isEqualTo(text.substring(0, 1000));
        assertThat(chunks.get(1)).startsWith(text.substring(800, 1000));
        assertThat(chunks.get(2)).isEqualTo(text.substring(1600));
    }

    @Test
    @DisplayName("Whitespace-only windows are dropped")
    void blankWindowsDropped() {
        TextChunker small = new TextChunker(10, 2);
        String text = "abcdefghij" + " ".repeat(30) + "klmnopqrst";

        List<String> chunks = small.chunk(text);

        assertThat(chunks).isNotEmpty();
        assertThat(chunks).noneMatch(String::isBlank);
        assertThat(String.join("", chunks)).contains("abcdefgh").contains("klmnopqrst");
    }

    @Test
    void emptyTextYieldsNoChunks() {
        assertThat(chunker.chunk("")).isEmpty();
        assertThat(chunker.chunk("   \n\t ")).isEmpty();
        assertThat(chunker.chunk(null)).isEmpty();
    }

    @Test
    void rejectsOverlapNotSmallerThanSize() {
        assertThatThrownBy(() -> new TextChunker(100, 100))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
