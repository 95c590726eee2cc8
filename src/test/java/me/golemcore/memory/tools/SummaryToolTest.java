package me.golemcore.memory.tools;

import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.Summary;
import me.golemcore.memory.domain.model.SummaryKind;
import me.golemcore.memory.domain.model.SummarySearchHit;
import me.golemcore.memory.domain.model.SummaryStats;
import me.golemcore.memory.domain.model.ToolResult;
import me.golemcore.memory.domain.service.SummarizerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SummaryToolTest {

    private SummarizerService summarizer;
    private SummaryTool tool;

    @BeforeEach
    void setUp() {
        summarizer = mock(SummarizerService.class);
        tool = new SummaryTool(summarizer);
    }

    @Test
    void shouldReportTooFewTurns() {
        when(summarizer.summarize(0, SummaryKind.WORK)).thenReturn(Optional.empty());
        when(summarizer.backlogCount()).thenReturn(4L);

        ToolResult result = tool.execute(Map.of("operation", "summarize_messages")).join();

        assertEquals("Not enough unsummarized turns yet (4 pending).", result.getOutput());
    }

    @Test
    void shouldReturnDraftWithoutStoring() {
        when(summarizer.summarize(30, SummaryKind.TECHNICAL))
                .thenReturn(Optional.of(summary(1, 30, "parser work")));

        ToolResult result = tool.execute(Map.of("operation", "summarize_messages", "limit", 30,
                "kind", "technical")).join();

        assertTrue(result.getOutput().startsWith("Summary of turns 1..30 (not stored yet"));
        verify(summarizer, never()).store(any());
    }

    @Test
    void shouldStoreWithChannels() {
        when(summarizer.store(any())).thenAnswer(inv -> {
            Summary s = inv.getArgument(0);
            return s.toBuilder().id("summary_" + s.getStartTurnId() + "_" + s.getEndTurnId()).build();
        });

        ToolResult result = tool.execute(Map.of("operation", "store_summary", "start_turn_id", 1,
                "end_turn_id", "20", "text", "we talked", "channels", List.of("terminal", "discord"))).join();

        assertEquals("Stored summary_1_20", result.getOutput());
        ArgumentCaptor<Summary> captor = ArgumentCaptor.forClass(Summary.class);
        verify(summarizer).store(captor.capture());
        assertEquals(Set.of("terminal", "discord"), captor.getValue().getChannels());
        assertEquals(SummaryKind.WORK, captor.getValue().getKind());
    }

    @Test
    void shouldExplainOverlapNoOp() {
        when(summarizer.store(any())).thenReturn(summary(1, 20, "existing"));

        ToolResult result = tool.execute(Map.of("operation", "store_summary", "start_turn_id", 5,
                "end_turn_id", 25, "text", "again")).join();

        assertTrue(result.isSuccess());
        assertEquals("Range overlaps summary_1_20 (1..20); nothing stored", result.getOutput());
    }

    @Test
    void shouldRequireRangeForStore() {
        ToolResult result = tool.execute(Map.of("operation", "store_summary", "text", "orphan")).join();

        assertEquals(ErrorKind.INVALID_REQUEST, result.getErrorKind());
        verifyNoInteractions(summarizer);
    }

    @Test
    void shouldRejectNonNumericRange() {
        ToolResult result = tool.execute(Map.of("operation", "store_summary", "start_turn_id", "one",
                "end_turn_id", 2, "text", "x")).join();

        assertEquals(ErrorKind.INVALID_REQUEST, result.getErrorKind());
    }

    @Test
    void shouldFormatSearchHits() {
        when(summarizer.search("parser", 10))
                .thenReturn(List.of(new SummarySearchHit(summary(1, 20, "parser work"), 0.7)));

        ToolResult result = tool.execute(Map.of("operation", "search_summaries", "query", "parser")).join();

        assertEquals("[summary_1_20, technical, turns 1..20] (0.70)\nparser work", result.getOutput());
    }

    @Test
    void shouldReportStats() {
        when(summarizer.stats()).thenReturn(SummaryStats.builder()
                .unsummarizedCount(120)
                .totalSummaries(3)
                .needsSummarization(true)
                .build());

        ToolResult result = tool.execute(Map.of("operation", "summary_stats")).join();

        assertEquals("120 unsummarized turns, 3 summaries (summarization recommended)", result.getOutput());
    }

    @Test
    void shouldReportNoRecentSummaries() {
        when(summarizer.recent(5)).thenReturn(List.of());

        ToolResult result = tool.execute(Map.of("operation", "get_recent_summaries")).join();

        assertEquals("No summaries yet.", result.getOutput());
    }

    private static Summary summary(long start, long end, String text) {
        return Summary.builder()
                .id("summary_" + start + "_" + end)
                .startTurnId(start)
                .endTurnId(end)
                .kind(SummaryKind.TECHNICAL)
                .text(text)
                .build();
    }
}
