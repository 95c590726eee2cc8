package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.ExtractionFailureException;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.HealthStatus;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.domain.model.Summary;
import me.golemcore.memory.domain.model.SummaryKind;
import me.golemcore.memory.domain.model.SummarySearchHit;
import me.golemcore.memory.domain.model.SummaryStats;
import me.golemcore.memory.port.outbound.LlmPort;
import me.golemcore.memory.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SummarizerServiceTest {

    private static final String TERMINAL = "terminal";

    @TempDir
    Path tempDir;

    private TestWorkspace workspace;
    private TurnStoreService turnStore;
    private LlmPort llmPort;
    private SummarizerService summarizer;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(tempDir);
        turnStore = workspace.newTurnStore();
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.getCurrentModel()).thenReturn("gpt-4o-mini");
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("We fixed the parser and agreed on tests.").build()));
        summarizer = new SummarizerService(turnStore, llmPort, workspace.storage(), workspace.lockService(),
                workspace.objectMapper(), workspace.properties(), workspace.clock());
    }

    private void appendTurns(int count) {
        for (int i = 0; i < count; i++) {
            turnStore.append(i % 3 == 0 ? "discord" : TERMINAL, "Jeff", "message " + i);
        }
    }

    @Test
    void shouldSkipWhenBelowMinimumTurns() {
        appendTurns(5);

        assertTrue(summarizer.summarize(0, SummaryKind.WORK).isEmpty());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldSummarizeOldestRunWithoutPersisting() {
        appendTurns(12);

        Optional<Summary> summary = summarizer.summarize(0, SummaryKind.TECHNICAL);

        assertTrue(summary.isPresent());
        assertEquals(1, summary.get().getStartTurnId());
        assertEquals(12, summary.get().getEndTurnId());
        assertEquals(12, summary.get().getMessageCount());
        assertEquals(Set.of("discord", TERMINAL), summary.get().getChannels());
        assertEquals(SummaryKind.TECHNICAL, summary.get().getKind());
        assertEquals(12, summarizer.backlogCount());
        assertTrue(summarizer.all().isEmpty());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertTrue(captor.getValue().getUserMessage().contains("technical conversation (12 messages)"));
        assertTrue(captor.getValue().getUserMessage().contains("Jeff: message 11"));
    }

    @Test
    void shouldRespectLimit() {
        appendTurns(30);

        Summary summary = summarizer.summarize(10, SummaryKind.WORK).orElseThrow();

        assertEquals(1, summary.getStartTurnId());
        assertEquals(10, summary.getEndTurnId());
    }

    @Test
    void shouldStoreAndMarkRange() {
        appendTurns(12);

        Summary stored = summarizer.summarizeAndStore(0, SummaryKind.WORK).orElseThrow();

        assertEquals("summary_1_12", stored.getId());
        assertEquals(TestWorkspace.NOW, stored.getCreatedAt());
        assertEquals(0, summarizer.backlogCount());
        assertEquals("summary_1_12", turnStore.get(5).orElseThrow().getSummaryId());
        assertEquals(1, summarizer.all().size());
    }

    @Test
    void shouldTreatOverlappingStoreAsNoOp() {
        appendTurns(12);
        Summary first = summarizer.store(Summary.builder().startTurnId(1).endTurnId(6).text("first half").build());

        Summary again = summarizer.store(Summary.builder().startTurnId(4).endTurnId(9).text("overlap").build());

        assertEquals(first.getId(), again.getId());
        assertEquals("first half", again.getText());
        assertEquals(1, summarizer.all().size());
        assertEquals(6, summarizer.backlogCount());
    }

    @Test
    void shouldRestoreLostMarksInsteadOfResummarizing() {
        appendTurns(12);
        summarizer.summarizeAndStore(0, SummaryKind.WORK).orElseThrow();
        String turnsDirectory = workspace.properties().getTurns().getDirectory();
        workspace.storage().deleteObject(turnsDirectory, TurnStoreService.MARKS_FILE).join();
        assertEquals(12, summarizer.backlogCount());

        for (int i = 0; i < 3; i++) {
            assertTrue(summarizer.summarizeAndStore(0, SummaryKind.WORK).isEmpty());
        }

        verify(llmPort, times(1)).chat(any());
        assertEquals(0, summarizer.backlogCount());
        assertEquals("summary_1_12", turnStore.get(7).orElseThrow().getSummaryId());
        assertEquals(1, summarizer.all().size());
    }

    @Test
    void shouldRestoreMarksWhenStoringOverAnUnmarkedSummary() {
        appendTurns(12);
        Summary first = summarizer.store(Summary.builder().startTurnId(1).endTurnId(12).text("all of it").build());
        String turnsDirectory = workspace.properties().getTurns().getDirectory();
        workspace.storage().deleteObject(turnsDirectory, TurnStoreService.MARKS_FILE).join();

        Summary again = summarizer.store(Summary.builder().startTurnId(1).endTurnId(12).text("retry").build());

        assertEquals(first.getId(), again.getId());
        assertEquals(0, summarizer.backlogCount());
    }

    @Test
    void shouldRejectInvalidStore() {
        SubstrateException blank = assertThrows(SubstrateException.class,
                () -> summarizer.store(Summary.builder().startTurnId(1).endTurnId(2).text(" ").build()));
        assertEquals(ErrorKind.INVALID_REQUEST, blank.getKind());

        SubstrateException inverted = assertThrows(SubstrateException.class,
                () -> summarizer.store(Summary.builder().startTurnId(5).endTurnId(2).text("x").build()));
        assertEquals(ErrorKind.INVALID_REQUEST, inverted.getKind());
    }

    @Test
    void shouldLeaveTurnsUnsummarizedWhenLlmFails() {
        appendTurns(12);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("503")));

        assertThrows(ExtractionFailureException.class, () -> summarizer.summarizeAndStore(0, SummaryKind.WORK));

        assertEquals(12, summarizer.backlogCount());
        assertTrue(summarizer.all().isEmpty());
    }

    @Test
    void shouldFailWhenLlmUnavailable() {
        appendTurns(12);
        when(llmPort.isAvailable()).thenReturn(false);

        ExtractionFailureException thrown = assertThrows(ExtractionFailureException.class,
                () -> summarizer.summarize(0, SummaryKind.WORK));
        assertTrue(thrown.isRetryable());
    }

    @Test
    void shouldRankSearchByOccurrences() {
        appendTurns(20);
        summarizer.store(Summary.builder().startTurnId(1).endTurnId(5).text("Parser work. More parser work.").build());
        summarizer.store(Summary.builder().startTurnId(6).endTurnId(10).text("A parser mention.").build());
        summarizer.store(Summary.builder().startTurnId(11).endTurnId(15).text("Lunch.").build());

        List<SummarySearchHit> hits = summarizer.search("PARSER", 10);

        assertEquals(2, hits.size());
        assertEquals("summary_1_5", hits.get(0).summary().getId());
        assertEquals(0.7, hits.get(0).relevance(), 1e-9);
        assertEquals(0.5, hits.get(1).relevance(), 1e-9);
    }

    @Test
    void shouldListRecentNewestFirst() {
        appendTurns(20);
        summarizer.store(Summary.builder().startTurnId(1).endTurnId(5).text("one").build());
        summarizer.store(Summary.builder().startTurnId(6).endTurnId(10).text("two").build());

        List<Summary> recent = summarizer.recent(1);

        assertEquals(1, recent.size());
        assertEquals("summary_6_10", recent.get(0).getId());
        assertEquals(2, summarizer.since(null).size());
        assertTrue(summarizer.since(TestWorkspace.NOW).isEmpty());
    }

    @Test
    void shouldReportStatsAndBacklogHealth() {
        workspace.properties().getSummaries().setHealthyBacklog(3);
        workspace.properties().getSummaries().setHighBacklog(4);
        appendTurns(5);

        SummaryStats stats = summarizer.stats();

        assertEquals(5, stats.getUnsummarizedCount());
        assertTrue(stats.isNeedsSummarization());
        assertEquals(HealthStatus.DEGRADED, summarizer.health().getStatus());
    }
}
