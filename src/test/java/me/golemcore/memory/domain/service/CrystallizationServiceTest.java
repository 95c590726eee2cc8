package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.exception.ChainIntegrityViolationException;
import me.golemcore.memory.domain.exception.ExtractionFailureException;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.Crystal;
import me.golemcore.memory.domain.model.CrystalListing;
import me.golemcore.memory.domain.model.CrystallizationTrigger;
import me.golemcore.memory.domain.model.ErrorKind;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.domain.model.Summary;
import me.golemcore.memory.domain.model.Turn;
import me.golemcore.memory.port.outbound.LlmPort;
import me.golemcore.memory.testsupport.TestWorkspace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CrystallizationServiceTest {

    private static final String CRYSTAL = """
            ## Field State
            Late evening, terminal session.

            ## Key Events
            The parser was rewritten.

            ## Decisions
            Keep the append-only log.

            ## Internal Arc
            Steady and focused.

            ## Continuity Seeds
            Finish the ingestion tests.""";

    @TempDir
    Path tempDir;

    private TestWorkspace workspace;
    private TurnStoreService turnStore;
    private SummarizerService summarizer;
    private CrystalChainStore chainStore;
    private LlmPort llmPort;
    private CrystallizationService service;

    @BeforeEach
    void setUp() {
        workspace = new TestWorkspace(tempDir);
        turnStore = workspace.newTurnStore();
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.getCurrentModel()).thenReturn("gpt-4o-mini");
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content(CRYSTAL).build()));
        summarizer = new SummarizerService(turnStore, llmPort, workspace.storage(), workspace.lockService(),
                workspace.objectMapper(), workspace.properties(), workspace.clock());
        chainStore = new CrystalChainStore(workspace.storage(), workspace.properties());
        service = new CrystallizationService(turnStore, summarizer, chainStore, llmPort, workspace.lockService(),
                workspace.properties(), workspace.clock());
    }

    private void appendTurns(int count) {
        for (int i = 1; i <= count; i++) {
            turnStore.append("terminal", "Jeff", "message " + i);
        }
    }

    private void crystallizeManually(int times) {
        for (int i = 0; i < times; i++) {
            service.crystallize(CRYSTAL);
        }
    }

    private static List<Integer> sequences(List<Crystal> crystals) {
        return crystals.stream().map(Crystal::getSequence).toList();
    }

    @Test
    void shouldNotTriggerWithoutNewTurns() {
        CrystallizationTrigger trigger = service.checkTrigger();

        assertFalse(trigger.triggered());
        assertEquals(0, trigger.turnsSince());
    }

    @Test
    void shouldNotTriggerBelowThresholds() {
        appendTurns(10);

        CrystallizationTrigger trigger = service.checkTrigger();

        assertFalse(trigger.triggered());
        assertEquals(10, trigger.turnsSince());
    }

    @Test
    void shouldTriggerOnHoursWithPendingTurns() {
        turnStore.append(Turn.builder().channel("discord").author("Jeff").content("good night")
                .createdAt(TestWorkspace.NOW.minus(Duration.ofHours(25))).build());

        CrystallizationTrigger trigger = service.checkTrigger();

        assertTrue(trigger.triggered());
        assertEquals(25.0, trigger.hoursSince(), 0.01);
    }

    @Test
    void shouldCreateExactlyOneCrystalForFiftyOneTurns() {
        appendTurns(51);

        Optional<Crystal> first = service.crystallizeIfDue();
        Optional<Crystal> second = service.crystallizeIfDue();

        assertTrue(first.isPresent());
        assertTrue(second.isEmpty());
        assertEquals(51, first.get().getThroughTurnId());
        assertEquals(1, chainStore.current().size());
        assertEquals(0, service.checkTrigger().turnsSince());
    }

    @Test
    void shouldPersistCrystalMetadata() {
        appendTurns(3);

        Crystal crystal = service.crystallize(null);

        assertEquals(1, crystal.getSequence());
        assertEquals("crystal_001.md", crystal.getFilename());
        assertEquals(CRYSTAL.strip().length() / 4, crystal.getTokenEstimate());
        Crystal reloaded = chainStore.latest().orElseThrow();
        assertEquals(3, reloaded.getThroughTurnId());
        assertEquals(TestWorkspace.NOW, reloaded.getCreatedAt());
        assertEquals(CRYSTAL.strip(), reloaded.getContent());
    }

    @Test
    void shouldKeepWindowOfMinWindowAndCount() {
        crystallizeManually(2);
        assertEquals(2, chainStore.current().size());
        assertTrue(chainStore.archived().isEmpty());

        crystallizeManually(4);

        CrystalListing listing = service.listCrystals();
        assertEquals(List.of(3, 4, 5, 6), sequences(listing.current()));
        assertEquals(List.of(1, 2), sequences(listing.archived()));
    }

    @Test
    void shouldRotateOldestIntoArchiveOnFifthCrystal() {
        crystallizeManually(4);
        assertTrue(chainStore.archived().isEmpty());

        Crystal fifth = service.crystallize(CRYSTAL);

        assertEquals(5, fifth.getSequence());
        assertEquals(List.of(2, 3, 4, 5), sequences(chainStore.current()));
        assertEquals(List.of(1), sequences(chainStore.archived()));
        assertTrue(chainStore.archived().get(0).isArchived());
    }

    @Test
    void shouldReturnNewestCrystalsOldestFirstAcrossArchive() {
        crystallizeManually(6);

        assertEquals(List.of(5, 6), sequences(service.getCrystals(2)));
        assertEquals(List.of(2, 3, 4, 5, 6), sequences(service.getCrystals(5)));
        assertEquals(List.of(1, 2, 3, 4, 5, 6), sequences(service.getCrystals(50)));
    }

    @Test
    void shouldOnlyDeleteLatestCrystal() {
        crystallizeManually(5);

        assertThrows(ChainIntegrityViolationException.class, () -> service.deleteLatest("crystal_003.md"));
        assertEquals(4, chainStore.current().size());

        Crystal deleted = service.deleteLatest("crystal_005.md");

        assertEquals(5, deleted.getSequence());
        assertEquals(List.of(2, 3, 4), sequences(chainStore.current()));
        assertEquals(List.of(1), sequences(chainStore.archived()));
        assertEquals(5, chainStore.nextSequence());
    }

    @Test
    void shouldRejectDeleteWithEmptyWindow() {
        SubstrateException thrown = assertThrows(SubstrateException.class, () -> service.deleteLatest(null));
        assertEquals(ErrorKind.INVALID_REQUEST, thrown.getKind());
    }

    @Test
    void shouldLeaveChainUntouchedWhenLlmFails() {
        crystallizeManually(4);
        appendTurns(5);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("timeout")));

        assertThrows(ExtractionFailureException.class, () -> service.crystallize(null));

        assertEquals(List.of(1, 2, 3, 4), sequences(chainStore.current()));
        assertTrue(chainStore.archived().isEmpty());
        assertEquals(5, service.checkTrigger().turnsSince());
    }

    @Test
    void shouldRejectLlmCrystalMissingSections() {
        appendTurns(5);
        when(llmPort.chat(any())).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("## Field State\nonly this").build()));

        assertThrows(ExtractionFailureException.class, () -> service.crystallize(null));
        assertTrue(chainStore.current().isEmpty());
    }

    @Test
    void shouldRejectManualCrystalMissingSections() {
        SubstrateException thrown = assertThrows(SubstrateException.class,
                () -> service.crystallize("## Field State\n## Decisions"));

        assertEquals(ErrorKind.INVALID_REQUEST, thrown.getKind());
        assertTrue(thrown.getMessage().contains("Key Events"));
        assertTrue(chainStore.current().isEmpty());
    }

    @Test
    void shouldBuildPromptFromPreviousCrystalSummariesAndUnsummarizedTurns() {
        service.crystallize(CRYSTAL);
        appendTurns(10);
        SummarizerService later = new SummarizerService(turnStore, llmPort, workspace.storage(),
                workspace.lockService(), workspace.objectMapper(), workspace.properties(),
                Clock.offset(workspace.clock(), Duration.ofMinutes(5)));
        later.store(Summary.builder().startTurnId(1).endTurnId(5).text("Summary of the parser work").build());

        service.crystallize(null);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        String prompt = captor.getValue().getUserMessage();
        assertTrue(prompt.contains("Target compression: about 6:1"));
        assertTrue(prompt.contains("Previous crystal (crystal_001.md)"));
        assertTrue(prompt.contains("Summary of the parser work"));
        assertTrue(prompt.contains("message 7"));
        assertFalse(prompt.contains("message 2"));
    }
}
