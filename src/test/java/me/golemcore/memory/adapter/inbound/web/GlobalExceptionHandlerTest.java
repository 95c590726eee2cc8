package me.golemcore.memory.adapter.inbound.web;

import me.golemcore.memory.domain.exception.ChainIntegrityViolationException;
import me.golemcore.memory.domain.exception.LockContendedException;
import me.golemcore.memory.domain.exception.SubstrateException;
import me.golemcore.memory.domain.model.ErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapSubstrateErrorsWithKind() {
        StepVerifier.create(handler.handleSubstrate(new LockContendedException("turns-entity")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.LOCKED, response.getStatusCode());
                    assertEquals("LOCK_CONTENDED", response.getBody().getErrorKind());
                    assertTrue(response.getBody().isRetryable());
                })
                .verifyComplete();

        StepVerifier.create(handler.handleSubstrate(new ChainIntegrityViolationException("not latest")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertFalse(response.getBody().isRetryable());
                })
                .verifyComplete();
    }

    @Test
    void shouldKeepResponseStatus() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown tool: x")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("Unknown tool: x", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrors() {
        StepVerifier.create(handler.handleGeneric(new IllegalStateException("secret path /root")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapEveryErrorKind() {
        assertEquals(HttpStatus.BAD_REQUEST, ErrorStatusMapper.statusOf(ErrorKind.INVALID_REQUEST));
        assertEquals(HttpStatus.CONFLICT, ErrorStatusMapper.statusOf(ErrorKind.SYNC_DRIFT));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ErrorStatusMapper.statusOf(ErrorKind.STORAGE_UNAVAILABLE));
        assertEquals(HttpStatus.BAD_GATEWAY, ErrorStatusMapper.statusOf(ErrorKind.EXTRACTION_FAILURE));
        assertEquals(HttpStatus.OK, ErrorStatusMapper.statusOf(ErrorKind.IDEMPOTENCY_VIOLATION));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ErrorStatusMapper.statusOf(null));
        assertEquals(HttpStatus.BAD_REQUEST,
                ErrorStatusMapper.statusOf(new SubstrateException(ErrorKind.INVALID_REQUEST, "x").getKind()));
    }
}
