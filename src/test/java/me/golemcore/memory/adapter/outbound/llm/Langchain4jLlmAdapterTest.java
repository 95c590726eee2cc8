package me.golemcore.memory.adapter.outbound.llm;

import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class Langchain4jLlmAdapterTest {

    private MemoryProperties properties;
    private List<ChatModel> created;
    private Langchain4jLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        properties.getLlm().setApiKey("test-key");
        properties.getLlm().setModel("gpt-4o-mini");
        created = new ArrayList<>();
        adapter = new Langchain4jLlmAdapter(properties) {
            @Override
            protected ChatModel createModel(MemoryProperties.LlmProperties config) {
                ChatModel model = mock(ChatModel.class);
                when(model.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder()
                        .aiMessage(AiMessage.from("reply " + (created.size() + 1)))
                        .build());
                created.add(model);
                return model;
            }
        };
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        properties.getLlm().setApiKey(" ");

        assertFalse(adapter.isAvailable());
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> adapter.chat(LlmRequest.builder().userMessage("hi").build()).join());
        assertTrue(thrown.getCause() instanceof IllegalStateException);
        assertTrue(created.isEmpty());
    }

    @Test
    void shouldSendSystemAndUserMessages() {
        LlmResponse response = adapter.chat(LlmRequest.builder()
                .systemPrompt("You summarize.")
                .userMessage("Summarize this.")
                .maxTokens(500)
                .build()).join();

        assertEquals("reply 1", response.getContent());
        assertEquals("gpt-4o-mini", response.getModel());
        assertEquals("stop", response.getFinishReason());

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(created.get(0)).chat(captor.capture());
        ChatRequest request = captor.getValue();
        assertEquals(2, request.messages().size());
        assertTrue(request.messages().get(0) instanceof SystemMessage);
        assertEquals(500, request.maxOutputTokens());
    }

    @Test
    void shouldReuseHandleUntilReconnect() {
        adapter.chat(LlmRequest.builder().userMessage("one").build()).join();
        adapter.chat(LlmRequest.builder().userMessage("two").build()).join();
        assertEquals(1, created.size());

        adapter.reconnect();
        LlmResponse response = adapter.chat(LlmRequest.builder().userMessage("three").build()).join();

        assertEquals(2, created.size());
        assertEquals("reply 2", response.getContent());
    }

    @Test
    void shouldPropagateModelFailure() {
        adapter.chat(LlmRequest.builder().userMessage("warm up").build()).join();
        when(created.get(0).chat(any(ChatRequest.class))).thenThrow(new RuntimeException("rate limited"));

        CompletionException thrown = assertThrows(CompletionException.class,
                () -> adapter.chat(LlmRequest.builder().userMessage("again").build()).join());
        assertEquals("rate limited", thrown.getCause().getMessage());
    }
}
