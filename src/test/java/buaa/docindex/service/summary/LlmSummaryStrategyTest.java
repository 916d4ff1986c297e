package buaa.docindex.service.summary;

import buaa.docindex.client.LlmChatClient;
import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ServiceException;
import buaa.docindex.config.LlmConfiguration;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class LlmSummaryStrategyTest {

    private final LlmChatClient chatClient = mock(LlmChatClient.class);
    private final LlmSummaryStrategy strategy = new LlmSummaryStrategy(chatClient, new LlmConfiguration());

    @Test
    void returnsModelSummary() {
        when(chatClient.complete(anyString())).thenReturn("  Revenue grew.  ");
        assertEquals(Optional.of("Revenue grew."), strategy.attempt("x".repeat(500), 100));
    }

    @Test
    void sendsOnlyBoundedPrefix() {
        when(chatClient.complete(anyString())).thenReturn("ok");
        String text = "a".repeat(1990) + "b".repeat(500);

        strategy.attempt(text, 100);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatClient).complete(prompt.capture());
        assertTrue(prompt.getValue().contains("approximately 100 characters"));
        assertTrue(prompt.getValue().contains("a".repeat(1990) + "b".repeat(10)));
        assertFalse(prompt.getValue().contains("b".repeat(11)));
    }

    @Test
    void emptyOnFailureBlankOrOversizedResult() {
        when(chatClient.complete(anyString()))
            .thenThrow(new ServiceException("timeout", DocIndexErrorCode.LLM_API_ERROR));
        assertTrue(strategy.attempt("x".repeat(500), 100).isEmpty());

        LlmChatClient blankClient = mock(LlmChatClient.class);
        when(blankClient.complete(anyString())).thenReturn("   ");
        assertTrue(new LlmSummaryStrategy(blankClient, new LlmConfiguration()).attempt("x".repeat(500), 100).isEmpty());

        LlmChatClient verboseClient = mock(LlmChatClient.class);
        when(verboseClient.complete(anyString())).thenReturn("y".repeat(151));
        LlmSummaryStrategy verbose = new LlmSummaryStrategy(verboseClient, new LlmConfiguration());
        assertTrue(verbose.attempt("x".repeat(500), 100).isEmpty());

        LlmChatClient slightlyLongClient = mock(LlmChatClient.class);
        when(slightlyLongClient.complete(anyString())).thenReturn("y".repeat(150));
        LlmSummaryStrategy slightlyLong = new LlmSummaryStrategy(slightlyLongClient, new LlmConfiguration());
        assertEquals(150, slightlyLong.attempt("x".repeat(500), 100).orElseThrow().length());
    }
}
