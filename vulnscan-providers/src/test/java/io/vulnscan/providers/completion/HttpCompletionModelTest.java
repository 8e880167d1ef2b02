package io.vulnscan.providers.completion;

import io.vulnscan.TransientProviderException;
import io.vulnscan.providers.FakeProviderServer;
import io.vulnscan.providers.JsonHttpClient;
import io.vulnscan.providers.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpCompletionModelTest {

    private FakeProviderServer server;
    private HttpCompletionModel model;

    @BeforeEach
    void setUp() throws IOException {
        server = new FakeProviderServer();
        model = new HttpCompletionModel(server.endpoint("/v1/chat/completions", "gpt-4o-mini"),
            RetryPolicy.none(), new JsonHttpClient(Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void testReturnsTrimmedContent() {
        server.reply(200, "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  hello \\n\"}}]}");

        assertEquals("hello", model.complete("system", "user"));
        String request = server.requests().get(0);
        assertTrue(request.contains("\"role\":\"system\""));
        assertTrue(request.contains("\"max_tokens\":1000"));
    }

    @Test
    void testMissingChoicesIsServiceError() {
        server.reply(200, "{\"choices\":[]}");

        TransientProviderException e = assertThrows(TransientProviderException.class,
            () -> model.complete("s", "u"));
        assertEquals(TransientProviderException.Reason.SERVICE_ERROR, e.getReason());
    }
}
