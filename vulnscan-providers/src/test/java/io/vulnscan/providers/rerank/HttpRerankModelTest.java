package io.vulnscan.providers.rerank;

import io.vulnscan.providers.FakeProviderServer;
import io.vulnscan.providers.JsonHttpClient;
import io.vulnscan.providers.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HttpRerankModelTest {

    private FakeProviderServer server;
    private HttpRerankModel model;

    @BeforeEach
    void setUp() throws IOException {
        server = new FakeProviderServer();
        model = new HttpRerankModel(server.endpoint("/v1/rerank", "rerank-2"),
            RetryPolicy.defaults().withSleeper(d -> { }), new JsonHttpClient(Duration.ofSeconds(5)));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void testResultsAreSortedBestFirst() {
        server.reply(200, "{\"results\":[{\"index\":0,\"relevance_score\":0.2},"
            + "{\"index\":2,\"relevance_score\":0.9},{\"index\":1,\"relevance_score\":0.5}]}");

        List<RerankResult> results = model.rerank("q", List.of("a", "b", "c"), 3);

        assertEquals(List.of(2, 1, 0), results.stream().map(RerankResult::index).toList());
        assertEquals(0.9f, results.get(0).score(), 1e-6);
        assertTrue(server.requests().get(0).contains("\"top_n\":3"));
        assertTrue(server.requests().get(0).contains("\"model\":\"rerank-2\""));
    }

    @Test
    void testOutOfRangeIndicesAreDropped() {
        server.reply(200, "{\"results\":[{\"index\":7,\"relevance_score\":0.99},{\"index\":0,\"relevance_score\":0.1}]}");

        List<RerankResult> results = model.rerank("q", List.of("a"), 5);

        assertEquals(1, results.size());
        assertEquals(0, results.get(0).index());
    }

    @Test
    void testEmptyDocumentsSkipTheCall() {
        assertTrue(model.rerank("q", List.of(), 5).isEmpty());
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void testServiceErrorIsRetried() {
        server.reply(503, "{}").reply(200, "{\"results\":[{\"index\":0,\"relevance_score\":0.8}]}");

        assertEquals(1, model.rerank("q", List.of("a"), 1).size());
        assertEquals(2, server.requests().size());
    }
}
