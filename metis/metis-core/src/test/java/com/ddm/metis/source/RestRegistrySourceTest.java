package com.ddm.metis.source;

import com.ddm.metis.codec.EntityCodecs;
import com.ddm.metis.defined.BusinessTerm;
import com.ddm.metis.defined.Kpi;
import com.ddm.metis.provider.BusinessGlossaryProvider;
import com.ddm.metis.provider.KpiProvider;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link RestRegistrySource} 类的单元测试。
 *
 * @author metis
 */
class RestRegistrySourceTest {

    private StubRestServer server;
    private final HttpClient http = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() throws Exception {
        server = new StubRestServer();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private RestRegistrySource<Kpi> kpis(String payloadColumn) {
        return new RestRegistrySource<>(http, server.baseUrl() + "/rest/v1/kpis", "secret-key",
                Duration.ofSeconds(2), KpiProvider.CODEC, payloadColumn);
    }

    @Test
    void testLoadAll_FlatRows() {
        server.respond(200, "[{\"id\":\"gross_margin\",\"name\":\"Gross Margin\"},{\"id\":\"net_income\"}]");
        List<Kpi> loaded = kpis(null).loadAll();

        assertEquals(List.of("gross_margin", "net_income"), loaded.stream().map(Kpi::id).toList());
        StubRestServer.Recorded req = server.lastRequest();
        assertEquals("GET", req.method());
        assertEquals("/rest/v1/kpis?select=*", req.uri());
        assertEquals("secret-key", req.apiKey());
        assertEquals("Bearer secret-key", req.authorization());
    }

    @Test
    void testLoadAll_TwoTierRows() {
        server.respond(200, "[{\"id\":\"k1\",\"name\":\"Column Name\",\"definition\":"
                + "{\"id\":\"k1\",\"name\":\"Payload Name\",\"metadata\":{\"altitude\":7}}},"
                + "{\"id\":\"k2\",\"definition\":\"{\\\"id\\\":\\\"k2\\\",\\\"unit\\\":\\\"%\\\"}\"}]");
        List<Kpi> loaded = kpis(null).loadAll();

        assertEquals("Column Name", loaded.get(0).name());
        assertEquals(7, loaded.get(0).metadata().get("altitude"));
        assertEquals("%", loaded.get(1).unit());
    }

    @Test
    void testLoadAll_MalformedRowsSkipped() {
        server.respond(200, "[{\"id\":\"ok\"},{\"name\":\"no id\"},42]");
        assertEquals(1, kpis(null).loadAll().size());
    }

    @Test
    void testLoadAll_ErrorStatus() {
        server.respond(503, "x".repeat(500));
        RegistrySourceException e = assertThrows(RegistrySourceException.class, () -> kpis(null).loadAll());
        assertTrue(e.getMessage().contains("503"));
        assertTrue(e.getMessage().length() < 400);
    }

    @Test
    void testLoadAll_NotAnArray() {
        server.respond(200, "{\"message\":\"hi\"}");
        assertThrows(RegistrySourceException.class, () -> kpis(null).loadAll());
    }

    @Test
    void testUpsert_FlatRow() throws Exception {
        server.respond(201, "");
        RestRegistrySource<BusinessTerm> glossary = new RestRegistrySource<>(http,
                server.baseUrl() + "/rest/v1/business_glossary_terms/", null, Duration.ofSeconds(2),
                BusinessGlossaryProvider.CODEC, null);
        glossary.upsert(BusinessTerm.of("Revenue", List.of("sales"), "Income from sales", Map.of("duckdb", "revenue")));

        StubRestServer.Recorded req = server.lastRequest();
        assertEquals("POST", req.method());
        assertEquals("/rest/v1/business_glossary_terms", req.uri());
        assertEquals("resolution=merge-duplicates", req.prefer());
        assertNull(req.apiKey());
        JsonNode body = EntityCodecs.JSON.readTree(req.body());
        assertEquals("revenue", body.get(0).get("id").asText());
        assertEquals("sales", body.get(0).get("synonyms").get(0).asText());
    }

    @Test
    void testUpsert_TwoTierRow() throws Exception {
        server.respond(201, "");
        kpis("definition").upsert(Kpi.fromLegacyLabel("GROSS_MARGIN", "Finance"));

        JsonNode row = EntityCodecs.JSON.readTree(server.lastRequest().body()).get(0);
        assertEquals("gross_margin", row.get("id").asText());
        assertEquals("Gross Margin", row.get("definition").get("name").asText());
        assertFalse(row.has("unit"));
    }

    @Test
    void testDelete() {
        server.respond(200, "[{\"id\":\"gross_margin\"}]");
        assertTrue(kpis(null).delete("gross_margin"));
        assertEquals("DELETE", server.lastRequest().method());
        assertEquals("/rest/v1/kpis?id=eq.gross_margin", server.lastRequest().uri());

        server.respond(200, "[]");
        assertFalse(kpis(null).delete("gross_margin"));
    }

    @Test
    void testTruncate() {
        server.respond(204, "");
        kpis(null).truncate();
        assertEquals("/rest/v1/kpis?id=not.is.null", server.lastRequest().uri());
    }

    @Test
    void testMissingEndpoint() {
        assertThrows(IllegalArgumentException.class,
                () -> new RestRegistrySource<>(http, " ", null, Duration.ofSeconds(1), KpiProvider.CODEC, null));
    }
}
