package org.databridge.hierarchy.server;

import org.databridge.hierarchy.SampleProjects;
import org.databridge.hierarchy.model.Aggregation;
import org.databridge.hierarchy.model.FormulaGroup;
import org.databridge.hierarchy.model.FormulaRule;
import org.databridge.hierarchy.model.HierarchyNode;
import org.databridge.hierarchy.model.RuleOperation;
import org.databridge.hierarchy.model.TotalFormula;
import org.databridge.hierarchy.serialization.Json;
import org.databridge.hierarchy.store.InMemoryHierarchyStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the HTTP adapter over a real socket on an ephemeral port.
 */
class FormulaHttpServerTest {

    private static InMemoryHierarchyStore store;
    private static FormulaHttpServer server;
    private static HttpClient httpClient;
    private static String baseUrl;

    @BeforeAll
    static void setup() throws IOException {
        store = SampleProjects.incomeStatementStore();
        server = new FormulaHttpServer(0, new FormulaEngineService(store));
        server.start();
        baseUrl = "http://localhost:" + server.port();
        httpClient = HttpClient.newHttpClient();
        System.out.println("Test server started on port " + server.port());
    }

    @AfterAll
    static void teardown() {
        if (server != null) {
            server.stop();
        }
    }

    private static HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("GET /health answers ok")
    void testHealth() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertEquals("ok", Json.getString(Json.parseObject(response.body()), "status"));
    }

    @Nested
    @DisplayName("POST /api/formulas/validate")
    class Validate {

        @Test
        @DisplayName("A valid formula comes back normalized")
        void testValid() throws Exception {
            HttpResponse<String> response = post("/api/formulas/validate", """
                    {"projectId": "p1", "hierarchyId": "TOTAL_REVENUE", "kind": "total_formula",
                     "formula": {"aggregation": "SUM", "children": [
                        {"hierarchyId": "PRODUCT_REV"}, {"hierarchyId": "PRODUCT_REV"}, {"hierarchyId": "SERVICE_REV"}]}}
                    """);

            assertEquals(200, response.statusCode(), response.body());
            Map<String, Object> body = Json.parseObject(response.body());
            assertEquals(Boolean.TRUE, body.get("valid"));
            assertEquals(2, Json.getList(Json.getObject(body, "formula"), "children").size());
        }

        @Test
        @DisplayName("An invalid formula answers 422 with every violation")
        void testInvalid() throws Exception {
            HttpResponse<String> response = post("/api/formulas/validate", """
                    {"projectId": "p1", "hierarchyId": "GROSS_PROFIT", "kind": "FORMULA_GROUP",
                     "formula": {"rules": [
                        {"hierarchyId": "COGS", "constantNumber": 100, "operation": "ADD", "precedence": 1},
                        {"hierarchyId": "GROSS_PROFIT", "operation": "ADD", "precedence": 1}]}}
                    """);
            System.out.println(response.body());

            assertEquals(422, response.statusCode());
            List<Object> violations = Json.getList(Json.parseObject(response.body()), "violations");
            assertEquals(2, violations.size());
        }

        @Test
        @DisplayName("Malformed bodies answer 400")
        void testMalformed() throws Exception {
            assertEquals(400, post("/api/formulas/validate", "{not json").statusCode());
            assertEquals(400, post("/api/formulas/validate", "{\"projectId\": \"p1\"}").statusCode());
        }
    }

    @Test
    @DisplayName("GET evaluation-order lists nodes with ranks")
    void testEvaluationOrder() throws Exception {
        HttpResponse<String> response = get("/api/projects/p1/evaluation-order");

        assertEquals(200, response.statusCode());
        Map<String, Object> body = Json.parseObject(response.body());
        assertEquals(List.of("TOTAL_REVENUE", "GROSS_PROFIT", "GROSS_MARGIN_PCT"), Json.getList(body, "order"));
        assertEquals(3L, Json.getObject(body, "ranks").get("GROSS_MARGIN_PCT"));
    }

    @Test
    @DisplayName("GET sql renders one node for the requested dialect")
    void testNodeSql() throws Exception {
        HttpResponse<String> response = get("/api/projects/p1/hierarchies/GROSS_PROFIT/sql?dialect=mysql");

        assertEquals(200, response.statusCode());
        Map<String, Object> body = Json.parseObject(response.body());
        assertEquals("MySQL", body.get("dialect"));
        String sql = Json.getString(body, "sql");
        assertTrue(sql.startsWith("(SELECT `l`.`GROSS_PROFIT` FROM (SELECT "), sql);
        assertTrue(sql.contains("`src`.`cogs_value` AS `COGS`"), sql);

        assertEquals(400, get("/api/projects/p1/hierarchies/GROSS_PROFIT/sql?dialect=oracle").statusCode());
        assertEquals(404, get("/api/projects/p1/hierarchies/NOPE/sql").statusCode());
        assertEquals(404, get("/api/projects/nope/evaluation-order").statusCode());
    }

    @Test
    @DisplayName("A node whose dependency has an invalid stored formula answers 422 naming the dependency")
    void testFailedDependencySql() throws Exception {
        // GIVEN: BAD has no children, UP reads BAD
        store.createProject("broken", "Broken");
        for (String id : List.of("BAD", "UP")) {
            store.saveNode("broken", HierarchyNode.of(id, id));
        }
        store.saveTotalFormula("broken", "BAD", new TotalFormula("BAD", Aggregation.SUM, List.of()));
        store.saveFormulaGroup("broken", "UP", FormulaGroup.of("UP", FormulaRule.hierarchy("BAD", RuleOperation.ADD, 1)));

        // WHEN
        HttpResponse<String> invalid = get("/api/projects/broken/hierarchies/BAD/sql");
        HttpResponse<String> dependant = get("/api/projects/broken/hierarchies/UP/sql");
        HttpResponse<String> scripts = post("/api/projects/broken/scripts", "{\"dialect\": \"postgres\", \"kinds\": [\"view\"]}");

        // THEN
        assertEquals(422, invalid.statusCode());
        assertFalse(Json.getList(Json.parseObject(invalid.body()), "violations").isEmpty());
        assertEquals(422, dependant.statusCode());
        assertEquals("BAD", Json.getString(Json.parseObject(dependant.body()), "via"));

        assertEquals(200, scripts.statusCode());
        @SuppressWarnings("unchecked")
        Map<String, Object> bundle = (Map<String, Object>) Json.getList(Json.parseObject(scripts.body()), "bundles").get(0);
        List<Object> errors = Json.getList(bundle, "errors");
        assertEquals(2, errors.size());
        @SuppressWarnings("unchecked")
        Map<String, Object> up = (Map<String, Object>) errors.get(1);
        assertEquals("UP", up.get("hierarchyId"));
        assertEquals("FAILED_DEPENDENCY", up.get("reason"));
        assertEquals("BAD", up.get("via"));
    }

    @Nested
    @DisplayName("POST scripts")
    class Scripts {

        @Test
        @DisplayName("All dialects produce one bundle each")
        void testAllDialects() throws Exception {
            HttpResponse<String> response = post("/api/projects/p1/scripts", "{\"dialect\": \"all\"}");

            assertEquals(200, response.statusCode());
            List<Object> bundles = Json.getList(Json.parseObject(response.body()), "bundles");
            assertEquals(4, bundles.size());
        }

        @Test
        @DisplayName("A selected node and kind for one dialect")
        void testSelection() throws Exception {
            HttpResponse<String> response = post("/api/projects/p1/scripts",
                    "{\"dialect\": \"snowflake\", \"nodeIds\": [\"TOTAL_REVENUE\"], \"kinds\": [\"view\"]}");

            assertEquals(200, response.statusCode());
            @SuppressWarnings("unchecked")
            Map<String, Object> bundle = (Map<String, Object>) Json.getList(Json.parseObject(response.body()), "bundles").get(0);
            assertEquals(List.of("PRODUCT_REV", "SERVICE_REV", "TOTAL_REVENUE"), Json.getList(bundle, "emittedNodeIds"));
            assertTrue(Json.getString(Json.getObject(bundle, "scripts"), "VIEW")
                    .contains("CREATE OR REPLACE VIEW VW_DEMO_INCOME_HIERARCHY_VALUES AS"));
        }

        @Test
        @DisplayName("An unsupported kind for the dialect answers 400")
        void testUnsupported() throws Exception {
            HttpResponse<String> response = post("/api/projects/p1/scripts",
                    "{\"dialect\": \"mysql\", \"kinds\": [\"DYNAMIC_TABLE\"]}");

            assertEquals(400, response.statusCode());
            assertEquals("MySQL", Json.getString(Json.parseObject(response.body()), "dialect"));
        }
    }

    @Test
    @DisplayName("Unknown routes and wrong methods are rejected")
    void testRouting() throws Exception {
        assertEquals(404, get("/api/unknown").statusCode());
        assertEquals(405, get("/api/projects/p1/scripts").statusCode());
    }
}
