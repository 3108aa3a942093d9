package org.databridge.hierarchy.server;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.databridge.hierarchy.NotFoundException;
import org.databridge.hierarchy.compiler.DanglingReferenceException;
import org.databridge.hierarchy.compiler.FailedDependencyException;
import org.databridge.hierarchy.config.EngineSettings;
import org.databridge.hierarchy.model.FormulaKind;
import org.databridge.hierarchy.model.NodeFormula;
import org.databridge.hierarchy.resolve.CircularDependencyException;
import org.databridge.hierarchy.resolve.EvaluationOrder;
import org.databridge.hierarchy.script.ArtifactKind;
import org.databridge.hierarchy.script.NodeError;
import org.databridge.hierarchy.script.NodeSelection;
import org.databridge.hierarchy.script.ScriptAssembler;
import org.databridge.hierarchy.script.ScriptBundle;
import org.databridge.hierarchy.serialization.FormulaJson;
import org.databridge.hierarchy.serialization.Json;
import org.databridge.hierarchy.store.InMemoryHierarchyStore;
import org.databridge.hierarchy.transpiler.SQLDialect;
import org.databridge.hierarchy.transpiler.UnsupportedDialectOperationException;
import org.databridge.hierarchy.validation.InvalidFormulaException;
import org.databridge.hierarchy.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * JSON over HTTP front of {@link FormulaEngineService}.
 *
 * <pre>
 * GET  /health
 * POST /api/formulas/validate                          {projectId, hierarchyId, kind, formula}
 * GET  /api/projects/{p}/evaluation-order
 * GET  /api/projects/{p}/hierarchies/{h}/sql?dialect=
 * POST /api/projects/{p}/scripts                       {nodeIds?, kinds?, dialect}
 * </pre>
 */
public class FormulaHttpServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormulaHttpServer.class);

    private static final String API_PREFIX = "/api/";
    private static final String ALL_DIALECTS = "all";

    private final HttpServer server;
    private final FormulaEngineService service;
    private final List<Route> routes = new ArrayList<>();

    /**
     * @param port Port to bind, 0 for an ephemeral one
     */
    public FormulaHttpServer(int port, FormulaEngineService service) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.service = service;
        setupRoutes();
    }

    private void setupRoutes() {
        routes.add(new Route("POST", "/api/formulas/validate", this::validate));
        routes.add(new Route("GET", "/api/projects/{projectId}/evaluation-order", this::evaluationOrder));
        routes.add(new Route("GET", "/api/projects/{projectId}/hierarchies/{hierarchyId}/sql", this::nodeSql));
        routes.add(new Route("POST", "/api/projects/{projectId}/scripts", this::scripts));

        server.createContext("/health", exchange -> {
            addCorsHeaders(exchange);
            sendResponse(exchange, 200, "{\"status\":\"ok\"}");
        });
        server.createContext(API_PREFIX, this::dispatch);

        // CORS preflight for everything else
        server.createContext("/", exchange -> {
            if ("OPTIONS".equals(exchange.getRequestMethod())) {
                addCorsHeaders(exchange);
                exchange.sendResponseHeaders(204, -1);
            } else {
                exchange.sendResponseHeaders(404, -1);
            }
            exchange.close();
        });
    }

    private void dispatch(HttpExchange exchange) throws IOException {
        addCorsHeaders(exchange);
        String method = exchange.getRequestMethod();
        if ("OPTIONS".equals(method)) {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return;
        }

        String path = exchange.getRequestURI().getPath();
        boolean pathMatched = false;
        for (Route route : routes) {
            Map<String, String> params = route.match(path);
            if (params == null) {
                continue;
            }
            pathMatched = true;
            if (!route.method().equals(method)) {
                continue;
            }
            handle(exchange, route, params);
            return;
        }
        if (pathMatched) {
            sendError(exchange, 405, "Method " + method + " not allowed on " + path, Map.of());
        } else {
            sendError(exchange, 404, "No route for " + path, Map.of());
        }
    }

    private void handle(HttpExchange exchange, Route route, Map<String, String> params) throws IOException {
        try {
            Object body = route.handler().handle(new Request(exchange, params));
            sendResponse(exchange, 200, Json.toJson(body));
        } catch (InvalidFormulaException e) {
            sendError(exchange, 422, e.getMessage(), Map.of("violations", violationsToList(e.violations())));
        } catch (CircularDependencyException e) {
            sendError(exchange, 409, e.getMessage(), Map.of("cycle", e.cycle()));
        } catch (DanglingReferenceException e) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("hierarchyId", e.hierarchyId());
            detail.put("missingIds", e.missingIds());
            detail.put("via", e.via());
            sendError(exchange, 422, e.getMessage(), detail);
        } catch (FailedDependencyException e) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("hierarchyId", e.hierarchyId());
            detail.put("via", e.via());
            sendError(exchange, 422, e.getMessage(), detail);
        } catch (UnsupportedDialectOperationException e) {
            sendError(exchange, 400, e.getMessage(),
                    Map.of("dialect", e.dialect(), "operation", e.operation()));
        } catch (NotFoundException e) {
            sendError(exchange, 404, e.getMessage(), Map.of());
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, e.getMessage(), Map.of());
        } catch (RuntimeException e) {
            LOGGER.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            sendError(exchange, 500, String.valueOf(e.getMessage()), Map.of());
        }
    }

    // ========== HANDLERS ==========

    private Object validate(Request request) throws IOException {
        Map<String, Object> body = request.jsonBody();
        String projectId = required(body, "projectId");
        String hierarchyId = required(body, "hierarchyId");
        FormulaKind kind = formulaKind(required(body, "kind"));
        Map<String, Object> payload = Json.getObject(body, "formula");
        if (payload == null) {
            throw new IllegalArgumentException("Missing 'formula' object");
        }

        NodeFormula formula = service.validateFormula(projectId, hierarchyId,
                FormulaJson.readFormula(kind, hierarchyId, payload));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("valid", true);
        response.put("kind", formula.kind().name());
        response.put("formula", FormulaJson.toMap(formula));
        return response;
    }

    private Object evaluationOrder(Request request) {
        EvaluationOrder order = service.resolveEvaluationOrder(request.param("projectId"));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("order", order.order());
        Map<String, Object> ranks = new LinkedHashMap<>();
        for (String nodeId : order.order()) {
            ranks.put(nodeId, order.rankOf(nodeId));
        }
        response.put("ranks", ranks);
        response.put("components", order.components());
        Map<String, Object> dangling = new LinkedHashMap<>();
        for (String nodeId : order.order()) {
            if (!order.danglingReferencesOf(nodeId).isEmpty()) {
                dangling.put(nodeId, order.danglingReferencesOf(nodeId));
            }
        }
        response.put("dangling", dangling);
        return response;
    }

    private Object nodeSql(Request request) {
        String dialectName = request.query("dialect");
        SQLDialect dialect = dialectName == null ? SQLDialect.POSTGRES : SQLDialect.fromName(dialectName);
        String projectId = request.param("projectId");
        String hierarchyId = request.param("hierarchyId");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("projectId", projectId);
        response.put("hierarchyId", hierarchyId);
        response.put("dialect", dialect.name());
        response.put("sql", service.compileNode(projectId, hierarchyId, dialect));
        return response;
    }

    private Object scripts(Request request) throws IOException {
        Map<String, Object> body = request.jsonBody();
        String projectId = request.param("projectId");
        NodeSelection selection = selection(body);
        String dialectName = Json.getString(body, "dialect");

        List<Object> bundles = new ArrayList<>();
        if (dialectName == null || ALL_DIALECTS.equalsIgnoreCase(dialectName.trim())) {
            Set<ArtifactKind> kinds = kinds(body, null);
            service.generateScriptsForAllDialects(projectId, selection, kinds)
                    .values()
                    .forEach(bundle -> bundles.add(bundleToMap(bundle)));
        } else {
            SQLDialect dialect = SQLDialect.fromName(dialectName);
            Set<ArtifactKind> kinds = kinds(body, dialect);
            bundles.add(bundleToMap(service.generateScripts(projectId, selection, kinds, dialect)));
        }
        return Map.of("bundles", bundles);
    }

    // ========== HELPERS ==========

    private static NodeSelection selection(Map<String, Object> body) {
        List<Object> nodeIds = Json.getList(body, "nodeIds");
        if (nodeIds == null || Boolean.TRUE.equals(body.get("all"))) {
            return NodeSelection.all();
        }
        List<String> ids = new ArrayList<>();
        for (Object nodeId : nodeIds) {
            ids.add(String.valueOf(nodeId));
        }
        return NodeSelection.of(ids);
    }

    /**
     * Requested kinds, or every kind the dialect supports when none are named.
     */
    private static Set<ArtifactKind> kinds(Map<String, Object> body, SQLDialect dialect) {
        List<Object> rawKinds = Json.getList(body, "kinds");
        Set<ArtifactKind> kinds = EnumSet.noneOf(ArtifactKind.class);
        if (rawKinds == null || rawKinds.isEmpty()) {
            for (ArtifactKind kind : ArtifactKind.values()) {
                if (dialect == null || ScriptAssembler.supports(dialect, kind)) {
                    kinds.add(kind);
                }
            }
            return kinds;
        }
        for (Object rawKind : rawKinds) {
            kinds.add(ArtifactKind.fromName(String.valueOf(rawKind)));
        }
        return kinds;
    }

    private static Map<String, Object> bundleToMap(ScriptBundle bundle) {
        Map<String, Object> scripts = new LinkedHashMap<>();
        bundle.scripts().forEach((kind, sql) -> scripts.put(kind.name(), sql));
        List<Object> errors = new ArrayList<>();
        for (NodeError error : bundle.errors()) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("hierarchyId", error.hierarchyId());
            detail.put("reason", error.reason().name());
            detail.put("message", error.message());
            detail.put("missingIds", error.missingIds());
            detail.put("via", error.via());
            detail.put("violations", violationsToList(error.violations()));
            errors.add(detail);
        }
        List<Object> unsupported = new ArrayList<>();
        bundle.unsupportedKinds().forEach(kind -> unsupported.add(kind.name()));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("dialect", bundle.dialect().name());
        map.put("scripts", scripts);
        map.put("emittedNodeIds", bundle.emittedNodeIds());
        map.put("errors", errors);
        map.put("unsupportedKinds", unsupported);
        return map;
    }

    private static List<Object> violationsToList(List<Violation> violations) {
        List<Object> list = new ArrayList<>();
        for (Violation violation : violations) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("ruleIndex", violation.ruleIndex());
            detail.put("hierarchyId", violation.hierarchyId());
            detail.put("message", violation.message());
            list.add(detail);
        }
        return list;
    }

    private static FormulaKind formulaKind(String name) {
        try {
            return FormulaKind.valueOf(name.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown formula kind: " + name, e);
        }
    }

    private static String required(Map<String, Object> body, String key) {
        String value = Json.getString(body, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing '" + key + "'");
        }
        return value;
    }

    private static void sendError(HttpExchange exchange, int status, String message, Map<String, ?> detail)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.putAll(detail);
        sendResponse(exchange, status, Json.toJson(body));
    }

    public static void addCorsHeaders(HttpExchange exchange) {
        var headers = exchange.getResponseHeaders();
        headers.add("Access-Control-Allow-Origin", "*");
        headers.add("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        headers.add("Access-Control-Allow-Headers", "Content-Type");
    }

    public static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static void sendResponse(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    public void start() {
        server.setExecutor(null);
        server.start();
        LOGGER.info("Formula engine HTTP server started on port {}", port());
    }

    public void stop() {
        server.stop(0);
        LOGGER.info("Formula engine HTTP server stopped");
    }

    public int port() {
        return server.getAddress().getPort();
    }

    /**
     * Starts a server over a project snapshot file, taken from the first argument or the
     * {@code snapshot.path} setting.
     */
    public static void main(String[] args) throws IOException {
        EngineSettings settings = EngineSettings.load();
        InMemoryHierarchyStore store = new InMemoryHierarchyStore();

        Path snapshot = args.length > 0 ? Path.of(args[0]) : settings.snapshotPath().orElse(null);
        if (snapshot != null) {
            store.load(FormulaJson.readProject(Files.readString(snapshot, StandardCharsets.UTF_8)));
            LOGGER.info("Loaded project snapshot {}", snapshot);
        } else {
            LOGGER.warn("No project snapshot configured, starting with an empty store");
        }

        FormulaEngineService service = new FormulaEngineService(store, settings.sourceMapping(),
                settings.scriptOptions(), ForkJoinPool.commonPool(), settings.compilationCache());
        FormulaHttpServer server = new FormulaHttpServer(settings.serverPort(), service);
        server.start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
    }

    // ========== ROUTING ==========

    @FunctionalInterface
    private interface RouteHandler {
        Object handle(Request request) throws IOException;
    }

    /**
     * A method and path template such as {@code /api/projects/{projectId}/scripts},
     * compiled to a regex with one named group per placeholder.
     */
    private static final class Route {
        private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

        private final String method;
        private final Pattern pattern;
        private final List<String> pathParams = new ArrayList<>();
        private final RouteHandler handler;

        Route(String method, String template, RouteHandler handler) {
            this.method = method;
            this.handler = handler;
            StringBuilder regex = new StringBuilder();
            Matcher placeholder = PLACEHOLDER.matcher(template);
            int last = 0;
            while (placeholder.find()) {
                regex.append(Pattern.quote(template.substring(last, placeholder.start())));
                regex.append("(?<").append(placeholder.group(1)).append(">[^/]+)");
                pathParams.add(placeholder.group(1));
                last = placeholder.end();
            }
            regex.append(Pattern.quote(template.substring(last)));
            this.pattern = Pattern.compile(regex.toString());
        }

        String method() {
            return method;
        }

        RouteHandler handler() {
            return handler;
        }

        /**
         * @return Decoded path parameters, or null when the path does not match
         */
        Map<String, String> match(String path) {
            Matcher matcher = pattern.matcher(path);
            if (!matcher.matches()) {
                return null;
            }
            Map<String, String> params = new LinkedHashMap<>();
            for (String name : pathParams) {
                params.put(name, URLDecoder.decode(matcher.group(name), StandardCharsets.UTF_8));
            }
            return params;
        }
    }

    private static final class Request {
        private final HttpExchange exchange;
        private final Map<String, String> params;

        Request(HttpExchange exchange, Map<String, String> params) {
            this.exchange = exchange;
            this.params = params;
        }

        String param(String name) {
            return params.get(name);
        }

        String query(String name) {
            URI uri = exchange.getRequestURI();
            String rawQuery = uri.getRawQuery();
            if (rawQuery == null) {
                return null;
            }
            for (String pair : rawQuery.split("&")) {
                int eq = pair.indexOf('=');
                String key = eq < 0 ? pair : pair.substring(0, eq);
                if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                    return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                }
            }
            return null;
        }

        Map<String, Object> jsonBody() throws IOException {
            String body = readBody(exchange);
            return body.isBlank() ? Map.of() : Json.parseObject(body);
        }
    }
}
