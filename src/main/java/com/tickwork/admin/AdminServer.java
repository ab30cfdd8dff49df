package com.tickwork.admin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.tickwork.core.JobException;
import com.tickwork.core.JobExecution;
import com.tickwork.core.JsonUtil;
import com.tickwork.core.Metrics;
import com.tickwork.core.RecurringJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP front end of {@link JobAdminService}: JSON endpoints under {@code /jobs}, the registered
 * function names under {@code /functions} and the scheduler counters in Prometheus text format
 * under {@code /metrics}.
 */
public final class AdminServer {
    private static final Logger log = LoggerFactory.getLogger(AdminServer.class);
    private static final String JSON = "application/json; charset=utf-8";

    private final JobAdminService service;
    private HttpServer server;

    public AdminServer(JobAdminService service) {
        this.service = service;
    }

    /** Starts the server on the given port, 0 for an ephemeral one. */
    public synchronized void start(int port) throws IOException {
        if (server != null) {
            return;
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/jobs", this::handleJobs);
        server.createContext("/functions", exchange -> {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, "method not allowed");
                return;
            }
            sendJson(exchange, 200, service.functionNames());
        });
        server.createContext("/metrics", exchange -> {
            byte[] body = buildMetrics(service.metrics()).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        log.info("Admin server listening on port {}", getPort());
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            log.info("Admin server stopped");
        }
    }

    /** Returns the port the server is bound to, or -1 if not running. */
    public synchronized int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    private void handleJobs(HttpExchange exchange) throws IOException {
        try {
            route(exchange);
        } catch (JobException e) {
            sendError(exchange, statusOf(AdminResult.Failure.of(e)), e.getMessage());
        } catch (JsonProcessingException e) {
            sendError(exchange, 400, "malformed request body: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("Admin request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            sendError(exchange, 500, "internal error");
        }
    }

    private void route(HttpExchange exchange) throws IOException, JobException {
        String method = exchange.getRequestMethod();
        List<String> segments = segments(exchange.getRequestURI().getRawPath());
        if (segments.isEmpty()) {
            switch (method) {
                case "GET" -> {
                    List<JobView> jobs = new ArrayList<>();
                    for (RecurringJob job : service.listJobs()) {
                        jobs.add(JobView.of(job));
                    }
                    sendJson(exchange, 200, jobs);
                }
                case "POST" -> sendResult(exchange, service.create(readForm(exchange)), 201);
                default -> sendError(exchange, 405, "method not allowed");
            }
            return;
        }
        String ref = segments.get(0);
        if (segments.size() == 1) {
            switch (method) {
                case "GET" -> sendJson(exchange, 200, JobView.of(service.getJob(ref)));
                case "PUT" -> {
                    long id;
                    try {
                        id = Long.parseLong(ref);
                    } catch (NumberFormatException e) {
                        sendError(exchange, 400, "job id must be numeric: " + ref);
                        return;
                    }
                    boolean keepStatus = !"false".equalsIgnoreCase(queryParam(exchange, "keepStatus"));
                    sendResult(exchange, service.update(id, readForm(exchange), keepStatus), 200);
                }
                case "DELETE" -> sendResult(exchange, service.delete(ref), 200);
                default -> sendError(exchange, 405, "method not allowed");
            }
            return;
        }
        if (segments.size() == 2) {
            String action = segments.get(1);
            if ("executions".equals(action)) {
                if (!"GET".equals(method)) {
                    sendError(exchange, 405, "method not allowed");
                    return;
                }
                List<ExecutionView> executions = new ArrayList<>();
                for (JobExecution execution : service.listExecutions(ref)) {
                    executions.add(ExecutionView.of(execution));
                }
                sendJson(exchange, 200, executions);
                return;
            }
            if (!"POST".equals(method)) {
                sendError(exchange, 405, "method not allowed");
                return;
            }
            switch (action) {
                case "pause" -> sendResult(exchange, service.pause(ref), 200);
                case "resume" -> sendResult(exchange, service.resume(ref), 200);
                case "run" -> sendResult(exchange, service.runNow(ref), 202);
                default -> sendError(exchange, 404, "unknown action: " + action);
            }
            return;
        }
        sendError(exchange, 404, "not found");
    }

    private static JobForm readForm(HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return JsonUtil.mapper().readValue(in, JobForm.class);
        }
    }

    private static List<String> segments(String rawPath) {
        List<String> segments = new ArrayList<>();
        String rest = rawPath.length() > "/jobs".length() ? rawPath.substring("/jobs".length()) : "";
        for (String part : rest.split("/")) {
            if (!part.isEmpty()) {
                segments.add(URLDecoder.decode(part, StandardCharsets.UTF_8));
            }
        }
        return segments;
    }

    private static String queryParam(HttpExchange exchange, String name) {
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            if (name.equals(URLDecoder.decode(key, StandardCharsets.UTF_8))) {
                return eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static void sendResult(HttpExchange exchange, AdminResult result, int successStatus) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.success());
        body.put("message", result.message());
        body.put("job", JobView.of(result.job()));
        sendJson(exchange, result.success() ? successStatus : statusOf(result.failure()), body);
    }

    private static void sendError(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", message);
        sendJson(exchange, status, body);
    }

    private static void sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = JsonUtil.mapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", JSON);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static int statusOf(AdminResult.Failure failure) {
        if (failure == null) {
            return 500;
        }
        return switch (failure) {
            case NOT_FOUND -> 404;
            case CONFLICT -> 409;
            case INVALID -> 400;
            case STORE -> 500;
        };
    }

    static String buildMetrics(Metrics m) {
        StringBuilder sb = new StringBuilder();
        sb.append("# HELP tickwork_job_success_total Number of successful job executions\n");
        sb.append("# TYPE tickwork_job_success_total counter\n");
        sb.append("tickwork_job_success_total ").append(m.getSuccessCount()).append('\n');
        sb.append("# HELP tickwork_job_failure_total Number of failed job executions\n");
        sb.append("# TYPE tickwork_job_failure_total counter\n");
        sb.append("tickwork_job_failure_total ").append(m.getFailureCount()).append('\n');
        sb.append("# HELP tickwork_job_skipped_total Number of fires skipped because of job or scheduler state\n");
        sb.append("# TYPE tickwork_job_skipped_total counter\n");
        sb.append("tickwork_job_skipped_total ").append(m.getSkippedCount()).append('\n');
        sb.append("# HELP tickwork_job_duration_millis_total Total time spent running jobs in milliseconds\n");
        sb.append("# TYPE tickwork_job_duration_millis_total counter\n");
        sb.append("tickwork_job_duration_millis_total ").append(m.getTotalDurationMillis()).append('\n');
        sb.append("# HELP tickwork_job_duration_millis_avg Average job execution time in milliseconds\n");
        sb.append("# TYPE tickwork_job_duration_millis_avg gauge\n");
        sb.append("tickwork_job_duration_millis_avg ").append(m.getAverageDurationMillis()).append('\n');
        return sb.toString();
    }
}
