package com.elssolution.powermonitor.polling;

import com.elssolution.powermonitor.domain.Device;
import com.elssolution.powermonitor.domain.EnergyReading;
import com.elssolution.powermonitor.domain.Reading;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * JSON-over-HTTP client for the meter firmware.
 *
 * Each instance owns its own {@link HttpClient}, so the reading and energy
 * pollers never compete for connections. The JDK client keeps connections
 * alive between polls; retries are left to the poll loop.
 */
@Slf4j
public class HttpMeterClient implements MeterClient {

    static final String PATH_READ = "/api/read";
    static final String PATH_ENERGY = "/api/energy?phase=ALL";
    static final List<String> REGISTERS = List.of("UrmsA", "IrmsA", "PmeanA", "QmeanA", "SmeanA", "PFmeanA", "Freq");

    private static final String CONTENT_TYPE_JSON = "application/json";

    private final String name;
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String readBody;

    public HttpMeterClient(String name, Duration connectTimeout, Duration requestTimeout,
                           ObjectMapper objectMapper, Clock clock) {
        this.name = name;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout)
                .build();
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.readBody = objectMapper.createObjectNode()
                .set("registers", objectMapper.valueToTree(REGISTERS))
                .toString();
    }

    @Override
    public Optional<Reading> readInstant(Device device) {
        return send(device, PATH_READ, b -> b
                .header("Content-Type", CONTENT_TYPE_JSON)
                .POST(HttpRequest.BodyPublishers.ofString(readBody)))
                .flatMap(body -> parseReading(device.getDeviceId(), body, clock.instant()));
    }

    @Override
    public Optional<List<EnergyReading>> readEnergy(Device device) {
        return send(device, PATH_ENERGY, HttpRequest.Builder::GET)
                .flatMap(body -> parseEnergy(device.getDeviceId(), body, clock.instant()));
    }

    /** Body of a 2xx response from {@code path} on the device, empty on anything else. */
    private Optional<String> send(Device device, String path, UnaryOperator<HttpRequest.Builder> method) {
        URI uri = null;
        try {
            uri = URI.create(baseUri(device.getAddress()) + path);
            HttpRequest req = method.apply(HttpRequest.newBuilder(uri)
                            .header("Accept", CONTENT_TYPE_JSON)
                            .timeout(requestTimeout))
                    .build();
            HttpResponse<String> resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
            int sc = resp.statusCode();
            if (sc >= 200 && sc < 300) return Optional.ofNullable(resp.body());
            log.warn("meter_http_status client={} device={} status={} body={}",
                    name, device.getDeviceId(), sc, truncate(resp.body(), 160));
            return Optional.empty();
        } catch (HttpTimeoutException e) {
            log.warn("meter_http_timeout client={} device={} uri={}", name, device.getDeviceId(), uri);
            return Optional.empty();
        } catch (IOException e) {
            log.warn("meter_http_io client={} device={} err={}", name, device.getDeviceId(), e.toString());
            return Optional.empty();
        } catch (InterruptedException e) {
            // cancelled by the supervisor
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("meter_bad_address client={} device={} address={} err={}",
                    name, device.getDeviceId(), device.getAddress(), e.getMessage());
            return Optional.empty();
        }
    }

    // ===== parsing =====

    /**
     * Parses a register read: {@code {"success":true,"data":[{"name":..,"value":..}]}}.
     * Registers reported with an {@code error} are ignored and read as 0.
     */
    Optional<Reading> parseReading(String deviceId, String body, Instant at) {
        JsonNode root = readTree(deviceId, body);
        if (root == null || !successful(deviceId, root)) return Optional.empty();

        JsonNode data = root.path("data");
        if (!data.isArray()) {
            log.warn("meter_bad_response device={} reason=no data array", deviceId);
            return Optional.empty();
        }
        Map<String, Double> values = new HashMap<>();
        for (JsonNode item : data) {
            if (item.has("error") || !item.hasNonNull("name")) continue;
            Double v = nodeNum(item, "value");
            if (v != null) values.put(item.get("name").asText(), v);
        }

        double active = values.getOrDefault("PmeanA", 0.0);
        double apparent = values.getOrDefault("SmeanA", 0.0);
        double pf = values.getOrDefault("PFmeanA", values.getOrDefault("PFA", 0.0));
        if (pf == 0.0 && apparent > 0) pf = active / apparent;

        return Optional.of(new Reading(at, deviceId,
                values.getOrDefault("UrmsA", 0.0),
                values.getOrDefault("IrmsA", 0.0),
                active,
                values.getOrDefault("QmeanA", 0.0),
                apparent,
                pf,
                values.getOrDefault("Freq", 0.0)));
    }

    /**
     * Parses an energy read, either a single phase
     * {@code {"success":true,"phase":"A","accumulatedKWh":..}} or a list under {@code phases}.
     */
    Optional<List<EnergyReading>> parseEnergy(String deviceId, String body, Instant at) {
        JsonNode root = readTree(deviceId, body);
        if (root == null || !successful(deviceId, root)) return Optional.empty();

        List<EnergyReading> out = new ArrayList<>();
        if (root.has("phase")) {
            addPhase(deviceId, root, at, out);
        } else if (root.path("phases").isArray()) {
            for (JsonNode p : root.get("phases")) addPhase(deviceId, p, at, out);
        } else {
            log.warn("meter_bad_response device={} reason=unexpected energy shape", deviceId);
            return Optional.empty();
        }
        return out.isEmpty() ? Optional.empty() : Optional.of(out);
    }

    private void addPhase(String deviceId, JsonNode node, Instant at, List<EnergyReading> out) {
        String phase = node.path("phase").asText("");
        Double kwh = nodeNum(node, "accumulatedKWh");
        if (phase.isEmpty() || kwh == null) {
            log.warn("meter_bad_response device={} reason=phase entry without phase/accumulatedKWh", deviceId);
            return;
        }
        out.add(new EnergyReading(at, deviceId, phase, kwh));
    }

    private JsonNode readTree(String deviceId, String body) {
        if (body == null || body.isBlank()) {
            log.warn("meter_bad_response device={} reason=empty body", deviceId);
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root.isObject()) return root;
            log.warn("meter_bad_response device={} reason=not an object", deviceId);
        } catch (IOException e) {
            log.warn("meter_bad_response device={} reason=invalid json err={}", deviceId, e.getMessage());
        }
        return null;
    }

    private static boolean successful(String deviceId, JsonNode root) {
        if (root.path("success").asBoolean(false)) return true;
        log.warn("meter_unsuccessful device={} body={}", deviceId, truncate(root.toString(), 160));
        return false;
    }

    // ===== helpers =====

    /** Reads a numeric field; handles numbers-as-strings too. */
    private static Double nodeNum(JsonNode obj, String field) {
        JsonNode n = obj.path(field);
        if (n.isNumber()) return n.asDouble();
        if (n.isTextual()) {
            try {
                return Double.parseDouble(n.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** True when {@code address} (host, host:port or URL) yields a usable base URI. */
    public static boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        try {
            return URI.create(baseUri(address)).getHost() != null;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static String baseUri(String address) {
        String a = address.trim();
        if (a.endsWith("/")) a = a.substring(0, a.length() - 1);
        return a.startsWith("http://") || a.startsWith("https://") ? a : "http://" + a;
    }

    private static String truncate(String s, int limit) {
        if (s == null) return "";
        return s.length() <= limit ? s : s.substring(0, Math.max(0, limit)) + "…";
    }
}
