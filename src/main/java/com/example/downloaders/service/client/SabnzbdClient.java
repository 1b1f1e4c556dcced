package com.example.downloaders.service.client;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.utils.constants.RegexPatterns;
import com.example.downloaders.utils.http.DownloaderHttp;
import com.example.downloaders.utils.http.EndpointResolver;
import com.example.downloaders.utils.model.ActionResult;
import com.example.downloaders.utils.model.AddResult;
import com.example.downloaders.utils.model.DownloadDetails;
import com.example.downloaders.utils.model.DownloadRequest;
import com.example.downloaders.utils.model.DownloadState;
import com.example.downloaders.utils.model.DownloadStatus;
import com.example.downloaders.utils.model.Downloader;
import com.example.downloaders.utils.model.DownloaderSettings;
import com.example.downloaders.utils.model.RepairStatus;
import com.example.downloaders.utils.model.UnpackStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * SABnzbd HTTP API: stateless GETs carrying {@code apikey}, {@code mode} and
 * {@code output=json}. Active jobs live in the queue, finished ones in history.
 */
@Slf4j
public class SabnzbdClient implements DownloaderClient {
    static final String DEFAULT_PATH = "/api";

    private static final long MB = 1024L * 1024L;
    private static final long GB = MB * 1024L;

    private final Downloader downloader;
    private final DownloaderHttp http;
    private final ObjectMapper objectMapper;

    public SabnzbdClient(Downloader downloader, DownloaderHttp http, ObjectMapper objectMapper) {
        this.downloader = downloader;
        this.http = http;
        this.objectMapper = objectMapper;
    }

    @Override
    public ActionResult testConnection() {
        try {
            String version = call("version", Map.of()).path("version").asText("?");
            // version does not check the key, queue does
            call("queue", Map.of("limit", "0"));
            log.info("SABnzbd {} reachable at {}", version, endpoint());
            return ActionResult.ok("Connected successfully to SABnzbd " + version);
        } catch (DownloaderException e) {
            return ActionResult.failed("Failed to connect to SABnzbd: " + e.getMessage());
        }
    }

    @Override
    public AddResult addDownload(DownloadRequest request) throws DownloaderException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("name", request.getUrl());
        params.put("nzbname", request.getTitle());
        String category = ClientSupport.firstNonBlank(request.getCategory(), downloader.getCategory());
        if (category != null) {
            params.put("cat", category);
        }
        Integer priority = priority(request.getPriority(),
                DownloaderSettings.of(downloader, objectMapper).addsStopped(downloader));
        if (priority != null) {
            params.put("priority", String.valueOf(priority));
        }

        JsonNode response = call("addurl", params);
        if (response.path("status").asBoolean(false)) {
            JsonNode ids = response.path("nzo_ids");
            if (ids.isArray() && ids.size() > 0) {
                String id = ids.get(0).asText();
                log.info("SABnzbd queued '{}' as {}", request.getTitle(), id);
                return AddResult.added(id, "NZB added successfully");
            }
            log.info("SABnzbd accepted '{}' without returning an id", request.getTitle());
            return AddResult.alreadyExists(null, "NZB accepted but no id returned (likely duplicate or merged)");
        }

        String error = response.path("error").asText("");
        if (RegexPatterns.DUPLICATE.matcher(error).find()) {
            log.info("SABnzbd already has '{}'", request.getTitle());
            return AddResult.alreadyExists(null, "NZB already exists");
        }
        return AddResult.failed("Failed to add NZB: " + (error.isEmpty() ? "SABnzbd returned no reason" : error));
    }

    /** -2 is SABnzbd's "paused"; otherwise request priority 1..5 onto -1/0/1. */
    static Integer priority(Integer requested, boolean paused) {
        if (paused) {
            return -2;
        }
        if (requested == null) {
            return null;
        }
        if (requested > 3) {
            return 1;
        }
        return requested < 2 ? -1 : 0;
    }

    @Override
    public Optional<DownloadStatus> getDownloadStatus(String id) throws DownloaderException {
        return findJob(id).map(DownloadStatus.class::cast);
    }

    @Override
    public Optional<DownloadDetails> getDownloadDetails(String id) throws DownloaderException {
        return findJob(id);
    }

    /** Queue first, history on a miss. */
    private Optional<DownloadDetails> findJob(String id) throws DownloaderException {
        JsonNode queue = call("queue", Map.of("nzo_ids", id)).path("queue");
        for (JsonNode slot : queue.path("slots")) {
            if (id.equals(slot.path("nzo_id").asText())) {
                return Optional.of(mapQueueSlot(slot, queue));
            }
        }
        JsonNode history = call("history", Map.of("nzo_ids", id)).path("history");
        for (JsonNode slot : history.path("slots")) {
            if (id.equals(slot.path("nzo_id").asText())) {
                return Optional.of(mapHistorySlot(slot));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<DownloadStatus> getAllDownloads() throws DownloaderException {
        List<DownloadStatus> result = new ArrayList<>();
        JsonNode queue = call("queue", Map.of()).path("queue");
        for (JsonNode slot : queue.path("slots")) {
            result.add(mapQueueSlot(slot, queue));
        }
        JsonNode history = call("history", Map.of()).path("history");
        for (JsonNode slot : history.path("slots")) {
            result.add(mapHistorySlot(slot));
        }
        return result;
    }

    @Override
    public ActionResult pauseDownload(String id) throws DownloaderException {
        return queueAction("pause", id, "NZB paused successfully");
    }

    @Override
    public ActionResult resumeDownload(String id) throws DownloaderException {
        return queueAction("resume", id, "NZB resumed successfully");
    }

    @Override
    public ActionResult removeDownload(String id, boolean deleteFiles) throws DownloaderException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("name", "delete");
        params.put("value", id);
        params.put("del_files", deleteFiles ? "1" : "0");
        boolean fromQueue = call("queue", params).path("status").asBoolean(false);
        boolean fromHistory = call("history", params).path("status").asBoolean(false);
        if (!fromQueue && !fromHistory) {
            return ActionResult.failed("SABnzbd has no job " + id);
        }
        return ActionResult.ok("NZB removed successfully");
    }

    @Override
    public long getFreeSpace() throws DownloaderException {
        JsonNode queue = call("queue", Map.of("limit", "0")).path("queue");
        double gigabytes = parseDouble(queue.path("diskspace1").asText(""));
        return gigabytes > 0 ? (long) (gigabytes * GB) : 0;
    }

    private ActionResult queueAction(String name, String id, String message) throws DownloaderException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("name", name);
        params.put("value", id);
        JsonNode response = call("queue", params);
        if (!response.path("status").asBoolean(false)) {
            return ActionResult.failed("SABnzbd could not " + name + " " + id + ": "
                    + response.path("error").asText("no such job"));
        }
        return ActionResult.ok(message);
    }

    // ---- mapping ------------------------------------------------------------

    static DownloadState mapQueueState(String status) {
        switch (status == null ? "" : status) {
            case "Downloading":
            case "Queued":
            case "Grabbing":
            case "Fetching":
            case "Propagating":
                return DownloadState.DOWNLOADING;
            case "Paused":
                return DownloadState.PAUSED;
            case "Checking":
            case "QuickCheck":
            case "Verifying":
            case "Repairing":
                return DownloadState.REPAIRING;
            case "Extracting":
            case "Moving":
            case "Running":
                return DownloadState.UNPACKING;
            case "Completed":
                return DownloadState.COMPLETED;
            default:
                return DownloadState.ERROR;
        }
    }

    static DownloadState mapHistoryState(String status) {
        switch (status == null ? "" : status) {
            case "Completed":
                return DownloadState.COMPLETED;
            case "Queued":
            case "Fetching":
                return DownloadState.DOWNLOADING;
            case "QuickCheck":
            case "Verifying":
            case "Repairing":
                return DownloadState.REPAIRING;
            case "Extracting":
            case "Moving":
            case "Running":
                return DownloadState.UNPACKING;
            default:
                return DownloadState.ERROR;
        }
    }

    private DownloadDetails mapQueueSlot(JsonNode slot, JsonNode queue) {
        DownloadState state = mapQueueState(slot.path("status").asText(""));
        long size = (long) (parseDouble(slot.path("mb").asText("0")) * MB);
        long left = (long) (parseDouble(slot.path("mbleft").asText("0")) * MB);
        Long speed = state == DownloadState.DOWNLOADING
                ? (long) (parseDouble(queue.path("kbpersec").asText("0")) * 1024)
                : null;

        return DownloadDetails.builder()
                .id(slot.path("nzo_id").asText())
                .name(slot.path("filename").asText())
                .status(state)
                .progress(ClientSupport.clamp((int) Math.round(parseDouble(slot.path("percentage").asText("0")))))
                .downloadSpeed(speed)
                .eta(parseTimeLeft(slot.path("timeleft").asText(null)))
                .size(size)
                .downloaded(Math.max(0, size - left))
                .repairStatus(state == DownloadState.REPAIRING ? RepairStatus.REPAIRING : null)
                .unpackStatus(state == DownloadState.UNPACKING ? UnpackStatus.UNPACKING : null)
                .age(parseAgeDays(slot.path("avg_age").asText("")))
                .category(category(slot.path("cat").asText("")))
                .build();
    }

    private DownloadDetails mapHistorySlot(JsonNode slot) {
        String status = slot.path("status").asText("");
        DownloadState state = mapHistoryState(status);
        String failure = slot.path("fail_message").asText("");
        String lowerFailure = failure.toLowerCase(Locale.ROOT);
        long size = slot.path("bytes").asLong(0);

        RepairStatus repair = null;
        UnpackStatus unpack = null;
        if (state == DownloadState.COMPLETED) {
            repair = RepairStatus.GOOD;
            unpack = UnpackStatus.COMPLETED;
        } else if (state == DownloadState.REPAIRING) {
            repair = RepairStatus.REPAIRING;
        } else if (state == DownloadState.UNPACKING) {
            repair = RepairStatus.GOOD;
            unpack = UnpackStatus.UNPACKING;
        } else if (state == DownloadState.ERROR) {
            if (lowerFailure.contains("repair") || lowerFailure.contains("par2")) {
                repair = RepairStatus.FAILED;
            }
            if (lowerFailure.contains("unpack") || lowerFailure.contains("extract")) {
                unpack = UnpackStatus.FAILED;
            }
        }

        return DownloadDetails.builder()
                .id(slot.path("nzo_id").asText())
                .name(slot.path("name").asText())
                .status(state)
                .progress(state == DownloadState.COMPLETED || state == DownloadState.UNPACKING
                        || state == DownloadState.REPAIRING ? 100 : 0)
                .size(size)
                .downloaded(size)
                .repairStatus(repair)
                .unpackStatus(unpack)
                .category(category(slot.path("category").asText("")))
                .error(state == DownloadState.ERROR ? (failure.isEmpty() ? status : failure) : null)
                .completedDate(ClientSupport.epochSeconds(slot.path("completed").asLong(0)))
                .downloadDir(slot.path("storage").asText(null))
                .build();
    }

    /** {@code [D:]H:MM:SS}; null for unknown or zero. */
    static Long parseTimeLeft(String text) {
        if (text == null || text.isBlank() || "unknown".equalsIgnoreCase(text.trim())) {
            return null;
        }
        String[] parts = text.trim().split(":");
        if (parts.length < 2 || parts.length > 4) {
            return null;
        }
        long[] unit = {86_400, 3_600, 60, 1};
        long seconds = 0;
        try {
            for (int i = 0; i < parts.length; i++) {
                seconds += Long.parseLong(parts[i]) * unit[unit.length - parts.length + i];
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return seconds > 0 ? seconds : null;
    }

    static Integer parseAgeDays(String text) {
        if (text == null || !text.endsWith("d")) {
            return null;
        }
        try {
            return Integer.parseInt(text.substring(0, text.length() - 1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String category(String raw) {
        return raw == null || raw.isEmpty() || "*".equals(raw) ? null : raw;
    }

    private static double parseDouble(String text) {
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException | NullPointerException e) {
            return 0;
        }
    }

    // ---- wire ---------------------------------------------------------------

    String apiKey() {
        return ClientSupport.firstNonBlank(downloader.getPassword(), downloader.getUsername());
    }

    JsonNode call(String mode, Map<String, String> params) throws DownloaderException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("mode", mode);
        query.put("output", "json");
        String key = apiKey();
        if (key != null) {
            query.put("apikey", key);
        }
        query.putAll(params);

        HttpResponse<String> response = http.send(
                http.request(endpoint() + "?" + DownloaderHttp.formEncode(query)).GET().build());
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            throw DownloaderException.authentication("Authentication failed: Invalid API key");
        }
        if (!DownloaderHttp.isSuccess(response)) {
            throw DownloaderException.httpStatus(response.statusCode());
        }

        String body = response.body() == null ? "" : response.body().trim();
        if (body.regionMatches(true, 0, "API Key", 0, 7) || body.startsWith("error:")) {
            // plain-text rejection, sent even when JSON was asked for
            throw DownloaderException.authentication("Authentication failed: " + body);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body.isEmpty() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw DownloaderException.protocol("Invalid JSON from SABnzbd", e);
        }
        String error = root.path("error").asText("");
        if (error.toLowerCase(Locale.ROOT).contains("api key")) {
            throw DownloaderException.authentication("Authentication failed: " + error);
        }
        return root;
    }

    private String endpoint() throws DownloaderException {
        return EndpointResolver.resolve(downloader, DEFAULT_PATH);
    }
}
