package com.example.downloaders.service.client;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.utils.constants.RegexPatterns;
import com.example.downloaders.utils.http.DownloaderHttp;
import com.example.downloaders.utils.http.EndpointResolver;
import com.example.downloaders.utils.http.RemoteFileFetcher;
import com.example.downloaders.utils.http.RemoteSource;
import com.example.downloaders.utils.model.ActionResult;
import com.example.downloaders.utils.model.AddResult;
import com.example.downloaders.utils.model.DownloadDetails;
import com.example.downloaders.utils.model.DownloadFile;
import com.example.downloaders.utils.model.DownloadRequest;
import com.example.downloaders.utils.model.DownloadState;
import com.example.downloaders.utils.model.DownloadStatus;
import com.example.downloaders.utils.model.DownloadTracker;
import com.example.downloaders.utils.model.Downloader;
import com.example.downloaders.utils.model.DownloaderSettings;
import com.example.downloaders.utils.model.FilePriority;
import com.example.downloaders.utils.model.TrackerStatus;
import com.example.downloaders.utils.torrent.MagnetLinks;
import com.example.downloaders.utils.torrent.TorrentInfoHash;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;

/**
 * qBittorrent Web API v2 with a cached {@code SID} cookie.
 */
@Slf4j
public class QBittorrentClient implements DownloaderClient {
    /** qBittorrent reports 8640000 (100 days) for "infinite". */
    static final long MAX_VALID_ETA_SECONDS = 8_640_000L;

    static final String OK = "Ok.";
    static final String FAILS = "Fails.";
    static final String DUPLICATE_MESSAGE = "Download already exists or invalid download";

    private static final String FORM = "application/x-www-form-urlencoded";

    private final Downloader downloader;
    private final DownloaderHttp http;
    private final RemoteFileFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final Duration verifyDelay;
    private final Duration recentAddWindow;

    private String cookie;

    public QBittorrentClient(Downloader downloader, DownloaderHttp http, RemoteFileFetcher fetcher,
                             ObjectMapper objectMapper, Duration verifyDelay, Duration recentAddWindow) {
        this.downloader = downloader;
        this.http = http;
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
        this.verifyDelay = verifyDelay;
        this.recentAddWindow = recentAddWindow;
    }

    @Override
    public ActionResult testConnection() {
        try {
            authenticate();
            String version = get("/api/v2/app/version").body().trim();
            log.info("qBittorrent {} reachable at {}", version, baseUrl());
            return ActionResult.ok("Connected successfully to qBittorrent " + version);
        } catch (DownloaderException e) {
            return ActionResult.failed("Failed to connect to qBittorrent: " + e.getMessage());
        }
    }

    // ---- add ----------------------------------------------------------------

    @Override
    public AddResult addDownload(DownloadRequest request) throws DownloaderException {
        authenticate();
        DownloaderSettings settings = DownloaderSettings.of(downloader, objectMapper);
        String url = request.getUrl();
        boolean magnet = MagnetLinks.isMagnet(url);
        String knownHash = MagnetLinks.extractHash(url).orElse(null);

        Map<String, String> form = addOptions(request, settings);
        Map<String, String> urlForm = new LinkedHashMap<>();
        urlForm.put("urls", url);
        urlForm.putAll(form);
        String body = request("POST", "/api/v2/torrents/add", DownloaderHttp.formEncode(urlForm), FORM).body().trim();
        if (FAILS.equals(body)) {
            log.info("qBittorrent refused '{}' as duplicate or invalid", request.getTitle());
            return AddResult.alreadyExists(knownHash, DUPLICATE_MESSAGE);
        }
        if (!OK.equals(body) && !body.isEmpty()) {
            return AddResult.failed("Failed to add torrent: " + body);
        }

        Optional<String> observed = knownHash != null
                ? findByHash(knownHash)
                : findRecentlyAdded(request.getTitle());
        if (observed.isPresent()) {
            return added(observed.get(), request, settings);
        }
        if (magnet) {
            return AddResult.failed("Torrent was not found in qBittorrent after adding the magnet link");
        }

        log.info("URL add of '{}' produced nothing visible, uploading the torrent file instead", request.getTitle());
        return upload(request, settings, form);
    }

    private AddResult upload(DownloadRequest request, DownloaderSettings settings, Map<String, String> form)
            throws DownloaderException {
        RemoteSource source;
        try {
            source = fetcher.fetch(request.getUrl());
        } catch (DownloaderException e) {
            return AddResult.failed("Failed to fetch torrent file: " + e.getMessage());
        }

        if (source.isMagnet()) {
            Map<String, String> urlForm = new LinkedHashMap<>();
            urlForm.put("urls", source.getMagnetUri());
            urlForm.putAll(form);
            String body = request("POST", "/api/v2/torrents/add", DownloaderHttp.formEncode(urlForm), FORM).body().trim();
            String hash = MagnetLinks.extractHash(source.getMagnetUri()).orElse(null);
            if (FAILS.equals(body)) {
                return AddResult.alreadyExists(hash, DUPLICATE_MESSAGE);
            }
            Optional<String> observed = hash != null ? findByHash(hash) : Optional.empty();
            return observed.isPresent()
                    ? added(observed.get(), request, settings)
                    : AddResult.failed("Torrent was not found in qBittorrent after adding the magnet link");
        }

        String hash = TorrentInfoHash.tryCompute(source.getContent()).orElse(null);
        String boundary = "----DownloaderBoundary" + UUID.randomUUID().toString().replace("-", "");
        byte[] multipart = multipart(boundary, fileName(request.getTitle()), source.getContent(), form);
        HttpResponse<String> response = request("POST", "/api/v2/torrents/add",
                HttpRequest.BodyPublishers.ofByteArray(multipart), "multipart/form-data; boundary=" + boundary);
        String body = response.body().trim();
        if (FAILS.equals(body)) {
            log.info("qBittorrent refused uploaded '{}' as duplicate or invalid", request.getTitle());
            return AddResult.alreadyExists(hash, DUPLICATE_MESSAGE);
        }
        if (!OK.equals(body) && !body.isEmpty()) {
            return AddResult.failed("Failed to add torrent: " + body);
        }
        if (hash == null) {
            return AddResult.unverified("Torrent uploaded, but its hash could not be determined");
        }
        return added(hash, request, settings);
    }

    private AddResult added(String hash, DownloadRequest request, DownloaderSettings settings) {
        if (settings.isForceStarted()) {
            try {
                request("POST", "/api/v2/torrents/setForceStart", "hashes=" + hash + "&value=true", FORM);
            } catch (DownloaderException e) {
                log.warn("Could not force-start {} in qBittorrent: {}", hash, e.getMessage());
            }
        }
        log.info("qBittorrent accepted '{}' as {}", request.getTitle(), hash);
        return AddResult.added(hash, "Torrent added successfully");
    }

    private Map<String, String> addOptions(DownloadRequest request, DownloaderSettings settings) {
        Map<String, String> form = new LinkedHashMap<>();
        String savePath = ClientSupport.firstNonBlank(request.getDownloadPath(), downloader.getDownloadPath());
        if (savePath != null) {
            form.put("savepath", savePath);
        }
        String category = ClientSupport.firstNonBlank(request.getCategory(), downloader.getCategory());
        if (category != null) {
            form.put("category", category);
        }
        if (settings.addsStopped(downloader)) {
            // "paused" before 5.0, "stopped" after
            form.put("paused", "true");
            form.put("stopped", "true");
        }
        return form;
    }

    private Optional<String> findByHash(String hash) throws DownloaderException {
        pause();
        JsonNode torrents = getJson("/api/v2/torrents/info?hashes=" + hash);
        for (JsonNode torrent : torrents) {
            String found = torrent.path("hash").asText("");
            if (!found.isEmpty()) {
                return Optional.of(found.toLowerCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    /** Newest torrent whose name matches the title, else one added within the recent-add window. */
    private Optional<String> findRecentlyAdded(String title) throws DownloaderException {
        pause();
        JsonNode torrents = getJson("/api/v2/torrents/info?sort=added_on&reverse=true");
        String wanted = normalize(title);
        if (!wanted.isEmpty()) {
            for (JsonNode torrent : torrents) {
                String name = normalize(torrent.path("name").asText(""));
                if (!name.isEmpty() && (name.contains(wanted) || wanted.contains(name))) {
                    return Optional.of(torrent.path("hash").asText().toLowerCase(Locale.ROOT));
                }
            }
        }
        long threshold = Instant.now().minus(recentAddWindow).getEpochSecond();
        for (JsonNode torrent : torrents) {
            if (torrent.path("added_on").asLong(0) >= threshold) {
                return Optional.of(torrent.path("hash").asText().toLowerCase(Locale.ROOT));
            }
        }
        return Optional.empty();
    }

    static String normalize(String title) {
        return title == null ? "" : title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    }

    private void pause() throws DownloaderException {
        if (verifyDelay.isZero() || verifyDelay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(verifyDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DownloaderException.transport("Interrupted while waiting for qBittorrent", e);
        }
    }

    static byte[] multipart(String boundary, String fileName, byte[] torrent, Map<String, String> fields) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(torrent.length + 512);
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"torrents\"; filename=\"" + fileName + "\"\r\n"
                + "Content-Type: application/x-bittorrent\r\n\r\n";
        out.writeBytes(head.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(torrent);
        out.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));
        for (Map.Entry<String, String> field : fields.entrySet()) {
            String part = "--" + boundary + "\r\n"
                    + "Content-Disposition: form-data; name=\"" + field.getKey() + "\"\r\n\r\n"
                    + field.getValue() + "\r\n";
            out.writeBytes(part.getBytes(StandardCharsets.UTF_8));
        }
        out.writeBytes(("--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    private static String fileName(String title) {
        String safe = title == null ? "" : title.replaceAll("[\\\\/:*?\"<>|\\r\\n]+", "_").trim();
        return (safe.isEmpty() ? "download" : safe) + ".torrent";
    }

    // ---- queries ------------------------------------------------------------

    @Override
    public Optional<DownloadStatus> getDownloadStatus(String id) throws DownloaderException {
        authenticate();
        JsonNode torrents = getJson("/api/v2/torrents/info?hashes=" + DownloaderHttp.encode(id));
        if (torrents.size() == 0) {
            return Optional.empty();
        }
        return Optional.of(fill(DownloadStatus.builder(), torrents.get(0)).build());
    }

    @Override
    public Optional<DownloadDetails> getDownloadDetails(String id) throws DownloaderException {
        authenticate();
        String hash = DownloaderHttp.encode(id);
        JsonNode torrents = getJson("/api/v2/torrents/info?hashes=" + hash);
        if (torrents.size() == 0) {
            return Optional.empty();
        }
        JsonNode torrent = torrents.get(0);
        JsonNode properties = getJson("/api/v2/torrents/properties?hash=" + hash);

        List<DownloadFile> files = new ArrayList<>();
        for (JsonNode file : getJson("/api/v2/torrents/files?hash=" + hash)) {
            int priority = file.path("priority").asInt(1);
            files.add(DownloadFile.builder()
                    .name(file.path("name").asText())
                    .size(file.path("size").asLong(0))
                    .progress(ClientSupport.percentOfFraction(file.path("progress").asDouble(0)))
                    .priority(filePriority(priority))
                    .wanted(priority != 0)
                    .build());
        }

        List<DownloadTracker> trackers = new ArrayList<>();
        for (JsonNode tracker : getJson("/api/v2/torrents/trackers?hash=" + hash)) {
            String url = tracker.path("url").asText("");
            if (url.startsWith("**")) {
                // DHT, PeX and LSD pseudo-entries
                continue;
            }
            TrackerStatus status = trackerStatus(tracker.path("status").asInt(1));
            int seeders = tracker.path("num_seeds").asInt(-1);
            int leechers = tracker.path("num_leeches").asInt(-1);
            String msg = tracker.path("msg").asText("");
            trackers.add(DownloadTracker.builder()
                    .url(url)
                    .tier(Math.max(0, tracker.path("tier").asInt(0)))
                    .status(status)
                    .seeders(seeders >= 0 ? seeders : null)
                    .leechers(leechers >= 0 ? leechers : null)
                    .error(status == TrackerStatus.ERROR && !msg.isEmpty() ? msg : null)
                    .build());
        }

        return Optional.of(fill(DownloadDetails.builder(), torrent)
                .hash(torrent.path("hash").asText(null))
                .addedDate(ClientSupport.epochSeconds(properties.path("addition_date").asLong(0)))
                .completedDate(ClientSupport.epochSeconds(properties.path("completion_date").asLong(0)))
                .downloadDir(properties.path("save_path").asText(torrent.path("save_path").asText(null)))
                .comment(emptyToNull(properties.path("comment").asText("")))
                .creator(emptyToNull(properties.path("created_by").asText("")))
                .files(files)
                .trackers(trackers)
                .totalPeers(properties.path("peers_total").asInt(0) + properties.path("seeds_total").asInt(0))
                .connectedPeers(properties.path("peers").asInt(0) + properties.path("seeds").asInt(0))
                .build());
    }

    @Override
    public List<DownloadStatus> getAllDownloads() throws DownloaderException {
        authenticate();
        List<DownloadStatus> result = new ArrayList<>();
        for (JsonNode torrent : getJson("/api/v2/torrents/info")) {
            result.add(fill(DownloadStatus.builder(), torrent).build());
        }
        return result;
    }

    @Override
    public ActionResult pauseDownload(String id) throws DownloaderException {
        authenticate();
        postWithFallback("/api/v2/torrents/pause", "/api/v2/torrents/stop", "hashes=" + DownloaderHttp.encode(id));
        return ActionResult.ok("Torrent paused successfully");
    }

    @Override
    public ActionResult resumeDownload(String id) throws DownloaderException {
        authenticate();
        postWithFallback("/api/v2/torrents/resume", "/api/v2/torrents/start", "hashes=" + DownloaderHttp.encode(id));
        return ActionResult.ok("Torrent resumed successfully");
    }

    @Override
    public ActionResult removeDownload(String id, boolean deleteFiles) throws DownloaderException {
        authenticate();
        request("POST", "/api/v2/torrents/delete",
                "hashes=" + DownloaderHttp.encode(id) + "&deleteFiles=" + deleteFiles, FORM);
        return ActionResult.ok("Torrent removed successfully");
    }

    /** qBittorrent 5 renamed pause/resume to stop/start and answers 404 to the old names. */
    private void postWithFallback(String path, String v5Path, String body) throws DownloaderException {
        try {
            request("POST", path, body, FORM);
        } catch (DownloaderException e) {
            if (e.getStatusCode() != 404) {
                throw e;
            }
            log.debug("{} not found, retrying as {}", path, v5Path);
            request("POST", v5Path, body, FORM);
        }
    }

    /**
     * Tries, in order: the path-specific free_space endpoint for the default save
     * path, sync/maindata, and transfer/info. A missing or non-numeric value moves
     * on to the next source.
     */
    @Override
    public long getFreeSpace() throws DownloaderException {
        authenticate();

        String savePath = null;
        try {
            savePath = getJson("/api/v2/app/preferences").path("save_path").asText(null);
        } catch (DownloaderException e) {
            log.debug("qBittorrent preferences unavailable: {}", e.getMessage());
        }
        if (savePath != null && !savePath.isEmpty()) {
            Long free = freeSpaceFrom("/api/v2/app/free_space?path=" + DownloaderHttp.encode(savePath), null);
            if (free != null) {
                return free;
            }
        }
        Long free = freeSpaceFrom("/api/v2/sync/maindata?rid=0", "server_state");
        if (free != null) {
            return free;
        }
        free = freeSpaceFrom("/api/v2/transfer/info", null);
        if (free != null) {
            return free;
        }
        log.warn("qBittorrent at {} did not report free space", baseUrl());
        return 0;
    }

    private Long freeSpaceFrom(String path, String container) {
        try {
            JsonNode node = getJson(path);
            if (container != null) {
                node = node.path(container);
            }
            JsonNode value = node.path("free_space_on_disk");
            return value.isNumber() ? value.asLong() : null;
        } catch (DownloaderException e) {
            log.debug("Free space from {} failed: {}", path, e.getMessage());
            return null;
        }
    }

    // ---- mapping ------------------------------------------------------------

    static DownloadState mapState(String state, double progress) {
        switch (state == null ? "" : state) {
            case "uploading":
            case "stalledUP":
            case "checkingUP":
            case "forcedUP":
            case "queuedUP":
                return DownloadState.SEEDING;
            case "pausedUP":
            case "stoppedUP":
                return DownloadState.COMPLETED;
            case "downloading":
            case "stalledDL":
            case "checkingDL":
            case "forcedDL":
            case "queuedDL":
            case "allocating":
            case "metaDL":
            case "forcedMetaDL":
            case "checkingResumeData":
            case "moving":
                return DownloadState.DOWNLOADING;
            case "pausedDL":
            case "stoppedDL":
                return progress >= 1.0 ? DownloadState.COMPLETED : DownloadState.PAUSED;
            default:
                return DownloadState.ERROR;
        }
    }

    static FilePriority filePriority(int priority) {
        if (priority == 0) {
            return FilePriority.OFF;
        }
        return priority >= 6 ? FilePriority.HIGH : FilePriority.NORMAL;
    }

    /** 0 disabled, 1 not contacted, 2 working, 3 updating, 4 not working. */
    static TrackerStatus trackerStatus(int status) {
        switch (status) {
            case 2:
                return TrackerStatus.WORKING;
            case 3:
                return TrackerStatus.UPDATING;
            case 4:
                return TrackerStatus.ERROR;
            default:
                return TrackerStatus.INACTIVE;
        }
    }

    private <B extends DownloadStatus.DownloadStatusBuilder<?, ?>> B fill(B builder, JsonNode t) {
        String state = t.path("state").asText("");
        double progress = t.path("progress").asDouble(0);
        long eta = t.path("eta").asLong(0);
        String category = t.path("category").asText("");
        DownloadState status = mapState(state, progress);

        builder.id(t.path("hash").asText())
                .name(t.path("name").asText())
                .status(status)
                .progress(ClientSupport.percentOfFraction(progress))
                .downloadSpeed(t.path("dlspeed").asLong(0))
                .uploadSpeed(t.path("upspeed").asLong(0))
                .eta(eta > 0 && eta < MAX_VALID_ETA_SECONDS ? eta : null)
                .size(t.path("size").asLong(0))
                .downloaded(t.path("downloaded").asLong(0))
                .seeders(t.path("num_seeds").asInt(0))
                .leechers(t.path("num_leechs").asInt(0))
                .ratio(t.path("ratio").asDouble(0))
                .category(category.isEmpty() ? null : category)
                .error(status == DownloadState.ERROR ? "Torrent state: " + (state.isEmpty() ? "unknown" : state) : null);
        return builder;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    // ---- wire ---------------------------------------------------------------

    void authenticate() throws DownloaderException {
        if (cookie != null || !downloader.hasCredentials()) {
            return;
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("username", downloader.getUsername());
        form.put("password", downloader.getPassword());
        HttpRequest login = http.request(baseUrl() + "/api/v2/auth/login")
                .header("Content-Type", FORM)
                .POST(HttpRequest.BodyPublishers.ofString(DownloaderHttp.formEncode(form)))
                .build();
        HttpResponse<String> response = http.send(login);
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            throw DownloaderException.authentication("Authentication failed: qBittorrent rejected the login (HTTP "
                    + response.statusCode() + ")");
        }
        if (!DownloaderHttp.isSuccess(response)) {
            throw DownloaderException.httpStatus(response.statusCode());
        }
        if (!OK.equals(response.body().trim())) {
            throw DownloaderException.authentication("Authentication failed: Invalid username or password");
        }
        for (String header : response.headers().allValues("Set-Cookie")) {
            Matcher matcher = RegexPatterns.SID_COOKIE.matcher(header);
            if (matcher.find()) {
                cookie = "SID=" + matcher.group(1);
                log.debug("qBittorrent session established");
                return;
            }
        }
        log.warn("qBittorrent login at {} returned no session cookie", baseUrl());
    }

    private JsonNode getJson(String path) throws DownloaderException {
        String body = get(path).body();
        try {
            return objectMapper.readTree(body == null || body.isBlank() ? "null" : body);
        } catch (JsonProcessingException e) {
            throw DownloaderException.protocol("Invalid JSON from qBittorrent " + path, e);
        }
    }

    private HttpResponse<String> get(String path) throws DownloaderException {
        return request("GET", path, HttpRequest.BodyPublishers.noBody(), null);
    }

    private HttpResponse<String> request(String method, String path, String body, String contentType)
            throws DownloaderException {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        return request(method, path, publisher, contentType);
    }

    /** One re-login on 401/403, then the failure is final. */
    private HttpResponse<String> request(String method, String path, HttpRequest.BodyPublisher body,
                                         String contentType) throws DownloaderException {
        HttpResponse<String> response = http.send(build(method, path, body, contentType));
        if ((response.statusCode() == 401 || response.statusCode() == 403) && downloader.hasCredentials()) {
            log.debug("qBittorrent session expired, logging in again");
            cookie = null;
            authenticate();
            response = http.send(build(method, path, body, contentType));
        }
        if (response.statusCode() == 401 || response.statusCode() == 403) {
            throw DownloaderException.authentication("Authentication failed: qBittorrent denied access (HTTP "
                    + response.statusCode() + ")");
        }
        if (!DownloaderHttp.isSuccess(response)) {
            throw DownloaderException.httpStatus(response.statusCode());
        }
        return response;
    }

    private HttpRequest build(String method, String path, HttpRequest.BodyPublisher body, String contentType)
            throws DownloaderException {
        HttpRequest.Builder builder = http.request(baseUrl() + path).method(method, body);
        if (contentType != null) {
            builder.header("Content-Type", contentType);
        }
        if (cookie != null) {
            builder.header("Cookie", cookie);
        }
        return builder.build();
    }

    private String baseUrl() throws DownloaderException {
        return EndpointResolver.resolve(downloader, "");
    }
}
