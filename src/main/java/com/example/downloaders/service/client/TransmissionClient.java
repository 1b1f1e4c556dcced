package com.example.downloaders.service.client;

import com.example.downloaders.exception.DownloaderException;
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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Transmission RPC (JSON over HTTP POST).
 * <p>
 * The server rejects the first request of a session with 409 and hands out an
 * {@code X-Transmission-Session-Id}; the id is cached and the request replayed once.
 */
@Slf4j
public class TransmissionClient implements DownloaderClient {
    static final String SESSION_HEADER = "X-Transmission-Session-Id";
    static final String DEFAULT_PATH = "/transmission/rpc";

    static final List<String> STATUS_FIELDS = List.of(
            "id", "name", "status", "percentDone", "rateDownload", "rateUpload",
            "eta", "totalSize", "downloadedEver", "peersSendingToUs", "peersGettingFromUs",
            "uploadRatio", "errorString", "labels", "hashString");

    static final List<String> DETAIL_FIELDS = List.of(
            "addedDate", "doneDate", "downloadDir", "comment", "creator",
            "files", "fileStats", "trackerStats", "peersConnected");

    private final Downloader downloader;
    private final DownloaderHttp http;
    private final RemoteFileFetcher fetcher;
    private final ObjectMapper objectMapper;

    private String sessionId;

    public TransmissionClient(Downloader downloader, DownloaderHttp http, RemoteFileFetcher fetcher,
                              ObjectMapper objectMapper) {
        this.downloader = downloader;
        this.http = http;
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public ActionResult testConnection() {
        try {
            JsonNode session = call("session-get", objectMapper.createObjectNode());
            log.info("Transmission {} reachable at {}", session.path("version").asText("?"), endpoint());
            return ActionResult.ok("Connected successfully to Transmission");
        } catch (DownloaderException e) {
            return ActionResult.failed("Failed to connect to Transmission: " + e.getMessage());
        }
    }

    @Override
    public AddResult addDownload(DownloadRequest request) throws DownloaderException {
        ObjectNode args = objectMapper.createObjectNode();
        String url = request.getUrl();

        if (MagnetLinks.isMagnet(url)) {
            args.put("filename", url);
        } else {
            try {
                RemoteSource source = fetcher.fetch(url);
                if (source.isMagnet()) {
                    args.put("filename", source.getMagnetUri());
                } else {
                    args.put("metainfo", Base64.getEncoder().encodeToString(source.getContent()));
                }
            } catch (DownloaderException e) {
                log.warn("Could not fetch torrent for '{}' locally, passing URL to Transmission: {}",
                        request.getTitle(), e.getMessage());
                args.put("filename", url);
            }
        }

        String category = ClientSupport.firstNonBlank(request.getCategory(), downloader.getCategory());
        String downloadDir = ClientSupport.firstNonBlank(request.getDownloadPath(), downloader.getDownloadPath());
        if (downloadDir != null) {
            args.put("download-dir", category != null ? ClientSupport.joinPath(downloadDir, category) : downloadDir);
        }
        if (category != null) {
            args.putArray("labels").add(category);
        }
        if (DownloaderSettings.of(downloader, objectMapper).addsStopped(downloader)) {
            args.put("paused", true);
        }
        if (request.getPriority() != null) {
            args.put("bandwidthPriority", bandwidthPriority(request.getPriority()));
        }

        JsonNode result = call("torrent-add", args);
        if (result.has("torrent-added")) {
            JsonNode torrent = result.get("torrent-added");
            String id = torrent.hasNonNull("id") ? torrent.get("id").asText() : null;
            if (id == null) {
                log.warn("Transmission accepted '{}' without returning an id", request.getTitle());
                return AddResult.unverified("Torrent added but Transmission returned no id");
            }
            log.info("Transmission accepted '{}' as id {}", request.getTitle(), id);
            return AddResult.added(id, "Torrent added successfully");
        }
        if (result.has("torrent-duplicate")) {
            JsonNode torrent = result.get("torrent-duplicate");
            log.info("Transmission already has '{}'", request.getTitle());
            return AddResult.alreadyExists(torrent.path("hashString").asText(null), "Download already exists");
        }
        return AddResult.failed("Failed to add torrent: unexpected response from Transmission");
    }

    /** Request priority 1..5 onto Transmission's -1/0/1. */
    static int bandwidthPriority(int priority) {
        if (priority > 3) {
            return 1;
        }
        return priority < 2 ? -1 : 0;
    }

    @Override
    public Optional<DownloadStatus> getDownloadStatus(String id) throws DownloaderException {
        JsonNode torrent = getTorrent(id, STATUS_FIELDS);
        return torrent == null ? Optional.empty() : Optional.of(fill(DownloadStatus.builder(), torrent).build());
    }

    @Override
    public Optional<DownloadDetails> getDownloadDetails(String id) throws DownloaderException {
        List<String> fields = new ArrayList<>(STATUS_FIELDS);
        fields.addAll(DETAIL_FIELDS);
        JsonNode torrent = getTorrent(id, fields);
        return torrent == null ? Optional.empty() : Optional.of(mapDetails(torrent));
    }

    @Override
    public List<DownloadStatus> getAllDownloads() throws DownloaderException {
        ObjectNode args = objectMapper.createObjectNode();
        addFields(args, STATUS_FIELDS);
        List<DownloadStatus> result = new ArrayList<>();
        for (JsonNode torrent : call("torrent-get", args).path("torrents")) {
            result.add(fill(DownloadStatus.builder(), torrent).build());
        }
        return result;
    }

    @Override
    public ActionResult pauseDownload(String id) throws DownloaderException {
        call("torrent-stop", idArgs(id));
        return ActionResult.ok("Torrent paused successfully");
    }

    @Override
    public ActionResult resumeDownload(String id) throws DownloaderException {
        call("torrent-start", idArgs(id));
        return ActionResult.ok("Torrent resumed successfully");
    }

    @Override
    public ActionResult removeDownload(String id, boolean deleteFiles) throws DownloaderException {
        ObjectNode args = idArgs(id);
        args.put("delete-local-data", deleteFiles);
        call("torrent-remove", args);
        return ActionResult.ok("Torrent removed successfully");
    }

    @Override
    public long getFreeSpace() throws DownloaderException {
        ObjectNode sessionArgs = objectMapper.createObjectNode();
        sessionArgs.putArray("fields").add("download-dir").add("download-dir-free-space");
        JsonNode session = call("session-get", sessionArgs);

        String path = ClientSupport.firstNonBlank(downloader.getDownloadPath(), session.path("download-dir").asText(null));
        if (path != null) {
            ObjectNode args = objectMapper.createObjectNode();
            args.put("path", path);
            try {
                JsonNode free = call("free-space", args);
                if (free.path("size-bytes").canConvertToLong()) {
                    return free.path("size-bytes").asLong();
                }
            } catch (DownloaderException e) {
                log.warn("Transmission free-space failed for {}: {}", path, e.getMessage());
            }
        }
        // servers before RPC 15 only report the default directory
        return Math.max(0, session.path("download-dir-free-space").asLong(0));
    }

    // ---- mapping ------------------------------------------------------------

    static DownloadState mapState(int code, double percentDone, String errorString) {
        if (errorString != null && !errorString.isEmpty()) {
            return DownloadState.ERROR;
        }
        boolean complete = percentDone >= 1.0;
        switch (code) {
            case 0:
                return complete ? DownloadState.COMPLETED : DownloadState.PAUSED;
            case 1:
            case 2:
            case 3:
            case 4:
            case 5:
                // check/download/seed pending count as downloading until percentDone reaches 1
                return complete ? DownloadState.SEEDING : DownloadState.DOWNLOADING;
            case 6:
                return DownloadState.SEEDING;
            default:
                return DownloadState.ERROR;
        }
    }

    private <B extends DownloadStatus.DownloadStatusBuilder<?, ?>> B fill(B builder, JsonNode t) {
        double percentDone = t.path("percentDone").asDouble(0);
        String error = t.path("errorString").asText("");
        long eta = t.path("eta").asLong(-1);
        JsonNode labels = t.path("labels");

        builder.id(t.path("id").asText())
                .name(t.path("name").asText())
                .status(mapState(t.path("status").asInt(-1), percentDone, error))
                .progress(ClientSupport.percentOfFraction(percentDone))
                .downloadSpeed(t.path("rateDownload").asLong(0))
                .uploadSpeed(t.path("rateUpload").asLong(0))
                .eta(eta > 0 ? eta : null)
                .size(t.path("totalSize").asLong(0))
                .downloaded(t.path("downloadedEver").asLong(0))
                .seeders(t.path("peersSendingToUs").asInt(0))
                .leechers(t.path("peersGettingFromUs").asInt(0))
                .ratio(Math.max(0, t.path("uploadRatio").asDouble(0)))
                .category(labels.isArray() && labels.size() > 0 ? labels.get(0).asText() : null)
                .error(error.isEmpty() ? null : error);
        return builder;
    }

    private DownloadDetails mapDetails(JsonNode t) {
        List<DownloadFile> files = new ArrayList<>();
        JsonNode fileList = t.path("files");
        JsonNode fileStats = t.path("fileStats");
        for (int i = 0; i < fileList.size(); i++) {
            JsonNode file = fileList.get(i);
            JsonNode stats = fileStats.path(i);
            boolean wanted = stats.path("wanted").asBoolean(true);
            long length = file.path("length").asLong(0);
            files.add(DownloadFile.builder()
                    .name(file.path("name").asText())
                    .size(length)
                    .progress(ClientSupport.percent(file.path("bytesCompleted").asLong(0), length))
                    .priority(filePriority(wanted, stats.path("priority").asInt(0)))
                    .wanted(wanted)
                    .build());
        }

        List<DownloadTracker> trackers = new ArrayList<>();
        for (JsonNode tracker : t.path("trackerStats")) {
            String result = tracker.path("lastAnnounceResult").asText("");
            boolean failed = !result.isEmpty() && !"Success".equals(result)
                    && !tracker.path("lastAnnounceSucceeded").asBoolean(false);
            int seeders = tracker.path("seederCount").asInt(-1);
            int leechers = tracker.path("leecherCount").asInt(-1);
            trackers.add(DownloadTracker.builder()
                    .url(tracker.path("announce").asText())
                    .tier(tracker.path("tier").asInt(0))
                    .status(trackerStatus(tracker))
                    .seeders(seeders >= 0 ? seeders : null)
                    .leechers(leechers >= 0 ? leechers : null)
                    .lastAnnounce(ClientSupport.epochSeconds(tracker.path("lastAnnounceTime").asLong(0)))
                    .nextAnnounce(ClientSupport.epochSeconds(tracker.path("nextAnnounceTime").asLong(0)))
                    .error(failed ? result : null)
                    .build());
        }

        int peers = t.path("peersConnected").asInt(0);
        return fill(DownloadDetails.builder(), t)
                .hash(t.path("hashString").asText(null))
                .addedDate(ClientSupport.epochSeconds(t.path("addedDate").asLong(0)))
                .completedDate(ClientSupport.epochSeconds(t.path("doneDate").asLong(0)))
                .downloadDir(t.path("downloadDir").asText(null))
                .comment(emptyToNull(t.path("comment").asText("")))
                .creator(emptyToNull(t.path("creator").asText("")))
                .files(files)
                .trackers(trackers)
                .totalPeers(peers)
                .connectedPeers(peers)
                .build();
    }

    static FilePriority filePriority(boolean wanted, int priority) {
        if (!wanted) {
            return FilePriority.OFF;
        }
        if (priority < 0) {
            return FilePriority.LOW;
        }
        return priority > 0 ? FilePriority.HIGH : FilePriority.NORMAL;
    }

    static TrackerStatus trackerStatus(JsonNode tracker) {
        String result = tracker.path("lastAnnounceResult").asText("");
        if (tracker.path("lastAnnounceSucceeded").asBoolean(false)) {
            return TrackerStatus.WORKING;
        }
        if (tracker.path("isBackup").asBoolean(false)) {
            return TrackerStatus.INACTIVE;
        }
        if (!result.isEmpty() && !"Success".equals(result)) {
            return TrackerStatus.ERROR;
        }
        // announceState 1 = waiting, 2 = queued, 3 = active
        int announceState = tracker.path("announceState").asInt(0);
        return announceState >= 1 && announceState <= 3 ? TrackerStatus.UPDATING : TrackerStatus.INACTIVE;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    // ---- wire ---------------------------------------------------------------

    private JsonNode getTorrent(String id, List<String> fields) throws DownloaderException {
        ObjectNode args = idArgs(id);
        addFields(args, fields);
        JsonNode torrents = call("torrent-get", args).path("torrents");
        return torrents.size() > 0 ? torrents.get(0) : null;
    }

    private static void addFields(ObjectNode args, List<String> fields) {
        ArrayNode array = args.putArray("fields");
        fields.forEach(array::add);
    }

    /** Numeric ids go over the wire as numbers, info-hashes as strings. */
    private ObjectNode idArgs(String id) {
        ObjectNode args = objectMapper.createObjectNode();
        ArrayNode ids = args.putArray("ids");
        if (id != null && id.matches("\\d{1,9}")) {
            ids.add(Integer.parseInt(id));
        } else {
            ids.add(id);
        }
        return args;
    }

    JsonNode call(String method, ObjectNode arguments) throws DownloaderException {
        String body;
        try {
            ObjectNode envelope = objectMapper.createObjectNode();
            envelope.put("method", method);
            envelope.set("arguments", arguments);
            body = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw DownloaderException.protocol("Could not encode " + method + " request", e);
        }

        String url = endpoint();
        HttpResponse<String> response = post(url, body);
        if (response.statusCode() == 409) {
            String token = response.headers().firstValue(SESSION_HEADER).orElse(null);
            if (token == null || token.isEmpty()) {
                throw DownloaderException.protocol("Transmission answered 409 without a session id");
            }
            log.debug("Transmission session id refreshed");
            sessionId = token;
            response = post(url, body);
        }
        if (response.statusCode() == 401) {
            throw DownloaderException.authentication("Authentication failed: Invalid username or password");
        }
        if (!DownloaderHttp.isSuccess(response)) {
            throw DownloaderException.httpStatus(response.statusCode());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw DownloaderException.protocol("Invalid JSON from Transmission", e);
        }
        String result = root.path("result").asText("");
        if (!"success".equals(result)) {
            throw DownloaderException.protocol("Transmission error: " + (result.isEmpty() ? "no result" : result));
        }
        return root.path("arguments");
    }

    private HttpResponse<String> post(String url, String body) throws DownloaderException {
        HttpRequest.Builder request = http.request(url)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (sessionId != null) {
            request.header(SESSION_HEADER, sessionId);
        }
        if (downloader.hasCredentials()) {
            request.header("Authorization", DownloaderHttp.basicAuth(downloader.getUsername(), downloader.getPassword()));
        }
        return http.send(request.build());
    }

    private String endpoint() throws DownloaderException {
        return EndpointResolver.resolve(downloader, DEFAULT_PATH);
    }
}
