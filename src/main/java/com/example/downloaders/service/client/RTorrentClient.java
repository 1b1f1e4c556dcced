package com.example.downloaders.service.client;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.exception.XmlRpcFaultException;
import com.example.downloaders.utils.auth.DigestAuth;
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
import com.example.downloaders.utils.xmlrpc.XmlRpcCodec;
import com.example.downloaders.utils.xmlrpc.XmlRpcValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * rTorrent over XML-RPC, either SCGI-mounted at {@code /RPC2} or through the
 * ruTorrent httprpc plugin.
 * <p>
 * Authentication is Basic until the front end answers with a Digest challenge;
 * that challenge is then answered once per request.
 */
@Slf4j
public class RTorrentClient implements DownloaderClient {
    static final String DEFAULT_PATH = "/RPC2";
    static final String VIEW = "main";

    /** Column order of {@link #STATUS_COMMANDS}; shared by d.multicall2 rows and per-field reads. */
    static final List<String> STATUS_COMMANDS = List.of(
            "d.hash", "d.name", "d.state", "d.complete", "d.size_bytes", "d.completed_bytes",
            "d.down.rate", "d.up.rate", "d.ratio", "d.peers_connected", "d.peers_complete",
            "d.message", "d.custom1");

    static final List<String> FILE_COMMANDS = List.of(
            "f.path=", "f.size_bytes=", "f.completed_chunks=", "f.size_chunks=", "f.priority=");

    static final List<String> TRACKER_COMMANDS = List.of(
            "t.url=", "t.group=", "t.is_enabled=", "t.scrape_complete=", "t.scrape_incomplete=",
            "t.success_counter=", "t.failed_counter=");

    private final Downloader downloader;
    private final DownloaderHttp http;
    private final RemoteFileFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Supplier<String> cnonceSource;

    private volatile DigestAuth.Challenge digestChallenge;

    public RTorrentClient(Downloader downloader, DownloaderHttp http, RemoteFileFetcher fetcher,
                          ObjectMapper objectMapper, Executor executor) {
        this(downloader, http, fetcher, objectMapper, executor, DigestAuth::newCnonce);
    }

    RTorrentClient(Downloader downloader, DownloaderHttp http, RemoteFileFetcher fetcher,
                   ObjectMapper objectMapper, Executor executor, Supplier<String> cnonceSource) {
        this.downloader = downloader;
        this.http = http;
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.cnonceSource = cnonceSource;
    }

    @Override
    public ActionResult testConnection() {
        try {
            XmlRpcValue version = call("system.client_version");
            log.info("rTorrent {} reachable at {}", version.asString(), endpoint());
            return ActionResult.ok("Connected successfully to rTorrent");
        } catch (DownloaderException e) {
            return ActionResult.failed("Failed to connect to rTorrent: " + e.getMessage());
        }
    }

    @Override
    public AddResult addDownload(DownloadRequest request) throws DownloaderException {
        String url = request.getUrl();
        if (MagnetLinks.isMagnet(url)) {
            return addMagnet(request, url);
        }

        RemoteSource source;
        try {
            source = fetchWithRepair(url);
        } catch (DownloaderException e) {
            log.warn("Could not fetch torrent for '{}': {}", request.getTitle(), e.getMessage());
            return AddResult.failed("Failed to fetch torrent file: " + e.getMessage());
        }
        if (source.isMagnet()) {
            return addMagnet(request, source.getMagnetUri());
        }

        String hash = TorrentInfoHash.tryCompute(source.getContent())
                .map(h -> h.toUpperCase(Locale.ROOT))
                .orElse(null);
        if (hash == null) {
            log.warn("Payload for '{}' is not a parsable torrent, uploading anyway", request.getTitle());
        }

        String method = stopped() ? "load.raw" : "load.raw_start";
        List<Object> params = loadParams(request, source.getContent());
        XmlRpcValue result = call(method, params.toArray());
        if (!isZero(result)) {
            return AddResult.failed("Failed to add torrent: rTorrent returned " + result.asString());
        }
        applyCategory(request, hash);
        log.info("rTorrent accepted '{}' ({})", request.getTitle(), hash);
        return hash != null
                ? AddResult.added(hash, "Torrent added successfully")
                : AddResult.unverified("Torrent added, but its hash could not be determined");
    }

    private AddResult addMagnet(DownloadRequest request, String magnet) throws DownloaderException {
        String method = stopped() ? "load.normal" : "load.start";
        XmlRpcValue result = call(method, loadParams(request, magnet).toArray());
        if (!isZero(result)) {
            return AddResult.failed("Failed to add torrent: rTorrent returned " + result.asString());
        }
        // rTorrent keys downloads by hex hash; a base32 magnet hash is not usable as an id
        String hash = MagnetLinks.extractHash(magnet)
                .filter(h -> h.length() == 40)
                .map(h -> h.toUpperCase(Locale.ROOT))
                .orElse(null);
        applyCategory(request, hash);
        log.info("rTorrent accepted magnet for '{}'", request.getTitle());
        return hash != null
                ? AddResult.added(hash, "Torrent added successfully")
                : AddResult.unverified("Torrent added, but the magnet carries no info-hash");
    }

    /** Target, payload, then on-load commands. */
    private List<Object> loadParams(DownloadRequest request, Object payload) {
        List<Object> params = new ArrayList<>();
        params.add("");
        params.add(payload);
        String directory = ClientSupport.firstNonBlank(request.getDownloadPath(), downloader.getDownloadPath());
        if (directory != null) {
            params.add("d.directory.set=\"" + directory.replace("\"", "\\\"") + "\"");
        }
        return params;
    }

    private void applyCategory(DownloadRequest request, String hash) {
        String category = ClientSupport.firstNonBlank(request.getCategory(), downloader.getCategory());
        if (category == null || hash == null) {
            return;
        }
        try {
            call("d.custom1.set", hash, encodeLabel(category));
        } catch (DownloaderException e) {
            log.warn("Could not set rTorrent label '{}' on {}: {}", category, hash, e.getMessage());
        }
    }

    /**
     * Fetches the torrent, repairing the URL on HTTP 400: first {@code +} becomes
     * {@code %20}, then a {@code &file=} parameter is dropped.
     */
    RemoteSource fetchWithRepair(String url) throws DownloaderException {
        List<String> candidates = new ArrayList<>();
        candidates.add(url);
        String spaced = url.replace("+", "%20");
        if (!spaced.equals(url)) {
            candidates.add(spaced);
        }
        String last = candidates.get(candidates.size() - 1);
        String stripped = RegexPatterns.FILE_PARAMETER.matcher(last).replaceFirst("");
        if (!stripped.equals(last)) {
            candidates.add(stripped);
        }

        DownloaderException lastError = null;
        for (String candidate : candidates) {
            try {
                return fetcher.fetch(candidate);
            } catch (DownloaderException e) {
                if (e.getStatusCode() != 400) {
                    throw e;
                }
                log.debug("Indexer rejected {} with 400", candidate);
                lastError = e;
            }
        }
        throw lastError;
    }

    @Override
    public Optional<DownloadStatus> getDownloadStatus(String id) throws DownloaderException {
        List<XmlRpcValue> row = readFields(id, STATUS_COMMANDS);
        return row == null ? Optional.empty() : Optional.of(fill(DownloadStatus.builder(), row).build());
    }

    @Override
    public Optional<DownloadDetails> getDownloadDetails(String id) throws DownloaderException {
        List<String> commands = new ArrayList<>(STATUS_COMMANDS);
        commands.add("d.directory");
        commands.add("d.creation_date");
        List<XmlRpcValue> row = readFields(id, commands);
        if (row == null) {
            return Optional.empty();
        }

        List<Object> fileParams = new ArrayList<>(List.of(id, ""));
        fileParams.addAll(FILE_COMMANDS);
        List<DownloadFile> files = new ArrayList<>();
        for (XmlRpcValue file : call("f.multicall", fileParams.toArray()).asList()) {
            int priority = file.get(4).asInt();
            files.add(DownloadFile.builder()
                    .name(file.get(0).asString())
                    .size(file.get(1).asLong())
                    .progress(ClientSupport.percent(file.get(2).asLong(), file.get(3).asLong()))
                    .priority(filePriority(priority))
                    .wanted(priority != 0)
                    .build());
        }

        List<Object> trackerParams = new ArrayList<>(List.of(id, ""));
        trackerParams.addAll(TRACKER_COMMANDS);
        List<DownloadTracker> trackers = new ArrayList<>();
        for (XmlRpcValue tracker : call("t.multicall", trackerParams.toArray()).asList()) {
            long seeders = tracker.get(3).asLong();
            long leechers = tracker.get(4).asLong();
            TrackerStatus status = trackerStatus(tracker.get(2).asBoolean(),
                    tracker.get(5).asLong(), tracker.get(6).asLong());
            trackers.add(DownloadTracker.builder()
                    .url(tracker.get(0).asString())
                    .tier(tracker.get(1).asInt())
                    .status(status)
                    .seeders(seeders >= 0 ? (int) seeders : null)
                    .leechers(leechers >= 0 ? (int) leechers : null)
                    .error(status == TrackerStatus.ERROR ? "Announce failed" : null)
                    .build());
        }

        int peers = row.get(9).asInt();
        int base = STATUS_COMMANDS.size();
        return Optional.of(fill(DownloadDetails.builder(), row)
                .hash(row.get(0).asString())
                .downloadDir(row.get(base).asString())
                .addedDate(ClientSupport.epochSeconds(row.get(base + 1).asLong()))
                .files(files)
                .trackers(trackers)
                .totalPeers(peers)
                .connectedPeers(peers)
                .build());
    }

    @Override
    public List<DownloadStatus> getAllDownloads() throws DownloaderException {
        List<Object> params = new ArrayList<>(List.of("", VIEW));
        STATUS_COMMANDS.forEach(command -> params.add(command + "="));
        List<DownloadStatus> result = new ArrayList<>();
        for (XmlRpcValue row : call("d.multicall2", params.toArray()).asList()) {
            result.add(fill(DownloadStatus.builder(), row.asList()).build());
        }
        return result;
    }

    @Override
    public ActionResult pauseDownload(String id) throws DownloaderException {
        call("d.stop", id);
        return ActionResult.ok("Torrent paused successfully");
    }

    @Override
    public ActionResult resumeDownload(String id) throws DownloaderException {
        call("d.start", id);
        return ActionResult.ok("Torrent resumed successfully");
    }

    @Override
    public ActionResult removeDownload(String id, boolean deleteFiles) throws DownloaderException {
        if (deleteFiles) {
            call("d.stop", id);
            call("d.delete_tied", id);
        }
        call("d.erase", id);
        return ActionResult.ok("Torrent removed successfully");
    }

    @Override
    public long getFreeSpace() throws DownloaderException {
        XmlRpcValue rows = call("d.multicall2", "", VIEW, "d.free_diskspace=");
        if (rows.asList().isEmpty()) {
            log.debug("rTorrent has no downloads to report free space from");
            return 0;
        }
        return Math.max(0, rows.get(0).get(0).asLong());
    }

    // ---- mapping ------------------------------------------------------------

    static DownloadState mapState(long state, long complete, int progress, String message) {
        if (message != null && !message.isEmpty()) {
            return DownloadState.ERROR;
        }
        boolean done = complete == 1 || progress >= 100;
        if (state == 1) {
            return done ? DownloadState.SEEDING : DownloadState.DOWNLOADING;
        }
        return done ? DownloadState.COMPLETED : DownloadState.PAUSED;
    }

    static FilePriority filePriority(int priority) {
        switch (priority) {
            case 0:
                return FilePriority.OFF;
            case 2:
                return FilePriority.HIGH;
            default:
                return FilePriority.NORMAL;
        }
    }

    static TrackerStatus trackerStatus(boolean enabled, long successes, long failures) {
        if (!enabled) {
            return TrackerStatus.INACTIVE;
        }
        if (successes > 0) {
            return TrackerStatus.WORKING;
        }
        return failures > 0 ? TrackerStatus.ERROR : TrackerStatus.UPDATING;
    }

    /** {@code row} is in {@link #STATUS_COMMANDS} order. */
    private <B extends DownloadStatus.DownloadStatusBuilder<?, ?>> B fill(B builder, List<XmlRpcValue> row) {
        XmlRpcValue[] v = new XmlRpcValue[STATUS_COMMANDS.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = i < row.size() ? row.get(i) : XmlRpcValue.nil();
        }
        long size = v[4].asLong();
        long completed = v[5].asLong();
        int progress = ClientSupport.percent(completed, size);
        long connected = v[9].asLong();
        long complete = v[10].asLong();
        String message = v[11].asString();
        String label = decodeLabel(v[12].asString());

        builder.id(v[0].asString())
                .name(v[1].asString())
                .status(mapState(v[2].asLong(), v[3].asLong(), progress, message))
                .progress(progress)
                .downloadSpeed(v[6].asLong())
                .uploadSpeed(v[7].asLong())
                .size(size)
                .downloaded(completed)
                .seeders((int) complete)
                .leechers((int) Math.max(0, connected - complete))
                .ratio(v[8].asLong() / 1000.0)
                .category(label.isEmpty() ? null : label)
                .error(message.isEmpty() ? null : message);
        return builder;
    }

    // ruTorrent keeps labels URL-encoded in custom1
    static String encodeLabel(String label) {
        return URLEncoder.encode(label, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String decodeLabel(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        try {
            return URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    // ---- wire ---------------------------------------------------------------

    /**
     * Reads single-value commands for one download concurrently.
     *
     * @return values in command order, or null when rTorrent does not know the hash
     */
    private List<XmlRpcValue> readFields(String hash, List<String> commands) throws DownloaderException {
        List<CompletableFuture<XmlRpcValue>> futures = new ArrayList<>();
        for (String command : commands) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return call(command, hash);
                } catch (DownloaderException e) {
                    throw new CompletionException(e);
                }
            }, executor));
        }

        List<XmlRpcValue> values = new ArrayList<>();
        for (CompletableFuture<XmlRpcValue> future : futures) {
            try {
                values.add(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof XmlRpcFaultException) {
                    log.debug("rTorrent does not know {}: {}", hash, cause.getMessage());
                    return null;
                }
                if (cause instanceof DownloaderException) {
                    throw (DownloaderException) cause;
                }
                throw DownloaderException.protocol("Reading " + hash + " failed", cause);
            }
        }
        return values;
    }

    private static boolean isZero(XmlRpcValue result) {
        switch (result.getType()) {
            case INT:
            case I8:
                return result.asLong() == 0;
            case STRING:
                return "0".equals(result.asString().trim());
            default:
                return false;
        }
    }

    private boolean stopped() {
        return DownloaderSettings.of(downloader, objectMapper).addsStopped(downloader);
    }

    XmlRpcValue call(String method, Object... params) throws DownloaderException {
        byte[] body = XmlRpcCodec.encodeCall(method, Arrays.asList(params)).getBytes(StandardCharsets.UTF_8);
        URI uri = DownloaderHttp.toUri(endpoint());

        HttpResponse<String> response = post(uri, body, currentAuthorization(uri, body));
        if (response.statusCode() == 401) {
            Optional<DigestAuth.Challenge> challenge = digestChallenge(response);
            if (challenge.isEmpty() || !downloader.hasCredentials()) {
                throw DownloaderException.authentication("Authentication failed: Invalid credentials");
            }
            log.debug("rTorrent endpoint requires Digest authentication");
            digestChallenge = challenge.get();
            response = post(uri, body, currentAuthorization(uri, body));
            if (response.statusCode() == 401) {
                throw DownloaderException.authentication("Authentication failed: Invalid credentials");
            }
        }
        if (!DownloaderHttp.isSuccess(response)) {
            throw DownloaderException.httpStatus(response.statusCode());
        }
        return XmlRpcCodec.decodeResponse(response.body());
    }

    private String currentAuthorization(URI uri, byte[] body) {
        if (!downloader.hasCredentials()) {
            return null;
        }
        DigestAuth.Challenge challenge = digestChallenge;
        if (challenge == null) {
            return DownloaderHttp.basicAuth(downloader.getUsername(), downloader.getPassword());
        }
        String requestUri = uri.getRawPath() + (uri.getRawQuery() != null ? "?" + uri.getRawQuery() : "");
        return DigestAuth.authorization(challenge, downloader.getUsername(), downloader.getPassword(),
                "POST", requestUri, body, cnonceSource.get());
    }

    private static Optional<DigestAuth.Challenge> digestChallenge(HttpResponse<?> response) {
        for (String header : response.headers().allValues("WWW-Authenticate")) {
            Optional<DigestAuth.Challenge> challenge = DigestAuth.parseChallenge(header);
            if (challenge.isPresent()) {
                return challenge;
            }
        }
        return Optional.empty();
    }

    private HttpResponse<String> post(URI uri, byte[] body, String authorization) throws DownloaderException {
        HttpRequest.Builder request = http.request(uri)
                .header("Content-Type", "text/xml")
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        if (authorization != null) {
            request.header("Authorization", authorization);
        }
        return http.send(request.build());
    }

    private String endpoint() throws DownloaderException {
        return EndpointResolver.resolve(downloader, DEFAULT_PATH);
    }
}
