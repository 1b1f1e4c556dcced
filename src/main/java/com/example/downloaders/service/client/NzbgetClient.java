package com.example.downloaders.service.client;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.utils.http.DownloaderHttp;
import com.example.downloaders.utils.http.EndpointResolver;
import com.example.downloaders.utils.http.RemoteFileFetcher;
import com.example.downloaders.utils.http.RemoteSource;
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
import com.example.downloaders.utils.xmlrpc.XmlRpcCodec;
import com.example.downloaders.utils.xmlrpc.XmlRpcValue;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * NZBGet XML-RPC at {@code /xmlrpc} with Basic authentication. The NZB is fetched
 * locally and appended as base64 content.
 */
@Slf4j
public class NzbgetClient implements DownloaderClient {
    static final String DEFAULT_PATH = "/xmlrpc";
    static final String DUPE_MODE = "SCORE";

    private static final long MB = 1024L * 1024L;

    private final Downloader downloader;
    private final DownloaderHttp http;
    private final RemoteFileFetcher fetcher;
    private final ObjectMapper objectMapper;

    public NzbgetClient(Downloader downloader, DownloaderHttp http, RemoteFileFetcher fetcher,
                        ObjectMapper objectMapper) {
        this.downloader = downloader;
        this.http = http;
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public ActionResult testConnection() {
        try {
            String version = call("version").asString();
            log.info("NZBGet {} reachable at {}", version, endpoint());
            return ActionResult.ok("Connected successfully to NZBGet " + version);
        } catch (DownloaderException e) {
            return ActionResult.failed("Failed to connect to NZBGet: " + e.getMessage());
        }
    }

    @Override
    public AddResult addDownload(DownloadRequest request) throws DownloaderException {
        RemoteSource source;
        try {
            source = fetcher.fetch(request.getUrl());
        } catch (DownloaderException e) {
            log.warn("Could not fetch NZB for '{}': {}", request.getTitle(), e.getMessage());
            return AddResult.failed("Failed to fetch NZB: " + e.getMessage());
        }
        if (source.isMagnet()) {
            return AddResult.failed("Failed to fetch NZB: URL redirected to a magnet link");
        }

        String category = ClientSupport.firstNonBlank(request.getCategory(), downloader.getCategory());
        boolean paused = DownloaderSettings.of(downloader, objectMapper).addsStopped(downloader);
        XmlRpcValue result = call("append",
                nzbFilename(request.getTitle()),
                Base64.getEncoder().encodeToString(source.getContent()),
                category == null ? "" : category,
                priority(request.getPriority()),
                false,
                paused,
                "",
                0,
                DUPE_MODE,
                List.of());

        long id = result.asLong();
        if (id <= 0) {
            return AddResult.failed("Failed to add NZB: NZBGet returned ID is 0 or negative");
        }
        log.info("NZBGet queued '{}' as {}", request.getTitle(), id);
        return AddResult.added(String.valueOf(id), "NZB added successfully");
    }

    static String nzbFilename(String title) {
        return title.toLowerCase(Locale.ROOT).endsWith(".nzb") ? title : title + ".nzb";
    }

    /** Request priority 1..5 onto NZBGet's -50/0/50 scale. */
    static int priority(Integer requested) {
        if (requested == null) {
            return 0;
        }
        if (requested > 3) {
            return 50;
        }
        return requested < 2 ? -50 : 0;
    }

    @Override
    public Optional<DownloadStatus> getDownloadStatus(String id) throws DownloaderException {
        return getDownloadDetails(id).map(DownloadStatus.class::cast);
    }

    @Override
    public Optional<DownloadDetails> getDownloadDetails(String id) throws DownloaderException {
        for (XmlRpcValue group : call("listgroups", 0).asList()) {
            if (id.equals(group.get("NZBID").asString())) {
                return Optional.of(mapGroup(group));
            }
        }
        for (XmlRpcValue item : call("history", false).asList()) {
            if (id.equals(item.get("NZBID").asString())) {
                return Optional.of(mapHistory(item));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<DownloadStatus> getAllDownloads() throws DownloaderException {
        List<DownloadStatus> result = new ArrayList<>();
        for (XmlRpcValue group : call("listgroups", 0).asList()) {
            result.add(mapGroup(group));
        }
        for (XmlRpcValue item : call("history", false).asList()) {
            result.add(mapHistory(item));
        }
        return result;
    }

    @Override
    public ActionResult pauseDownload(String id) throws DownloaderException {
        return editQueue("GroupPause", id)
                ? ActionResult.ok("NZB paused successfully")
                : ActionResult.failed("NZBGet could not pause " + id);
    }

    @Override
    public ActionResult resumeDownload(String id) throws DownloaderException {
        return editQueue("GroupResume", id)
                ? ActionResult.ok("NZB resumed successfully")
                : ActionResult.failed("NZBGet could not resume " + id);
    }

    /** Deleting from the queue leaves a history entry; that is cleared too. */
    @Override
    public ActionResult removeDownload(String id, boolean deleteFiles) throws DownloaderException {
        boolean fromQueue = editQueue(deleteFiles ? "GroupFinalDelete" : "GroupDelete", id);
        boolean fromHistory = editQueue("HistoryDelete", id);
        if (!fromQueue && !fromHistory) {
            return ActionResult.failed("NZBGet has no download " + id);
        }
        return ActionResult.ok("NZB removed successfully");
    }

    @Override
    public long getFreeSpace() throws DownloaderException {
        XmlRpcValue status = call("status");
        XmlRpcValue hi = status.get("FreeDiskSpaceHi");
        XmlRpcValue lo = status.get("FreeDiskSpaceLo");
        if (!hi.isNil() && !lo.isNil()) {
            return combine(hi, lo);
        }
        return status.get("FreeDiskSpaceMB").asLong() * MB;
    }

    private boolean editQueue(String command, String id) throws DownloaderException {
        int nzbId;
        try {
            nzbId = Integer.parseInt(id);
        } catch (NumberFormatException e) {
            throw DownloaderException.protocol("Not an NZBGet id: " + id);
        }
        return call("editqueue", command, "", List.of(nzbId)).asBoolean();
    }

    // ---- mapping ------------------------------------------------------------

    static DownloadState mapGroupState(String status) {
        switch (status == null ? "" : status) {
            case "QUEUED":
            case "FETCHING":
            case "DOWNLOADING":
                return DownloadState.DOWNLOADING;
            case "PAUSED":
                return DownloadState.PAUSED;
            case "LOADING_PARS":
            case "VERIFYING_SOURCES":
            case "REPAIRING":
            case "VERIFYING_REPAIRED":
                return DownloadState.REPAIRING;
            case "PP_QUEUED":
            case "RENAMING":
            case "UNPACKING":
            case "MOVING":
            case "EXECUTING_SCRIPT":
                return DownloadState.UNPACKING;
            case "PP_FINISHED":
                return DownloadState.COMPLETED;
            default:
                return DownloadState.ERROR;
        }
    }

    /** History status is {@code KIND/DETAIL}, e.g. {@code SUCCESS/UNPACK} or {@code FAILURE/PAR}. */
    static DownloadState mapHistoryState(String status) {
        String kind = status == null ? "" : status.split("/", 2)[0];
        switch (kind) {
            case "SUCCESS":
            case "WARNING":
                return DownloadState.COMPLETED;
            default:
                return DownloadState.ERROR;
        }
    }

    static RepairStatus repairStatus(String parStatus) {
        switch (parStatus == null ? "" : parStatus) {
            case "SUCCESS":
            case "NONE":
                return RepairStatus.GOOD;
            case "FAILURE":
            case "REPAIR_POSSIBLE":
            case "MANUAL":
                return RepairStatus.FAILED;
            default:
                return null;
        }
    }

    static UnpackStatus unpackStatus(String unpack) {
        switch (unpack == null ? "" : unpack) {
            case "SUCCESS":
                return UnpackStatus.COMPLETED;
            case "FAILURE":
            case "SPACE":
            case "PASSWORD":
                return UnpackStatus.FAILED;
            default:
                return null;
        }
    }

    private DownloadDetails mapGroup(XmlRpcValue group) {
        DownloadState state = mapGroupState(group.get("Status").asString());
        long size = sizeOf(group, "FileSize");
        long remaining = sizeOf(group, "RemainingSize");
        long downloaded = Math.max(0, size - remaining);

        return fill(DownloadDetails.builder(), group)
                .name(group.get("NZBName").asString())
                .status(state)
                .progress(ClientSupport.percent(downloaded, size))
                .size(size)
                .downloaded(downloaded)
                .repairStatus(state == DownloadState.REPAIRING ? RepairStatus.REPAIRING : null)
                .unpackStatus(state == DownloadState.UNPACKING ? UnpackStatus.UNPACKING : null)
                .downloadDir(blankToNull(group.get("DestDir").asString()))
                .build();
    }

    private DownloadDetails mapHistory(XmlRpcValue item) {
        String status = item.get("Status").asString();
        DownloadState state = mapHistoryState(status);
        long size = sizeOf(item, "FileSize");

        return fill(DownloadDetails.builder(), item)
                .name(item.get("Name").asString())
                .status(state)
                .progress(state == DownloadState.COMPLETED ? 100 : 0)
                .size(size)
                .downloaded(size)
                .repairStatus(repairStatus(item.get("ParStatus").asString()))
                .unpackStatus(unpackStatus(item.get("UnpackStatus").asString()))
                .error(state == DownloadState.ERROR ? status : null)
                .completedDate(ClientSupport.epochSeconds(item.get("HistoryTime").asLong()))
                .downloadDir(blankToNull(item.get("DestDir").asString()))
                .build();
    }

    private <B extends DownloadStatus.DownloadStatusBuilder<?, ?>> B fill(B builder, XmlRpcValue entry) {
        builder.id(entry.get("NZBID").asString())
                .category(blankToNull(entry.get("Category").asString()))
                .age(ageDays(entry.get("MinPostTime").asLong()));
        return builder;
    }

    /** 64-bit sizes arrive as two signed 32-bit halves. */
    static long sizeOf(XmlRpcValue entry, String prefix) {
        XmlRpcValue hi = entry.get(prefix + "Hi");
        XmlRpcValue lo = entry.get(prefix + "Lo");
        if (hi.isNil() && lo.isNil()) {
            return entry.get(prefix + "MB").asLong() * MB;
        }
        return combine(hi, lo);
    }

    private static long combine(XmlRpcValue hi, XmlRpcValue lo) {
        return (hi.asLong() << 32) + (lo.asLong() & 0xFFFFFFFFL);
    }

    private static Integer ageDays(long postTime) {
        if (postTime <= 0) {
            return null;
        }
        return (int) Duration.between(Instant.ofEpochSecond(postTime), Instant.now()).toDays();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    // ---- wire ---------------------------------------------------------------

    XmlRpcValue call(String method, Object... params) throws DownloaderException {
        String body = XmlRpcCodec.encodeCall(method, Arrays.asList(params));
        HttpRequest.Builder request = http.request(endpoint())
                .header("Content-Type", "text/xml")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (downloader.hasCredentials()) {
            request.header("Authorization", DownloaderHttp.basicAuth(downloader.getUsername(), downloader.getPassword()));
        }

        HttpResponse<String> response = http.send(request.build());
        if (response.statusCode() == 401) {
            throw DownloaderException.authentication("Authentication failed: Invalid username or password");
        }
        if (!DownloaderHttp.isSuccess(response)) {
            throw DownloaderException.httpStatus(response.statusCode());
        }
        return XmlRpcCodec.decodeResponse(response.body());
    }

    private String endpoint() throws DownloaderException {
        return EndpointResolver.resolve(downloader, DEFAULT_PATH);
    }
}
