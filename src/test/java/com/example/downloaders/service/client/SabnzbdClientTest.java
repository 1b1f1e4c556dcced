package com.example.downloaders.service.client;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.support.StubHttpServer;
import com.example.downloaders.support.StubHttpServer.RecordedRequest;
import com.example.downloaders.utils.model.ActionResult;
import com.example.downloaders.utils.model.AddOutcome;
import com.example.downloaders.utils.model.AddResult;
import com.example.downloaders.utils.model.DownloadRequest;
import com.example.downloaders.utils.model.DownloadState;
import com.example.downloaders.utils.model.DownloadStatus;
import com.example.downloaders.utils.model.Downloader;
import com.example.downloaders.utils.model.DownloaderType;
import com.example.downloaders.utils.model.RepairStatus;
import com.example.downloaders.utils.model.UnpackStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SabnzbdClientTest {

    private static final String EMPTY_QUEUE = "{\"queue\":{\"slots\":[],\"kbpersec\":\"0\",\"diskspace1\":\"0\"}}";
    private static final String EMPTY_HISTORY = "{\"history\":{\"slots\":[]}}";

    private StubHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = StubHttpServer.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private SabnzbdClient client(Downloader downloader) {
        return new SabnzbdClient(downloader, StubHttpServer.http(), new ObjectMapper());
    }

    private Downloader.DownloaderBuilder downloader() {
        return Downloader.builder().id("s1").name("SABnzbd").type(DownloaderType.SABNZBD)
                .url(server.baseUrl()).password("apikey123");
    }

    private static DownloadRequest request() {
        return DownloadRequest.builder().url("https://indexer.example/getnzb/abc.nzb?i=1&r=key")
                .title("Some.Game-GRP").build();
    }

    private List<String> paths() {
        return server.requests().stream().map(RecordedRequest::getPath).collect(Collectors.toList());
    }

    @Test
    void addSubmitsUrlByReference() throws Exception {
        server.enqueue(200, "{\"status\":true,\"nzo_ids\":[\"SABnzbd_nzo_abc123\"]}");

        AddResult result = client(downloader().category("games").build())
                .addDownload(request().toBuilder().priority(5).build());

        assertThat(result.getOutcome()).isEqualTo(AddOutcome.ADDED);
        assertThat(result.getId()).isEqualTo("SABnzbd_nzo_abc123");
        String path = server.request(0).getPath();
        assertThat(path).startsWith("/api?mode=addurl&output=json&apikey=apikey123")
                .contains("&name=https%3A%2F%2Findexer.example%2Fgetnzb%2Fabc.nzb%3Fi%3D1%26r%3Dkey")
                .contains("&nzbname=Some.Game-GRP")
                .contains("&cat=games")
                .contains("&priority=1");
    }

    @Test
    void emptyIdListIsLikelyDuplicate() throws Exception {
        server.enqueue(200, "{\"status\":true,\"nzo_ids\":[]}");

        AddResult result = client(downloader().build()).addDownload(request());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).contains("duplicate or merged");
    }

    @Test
    void duplicateErrorIsSuccess() throws Exception {
        server.enqueue(200, "{\"status\":false,\"error\":\"DUPLICATE NZB\"}");

        AddResult result = client(downloader().build()).addDownload(request());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutcome()).isEqualTo(AddOutcome.ALREADY_EXISTS);
        assertThat(result.getMessage()).isEqualTo("NZB already exists");
    }

    @Test
    void otherErrorIsFailure() throws Exception {
        server.enqueue(200, "{\"status\":false,\"error\":\"Unknown category\"}");

        AddResult result = client(downloader().build()).addDownload(request());

        assertThat(result.getOutcome()).isEqualTo(AddOutcome.FAILED);
        assertThat(result.getMessage()).isEqualTo("Failed to add NZB: Unknown category");
    }

    @Test
    void stoppedDownloaderAddsPaused() throws Exception {
        server.enqueue(200, "{\"status\":true,\"nzo_ids\":[\"x\"]}");

        client(downloader().addStopped(true).build()).addDownload(request());

        assertThat(server.request(0).getPath()).contains("&priority=-2");
    }

    @Test
    void apiKeyFallsBackToUsername() throws Exception {
        server.enqueue(200, "{\"status\":true,\"nzo_ids\":[\"x\"]}");

        client(downloader().password(null).username("key").build()).addDownload(request());

        assertThat(server.request(0).getPath()).contains("apikey=key");
    }

    @Test
    void wrongApiKeyIsAuthenticationFailure() {
        server.enqueue(200, "{\"status\":false,\"error\":\"API Key Incorrect\"}");

        assertThatThrownBy(() -> client(downloader().build()).getAllDownloads())
                .isInstanceOfSatisfying(DownloaderException.class, e -> assertThat(e.isAuthentication()).isTrue());
    }

    @Test
    void queueHitMapsActiveJob() throws Exception {
        server.enqueue(200, "{\"queue\":{\"kbpersec\":\"2048.0\",\"slots\":[{\"nzo_id\":\"n1\",\"filename\":\"Game\","
                + "\"status\":\"Downloading\",\"percentage\":\"45\",\"mb\":\"1000.0\",\"mbleft\":\"550.0\","
                + "\"timeleft\":\"0:12:34\",\"cat\":\"games\",\"avg_age\":\"12d\"}]}}");

        Optional<DownloadStatus> status = client(downloader().build()).getDownloadStatus("n1");

        assertThat(status).isPresent();
        DownloadStatus job = status.get();
        assertThat(job.getStatus()).isEqualTo(DownloadState.DOWNLOADING);
        assertThat(job.getProgress()).isEqualTo(45);
        assertThat(job.getEta()).isEqualTo(754L);
        assertThat(job.getDownloadSpeed()).isEqualTo(2048L * 1024);
        assertThat(job.getSize()).isEqualTo(1000L * 1024 * 1024);
        assertThat(job.getDownloaded()).isEqualTo(450L * 1024 * 1024);
        assertThat(job.getCategory()).isEqualTo("games");
        assertThat(job.getAge()).isEqualTo(12);
        assertThat(server.requests()).hasSize(1);
    }

    @Test
    void queueMissFallsBackToHistory() throws Exception {
        server.enqueue(200, EMPTY_QUEUE);
        server.enqueue(200, "{\"history\":{\"slots\":[{\"nzo_id\":\"n2\",\"name\":\"Game\",\"status\":\"Failed\","
                + "\"fail_message\":\"Unpacking failed, archive requires a password\",\"bytes\":1024,\"category\":\"*\"}]}}");

        DownloadStatus job = client(downloader().build()).getDownloadStatus("n2").orElseThrow();

        assertThat(job.getStatus()).isEqualTo(DownloadState.ERROR);
        assertThat(job.getUnpackStatus()).isEqualTo(UnpackStatus.FAILED);
        assertThat(job.getError()).contains("password");
        assertThat(job.getCategory()).isNull();
        assertThat(paths().get(1)).contains("mode=history").contains("nzo_ids=n2");
    }

    @Test
    void unknownJobIsEmpty() throws Exception {
        server.enqueue(200, EMPTY_QUEUE);
        server.enqueue(200, EMPTY_HISTORY);

        assertThat(client(downloader().build()).getDownloadStatus("nope")).isEmpty();
    }

    @Test
    void listsQueueThenHistory() throws Exception {
        server.enqueue(200, "{\"queue\":{\"slots\":[{\"nzo_id\":\"q\",\"status\":\"Extracting\"}]}}");
        server.enqueue(200, "{\"history\":{\"slots\":[{\"nzo_id\":\"h\",\"status\":\"Completed\",\"bytes\":10}]}}");

        List<DownloadStatus> all = client(downloader().build()).getAllDownloads();

        assertThat(all).extracting(DownloadStatus::getId).containsExactly("q", "h");
        assertThat(all.get(0).getStatus()).isEqualTo(DownloadState.UNPACKING);
        assertThat(all.get(1).getStatus()).isEqualTo(DownloadState.COMPLETED);
        assertThat(all.get(1).getRepairStatus()).isEqualTo(RepairStatus.GOOD);
        assertThat(all.get(1).getProgress()).isEqualTo(100);
    }

    @Test
    void removeClearsQueueAndHistory() throws Exception {
        server.enqueue(200, "{\"status\":true,\"nzo_ids\":[\"n1\"]}");
        server.enqueue(200, "{\"status\":false}");

        ActionResult result = client(downloader().build()).removeDownload("n1", true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(paths().get(0)).contains("mode=queue").contains("name=delete").contains("value=n1").contains("del_files=1");
        assertThat(paths().get(1)).contains("mode=history").contains("name=delete");
    }

    @Test
    void pauseUsesQueueAction() throws Exception {
        server.enqueue(200, "{\"status\":true}");

        assertThat(client(downloader().build()).pauseDownload("n1").isSuccess()).isTrue();
        assertThat(paths().get(0)).contains("mode=queue&output=json&apikey=apikey123&name=pause&value=n1");
    }

    @Test
    void freeSpaceFromQueueGigabytes() throws Exception {
        server.enqueue(200, "{\"queue\":{\"diskspace1\":\"1.50\",\"slots\":[]}}");

        assertThat(client(downloader().build()).getFreeSpace()).isEqualTo((long) (1.5 * 1024 * 1024 * 1024));
    }

    @Test
    void connectionTestChecksVersionAndKey() {
        server.enqueue(200, "{\"version\":\"4.2.1\"}");
        server.enqueue(200, EMPTY_QUEUE);

        ActionResult result = client(downloader().build()).testConnection();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Connected successfully to SABnzbd 4.2.1");
    }

    @Test
    void timeLeftParsing() {
        assertThat(SabnzbdClient.parseTimeLeft("1:02:03")).isEqualTo(3723L);
        assertThat(SabnzbdClient.parseTimeLeft("2:00:00:10")).isEqualTo(172_810L);
        assertThat(SabnzbdClient.parseTimeLeft("0:00:00")).isNull();
        assertThat(SabnzbdClient.parseTimeLeft("unknown")).isNull();
        assertThat(SabnzbdClient.parseTimeLeft("soon")).isNull();
    }

    @Test
    void stateMapping() {
        assertThat(SabnzbdClient.mapQueueState("Paused")).isEqualTo(DownloadState.PAUSED);
        assertThat(SabnzbdClient.mapQueueState("Verifying")).isEqualTo(DownloadState.REPAIRING);
        assertThat(SabnzbdClient.mapHistoryState("Moving")).isEqualTo(DownloadState.UNPACKING);
        assertThat(SabnzbdClient.mapHistoryState("Failed")).isEqualTo(DownloadState.ERROR);
    }
}
