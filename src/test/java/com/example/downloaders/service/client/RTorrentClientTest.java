package com.example.downloaders.service.client;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.support.StubHttpServer;
import com.example.downloaders.support.StubHttpServer.RecordedRequest;
import com.example.downloaders.support.StubHttpServer.StubResponse;
import com.example.downloaders.support.TorrentFixtures;
import com.example.downloaders.utils.http.DownloaderHttp;
import com.example.downloaders.utils.model.ActionResult;
import com.example.downloaders.utils.model.AddOutcome;
import com.example.downloaders.utils.model.AddResult;
import com.example.downloaders.utils.model.DownloadRequest;
import com.example.downloaders.utils.model.DownloadState;
import com.example.downloaders.utils.model.DownloadStatus;
import com.example.downloaders.utils.model.Downloader;
import com.example.downloaders.utils.model.DownloaderType;
import com.example.downloaders.utils.torrent.TorrentInfoHash;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RTorrentClientTest {

    private static final Pattern METHOD = Pattern.compile("<methodName>(.*?)</methodName>");
    private static final String HASH = "0123456789abcdef0123456789abcdef01234567";
    private static final String ZERO = xml("<i4>0</i4>");
    private static final String FAULT = "<?xml version=\"1.0\"?><methodResponse><fault><value><struct>"
            + "<member><name>faultCode</name><value><i4>-501</i4></value></member>"
            + "<member><name>faultString</name><value><string>Could not find info-hash.</string></value></member>"
            + "</struct></value></fault></methodResponse>";

    private StubHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        server = StubHttpServer.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private static String xml(String value) {
        return "<?xml version=\"1.0\"?>\n<methodResponse><params><param><value>" + value
                + "</value></param></params></methodResponse>";
    }

    private static String method(RecordedRequest request) {
        Matcher matcher = METHOD.matcher(request.bodyAsString());
        return matcher.find() ? matcher.group(1) : null;
    }

    private List<String> rpcMethods() {
        return server.requests().stream()
                .filter(r -> r.getPath().equals("/RPC2"))
                .map(RTorrentClientTest::method)
                .collect(Collectors.toList());
    }

    private RTorrentClient client(Downloader downloader) {
        DownloaderHttp http = StubHttpServer.http();
        return new RTorrentClient(downloader, http, StubHttpServer.fetcher(http), new ObjectMapper(),
                Runnable::run, () -> "0a4f113b");
    }

    private Downloader.DownloaderBuilder downloader() {
        return Downloader.builder().id("r1").name("rTorrent").type(DownloaderType.RTORRENT).url(server.baseUrl());
    }

    private static DownloadRequest request(String url) {
        return DownloadRequest.builder().url(url).title("Some Game").build();
    }

    @Test
    void magnetIsLoadedAndLabelled() throws Exception {
        server.dispatch(r -> StubResponse.of(200, ZERO));
        Downloader downloader = downloader().downloadPath("/data/games").category("PC Games").build();

        AddResult result = client(downloader).addDownload(request("magnet:?xt=urn:btih:" + HASH));

        assertThat(result.getOutcome()).isEqualTo(AddOutcome.ADDED);
        assertThat(result.getId()).isEqualTo(HASH.toUpperCase(Locale.ROOT));
        assertThat(rpcMethods()).containsExactly("load.start", "d.custom1.set");
        String load = server.request(0).bodyAsString();
        assertThat(load).contains("magnet:?xt=urn:btih:" + HASH).contains("d.directory.set=&quot;/data/games&quot;");
        assertThat(server.request(1).bodyAsString()).contains("<string>PC%20Games</string>");
    }

    @Test
    void stoppedDownloaderUsesNonStartingLoad() throws Exception {
        server.dispatch(r -> StubResponse.of(200, ZERO));
        Downloader downloader = downloader().settings("{\"initialState\":\"stopped\"}").build();

        client(downloader).addDownload(request("magnet:?xt=urn:btih:" + HASH));

        assertThat(rpcMethods()).containsExactly("load.normal");
    }

    @Test
    void labelFailureDoesNotFailTheAdd() throws Exception {
        server.dispatch(r -> "d.custom1.set".equals(method(r)) ? StubResponse.of(200, FAULT) : StubResponse.of(200, ZERO));

        AddResult result = client(downloader().category("games").build())
                .addDownload(request("magnet:?xt=urn:btih:" + HASH));

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void torrentFileIsUploadedRawAfterUrlRepair() throws Exception {
        byte[] torrent = TorrentFixtures.torrent();
        server.dispatch(r -> {
            if (r.getPath().startsWith("/files/")) {
                return r.getPath().contains("+") ? StubResponse.of(400, "bad") : StubResponse.bytes(200, torrent);
            }
            return StubResponse.of(200, ZERO);
        });

        AddResult result = client(downloader().build())
                .addDownload(request(server.baseUrl() + "/files/get?name=Some+Game"));

        assertThat(result.getOutcome()).isEqualTo(AddOutcome.ADDED);
        assertThat(result.getId()).isEqualTo(TorrentInfoHash.compute(torrent).toUpperCase(Locale.ROOT));
        assertThat(server.request(0).getPath()).isEqualTo("/files/get?name=Some+Game");
        assertThat(server.request(1).getPath()).isEqualTo("/files/get?name=Some%20Game");
        assertThat(rpcMethods()).containsExactly("load.raw_start");
        assertThat(server.request(2).bodyAsString()).contains("<base64>");
    }

    @Test
    void threeConsecutive400sGiveUp() throws Exception {
        server.dispatch(r -> StubResponse.of(400, "bad request"));

        AddResult result = client(downloader().build())
                .addDownload(request(server.baseUrl() + "/files/get?name=A+B&file=A+B.torrent"));

        assertThat(result.getOutcome()).isEqualTo(AddOutcome.FAILED);
        assertThat(result.getMessage()).isEqualTo("Failed to fetch torrent file: HTTP 400: Bad Request");
        assertThat(server.requests()).extracting(RecordedRequest::getPath).containsExactly(
                "/files/get?name=A+B&file=A+B.torrent",
                "/files/get?name=A%20B&file=A%20B.torrent",
                "/files/get?name=A%20B");
    }

    @Test
    void nonZeroLoadResultIsFailure() throws Exception {
        server.dispatch(r -> StubResponse.of(200, xml("<i4>-1</i4>")));

        AddResult result = client(downloader().build()).addDownload(request("magnet:?xt=urn:btih:" + HASH));

        assertThat(result.getOutcome()).isEqualTo(AddOutcome.FAILED);
        assertThat(result.getMessage()).contains("-1");
    }

    @Test
    void answersDigestChallengeOnce() {
        server.dispatch(r -> {
            String auth = r.header("Authorization");
            if (auth != null && auth.startsWith("Digest ")) {
                return StubResponse.of(200, xml("<string>0.9.8</string>"));
            }
            return StubResponse.of(401, "").header("WWW-Authenticate",
                    "Digest realm=\"rtorrent\", nonce=\"abc123\", qop=\"auth\", opaque=\"xyz\"");
        });

        ActionResult result = client(downloader().username("admin").password("secret").build()).testConnection();

        assertThat(result.isSuccess()).isTrue();
        assertThat(server.requests()).hasSize(2);
        assertThat(server.request(0).header("Authorization")).startsWith("Basic ");
        assertThat(server.request(1).header("Authorization"))
                .startsWith("Digest username=\"admin\"")
                .contains("realm=\"rtorrent\"")
                .contains("uri=\"/RPC2\"")
                .contains("nc=00000001")
                .contains("cnonce=\"0a4f113b\"")
                .contains("opaque=\"xyz\"");
    }

    @Test
    void rejectedDigestIsAuthenticationFailure() {
        server.dispatch(r -> StubResponse.of(401, "").header("WWW-Authenticate", "Digest realm=\"r\", nonce=\"n\""));

        assertThatThrownBy(() -> client(downloader().username("admin").password("wrong").build()).getAllDownloads())
                .isInstanceOfSatisfying(DownloaderException.class, e -> assertThat(e.isAuthentication()).isTrue());
        assertThat(server.requests()).hasSize(2);
    }

    @Test
    void listsMainViewWithStateDerivation() throws Exception {
        server.enqueue(200, xml("<array><data>"
                + row("AAA", "a", 1, 1, 100, 100, 1500, 5, 2, "", "games%20pc")
                + row("BBB", "b", 0, 0, 100, 40, 0, 0, 0, "", "")
                + row("CCC", "c", 0, 1, 100, 100, 0, 0, 0, "", "")
                + row("DDD", "d", 1, 0, 100, 10, 0, 0, 0, "Tracker: [Timeout was reached]", "")
                + "</data></array>"));

        List<DownloadStatus> all = client(downloader().build()).getAllDownloads();

        assertThat(all).extracting(DownloadStatus::getStatus).containsExactly(
                DownloadState.SEEDING, DownloadState.PAUSED, DownloadState.COMPLETED, DownloadState.ERROR);
        DownloadStatus first = all.get(0);
        assertThat(first.getRatio()).isEqualTo(1.5);
        assertThat(first.getSeeders()).isEqualTo(2);
        assertThat(first.getLeechers()).isEqualTo(3);
        assertThat(first.getCategory()).isEqualTo("games pc");
        assertThat(all.get(1).getProgress()).isEqualTo(40);
        assertThat(method(server.request(0))).isEqualTo("d.multicall2");
        assertThat(server.request(0).bodyAsString()).contains("<string>main</string>").contains("d.custom1=");
    }

    private static String row(String hash, String name, int state, int complete, long size, long done,
                              long ratio, int connected, int seeds, String message, String label) {
        return "<value><array><data>"
                + "<value><string>" + hash + "</string></value>"
                + "<value><string>" + name + "</string></value>"
                + "<value><i8>" + state + "</i8></value>"
                + "<value><i8>" + complete + "</i8></value>"
                + "<value><i8>" + size + "</i8></value>"
                + "<value><i8>" + done + "</i8></value>"
                + "<value><i8>0</i8></value>"
                + "<value><i8>0</i8></value>"
                + "<value><i8>" + ratio + "</i8></value>"
                + "<value><i8>" + connected + "</i8></value>"
                + "<value><i8>" + seeds + "</i8></value>"
                + "<value><string>" + message + "</string></value>"
                + "<value><string>" + label + "</string></value>"
                + "</data></array></value>";
    }

    @Test
    void unknownHashIsEmpty() throws Exception {
        server.dispatch(r -> StubResponse.of(200, FAULT));

        assertThat(client(downloader().build()).getDownloadStatus("FFFF")).isEmpty();
    }

    @Test
    void removeWithDataStopsDeletesAndErases() throws Exception {
        server.dispatch(r -> StubResponse.of(200, ZERO));

        ActionResult result = client(downloader().build()).removeDownload("AAA", true);

        assertThat(result.isSuccess()).isTrue();
        assertThat(rpcMethods()).containsExactly("d.stop", "d.delete_tied", "d.erase");
    }

    @Test
    void freeSpaceFromFirstDownload() throws Exception {
        server.enqueue(200, xml("<array><data><value><array><data><value><i8>987654321</i8></value></data></array></value></data></array>"));

        assertThat(client(downloader().build()).getFreeSpace()).isEqualTo(987_654_321L);
    }

    @Test
    void stateDerivation() {
        assertThat(RTorrentClient.mapState(0, 0, 100, "")).isEqualTo(DownloadState.COMPLETED);
        assertThat(RTorrentClient.mapState(1, 0, 100, null)).isEqualTo(DownloadState.SEEDING);
        assertThat(RTorrentClient.mapState(1, 0, 50, "")).isEqualTo(DownloadState.DOWNLOADING);
        assertThat(RTorrentClient.mapState(1, 1, 100, "error")).isEqualTo(DownloadState.ERROR);
    }
}
