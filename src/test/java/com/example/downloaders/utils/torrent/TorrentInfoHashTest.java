package com.example.downloaders.utils.torrent;

import com.example.downloaders.support.TorrentFixtures;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TorrentInfoHashTest {

    @Test
    void hashIsSha1OfRawInfoDictionary() throws Exception {
        byte[] info = TorrentFixtures.infoDictionary().getBytes(StandardCharsets.US_ASCII);
        String expected = HexFormat.of().formatHex(MessageDigest.getInstance("SHA-1").digest(info));

        assertThat(TorrentInfoHash.compute(TorrentFixtures.torrent())).isEqualTo(expected);
    }

    @Test
    void torrentWithoutInfoIsRejected() {
        byte[] torrent = "d8:announce3:urle".getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> TorrentInfoHash.compute(torrent))
                .isInstanceOf(BencodeException.class)
                .hasMessageContaining("info");
    }

    @Test
    void htmlErrorPageYieldsNoHash() {
        byte[] page = "<html><body>Not found</body></html>".getBytes(StandardCharsets.UTF_8);

        assertThat(TorrentInfoHash.tryCompute(page)).isEmpty();
    }
}
