package com.example.downloaders.utils.auth;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DigestAuthTest {

    private static final String RFC_CHALLENGE = "Digest realm=\"testrealm@host.com\", qop=\"auth,auth-int\", "
            + "nonce=\"dcd98b7102dd2f0e8b11d0f600bfb0c093\", opaque=\"5ccc069c403ebaf9f0171e9517f40e41\"";

    @Test
    void parsesRfcChallenge() {
        DigestAuth.Challenge challenge = DigestAuth.parseChallenge(RFC_CHALLENGE).orElseThrow();

        assertThat(challenge.getRealm()).isEqualTo("testrealm@host.com");
        assertThat(challenge.getNonce()).isEqualTo("dcd98b7102dd2f0e8b11d0f600bfb0c093");
        assertThat(challenge.getOpaque()).isEqualTo("5ccc069c403ebaf9f0171e9517f40e41");
        assertThat(challenge.selectedQop()).isEqualTo("auth");
    }

    @Test
    void basicChallengeIsNotDigest() {
        assertThat(DigestAuth.parseChallenge("Basic realm=\"rtorrent\"")).isEmpty();
        assertThat(DigestAuth.parseChallenge(null)).isEmpty();
    }

    @Test
    void computesRfc2617Response() {
        DigestAuth.Challenge challenge = DigestAuth.parseChallenge(RFC_CHALLENGE).orElseThrow();

        String response = DigestAuth.response(challenge, "Mufasa", "Circle Of Life",
                "GET", "/dir/index.html", null, "0a4f113b");

        assertThat(response).isEqualTo("6629fae49393a05397450978507c4ef1");
    }

    @Test
    void authorizationHeaderCarriesNonceCountAndCnonce() {
        DigestAuth.Challenge challenge = DigestAuth.parseChallenge(RFC_CHALLENGE).orElseThrow();

        String header = DigestAuth.authorization(challenge, "Mufasa", "Circle Of Life",
                "GET", "/dir/index.html", null, "0a4f113b");

        assertThat(header).startsWith("Digest username=\"Mufasa\"")
                .contains("uri=\"/dir/index.html\"")
                .contains("response=\"6629fae49393a05397450978507c4ef1\"")
                .contains("opaque=\"5ccc069c403ebaf9f0171e9517f40e41\"")
                .contains("qop=auth")
                .contains("nc=00000001")
                .contains("cnonce=\"0a4f113b\"");
    }

    @Test
    void authIntHashesTheBody() {
        DigestAuth.Challenge challenge = DigestAuth.Challenge.builder()
                .realm("rtorrent").nonce("abc").qop("auth-int").build();

        String withBody = DigestAuth.response(challenge, "u", "p", "POST", "/RPC2", "<a/>".getBytes(), "c");
        String otherBody = DigestAuth.response(challenge, "u", "p", "POST", "/RPC2", "<b/>".getBytes(), "c");

        assertThat(withBody).isNotEqualTo(otherBody);
    }

    @Test
    void legacyChallengeWithoutQopOmitsNonceCount() {
        DigestAuth.Challenge challenge = DigestAuth.parseChallenge("Digest realm=\"r\", nonce=\"n\"").orElseThrow();

        String header = DigestAuth.authorization(challenge, "u", "p", "POST", "/RPC2", null, "c");

        assertThat(header).doesNotContain("qop=").doesNotContain("nc=");
        assertThat(DigestAuth.response(challenge, "u", "p", "POST", "/RPC2", null, "c"))
                .isEqualTo(DigestAuth.md5Hex(DigestAuth.md5Hex("u:r:p") + ":n:" + DigestAuth.md5Hex("POST:/RPC2")));
    }

    @Test
    void cnonceIsRandomHex() {
        assertThat(DigestAuth.newCnonce()).matches("[0-9a-f]{16}").isNotEqualTo(DigestAuth.newCnonce());
    }
}
