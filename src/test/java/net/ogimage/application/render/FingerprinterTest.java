package net.ogimage.application.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FingerprinterTest {

    private final Fingerprinter fingerprinter = new Fingerprinter();

    @Test
    void equalInputs_ProduceEqualFingerprints() {
        assertThat(fingerprinter.fingerprint("https://example.com/page", 1200, 630))
            .isEqualTo(fingerprinter.fingerprint("https://example.com/page", 1200, 630));
    }

    @Test
    void normalizedVariants_ShareAFingerprint() {
        String canonical = fingerprinter.fingerprint("https://example.com/page", 1200, 630);

        assertThat(fingerprinter.fingerprint("HTTPS://EXAMPLE.com/page/", 1200, 630)).isEqualTo(canonical);
        assertThat(fingerprinter.fingerprint("https://example.com:443/page#top", 1200, 630)).isEqualTo(canonical);
    }

    @Test
    void differentWidth_ProducesDifferentFingerprint() {
        assertThat(fingerprinter.fingerprint("https://example.com", 1200, 630))
            .isNotEqualTo(fingerprinter.fingerprint("https://example.com", 1201, 630));
    }

    @Test
    void differentHeightOrPath_ProducesDifferentFingerprint() {
        String base = fingerprinter.fingerprint("https://example.com/a", 1200, 630);

        assertThat(fingerprinter.fingerprint("https://example.com/a", 1200, 631)).isNotEqualTo(base);
        assertThat(fingerprinter.fingerprint("https://example.com/b", 1200, 630)).isNotEqualTo(base);
    }

    @Test
    void fingerprint_IsLowercaseSha256Hex() {
        assertThat(fingerprinter.fingerprint("https://example.com", 1200, 630)).matches("[0-9a-f]{64}");
    }
}
