package net.ogimage.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class UrlUtilsTest {

    @ParameterizedTest
    @CsvSource({
        "HTTPS://Example.COM/docs/,https://example.com/docs",
        "https://example.com/,https://example.com",
        "https://example.com,https://example.com",
        "http://example.com:80/a,http://example.com/a",
        "https://example.com:443/a,https://example.com/a",
        "https://example.com:8443/a,https://example.com:8443/a",
        "https://example.com/a#section,https://example.com/a",
        "https://example.com/a/?q=1,https://example.com/a?q=1"
    })
    void shouldCanonicalize(String input, String expected) {
        assertEquals(expected, UrlUtils.canonicalize(input));
    }

    @Test
    void shouldKeepPathCase() {
        assertEquals("https://example.com/Docs", UrlUtils.canonicalize("https://EXAMPLE.com/Docs"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "ftp://example.com/file", "example.com", "https://", "not a url"})
    void shouldRejectNonHttpUrls(String input) {
        assertTrue(UrlUtils.parseHttpUrl(input).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "https://my_site.example.com/page",
        "https://example.com/search?q=a b",
        "https://example.com/search?q=a|b",
        "https://example.com/wiki/Café",
        "https://example.com/list?ids[]=1"
    })
    void shouldAcceptUrlsBrowsersAccept(String input) {
        assertTrue(UrlUtils.parseHttpUrl(input).isPresent(), input);
    }

    @Test
    void shouldRejectSpaceInsideHost() {
        assertTrue(UrlUtils.parseHttpUrl("https://bad host.com/page").isEmpty());
    }

    @Test
    void shouldCanonicalizeUnencodedQueryLikeItsEncodedForm() {
        assertEquals("https://example.com/search?q=a%20b", UrlUtils.canonicalize("https://example.com/search?q=a b"));
        assertEquals(UrlUtils.canonicalize("https://example.com/search?q=a%20b"),
            UrlUtils.canonicalize("https://example.com/search?q=a b"));
        assertEquals("https://example.com/search?q=a%7Cb", UrlUtils.canonicalize("https://example.com/search?q=a|b"));
        assertEquals("https://example.com/wiki/Caf%C3%A9", UrlUtils.canonicalize("https://example.com/wiki/Café"));
    }

    @Test
    void shouldHandleUnderscoreHostsWithPorts() {
        assertEquals("my_site.example.com", UrlUtils.extractHost("https://My_Site.example.com/page").orElseThrow());
        assertEquals("https://my_site.example.com:8080/page",
            UrlUtils.canonicalize("HTTPS://user@My_Site.example.com:8080/page/"));
        assertEquals("https://my_site.example.com/page", UrlUtils.canonicalize("https://my_site.example.com:443/page"));
    }

    @Test
    void shouldExtractLowerCasedHost() {
        assertEquals("blog.example.com", UrlUtils.extractHost("https://Blog.Example.com/post").orElseThrow());
    }
}
