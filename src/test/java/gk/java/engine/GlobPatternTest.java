package gk.java.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GlobPatternTest {

    @Test
    void testStar_matchesAcrossSlashes() {
        GlobPattern pattern = GlobPattern.compile("/api/*");
        assertTrue(pattern.matches("/api/"));
        assertTrue(pattern.matches("/api/v1/users/42"));
        assertFalse(pattern.matches("/apix"));
        assertFalse(pattern.matches("/other/api/x"));
    }

    @Test
    void testQuestionMark_matchesOneCharacter() {
        GlobPattern pattern = GlobPattern.compile("/v?/items");
        assertTrue(pattern.matches("/v1/items"));
        assertFalse(pattern.matches("/v10/items"));
        assertFalse(pattern.matches("/v/items"));
    }

    @Test
    void testCharacterClasses() {
        GlobPattern included = GlobPattern.compile("/v[12]/*");
        assertTrue(included.matches("/v1/x"));
        assertTrue(included.matches("/v2/x"));
        assertFalse(included.matches("/v3/x"));

        GlobPattern excluded = GlobPattern.compile("/v[!12]/*");
        assertTrue(excluded.matches("/v3/x"));
        assertFalse(excluded.matches("/v1/x"));
    }

    @Test
    void testRegexMetacharacters_areLiteral() {
        GlobPattern pattern = GlobPattern.compile("/search.json+(x)");
        assertTrue(pattern.matches("/search.json+(x)"));
        assertFalse(pattern.matches("/searchXjson+(x)"));
    }

    @Test
    void testUnterminatedBracket_isLiteral() {
        GlobPattern pattern = GlobPattern.compile("/a[b");
        assertTrue(pattern.matches("/a[b"));
        assertFalse(pattern.matches("/ab"));
    }

    @Test
    void testMatching_isCaseSensitive() {
        assertFalse(GlobPattern.compile("/API/*").matches("/api/x"));
    }

    @Test
    void testEmptyPattern_rejected() {
        assertThrows(InvalidRuleException.class, () -> GlobPattern.compile(""));
        assertThrows(InvalidRuleException.class, () -> GlobPattern.compile(null));
    }

    @Test
    void testGlob_keepsSource() {
        assertEquals("/api/*", GlobPattern.compile("/api/*").glob());
    }
}
