package chaptercrawler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocumentAssemblerTest {

    @Test
    void chaptersAreJoinedByIndexNotArrival() {
        List<ChapterResult> arrived = List.of(
                new ChapterResult(2, "u2", "<p>two</p>"),
                new ChapterResult(0, "u0", "<p>zero</p>"),
                new ChapterResult(1, "u1", "<p>one</p>"));

        String body = new DocumentAssembler("Book").body(arrived);

        assertEquals("<p>zero</p><hr />\n<p>one</p><hr />\n<p>two</p>", body);
    }

    @Test
    void equalIndicesKeepArrivalOrder() {
        List<ChapterResult> arrived = List.of(
                new ChapterResult(1, "b", "second"),
                new ChapterResult(0, "a", "first"),
                new ChapterResult(1, "c", "third"));

        List<ChapterResult> sorted = DocumentAssembler.inChainOrder(arrived);

        assertEquals(List.of("a", "b", "c"), sorted.stream().map(ChapterResult::url).toList());
    }

    @Test
    void documentIsWrappedInStandaloneShell() {
        String html = new DocumentAssembler("Tom & Jerry <3").assemble(List.of(new ChapterResult(0, "u", "<p>only</p>")));

        assertTrue(html.contains("<!DOCTYPE html>"));
        assertTrue(html.contains("<meta charset=\"UTF-8\">"));
        assertTrue(html.contains("<title>Tom &amp; Jerry &lt;3</title>"));
        assertTrue(html.contains("<body><p>only</p></body></html>"));
    }

    @Test
    void noChaptersStillProducesADocument() {
        String html = new DocumentAssembler("Empty").assemble(List.of());

        assertTrue(html.contains("<body></body>"));
    }
}
