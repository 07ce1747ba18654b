package chaptercrawler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

// Puts collected chapters back in chain order and wraps them in a standalone HTML page.
public class DocumentAssembler {

    public static final String SEPARATOR = "<hr />\n";

    private static final String TEMPLATE = """
            <!DOCTYPE html><html lang="en"><head><meta charset="UTF-8"><title>%s</title>
            <style>body { font-family: sans-serif; line-height: 1.6; max-width: 800px; margin: 2rem auto; padding: 0 1rem; } h1, h2, h3 { line-height: 1.2; } hr { margin: 3rem 0; }</style>
            </head><body>%s</body></html>
            """;

    private final String title;

    public DocumentAssembler(String title) {
        this.title = title;
    }

    // List.sort is stable, so equal indices keep arrival order.
    public static List<ChapterResult> inChainOrder(List<ChapterResult> chapters) {
        List<ChapterResult> sorted = new ArrayList<>(chapters);
        sorted.sort(Comparator.comparingInt(ChapterResult::index));
        return sorted;
    }

    public String body(List<ChapterResult> chapters) {
        return inChainOrder(chapters).stream()
                .map(ChapterResult::content)
                .collect(Collectors.joining(SEPARATOR));
    }

    public String assemble(List<ChapterResult> chapters) {
        return wrap(body(chapters));
    }

    public String wrap(String body) {
        return TEMPLATE.formatted(escapeTitle(title), body);
    }

    private static String escapeTitle(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
