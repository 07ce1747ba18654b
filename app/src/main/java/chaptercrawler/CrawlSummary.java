package chaptercrawler;

import java.nio.file.Path;

// Counters for the end-of-run report. cutShort is set when the run was stopped before the chain finished.
public record CrawlSummary(
        int chaptersCollected,
        int failures,
        int duplicatesRejected,
        int chaptersCapped,
        boolean cutShort,
        Path outputPath
) { }
