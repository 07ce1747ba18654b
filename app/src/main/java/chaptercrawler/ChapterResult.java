package chaptercrawler;

// One successfully fetched chapter. Output order is decided by index, not by when the fetch finished.
public record ChapterResult(int index, String url, String content) { }
