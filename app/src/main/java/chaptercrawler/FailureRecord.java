package chaptercrawler;

// Lightweight failure detail for failures.csv.
public record FailureRecord(int index, String url, FailureType type, String message) { }
