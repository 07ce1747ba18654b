package chaptercrawler;

// Why a single page could not be turned into a chapter.
public enum FailureType {
    NETWORK_FAILURE,
    TIMEOUT,
    DECODE_FAILURE,
    CONTENT_NOT_FOUND,
    // unexpected runtime exception thrown by a fetcher
    CRASH
}
