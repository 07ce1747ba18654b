package chaptercrawler;

// Fetches one page and extracts its chapter content and "next" link.
// Called from many threads at once; no retries, no caching. An unresolvable next link means no next link.
public interface PageFetcher {

    FetchedPage fetch(String url) throws FetchException;
}
