package chaptercrawler;

import java.util.Optional;

// Extracted chapter body plus the resolved "next chapter" link, if the page had a usable one.
public record FetchedPage(String content, Optional<String> nextUrl) {

    public static FetchedPage last(String content) {
        return new FetchedPage(content, Optional.empty());
    }

    public static FetchedPage withNext(String content, String nextUrl) {
        return new FetchedPage(content, Optional.of(nextUrl));
    }
}
