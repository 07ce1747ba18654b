package chaptercrawler;

// Life cycle of one ChapterTask. REJECTED, FAILED, SUCCEEDED and CANCELLED are outcomes; TERMINATED is always last.
public enum TaskState {
    PENDING,
    TOKEN_ACQUIRED,
    CLAIMED,
    REJECTED,
    FETCHING,
    SUCCEEDED,
    FAILED,
    // run was stopped before this task got to fetch
    CANCELLED,
    TERMINATED
}
