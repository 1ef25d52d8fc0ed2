package livefeed.demo;

import java.time.Instant;

public record Comment(long commentID, long postID, long authorID, String body, Instant createdAt) {
}
