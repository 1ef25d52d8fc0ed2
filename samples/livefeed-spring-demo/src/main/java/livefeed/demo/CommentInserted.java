package livefeed.demo;

import livefeed.Channel;

/** Notification payload: only ids, subscribers re-read the row under their own account. */
public record CommentInserted(long commentID, long postID) {
    public static final Channel<CommentInserted> CHANNEL = Channel.of("comment_insert", CommentInserted.class);
}
