package livefeed.demo;

import livefeed.AccountId;
import livefeed.ApiErrorCode;
import livefeed.ApiException;
import livefeed.SqlQuery;
import livefeed.context.AuthorizedContext;
import livefeed.context.Contexts;
import livefeed.context.RowMapper;
import livefeed.registry.ChannelRegistry;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Posts and comments. Every read and write goes through an authorized transaction; a new
 * comment is announced on {@link CommentInserted#CHANNEL} once its transaction commits.
 */
@Service
public class CommentService {

    static final RowMapper<Comment> COMMENT = rs -> new Comment(
            rs.getLong("id"),
            rs.getLong("post_id"),
            rs.getLong("author_id"),
            rs.getString("body"),
            rs.getTimestamp("created_at").toInstant());

    private final Contexts contexts;
    private final ChannelRegistry registry;

    public CommentService(Contexts contexts, ChannelRegistry registry) {
        this.contexts = contexts;
        this.registry = registry;
    }

    public long createPost(AccountId author, String title) {
        if (title == null || title.isBlank()) {
            throw new ApiException(ApiErrorCode.BAD_INPUT, "title must not be blank");
        }
        return contexts.withAuthorized(author, ctx -> {
            long postId = nextId(ctx, "post_seq");
            ctx.update(SqlQuery.of("INSERT INTO post (id, author_id, title) VALUES (?, ?, ?)",
                    postId, author.value(), title));
            return postId;
        });
    }

    public long publishComment(AccountId author, long postId, String body) {
        if (body == null || body.isBlank()) {
            throw new ApiException(ApiErrorCode.BAD_INPUT, "comment must not be blank");
        }
        return contexts.withAuthorized(author, ctx -> {
            if (!postExists(ctx, postId)) {
                throw new ApiException(ApiErrorCode.NOT_FOUND, "No post " + postId);
            }
            long commentId = nextId(ctx, "comment_seq");
            ctx.update(SqlQuery.of(
                    "INSERT INTO comment (id, post_id, author_id, body, created_at) VALUES (?, ?, ?, ?, ?)",
                    commentId, postId, author.value(), body, Instant.now()));
            ctx.afterCommit(() -> registry.notify(CommentInserted.CHANNEL, new CommentInserted(commentId, postId)));
            return commentId;
        });
    }

    public List<Comment> listComments(AccountId viewer, long postId) {
        return contexts.withAuthorized(viewer, ctx -> {
            if (!postExists(ctx, postId)) {
                throw new ApiException(ApiErrorCode.NOT_FOUND, "No post " + postId);
            }
            return ctx.query(SqlQuery.of(
                    "SELECT id, post_id, author_id, body, created_at FROM comment WHERE post_id = ? ORDER BY id",
                    postId), COMMENT);
        });
    }

    static boolean postExists(AuthorizedContext ctx, long postId) {
        return ctx.queryOne(SqlQuery.of("SELECT id FROM post WHERE id = ?", postId), rs -> rs.getLong(1))
                .isPresent();
    }

    static Optional<Comment> findComment(AuthorizedContext ctx, long commentId) {
        return ctx.queryOne(SqlQuery.of(
                "SELECT id, post_id, author_id, body, created_at FROM comment WHERE id = ?", commentId), COMMENT);
    }

    private static long nextId(AuthorizedContext ctx, String sequence) {
        return ctx.queryOne(SqlQuery.of("SELECT NEXT VALUE FOR " + sequence), rs -> rs.getLong(1))
                .orElseThrow(() -> new IllegalStateException("sequence " + sequence + " returned no value"));
    }
}
