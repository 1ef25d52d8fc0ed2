package livefeed.demo;

import livefeed.ApiErrorCode;
import livefeed.ApiException;
import livefeed.context.SubscriptionContext;
import livefeed.registry.ChannelRegistry;
import livefeed.registry.Unlisten;
import livefeed.session.SubscriptionHandler;
import livefeed.session.Unsubscribe;
import livefeed.spring.boot.SubscriptionEndpoint;
import org.springframework.stereotype.Component;

/**
 * Streams new comments on one post. Each notification is re-read as the subscriber, so a
 * comment the subscriber may not see is never published.
 */
@Component
@SubscriptionEndpoint(path = "/comment/watchPostComments", input = WatchPostComments.Input.class)
public class WatchPostComments implements SubscriptionHandler<WatchPostComments.Input> {

    public record Input(long postID) {
    }

    private final ChannelRegistry registry;

    public WatchPostComments(ChannelRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Unsubscribe subscribe(SubscriptionContext<Object> ctx, Input input) {
        if (input.postID() <= 0) {
            throw new ApiException(ApiErrorCode.BAD_INPUT, "postID must be > 0");
        }
        boolean visible = ctx.withAuthorized(tx -> CommentService.postExists(tx, input.postID()));
        if (!visible) {
            throw new ApiException(ApiErrorCode.NOT_FOUND, "No post " + input.postID());
        }
        Unlisten unlisten = registry.listen(CommentInserted.CHANNEL, event -> {
            if (event.postID() == input.postID()) {
                ctx.withAuthorized(tx -> CommentService.findComment(tx, event.commentID()))
                        .ifPresent(ctx::publish);
            }
        });
        return unlisten::unlisten;
    }
}
