package livefeed.demo;

import livefeed.AccountId;
import livefeed.ApiException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/posts")
public class CommentController {

    private final CommentService comments;

    public CommentController(CommentService comments) {
        this.comments = comments;
    }

    @PostMapping
    public Map<String, Object> createPost(@RequestHeader("X-Account-Id") long accountId,
            @RequestBody String title) {
        long postId = comments.createPost(AccountId.of(accountId), title);
        return Map.of("status", "ok", "postID", postId);
    }

    @PostMapping("/{postId}/comments")
    public Map<String, Object> publishComment(@RequestHeader("X-Account-Id") long accountId,
            @PathVariable long postId, @RequestBody String body) {
        long commentId = comments.publishComment(AccountId.of(accountId), postId, body);
        return Map.of("status", "ok", "commentID", commentId);
    }

    @GetMapping("/{postId}/comments")
    public List<Comment> listComments(@RequestHeader("X-Account-Id") long accountId, @PathVariable long postId) {
        return comments.listComments(AccountId.of(accountId), postId);
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, String>> apiError(ApiException e) {
        HttpStatus status = switch (e.code()) {
            case BAD_INPUT -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS -> HttpStatus.CONFLICT;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case UNKNOWN -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(Map.of("code", e.code().name()));
    }
}
