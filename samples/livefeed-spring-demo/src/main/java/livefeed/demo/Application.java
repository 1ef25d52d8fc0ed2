package livefeed.demo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Livefeed demo: posts and comments with a live comment feed.
 *
 * <p>Run with: mvn install -DskipTests && mvn -f samples/livefeed-spring-demo/pom.xml spring-boot:run
 *
 * <p>HTTP endpoints (port 8080), acting as the account in the {@code X-Account-Id} header:
 * POST /posts                        - create a post
 * POST /posts/{postId}/comments      - comment on a post (body is the comment text)
 * GET  /posts/{postId}/comments      - list comments
 *
 * <p>WebSocket: {@code ws://localhost:4000/?access_token=demo-2}, then send
 * {@code {"type":"subscribe","id":"a","path":"/comment/watchPostComments","input":{"postID":1}}}.
 */
@SpringBootApplication
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
