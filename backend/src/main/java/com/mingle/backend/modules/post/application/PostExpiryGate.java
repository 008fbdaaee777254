package com.mingle.backend.modules.post.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.mingle.backend.global.error.ProblemException;
import com.mingle.backend.modules.post.domain.Post;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Evaluates post expiry against the application clock at the moment of the call.
 * There is no sweep: every reader and writer asks the gate.
 */
@Component
public class PostExpiryGate {

    private final Clock clock;

    public PostExpiryGate(Clock clock) {
        this.clock = clock;
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public void requireLive(Post post) {
        if (!post.lifecycleAt(now()).acceptsInteractions()) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "POST_EXPIRED",
                    "Post expired; no further interactions allowed");
        }
    }
}
