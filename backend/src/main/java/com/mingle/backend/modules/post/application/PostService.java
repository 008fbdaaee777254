package com.mingle.backend.modules.post.application;

import java.util.List;
import java.util.UUID;

import com.mingle.backend.global.error.ProblemException;
import com.mingle.backend.modules.auth.domain.MingleUser;
import com.mingle.backend.modules.auth.infrastructure.persistence.MingleUserRepository;
import com.mingle.backend.modules.post.domain.Post;
import com.mingle.backend.modules.post.infrastructure.persistence.PostRepository;
import com.mingle.backend.modules.post.presentation.dto.CreatePostRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional
public class PostService {

    private static final Logger log = LoggerFactory.getLogger(PostService.class);

    private static final int TITLE_MIN_LENGTH = 6;
    private static final int TITLE_MAX_LENGTH = 120;
    private static final int BODY_MAX_LENGTH = 2000;

    private final PostRepository postRepository;
    private final MingleUserRepository userRepository;
    private final TopicCatalog topicCatalog;
    private final PostPolicyProperties policy;
    private final PostExpiryGate expiryGate;

    public PostService(
            PostRepository postRepository,
            MingleUserRepository userRepository,
            TopicCatalog topicCatalog,
            PostPolicyProperties policy,
            PostExpiryGate expiryGate
    ) {
        this.postRepository = postRepository;
        this.userRepository = userRepository;
        this.topicCatalog = topicCatalog;
        this.policy = policy;
        this.expiryGate = expiryGate;
    }

    public Post createPost(UUID ownerId, CreatePostRequest request) {
        String title = request.title() == null ? "" : request.title().trim();
        String body = request.body() == null ? "" : request.body().trim();

        if (title.length() < TITLE_MIN_LENGTH || title.length() > TITLE_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_TITLE",
                    "Title must be " + TITLE_MIN_LENGTH + "-" + TITLE_MAX_LENGTH + " characters");
        }
        if (body.isEmpty() || body.length() > BODY_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_BODY",
                    "Body must be 1-" + BODY_MAX_LENGTH + " characters");
        }
        List<String> topics = topicCatalog.resolveAll(request.topics());
        int expiresInMinutes = resolveExpiryMinutes(request.expiresInMinutes());

        MingleUser owner = userRepository.findById(ownerId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNKNOWN_USER"));

        Post post = Post.publish(owner, title, body, topics, expiresInMinutes, expiryGate.now());
        Post saved = postRepository.save(post);
        log.info("User {} published post {} in {} expiring at {}", ownerId, saved.getId(), topics, saved.getExpiresAt());
        return saved;
    }

    @Transactional(readOnly = true)
    public Post getPost(UUID postId) {
        return postRepository.findWithOwnerById(postId)
                .orElseThrow(PostService::postNotFound);
    }

    /**
     * Loads the post holding its row lock until the surrounding transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Post getPostForUpdate(UUID postId) {
        return postRepository.findByIdForUpdate(postId)
                .orElseThrow(PostService::postNotFound);
    }

    private int resolveExpiryMinutes(Integer requested) {
        if (requested == null) {
            return policy.defaultExpiryMinutes();
        }
        if (requested <= 0 || requested > policy.maxExpiryMinutes()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_EXPIRY",
                    "expiresInMinutes must be 1 to " + policy.maxExpiryMinutes());
        }
        return requested;
    }

    static ResponseStatusException postNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, "POST_NOT_FOUND", "Post not found");
    }
}
