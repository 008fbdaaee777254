package com.mingle.backend.modules.engagement.application;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.mingle.backend.global.error.ProblemException;
import com.mingle.backend.modules.auth.domain.MingleUser;
import com.mingle.backend.modules.auth.infrastructure.persistence.MingleUserRepository;
import com.mingle.backend.modules.comment.infrastructure.persistence.PostCommentRepository;
import com.mingle.backend.modules.engagement.domain.PostReaction;
import com.mingle.backend.modules.engagement.domain.ReactionTally;
import com.mingle.backend.modules.engagement.domain.ReactionType;
import com.mingle.backend.modules.engagement.infrastructure.persistence.PostReactionRepository;
import com.mingle.backend.modules.engagement.presentation.dto.EngagementCountersResponse;
import com.mingle.backend.modules.post.application.PostExpiryGate;
import com.mingle.backend.modules.post.application.PostService;
import com.mingle.backend.modules.post.domain.Post;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Like/dislike ledger. Every mutation holds the post row lock, so the
 * read-modify-write of a user's single reaction is serialised per post.
 */
@Service
@Transactional
public class EngagementService {

    private static final Logger log = LoggerFactory.getLogger(EngagementService.class);

    private final PostReactionRepository reactionRepository;
    private final PostCommentRepository commentRepository;
    private final MingleUserRepository userRepository;
    private final PostService postService;
    private final PostExpiryGate expiryGate;

    public EngagementService(
            PostReactionRepository reactionRepository,
            PostCommentRepository commentRepository,
            MingleUserRepository userRepository,
            PostService postService,
            PostExpiryGate expiryGate
    ) {
        this.reactionRepository = reactionRepository;
        this.commentRepository = commentRepository;
        this.userRepository = userRepository;
        this.postService = postService;
        this.expiryGate = expiryGate;
    }

    public EngagementCountersResponse like(UUID actingUserId, UUID postId) {
        return react(actingUserId, postId, ReactionType.LIKE);
    }

    public EngagementCountersResponse dislike(UUID actingUserId, UUID postId) {
        return react(actingUserId, postId, ReactionType.DISLIKE);
    }

    public EngagementCountersResponse withdraw(UUID actingUserId, UUID postId) {
        Post post = lockInteractablePost(actingUserId, postId);
        Optional<PostReaction> existing = reactionRepository.findByPostIdAndUserId(post.getId(), actingUserId);
        String message;
        if (existing.isPresent()) {
            reactionRepository.delete(existing.get());
            reactionRepository.flush();
            log.debug("User {} withdrew {} on post {}", actingUserId, existing.get().getType(), postId);
            message = "Reaction removed";
        } else {
            message = "No reaction to remove";
        }
        return counters(post.getId(), message);
    }

    @Transactional(readOnly = true)
    public Map<UUID, ReactionTally> tallyFor(Collection<UUID> postIds) {
        Map<UUID, ReactionTally> tallies = new HashMap<>();
        if (postIds.isEmpty()) {
            return tallies;
        }
        for (PostReactionRepository.ReactionCountProjection row : reactionRepository.countByPostIds(postIds)) {
            tallies.merge(row.getPostId(), ReactionTally.EMPTY.plus(row.getType(), row.getTotal()),
                    (left, right) -> new ReactionTally(left.likes() + right.likes(), left.dislikes() + right.dislikes()));
        }
        return tallies;
    }

    private EngagementCountersResponse react(UUID actingUserId, UUID postId, ReactionType type) {
        Post post = lockInteractablePost(actingUserId, postId);
        Optional<PostReaction> existing = reactionRepository.findByPostIdAndUserId(post.getId(), actingUserId);

        String message;
        if (existing.isPresent()) {
            boolean changed = existing.get().switchTo(type, expiryGate.now());
            message = changed ? switchedMessage(type) : alreadyMessage(type);
        } else {
            MingleUser user = userRepository.findById(actingUserId)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNKNOWN_USER"));
            reactionRepository.save(new PostReaction(post, user, type, expiryGate.now()));
            message = type == ReactionType.LIKE ? "Post liked" : "Post disliked";
        }
        reactionRepository.flush();
        log.debug("User {} -> {} on post {}: {}", actingUserId, type, postId, message);
        return counters(post.getId(), message);
    }

    private Post lockInteractablePost(UUID actingUserId, UUID postId) {
        Post post = postService.getPostForUpdate(postId);
        expiryGate.requireLive(post);
        if (post.isOwnedBy(actingUserId)) {
            log.debug("Rejected self reaction by {} on post {}", actingUserId, postId);
            throw new ProblemException(HttpStatus.FORBIDDEN, "SELF_REACTION_FORBIDDEN",
                    "Owners cannot react to their own post");
        }
        return post;
    }

    private EngagementCountersResponse counters(UUID postId, String message) {
        long likes = reactionRepository.countByPostIdAndType(postId, ReactionType.LIKE);
        long dislikes = reactionRepository.countByPostIdAndType(postId, ReactionType.DISLIKE);
        long comments = commentRepository.countByPostId(postId);
        return new EngagementCountersResponse(message, likes, dislikes, comments);
    }

    private static String switchedMessage(ReactionType type) {
        return type == ReactionType.LIKE ? "Switched to like" : "Switched to dislike";
    }

    private static String alreadyMessage(ReactionType type) {
        return type == ReactionType.LIKE ? "Already liked" : "Already disliked";
    }
}
