package com.mingle.backend.modules.comment.application;

import java.util.List;
import java.util.UUID;

import com.mingle.backend.global.error.ProblemException;
import com.mingle.backend.modules.auth.domain.MingleUser;
import com.mingle.backend.modules.auth.infrastructure.persistence.MingleUserRepository;
import com.mingle.backend.modules.comment.domain.PostComment;
import com.mingle.backend.modules.comment.infrastructure.persistence.PostCommentRepository;
import com.mingle.backend.modules.comment.presentation.dto.CommentCreatedResponse;
import com.mingle.backend.modules.comment.presentation.dto.CommentResponse;
import com.mingle.backend.modules.post.application.PostExpiryGate;
import com.mingle.backend.modules.post.application.PostService;
import com.mingle.backend.modules.post.domain.Post;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional
public class CommentService {

    private static final Logger log = LoggerFactory.getLogger(CommentService.class);
    static final int TEXT_MAX_LENGTH = 500;

    private final PostCommentRepository commentRepository;
    private final MingleUserRepository userRepository;
    private final PostService postService;
    private final PostExpiryGate expiryGate;

    public CommentService(
            PostCommentRepository commentRepository,
            MingleUserRepository userRepository,
            PostService postService,
            PostExpiryGate expiryGate
    ) {
        this.commentRepository = commentRepository;
        this.userRepository = userRepository;
        this.postService = postService;
        this.expiryGate = expiryGate;
    }

    public CommentCreatedResponse addComment(UUID actingUserId, UUID postId, String rawText) {
        Post post = postService.getPost(postId);
        expiryGate.requireLive(post);

        String text = rawText == null ? "" : rawText.trim();
        if (text.isEmpty() || text.length() > TEXT_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_COMMENT",
                    "Comment must be 1-" + TEXT_MAX_LENGTH + " characters");
        }

        MingleUser author = userRepository.findById(actingUserId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNKNOWN_USER"));

        PostComment saved = commentRepository.save(new PostComment(post, author, text, expiryGate.now()));
        long commentsCount = commentRepository.countByPostId(postId);
        log.debug("User {} commented on post {} ({} comments)", actingUserId, postId, commentsCount);
        return new CommentCreatedResponse("Comment added", commentsCount, CommentResponse.of(saved));
    }

    @Transactional(readOnly = true)
    public List<CommentResponse> listComments(UUID postId) {
        postService.getPost(postId);
        return commentRepository.findThread(postId).stream()
                .map(CommentResponse::of)
                .toList();
    }
}
