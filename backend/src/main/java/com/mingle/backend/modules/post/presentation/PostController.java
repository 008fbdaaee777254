package com.mingle.backend.modules.post.presentation;

import java.util.List;
import java.util.UUID;

import com.mingle.backend.global.security.SecurityUtils;
import com.mingle.backend.modules.post.application.PostExpiryGate;
import com.mingle.backend.modules.post.application.PostService;
import com.mingle.backend.modules.post.domain.Post;
import com.mingle.backend.modules.post.presentation.dto.CreatePostRequest;
import com.mingle.backend.modules.post.presentation.dto.PostDtoMapper;
import com.mingle.backend.modules.post.presentation.dto.PostResponse;
import com.mingle.backend.modules.topic.application.TopicQueryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/posts")
public class PostController {

    private final PostService postService;
    private final PostExpiryGate expiryGate;
    private final TopicQueryService topicQueryService;

    public PostController(PostService postService, PostExpiryGate expiryGate, TopicQueryService topicQueryService) {
        this.postService = postService;
        this.expiryGate = expiryGate;
        this.topicQueryService = topicQueryService;
    }

    @Operation(summary = "Publish a post under one or more topics")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Post created"),
            @ApiResponse(responseCode = "400", description = "Invalid title, body, topics or expiry")
    })
    @PostMapping
    public ResponseEntity<PostResponse> createPost(@RequestBody CreatePostRequest request) {
        Post post = postService.createPost(SecurityUtils.getCurrentUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(PostDtoMapper.toFreshResponse(post, expiryGate.now()));
    }

    @Operation(summary = "Browse posts, optionally filtered by topic")
    @GetMapping
    public ResponseEntity<List<PostResponse>> browse(@RequestParam(name = "topic", required = false) String topic) {
        return ResponseEntity.ok(topicQueryService.browse(topic));
    }

    @GetMapping("/{postId}")
    public ResponseEntity<PostResponse> getPost(@PathVariable("postId") UUID postId) {
        return ResponseEntity.ok(topicQueryService.postView(postId));
    }
}
