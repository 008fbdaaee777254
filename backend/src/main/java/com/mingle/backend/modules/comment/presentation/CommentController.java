package com.mingle.backend.modules.comment.presentation;

import java.util.List;
import java.util.UUID;

import com.mingle.backend.global.security.SecurityUtils;
import com.mingle.backend.modules.comment.application.CommentService;
import com.mingle.backend.modules.comment.presentation.dto.CommentCreatedResponse;
import com.mingle.backend.modules.comment.presentation.dto.CommentResponse;
import com.mingle.backend.modules.comment.presentation.dto.CreateCommentRequest;

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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/posts/{postId}/comments")
public class CommentController {

    private final CommentService commentService;

    public CommentController(CommentService commentService) {
        this.commentService = commentService;
    }

    @Operation(summary = "Append a comment to a live post")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Comment stored"),
            @ApiResponse(responseCode = "400", description = "Blank or overlong text"),
            @ApiResponse(responseCode = "403", description = "Post expired - detail `POST_EXPIRED`"),
            @ApiResponse(responseCode = "404", description = "Unknown post")
    })
    @PostMapping
    public ResponseEntity<CommentCreatedResponse> addComment(
            @PathVariable("postId") UUID postId,
            @RequestBody CreateCommentRequest request
    ) {
        CommentCreatedResponse created = commentService.addComment(SecurityUtils.getCurrentUserId(), postId, request.text());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ResponseEntity<List<CommentResponse>> listComments(@PathVariable("postId") UUID postId) {
        return ResponseEntity.ok(commentService.listComments(postId));
    }
}
