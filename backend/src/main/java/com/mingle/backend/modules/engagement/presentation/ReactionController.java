package com.mingle.backend.modules.engagement.presentation;

import java.util.UUID;

import com.mingle.backend.global.security.SecurityUtils;
import com.mingle.backend.modules.engagement.application.EngagementService;
import com.mingle.backend.modules.engagement.presentation.dto.EngagementCountersResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/posts/{postId}")
public class ReactionController {

    private final EngagementService engagementService;

    public ReactionController(EngagementService engagementService) {
        this.engagementService = engagementService;
    }

    @Operation(summary = "Like a live post owned by someone else")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current counters"),
            @ApiResponse(responseCode = "403", description = "`POST_EXPIRED` or `SELF_REACTION_FORBIDDEN`"),
            @ApiResponse(responseCode = "404", description = "Unknown post")
    })
    @PostMapping("/like")
    public ResponseEntity<EngagementCountersResponse> like(@PathVariable("postId") UUID postId) {
        return ResponseEntity.ok(engagementService.like(SecurityUtils.getCurrentUserId(), postId));
    }

    @Operation(summary = "Dislike a live post owned by someone else")
    @PostMapping("/dislike")
    public ResponseEntity<EngagementCountersResponse> dislike(@PathVariable("postId") UUID postId) {
        return ResponseEntity.ok(engagementService.dislike(SecurityUtils.getCurrentUserId(), postId));
    }

    @Operation(summary = "Withdraw the caller's reaction, if any")
    @DeleteMapping("/reaction")
    public ResponseEntity<EngagementCountersResponse> withdraw(@PathVariable("postId") UUID postId) {
        return ResponseEntity.ok(engagementService.withdraw(SecurityUtils.getCurrentUserId(), postId));
    }
}
