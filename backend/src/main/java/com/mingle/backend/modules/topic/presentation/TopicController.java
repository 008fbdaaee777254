package com.mingle.backend.modules.topic.presentation;

import java.util.List;

import com.mingle.backend.modules.post.presentation.dto.PostResponse;
import com.mingle.backend.modules.topic.application.TopicQueryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/topics")
public class TopicController {

    private final TopicQueryService topicQueryService;

    public TopicController(TopicQueryService topicQueryService) {
        this.topicQueryService = topicQueryService;
    }

    @Operation(summary = "List the closed topic catalog, empty when topics are free-form")
    @GetMapping
    public ResponseEntity<List<String>> topics() {
        return ResponseEntity.ok(topicQueryService.topics());
    }

    @Operation(summary = "Live post with the highest engagement in a topic")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Most active live post"),
            @ApiResponse(responseCode = "404", description = "No live post in the topic - `NO_ACTIVE_POST`")
    })
    @GetMapping("/{topic}/most-active")
    public ResponseEntity<PostResponse> mostActive(@PathVariable("topic") String topic) {
        return ResponseEntity.ok(topicQueryService.mostActive(topic));
    }

    @Operation(summary = "Expired posts in a topic, most recently expired first")
    @GetMapping("/{topic}/expired")
    public ResponseEntity<List<PostResponse>> expired(@PathVariable("topic") String topic) {
        return ResponseEntity.ok(topicQueryService.expiredByTopic(topic));
    }
}
