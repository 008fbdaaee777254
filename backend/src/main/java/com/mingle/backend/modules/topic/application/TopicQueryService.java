package com.mingle.backend.modules.topic.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.mingle.backend.global.error.ProblemException;
import com.mingle.backend.modules.post.application.PostExpiryGate;
import com.mingle.backend.modules.post.application.PostService;
import com.mingle.backend.modules.post.application.TopicCatalog;
import com.mingle.backend.modules.post.domain.Post;
import com.mingle.backend.modules.post.infrastructure.persistence.PostRepository;
import com.mingle.backend.modules.post.presentation.dto.PostResponse;
import com.mingle.backend.modules.topic.domain.ActivityRanking;
import com.mingle.backend.modules.topic.domain.PostActivity;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class TopicQueryService {

    private final PostRepository postRepository;
    private final PostService postService;
    private final TopicCatalog topicCatalog;
    private final PostExpiryGate expiryGate;
    private final PostViewAssembler assembler;
    private final ActivityRanking ranking;

    public TopicQueryService(
            PostRepository postRepository,
            PostService postService,
            TopicCatalog topicCatalog,
            PostExpiryGate expiryGate,
            PostViewAssembler assembler,
            RankingProperties rankingProperties
    ) {
        this.postRepository = postRepository;
        this.postService = postService;
        this.topicCatalog = topicCatalog;
        this.expiryGate = expiryGate;
        this.assembler = assembler;
        this.ranking = new ActivityRanking(
                rankingProperties.likeWeight(),
                rankingProperties.dislikeWeight(),
                rankingProperties.commentWeight()
        );
    }

    /**
     * Live and expired posts in creation order. A missing or blank topic lists every post;
     * a topic no post carries gives an empty list.
     */
    public List<PostResponse> browse(String rawTopic) {
        OffsetDateTime now = expiryGate.now();
        if (rawTopic == null || rawTopic.isBlank()) {
            return assembler.toViews(postRepository.findAllInCreationOrder(), now);
        }
        return topicCatalog.find(rawTopic)
                .map(topic -> assembler.toViews(postRepository.findByTopic(topic), now))
                .orElseGet(List::of);
    }

    public List<PostResponse> expiredByTopic(String rawTopic) {
        OffsetDateTime now = expiryGate.now();
        return topicCatalog.find(rawTopic)
                .map(topic -> assembler.toViews(postRepository.findExpiredByTopic(topic, now), now))
                .orElseGet(List::of);
    }

    public PostResponse mostActive(String rawTopic) {
        OffsetDateTime now = expiryGate.now();
        List<Post> live = topicCatalog.find(rawTopic)
                .map(topic -> postRepository.findLiveByTopic(topic, now))
                .orElseGet(List::of);
        Map<UUID, Post> byId = live.stream().collect(Collectors.toMap(Post::getId, Function.identity()));

        PostActivity winner = ranking.mostActive(assembler.activityOf(live))
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "NO_ACTIVE_POST",
                        "No active post in topic " + rawTopic));
        return assembler.toView(byId.get(winner.postId()), now);
    }

    public PostResponse postView(UUID postId) {
        return assembler.toView(postService.getPost(postId), expiryGate.now());
    }

    public List<String> topics() {
        return topicCatalog.knownTopics();
    }
}
