package com.mingle.backend.modules.engagement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import com.mingle.backend.modules.engagement.infrastructure.persistence.PostReactionRepository;
import com.mingle.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class ReactionIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private PostReactionRepository reactionRepository;

    private String olga;
    private String nick;
    private String mary;
    private String nestor;

    @BeforeEach
    void setUp() throws Exception {
        olga = registerAndToken("Olga", "olga@mingle.com");
        nick = registerAndToken("Nick", "nick@mingle.com");
        mary = registerAndToken("Mary", "mary@mingle.com");
        nestor = registerAndToken("Nestor", "nestor@mingle.com");
    }

    @Test
    void countersReflectEveryUsersSingleReaction() throws Exception {
        String maryPost = createPost(mary, "Mary Tech Post", List.of("Tech"), 5);
        String nickPost = createPost(nick, "Nick Tech Post", List.of("Tech"), 5);

        mockMvc.perform(post("/api/posts/{id}/like", maryPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.likesCount").value(1));
        mockMvc.perform(post("/api/posts/{id}/like", maryPost).header("Authorization", bearer(olga)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.likesCount").value(2));
        mockMvc.perform(post("/api/posts/{id}/like", nickPost).header("Authorization", bearer(nestor)))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/posts/{id}/dislike", maryPost).header("Authorization", bearer(nestor)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.likesCount").value(2))
                .andExpect(jsonPath("$.dislikesCount").value(1))
                .andExpect(jsonPath("$.commentsCount").value(0));

        mockMvc.perform(get("/api/posts/{id}", maryPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.likesCount").value(2))
                .andExpect(jsonPath("$.dislikesCount").value(1));
        mockMvc.perform(get("/api/posts/{id}", nickPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.likesCount").value(1))
                .andExpect(jsonPath("$.dislikesCount").value(0));
    }

    @Test
    void ownerCannotReactToOwnPost() throws Exception {
        String maryPost = createPost(mary, "Mary Tech Post", List.of("Tech"), 5);

        mockMvc.perform(post("/api/posts/{id}/like", maryPost).header("Authorization", bearer(mary)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("SELF_REACTION_FORBIDDEN"));
        mockMvc.perform(post("/api/posts/{id}/dislike", maryPost).header("Authorization", bearer(mary)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("SELF_REACTION_FORBIDDEN"));

        assertThat(reactionRepository.count()).isZero();
    }

    @Test
    void switchingReactionMovesTheCountAndRepeatingIsANoOp() throws Exception {
        String maryPost = createPost(mary, "Mary Tech Post", List.of("Tech"), 5);

        mockMvc.perform(post("/api/posts/{id}/like", maryPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/posts/{id}/like", maryPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Already liked"))
                .andExpect(jsonPath("$.likesCount").value(1));

        mockMvc.perform(post("/api/posts/{id}/dislike", maryPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Switched to dislike"))
                .andExpect(jsonPath("$.likesCount").value(0))
                .andExpect(jsonPath("$.dislikesCount").value(1));

        assertThat(reactionRepository.count()).isEqualTo(1);

        mockMvc.perform(delete("/api/posts/{id}/reaction", maryPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.likesCount").value(0))
                .andExpect(jsonPath("$.dislikesCount").value(0));
        mockMvc.perform(delete("/api/posts/{id}/reaction", maryPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("No reaction to remove"));

        assertThat(reactionRepository.count()).isZero();
    }

    @Test
    void expiredPostRejectsReactionsWithoutChangingCounters() throws Exception {
        String nestorPost = createPost(nestor, "Nestor Health Post", List.of("Health"), 1);
        mockMvc.perform(post("/api/posts/{id}/like", nestorPost).header("Authorization", bearer(mary)))
                .andExpect(status().isOk());

        clock.advance(Duration.ofSeconds(75));

        mockMvc.perform(post("/api/posts/{id}/dislike", nestorPost).header("Authorization", bearer(mary)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("POST_EXPIRED"));
        mockMvc.perform(delete("/api/posts/{id}/reaction", nestorPost).header("Authorization", bearer(mary)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("POST_EXPIRED"));

        mockMvc.perform(get("/api/posts/{id}", nestorPost).header("Authorization", bearer(mary)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("Expired"))
                .andExpect(jsonPath("$.likesCount").value(1))
                .andExpect(jsonPath("$.dislikesCount").value(0));
    }

    @Test
    void expiredCheckWinsOverOwnershipCheck() throws Exception {
        String maryPost = createPost(mary, "Mary Tech Post", List.of("Tech"), 1);
        clock.advance(Duration.ofMinutes(2));

        mockMvc.perform(post("/api/posts/{id}/like", maryPost).header("Authorization", bearer(mary)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("POST_EXPIRED"));
    }

    @Test
    void reactingToUnknownPostIs404() throws Exception {
        mockMvc.perform(post("/api/posts/{id}/like", UUID.randomUUID()).header("Authorization", bearer(nick)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("POST_NOT_FOUND"));
    }
}
