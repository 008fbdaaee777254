package com.mingle.backend.modules.comment;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import com.mingle.backend.support.AbstractIntegrationTest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.ResultActions;

class CommentIntegrationTest extends AbstractIntegrationTest {

    private String nick;
    private String olga;
    private String mary;

    @BeforeEach
    void setUp() throws Exception {
        nick = registerAndToken("Nick", "nick@mingle.com");
        olga = registerAndToken("Olga", "olga@mingle.com");
        mary = registerAndToken("Mary", "mary@mingle.com");
    }

    @Test
    void commentsAreListedOldestFirstOnThePost() throws Exception {
        String maryPost = createPost(mary, "Mary Tech Post", List.of("Tech"), 5);

        comment(nick, maryPost, "Nick comment #1")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.commentsCount").value(1))
                .andExpect(jsonPath("$.comment.text").value("Nick comment #1"))
                .andExpect(jsonPath("$.comment.user.name").value("Nick"));
        clock.advance(Duration.ofSeconds(1));
        comment(olga, maryPost, "Olga comment #1").andExpect(status().isCreated());
        clock.advance(Duration.ofSeconds(1));
        comment(nick, maryPost, "Nick comment #2").andExpect(status().isCreated());
        clock.advance(Duration.ofSeconds(1));
        comment(olga, maryPost, "Olga comment #2")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.commentsCount").value(4));

        mockMvc.perform(get("/api/posts/{id}/comments", maryPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(4)))
                .andExpect(jsonPath("$[0].text").value("Nick comment #1"))
                .andExpect(jsonPath("$[1].text").value("Olga comment #1"))
                .andExpect(jsonPath("$[3].text").value("Olga comment #2"));

        mockMvc.perform(get("/api/posts").param("topic", "Tech").header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].commentsCount").value(4))
                .andExpect(jsonPath("$[0].comments", hasSize(4)))
                .andExpect(jsonPath("$[0].comments[1].user.name").value("Olga"));
    }

    @Test
    void commentsMadeAtTheSameInstantKeepInsertionOrder() throws Exception {
        String maryPost = createPost(mary, "Mary Tech Post", List.of("Tech"), 5);
        List<String> texts = List.of("first", "second", "third", "fourth", "fifth", "sixth");
        for (String text : texts) {
            comment(nick, maryPost, text).andExpect(status().isCreated());
        }

        mockMvc.perform(get("/api/posts/{id}/comments", maryPost).header("Authorization", bearer(olga)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[*].text").value(contains(texts.toArray())));
        mockMvc.perform(get("/api/posts/{id}", maryPost).header("Authorization", bearer(olga)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.comments[*].text").value(contains(texts.toArray())));
    }

    @Test
    void ownerMayCommentOnOwnPost() throws Exception {
        String maryPost = createPost(mary, "Mary Tech Post", List.of("Tech"), 5);

        comment(mary, maryPost, "Thanks for reading").andExpect(status().isCreated());
    }

    @Test
    void commentsOnExpiredPostAreRejectedButKept() throws Exception {
        String healthPost = createPost(nick, "Nick Health Post", List.of("Health"), 1);
        comment(mary, healthPost, "Mary: commenting on Health post").andExpect(status().isCreated());

        clock.advance(Duration.ofSeconds(75));

        comment(olga, healthPost, "Too late")
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("POST_EXPIRED"));

        mockMvc.perform(get("/api/posts").param("topic", "Health").header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].comments", hasSize(1)))
                .andExpect(jsonPath("$[0].status").value("Expired"));
    }

    @Test
    void blankOrOverlongTextIsRejected() throws Exception {
        String maryPost = createPost(mary, "Mary Tech Post", List.of("Tech"), 5);

        comment(nick, maryPost, "   ")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_COMMENT"));
        comment(nick, maryPost, "x".repeat(501))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_COMMENT"));

        mockMvc.perform(get("/api/posts/{id}/comments", maryPost).header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void unknownPostIs404() throws Exception {
        UUID missing = UUID.randomUUID();
        comment(nick, missing.toString(), "Hello?")
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/posts/{id}/comments", missing).header("Authorization", bearer(nick)))
                .andExpect(status().isNotFound());
    }

    private ResultActions comment(String token, String postId, String text) throws Exception {
        return mockMvc.perform(post("/api/posts/{id}/comments", postId)
                .header("Authorization", bearer(token))
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new CommentPayload(text))));
    }

    private record CommentPayload(String text) {
    }
}
