package com.mingle.backend.modules.topic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.mingle.backend.support.AbstractIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

class TopicIntegrationTest extends AbstractIntegrationTest {

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
    void mostActiveCountsLikesDislikesAndComments() throws Exception {
        createPost(olga, "Olga Tech Post", List.of("Tech"), 5);
        clock.advance(Duration.ofSeconds(1));
        String nickPost = createPost(nick, "Nick Tech Post", List.of("Tech"), 5);
        clock.advance(Duration.ofSeconds(1));
        String maryPost = createPost(mary, "Mary Tech Post", List.of("Tech"), 5);

        react("like", nick, maryPost);
        react("like", olga, maryPost);
        react("like", nestor, nickPost);
        react("dislike", nestor, maryPost);
        comment(nick, maryPost, "Nick comment #1");

        mockMvc.perform(get("/api/topics/{topic}/most-active", "Tech").header("Authorization", bearer(nestor)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$._id").value(maryPost))
                .andExpect(jsonPath("$.likesCount").value(2))
                .andExpect(jsonPath("$.dislikesCount").value(1))
                .andExpect(jsonPath("$.commentsCount").value(1));
    }

    @Test
    void tieGoesToEarliestCreatedPost() throws Exception {
        String first = createPost(olga, "Earlier tie post", List.of("Sport"), 5);
        clock.advance(Duration.ofSeconds(1));
        String second = createPost(nick, "Later tie post", List.of("Sport"), 5);

        react("like", mary, second);
        react("dislike", mary, first);

        mockMvc.perform(get("/api/topics/{topic}/most-active", "Sport").header("Authorization", bearer(mary)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$._id").value(first));
    }

    @Test
    void expiredPostsNeverWinMostActive() throws Exception {
        String busy = createPost(olga, "Busy but short lived", List.of("Politics"), 1);
        react("like", nick, busy);
        react("like", mary, busy);
        clock.advance(Duration.ofSeconds(30));
        String quiet = createPost(nick, "Quiet but long lived", List.of("Politics"), 30);

        clock.advance(Duration.ofMinutes(1));

        mockMvc.perform(get("/api/topics/{topic}/most-active", "Politics").header("Authorization", bearer(mary)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$._id").value(quiet));
    }

    @Test
    void mostActiveIs404WhenNoLivePostExists() throws Exception {
        mockMvc.perform(get("/api/topics/{topic}/most-active", "Health").header("Authorization", bearer(mary)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NO_ACTIVE_POST"));

        createPost(olga, "Expiring health post", List.of("Health"), 1);
        clock.advance(Duration.ofMinutes(5));

        mockMvc.perform(get("/api/topics/{topic}/most-active", "Health").header("Authorization", bearer(mary)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NO_ACTIVE_POST"));
    }

    @Test
    void expiredListIsMostRecentlyExpiredFirstAndSubsetOfBrowse() throws Exception {
        String shortLived = createPost(olga, "Expires first", List.of("Health"), 1);
        String longer = createPost(nick, "Expires second", List.of("Health"), 2);
        String live = createPost(mary, "Still going", List.of("Health"), 60);

        clock.advance(Duration.ofMinutes(3));

        JsonNode expired = readJson(mockMvc.perform(get("/api/topics/{topic}/expired", "Health")
                        .header("Authorization", bearer(nestor)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0]._id").value(longer))
                .andExpect(jsonPath("$[1]._id").value(shortLived))
                .andExpect(jsonPath("$[0].status").value("Expired"))
                .andReturn());

        JsonNode browse = readJson(mockMvc.perform(get("/api/posts").param("topic", "Health")
                        .header("Authorization", bearer(nestor)))
                .andExpect(status().isOk())
                .andReturn());

        Set<String> browsed = new HashSet<>();
        browse.forEach(node -> browsed.add(node.path("_id").asText()));
        Set<String> expiredIds = new HashSet<>();
        expired.forEach(node -> expiredIds.add(node.path("_id").asText()));
        assertThat(browsed).containsAll(expiredIds).contains(live);
    }

    @Test
    void emptyTopicHasNoExpiredPosts() throws Exception {
        mockMvc.perform(get("/api/topics/{topic}/expired", "Sport").header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void freeFormTopicFlowsThroughEveryTopicQuery() throws Exception {
        mockMvc.perform(get("/api/topics/{topic}/expired", "Science").header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        mockMvc.perform(get("/api/topics/{topic}/most-active", "Science").header("Authorization", bearer(nick)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NO_ACTIVE_POST"));

        String science = createPost(olga, "Black holes explained", List.of("Science"), 1);
        react("like", nick, science);

        mockMvc.perform(get("/api/topics/{topic}/most-active", "Science").header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$._id").value(science))
                .andExpect(jsonPath("$.likesCount").value(1));

        clock.advance(Duration.ofMinutes(1));

        mockMvc.perform(get("/api/topics/{topic}/expired", "Science").header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0]._id").value(science));
    }

    @Test
    void openCatalogListsNoFixedTopics() throws Exception {
        mockMvc.perform(get("/api/topics").header("Authorization", bearer(nick)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    private void react(String kind, String token, String postId) throws Exception {
        mockMvc.perform(post("/api/posts/{id}/" + kind, postId).header("Authorization", bearer(token)))
                .andExpect(status().isOk());
    }

    private void comment(String token, String postId, String text) throws Exception {
        mockMvc.perform(post("/api/posts/{id}/comments", postId)
                        .header("Authorization", bearer(token))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CommentPayload(text))))
                .andExpect(status().isCreated());
    }

    private record CommentPayload(String text) {
    }
}
