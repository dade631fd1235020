package com.tradegate.access;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AccessApiTest {
    @Autowired
    private MockMvc mvc;

    @Test
    void unknownUserIsNotFound() throws Exception {
        mvc.perform(get("/api/permissions/{userId}", "nobody-" + Fixtures.id("u")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("not_found"))
                .andExpect(jsonPath("$.ts").exists());
    }

    @Test
    void contentIsFoundBySlugAndFilteredByAge() throws Exception {
        String id = Fixtures.id("budgeting");
        mvc.perform(post("/api/catalog/content").contentType(MediaType.APPLICATION_JSON).content("""
                        {"id":"%s","slug":"%s","title":"Budgeting","type":"ARTICLE","level":"BEGINNER","completionRequirement":"NONE","minAge":16}
                        """.formatted(id, id)))
                .andExpect(status().isOk());

        mvc.perform(get("/api/catalog/content/by-slug/{slug}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id));
        mvc.perform(get("/api/catalog/content").param("age", "12"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.id == '%s')]".formatted(id)).isEmpty());
        mvc.perform(get("/api/catalog/content").param("type", "ARTICLE").param("age", "16"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[?(@.id == '%s')]".formatted(id)).isNotEmpty());
    }

    @Test
    void cyclicPrerequisiteIsABadRequest() throws Exception {
        String a = Fixtures.id("a");
        String b = Fixtures.id("b");
        for (String id : new String[]{a, b}) {
            mvc.perform(post("/api/catalog/content").contentType(MediaType.APPLICATION_JSON).content("""
                            {"id":"%s","slug":"%s","title":"Intro","type":"MODULE","level":"BEGINNER","completionRequirement":"NONE"}
                            """.formatted(id, id)))
                    .andExpect(status().isOk());
        }
        edge(a, b).andExpect(status().isOk());
        edge(b, a).andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.issues[0].code").value("CYCLE_DETECTED"));
    }

    @Test
    void lockedContentIsAConflict() throws Exception {
        String user = Fixtures.id("u");
        String a = Fixtures.id("a");
        String b = Fixtures.id("b");
        mvc.perform(post("/api/users").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"%s\",\"birthdate\":\"1990-01-01\"}".formatted(user)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("FREE"));
        for (String id : new String[]{a, b}) {
            mvc.perform(post("/api/catalog/content").contentType(MediaType.APPLICATION_JSON).content("""
                            {"id":"%s","slug":"%s","title":"Lesson","type":"ARTICLE","level":"BEGINNER","completionRequirement":"NONE"}
                            """.formatted(id, id)))
                    .andExpect(status().isOk());
        }
        edge(a, b).andExpect(status().isOk());

        mvc.perform(post("/api/progress").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"%s\",\"contentId\":\"%s\",\"completed\":true}".formatted(user, b)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.missingPrerequisites[0]").value(a));
    }

    @Test
    void gateAnswersWithADecisionBody() throws Exception {
        mvc.perform(post("/api/access/check").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"destination\":\"/portfolio\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.type").value("Deny"))
                .andExpect(jsonPath("$.reason").value("AUTH_EXPIRED"))
                .andExpect(jsonPath("$.returnTo").value("/portfolio"));
    }

    private org.springframework.test.web.servlet.ResultActions edge(String prerequisite, String content) throws Exception {
        return mvc.perform(post("/api/catalog/prerequisites").contentType(MediaType.APPLICATION_JSON)
                .content("{\"prerequisiteId\":\"%s\",\"contentId\":\"%s\"}".formatted(prerequisite, content)));
    }
}
