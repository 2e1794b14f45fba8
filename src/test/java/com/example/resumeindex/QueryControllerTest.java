package com.example.resumeindex;

import com.example.resumeindex.testutils.TempDirs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {"spring.jpa.hibernate.ddl-auto=create-drop", "spring.datasource.url=jdbc:h2:mem:testdb;DB_CLOSE_DELAY=-1"})
@AutoConfigureMockMvc
public class QueryControllerTest {

    private static final Path INDEX_DIR = TempDirs.create("query-api-test");

    @DynamicPropertySource
    static void indexDir(DynamicPropertyRegistry registry) {
        registry.add("index.dir", INDEX_DIR::toString);
    }

    private static final String ALICE = "{\"personal_information\":{\"full_name\":\"Alice\"},\"skills\":[\"Rust\"]}";
    private static final String BOB = "{\"personal_information\":{\"full_name\":\"Bob\"},\"skills\":[\"Perl\"]}";

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ProfileStore store;

    @Autowired
    private ResumeProfileReader reader;

    @Autowired
    private ResumeProfileRepository repo;

    @Autowired
    private BackfillCoordinator coordinator;

    private String artifact;

    @BeforeEach
    public void setUp() {
        repo.deleteAll();
        store.upsert("alice", reader.read(ALICE), "t");
        store.upsert("bob", reader.read(BOB), "t");
        artifact = coordinator.backfill(BackfillMode.FULL, "test-model", 2).getArtifactPath();
    }

    @Test
    public void profileQueryFindsItselfAgainstLatestArtifact() throws Exception {
        mvc.perform(post("/api/query/profile").contentType("application/json")
                        .content("{\"profile\":" + ALICE + ",\"topK\":1}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.artifactPath").value(artifact))
                .andExpect(jsonPath("$.requestedTopK").value(1))
                .andExpect(jsonPath("$.neighbors", hasSize(1)))
                .andExpect(jsonPath("$.neighbors[0].rank").value(1))
                .andExpect(jsonPath("$.neighbors[0].externalId").value("alice"))
                .andExpect(jsonPath("$.neighbors[0].distance", closeTo(0.0, 1e-6)));
    }

    @Test
    public void vectorQueryWithoutJoinReturnsPositionsOnly() throws Exception {
        String body = "{\"vector\":[0,0,0,0,0,0,0,0],\"artifactPath\":\"" + jsonEscape(artifact) + "\",\"topK\":5,\"resolveRecords\":false}";

        mvc.perform(post("/api/query").contentType("application/json").content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.neighbors", hasSize(2)))
                .andExpect(jsonPath("$.neighbors[0].resolved").value(false))
                .andExpect(jsonPath("$.neighbors[0].externalId").doesNotExist());
    }

    @Test
    public void wrongDimensionIs422WithBothSizes() throws Exception {
        mvc.perform(post("/api/query").contentType("application/json").content("{\"vector\":[1,2,3],\"topK\":1}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("DIMENSION_MISMATCH"))
                .andExpect(jsonPath("$.expected").value(8))
                .andExpect(jsonPath("$.actual").value(3));
    }

    @Test
    public void nonPositiveTopKIs400() throws Exception {
        mvc.perform(post("/api/query").contentType("application/json").content("{\"vector\":[1],\"topK\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("CONFIGURATION"));
    }

    @Test
    public void unknownArtifactIs404() throws Exception {
        String missing = INDEX_DIR.resolve("resume_profiles_19990101T000000Z.idx").toString();
        mvc.perform(post("/api/query").contentType("application/json")
                        .content("{\"vector\":[1],\"topK\":1,\"artifactPath\":\"" + jsonEscape(missing) + "\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    private static String jsonEscape(String s) {
        return s.replace("\\", "\\\\");
    }
}
