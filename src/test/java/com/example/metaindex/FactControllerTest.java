package com.example.metaindex;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {"spring.jpa.hibernate.ddl-auto=create-drop", "spring.datasource.url=jdbc:h2:mem:factapi;DB_CLOSE_DELAY=-1"})
@AutoConfigureMockMvc
public class FactControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ToolRegistry registry;

    @Test
    public void registerToolsThenReadThemBack() throws Exception {
        String body = "[{\"name\":\"file\",\"version\":\"5.22\",\"configuration\":{\"type\":\"library\"}},"
                + "{\"name\":\"file\",\"version\":\"5.22\",\"configuration\":{\"type\":\"library\"}}]";
        mockMvc.perform(post("/api/tools").contentType("application/json").content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].name").value("file"))
                .andExpect(jsonPath("$[0].configuration.type").value("library"));

        long id = registry.register("file", "5.22", Map.of("type", "library"));
        mockMvc.perform(get("/api/tools/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id));
        mockMvc.perform(get("/api/tools/999999"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void addGetAndMissingMimetypes() throws Exception {
        long tool = registry.register("file", "api-test", Map.of());
        String entries = "[{\"id\":\"aa01\",\"toolId\":" + tool + ",\"payload\":{\"mimetype\":\"text/plain\",\"encoding\":\"us-ascii\"}},"
                + "{\"id\":\"aa02\",\"toolId\":424242,\"payload\":{\"mimetype\":\"text/plain\",\"encoding\":\"us-ascii\"}}]";

        mockMvc.perform(post("/api/facts/mimetype").param("policy", "ignore-dups").contentType("application/json").content(entries))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.affected").value(1))
                .andExpect(jsonPath("$.rejected", hasSize(1)))
                .andExpect(jsonPath("$.rejected[0].objectId").value("aa02"));

        mockMvc.perform(post("/api/facts/mimetype/get").contentType("application/json")
                        .content("{\"ids\":[\"aa01\",\"aa02\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].payload.mimetype").value("text/plain"))
                .andExpect(jsonPath("$[0].tool.name").value("file"));

        mockMvc.perform(post("/api/facts/mimetype/missing").contentType("application/json")
                        .content("{\"ids\":[\"aa01\",\"aa03\"],\"toolId\":" + tool + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0]").value("aa03"));
    }

    @Test
    public void contentMetadataAndLicensesAreAccepted() throws Exception {
        long tool = registry.register("metadata-translator", "api-test", Map.of("context", "npm"));
        mockMvc.perform(post("/api/facts/content-metadata").contentType("application/json")
                        .content("[{\"id\":\"bb01\",\"toolId\":" + tool + ",\"payload\":{\"name\":\"foo\"}}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.affected").value(1));

        long nomos = registry.register("nomos", "api-test", Map.of());
        mockMvc.perform(post("/api/facts/license").param("policy", "update-dups").contentType("application/json")
                        .content("[{\"id\":\"bb02\",\"toolId\":" + nomos + ",\"payload\":[\"MIT\"]}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.affected").value(1));
    }

    @Test
    public void badRequests() throws Exception {
        mockMvc.perform(post("/api/facts/nonsense/get").contentType("application/json").content("{\"ids\":[\"x\"]}"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/facts/mimetype").param("policy", "sometimes").contentType("application/json").content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("IllegalArgumentException"));
        mockMvc.perform(post("/api/facts/content-metadata").contentType("application/json")
                        .content("[{\"id\":\"x\",\"toolId\":1,\"payload\":[1,2]}]"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/facts/mimetype/missing").contentType("application/json").content("{\"ids\":[\"x\"]}"))
                .andExpect(status().isBadRequest());
    }
}
