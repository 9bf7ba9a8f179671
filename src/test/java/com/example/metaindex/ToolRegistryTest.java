package com.example.metaindex;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {"spring.jpa.hibernate.ddl-auto=create-drop", "spring.datasource.url=jdbc:h2:mem:tools;DB_CLOSE_DELAY=-1"})
public class ToolRegistryTest {

    @Autowired
    ToolRegistry registry;

    @Autowired
    ToolRepository repository;

    @Test
    public void registeringTheSameTripleTwiceReturnsTheSameId() {
        Map<String, Object> cfg = new LinkedHashMap<>();
        cfg.put("type", "library");
        cfg.put("debian-package", "python3-magic");
        long first = registry.register("file", "5.22", cfg);

        // same configuration, keys in another order
        Map<String, Object> reordered = new LinkedHashMap<>();
        reordered.put("debian-package", "python3-magic");
        reordered.put("type", "library");
        long second = registry.register("file", "5.22", reordered);

        assertThat(second).isEqualTo(first);
    }

    @Test
    public void differentConfigurationGetsADifferentId() {
        long a = registry.register("nomos", "3.1.0", Map.of("command_line", "nomossa <filepath>"));
        long b = registry.register("nomos", "3.1.0", Map.of("command_line", "nomossa -l <filepath>"));
        long c = registry.register("nomos", "3.1.1", Map.of("command_line", "nomossa <filepath>"));
        assertThat(Set.of(a, b, c)).hasSize(3);
    }

    @Test
    public void bulkRegistrationKeepsTheCallersOrder() {
        List<ToolSpec> specs = List.of(
                new ToolSpec("zeta", "1", Map.of()),
                new ToolSpec("alpha", "1", Map.of()),
                new ToolSpec("zeta", "1", Map.of()));
        List<IndexerTool> tools = registry.registerAll(specs);
        assertThat(tools).hasSize(3);
        assertThat(tools.get(0).getName()).isEqualTo("zeta");
        assertThat(tools.get(1).getName()).isEqualTo("alpha");
        assertThat(tools.get(2).getId()).isEqualTo(tools.get(0).getId());
    }

    @Test
    public void concurrentRegistrationYieldsOneRow() throws Exception {
        ToolSpec spec = new ToolSpec("universal-ctags", "5.9", Map.of("command_line", "ctags -f - <filepath>"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<IndexerTool>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) futures.add(pool.submit(() -> registry.register(spec)));
            Set<Long> ids = new HashSet<>();
            for (Future<IndexerTool> f : futures) ids.add(f.get(30, TimeUnit.SECONDS).getId());
            assertThat(ids).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
        long rows = repository.findAll().stream()
                .filter(t -> t.getName().equals("universal-ctags"))
                .count();
        assertThat(rows).isEqualTo(1);
    }

    @Test
    public void nameAndVersionAreRequired() {
        assertThatThrownBy(() -> registry.register("", "1", Map.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("x", null, Map.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void lookupByIdAndSpec() {
        ToolSpec spec = new ToolSpec("lookup-me", "2.0", Map.of("k", List.of(1, 2)));
        IndexerTool t = registry.register(spec);
        assertThat(registry.findById(t.getId())).map(IndexerTool::getName).contains("lookup-me");
        assertThat(registry.get(spec)).map(IndexerTool::getId).contains(t.getId());
        assertThat(registry.get(new ToolSpec("lookup-me", "2.1", Map.of()))).isEmpty();
    }
}
