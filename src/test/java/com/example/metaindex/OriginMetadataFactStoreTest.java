package com.example.metaindex;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = {"spring.jpa.hibernate.ddl-auto=create-drop", "spring.datasource.url=jdbc:h2:mem:originfacts;DB_CLOSE_DELAY=-1"})
public class OriginMetadataFactStoreTest {

    @Autowired
    OriginIntrinsicMetadataFactStore store;

    @Autowired
    ToolRegistry registry;

    @Test
    public void searchFindsOriginsContainingEveryTerm() {
        long tool = tool();
        store.add(List.of(
                new FactEntry<>("https://example.org/one", tool, meta("{\"name\":\"alpha\",\"author\":\"Jane Doe\"}", "npm")),
                new FactEntry<>("https://example.org/two", tool, meta("{\"name\":\"beta\",\"author\":\"Jane Smith\"}", "npm"))),
                ConflictPolicy.SKIP);

        assertThat(store.searchFulltext("jane", 10)).extracting(Fact::objectId)
                .contains("https://example.org/one", "https://example.org/two");
        assertThat(store.searchFulltext("Jane Doe", 10)).extracting(Fact::objectId)
                .containsExactly("https://example.org/one");
        assertThat(store.searchFulltext("nobody-here", 10)).isEmpty();
    }

    @Test
    public void searchSeesOverwrittenMetadataImmediately() {
        long tool = tool();
        String origin = "https://example.org/fresh";
        store.add(List.of(new FactEntry<>(origin, tool, meta("{\"name\":\"oldname\"}", "npm"))), ConflictPolicy.SKIP);
        assertThat(store.searchFulltext("oldname", 10)).extracting(Fact::objectId).contains(origin);

        store.add(List.of(new FactEntry<>(origin, tool, meta("{\"name\":\"newname\"}", "npm"))), ConflictPolicy.OVERWRITE);
        assertThat(store.searchFulltext("oldname", 10)).extracting(Fact::objectId).doesNotContain(origin);
        assertThat(store.searchFulltext("newname", 10)).extracting(Fact::objectId).contains(origin);
    }

    @Test
    public void nameOfAHugeDocumentIsStillSearchable() {
        long tool = tool();
        String origin = "https://example.org/huge";
        StringBuilder description = new StringBuilder();
        for (int i = 0; i < SearchVector.MAX_TERMS + 500; i++) description.append("t").append(i).append(' ');
        ObjectNode doc = CanonicalJson.readObject("{\"name\":\"zorglub\"}");
        doc.put("description", description.toString());
        store.add(List.of(new FactEntry<>(origin, tool, new OriginMetadata(doc, List.of("npm"), "dir"))), ConflictPolicy.SKIP);

        assertThat(store.searchFulltext("zorglub", 10)).extracting(Fact::objectId).containsExactly(origin);
    }

    @Test
    public void searchRespectsTheLimit() {
        long tool = tool();
        List<FactEntry<OriginMetadata>> entries = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            entries.add(new FactEntry<>("https://example.org/limit" + i, tool, meta("{\"keywords\":\"limitword\"}", "npm")));
        }
        store.add(entries, ConflictPolicy.SKIP);
        List<Fact<OriginMetadata>> hits = store.searchFulltext("limitword", 3);
        assertThat(hits).hasSize(3);
        // equal ranks fall back to origin order
        assertThat(hits).extracting(Fact::objectId)
                .containsExactly("https://example.org/limit0", "https://example.org/limit1", "https://example.org/limit2");
    }

    @Test
    public void producerSearchPagesByOrigin() {
        long tool = tool();
        List<FactEntry<OriginMetadata>> entries = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            String mapping = i % 2 == 0 ? "pkg-info" : "maven";
            entries.add(new FactEntry<>("https://pages.example.org/p" + i, tool, meta("{\"name\":\"p" + i + "\"}", mapping)));
        }
        store.add(entries, ConflictPolicy.SKIP);

        OriginMetadataFactStore.ProducerPage first = store.searchByProducer(List.of("pkg-info"), List.of(tool), null, 2);
        assertThat(first.originIds()).containsExactly("https://pages.example.org/p0", "https://pages.example.org/p2");
        assertThat(first.nextPageToken()).isNotNull();

        OriginMetadataFactStore.ProducerPage second = store.searchByProducer(List.of("pkg-info"), List.of(tool), first.nextPageToken(), 2);
        assertThat(second.originIds()).containsExactly("https://pages.example.org/p4");
        assertThat(second.nextPageToken()).isNull();
    }

    @Test
    public void producerSearchRejectsANonPositiveLimit() {
        assertThatThrownBy(() -> store.searchByProducer(null, null, null, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void statsCountEmptyAndPerMapping() {
        long tool = tool();
        store.add(List.of(
                new FactEntry<>("https://stats.example.org/a", tool, meta("{\"name\":\"a\"}", "npm")),
                new FactEntry<>("https://stats.example.org/b", tool, new OriginMetadata(null, List.of(), "d")),
                new FactEntry<>("https://stats.example.org/c", tool, meta("{\"name\":\"c\"}", "codemeta"))),
                ConflictPolicy.SKIP);

        OriginMetadataFactStore.MetadataStats stats = store.stats();
        assertThat(stats.total()).isGreaterThanOrEqualTo(3);
        assertThat(stats.total() - stats.nonEmpty()).isGreaterThanOrEqualTo(1);
        assertThat(stats.perMapping()).containsKey("codemeta");
    }

    @Test
    public void provenanceAndMappingsRoundTrip() {
        long tool = tool();
        store.add(List.of(new FactEntry<>("https://rt.example.org/x", tool,
                new OriginMetadata(CanonicalJson.readObject("{\"name\":\"x\"}"), List.of("npm", "codemeta"), "dir-1"))), ConflictPolicy.SKIP);

        OriginMetadata m = store.get("https://rt.example.org/x", tool).orElseThrow().payload();
        assertThat(m.mappings()).containsExactly("npm", "codemeta");
        assertThat(m.from()).isEqualTo("dir-1");
        assertThat(m.metadata().get("name").asText()).isEqualTo("x");
    }

    private long tool() {
        return registry.register("metadata-detector", "test-" + UUID.randomUUID(), Map.of());
    }

    private static OriginMetadata meta(String json, String mapping) {
        return new OriginMetadata(CanonicalJson.readObject(json), List.of(mapping), "dir");
    }
}
