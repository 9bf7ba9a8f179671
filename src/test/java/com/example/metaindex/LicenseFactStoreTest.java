package com.example.metaindex;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {"spring.jpa.hibernate.ddl-auto=create-drop", "spring.datasource.url=jdbc:h2:mem:licenses;DB_CLOSE_DELAY=-1"})
public class LicenseFactStoreTest {

    @Autowired
    LicenseFactStore store;

    @Autowired
    LicenseDictionary dictionary;

    @Autowired
    ToolRegistry registry;

    @Test
    public void licenseNamesRoundTripThroughTheDictionary() {
        long tool = registry.register("nomos", "3.1.0", Map.of("command_line", "nomossa <filepath>"));
        store.add(List.of(new FactEntry<>("c1", tool, List.of("MIT", "GPL-3.0-or-later"))), ConflictPolicy.SKIP);

        assertThat(store.get("c1", tool)).map(Fact::payload).contains(List.of("GPL-3.0-or-later", "MIT"));
        assertThat(dictionary.lookup(List.of("MIT", "GPL-3.0-or-later", "Apache-2.0"))).containsOnlyKeys("MIT", "GPL-3.0-or-later");
    }

    @Test
    public void sharedNamesAreStoredOnce() {
        long tool = registry.register("nomos", "3.1.0", Map.of("command_line", "nomossa -S <filepath>"));
        store.add(List.of(
                new FactEntry<>("c2", tool, List.of("BSD-3-Clause")),
                new FactEntry<>("c3", tool, List.of("BSD-3-Clause", "Zlib"))), ConflictPolicy.SKIP);

        Map<String, Integer> first = dictionary.resolve(List.of("BSD-3-Clause"));
        Map<String, Integer> again = dictionary.resolve(List.of("BSD-3-Clause", "Zlib"));
        assertThat(again.get("BSD-3-Clause")).isEqualTo(first.get("BSD-3-Clause"));
        assertThat(again.get("Zlib")).isNotEqualTo(again.get("BSD-3-Clause"));
    }

    @Test
    public void overwriteReplacesTheLicenseSet() {
        long tool = registry.register("nomos", "3.1.0", Map.of("command_line", "nomossa -X <filepath>"));
        store.add(List.of(new FactEntry<>("c4", tool, List.of("MIT", "ISC"))), ConflictPolicy.SKIP);
        store.add(List.of(new FactEntry<>("c4", tool, List.of("Apache-2.0"))), ConflictPolicy.OVERWRITE);

        assertThat(store.get("c4", tool)).map(Fact::payload).contains(List.of("Apache-2.0"));
    }

    @Test
    public void anEmptyLicenseListIsAFact() {
        long tool = registry.register("nomos", "3.1.0", Map.of("command_line", "nomossa -E <filepath>"));
        AddSummary s = store.add(List.of(new FactEntry<>("c5", tool, List.<String>of())), ConflictPolicy.SKIP);

        assertThat(s.affected()).isEqualTo(1);
        assertThat(store.get("c5", tool)).map(Fact::payload).contains(List.of());
        assertThat(store.missing(List.of("c5"), tool)).isEmpty();
    }

    @Test
    public void malformedLicenseNamesRejectOnlyTheirEntry() {
        long tool = registry.register("nomos", "3.1.0", Map.of("command_line", "nomossa -N <filepath>"));
        AddSummary s = store.add(List.of(
                new FactEntry<>("good", tool, List.of("GPL-3.0")),
                new FactEntry<>("bad", tool, Arrays.asList("MIT", null)),
                new FactEntry<>("blank", tool, List.of(" ")),
                new FactEntry<>("long", tool, List.of("x".repeat(LicenseFactStore.MAX_NAME_LENGTH + 1)))),
                ConflictPolicy.SKIP);

        assertThat(s.affected()).isEqualTo(1);
        assertThat(s.rejected()).extracting(AddSummary.Rejected::objectId).containsExactlyInAnyOrder("bad", "blank", "long");
        assertThat(store.get("good", tool)).map(Fact::payload).contains(List.of("GPL-3.0"));
        assertThat(store.get("bad", tool)).isEmpty();
    }
}
