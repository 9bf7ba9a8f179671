package com.example.metaindex;

import com.example.metaindex.testutils.CapturingProcess;
import com.example.metaindex.testutils.TestProcessRunner;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.env.MockEnvironment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class LicenseIndexerProcessTest {

    @Test
    public void parsesTheScannerOutput() throws Exception {
        CapturingProcess cp = new CapturingProcess("File /tmp/license-1.blob contains license(s) MIT,GPL-2.0-or-later\n", 0);
        TestProcessRunner runner = new TestProcessRunner(cp);
        LicenseIndexer indexer = indexer(runner, mock(LicenseFactStore.class), mock(ObjectStorage.class));

        Optional<List<String>> out = indexer.compute("c1", "/* MIT */".getBytes());

        assertThat(out).contains(List.of("GPL-2.0-or-later", "MIT"));
        List<String> command = runner.getCommands().get(0);
        assertThat(command.get(0)).isEqualTo("nomossa");
        // the temporary copy is gone once the scanner is done
        assertThat(Files.exists(Path.of(command.get(1)))).isFalse();
    }

    @Test
    public void noLicenseFoundIsAnEmptyFact() {
        assertThat(LicenseIndexer.parse("File x contains license(s) No_license_found\n")).isEmpty();
        assertThat(LicenseIndexer.parse("")).isEmpty();
        assertThat(LicenseIndexer.parse("File a contains license(s) BSD, BSD\n")).containsExactly("BSD");
    }

    @Test
    public void nonZeroExitIsAnError() {
        CapturingProcess cp = new CapturingProcess("".getBytes(), "nomossa: cannot open".getBytes(), 2);
        LicenseIndexer indexer = indexer(new TestProcessRunner(cp), mock(LicenseFactStore.class), mock(ObjectStorage.class));

        assertThatThrownBy(() -> indexer.compute("c1", new byte[]{1}))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("cannot open");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void indexSkipsBlobsThatCannotBeFetched() {
        LicenseFactStore store = mock(LicenseFactStore.class);
        ObjectStorage storage = mock(ObjectStorage.class);
        when(store.missing(any(), any())).thenReturn(List.of("present", "absent"));
        when(storage.getBlob("present")).thenReturn(Optional.of("x".getBytes()));
        when(storage.getBlob("absent")).thenReturn(Optional.empty());
        when(store.add(any(), any())).thenReturn(new AddSummary(1, List.of()));
        CapturingProcess cp = new CapturingProcess("File p contains license(s) ISC\n", 0);

        AddSummary s = indexer(new TestProcessRunner(cp), store, storage).index(List.of("present", "absent"), ConflictPolicy.SKIP);

        assertThat(s.affected()).isEqualTo(1);
        ArgumentCaptor<List<FactEntry<List<String>>>> captor = ArgumentCaptor.forClass(List.class);
        verify(store).add(captor.capture(), eq(ConflictPolicy.SKIP));
        assertThat(captor.getValue()).singleElement().satisfies(e -> {
            assertThat(e.objectId()).isEqualTo("present");
            assertThat(e.toolId()).isEqualTo(11L);
            assertThat(e.payload()).containsExactly("ISC");
        });
    }

    private static LicenseIndexer indexer(TestProcessRunner runner, LicenseFactStore store, ObjectStorage storage) {
        ToolRegistry registry = mock(ToolRegistry.class);
        IndexerTool tool = new IndexerTool("nomos", "3.1.0", "{}");
        tool.setId(11L);
        when(registry.register(any(ToolSpec.class))).thenReturn(tool);
        return new LicenseIndexer(store, storage, registry, runner, new MockEnvironment());
    }
}
