package com.example.metaindex;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.mock.env.MockEnvironment;

import java.util.*;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ContentIndexingJobServiceUnitTest {

    @Test
    @SuppressWarnings("unchecked")
    public void testStartPauseResumeCancelWithMockIndexer() throws Exception {
        InMemoryArchive archive = new InMemoryArchive();
        archive.putDirectory("root", List.of(
                new ArchiveModels.DirectoryEntry("a.txt", ArchiveModels.EntryType.FILE, "b1"),
                new ArchiveModels.DirectoryEntry("src", ArchiveModels.EntryType.DIR, "sub")));
        archive.putDirectory("sub", List.of(
                new ArchiveModels.DirectoryEntry("b.txt", ArchiveModels.EntryType.FILE, "b2"),
                new ArchiveModels.DirectoryEntry("c.txt", ArchiveModels.EntryType.FILE, "b3"),
                new ArchiveModels.DirectoryEntry("again.txt", ArchiveModels.EntryType.FILE, "b1")));

        ContentIndexer<Mimetype> indexer = Mockito.mock(ContentIndexer.class);
        Mockito.when(indexer.name()).thenReturn("mimetype");
        // each batch takes a little while
        Mockito.when(indexer.index(Mockito.anyCollection(), Mockito.any())).thenAnswer(invocation -> {
            Thread.sleep(100);
            return new AddSummary(((Collection<String>) invocation.getArgument(0)).size(), List.of());
        });

        ContentIndexingJobService svc = new ContentIndexingJobService(archive, List.of(indexer),
                new MockEnvironment().withProperty("indexer.content-job.batch-size", "1"));

        String jobId = svc.startJob("root", List.of(), ConflictPolicy.SKIP);
        assertThat(jobId).isNotNull();
        assertThat(svc.startJob("root", List.of(), ConflictPolicy.SKIP)).isEqualTo(jobId);

        TimeUnit.MILLISECONDS.sleep(150);
        assertThat((Integer) svc.status().get("processedContents")).isGreaterThanOrEqualTo(1);

        assertThat(svc.pause()).isTrue();
        TimeUnit.MILLISECONDS.sleep(250);
        int processedWhenPaused = (Integer) svc.status().get("processedContents");

        assertThat(svc.resume()).isTrue();
        TimeUnit.MILLISECONDS.sleep(600);

        svc.cancel();

        Map<String, Object> finalStatus = svc.status();
        assertThat((Integer) finalStatus.get("processedContents")).isGreaterThanOrEqualTo(processedWhenPaused);
        assertThat((Integer) finalStatus.get("totalContents")).isEqualTo(3);
        assertThat(finalStatus.get("indexers")).isEqualTo(List.of("mimetype"));
    }

    @Test
    public void reachableContentsAreDistinct() {
        InMemoryArchive archive = new InMemoryArchive();
        archive.putDirectory("root", List.of(
                new ArchiveModels.DirectoryEntry("x", ArchiveModels.EntryType.FILE, "b1"),
                new ArchiveModels.DirectoryEntry("d", ArchiveModels.EntryType.DIR, "root"),
                new ArchiveModels.DirectoryEntry("sm", ArchiveModels.EntryType.REV, "rev")));
        ContentIndexingJobService svc = new ContentIndexingJobService(archive, List.of(), new MockEnvironment());

        assertThat(svc.reachableContents("root")).containsExactly("b1");
    }

    @Test
    public void unknownIndexerNamesAreRejected() {
        ContentIndexingJobService svc = new ContentIndexingJobService(new InMemoryArchive(), List.of(), new MockEnvironment());
        assertThatThrownBy(() -> svc.startJob("root", List.of("nope"), ConflictPolicy.SKIP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(svc.pause()).isFalse();
    }
}
