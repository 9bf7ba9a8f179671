package com.example.metaindex;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.env.MockEnvironment;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@SpringBootTest(properties = {"spring.jpa.hibernate.ddl-auto=create-drop", "spring.datasource.url=jdbc:h2:mem:schema;DB_CLOSE_DELAY=-1"})
public class SchemaVersionServiceTest {

    @Autowired
    SchemaVersionService service;

    @Test
    public void startupRecordsTheCodeVersion() {
        assertThat(service.storedVersion()).contains(SchemaVersionService.CURRENT_VERSION);
        assertThat(service.history()).extracting(SchemaVersionRecord::getVersion).containsExactly(SchemaVersionService.CURRENT_VERSION);
        // running it again is a no-op
        SchemaVersionService.SchemaStatus again = service.upgrade();
        assertThat(again.previous()).isEqualTo(SchemaVersionService.CURRENT_VERSION);
        assertThat(again.reindexRequested()).isFalse();
    }

    @Test
    public void upgradingPastAFlaggedVersionReindexes() {
        SchemaVersionRepository repo = mock(SchemaVersionRepository.class);
        ReindexService reindex = mock(ReindexService.class);
        when(repo.findTopByOrderByVersionDesc()).thenReturn(Optional.of(new SchemaVersionRecord(2, Instant.now(), "v2")));

        SchemaVersionService svc = new SchemaVersionService(repo, reindex, new MockEnvironment()
                .withProperty("indexer.schema.version", "4")
                .withProperty("indexer.schema.requires-reindex", "3"));
        SchemaVersionService.SchemaStatus status = svc.upgrade();

        assertThat(status.previous()).isEqualTo(2);
        assertThat(status.current()).isEqualTo(4);
        assertThat(status.reindexRequested()).isTrue();
        verify(reindex).reindexOrigins();
        verify(repo).save(any(SchemaVersionRecord.class));
    }

    @Test
    public void freshDatabasesAreNotReindexed() {
        SchemaVersionRepository repo = mock(SchemaVersionRepository.class);
        ReindexService reindex = mock(ReindexService.class);
        when(repo.findTopByOrderByVersionDesc()).thenReturn(Optional.empty());

        SchemaVersionService svc = new SchemaVersionService(repo, reindex, new MockEnvironment()
                .withProperty("indexer.schema.requires-reindex", "1,2,3"));

        assertThat(svc.upgrade().reindexRequested()).isFalse();
        verifyNoInteractions(reindex);
    }

    @Test
    public void newerDatabasesAreRefused() {
        SchemaVersionRepository repo = mock(SchemaVersionRepository.class);
        when(repo.findTopByOrderByVersionDesc()).thenReturn(Optional.of(new SchemaVersionRecord(99, Instant.now(), "future")));
        SchemaVersionService svc = new SchemaVersionService(repo, mock(ReindexService.class), new MockEnvironment());

        assertThatThrownBy(svc::upgrade).isInstanceOf(IllegalStateException.class);
        verify(repo, never()).save(any());
    }
}
