package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.MutableClock;
import com.shlawgathon.pulse.backend.dto.IngestInteractionRequest;
import com.shlawgathon.pulse.backend.exception.RecordStoreUnavailableException;
import com.shlawgathon.pulse.backend.model.CompletionStatus;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.RecordFilter;
import com.shlawgathon.pulse.backend.pubsub.InteractionEventPublisher;
import com.shlawgathon.pulse.backend.repository.InteractionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

import static com.shlawgathon.pulse.backend.TestRecords.NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class InteractionRecordServiceTest {

    private InteractionRecordRepository repository;
    private MongoTemplate mongoTemplate;
    private InteractionEventPublisher publisher;
    private InteractionRecordService service;

    @BeforeEach
    void setUp() {
        repository = mock(InteractionRecordRepository.class);
        mongoTemplate = mock(MongoTemplate.class);
        publisher = mock(InteractionEventPublisher.class);
        service = new InteractionRecordService(repository, mongoTemplate, publisher, new MutableClock(NOW));
    }

    @Test
    void shouldQueryNewestFirstWithinScope() {
        when(mongoTemplate.find(any(Query.class), eq(InteractionRecord.class))).thenReturn(List.of());

        service.fetchRecords(RecordFilter.builder().userId("alice").projectId("proj-1").limit(25).build());

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).find(query.capture(), eq(InteractionRecord.class));
        assertEquals(25, query.getValue().getLimit());
        assertEquals("alice", query.getValue().getQueryObject().get("userId"));
        assertEquals("proj-1", query.getValue().getQueryObject().get("projectId"));
        assertEquals(-1, query.getValue().getSortObject().get("timestamp"));
    }

    @Test
    void shouldWrapStoreFailures() {
        when(mongoTemplate.find(any(Query.class), eq(InteractionRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(RecordStoreUnavailableException.class,
                () -> service.fetchRecords(RecordFilter.builder().build()));
    }

    @Test
    void shouldFillDefaultsAndPublishOnIngest() {
        // Given
        when(repository.save(any(InteractionRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));
        IngestInteractionRequest request = IngestInteractionRequest.builder()
                .userId("alice")
                .projectId("proj-1")
                .queryText("add search")
                .build();

        // When
        InteractionRecord record = service.ingest(request);

        // Then
        assertNotNull(record.getId());
        assertEquals(NOW, record.getTimestamp());
        assertEquals(CompletionStatus.PENDING, record.getCompletionStatus());
        verify(publisher).publishInserted(record);
    }

    @Test
    void shouldMarkAnsweredTurnCompleted() {
        when(repository.save(any(InteractionRecord.class))).thenAnswer(invocation -> invocation.getArgument(0));

        InteractionRecord record = service.ingest(IngestInteractionRequest.builder()
                .userId("alice")
                .projectId("proj-1")
                .queryText("add search")
                .responseText("Use a debounced input.")
                .build());

        assertEquals(CompletionStatus.COMPLETED, record.getCompletionStatus());
    }

    @Test
    void shouldNotPublishWhenSaveFails() {
        when(repository.save(any(InteractionRecord.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThrows(RecordStoreUnavailableException.class, () -> service.ingest(IngestInteractionRequest.builder()
                .userId("alice")
                .projectId("proj-1")
                .queryText("add search")
                .build()));
        verifyNoInteractions(publisher);
    }
}
