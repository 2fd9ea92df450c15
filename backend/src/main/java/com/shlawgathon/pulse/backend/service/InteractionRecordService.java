package com.shlawgathon.pulse.backend.service;

import com.shlawgathon.pulse.backend.dto.IngestInteractionRequest;
import com.shlawgathon.pulse.backend.dto.InteractionRecordResponse;
import com.shlawgathon.pulse.backend.exception.RecordStoreUnavailableException;
import com.shlawgathon.pulse.backend.model.CompletionStatus;
import com.shlawgathon.pulse.backend.model.InteractionRecord;
import com.shlawgathon.pulse.backend.model.RecordFilter;
import com.shlawgathon.pulse.backend.pubsub.InteractionEventPublisher;
import com.shlawgathon.pulse.backend.repository.InteractionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Adapter over the interaction record store.
 * Reads records by scope and ingests new turns, publishing an insert
 * notification for each stored record.
 */
@Service
public class InteractionRecordService {

    private static final Logger log = LoggerFactory.getLogger(InteractionRecordService.class);

    private final InteractionRecordRepository interactionRecordRepository;
    private final MongoTemplate mongoTemplate;
    private final InteractionEventPublisher interactionEventPublisher;
    private final Clock clock;

    public InteractionRecordService(InteractionRecordRepository interactionRecordRepository,
            MongoTemplate mongoTemplate,
            InteractionEventPublisher interactionEventPublisher,
            Clock clock) {
        this.interactionRecordRepository = interactionRecordRepository;
        this.mongoTemplate = mongoTemplate;
        this.interactionEventPublisher = interactionEventPublisher;
        this.clock = clock;
    }

    /**
     * Fetch records matching the filter, newest first.
     *
     * @throws RecordStoreUnavailableException when the store cannot be queried
     */
    public List<InteractionRecord> fetchRecords(RecordFilter filter) {
        Query query = new Query()
                .with(Sort.by(Sort.Direction.DESC, "timestamp"))
                .limit(Math.max(1, filter.getLimit()));

        if (filter.getUserId() != null) {
            query.addCriteria(Criteria.where("userId").is(filter.getUserId()));
        }
        if (filter.getProjectId() != null) {
            query.addCriteria(Criteria.where("projectId").is(filter.getProjectId()));
        }
        if (filter.getFromTimestamp() != null || filter.getToTimestamp() != null) {
            Criteria timestamp = Criteria.where("timestamp");
            if (filter.getFromTimestamp() != null) {
                timestamp = timestamp.gte(filter.getFromTimestamp());
            }
            if (filter.getToTimestamp() != null) {
                timestamp = timestamp.lte(filter.getToTimestamp());
            }
            query.addCriteria(timestamp);
        }

        try {
            List<InteractionRecord> records = mongoTemplate.find(query, InteractionRecord.class);
            log.debug("[STORE] Fetched {} records | user: {} | project: {}",
                    records.size(), filter.getUserId(), filter.getProjectId());
            return records;
        } catch (DataAccessException e) {
            throw new RecordStoreUnavailableException("Failed to fetch interaction records", e);
        }
    }

    /**
     * Store a new interaction turn and announce it to all pods.
     */
    public InteractionRecord ingest(IngestInteractionRequest request) {
        InteractionRecord record = InteractionRecord.builder()
                .id(request.getId() != null ? request.getId() : UUID.randomUUID().toString())
                .userId(request.getUserId())
                .projectId(request.getProjectId())
                .projectName(request.getProjectName())
                .queryText(request.getQueryText())
                .responseText(request.getResponseText())
                .timestamp(request.getTimestamp() != null ? request.getTimestamp() : clock.instant())
                .completionStatus(resolveCompletionStatus(request))
                .completedAt(request.getCompletedAt())
                .build();

        try {
            record = interactionRecordRepository.save(record);
        } catch (DataAccessException e) {
            throw new RecordStoreUnavailableException("Failed to store interaction record", e);
        }
        log.info("[STORE] Stored record: {} | user: {} | project: {}",
                record.getId(), record.getUserId(), record.getProjectId());

        interactionEventPublisher.publishInserted(record);
        return record;
    }

    /**
     * Convert record to response DTO.
     */
    public InteractionRecordResponse toResponse(InteractionRecord record) {
        return InteractionRecordResponse.builder()
                .id(record.getId())
                .userId(record.getUserId())
                .projectId(record.getProjectId())
                .projectName(record.getProjectName())
                .queryText(record.getQueryText())
                .responseText(record.getResponseText())
                .timestamp(record.getTimestamp())
                .completionStatus(record.getCompletionStatus())
                .completedAt(record.getCompletedAt())
                .build();
    }

    private CompletionStatus resolveCompletionStatus(IngestInteractionRequest request) {
        if (request.getCompletionStatus() != null) {
            return request.getCompletionStatus();
        }
        return request.getResponseText() != null && !request.getResponseText().isBlank()
                ? CompletionStatus.COMPLETED
                : CompletionStatus.PENDING;
    }
}
