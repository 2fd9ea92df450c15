package com.shlawgathon.pulse.backend.repository;

import com.shlawgathon.pulse.backend.model.InteractionRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface InteractionRecordRepository extends MongoRepository<InteractionRecord, String> {

    List<InteractionRecord> findByUserIdOrderByTimestampDesc(String userId, Pageable pageable);

    List<InteractionRecord> findByTimestampAfterOrderByTimestampDesc(Instant after, Pageable pageable);

    long countByUserIdAndTimestampAfter(String userId, Instant after);
}
