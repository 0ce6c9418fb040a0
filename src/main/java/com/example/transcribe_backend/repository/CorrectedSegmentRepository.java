package com.example.transcribe_backend.repository;

import com.example.transcribe_backend.model.CorrectedSegment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface CorrectedSegmentRepository extends JpaRepository<CorrectedSegment, UUID> {
    List<CorrectedSegment> findByVideoIdOrderByStartSecAsc(String videoId);
}
