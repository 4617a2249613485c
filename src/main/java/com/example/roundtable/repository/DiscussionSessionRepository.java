package com.example.roundtable.repository;

import com.example.roundtable.model.DiscussionSessionEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DiscussionSessionRepository extends JpaRepository<DiscussionSessionEntity, String> {

    List<DiscussionSessionEntity> findAllByOrderByStartedAtDesc(Pageable page);

    @Query("select avg(s.durationSeconds) from DiscussionSessionEntity s where s.durationSeconds > 0")
    Double averageDurationSeconds();

    @Query("select avg(s.participantCount) from DiscussionSessionEntity s")
    Double averageParticipantCount();
}
