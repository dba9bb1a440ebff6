package com.trackflow.repository;

import com.trackflow.model.TrackKey;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TrackRepository extends JpaRepository<TrackRecord, TrackKey> {

    Optional<TrackRecord> findFirstById(String id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from TrackRecord t where t.id = :id")
    Optional<TrackRecord> findByIdForUpdate(@Param("id") String id);

    List<TrackRecord> findByStatusInOrderByCreatedDateAsc(Collection<TrackStatus> statuses);

    Page<TrackRecord> findAllByOrderByCreatedDateDesc(Pageable pageable);

    Page<TrackRecord> findByStatusOrderByCreatedDateDesc(TrackStatus status, Pageable pageable);

    Page<TrackRecord> findByGenreIgnoreCaseOrderByCreatedDateDesc(String genre, Pageable pageable);
}
