package app.lexis.core.review.repository;

import app.lexis.core.review.domain.Phase;
import app.lexis.core.review.entity.SrCardStateEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface SrCardStateRepository extends JpaRepository<SrCardStateEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from SrCardStateEntity s where s.wordId = :id")
    Optional<SrCardStateEntity> findByIdForUpdate(@Param("id") Long id);

    @Query("""
        select s
        from SrCardStateEntity s
        where s.nextReviewAt <= :now
        order by s.nextReviewAt asc, s.wordId asc
        """)
    List<SrCardStateEntity> findDue(@Param("now") Instant now);

    @Query("""
        select s.wordId
        from SrCardStateEntity s
        where s.nextReviewAt <= :now
        order by s.nextReviewAt asc, s.wordId asc
        """)
    List<Long> findDueWordIds(@Param("now") Instant now, Pageable pageable);

    @Query("select count(s.wordId) from SrCardStateEntity s where s.nextReviewAt <= :now")
    long countDue(@Param("now") Instant now);

    long countByPhase(Phase phase);

    @Query("select avg(s.easinessFactor) from SrCardStateEntity s where s.phase = :phase")
    Double averageEasinessFactor(@Param("phase") Phase phase);

    List<SrCardStateEntity> findByWordIdIn(List<Long> wordIds);
}
