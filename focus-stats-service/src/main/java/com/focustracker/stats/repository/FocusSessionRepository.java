package com.focustracker.stats.repository;

import com.focustracker.stats.entity.FocusSession;
import com.focustracker.stats.model.GoalCategory;
import com.focustracker.stats.model.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface FocusSessionRepository extends JpaRepository<FocusSession, Long> {

    @Query("SELECT COUNT(s) FROM FocusSession s, Goal g " +
           "WHERE g.id = s.goalId AND s.userId = :userId AND g.category = :category " +
           "AND s.status = :status AND s.completedAt >= :since")
    long countByUserAndCategoryAndStatusSince(@Param("userId") Long userId,
                                              @Param("category") GoalCategory category,
                                              @Param("status") SessionStatus status,
                                              @Param("since") Instant since);
}
