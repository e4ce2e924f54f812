package com.focustracker.stats.service;

import com.focustracker.stats.entity.FocusSession;
import com.focustracker.stats.entity.Goal;
import com.focustracker.stats.model.SessionCompletionEvent;
import com.focustracker.stats.model.SessionStatus;
import com.focustracker.stats.repository.FocusSessionRepository;
import com.focustracker.stats.repository.GoalRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Completes active focus sessions and feeds them into the statistics.
 * The session commit comes first; a statistics failure afterwards is logged and never undoes it.
 */
@Service
@Slf4j
public class SessionCompletionService {

    private final FocusSessionRepository sessionRepository;
    private final GoalRepository goalRepository;
    private final StatsAggregator statsAggregator;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public SessionCompletionService(FocusSessionRepository sessionRepository,
                                    GoalRepository goalRepository,
                                    StatsAggregator statsAggregator,
                                    TransactionTemplate transactionTemplate,
                                    Clock clock) {
        this.sessionRepository = sessionRepository;
        this.goalRepository = goalRepository;
        this.statsAggregator = statsAggregator;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    /**
     * Complete an active session
     *
     * @param actualDurationMinutes minutes actually spent, or {@code null} to use the planned duration
     */
    public FocusSession completeSession(Long sessionId, Integer actualDurationMinutes) {
        Instant now = clock.instant();

        FocusSession completed = transactionTemplate.execute(status -> {
            FocusSession session = sessionRepository.findById(sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            if (session.getStatus() != SessionStatus.ACTIVE) {
                throw new IllegalStateException("Session " + sessionId + " is not active: " + session.getStatus());
            }
            session.setStatus(SessionStatus.COMPLETED);
            session.setCompletedAt(now);
            session.setActualDuration(actualDurationMinutes != null
                    ? actualDurationMinutes
                    : session.getPlannedDuration());
            return sessionRepository.save(session);
        });

        recordStatistics(completed, now);
        return completed;
    }

    private void recordStatistics(FocusSession session, Instant now) {
        try {
            Goal goal = goalRepository.findById(session.getGoalId())
                    .orElseThrow(() -> new IllegalStateException("Goal " + session.getGoalId() + " not found"));
            statsAggregator.recordCompletion(SessionCompletionEvent.builder()
                    .userId(session.getUserId())
                    .category(goal.getCategory())
                    .actualDurationMinutes(session.getActualDuration())
                    .completionTimestamp(now)
                    .build());
        } catch (RuntimeException e) {
            // Statistics may lag behind; the session itself stays completed
            log.error("Failed to update statistics for completed session {} of user {}",
                    session.getId(), session.getUserId(), e);
        }
    }
}
