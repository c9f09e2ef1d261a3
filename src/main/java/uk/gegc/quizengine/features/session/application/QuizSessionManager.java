package uk.gegc.quizengine.features.session.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import uk.gegc.quizengine.features.question.infra.factory.QuestionHandlerFactory;
import uk.gegc.quizengine.features.session.config.QuizSessionProperties;
import uk.gegc.quizengine.features.session.domain.event.QuizSessionExpiredEvent;
import uk.gegc.quizengine.features.session.domain.model.CleanupReport;
import uk.gegc.quizengine.features.session.domain.model.QuizSession;
import uk.gegc.quizengine.features.session.domain.model.SessionRequest;
import uk.gegc.quizengine.features.session.domain.model.SessionResult;
import uk.gegc.quizengine.features.session.domain.model.SessionStatus;
import uk.gegc.quizengine.shared.exception.SessionNotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Registry of live quiz sessions keyed by session id.
 * <p>
 * Insertion, lookup and eviction of one id are atomic with respect to each other. A caller that already
 * holds a session keeps a valid object after it is evicted; it simply can no longer be found by id.
 */
@Component
@Slf4j
public class QuizSessionManager {

    static final int MAX_ID_ATTEMPTS = 10;

    private final ConcurrentMap<String, QuizSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;
    private final QuestionHandlerFactory handlerFactory;
    private final QuizSessionProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Supplier<String> idGenerator;

    @Autowired
    public QuizSessionManager(Clock clock,
                              QuestionHandlerFactory handlerFactory,
                              QuizSessionProperties properties,
                              ApplicationEventPublisher eventPublisher) {
        this(clock, handlerFactory, properties, eventPublisher, () -> UUID.randomUUID().toString());
    }

    public QuizSessionManager(Clock clock,
                              QuestionHandlerFactory handlerFactory,
                              QuizSessionProperties properties,
                              ApplicationEventPublisher eventPublisher,
                              Supplier<String> idGenerator) {
        this.clock = clock;
        this.handlerFactory = handlerFactory;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.idGenerator = idGenerator;
    }

    /**
     * Opens a session under a fresh id that is not already registered.
     *
     * @return the new session id
     */
    public String createSession(SessionRequest request) {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String id = idGenerator.get();
            QuizSession session = QuizSession.builder()
                    .id(id)
                    .mode(request.mode())
                    .questions(request.questions())
                    .timeLimitSeconds(request.timeLimitSeconds())
                    .unlimitedTime(request.unlimitedTime())
                    .ownerUserId(request.ownerUserId())
                    .section(request.section())
                    .category(request.category())
                    .clock(clock)
                    .handlerFactory(handlerFactory)
                    .build();
            if (sessions.putIfAbsent(id, session) == null) {
                log.info("Created {} quiz session {} with {} questions", request.mode(), id, session.size());
                return id;
            }
            log.warn("Generated session id {} already in use, retrying", id);
        }
        throw new IllegalStateException("Could not generate a unique session id after " + MAX_ID_ATTEMPTS + " attempts");
    }

    public QuizSession getSession(String sessionId) {
        QuizSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    /**
     * Removes a session. Does nothing when the id is not registered.
     */
    public void deleteSession(String sessionId) {
        if (sessionId != null && sessions.remove(sessionId) != null) {
            log.info("Deleted quiz session {}", sessionId);
        }
    }

    /**
     * Expires and evicts active sessions older than {@code maxAge}, evicts sessions that are already
     * expired, and evicts completed sessions whose retention window has passed. Safe to run concurrently
     * with lookups and with itself.
     * <p>
     * Each session expired by this sweep is announced with a {@link QuizSessionExpiredEvent} once the
     * sweep has finished touching the registry.
     */
    public CleanupReport cleanupExpired(Duration maxAge) {
        Instant now = clock.instant();
        Duration retention = properties.getCompletedRetention().compareTo(maxAge) > 0
                ? properties.getCompletedRetention()
                : maxAge;
        AtomicInteger expired = new AtomicInteger();
        AtomicInteger evicted = new AtomicInteger();
        List<QuizSessionExpiredEvent> expiredEvents = new ArrayList<>();

        for (String id : sessions.keySet()) {
            sessions.computeIfPresent(id, (key, session) -> {
                SessionStatus status = session.getStatus();
                if (status == SessionStatus.ACTIVE) {
                    if (Duration.between(session.getStartedAt(), now).compareTo(maxAge) <= 0) {
                        return session;
                    }
                    SessionResult result = session.expire();
                    expiredEvents.add(new QuizSessionExpiredEvent(this, session, result));
                    expired.incrementAndGet();
                } else if (status == SessionStatus.COMPLETED
                        && Duration.between(session.getEndedAt(), now).compareTo(retention) <= 0) {
                    return session;
                }
                evicted.incrementAndGet();
                return null;
            });
        }

        for (QuizSessionExpiredEvent event : expiredEvents) {
            try {
                eventPublisher.publishEvent(event);
            } catch (Exception e) {
                log.warn("Could not announce expiry of session {}: {}", event.getSession().getId(), e.getMessage());
            }
        }

        CleanupReport report = new CleanupReport(expired.get(), evicted.get());
        if (report.evicted() > 0) {
            log.info("Session cleanup expired {} and evicted {} sessions; {} remain",
                    report.expired(), report.evicted(), sessions.size());
        }
        return report;
    }

    public int activeSessionCount() {
        return (int) sessions.values().stream()
                .filter(session -> session.getStatus() == SessionStatus.ACTIVE)
                .count();
    }

    public int sessionCount() {
        return sessions.size();
    }
}
