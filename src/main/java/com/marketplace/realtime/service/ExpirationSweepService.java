package com.marketplace.realtime.service;

import com.marketplace.realtime.config.ExpirationProperties;
import com.marketplace.realtime.model.Notification;
import com.marketplace.realtime.model.NotificationType;
import com.marketplace.realtime.model.RequestStatus;
import com.marketplace.realtime.repository.ExpirationCandidate;
import com.marketplace.realtime.repository.ListingRequestRepository;
import com.marketplace.realtime.repository.NotificationRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Cancels requests nobody acted on in time.
 * <ul>
 *   <li>pending requests older than {@code app.expiration.pending-ttl}</li>
 *   <li>accepted requests whose scheduled start passed more than
 *   {@code app.expiration.accepted-grace} ago</li>
 * </ul>
 * Each rule runs in its own transaction: one candidate query, one bulk update
 * and one batched notification insert. A failing rule is rolled back and
 * reported without stopping the other one.
 */
@Service
public class ExpirationSweepService {

    static final String RULE_PENDING = "pending";
    static final String RULE_ACCEPTED = "accepted";

    private static final Logger logger = LoggerFactory.getLogger(ExpirationSweepService.class);

    private final ListingRequestRepository requestRepository;
    private final NotificationRepository notificationRepository;
    private final TransactionTemplate transactionTemplate;
    private final ExpirationProperties properties;
    private final ExpirationMessages messages;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counter notificationsCounter;

    private final ReentrantLock sweepLock = new ReentrantLock();

    public ExpirationSweepService(ListingRequestRepository requestRepository,
                                  NotificationRepository notificationRepository,
                                  PlatformTransactionManager transactionManager,
                                  ExpirationProperties properties,
                                  ExpirationMessages messages,
                                  ApplicationEventPublisher eventPublisher,
                                  Clock clock,
                                  MeterRegistry meterRegistry) {
        this.requestRepository = requestRepository;
        this.notificationRepository = notificationRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
        this.messages = messages;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.notificationsCounter = Counter.builder("marketplace.notifications.created")
                .description("Notifications written by the expiration sweep")
                .register(meterRegistry);
    }

    /**
     * Runs both rules against the current time. Concurrent calls run one after another.
     */
    public ExpirationResult expireStaleRequests() {
        sweepLock.lock();
        try {
            return sweep(clock.instant());
        } finally {
            sweepLock.unlock();
        }
    }

    private ExpirationResult sweep(Instant now) {
        logger.info("Starting expiration sweep at {}", now);
        List<String> errors = new ArrayList<>();

        RuleOutcome pending = runRule(RULE_PENDING, errors, rowErrors -> expirePending(now));
        RuleOutcome accepted = runRule(RULE_ACCEPTED, errors, rowErrors -> expireAccepted(now, rowErrors));

        ExpirationResult result = new ExpirationResult(
                pending.expired(),
                accepted.expired(),
                pending.notifications() + accepted.notifications(),
                errors);
        if (result.hasErrors()) {
            logger.warn("Expiration sweep finished with {} errors: {}", errors.size(), errors);
        }
        logger.info("Expiration sweep done - pending: {}, accepted: {}, notifications: {}",
                result.expiredPending(), result.expiredAccepted(), result.notificationsCreated());
        return result;
    }

    private RuleOutcome runRule(String rule, List<String> errors, Function<List<String>, RuleOutcome> work) {
        List<String> rowErrors = new ArrayList<>();
        try {
            RuleOutcome outcome = transactionTemplate.execute(status -> work.apply(rowErrors));
            errors.addAll(rowErrors);
            if (outcome == null || outcome.expired() == 0) {
                return RuleOutcome.NONE;
            }
            meterRegistry.counter("marketplace.requests.expired", "rule", rule).increment(outcome.expired());
            notificationsCounter.increment(outcome.notifications());
            return outcome;
        } catch (DataAccessException | TransactionException e) {
            logger.error("Expiration rule '{}' failed and was rolled back", rule, e);
            errors.addAll(rowErrors);
            errors.add("Rule " + rule + " failed: " + e.getMessage());
            return RuleOutcome.NONE;
        }
    }

    // transactional
    private RuleOutcome expirePending(Instant now) {
        Instant cutoff = now.minus(properties.getPendingTtl());
        List<ExpirationCandidate> candidates =
                requestRepository.findCandidatesCreatedBefore(RequestStatus.PENDING, cutoff);
        if (candidates.isEmpty()) {
            return RuleOutcome.NONE;
        }
        RequestStatus.PENDING.requireTransition(RequestStatus.CANCELLED_BY_PROVIDER);

        String response = messages.pendingProviderResponse();
        List<Notification> notifications = new ArrayList<>(candidates.size());
        for (ExpirationCandidate candidate : candidates) {
            notifications.add(notification(candidate.clientId(), NotificationType.REQUEST_REJECTED,
                    messages.pendingTitle(), messages.pendingMessage(candidate.listingTitle()), candidate.id(), now));
        }
        return apply(RULE_PENDING, candidates, RequestStatus.PENDING, response, notifications, now);
    }

    // transactional
    private RuleOutcome expireAccepted(Instant now, List<String> rowErrors) {
        List<ExpirationCandidate> candidates =
                requestRepository.findCandidatesWithPreferredDate(RequestStatus.ACCEPTED);
        List<ExpirationCandidate> expired = new ArrayList<>();
        for (ExpirationCandidate candidate : candidates) {
            try {
                if (now.isAfter(deadline(candidate))) {
                    expired.add(candidate);
                }
            } catch (DateTimeException | NumberFormatException e) {
                logger.warn("Skipping request {} with unusable preferred time '{}'",
                        candidate.id(), candidate.preferredTime());
                rowErrors.add("Request " + candidate.id() + ": invalid preferred time '"
                        + candidate.preferredTime() + "'");
            }
        }
        if (expired.isEmpty()) {
            return RuleOutcome.NONE;
        }
        RequestStatus.ACCEPTED.requireTransition(RequestStatus.CANCELLED_BY_PROVIDER);

        String response = messages.acceptedProviderResponse();
        List<Notification> notifications = new ArrayList<>(expired.size() * 2);
        for (ExpirationCandidate candidate : expired) {
            String title = messages.acceptedTitle();
            String message = messages.acceptedMessage(candidate.listingTitle());
            notifications.add(notification(candidate.clientId(), NotificationType.CANCELLED_BY_PROVIDER,
                    title, message, candidate.id(), now));
            notifications.add(notification(candidate.providerId(), NotificationType.CANCELLED_BY_PROVIDER,
                    title, message, candidate.id(), now));
        }
        return apply(RULE_ACCEPTED, expired, RequestStatus.ACCEPTED, response, notifications, now);
    }

    private RuleOutcome apply(String rule,
                              List<ExpirationCandidate> candidates,
                              RequestStatus from,
                              String response,
                              List<Notification> notifications,
                              Instant now) {
        List<String> ids = candidates.stream().map(ExpirationCandidate::id).toList();
        int updated = requestRepository.updateStatus(ids, RequestStatus.CANCELLED_BY_PROVIDER, response, now);
        if (updated != ids.size()) {
            logger.warn("Rule '{}' updated {} of {} candidate requests", rule, updated, ids.size());
        }
        notificationRepository.saveAll(notifications);

        List<ExpiredRequest> changes = candidates.stream()
                .map(c -> new ExpiredRequest(c.id(), c.clientId(), c.providerId(), from,
                        RequestStatus.CANCELLED_BY_PROVIDER, response, now))
                .toList();
        eventPublisher.publishEvent(new ExpirationAppliedEvent(rule, changes, notifications));
        logger.info("Rule '{}' cancelled {} requests", rule, ids.size());
        return new RuleOutcome(ids.size(), notifications.size());
    }

    Instant deadline(ExpirationCandidate candidate) {
        LocalTime start = parsePreferredTime(candidate.preferredTime());
        return ZonedDateTime.of(candidate.preferredDate(), start, properties.getZone())
                .plus(properties.getAcceptedGrace())
                .toInstant();
    }

    private LocalTime parsePreferredTime(String value) {
        if (value == null || value.isBlank()) {
            return properties.getDefaultPreferredTime();
        }
        String[] parts = value.trim().split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new DateTimeException("Expected HH:mm but got " + value);
        }
        return LocalTime.of(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
    }

    private static Notification notification(String userId, NotificationType type, String title, String message,
                                             String requestId, Instant now) {
        return Notification.builder()
                .userId(userId)
                .type(type)
                .title(title)
                .message(message)
                .requestId(requestId)
                .createdAt(now)
                .build();
    }

    private record RuleOutcome(int expired, int notifications) {
        static final RuleOutcome NONE = new RuleOutcome(0, 0);
    }
}
