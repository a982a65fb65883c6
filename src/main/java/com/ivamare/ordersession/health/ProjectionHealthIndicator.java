package com.ivamare.ordersession.health;

import com.ivamare.ordersession.projection.DeadLetterRepository;
import com.ivamare.ordersession.projection.EventSubscriber;
import com.ivamare.ordersession.projection.ProjectionEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;

/**
 * Health indicator for the projection engine.
 *
 * <p>Dead letters mean some read model is behind for at least one session, so
 * their presence reports the engine as down.
 */
public class ProjectionHealthIndicator implements HealthIndicator {

    private final ProjectionEngine projectionEngine;
    private final DeadLetterRepository deadLetterRepository;

    public ProjectionHealthIndicator(ProjectionEngine projectionEngine, DeadLetterRepository deadLetterRepository) {
        this.projectionEngine = projectionEngine;
        this.deadLetterRepository = deadLetterRepository;
    }

    @Override
    public Health health() {
        List<String> subscribers = projectionEngine.subscribers().stream()
            .map(EventSubscriber::name)
            .toList();

        if (subscribers.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No subscribers registered")
                .build();
        }

        long deadLetters;
        try {
            deadLetters = deadLetterRepository.count();
        } catch (RuntimeException e) {
            return Health.down()
                .withDetail("subscribers", subscribers)
                .withDetail("error", e.getMessage())
                .build();
        }

        Health.Builder builder = deadLetters == 0 ? Health.up() : Health.down();
        return builder
            .withDetail("subscribers", subscribers)
            .withDetail("eventsApplied", projectionEngine.eventsApplied())
            .withDetail("deadLetters", deadLetters)
            .build();
    }
}
