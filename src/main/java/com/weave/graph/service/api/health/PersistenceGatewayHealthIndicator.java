package com.weave.graph.service.api.health;

import com.weave.graph.service.persistence.PersistenceGateway;
import com.weave.graph.service.session.SessionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the persistence gateway.
 *
 * DOWN once the gateway is closed; reports the backend and open session count.
 */
@Component
@RequiredArgsConstructor
public class PersistenceGatewayHealthIndicator implements HealthIndicator {

    private final PersistenceGateway gateway;
    private final SessionRegistry sessionRegistry;

    @Override
    public Health health() {
        Health.Builder builder = gateway.isClosed()
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("provider", gateway.getName())
                .withDetail("closed", gateway.isClosed())
                .withDetail("openSessions", sessionRegistry.count())
                .build();
    }
}
