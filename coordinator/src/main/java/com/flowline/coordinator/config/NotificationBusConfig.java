package com.flowline.coordinator.config;

import com.flowline.coordinator.bus.ListenConnectionFactory;
import com.flowline.coordinator.bus.PostgresNotificationBus;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;

/**
 * Wires the process-wide notification bus.
 *
 * The LISTEN connection uses the same URL and credentials as the pool but is
 * opened separately; it shows up in pg_stat_activity as {@code flowline.bus.application-name}.
 */
@Configuration
public class NotificationBusConfig {

    @Bean(initMethod = "start", destroyMethod = "close")
    public PostgresNotificationBus notificationBus(
            JdbcTemplate jdbcTemplate,
            MeterRegistry meterRegistry,
            @Value("${spring.datasource.url}") String url,
            @Value("${spring.datasource.username:#{null}}") String username,
            @Value("${spring.datasource.password:#{null}}") String password,
            @Value("${flowline.bus.channel:flowline_bus}") String channel,
            @Value("${flowline.bus.application-name:flowline-bus-listener}") String applicationName,
            @Value("${flowline.bus.poll-interval:500ms}") Duration pollInterval,
            @Value("${flowline.bus.reconnect-min-backoff:1s}") Duration minBackoff,
            @Value("${flowline.bus.reconnect-max-backoff:1m}") Duration maxBackoff) {
        return new PostgresNotificationBus(
                ListenConnectionFactory.driverManager(url, username, password, applicationName),
                jdbcTemplate,
                channel,
                pollInterval,
                minBackoff,
                maxBackoff,
                meterRegistry);
    }
}
