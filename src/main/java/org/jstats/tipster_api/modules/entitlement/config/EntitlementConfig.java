package org.jstats.tipster_api.modules.entitlement.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(EntitlementConfig.EntitlementProperties.class)
public class EntitlementConfig {

    public static final String ENTITLEMENT_SCHEDULER = "entitlementScheduler";

    /**
     * @param refreshInterval how often the gate polls the billing service
     * @param defaultAlias    the only alias granted before the first fetch and after a failed one
     * @param sessionIdleTimeout how long a caller's cached entitlements outlive its last request
     */
    @ConfigurationProperties(prefix = "tipster.entitlements")
    public record EntitlementProperties(
            @DefaultValue("30s") Duration refreshInterval,
            @DefaultValue("Quick Pick") String defaultAlias,
            @DefaultValue("30m") Duration sessionIdleTimeout) {}

    @Bean(name = ENTITLEMENT_SCHEDULER, destroyMethod = "shutdownNow")
    ScheduledExecutorService entitlementScheduler() {
        var pool = new ScheduledThreadPoolExecutor(1, r -> {
            var t = new Thread(r, "entitlement-refresh");
            t.setDaemon(true);
            return t;
        });
        pool.setRemoveOnCancelPolicy(true);
        return pool;
    }
}
