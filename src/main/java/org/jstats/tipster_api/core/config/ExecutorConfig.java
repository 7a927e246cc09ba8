package org.jstats.tipster_api.core.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Threads for cancellable outbound calls. Cancelling a submitted call interrupts its thread,
 * which aborts the in-flight HTTP exchange.
 */
@Configuration
public class ExecutorConfig {

    public static final String OUTBOUND_EXECUTOR = "outboundExecutor";

    @Bean(name = OUTBOUND_EXECUTOR, destroyMethod = "shutdownNow")
    ExecutorService outboundExecutor(@Value("${tipster.outbound.threads:8}") int threads) {
        var seq = new AtomicLong();
        ThreadFactory factory = r -> {
            var t = new Thread(r, "outbound-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}
