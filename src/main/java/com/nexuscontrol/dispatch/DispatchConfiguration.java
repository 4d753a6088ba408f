package com.nexuscontrol.dispatch;

import com.nexuscontrol.contract.RunRequestValidator;
import com.nexuscontrol.policy.PolicyValidator;
import com.nexuscontrol.projection.ProjectionService;
import com.nexuscontrol.store.EventLogService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({RouterProperties.class, StdoutAdapterProperties.class})
public class DispatchConfiguration {

    /**
     * Built-in stdout adapter, registered unless
     * {@code nexus.adapters.stdout.enabled=false}. Other {@link DispatchAdapter}
     * beans are registered alongside it.
     */
    @Bean
    public AdapterRegistry adapterRegistry(StdoutAdapterProperties stdoutProperties,
                                           ObjectProvider<DispatchAdapter> extraAdapters,
                                           Clock clock) {
        List<DispatchAdapter> adapters = new ArrayList<>();
        if (stdoutProperties.isEnabled()) {
            adapters.add(new StdoutAdapter(stdoutProperties.toOptions(), System.out, clock));
        }
        extraAdapters.orderedStream().forEach(adapters::add);
        return new AdapterRegistry(adapters);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService adapterExecutor(RouterProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "adapter-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
            properties.workerThreads(),
            properties.workerThreads(),
            0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(properties.queueCapacity()),
            threads
        );
    }

    @Bean
    public Router router(RunRequestValidator requestValidator,
                         PolicyValidator policyValidator,
                         ProjectionService projectionService,
                         EventLogService eventLog,
                         AdapterRegistry adapterRegistry,
                         ExecutorService adapterExecutor,
                         RouterProperties properties) {
        return new Router(requestValidator, policyValidator, projectionService, eventLog,
            adapterRegistry, adapterExecutor, properties);
    }
}
