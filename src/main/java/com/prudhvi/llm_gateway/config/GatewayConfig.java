package com.prudhvi.llm_gateway.config;

import com.prudhvi.llm_gateway.events.GatewayEventEmitter;
import com.prudhvi.llm_gateway.events.GatewayEventSink;
import com.prudhvi.llm_gateway.retry.BackoffSleeper;
import com.prudhvi.llm_gateway.timeout.TimeoutGuard;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the gateway's infrastructure beans.
 *
 * Two thread pools are involved:
 * - llmCallWorkers runs the provider calls so the timeout guard can abandon
 *   them at their deadline. Unbounded (cached) because concurrency is already
 *   bounded by the servlet request threads that wait on it.
 * - gatewayEventDispatcher delivers events to sinks on one thread with a
 *   bounded queue, keeping metrics and logging off the request path.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    @Bean
    public Clock gatewayClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService llmCallWorkers() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("llm-call-");
        threadFactory.setDaemon(true);
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolExecutor gatewayEventDispatcher(GatewayProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("gateway-events-");
        threadFactory.setDaemon(true);
        // AbortPolicy: the emitter catches the rejection and drops the event.
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(properties.getEvents().getQueueCapacity()),
                threadFactory, new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public TimeoutGuard timeoutGuard(@Qualifier("llmCallWorkers") ExecutorService llmCallWorkers) {
        return new TimeoutGuard(llmCallWorkers);
    }

    @Bean
    public GatewayEventEmitter gatewayEventEmitter(ObjectProvider<GatewayEventSink> sinks,
                                                   @Qualifier("gatewayEventDispatcher") ThreadPoolExecutor dispatcher,
                                                   Clock gatewayClock) {
        return new GatewayEventEmitter(sinks.orderedStream().toList(), dispatcher, gatewayClock);
    }

    @Bean
    public BackoffSleeper backoffSleeper() {
        return BackoffSleeper.THREAD_SLEEP;
    }
}
