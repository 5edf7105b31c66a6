package com.agentbacktest.common.resilience;

import com.agentbacktest.common.exception.AgentException;
import com.agentbacktest.common.exception.CircuitOpenException;
import com.agentbacktest.common.exception.ProviderTimeoutException;
import com.agentbacktest.common.exception.ProviderUnavailableException;
import com.agentbacktest.common.model.AgentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps blocking calls to an external capability with per-attempt timeout, exponential
 * backoff retry and a per-channel {@link CircuitBreaker}.
 *
 * <h3>Per attempt</h3>
 * <ol>
 *   <li>breaker permission, else {@link CircuitOpenException} (not retried)</li>
 *   <li>call on the bounded-elastic scheduler, limited by {@code callTimeout}</li>
 *   <li>success closes the breaker; a transient failure counts against it</li>
 * </ol>
 *
 * <p>Transient failures ({@link AgentException#isTransient()}) are retried with
 * {@code baseDelay × 2^attempt} capped at {@code maxDelay}, no jitter. Any other
 * runtime failure of the callable is treated as {@link ProviderUnavailableException}.
 * The whole call, retries included, is bounded by {@code callDeadline}; exceeding it
 * surfaces {@link ProviderTimeoutException}.
 */
public class ResilientCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientCaller.class);

    private final ResilienceSettings settings;
    private final Clock clock;
    private final Scheduler scheduler;
    private final Map<AgentRole, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public ResilientCaller(ResilienceSettings settings, Clock clock) {
        this(settings, clock, Schedulers.boundedElastic());
    }

    public ResilientCaller(ResilienceSettings settings, Clock clock, Scheduler scheduler) {
        this.settings = settings.validate();
        this.clock = clock;
        this.scheduler = scheduler;
    }

    public <T> Mono<T> call(AgentRole channel, Callable<T> action) {
        CircuitBreaker breaker = breakerFor(channel);

        Mono<T> attempt = Mono.defer(() -> {
            if (!breaker.tryAcquirePermission()) {
                Instant until = breaker.state().openUntil();
                return Mono.error(new CircuitOpenException(channel, until != null ? until : clock.instant()));
            }
            AtomicBoolean settled = new AtomicBoolean();
            return Mono.fromCallable(action)
                .subscribeOn(scheduler)
                .timeout(settings.callTimeout(),
                    Mono.error(() -> new ProviderTimeoutException(channel, settings.callTimeout())))
                .onErrorMap(e -> !(e instanceof AgentException),
                    e -> new ProviderUnavailableException(channel, String.valueOf(e.getMessage()), e))
                .doOnSuccess(v -> {
                    if (settled.compareAndSet(false, true)) breaker.onSuccess();
                })
                .doOnError(e -> {
                    if (!settled.compareAndSet(false, true)) return;
                    if (isTransient(e)) {
                        breaker.onFailure();
                    } else {
                        // provider answered; the content problem is handled by the caller
                        breaker.onSuccess();
                    }
                })
                .doOnCancel(() -> {
                    if (settled.compareAndSet(false, true)) breaker.onFailure();
                });
        });

        return attempt
            .retryWhen(Retry.backoff(settings.maxRetries(), settings.baseDelay())
                .maxBackoff(settings.maxDelay())
                .jitter(0.0)
                .filter(ResilientCaller::isTransient)
                .doBeforeRetry(signal -> log.warn("[Resilience] retry channel={} attempt={} cause={}",
                    channel, signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
            .timeout(settings.callDeadline(),
                Mono.error(() -> new ProviderTimeoutException(channel, settings.callDeadline())));
    }

    public CircuitState circuitState(AgentRole channel) {
        CircuitBreaker breaker = breakers.get(channel);
        return breaker != null ? breaker.state() : CircuitState.closed();
    }

    private CircuitBreaker breakerFor(AgentRole channel) {
        return breakers.computeIfAbsent(channel, c ->
            new CircuitBreaker(c.name(), settings.failureThreshold(), settings.cooldown(), clock));
    }

    private static boolean isTransient(Throwable e) {
        return e instanceof AgentException ae && ae.isTransient();
    }
}
