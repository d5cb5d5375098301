package com.vibecoding.agentsandbox.support;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 제한 시간이 있는 폴링 루프
 * check 가 값을 돌려주면 종료, 제한 시간을 넘기면 empty.
 */
public class BoundedPoller {

    /**
     * 테스트에서 대기를 대체하기 위한 sleep 함수
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final IntervalFunction intervals;
    private final Sleeper sleeper;

    public BoundedPoller(IntervalFunction intervals, Sleeper sleeper) {
        this.intervals = intervals;
        this.sleeper = sleeper;
    }

    public static BoundedPoller linear(Duration interval) {
        return new BoundedPoller(IntervalFunction.of(interval), Thread::sleep);
    }

    public static BoundedPoller exponential(Duration initial, Duration max) {
        return new BoundedPoller(IntervalFunction.ofExponentialBackoff(initial, 2.0, max), Thread::sleep);
    }

    public <T> Optional<T> poll(Supplier<Optional<T>> check, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempt = 1;

        while (true) {
            Optional<T> result = check.get();
            if (result.isPresent()) {
                return result;
            }

            long remainingMillis = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            if (remainingMillis <= 0) {
                return Optional.empty();
            }

            long wait = Math.min(intervals.apply(attempt++), remainingMillis);
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }
}
