package my.cmmloutcomes.app.service.extraction;

import my.cmmloutcomes.app.llm.LlmRequestException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Blocks so that consecutive generative calls start at least {@code minInterval} apart.
 */
public class GenerativeCallThrottle {
	private final Duration minInterval;
	private final Clock clock;
	private final Sleeper sleeper;
	private Instant lastCall;

	public GenerativeCallThrottle(Duration minInterval) {
		this(minInterval, Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()));
	}

	public GenerativeCallThrottle(Duration minInterval, Clock clock, Sleeper sleeper) {
		this.minInterval = minInterval == null || minInterval.isNegative() ? Duration.ZERO : minInterval;
		this.clock = clock;
		this.sleeper = sleeper;
	}

	public synchronized void awaitTurn() {
		if (lastCall != null && !minInterval.isZero()) {
			Duration elapsed = Duration.between(lastCall, clock.instant());
			Duration remaining = minInterval.minus(elapsed);
			if (!remaining.isNegative() && !remaining.isZero()) {
				try {
					sleeper.sleep(remaining);
				} catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					throw new LlmRequestException("Interrupted while waiting between generative calls", null, false, ex);
				}
			}
		}
		lastCall = clock.instant();
	}

	public Duration getMinInterval() {
		return minInterval;
	}

	@FunctionalInterface
	public interface Sleeper {
		void sleep(Duration duration) throws InterruptedException;
	}
}
