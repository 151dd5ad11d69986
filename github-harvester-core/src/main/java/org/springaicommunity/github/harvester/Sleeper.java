package org.springaicommunity.github.harvester;

import java.time.Duration;

/**
 * Blocks the calling thread. Injected into {@link RateLimitedRequestExecutor} so tests can
 * record rate limit waits instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 */
	Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;

}
