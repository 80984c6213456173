package am.ik.apilens.client;

import java.time.Duration;
import java.util.List;

import am.ik.apilens.record.RequestRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a {@link BatchSender} with bounded exponential backoff. A batch is attempted up
 * to {@code maxRetries + 1} times, waiting {@code min(base * 2^attempt, max)} between
 * attempts. Keeps no state between batches.
 */
public class RetryingBatchSender {

	private static final Logger log = LoggerFactory.getLogger(RetryingBatchSender.class);

	private final BatchSender delegate;

	private final int maxRetries;

	private final Duration backoffBase;

	private final Duration backoffMax;

	private final Sleeper sleeper;

	public RetryingBatchSender(BatchSender delegate, int maxRetries, Duration backoffBase, Duration backoffMax,
			Sleeper sleeper) {
		this.delegate = delegate;
		this.maxRetries = Math.max(maxRetries, 0);
		this.backoffBase = backoffBase;
		this.backoffMax = backoffMax;
		this.sleeper = sleeper;
	}

	/**
	 * Sends the batch, retrying on failure.
	 * @return true if one of the attempts succeeded
	 */
	public boolean send(List<RequestRecord> batch) {
		for (int attempt = 0; attempt <= this.maxRetries; attempt++) {
			try {
				this.delegate.send(batch);
				return true;
			}
			catch (IngestException ex) {
				if (attempt >= this.maxRetries) {
					log.warn("msg=\"API Lens ingest request failed after retries\" attempts={} error=\"{}\"",
							attempt + 1, ex.getMessage());
					return false;
				}
				Duration backoff = backoff(attempt);
				log.debug("msg=\"API Lens ingest attempt failed, retrying\" attempt={} backoff={} error=\"{}\"",
						attempt + 1, backoff, ex.getMessage());
				try {
					this.sleeper.sleep(backoff);
				}
				catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					log.warn("msg=\"Interrupted during ingest backoff, giving up on batch\" batchSize={}",
							batch.size());
					return false;
				}
			}
		}
		return false;
	}

	/**
	 * Returns the delay after the given zero-based failed attempt.
	 */
	Duration backoff(int attempt) {
		long maxMs = this.backoffMax.toMillis();
		long delay = Math.min(this.backoffBase.toMillis(), maxMs);
		for (int i = 0; i < attempt && delay < maxMs; i++) {
			delay = Math.min(delay * 2, maxMs);
		}
		return Duration.ofMillis(delay);
	}

	/**
	 * Waits between attempts.
	 */
	@FunctionalInterface
	public interface Sleeper {

		Sleeper THREAD = (duration) -> Thread.sleep(duration.toMillis());

		void sleep(Duration duration) throws InterruptedException;

	}

}
