package am.ik.apilens.client;

import java.net.URI;
import java.time.Duration;
import java.time.InstantSource;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import am.ik.apilens.ApiLensProperties;
import am.ik.apilens.record.CaptureInput;
import am.ik.apilens.record.RecordNormalizer;
import am.ik.apilens.record.RequestRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Buffers captured request records in memory and forwards them to the API Lens ingest
 * endpoint in batches.
 * <p>
 * {@link #capture(CaptureInput)} only touches memory and is safe to call from request
 * threads. Delivery happens on a background daemon thread, either periodically or when
 * the queue reaches the batch size, or synchronously through {@link #flushOnce()} and
 * {@link #flushAll()}. A batch that still fails after the configured retries is dropped
 * and never re-queued.
 * <p>
 * One instance is meant to be shared by the whole application; callers own its lifecycle
 * and must call {@link #shutdown(boolean)} or {@link #close()} when done.
 */
public class ApiLensClient implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(ApiLensClient.class);

	private final ApiLensProperties properties;

	private final URI endpoint;

	private final RecordNormalizer normalizer;

	private final BoundedRecordQueue queue;

	private final RetryingBatchSender sender;

	private final FlushScheduler flushScheduler;

	private final AtomicBoolean enabled;

	public ApiLensClient(ApiLensProperties properties, IngestTransport transport, InstantSource instantSource) {
		this(properties, transport, instantSource, RetryingBatchSender.Sleeper.THREAD);
	}

	ApiLensClient(ApiLensProperties properties, IngestTransport transport, InstantSource instantSource,
			RetryingBatchSender.Sleeper sleeper) {
		if (properties == null || properties.apiKey().isEmpty()) {
			throw new IllegalArgumentException("apiKey is required");
		}
		if (transport == null) {
			throw new IllegalArgumentException("transport is required");
		}
		this.properties = properties;
		this.endpoint = IngestEndpointResolver.resolve(properties.baseUrl(), properties.ingestPath());
		this.normalizer = new RecordNormalizer(properties.environment(),
				properties.requestLogging().maxPayloadBytes(), instantSource);
		this.queue = new BoundedRecordQueue(properties.maxQueueSize());
		HttpBatchSender batchSender = new HttpBatchSender(transport, this.endpoint, properties.apiKey(),
				properties.userAgent(), HttpBatchSender.createObjectMapper());
		this.sender = new RetryingBatchSender(batchSender, properties.maxRetries(), properties.retryBackoffBase(),
				properties.retryBackoffMax(), sleeper);
		this.flushScheduler = new FlushScheduler(this::flushPending, properties.flushInterval(),
				deliveryDeadline(properties, this.sender));
		this.enabled = new AtomicBoolean(properties.enabled());
		log.info("msg=\"API Lens client initialized\" endpoint={} environment={} batchSize={} enabled={}",
				this.endpoint, properties.environment(), properties.batchSize(), properties.enabled());
		start();
	}

	/**
	 * Creates a client posting through a {@link RestClientIngestTransport} and using the
	 * system clock.
	 */
	public static ApiLensClient create(ApiLensProperties properties) {
		return new ApiLensClient(properties, RestClientIngestTransport.create(properties.timeout()),
				InstantSource.system());
	}

	public boolean isEnabled() {
		return this.enabled.get();
	}

	/**
	 * Arms the periodic flush timer if the client is enabled. No-op when already running.
	 */
	public void start() {
		if (!isEnabled()) {
			return;
		}
		this.flushScheduler.start();
	}

	/**
	 * Disarms the periodic flush timer. Queued records stay queued.
	 */
	public void stop() {
		this.flushScheduler.stop();
	}

	public boolean isRunning() {
		return this.flushScheduler.isActive();
	}

	/**
	 * Normalizes the input and enqueues it. Never performs I/O and never throws for bad
	 * input.
	 */
	public void capture(CaptureInput input) {
		captureRecord(this.normalizer.normalize(input));
	}

	/**
	 * Enqueues each input in order.
	 */
	public void captureMany(List<CaptureInput> inputs) {
		if (inputs == null) {
			return;
		}
		for (CaptureInput input : inputs) {
			capture(input);
		}
	}

	/**
	 * Enqueues an already normalized record. When the queue is full the oldest record is
	 * dropped; when it reaches the batch size a background flush is requested.
	 */
	public void captureRecord(RequestRecord record) {
		if (!isEnabled() || record == null) {
			return;
		}
		int size = this.queue.offer(record);
		if (size >= this.properties.batchSize()) {
			this.flushScheduler.requestFlush();
		}
	}

	/**
	 * Sends up to one batch from the front of the queue.
	 * @return the number of records delivered, 0 if the queue was empty or the batch was
	 * dropped
	 */
	public int flushOnce() {
		List<RequestRecord> batch = this.queue.drain(this.properties.batchSize());
		if (batch.isEmpty()) {
			return 0;
		}
		if (!this.sender.send(batch)) {
			log.warn("msg=\"API Lens ingest failed; dropping batch\" batchSize={}", batch.size());
			return 0;
		}
		log.debug("msg=\"API Lens batch delivered\" batchSize={}", batch.size());
		return batch.size();
	}

	/**
	 * Background flush: sends one batch, then keeps sending while a full batch is
	 * waiting, so a burst of captures does not wait for the timer.
	 */
	void flushPending() {
		int sent = flushOnce();
		while (sent > 0 && this.queue.size() >= this.properties.batchSize()) {
			sent = flushOnce();
		}
	}

	/**
	 * Flushes until the queue is empty or a batch fails.
	 * @return the total number of records delivered
	 */
	public int flushAll() {
		int total = 0;
		while (!this.queue.isEmpty()) {
			int sent = flushOnce();
			if (sent <= 0) {
				break;
			}
			total += sent;
		}
		return total;
	}

	/**
	 * Disables capturing, stops the timer and waits for a background flush that is
	 * already sending. If requested, the rest of the queue is then drained on the calling
	 * thread.
	 */
	public void shutdown(boolean flush) {
		this.enabled.set(false);
		this.flushScheduler.shutdown();
		int sent = flush ? flushAll() : 0;
		log.info("msg=\"API Lens client shut down\" flushed={} remaining={} dropped={}", sent, this.queue.size(),
				this.queue.droppedCount());
	}

	/**
	 * Upper bound for delivering one batch: every attempt running into the timeout plus
	 * all backoff delays in between.
	 */
	private static Duration deliveryDeadline(ApiLensProperties properties, RetryingBatchSender sender) {
		Duration deadline = properties.timeout().multipliedBy(2L * (properties.maxRetries() + 1));
		for (int attempt = 0; attempt < properties.maxRetries(); attempt++) {
			deadline = deadline.plus(sender.backoff(attempt));
		}
		return deadline;
	}

	/**
	 * Same as {@code shutdown(true)}.
	 */
	@Override
	public void close() {
		shutdown(true);
	}

	public long droppedCount() {
		return this.queue.droppedCount();
	}

	public int queueSize() {
		return this.queue.size();
	}

	/**
	 * Returns a snapshot of the queued records, oldest first.
	 */
	public List<RequestRecord> queuedRecords() {
		return this.queue.snapshot();
	}

	public ApiLensProperties properties() {
		return this.properties;
	}

	public URI endpoint() {
		return this.endpoint;
	}

}
