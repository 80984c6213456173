package am.ik.apilens.client;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Runs the flush task on a single daemon thread, either periodically while active or
 * on demand. On-demand requests are coalesced: while one is pending, further requests
 * are absorbed by it.
 */
public class FlushScheduler {

	private static final Logger log = LoggerFactory.getLogger(FlushScheduler.class);

	private final ThreadPoolTaskScheduler taskScheduler;

	private final Runnable flushTask;

	private final Duration interval;

	private final AtomicBoolean flushRequested = new AtomicBoolean();

	private final Object monitor = new Object();

	private ScheduledFuture<?> timer;

	private boolean shutdown;

	/**
	 * @param flushTask task run by the timer and by {@link #requestFlush()}
	 * @param interval delay between the end of one timed flush and the start of the next
	 * @param shutdownTimeout how long {@link #shutdown()} waits for a running flush
	 */
	public FlushScheduler(Runnable flushTask, Duration interval, Duration shutdownTimeout) {
		this.flushTask = flushTask;
		this.interval = interval;
		ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
		scheduler.setPoolSize(1);
		scheduler.setThreadNamePrefix("apilens-flush-");
		scheduler.setDaemon(true);
		scheduler.setWaitForTasksToCompleteOnShutdown(true);
		scheduler.setAwaitTerminationMillis(shutdownTimeout.toMillis());
		scheduler.initialize();
		this.taskScheduler = scheduler;
	}

	/**
	 * Arms the periodic timer. Does nothing if it is already armed or the scheduler was
	 * shut down.
	 * @return true if the timer was armed by this call
	 */
	public boolean start() {
		synchronized (this.monitor) {
			if (this.timer != null || this.shutdown) {
				return false;
			}
			this.timer = this.taskScheduler.scheduleWithFixedDelay(this::runFlush, Instant.now().plus(this.interval),
					this.interval);
			return true;
		}
	}

	/**
	 * Disarms the periodic timer. Idempotent.
	 */
	public void stop() {
		synchronized (this.monitor) {
			if (this.timer != null) {
				this.timer.cancel(false);
				this.timer = null;
			}
		}
	}

	public boolean isActive() {
		synchronized (this.monitor) {
			return this.timer != null;
		}
	}

	/**
	 * Schedules one flush on the background thread without waiting for it.
	 */
	public void requestFlush() {
		synchronized (this.monitor) {
			if (this.shutdown) {
				return;
			}
		}
		if (!this.flushRequested.compareAndSet(false, true)) {
			return;
		}
		try {
			this.taskScheduler.execute(() -> {
				this.flushRequested.set(false);
				runFlush();
			});
		}
		catch (TaskRejectedException ex) {
			this.flushRequested.set(false);
			log.debug("Flush request rejected, scheduler is shutting down", ex);
		}
	}

	/**
	 * Disarms the timer and releases the background thread. A flush that is already
	 * running, or was requested before this call, completes first; the caller blocks for
	 * at most the shutdown timeout.
	 */
	public void shutdown() {
		synchronized (this.monitor) {
			stop();
			if (this.shutdown) {
				return;
			}
			this.shutdown = true;
		}
		this.taskScheduler.shutdown();
	}

	private void runFlush() {
		try {
			this.flushTask.run();
		}
		catch (RuntimeException ex) {
			log.error("Unexpected error while flushing API Lens queue", ex);
		}
	}

}
