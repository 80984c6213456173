package am.ik.apilens.client;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import am.ik.apilens.record.RequestRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory FIFO of records with a fixed capacity. When full, the oldest record is
 * dropped to make room for the new one and the dropped counter is incremented.
 */
public class BoundedRecordQueue {

	private static final Logger log = LoggerFactory.getLogger(BoundedRecordQueue.class);

	private final ArrayDeque<RequestRecord> records = new ArrayDeque<>();

	private final ReentrantLock lock = new ReentrantLock();

	private final AtomicLong droppedCount = new AtomicLong();

	private final int capacity;

	public BoundedRecordQueue(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be >= 1");
		}
		this.capacity = capacity;
	}

	/**
	 * Appends the record, evicting the oldest one if the queue is at capacity.
	 * @return the queue length after the append
	 */
	public int offer(RequestRecord record) {
		RequestRecord dropped = null;
		int size;
		this.lock.lock();
		try {
			if (this.records.size() >= this.capacity) {
				dropped = this.records.pollFirst();
				this.droppedCount.incrementAndGet();
			}
			this.records.addLast(record);
			size = this.records.size();
		}
		finally {
			this.lock.unlock();
		}
		if (dropped != null && log.isDebugEnabled()) {
			log.debug("msg=\"Queue full, dropped oldest record\" path={} droppedCount={}", dropped.path(),
					this.droppedCount.get());
		}
		return size;
	}

	/**
	 * Removes up to {@code maxRecords} records from the front of the queue in one step.
	 * @return the removed records, oldest first; empty when the queue is empty
	 */
	public List<RequestRecord> drain(int maxRecords) {
		this.lock.lock();
		try {
			int n = Math.min(maxRecords, this.records.size());
			if (n <= 0) {
				return List.of();
			}
			List<RequestRecord> batch = new ArrayList<>(n);
			for (int i = 0; i < n; i++) {
				batch.add(this.records.pollFirst());
			}
			return batch;
		}
		finally {
			this.lock.unlock();
		}
	}

	public int size() {
		this.lock.lock();
		try {
			return this.records.size();
		}
		finally {
			this.lock.unlock();
		}
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * Returns a copy of the queued records, oldest first.
	 */
	public List<RequestRecord> snapshot() {
		this.lock.lock();
		try {
			return List.copyOf(this.records);
		}
		finally {
			this.lock.unlock();
		}
	}

	/**
	 * Number of records evicted because the queue was full. Never decreases.
	 */
	public long droppedCount() {
		return this.droppedCount.get();
	}

	public int capacity() {
		return this.capacity;
	}

}
