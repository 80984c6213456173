package am.ik.apilens.web;

import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * Counts the bytes passing through a request or response body and keeps a copy of at
 * most {@code limit} leading bytes. The copy never grows past the limit.
 */
final class BodyCapture {

	private static final int INITIAL_CAPACITY = 256;

	private final int limit;

	private byte[] buffer = new byte[0];

	private int buffered;

	private long total;

	BodyCapture(int limit) {
		this.limit = Math.max(limit, 0);
	}

	synchronized void record(int b) {
		this.total++;
		if (this.buffered < this.limit) {
			ensureCapacity(this.buffered + 1);
			this.buffer[this.buffered++] = (byte) b;
		}
	}

	synchronized void record(byte[] b, int off, int len) {
		if (len <= 0) {
			return;
		}
		this.total += len;
		int room = this.limit - this.buffered;
		if (room <= 0) {
			return;
		}
		int n = Math.min(len, room);
		ensureCapacity(this.buffered + n);
		System.arraycopy(b, off, this.buffer, this.buffered, n);
		this.buffered += n;
	}

	/**
	 * Forgets everything recorded so far, for a response whose buffer was discarded.
	 */
	synchronized void reset() {
		this.buffered = 0;
		this.total = 0;
	}

	/**
	 * Total number of bytes seen, including those beyond the limit.
	 */
	synchronized long total() {
		return this.total;
	}

	synchronized int buffered() {
		return this.buffered;
	}

	synchronized String text(Charset charset) {
		return new String(this.buffer, 0, this.buffered, charset);
	}

	private void ensureCapacity(int required) {
		if (required <= this.buffer.length) {
			return;
		}
		int capacity = Math.max(this.buffer.length * 2, INITIAL_CAPACITY);
		this.buffer = Arrays.copyOf(this.buffer, Math.min(Math.max(capacity, required), this.limit));
	}

}
