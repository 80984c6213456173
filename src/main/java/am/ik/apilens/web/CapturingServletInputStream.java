package am.ik.apilens.web;

import java.io.IOException;

import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;

/**
 * Forwards every call to the wrapped stream and records the bytes the application read.
 */
class CapturingServletInputStream extends ServletInputStream {

	private final ServletInputStream delegate;

	private final BodyCapture capture;

	CapturingServletInputStream(ServletInputStream delegate, BodyCapture capture) {
		this.delegate = delegate;
		this.capture = capture;
	}

	@Override
	public int read() throws IOException {
		int b = this.delegate.read();
		if (b >= 0) {
			this.capture.record(b);
		}
		return b;
	}

	@Override
	public int read(byte[] b, int off, int len) throws IOException {
		int n = this.delegate.read(b, off, len);
		if (n > 0) {
			this.capture.record(b, off, n);
		}
		return n;
	}

	@Override
	public boolean isFinished() {
		return this.delegate.isFinished();
	}

	@Override
	public boolean isReady() {
		return this.delegate.isReady();
	}

	@Override
	public void setReadListener(ReadListener readListener) {
		this.delegate.setReadListener(readListener);
	}

	@Override
	public int available() throws IOException {
		return this.delegate.available();
	}

	@Override
	public void close() throws IOException {
		this.delegate.close();
	}

}
