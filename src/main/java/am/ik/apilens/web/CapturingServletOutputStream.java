package am.ik.apilens.web;

import java.io.IOException;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;

/**
 * Forwards every call to the wrapped stream and records the bytes that were written.
 */
class CapturingServletOutputStream extends ServletOutputStream {

	private final ServletOutputStream delegate;

	private final BodyCapture capture;

	CapturingServletOutputStream(ServletOutputStream delegate, BodyCapture capture) {
		this.delegate = delegate;
		this.capture = capture;
	}

	@Override
	public void write(int b) throws IOException {
		this.delegate.write(b);
		this.capture.record(b);
	}

	@Override
	public void write(byte[] b, int off, int len) throws IOException {
		this.delegate.write(b, off, len);
		this.capture.record(b, off, len);
	}

	@Override
	public void flush() throws IOException {
		this.delegate.flush();
	}

	@Override
	public void close() throws IOException {
		this.delegate.close();
	}

	@Override
	public boolean isReady() {
		return this.delegate.isReady();
	}

	@Override
	public void setWriteListener(WriteListener writeListener) {
		this.delegate.setWriteListener(writeListener);
	}

}
