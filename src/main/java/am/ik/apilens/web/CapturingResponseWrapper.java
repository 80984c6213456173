package am.ik.apilens.web;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;

/**
 * Response wrapper that passes all output through to the original response while
 * counting the bytes written and keeping a bounded prefix of them.
 */
class CapturingResponseWrapper extends HttpServletResponseWrapper {

	private final BodyCapture capture;

	private CapturingServletOutputStream outputStream;

	private CapturingPrintWriter writer;

	CapturingResponseWrapper(HttpServletResponse response, int captureLimit) {
		super(response);
		this.capture = new BodyCapture(captureLimit);
	}

	@Override
	public ServletOutputStream getOutputStream() throws IOException {
		if (this.outputStream == null) {
			this.outputStream = new CapturingServletOutputStream(super.getOutputStream(), this.capture);
		}
		return this.outputStream;
	}

	@Override
	public PrintWriter getWriter() throws IOException {
		if (this.writer == null) {
			this.writer = new CapturingPrintWriter(super.getWriter(),
					WrapperCharsets.forName(getCharacterEncoding(), StandardCharsets.ISO_8859_1), this.capture);
		}
		return this.writer;
	}

	@Override
	public void reset() {
		super.reset();
		this.outputStream = null;
		this.writer = null;
		this.capture.reset();
	}

	@Override
	public void resetBuffer() {
		super.resetBuffer();
		this.capture.reset();
	}

	// the container discards the buffered body and renders its own error page
	@Override
	public void sendError(int sc) throws IOException {
		super.sendError(sc);
		this.capture.reset();
	}

	@Override
	public void sendError(int sc, String msg) throws IOException {
		super.sendError(sc, msg);
		this.capture.reset();
	}

	long bytesWritten() {
		return this.capture.total();
	}

	String capturedBody() {
		return this.capture.text(StandardCharsets.UTF_8);
	}

}
