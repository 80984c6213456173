package am.ik.apilens.web;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;

/**
 * Request wrapper that counts the body bytes read by the application and keeps a bounded
 * prefix of them.
 */
class CapturingRequestWrapper extends HttpServletRequestWrapper {

	private final BodyCapture capture;

	private CapturingServletInputStream inputStream;

	private BufferedReader reader;

	CapturingRequestWrapper(HttpServletRequest request, int captureLimit) {
		super(request);
		this.capture = new BodyCapture(captureLimit);
	}

	@Override
	public ServletInputStream getInputStream() throws IOException {
		if (this.inputStream == null) {
			this.inputStream = new CapturingServletInputStream(super.getInputStream(), this.capture);
		}
		return this.inputStream;
	}

	@Override
	public BufferedReader getReader() throws IOException {
		if (this.reader == null) {
			this.reader = new BufferedReader(new InputStreamReader(getInputStream(), charset()));
		}
		return this.reader;
	}

	long bytesRead() {
		return this.capture.total();
	}

	String capturedBody() {
		return this.capture.text(charset());
	}

	private Charset charset() {
		return WrapperCharsets.forName(getCharacterEncoding(), StandardCharsets.UTF_8);
	}

}
