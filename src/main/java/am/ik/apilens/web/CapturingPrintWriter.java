package am.ik.apilens.web;

import java.io.PrintWriter;
import java.nio.charset.Charset;

/**
 * Forwards characters to the response's own writer and records them, encoded with the
 * response charset.
 */
class CapturingPrintWriter extends PrintWriter {

	private final Charset charset;

	private final BodyCapture capture;

	CapturingPrintWriter(PrintWriter delegate, Charset charset, BodyCapture capture) {
		super(delegate);
		this.charset = charset;
		this.capture = capture;
	}

	@Override
	public void write(int c) {
		super.write(c);
		record(String.valueOf((char) c));
	}

	@Override
	public void write(char[] buf, int off, int len) {
		super.write(buf, off, len);
		record(new String(buf, off, len));
	}

	@Override
	public void write(String s, int off, int len) {
		super.write(s, off, len);
		record(s.substring(off, off + len));
	}

	@Override
	public void println() {
		write(System.lineSeparator());
	}

	private void record(String chars) {
		byte[] bytes = chars.getBytes(this.charset);
		this.capture.record(bytes, 0, bytes.length);
	}

}
