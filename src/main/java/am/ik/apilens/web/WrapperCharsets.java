package am.ik.apilens.web;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;

final class WrapperCharsets {

	private WrapperCharsets() {
	}

	static Charset forName(String name, Charset fallback) {
		if (name == null || name.isBlank()) {
			return fallback;
		}
		try {
			return Charset.forName(name);
		}
		catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
			return fallback;
		}
	}

}
