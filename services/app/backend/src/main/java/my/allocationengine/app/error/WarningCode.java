package my.allocationengine.app.error;

import java.util.Locale;

public enum WarningCode {
	INSUFFICIENT_DATA("insufficient_data"),
	SINGULAR_BLEND("singular_blend"),
	REGULARIZED_COVARIANCE("regularized_covariance"),
	CLAMPED_CORRELATION("clamped_correlation"),
	DEGENERATE_RATIO("degenerate_ratio");

	private final String id;

	WarningCode(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}

	public static WarningCode from(String raw) {
		if (raw == null || raw.isBlank()) {
			throw new IllegalArgumentException("Warning code is required");
		}
		String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
		for (WarningCode code : values()) {
			if (code.id.equals(normalized)) {
				return code;
			}
		}
		throw new IllegalArgumentException("Unknown warning code: " + raw);
	}
}
