package my.allocationengine.app.error;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

public record EngineWarning(WarningCode code, String message) {
	public EngineWarning {
		Objects.requireNonNull(code, "code");
		message = message == null ? "" : message;
	}

	public static EngineWarning of(WarningCode code, String message) {
		return new EngineWarning(code, message);
	}

	@SafeVarargs
	public static List<EngineWarning> merge(Collection<EngineWarning>... groups) {
		LinkedHashSet<EngineWarning> merged = new LinkedHashSet<>();
		for (Collection<EngineWarning> group : groups) {
			if (group != null) {
				merged.addAll(group);
			}
		}
		return List.copyOf(new ArrayList<>(merged));
	}
}
