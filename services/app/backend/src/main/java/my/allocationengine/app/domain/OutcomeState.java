package my.allocationengine.app.domain;

public enum OutcomeState {
	PROSPECT,
	ENGAGED,
	RESPONDED,
	CONVERTED,
	LAPSED;

	public boolean isTerminal() {
		return this == CONVERTED || this == LAPSED;
	}

	public OutcomeState next() {
		return switch (this) {
			case PROSPECT -> ENGAGED;
			case ENGAGED -> RESPONDED;
			case RESPONDED -> CONVERTED;
			case CONVERTED, LAPSED -> this;
		};
	}
}
