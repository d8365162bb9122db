package my.allocationengine.app.error;

public enum ErrorCode {
	INFEASIBLE("infeasible"),
	SIMULATION_FAILED("simulation_failed");

	private final String id;

	ErrorCode(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}
}
