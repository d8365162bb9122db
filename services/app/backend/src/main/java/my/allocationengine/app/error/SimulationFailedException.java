package my.allocationengine.app.error;

public class SimulationFailedException extends AllocationEngineException {
	private final String reference;

	public SimulationFailedException(String message, String reference, Throwable cause) {
		super(message, ErrorCode.SIMULATION_FAILED, cause);
		this.reference = reference;
	}

	public String getReference() {
		return reference;
	}
}
