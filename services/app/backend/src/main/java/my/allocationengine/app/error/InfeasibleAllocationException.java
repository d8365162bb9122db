package my.allocationengine.app.error;

public class InfeasibleAllocationException extends AllocationEngineException {
	public InfeasibleAllocationException(String message) {
		super(message, ErrorCode.INFEASIBLE);
	}
}
