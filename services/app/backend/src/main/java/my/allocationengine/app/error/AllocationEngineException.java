package my.allocationengine.app.error;

public class AllocationEngineException extends RuntimeException {
	private final ErrorCode errorCode;

	public AllocationEngineException(String message, ErrorCode errorCode) {
		super(message);
		this.errorCode = errorCode;
	}

	public AllocationEngineException(String message, ErrorCode errorCode, Throwable cause) {
		super(message, cause);
		this.errorCode = errorCode;
	}

	public ErrorCode getErrorCode() {
		return errorCode;
	}
}
