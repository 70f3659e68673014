package choreo;

public class ChoreoOptionException extends Exception {

	private static final long serialVersionUID = -3590216457023413772L;

	public ChoreoOptionException(String msg) {
		super(msg);
	}

	public ChoreoOptionException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
