package choreo.trans;

import choreo.ChoreoException;

/**
 * Exception raised while expanding or analyzing a choreography
 *
 */
public class ChoreoTransException extends ChoreoException {

	private static final long serialVersionUID = 4120874471356220761L;
	private static final String prefix = "Analysis Error";

	public ChoreoTransException(String msg) {
		super(prefix, msg);
	}

}
