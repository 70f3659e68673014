package choreo.util;

/**
 * 
 * A common abstract base for tree nodes that can be traced back to their
 * location in the choreography source.
 *
 */
public abstract class SourceLocatable {
	
	public abstract SourceLocation getLocation();

}
