package umms.core.coordinatesystem;

public class PermutationNotFoundException extends RuntimeException {

	private static final long serialVersionUID = -2905716392219554211L;

	public PermutationNotFoundException(String chr, int n)
	{
		super("Unable to place a control window on " + chr + " after " + n + " tries.");
	}
}
