package umms.core.feature;

/**
 * A background window drawn at random from the genome.
 */
public class ControlWindow extends GenomeWindow {

	public ControlWindow(String chr, int start, int width) {
		super(chr, start, width);
	}
}
