package umms.core.annotation.filter;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.collections15.Predicate;

import umms.core.feature.Window;

/**
 * Pass windows lying on one of the allowed chromosomes
 */
public class ChromosomeFilter<T extends Window> implements Predicate<T> {

	private final Set<String> allowed;

	public ChromosomeFilter(Collection<String> chromosomes) {
		this.allowed = new HashSet<String>(chromosomes);
	}

	@Override
	public boolean evaluate(T window) {
		return allowed.contains(window.getChr());
	}
}
