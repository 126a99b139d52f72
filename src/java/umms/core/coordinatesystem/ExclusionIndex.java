package umms.core.coordinatesystem;

import java.util.HashMap;
import java.util.Map;

import broad.core.datastructures.IntervalTree;
import umms.core.feature.Window;

/**
 * Occupied intervals per chromosome. Seeded with the peak windows and grown with every
 * accepted control window. Not thread safe: a chromosome's tree must only be touched by
 * one thread at a time.
 */
public class ExclusionIndex {

	private final Map<String, IntervalTree<Window>> occupied = new HashMap<String, IntervalTree<Window>>();
	private int size;

	public ExclusionIndex() {
	}

	public ExclusionIndex(Iterable<? extends Window> windows) {
		addAll(windows);
	}

	public void add(Window window) {
		IntervalTree<Window> tree = occupied.get(window.getChr());
		if (tree == null) {
			tree = new IntervalTree<Window>();
			occupied.put(window.getChr(), tree);
		}
		tree.put(window.getStart(), window.getEnd(), window);
		size++;
	}

	public void addAll(Iterable<? extends Window> windows) {
		for (Window w : windows) {
			add(w);
		}
	}

	public boolean overlaps(Window window) {
		IntervalTree<Window> tree = occupied.get(window.getChr());
		return tree != null && tree.hasOverlapping(window.getStart(), window.getEnd());
	}

	public int size() {
		return size;
	}

	public int size(String chr) {
		IntervalTree<Window> tree = occupied.get(chr);
		return tree == null ? 0 : tree.size();
	}
}
