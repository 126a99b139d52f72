package broad.core.datastructures;

/**
 * Self balancing (AVL) tree of closed integer intervals, keyed on start and augmented with
 * the largest end found in each subtree. Insertion and the overlap query are O(log n).
 * Intervals may overlap each other and duplicates are kept.
 *
 * @param <V> value stored with each interval
 */
public class IntervalTree<V> {

	private Node<V> root;
	private int size;

	private static class Node<V> {
		private final int start;
		private final int end;
		private final V value;
		private int maxEnd;
		private int height;
		private Node<V> left;
		private Node<V> right;

		Node(int start, int end, V value) {
			this.start = start;
			this.end = end;
			this.value = value;
			this.maxEnd = end;
			this.height = 1;
		}
	}

	/**
	 * Add the closed interval [start, end]
	 */
	public void put(int start, int end, V value) {
		if (end < start) {
			throw new IllegalArgumentException("Interval end " + end + " is before start " + start);
		}
		root = insert(root, new Node<V>(start, end, value));
		size++;
	}

	public int size() {
		return size;
	}

	public boolean isEmpty() {
		return size == 0;
	}

	/**
	 * @return true if any stored interval shares at least one position with [start, end]
	 */
	public boolean hasOverlapping(int start, int end) {
		Node<V> n = root;
		while (n != null) {
			if (n.start <= end && start <= n.end) {
				return true;
			}
			// if the left subtree reaches start it must hold an overlap or nothing right of it can
			if (n.left != null && n.left.maxEnd >= start) {
				n = n.left;
			} else {
				n = n.right;
			}
		}
		return false;
	}

	private Node<V> insert(Node<V> n, Node<V> node) {
		if (n == null) {
			return node;
		}
		if (node.start < n.start) {
			n.left = insert(n.left, node);
		} else {
			n.right = insert(n.right, node);
		}
		update(n);
		return balance(n);
	}

	private Node<V> balance(Node<V> n) {
		int bf = height(n.left) - height(n.right);
		if (bf > 1) {
			if (height(n.left.left) < height(n.left.right)) {
				n.left = rotateLeft(n.left);
			}
			return rotateRight(n);
		}
		if (bf < -1) {
			if (height(n.right.right) < height(n.right.left)) {
				n.right = rotateRight(n.right);
			}
			return rotateLeft(n);
		}
		return n;
	}

	private Node<V> rotateRight(Node<V> n) {
		Node<V> l = n.left;
		n.left = l.right;
		l.right = n;
		update(n);
		update(l);
		return l;
	}

	private Node<V> rotateLeft(Node<V> n) {
		Node<V> r = n.right;
		n.right = r.left;
		r.left = n;
		update(n);
		update(r);
		return r;
	}

	private void update(Node<V> n) {
		n.height = 1 + Math.max(height(n.left), height(n.right));
		int max = n.end;
		if (n.left != null) {
			max = Math.max(max, n.left.maxEnd);
		}
		if (n.right != null) {
			max = Math.max(max, n.right.maxEnd);
		}
		n.maxEnd = max;
	}

	private static int height(Node<?> n) {
		return n == null ? 0 : n.height;
	}

	int height() {
		return height(root);
	}
}
