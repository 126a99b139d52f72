package umms.core.sequence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Sequence records keyed by identifier that iterate in the order they were first added.
 * Order is part of the contract: feature rows and prediction records follow it.
 * Adding a record whose identifier is already present replaces the sequence in place.
 */
public class OrderedSequenceMap implements Iterable<SequenceRecord> {

	private final List<SequenceRecord> records = new ArrayList<SequenceRecord>();
	private final Map<String, Integer> index = new HashMap<String, Integer>();

	/**
	 * @return true if the record was new, false if it replaced an existing one
	 */
	public boolean put(SequenceRecord record) {
		Integer position = index.get(record.getId());
		if (position != null) {
			records.set(position, record);
			return false;
		}
		index.put(record.getId(), records.size());
		records.add(record);
		return true;
	}

	public SequenceRecord get(String id) {
		Integer position = index.get(id);
		return position == null ? null : records.get(position);
	}

	public SequenceRecord get(int position) {
		return records.get(position);
	}

	public int indexOf(String id) {
		Integer position = index.get(id);
		return position == null ? -1 : position;
	}

	public int size() {
		return records.size();
	}

	public boolean isEmpty() {
		return records.isEmpty();
	}

	public List<String> getIds() {
		List<String> ids = new ArrayList<String>(records.size());
		for (SequenceRecord r : records) {
			ids.add(r.getId());
		}
		return ids;
	}

	public List<String> getSequences() {
		List<String> seqs = new ArrayList<String>(records.size());
		for (SequenceRecord r : records) {
			seqs.add(r.getSequence());
		}
		return seqs;
	}

	public List<SequenceRecord> getRecords() {
		return Collections.unmodifiableList(records);
	}

	@Override
	public Iterator<SequenceRecord> iterator() {
		return getRecords().iterator();
	}
}
