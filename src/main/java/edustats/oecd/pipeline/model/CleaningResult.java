package edustats.oecd.pipeline.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one cleaner pass: surviving records in input order plus a tally
 * of dropped rows per reason.
 */
public class CleaningResult<T extends CleanRecord> {

    private final int inputCount;
    private final List<T> records;
    private final Map<DropReason, Integer> drops;

    public CleaningResult(int inputCount, List<T> records, Map<DropReason, Integer> drops) {
        this.inputCount = inputCount;
        this.records = Collections.unmodifiableList(records);
        EnumMap<DropReason, Integer> copy = new EnumMap<>(DropReason.class);
        copy.putAll(drops);
        this.drops = Collections.unmodifiableMap(copy);
    }

    public int getInputCount() {
        return inputCount;
    }

    public List<T> getRecords() {
        return records;
    }

    public Map<DropReason, Integer> getDrops() {
        return drops;
    }

    public int getDropCount(DropReason reason) {
        return drops.getOrDefault(reason, 0);
    }

    public int getTotalDropped() {
        return drops.values().stream().mapToInt(Integer::intValue).sum();
    }
}
