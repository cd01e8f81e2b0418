package edustats.oecd.pipeline.service;

import edustats.oecd.pipeline.dto.DimensionDto;
import edustats.oecd.pipeline.exception.DecodeException;
import edustats.oecd.pipeline.model.FlatRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the sparse SDMX-JSON observation map into flat records.
 *
 * Observation keys are colon-joined positions, one per dimension, e.g.
 * {@code "0:3:1"}. Each position is looked up in the matching dimension's
 * value list; positions outside that list leave the field unset so the
 * record cleaner drops the row later.
 *
 * Output order is the iteration order of the observation map.
 */
@Service
@Slf4j
public class DimensionDecoder {

    private static final String KEY_SEPARATOR = ":";

    /**
     * Decode every observation.
     *
     * @param observations observation key to value list
     * @param dimensions   ordered observation dimensions
     * @return one record per observation, in map order
     * @throws DecodeException if any key holds a non-integer token
     */
    public List<FlatRecord> decode(Map<String, ? extends List<?>> observations, List<DimensionDto> dimensions) {
        List<FlatRecord> records = new ArrayList<>(observations.size());
        int skippedPositions = 0;

        for (Map.Entry<String, ? extends List<?>> observation : observations.entrySet()) {
            int[] indices = parseKey(observation.getKey());
            FlatRecord record = new FlatRecord();

            for (int i = 0; i < dimensions.size() && i < indices.length; i++) {
                DimensionDto dimension = dimensions.get(i);
                List<DimensionDto.Value> values = dimension.getValues();
                int index = indices[i];

                if (values == null || index < 0 || index >= values.size()) {
                    skippedPositions++;
                    continue;
                }

                record.put(dimensionName(dimension, i), valueName(values.get(index)));
            }

            List<?> observationValues = observation.getValue();
            if (observationValues != null && !observationValues.isEmpty()) {
                record.put(FlatRecord.VALUE_KEY, observationValues.get(0));
            }

            records.add(record);
        }

        if (skippedPositions > 0) {
            log.debug("Skipped {} out-of-range dimension positions while decoding {} observations",
                    skippedPositions, observations.size());
        }
        return records;
    }

    /**
     * Parse {@code "0:1:2"} into {@code [0, 1, 2]}.
     */
    int[] parseKey(String key) {
        String[] tokens = key.split(KEY_SEPARATOR, -1);
        int[] indices = new int[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            try {
                indices[i] = Integer.parseInt(tokens[i].trim());
            } catch (NumberFormatException e) {
                throw new DecodeException(key, e);
            }
        }
        return indices;
    }

    private String dimensionName(DimensionDto dimension, int position) {
        String name = dimension.getName();
        if (name == null) {
            return "dim_" + position;
        }
        return name;
    }

    private String valueName(DimensionDto.Value value) {
        if (value == null || value.getName() == null) {
            return "";
        }
        return value.getName();
    }
}
