package com.scosim.simulator.service.event;

import com.scosim.simulator.model.EventRecord;

import java.util.Optional;

/**
 * Parses {@code timestamp|frame_index|scan_frame_index|kind_code}.
 */
public final class EventRecordParser {

    static final String SEPARATOR = "\\|";
    static final int FIELD_COUNT = 4;

    private EventRecordParser() {
    }

    /**
     * @return the record, or empty if the text does not have exactly four fields or the kind code is not an integer
     */
    public static Optional<EventRecord> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String[] fields = text.split(SEPARATOR, -1);
        if (fields.length != FIELD_COUNT) {
            return Optional.empty();
        }
        int kindCode;
        try {
            kindCode = Integer.parseInt(fields[3].trim());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.of(new EventRecord(fields[0], fields[1], fields[2], kindCode));
    }
}
