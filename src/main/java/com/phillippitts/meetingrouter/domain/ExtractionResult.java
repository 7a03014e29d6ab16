package com.phillippitts.meetingrouter.domain;

import java.util.List;

/**
 * Output of the extraction service for one meeting.
 *
 * @param meetingSummary model-written summary, may be empty
 * @param items          extracted action items in model order
 */
public record ExtractionResult(String meetingSummary, List<ExtractedTaskItem> items) {

    public ExtractionResult {
        meetingSummary = meetingSummary == null ? "" : meetingSummary;
        items = items == null ? List.of() : List.copyOf(items);
    }

    public int itemCount() {
        return items.size();
    }
}
