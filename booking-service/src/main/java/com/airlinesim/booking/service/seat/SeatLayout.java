package com.airlinesim.booking.service.seat;

import com.airlinesim.booking.enums.SeatClass;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Cabin geometry shared by every flight: row count, seat letters and the row range of each class.
 */
@Getter
public final class SeatLayout {

    private final int rows;
    private final String letters;
    private final List<ClassRange> classRanges;

    private SeatLayout(int rows, String letters, List<ClassRange> classRanges) {
        this.rows = rows;
        this.letters = letters;
        this.classRanges = Collections.unmodifiableList(classRanges);
    }

    /**
     * Parses ranges written as {@code FIRST:1-2,BUSINESS:3-6,ECONOMY:7-30}.
     */
    public static SeatLayout parse(int rows, String letters, String classRanges) {
        if (rows <= 0) {
            throw new IllegalArgumentException("Seat map must have at least one row");
        }
        if (letters == null || letters.isBlank()) {
            throw new IllegalArgumentException("Seat map must have at least one seat letter");
        }

        List<ClassRange> ranges = new ArrayList<>();
        if (classRanges != null && !classRanges.isBlank()) {
            for (String part : classRanges.split(",")) {
                ranges.add(ClassRange.parse(part.trim()));
            }
        }
        return new SeatLayout(rows, letters.trim().toUpperCase(Locale.ROOT), ranges);
    }

    /**
     * Rows not covered by any range are economy.
     */
    public SeatClass classForRow(int row) {
        for (ClassRange range : classRanges) {
            if (row >= range.firstRow() && row <= range.lastRow()) {
                return range.seatClass();
            }
        }
        return SeatClass.ECONOMY;
    }

    public record ClassRange(SeatClass seatClass, int firstRow, int lastRow) {

        static ClassRange parse(String value) {
            String[] classAndRows = value.split(":");
            String[] bounds = classAndRows.length == 2 ? classAndRows[1].split("-") : new String[0];
            if (bounds.length != 2) {
                throw new IllegalArgumentException("Invalid seat class range: " + value);
            }

            SeatClass seatClass = SeatClass.valueOf(classAndRows[0].trim().toUpperCase(Locale.ROOT));
            int first = Integer.parseInt(bounds[0].trim());
            int last = Integer.parseInt(bounds[1].trim());
            if (first > last) {
                throw new IllegalArgumentException("Invalid seat class range: " + value);
            }
            return new ClassRange(seatClass, first, last);
        }
    }
}
