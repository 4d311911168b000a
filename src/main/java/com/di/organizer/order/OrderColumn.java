package com.di.organizer.order;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fixed column set of the production order table, in file order.
 */
public enum OrderColumn {

    PRIORITY("Priority", Kind.INTEGER),
    STATUS("Status", Kind.TEXT),
    PRODUCTION_ORDER("Production_order", Kind.TEXT),
    PART_TYPE("Part_type", Kind.TEXT),
    PIECES_FINISHED("Pieces_finished", Kind.INTEGER),
    PIECES_INTENDED("Pieces_intended", Kind.INTEGER),
    DELIVERY_DATE("Delivery_date", Kind.DATE),
    SCHEDULED_DATE("Scheduled_date", Kind.DATE);

    /** How raw values of a column are coerced. */
    public enum Kind {
        INTEGER,
        TEXT,
        DATE
    }

    private static final List<String> HEADERS = Collections.unmodifiableList(
            Arrays.stream(values()).map(OrderColumn::getHeader).collect(Collectors.toList()));

    private final String header;
    private final Kind kind;

    OrderColumn(String header, Kind kind) {
        this.header = header;
        this.kind = kind;
    }

    public String getHeader() {
        return header;
    }

    public Kind getKind() {
        return kind;
    }

    /** Value used when a row has no entry for this column. */
    public Object defaultValue() {
        return kind == Kind.INTEGER ? (Object) 0 : "";
    }

    /** Header names in file order. */
    public static List<String> headers() {
        return HEADERS;
    }
}
