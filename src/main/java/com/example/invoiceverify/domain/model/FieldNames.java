package com.example.invoiceverify.domain.model;

import java.util.List;

/**
 * Persisted field names used in {@code <prefix>_fields.json}.
 */
public final class FieldNames {

    public static final String INVOICE_NUMBER = "invoice_number";
    public static final String DATE = "date";
    public static final String GST_NUMBER = "gst_number";
    public static final String PO_NUMBER = "po_number";
    public static final String BILL_TO = "bill_to";
    public static final String SHIP_TO = "ship_to";
    public static final String BILL_TO_ADDRESS = "bill_to_address";
    public static final String SHIP_TO_ADDRESS = "ship_to_address";

    public static final String SUBTOTAL = "subtotal";
    public static final String GST_AMOUNT = "gst_amount";
    public static final String DISCOUNT = "discount";
    public static final String TOTAL = "total";

    /** Regex-driven header fields, in extraction order. */
    public static final List<String> REGEX_FIELDS = List.of(INVOICE_NUMBER, DATE, GST_NUMBER, PO_NUMBER);

    /** Amount fields supplied from outside the extractor and read by verification. */
    public static final List<String> AMOUNT_FIELDS = List.of(SUBTOTAL, GST_AMOUNT, DISCOUNT, TOTAL);

    private FieldNames() {
    }
}
