package com.example.invoiceverify.application.service;

import com.example.invoiceverify.config.InvoiceProperties;
import com.example.invoiceverify.domain.model.FieldNames;
import com.example.invoiceverify.domain.model.FieldSet;
import com.example.invoiceverify.domain.model.FieldValue;
import com.example.invoiceverify.domain.model.LineItem;
import com.example.invoiceverify.domain.model.VerificationReport;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Application-layer service that cross-checks extracted totals against the sum of the line items.
 * This is the only implementation of the check; every driver and the API delegate here.
 * <p>
 * The computation is pure: the same fields and items always produce an equal report. Problems with
 * the inputs are returned as failure reports, never thrown.
 */
@Service
public class VerificationService {

    private final double marginTolerance;
    private final double epsilon;

    /**
     * @param properties externalized verification settings (margin tolerance, division guard)
     */
    public VerificationService(InvoiceProperties properties) {
        this.marginTolerance = properties.verification().marginTolerance();
        this.epsilon = properties.verification().epsilon();
    }

    /**
     * Verifies one document.
     *
     * @param fields    extracted and supplied header fields
     * @param lineItems reconstructed line items
     * @return success report with all figures, or a failure report when an amount cannot be read
     *         or the figures overflow
     */
    public VerificationReport verify(FieldSet fields, List<LineItem> lineItems) {
        FieldSet source = fields == null ? FieldSet.empty() : fields;
        double computedSubtotal = lineItems == null ? 0.0
                : lineItems.stream().mapToDouble(LineItem::rowTotal).sum();

        double extractedSubtotal;
        double gst;
        double discount;
        double extractedTotal;
        try {
            extractedSubtotal = amount(source, FieldNames.SUBTOTAL);
            gst = amount(source, FieldNames.GST_AMOUNT);
            discount = amount(source, FieldNames.DISCOUNT);
            extractedTotal = amount(source, FieldNames.TOTAL);
        } catch (AmountCoercionException ex) {
            return VerificationReport.failure("Value extraction error: " + ex.getMessage());
        }

        double computedTotal = computedSubtotal + gst - discount;
        double errorMargin = Math.abs(computedTotal - extractedTotal);
        boolean verified = errorMargin < marginTolerance;
        double confidence = Math.max(0.0, 1.0 - errorMargin / (extractedTotal + epsilon));
        if (!Double.isFinite(computedTotal) || !Double.isFinite(errorMargin) || !Double.isFinite(confidence)) {
            return VerificationReport.failure("Arithmetic error: figures cannot be compared (computed total "
                    + computedTotal + ", error margin " + errorMargin + ", confidence " + confidence + ")");
        }

        return VerificationReport.success(
                verified,
                round(confidence, 3),
                round(errorMargin, 2),
                extractedSubtotal,
                round(computedSubtotal, 2),
                extractedTotal,
                round(computedTotal, 2),
                gst,
                discount
        );
    }

    private double amount(FieldSet fields, String name) {
        FieldValue field = fields.get(name)
                .orElseThrow(() -> new AmountCoercionException("field '" + name + "' is missing"));
        if (!field.present()) {
            throw new AmountCoercionException("field '" + name + "' has no value");
        }
        OptionalDouble parsed = NumericText.parse(field.value());
        if (parsed.isEmpty()) {
            throw new AmountCoercionException("field '" + name + "' is not numeric: '" + field.value() + "'");
        }
        return parsed.getAsDouble();
    }

    private static double round(double value, int scale) {
        // exact binary value, so 2.675 rounds to 2.67
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Local signal used to abort the computation on the first unreadable amount.
     */
    private static final class AmountCoercionException extends RuntimeException {

        AmountCoercionException(String message) {
            super(message, null, false, false);
        }
    }
}
