package com.gigateer.ingestor.domain.model;

import java.math.BigDecimal;

/**
 * Ticket price as advertised. Min and max are equal for a single price;
 * both are null when only the raw text could be kept.
 */
public class PriceInfo {

    private BigDecimal min;

    private BigDecimal max;

    /** ISO currency code, e.g. "GBP". */
    private String currency;

    /** Price text exactly as listed, e.g. "£10 - £15 adv". */
    private String text;

    public BigDecimal getMin() {
        return min;
    }

    public void setMin(BigDecimal min) {
        this.min = min;
    }

    public BigDecimal getMax() {
        return max;
    }

    public void setMax(BigDecimal max) {
        this.max = max;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }
}
