package com.gigateer.ingestor.application.normalize;

import com.gigateer.ingestor.domain.model.PriceInfo;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads ticket prices such as "£12.50", "£10 - £15 adv" or "Free entry".
 * Text without a recognisable amount is kept as text only.
 */
final class PriceParser {

    private static final Pattern AMOUNT = Pattern.compile("([£€$])?\\s*(\\d+(?:\\.\\d{1,2})?)");
    private static final Pattern FREE = Pattern.compile("\\bfree\\b", Pattern.CASE_INSENSITIVE);
    private static final Map<String, String> CURRENCIES = Map.of("£", "GBP", "€", "EUR", "$", "USD");

    private PriceParser() {
    }

    static PriceInfo parse(String raw) {
        String text = NormalizationUtils.collapseWhitespace(raw);
        if (text == null) {
            return null;
        }

        PriceInfo price = new PriceInfo();
        price.setText(text);

        List<BigDecimal> amounts = new ArrayList<>();
        String currency = null;
        Matcher matcher = AMOUNT.matcher(text);
        while (matcher.find()) {
            amounts.add(new BigDecimal(matcher.group(2)));
            if (currency == null && matcher.group(1) != null) {
                currency = CURRENCIES.get(matcher.group(1));
            }
        }

        if (amounts.isEmpty()) {
            if (FREE.matcher(text.toLowerCase(Locale.ROOT)).find()) {
                price.setMin(BigDecimal.ZERO);
                price.setMax(BigDecimal.ZERO);
            }
            return price;
        }

        // bare numbers with no currency symbol anywhere are more likely times or ages
        if (currency == null) {
            return price;
        }

        price.setMin(Collections.min(amounts));
        price.setMax(Collections.max(amounts));
        price.setCurrency(currency);
        return price;
    }
}
