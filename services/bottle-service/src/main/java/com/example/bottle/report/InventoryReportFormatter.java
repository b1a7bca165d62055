package com.example.bottle.report;

import com.example.bottle.config.BottleProperties;
import com.example.bottle.domain.BottleItem;
import com.example.bottle.domain.FlaggedBreakage;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders inventory data as the lines shown to the person at the console.
 */
@Component
public class InventoryReportFormatter {

    static final String SEPARATOR = "-----------------------";

    private static final MathContext STRENGTH_PRECISION = new MathContext(6);

    private final DateTimeFormatter timestampFormatter;

    public InventoryReportFormatter(BottleProperties properties) {
        BottleProperties.Report report = properties.getReport();
        this.timestampFormatter = DateTimeFormatter.ofPattern(report.getTimestampPattern())
                .withZone(ZoneId.of(report.getZone()));
    }

    public List<String> itemLines(List<BottleItem> items) {
        List<String> lines = new ArrayList<>();
        lines.add("List of added beers:");
        for (BottleItem item : items) {
            lines.add("Name: " + item.getName());
            lines.add("Style: " + item.getStyle());
            lines.add("Alcohol Content: " + formatStrength(item.getStrengthPercent()) + "%");
            lines.add("Container Size: " + (item.getSize() != null ? item.getSize().sizeWithUnits() : "unknown"));
            lines.add("Quantity: " + item.getQuantity() + " bottles");
            lines.add("Barcode: " + (item.getBarcode() != null ? item.getBarcode().getValue() : "none"));
            lines.add("Updated Date: " + (item.getLastUpdated() != null ? timestampFormatter.format(item.getLastUpdated()) : ""));
            lines.add(SEPARATOR);
        }
        return lines;
    }

    public List<String> flaggedBreakageLines(List<FlaggedBreakage> flagged) {
        if (flagged.isEmpty()) {
            return List.of("No beers flagged for breakage.");
        }
        List<String> lines = new ArrayList<>();
        lines.add("List of flagged beers for breakage:");
        for (FlaggedBreakage entry : flagged) {
            lines.add("Name: " + entry.getName());
            lines.add("Quantity: " + entry.getQuantity() + " bottles");
            lines.add(SEPARATOR);
        }
        return lines;
    }

    public List<String> countLines(Map<String, Integer> countsByType) {
        List<String> lines = new ArrayList<>();
        lines.add("Total counts of each beer type:");
        countsByType.forEach((name, count) -> lines.add(name + ": " + count + " bottles"));
        return lines;
    }

    public String totalLine(int total) {
        return "Total beer count in stock: " + total + " bottles.";
    }

    // six significant digits, no trailing zeros: 7.0 prints as "7", 4.123456 as "4.12346"
    private static String formatStrength(double strengthPercent) {
        return BigDecimal.valueOf(strengthPercent)
                .round(STRENGTH_PRECISION)
                .stripTrailingZeros()
                .toPlainString();
    }
}
