package com.example.bottle.demo;

import com.example.bottle.domain.ContainerSize;
import com.example.bottle.domain.NewBottle;
import com.example.bottle.report.InventoryReportFormatter;
import com.example.bottle.service.BottleInventoryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Walks through a short scripted session on startup: flags breakage, stocks two beers and
 * logs the resulting reports.
 */
@Component
@ConditionalOnProperty(prefix = "bottle.demo", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DemoScenarioRunner implements CommandLineRunner {

    private final BottleInventoryService inventoryService;
    private final InventoryReportFormatter reportFormatter;

    @Override
    public void run(String... args) {
        log.info("Running bottle inventory demo scenario");

        inventoryService.flagBreakage();

        inventoryService.add(NewBottle.builder()
                .style("IPA")
                .name("Example IPA")
                .strengthPercent(6.5)
                .size(ContainerSize.millilitres(355))
                .quantity(24)
                .barcode(123456L)
                .build());

        inventoryService.add(NewBottle.builder()
                .style("Stout")
                .name("Sample Stout")
                .strengthPercent(7.0)
                .size(ContainerSize.fluidOunces(12))
                .quantity(12)
                .barcode(789012L)
                .build());

        print(reportFormatter.itemLines(inventoryService.listItems()));
        print(reportFormatter.flaggedBreakageLines(inventoryService.listFlaggedBreakage()));
        print(reportFormatter.countLines(inventoryService.countsByType()));
        log.info("{}", reportFormatter.totalLine(inventoryService.totalCount()));
    }

    private void print(List<String> lines) {
        lines.forEach(line -> log.info("{}", line));
    }
}
