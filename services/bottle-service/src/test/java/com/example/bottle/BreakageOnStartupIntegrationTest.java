package com.example.bottle;

import com.example.bottle.domain.ContainerSize;
import com.example.bottle.domain.FlaggedBreakage;
import com.example.bottle.domain.NewBottle;
import com.example.bottle.listener.ActivityEntry;
import com.example.bottle.listener.InventoryActivityListener;
import com.example.bottle.service.BottleInventoryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "bottle.breakage-flagged-on-startup=true")
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class BreakageOnStartupIntegrationTest {

    @Autowired
    private BottleInventoryService inventoryService;

    @Autowired
    private InventoryActivityListener activityListener;

    @Test
    @DisplayName("Should flag breakage on startup and record the flag in the activity trail")
    void shouldRecordStartupFlagInActivityTrail() {
        // Then
        assertThat(inventoryService.isBreakageFlagged()).isTrue();
        assertThat(activityListener.recentActivity())
                .extracting(ActivityEntry::getEventType)
                .containsExactly("BreakageFlaggedEvent");
    }

    @Test
    @DisplayName("Should record the first add after startup as breakage")
    void shouldRecordFirstAddAsBreakage() {
        // When
        inventoryService.add(NewBottle.builder()
                .style("IPA")
                .name("Example IPA")
                .strengthPercent(6.5)
                .size(ContainerSize.millilitres(355))
                .quantity(24)
                .barcode(123456L)
                .build());

        // Then
        assertThat(inventoryService.listFlaggedBreakage()).containsExactly(new FlaggedBreakage("Example IPA", 24));
        assertThat(activityListener.recentActivity())
                .extracting(ActivityEntry::getEventType)
                .containsExactly("BreakageFlaggedEvent", "BottleAddedEvent", "BreakageRecordedEvent");
    }
}
