package com.agentrelay.core.aggregate;

import com.agentrelay.core.model.TaskResult;
import com.agentrelay.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MergerTest {

    private final ReplyParser parser = new ReplyParser();

    private static TaskResult ok(String worker, String payload, String result) {
        return new TaskResult("R/" + worker, worker, payload, TaskStatus.SUCCEEDED, 1, result, null, null, null);
    }

    @Test
    @DisplayName("farm merger omits the total when units differ")
    void farmMixedUnits() {
        String merged = new FarmInventoryMerger(parser).merge(List.of(
                ok("brazil", "q", "7500 lbs"), ok("colombia", "q", "20 bags")));
        assertEquals("brazil : 7500 lbs\ncolombia : 20 bags", merged);
    }

    @Test
    @DisplayName("logistics timeline sorts by lifecycle step regardless of arrival order")
    void logisticsOrder() {
        String merged = new LogisticsTimelineMerger(parser).merge(List.of(
                ok("shipper", "q", "DELIVERED | Shipper -> Supervisor: Order X1 delivered"),
                ok("tatooine", "q", "RECEIVED_ORDER | Tatooine Farm -> Supervisor: Order X1 intake"),
                ok("accountant", "q", "PAYMENT_COMPLETE | Accountant -> Supervisor: Payment confirmed on order X1")));
        assertEquals("""
                Order X1 timeline:
                1. RECEIVED_ORDER | Tatooine Farm -> Supervisor: Order X1 intake
                2. PAYMENT_COMPLETE | Accountant -> Supervisor: Payment confirmed on order X1
                3. DELIVERED | Shipper -> Supervisor: Order X1 delivered""", merged);
    }

    @Test
    @DisplayName("news digest counts communities and names failures by URL")
    void newsDigest() {
        var merger = new NewsDigestMerger();
        String merged = merger.merge(List.of(
                ok("scraper-1", "scrape https://a.example/m/tech", "Tech summary."),
                ok("scraper-2", "scrape https://b.example/m/art", "Art summary.")));

        assertTrue(merged.startsWith("# Community News Aggregated Report"));
        assertTrue(merged.contains("Communities Analyzed: 2"));
        assertTrue(merged.contains("## https://a.example/m/tech\n\nTech summary."));
        assertEquals("https://c.example/x", merger.describe(ok("scraper-1", "scrape https://c.example/x", null)));
        assertEquals("Failed URLs:", merger.failureHeading());
    }
}
