package com.agentrelay.dispatch.api;

import com.agentrelay.workers.WorkerDirectory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes the supervisor's capability card for agent discovery.
 */
@RestController
public class AgentCardController {

    private final WorkerDirectory directory;

    public AgentCardController(WorkerDirectory directory) {
        this.directory = directory;
    }

    @GetMapping("/.well-known/agent.json")
    public ResponseEntity<Map<String, Object>> agentCard() {
        Map<String, Object> card = new LinkedHashMap<>();
        card.put("name", "AgentRelay Supervisor");
        card.put("description", "Supervisor that fans prompts out to farm, logistics and news scraper "
                + "workers, retries failed tasks and aggregates their replies.");
        card.put("version", "0.1.0");
        card.put("capabilities", Map.of("streaming", true));
        card.put("defaultInputModes", List.of("text"));
        card.put("defaultOutputModes", List.of("text"));
        card.put("skills", skills());
        return ResponseEntity.ok(card);
    }

    private List<Map<String, Object>> skills() {
        List<Map<String, Object>> skills = new ArrayList<>();
        if (!directory.workers(WorkerDirectory.FARM).isEmpty()) {
            skills.add(skill("farm_inventory", "Coffee farm inventory and orders",
                    "Queries one farm or broadcasts to all farms; places orders with a single farm.",
                    directory.workers(WorkerDirectory.FARM),
                    List.of("How much coffee does the Colombia farm have?",
                            "Show total inventory across all farms",
                            "Create an order with price 2.5 and quantity 500 from the Brazil farm")));
        }
        if (!directory.workers(WorkerDirectory.LOGISTICS).isEmpty()) {
            skills.add(skill("logistics_order", "Order shipment lifecycle",
                    "Walks an order through intake, handover, customs, payment and delivery.",
                    directory.workers(WorkerDirectory.LOGISTICS),
                    List.of("Ship an order of 100 lbs to the Tatooine market")));
        }
        if (!directory.workers(WorkerDirectory.SCRAPER).isEmpty()) {
            skills.add(skill("news_digest", "Community news digest",
                    "Scrapes each URL in the prompt and merges the summaries into one report.",
                    directory.workers(WorkerDirectory.SCRAPER),
                    List.of("Scrape and summarize: https://example.com/m/technology")));
        }
        return skills;
    }

    private static Map<String, Object> skill(String id, String name, String description, List<String> workers,
                                             List<String> examples) {
        Map<String, Object> skill = new LinkedHashMap<>();
        skill.put("id", id);
        skill.put("name", name);
        skill.put("description", description);
        skill.put("workers", workers);
        skill.put("examples", examples);
        return skill;
    }
}
