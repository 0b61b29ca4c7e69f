package com.agentrelay.core.routing;

import com.agentrelay.core.model.AggregationPolicy;
import com.agentrelay.core.model.TaskTarget;
import com.agentrelay.workers.WorkerDirectory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Routes coffee exchange prompts to farm workers.
 * <ul>
 *   <li>Exactly one farm named and no "all" → unicast.</li>
 *   <li>Several farms named → broadcast to those farms.</li>
 *   <li>"all" or no farm named → broadcast to every farm.</li>
 *   <li>Order creation and order lookups require exactly one farm and never tolerate failure.</li>
 * </ul>
 */
public class FarmRequestDecomposer implements RequestDecomposer {

    public static final String BROADCAST_GROUP = "farm_broadcast";

    private static final Pattern KEYWORDS = Pattern.compile(
            "\\b(farms?|coffee|yields?|inventory|harvest|supply|order)\\b");
    private static final Pattern ALL = Pattern.compile("\\b(all|every|each|total|across)\\b");
    private static final Pattern PRICE = Pattern.compile("price\\s+(?:of\\s+)?\\$?(-?[0-9]+(?:\\.[0-9]+)?)");
    private static final Pattern QUANTITY = Pattern.compile("quantity\\s+(?:of\\s+)?(-?[0-9]+)");
    private static final Pattern ORDER_LOOKUP = Pattern.compile("order\\s+id\\s+([A-Za-z0-9\\-]+)",
            Pattern.CASE_INSENSITIVE);

    private final WorkerDirectory directory;

    public FarmRequestDecomposer(WorkerDirectory directory) {
        this.directory = directory;
    }

    @Override
    public Decomposition decompose(SupervisorRequest request) {
        String prompt = request.prompt().trim();
        String lower = prompt.toLowerCase(Locale.ROOT);
        List<String> farms = directory.workers(WorkerDirectory.FARM);
        List<String> named = farms.stream()
                .filter(f -> Pattern.compile("\\b" + Pattern.quote(f) + "\\b").matcher(lower).find())
                .toList();

        if (named.isEmpty() && !KEYWORDS.matcher(lower).find()) {
            return Decomposition.unmatched();
        }

        Matcher lookup = ORDER_LOOKUP.matcher(prompt);
        if (lookup.find()) {
            if (named.size() != 1) {
                return Decomposition.rejected(WorkerDirectory.FARM, "Please name the farm that holds the order.");
            }
            return Decomposition.unicast(WorkerDirectory.FARM, AggregationPolicy.REQUIRE_ALL,
                    new TaskSpec(TaskTarget.unicast(named.get(0)), "Get details for order ID " + lookup.group(1)));
        }

        if (lower.contains("order") && (lower.contains("price") || lower.contains("quantity"))) {
            return orderCreation(lower, named);
        }

        if (named.size() == 1 && !ALL.matcher(lower).find()) {
            return Decomposition.unicast(WorkerDirectory.FARM, AggregationPolicy.TOLERATE_PARTIAL,
                    new TaskSpec(TaskTarget.unicast(named.get(0)), prompt));
        }

        List<String> recipients = named.size() > 1 ? named : farms;
        if (recipients.isEmpty()) {
            return Decomposition.rejected(WorkerDirectory.FARM, "No farms are configured.");
        }
        List<TaskSpec> tasks = recipients.stream()
                .map(farm -> new TaskSpec(TaskTarget.broadcast(BROADCAST_GROUP, farm, recipients), prompt))
                .toList();
        return Decomposition.broadcast(WorkerDirectory.FARM, AggregationPolicy.TOLERATE_PARTIAL, tasks);
    }

    private Decomposition orderCreation(String lower, List<String> named) {
        if (named.size() != 1) {
            return Decomposition.rejected(WorkerDirectory.FARM,
                    "Please specify exactly one farm to place the order with.");
        }
        Matcher price = PRICE.matcher(lower);
        Matcher quantity = QUANTITY.matcher(lower);
        if (!price.find() || !quantity.find()) {
            return Decomposition.rejected(WorkerDirectory.FARM, "Please provide both a price and a quantity.");
        }
        BigDecimal p = new BigDecimal(price.group(1));
        BigDecimal q = new BigDecimal(quantity.group(1));
        if (p.signum() <= 0 || q.signum() <= 0) {
            return Decomposition.rejected(WorkerDirectory.FARM, "Price and quantity must be greater than zero.");
        }
        String payload = "Create an order with price " + p.stripTrailingZeros().toPlainString()
                + " and quantity " + q.toPlainString();
        return Decomposition.unicast(WorkerDirectory.FARM, AggregationPolicy.REQUIRE_ALL,
                new TaskSpec(TaskTarget.unicast(named.get(0)), payload));
    }
}
