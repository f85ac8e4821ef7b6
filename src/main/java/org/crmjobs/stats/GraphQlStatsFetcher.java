package org.crmjobs.stats;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * Computes CRM stats from the GraphQL customers and orders lists:
 * counts are list sizes, revenue is the BigDecimal sum of order totals (null totals count as zero).
 */
public class GraphQlStatsFetcher implements StatsFetcher {

    static final String STATS_QUERY = """
            query GetCRMStats {
              customers { id }
              orders { id totalAmount }
            }
            """;

    private final GraphQlClient client;

    public GraphQlStatsFetcher(GraphQlClient client) {
        this.client = client;
    }

    @Override
    public CrmStats getStats() throws FetchException {
        JsonNode data = client.execute(STATS_QUERY);
        JsonNode customers = requireList(data, "customers");
        JsonNode orders = requireList(data, "orders");

        BigDecimal revenue = BigDecimal.ZERO;
        for (JsonNode order : orders) {
            revenue = revenue.add(amountOf(order));
        }
        return new CrmStats(customers.size(), orders.size(), revenue);
    }

    private static JsonNode requireList(JsonNode data, String field) throws FetchException {
        JsonNode node = data.get(field);
        if (node == null || !node.isArray()) {
            throw new FetchException("Malformed GraphQL response: '" + field + "' is not a list");
        }
        return node;
    }

    private static BigDecimal amountOf(JsonNode order) throws FetchException {
        JsonNode amount = order.get("totalAmount");
        if (amount == null || amount.isNull()) {
            return BigDecimal.ZERO;
        }
        if (amount.isNumber()) {
            return amount.decimalValue();
        }
        if (amount.isTextual()) {
            String text = amount.asText().trim();
            if (text.isEmpty()) {
                return BigDecimal.ZERO;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new FetchException("Malformed GraphQL response: totalAmount '" + text
                        + "' of order " + order.path("id").asText() + " is not a number", e);
            }
        }
        throw new FetchException("Malformed GraphQL response: unexpected totalAmount " + amount
                + " on order " + order.path("id").asText());
    }
}
